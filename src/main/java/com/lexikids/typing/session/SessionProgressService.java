package com.lexikids.typing.session;

import com.lexikids.typing.analysis.AnalysisModels.AnalysisResult;
import com.lexikids.typing.analysis.AnalysisModels.CachedAnalysis;
import com.lexikids.typing.analysis.PerformanceAnalyzer;
import com.lexikids.typing.config.TypingProperties;
import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.repository.ChildJdbcRepository;
import com.lexikids.typing.repository.SessionActivityJdbcRepository;
import com.lexikids.typing.repository.SessionJdbcRepository;
import com.lexikids.typing.session.SessionModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns every mutation of a child's sessions. Typing results follow a read-append-recompute-write
 * cycle: the cached analysis is always rebuilt from the full attempt list, never patched.
 * There is no optimistic locking, so two concurrent saves on one session may overwrite each
 * other's cached analysis.
 */
@Service
public class SessionProgressService {
    private static final Logger log = LoggerFactory.getLogger(SessionProgressService.class);

    private final ChildJdbcRepository childRepository;
    private final SessionJdbcRepository sessionRepository;
    private final SessionActivityJdbcRepository activityRepository;
    private final PerformanceAnalyzer analyzer;
    private final TypingProperties properties;
    private final Clock clock;

    public SessionProgressService(ChildJdbcRepository childRepository,
                                  SessionJdbcRepository sessionRepository,
                                  SessionActivityJdbcRepository activityRepository,
                                  PerformanceAnalyzer analyzer,
                                  TypingProperties properties,
                                  Clock clock) {
        this.childRepository = childRepository;
        this.sessionRepository = sessionRepository;
        this.activityRepository = activityRepository;
        this.analyzer = analyzer;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public SessionStart startSession(String therapistCode, String username) {
        requireFields(therapistCode, username);
        Child child = childRepository.findChild(therapistCode, username)
                .orElseThrow(() -> new NotFoundException("Child not found under this therapist"));

        String sessionId = generateSessionId();
        sessionRepository.insertSession(new SessionHeader(sessionId, therapistCode, username, clock.instant(),
                List.copyOf(child.currentAssignedThemes()), child.preferredGame(), child.preferredStory()));
        log.info("Started session {} for child {} of therapist {}", sessionId, username, therapistCode);
        return new SessionStart(sessionId, username, child.currentAssignedThemes(), child.preferredStory());
    }

    public Session session(SessionKey key) {
        return assemble(requireSession(key));
    }

    public List<Session> sessions(String therapistCode, String username) {
        requireFields(therapistCode, username);
        childRepository.findChild(therapistCode, username)
                .orElseThrow(() -> new NotFoundException("Therapist or child not found"));
        return sessionRepository.listSessions(therapistCode, username).stream().map(this::assemble).toList();
    }

    @Transactional
    public SaveResult saveTypingResults(SessionKey key, List<Attempt> results) {
        if (results == null) throw new InvalidRequestException("Missing fields");
        SessionHeader session = requireSession(key);
        if (properties.session().enforcePreferredGame()
                && session.preferredGame() != null && !GameTypes.TYPING.equals(session.preferredGame())) {
            log.warn("Rejected typing results for session {} assigned to {}", key.sessionId(), session.preferredGame());
            throw new InvalidRequestException("Typing results not allowed for this session (preferred game mismatch)");
        }

        Instant now = clock.instant();
        List<Attempt> stamped = results.stream().filter(Objects::nonNull).map(a -> a.completedAt(now)).toList();
        sessionRepository.appendAttempts(key.sessionId(), stamped);
        stamped.forEach(a -> sessionRepository.putLatestInput(key.sessionId(), a.word(), a.input()));

        CachedAnalysis cached = recompute(key.sessionId());
        AnalysisResult analysis = cached.analysis();
        log.info("Saved {} typing results for session {}: {} words, {}% accuracy, emotional state {}",
                stamped.size(), key.sessionId(), cached.totalWords(), analysis.overallAccuracy(), analysis.emotionalState().key());
        return new SaveResult(key.sessionId(), cached.totalWords(), analysis);
    }

    @Transactional
    public CachedAnalysis analyzeSession(SessionKey key) {
        requireSession(key);
        if (sessionRepository.loadAttempts(key.sessionId()).isEmpty()) {
            throw new InvalidRequestException("No typing results to analyze");
        }
        CachedAnalysis cached = recompute(key.sessionId());
        log.info("Analysis recomputed for session {}: emotional state {}, problem letters {}",
                key.sessionId(), cached.analysis().emotionalState().key(), cached.analysis().problematicLetters());
        return cached;
    }

    public String trackThemeChange(SessionKey key, String theme) {
        requireFields(theme);
        requireSession(key);
        activityRepository.appendThemeChange(key.sessionId(), theme);
        return theme;
    }

    public void trackEmotion(SessionKey key, String emotion) {
        requireFields(emotion);
        requireSession(key);
        activityRepository.appendEmotion(key.sessionId(), emotion);
    }

    public void recordPuzzle(SessionKey key, String theme, int level, String puzzleId, List<String> emotionsDuring) {
        requireFields(theme, puzzleId);
        if (level <= 0) throw new InvalidRequestException("Missing required fields");
        requireSession(key);
        activityRepository.appendPuzzle(key.sessionId(), new PuzzleCompletion(theme, level, puzzleId, clock.instant(),
                emotionsDuring == null ? List.of() : List.copyOf(emotionsDuring)));
    }

    public void recordEmotionReading(SessionKey key, String emotion) {
        requireFields(emotion);
        requireSession(key);
        activityRepository.appendEmotionReading(key.sessionId(), emotion);
    }

    /**
     * Most frequent buffered label of this session (ties go to the label seen first), then clears
     * the buffer for the next puzzle.
     */
    @Transactional
    public String drainDominantEmotion(SessionKey key) {
        requireSession(key);
        List<String> readings = activityRepository.loadEmotionReadings(key.sessionId());
        if (readings.isEmpty()) {
            throw new NotFoundException("No emotions recorded for this puzzle yet");
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        readings.forEach(e -> counts.merge(e, 1, Integer::sum));
        String dominant = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                dominant = entry.getKey();
                best = entry.getValue();
            }
        }
        activityRepository.clearEmotionReadings(key.sessionId());
        return dominant;
    }

    @Transactional
    public void saveTracing(SessionKey key, String letter, String imageData) {
        requireFields(letter, imageData);
        SessionHeader session = requireSession(key);
        if (session.preferredGame() == null) {
            sessionRepository.updatePreferredGame(key.sessionId(), GameTypes.TRACING);
        }
        activityRepository.appendTracing(key.sessionId(), new TracingAttempt(letter, imageData, clock.instant()));
    }

    public List<TracingAttempt> tracingResults(SessionKey key) {
        requireSession(key);
        return activityRepository.loadTracings(key.sessionId());
    }

    public void recordReading(SessionKey key, String storyTitle, String audioRef) {
        requireFields(storyTitle, audioRef);
        requireSession(key);
        activityRepository.appendRecording(key.sessionId(), new Recording(storyTitle, audioRef, clock.instant()));
    }

    public List<String> completeGame(String therapistCode, String username, String game) {
        requireFields(therapistCode, username, game);
        if (!GameTypes.SUPPORTED.contains(game)) {
            throw new InvalidRequestException("Unknown game: " + game);
        }
        Child child = childRepository.findChild(therapistCode, username)
                .orElseThrow(() -> new NotFoundException("Child not found"));
        List<String> completed = new ArrayList<>(child.completedGames());
        if (!completed.contains(game)) {
            completed.add(game);
            childRepository.updateCompletedGames(therapistCode, username, completed);
        }
        return List.copyOf(completed);
    }

    private CachedAnalysis recompute(String sessionId) {
        List<Attempt> attempts = sessionRepository.loadAttempts(sessionId);
        AnalysisResult analysis = analyzer.analyze(attempts);
        int correct = (int) attempts.stream().filter(Attempt::correct).count();
        CachedAnalysis cached = new CachedAnalysis(analysis, clock.instant(), attempts.size(), correct);
        sessionRepository.saveAnalysis(sessionId, cached);
        return cached;
    }

    private SessionHeader requireSession(SessionKey key) {
        if (key == null) throw new InvalidRequestException("Missing required fields");
        requireFields(key.therapistCode(), key.username(), key.sessionId());
        return sessionRepository.findSession(key)
                .orElseThrow(() -> new NotFoundException("Session not found"));
    }

    private Session assemble(SessionHeader header) {
        String id = header.sessionId();
        return new Session(id, header.therapistCode(), header.username(), header.startedAt(), header.assignedThemes(),
                activityRepository.loadThemeChanges(id),
                activityRepository.loadEmotions(id),
                activityRepository.loadPuzzles(id),
                sessionRepository.loadAttempts(id),
                sessionRepository.loadLatestInputs(id),
                sessionRepository.loadAnalysis(id).orElse(null),
                activityRepository.loadTracings(id),
                activityRepository.loadRecordings(id),
                header.preferredGame(),
                header.preferredStory());
    }

    private String generateSessionId() {
        return Long.toString(clock.millis(), 36)
                + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }

    private static void requireFields(String... values) {
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new InvalidRequestException("Missing required fields");
            }
        }
    }
}

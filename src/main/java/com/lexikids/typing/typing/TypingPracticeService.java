package com.lexikids.typing.typing;

import com.lexikids.typing.analysis.AnalysisModels.AnalysisResult;
import com.lexikids.typing.analysis.PerformanceAnalyzer;
import com.lexikids.typing.difficulty.DifficultyEstimator;
import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.selection.SelectionModels.WordChoice;
import com.lexikids.typing.selection.WordSelector;
import com.lexikids.typing.session.InvalidRequestException;
import com.lexikids.typing.words.DifficultyTier;
import com.lexikids.typing.words.WordBank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class TypingPracticeService {
    private static final Logger log = LoggerFactory.getLogger(TypingPracticeService.class);
    static final int INSIGHT_WINDOW = 3;

    private final WordBank wordBank;
    private final WordSelector wordSelector;
    private final DifficultyEstimator difficultyEstimator;
    private final PerformanceAnalyzer analyzer;

    public TypingPracticeService(WordBank wordBank,
                                 WordSelector wordSelector,
                                 DifficultyEstimator difficultyEstimator,
                                 PerformanceAnalyzer analyzer) {
        this.wordBank = wordBank;
        this.wordSelector = wordSelector;
        this.difficultyEstimator = difficultyEstimator;
        this.analyzer = analyzer;
    }

    public TypingModels.InitialWord initialWord(String sessionId, String username) {
        DifficultyTier tier = DifficultyTier.MEDIUM;
        List<String> words = wordBank.words(tier);
        String word = words.get(ThreadLocalRandom.current().nextInt(words.size()));
        log.info("Initial word '{}' ({}) for {} in session {}", word, tier.key(), username, sessionId);
        return new TypingModels.InitialWord(word, tier, true, "Welcome! Let's start your typing adventure!");
    }

    public TypingModels.NextWord nextWord(String sessionId, String username, List<Attempt> history, DifficultyTier difficultyOverride) {
        if (history == null) throw new InvalidRequestException("Missing required fields");
        List<Attempt> attempts = history.stream().filter(Objects::nonNull).toList();
        List<String> usedWords = attempts.stream().map(a -> a.word().toLowerCase(Locale.ROOT)).toList();

        WordChoice choice = wordSelector.select(attempts, usedWords, difficultyOverride);

        List<Attempt> recent = attempts.subList(Math.max(0, attempts.size() - INSIGHT_WINDOW), attempts.size());
        double recentAccuracy = recent.isEmpty() ? 0.0
                : recent.stream().filter(Attempt::correct).count() * 100.0 / recent.size();

        log.info("Next word '{}' ({}) for {} in session {}, recent accuracy {}%",
                choice.word(), choice.difficulty().key(), username, sessionId, Math.round(recentAccuracy));
        return new TypingModels.NextWord(choice.word(), choice.difficulty(), (int) Math.round(recentAccuracy),
                insight(recentAccuracy), choice.focusLetter());
    }

    public AnalysisResult analyze(List<Attempt> history) {
        return analyzer.analyze(history);
    }

    public TypingModels.RealTimeFeedback realTimeFeedback(List<Attempt> currentResults) {
        if (currentResults == null || currentResults.isEmpty()) {
            throw new InvalidRequestException("No results provided");
        }
        AnalysisResult quick = analyzer.analyze(currentResults);
        return new TypingModels.RealTimeFeedback(
                quick.overallAccuracy(),
                quick.emotionalState(),
                quick.encouragement(),
                quick.emotionalState().needsSupport(),
                difficultyEstimator.estimate(currentResults));
    }

    public TypingModels.WordLists wordLists() {
        Map<String, List<String>> tiers = new LinkedHashMap<>();
        wordBank.tiers().forEach((tier, words) -> tiers.put(tier.key(), words));
        return new TypingModels.WordLists(tiers, wordBank.size());
    }

    private String insight(double recentAccuracy) {
        if (recentAccuracy < 60) return "Selected easier word to build confidence";
        if (recentAccuracy > 85) return "Selected challenging word to advance skills";
        return "Selected balanced word for steady progress";
    }
}

package com.lexikids.typing.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexikids.typing.analysis.AnalysisModels;
import com.lexikids.typing.progress.ProgressModels;
import com.lexikids.typing.progress.ProgressReportService;
import com.lexikids.typing.session.SessionModels;
import com.lexikids.typing.session.SessionProgressService;
import com.lexikids.typing.typing.TypingModels;
import com.lexikids.typing.typing.TypingPracticeService;
import com.lexikids.typing.words.DifficultyTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/typing")
public class TypingController {
    private final TypingPracticeService typingService;
    private final SessionProgressService sessionService;
    private final ProgressReportService progressService;
    private final ObjectMapper objectMapper;

    public TypingController(TypingPracticeService typingService,
                            SessionProgressService sessionService,
                            ProgressReportService progressService,
                            ObjectMapper objectMapper) {
        this.typingService = typingService;
        this.sessionService = sessionService;
        this.progressService = progressService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/initial-word")
    public ResponseEntity<TypingModels.InitialWord> initialWord(@Valid @RequestBody SessionRequest request) {
        return ResponseEntity.ok(typingService.initialWord(request.sessionId(), request.username()));
    }

    @PostMapping("/next-word")
    public ResponseEntity<TypingModels.NextWord> nextWord(@Valid @RequestBody NextWordRequest request) {
        return ResponseEntity.ok(typingService.nextWord(request.sessionId(), request.username(),
                ApiModels.toAttempts(request.typingHistory()), DifficultyTier.fromKey(request.difficultyLevel())));
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisModels.AnalysisResult> analyze(@RequestBody HistoryRequest request) {
        return ResponseEntity.ok(typingService.analyze(ApiModels.toAttemptsLenient(request.typingHistory(), objectMapper)));
    }

    @PostMapping("/analyze-session")
    public ResponseEntity<AnalysisModels.CachedAnalysis> analyzeSession(@Valid @RequestBody SessionRequest request) {
        return ResponseEntity.ok(sessionService.analyzeSession(request.key()));
    }

    @PostMapping("/results")
    public ResponseEntity<SessionModels.SaveResult> saveResults(@Valid @RequestBody SaveResultsRequest request) {
        return ResponseEntity.ok(sessionService.saveTypingResults(
                new SessionModels.SessionKey(request.therapistCode(), request.username(), request.sessionId()),
                ApiModels.toAttempts(request.results())));
    }

    @PostMapping("/real-time-feedback")
    public ResponseEntity<TypingModels.RealTimeFeedback> realTimeFeedback(@RequestBody FeedbackRequest request) {
        return ResponseEntity.ok(typingService.realTimeFeedback(ApiModels.toAttempts(request.currentResults())));
    }

    @GetMapping("/child-analysis")
    public ResponseEntity<ProgressModels.ChildProgressReport> childAnalysis(@RequestParam String therapistCode,
                                                                           @RequestParam String username) {
        return ResponseEntity.ok(progressService.childReport(therapistCode, username));
    }

    @GetMapping("/words")
    public ResponseEntity<TypingModels.WordLists> words() {
        return ResponseEntity.ok(typingService.wordLists());
    }

    public record SessionRequest(@NotBlank String sessionId, @NotBlank String username, @NotBlank String therapistCode) {
        SessionModels.SessionKey key() {
            return new SessionModels.SessionKey(therapistCode, username, sessionId);
        }
    }

    public record NextWordRequest(@NotBlank String sessionId,
                                  @NotBlank String username,
                                  @NotBlank String therapistCode,
                                  @NotNull List<ApiModels.AttemptIn> typingHistory,
                                  String difficultyLevel) {}

    public record HistoryRequest(JsonNode typingHistory) {}

    public record SaveResultsRequest(@NotBlank String therapistCode,
                                     @NotBlank String username,
                                     @NotBlank String sessionId,
                                     @NotNull List<ApiModels.AttemptIn> results) {}

    public record FeedbackRequest(List<ApiModels.AttemptIn> currentResults) {}
}

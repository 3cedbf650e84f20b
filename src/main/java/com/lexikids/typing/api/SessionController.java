package com.lexikids.typing.api;

import com.lexikids.typing.session.SessionModels;
import com.lexikids.typing.session.SessionModels.SessionKey;
import com.lexikids.typing.session.SessionProgressService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final SessionProgressService sessionService;

    public SessionController(SessionProgressService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping("/start")
    public ResponseEntity<SessionModels.SessionStart> start(@Valid @RequestBody ChildRequest request) {
        return ResponseEntity.ok(sessionService.startSession(request.therapistCode(), request.username()));
    }

    @GetMapping
    public ResponseEntity<List<SessionModels.Session>> sessions(@RequestParam String therapistCode,
                                                                @RequestParam String username) {
        return ResponseEntity.ok(sessionService.sessions(therapistCode, username));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionModels.Session> session(@PathVariable String sessionId,
                                                         @RequestParam String therapistCode,
                                                         @RequestParam String username) {
        return ResponseEntity.ok(sessionService.session(new SessionKey(therapistCode, username, sessionId)));
    }

    @PostMapping("/{sessionId}/themes")
    public ResponseEntity<ThemeResponse> trackTheme(@PathVariable String sessionId, @Valid @RequestBody ThemeRequest request) {
        String current = sessionService.trackThemeChange(request.key(sessionId), request.theme());
        return ResponseEntity.ok(new ThemeResponse(current));
    }

    @PostMapping("/{sessionId}/emotions")
    public ResponseEntity<Void> trackEmotion(@PathVariable String sessionId, @Valid @RequestBody EmotionRequest request) {
        sessionService.trackEmotion(request.key(sessionId), request.emotion());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/emotion-readings")
    public ResponseEntity<Void> recordEmotionReading(@PathVariable String sessionId, @Valid @RequestBody EmotionRequest request) {
        sessionService.recordEmotionReading(request.key(sessionId), request.emotion());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/emotion-readings/dominant")
    public ResponseEntity<EmotionResponse> dominantEmotion(@PathVariable String sessionId, @Valid @RequestBody ChildRequest request) {
        SessionKey key = new SessionKey(request.therapistCode(), request.username(), sessionId);
        return ResponseEntity.ok(new EmotionResponse(sessionService.drainDominantEmotion(key)));
    }

    @PostMapping("/{sessionId}/puzzles")
    public ResponseEntity<Void> recordPuzzle(@PathVariable String sessionId, @Valid @RequestBody PuzzleRequest request) {
        sessionService.recordPuzzle(new SessionKey(request.therapistCode(), request.username(), sessionId),
                request.theme(), request.level(), request.puzzleId(), request.emotionsDuring());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/tracing")
    public ResponseEntity<Void> saveTracing(@PathVariable String sessionId, @Valid @RequestBody TracingRequest request) {
        sessionService.saveTracing(new SessionKey(request.therapistCode(), request.username(), sessionId),
                request.letter(), request.imageData());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/tracing")
    public ResponseEntity<List<SessionModels.TracingAttempt>> tracingResults(@PathVariable String sessionId,
                                                                             @RequestParam String therapistCode,
                                                                             @RequestParam String username) {
        return ResponseEntity.ok(sessionService.tracingResults(new SessionKey(therapistCode, username, sessionId)));
    }

    @PostMapping("/{sessionId}/recordings")
    public ResponseEntity<Void> recordReading(@PathVariable String sessionId, @Valid @RequestBody RecordingRequest request) {
        sessionService.recordReading(new SessionKey(request.therapistCode(), request.username(), sessionId),
                request.storyTitle(), request.audioRef());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/completed-games")
    public ResponseEntity<List<String>> completeGame(@Valid @RequestBody GameRequest request) {
        return ResponseEntity.ok(sessionService.completeGame(request.therapistCode(), request.username(), request.game()));
    }

    public record ChildRequest(@NotBlank String therapistCode, @NotBlank String username) {}

    public record ThemeRequest(@NotBlank String therapistCode, @NotBlank String username, @NotBlank String theme) {
        SessionKey key(String sessionId) {
            return new SessionKey(therapistCode, username, sessionId);
        }
    }

    public record EmotionRequest(@NotBlank String therapistCode, @NotBlank String username, @NotBlank String emotion) {
        SessionKey key(String sessionId) {
            return new SessionKey(therapistCode, username, sessionId);
        }
    }

    public record PuzzleRequest(@NotBlank String therapistCode,
                                @NotBlank String username,
                                @NotBlank String theme,
                                @NotNull @Positive Integer level,
                                @NotBlank String puzzleId,
                                List<String> emotionsDuring) {}

    public record TracingRequest(@NotBlank String therapistCode,
                                 @NotBlank String username,
                                 @NotBlank String letter,
                                 @NotBlank String imageData) {}

    public record RecordingRequest(@NotBlank String therapistCode,
                                   @NotBlank String username,
                                   @NotBlank String storyTitle,
                                   @NotBlank String audioRef) {}

    public record GameRequest(@NotBlank String therapistCode, @NotBlank String username, @NotBlank String game) {}

    public record ThemeResponse(String currentTheme) {}

    public record EmotionResponse(String emotion) {}
}

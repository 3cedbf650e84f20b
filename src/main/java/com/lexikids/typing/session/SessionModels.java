package com.lexikids.typing.session;

import com.lexikids.typing.analysis.AnalysisModels.AnalysisResult;
import com.lexikids.typing.analysis.AnalysisModels.CachedAnalysis;
import com.lexikids.typing.domain.DomainModels.Attempt;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class SessionModels {
    public record SessionKey(String therapistCode, String username, String sessionId) {}

    public record Child(String therapistCode,
                        String username,
                        List<String> currentAssignedThemes,
                        List<String> assignedGames,
                        List<String> completedGames,
                        String preferredGame,
                        String preferredStory,
                        Instant joinedAt) {}

    public record Session(String sessionId,
                          String therapistCode,
                          String username,
                          Instant startedAt,
                          List<String> assignedThemes,
                          List<String> themesChanged,
                          List<String> emotionsOfChild,
                          List<PuzzleCompletion> playedPuzzles,
                          List<Attempt> typingResults,
                          Map<String, String> typingResultsMap,
                          CachedAnalysis typingAnalysis,
                          List<TracingAttempt> tracingResults,
                          List<Recording> readingRecordings,
                          String preferredGame,
                          String preferredStory) {}

    public record SessionHeader(String sessionId,
                                String therapistCode,
                                String username,
                                Instant startedAt,
                                List<String> assignedThemes,
                                String preferredGame,
                                String preferredStory) {}

    public record PuzzleCompletion(String theme, int level, String puzzleId, Instant completedAt, List<String> emotionsDuring) {}

    public record TracingAttempt(String letter, String imageData, Instant tracedAt) {}

    public record Recording(String storyTitle, String audioRef, Instant recordedAt) {}

    public record SessionStart(String sessionId, String username, List<String> assignedThemes, String preferredStory) {}

    public record SaveResult(String sessionId, int totalWords, AnalysisResult analysis) {}
}

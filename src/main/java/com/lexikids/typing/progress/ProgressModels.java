package com.lexikids.typing.progress;

import com.lexikids.typing.analysis.AnalysisModels.AnalysisResult;
import com.lexikids.typing.analysis.AnalysisModels.ConfusionPattern;
import com.lexikids.typing.analysis.AnalysisModels.EmotionalState;

import java.time.Instant;
import java.util.List;

public class ProgressModels {
    public record ChildProgressReport(String username,
                                      OverallStats overallStats,
                                      AggregateInsights aggregateInsights,
                                      List<SessionAnalysis> sessionAnalyses,
                                      List<TimelinePoint> progressTimeline,
                                      boolean hasData) {}

    public record OverallStats(int totalWords, int correctWords, double overallAccuracy, int totalSessions) {}

    public record AggregateInsights(List<String> topProblemLetters,
                                    List<String> strengths,
                                    List<ConfusionPattern> confusionPatterns,
                                    List<String> recommendations,
                                    EmotionalState emotionalState,
                                    String encouragement) {}

    public record SessionAnalysis(String sessionId, AnalysisResult analysis, Instant date, boolean cached) {}

    public record TimelinePoint(Instant date, int accuracy, int wordsCompleted) {}
}

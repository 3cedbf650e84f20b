package com.lexikids.typing.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

public class AnalysisModels {
    public record AnalysisResult(int overallAccuracy,
                                 List<String> problematicLetters,
                                 List<String> strengths,
                                 List<ConfusionPattern> confusionPatterns,
                                 Severity severity,
                                 EmotionalState emotionalState,
                                 List<String> recommendations,
                                 String encouragement,
                                 PerformanceMetrics performanceMetrics) {}

    public record ConfusionPattern(String target, String typedAs, int frequency) {}

    public record PerformanceMetrics(long avgTimeSpent,
                                     long totalHesitations,
                                     double avgHesitations,
                                     int recentAccuracy,
                                     boolean improving) {}

    public record CachedAnalysis(AnalysisResult analysis, Instant analyzedAt, int totalWords, int correctWords) {}

    public enum Severity {
        MILD, MODERATE, SEVERE;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Severity fromKey(String key) {
            return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum EmotionalState {
        EXCELLING, CONFIDENT, CHALLENGED, STRUGGLING, FRUSTRATED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static EmotionalState fromKey(String key) {
            return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
        }

        public boolean needsSupport() {
            return this == STRUGGLING || this == FRUSTRATED;
        }
    }
}

package com.lexikids.typing.analysis;

import com.lexikids.typing.analysis.AnalysisModels.*;
import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.domain.LetterAlignment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

@Component
public class PerformanceAnalyzer {
    static final int RECENT_WINDOW = 5;
    static final int TOP_PROBLEM_LETTERS = 5;
    static final int TOP_CONFUSION_PAIRS = 3;
    static final int CONFUSIONS_PER_LETTER = 2;
    static final double FRUSTRATION_HESITATIONS = 2.5;
    static final double FRUSTRATION_TIME_MS = 7000;

    public AnalysisResult analyze(List<Attempt> attempts) {
        return analyze(attempts, ThreadLocalRandom.current());
    }

    public AnalysisResult analyze(List<Attempt> attempts, Random random) {
        List<Attempt> all = attempts == null ? List.of()
                : attempts.stream().filter(Objects::nonNull).toList();
        int total = all.size();
        int correct = (int) all.stream().filter(Attempt::correct).count();
        int overallAccuracy = percent(correct, total);

        LetterStats stats = LetterStats.collect(all);
        List<String> problematicLetters = stats.problematicLetters();
        List<String> strengths = stats.strengths();
        List<ConfusionPattern> confusionPatterns = stats.confusionPatterns();

        double avgTimeSpent = all.stream().mapToInt(Attempt::timeSpentMs).average().orElse(0.0);
        long totalHesitations = all.stream().mapToLong(Attempt::hesitations).sum();
        double avgHesitations = total > 0 ? (double) totalHesitations / total : 0.0;

        List<Attempt> recent = all.subList(Math.max(0, total - RECENT_WINDOW), total);
        double recentAccuracy = recent.isEmpty() ? 0.0
                : recent.stream().filter(Attempt::correct).count() * 100.0 / recent.size();

        Severity severity = severity(overallAccuracy);
        EmotionalState emotionalState = emotionalState(overallAccuracy, avgHesitations, avgTimeSpent);

        List<String> recommendations = recommendations(problematicLetters, confusionPatterns,
                overallAccuracy, avgHesitations, avgTimeSpent);

        PerformanceMetrics metrics = new PerformanceMetrics(
                Math.round(avgTimeSpent),
                totalHesitations,
                new BigDecimal(avgHesitations).setScale(1, RoundingMode.HALF_UP).doubleValue(),
                (int) Math.round(recentAccuracy),
                recentAccuracy > overallAccuracy);

        return new AnalysisResult(overallAccuracy, problematicLetters, strengths, confusionPatterns,
                severity, emotionalState, recommendations, EncouragementMessages.pick(emotionalState, random), metrics);
    }

    static Severity severity(int accuracy) {
        if (accuracy < 60) return Severity.SEVERE;
        if (accuracy < 80) return Severity.MODERATE;
        return Severity.MILD;
    }

    static EmotionalState emotionalState(int accuracy, double avgHesitations, double avgTimeSpent) {
        EmotionalState state = EmotionalState.CONFIDENT;
        if (accuracy < 60) {
            state = EmotionalState.STRUGGLING;
        } else if (accuracy < 80) {
            state = EmotionalState.CHALLENGED;
        } else if (accuracy >= 90) {
            state = EmotionalState.EXCELLING;
        }
        if (avgHesitations > FRUSTRATION_HESITATIONS || avgTimeSpent > FRUSTRATION_TIME_MS) {
            state = EmotionalState.FRUSTRATED;
        }
        return state;
    }

    private List<String> recommendations(List<String> problematicLetters,
                                         List<ConfusionPattern> confusionPatterns,
                                         int accuracy,
                                         double avgHesitations,
                                         double avgTimeSpent) {
        List<String> out = new ArrayList<>();
        if (!problematicLetters.isEmpty()) {
            String top = problematicLetters.stream().limit(TOP_PROBLEM_LETTERS)
                    .collect(Collectors.joining(", ")).toUpperCase(Locale.ROOT);
            out.add("Focus practice on these letters: " + top);
        }
        if (!confusionPatterns.isEmpty()) {
            String pairs = confusionPatterns.stream().limit(TOP_CONFUSION_PAIRS)
                    .map(p -> p.typedAs() + "/" + p.target())
                    .collect(Collectors.joining(", ")).toUpperCase(Locale.ROOT);
            out.add("Work on distinguishing: " + pairs);
        }
        if (avgHesitations > 2) {
            out.add("Use visual letter cards to reduce hesitation");
            out.add("Practice in shorter, more frequent sessions");
        }
        if (accuracy >= 90) {
            out.add("Excellent progress! Ready for more challenging words");
        } else if (accuracy < 70) {
            out.add("Start with simpler 3-letter words for confidence");
            out.add("Use multisensory techniques (trace letters while saying them)");
        }
        if (avgTimeSpent > 7000) {
            out.add("Take time to sound out each letter - no rush!");
        } else if (avgTimeSpent < 3000) {
            out.add("Great speed! Focus on accuracy next");
        }
        return List.copyOf(out);
    }

    private static int percent(long part, long total) {
        return total == 0 ? 0 : (int) Math.round(100.0 * part / total);
    }

    private static final class LetterStats {
        private final Map<String, Integer> ok = new LinkedHashMap<>();
        private final Map<String, Integer> errors = new LinkedHashMap<>();
        private final Map<String, Map<String, Integer>> confusions = new LinkedHashMap<>();

        static LetterStats collect(List<Attempt> attempts) {
            LetterStats stats = new LetterStats();
            for (Attempt attempt : attempts) {
                LetterAlignment.align(attempt.word(), attempt.input(), stats::count);
            }
            return stats;
        }

        private void count(String target, String typed) {
            if (target.isEmpty()) return;
            if (target.equals(typed)) {
                ok.merge(target, 1, Integer::sum);
                return;
            }
            errors.merge(target, 1, Integer::sum);
            if (!typed.isEmpty()) {
                confusions.computeIfAbsent(target, k -> new LinkedHashMap<>()).merge(typed, 1, Integer::sum);
            }
        }

        List<String> problematicLetters() {
            return byCountDescending(errors, errors.keySet());
        }

        List<String> strengths() {
            List<String> eligible = ok.keySet().stream()
                    .filter(l -> ok.get(l) >= errors.getOrDefault(l, 0))
                    .toList();
            return byCountDescending(ok, eligible);
        }

        List<ConfusionPattern> confusionPatterns() {
            List<ConfusionPattern> out = new ArrayList<>();
            confusions.forEach((target, mistakenFor) ->
                    byCountDescending(mistakenFor, mistakenFor.keySet()).stream()
                            .limit(CONFUSIONS_PER_LETTER)
                            .filter(typed -> !typed.equals(target))
                            .forEach(typed -> out.add(new ConfusionPattern(target, typed, mistakenFor.get(typed)))));
            return List.copyOf(out);
        }

        private static List<String> byCountDescending(Map<String, Integer> counts, Collection<String> letters) {
            List<String> sorted = new ArrayList<>(letters);
            sorted.sort(Comparator.comparing((String l) -> counts.getOrDefault(l, 0)).reversed());
            return List.copyOf(sorted);
        }
    }
}

package com.lexikids.typing.difficulty;

import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.words.DifficultyTier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

@Component
public class DifficultyEstimator {
    static final int MIN_HISTORY = 3;
    static final int WINDOW = 5;

    public DifficultyTier estimate(List<Attempt> history) {
        List<Attempt> attempts = history == null ? List.of()
                : history.stream().filter(Objects::nonNull).toList();
        if (attempts.size() < MIN_HISTORY) return DifficultyTier.MEDIUM;

        List<Attempt> window = attempts.subList(Math.max(0, attempts.size() - WINDOW), attempts.size());
        double accuracy = window.stream().filter(Attempt::correct).count() / (double) window.size();
        double avgTime = window.stream().mapToInt(Attempt::timeSpentMs).average().orElse(0.0);
        double avgHesitations = window.stream().mapToInt(Attempt::hesitations).average().orElse(0.0);

        if (accuracy >= 0.8 && avgTime < 5000 && avgHesitations < 2) {
            return DifficultyTier.HARD;
        }
        if (accuracy < 0.5 || avgHesitations > 3 || avgTime > 8000) {
            return DifficultyTier.EASY;
        }
        return DifficultyTier.MEDIUM;
    }
}

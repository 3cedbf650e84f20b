package com.lexikids.typing;

import com.lexikids.typing.difficulty.DifficultyEstimator;
import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.words.DifficultyTier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DifficultyEstimatorTest {
    private final DifficultyEstimator estimator = new DifficultyEstimator();

    @Test
    void shortHistoryIsMedium() {
        assertEquals(DifficultyTier.MEDIUM, estimator.estimate(List.of()));
        assertEquals(DifficultyTier.MEDIUM, estimator.estimate(null));
        assertEquals(DifficultyTier.MEDIUM, estimator.estimate(List.of(
                Attempt.of("cat", "cat", true, 1000, 0),
                Attempt.of("dog", "dog", true, 1000, 0))));
    }

    @Test
    void fastAccurateChildGetsHardWords() {
        assertEquals(DifficultyTier.HARD, estimator.estimate(repeat(Attempt.of("cat", "cat", true, 3000, 1), 3)));
        assertEquals(DifficultyTier.HARD, estimator.estimate(repeat(Attempt.of("cat", "cat", true, 4999, 1), 5)));
    }

    @Test
    void onlyLastFiveAttemptsCount() {
        List<Attempt> history = new ArrayList<>(repeat(Attempt.of("cat", "bat", false, 9000, 5), 5));
        history.addAll(repeat(Attempt.of("dog", "dog", true, 2000, 0), 5));
        assertEquals(DifficultyTier.HARD, estimator.estimate(history));
    }

    @Test
    void struggleSignalsGiveEasyWords() {
        List<Attempt> lowAccuracy = List.of(
                Attempt.of("cat", "cat", true, 2000, 0),
                Attempt.of("cat", "bat", false, 2000, 0),
                Attempt.of("cat", "kat", false, 2000, 0));
        assertEquals(DifficultyTier.EASY, estimator.estimate(lowAccuracy));

        assertEquals(DifficultyTier.EASY, estimator.estimate(repeat(Attempt.of("cat", "cat", true, 2000, 4), 4)));
        assertEquals(DifficultyTier.EASY, estimator.estimate(repeat(Attempt.of("cat", "cat", true, 8001, 0), 4)));
    }

    @Test
    void mixedPerformanceStaysMedium() {
        List<Attempt> history = List.of(
                Attempt.of("cat", "cat", true, 4000, 0),
                Attempt.of("cat", "cat", true, 4000, 0),
                Attempt.of("cat", "cat", true, 4000, 0),
                Attempt.of("cat", "bat", false, 4000, 0),
                Attempt.of("cat", "bat", false, 4000, 0));
        assertEquals(DifficultyTier.MEDIUM, estimator.estimate(history));

        assertEquals(DifficultyTier.MEDIUM, estimator.estimate(repeat(Attempt.of("cat", "cat", true, 6000, 0), 5)));
    }

    @Test
    void missingTimingCountsAsZero() {
        List<Attempt> history = repeat(new Attempt(null, null, true, -10, -1, null), 3);
        assertEquals(DifficultyTier.HARD, estimator.estimate(history));
    }

    private static List<Attempt> repeat(Attempt attempt, int times) {
        return Collections.nCopies(times, attempt);
    }
}

package com.lexikids.typing.domain;

import java.time.Instant;

public class DomainModels {
    /**
     * One recorded word-typing trial. Missing strings become empty, missing or negative
     * counters become zero, so every consumer can read the fields without null checks.
     */
    public record Attempt(String word,
                          String input,
                          boolean correct,
                          int timeSpentMs,
                          int hesitations,
                          Instant completedAt) {
        public Attempt {
            word = word == null ? "" : word;
            input = input == null ? "" : input;
            timeSpentMs = Math.max(timeSpentMs, 0);
            hesitations = Math.max(hesitations, 0);
        }

        public static Attempt of(String word, String input, boolean correct, int timeSpentMs, int hesitations) {
            return new Attempt(word, input, correct, timeSpentMs, hesitations, null);
        }

        public Attempt completedAt(Instant at) {
            return new Attempt(word, input, correct, timeSpentMs, hesitations, at);
        }
    }
}

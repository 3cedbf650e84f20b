package com.lexikids.typing.selection;

import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.domain.LetterAlignment;

import java.util.*;

/**
 * Recency-weighted error score per target letter. Only incorrect attempts are scored;
 * each mismatched position adds 2 when the attempt is one of the last three, 1 otherwise.
 */
public final class LetterErrorScores {
    static final int RECENT_ATTEMPTS = 3;
    static final int RECENT_WEIGHT = 2;

    private final Map<String, Integer> scores;

    private LetterErrorScores(Map<String, Integer> scores) {
        this.scores = Collections.unmodifiableMap(scores);
    }

    public static LetterErrorScores from(List<Attempt> history) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        if (history == null) return new LetterErrorScores(scores);

        int size = history.size();
        for (int index = 0; index < size; index++) {
            Attempt attempt = history.get(index);
            if (attempt == null || attempt.correct()) continue;
            int weight = index >= size - RECENT_ATTEMPTS ? RECENT_WEIGHT : 1;
            LetterAlignment.align(attempt.word(), attempt.input(), (target, typed) -> {
                if (!target.isEmpty() && !target.equals(typed)) {
                    scores.merge(target, weight, Integer::sum);
                }
            });
        }
        return new LetterErrorScores(scores);
    }

    public int score(String letter) {
        return scores.getOrDefault(letter, 0);
    }

    public Map<String, Integer> asMap() {
        return scores;
    }

    /** Letters by descending score; equal scores keep the order they were first mis-typed. */
    public List<String> ranked() {
        List<String> letters = new ArrayList<>(scores.keySet());
        letters.sort(Comparator.comparing((String l) -> scores.get(l)).reversed());
        return letters;
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }
}

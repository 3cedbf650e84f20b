package com.lexikids.typing.selection;

import com.lexikids.typing.difficulty.DifficultyEstimator;
import com.lexikids.typing.domain.DomainModels.Attempt;
import com.lexikids.typing.selection.SelectionModels.CandidatePool;
import com.lexikids.typing.selection.SelectionModels.WordChoice;
import com.lexikids.typing.words.DifficultyTier;
import com.lexikids.typing.words.WordBank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

@Component
public class WordSelector {
    private static final Logger log = LoggerFactory.getLogger(WordSelector.class);
    static final int FOCUS_LETTERS = 3;

    private final WordBank wordBank;
    private final DifficultyEstimator difficultyEstimator;

    public WordSelector(WordBank wordBank, DifficultyEstimator difficultyEstimator) {
        this.wordBank = wordBank;
        this.difficultyEstimator = difficultyEstimator;
    }

    public WordChoice select(List<Attempt> history, Collection<String> usedWords, DifficultyTier requestedDifficulty) {
        return select(history, usedWords, requestedDifficulty, ThreadLocalRandom.current());
    }

    public WordChoice select(List<Attempt> history, Collection<String> usedWords, DifficultyTier requestedDifficulty, Random random) {
        List<Attempt> attempts = history == null ? List.of() : history;
        Set<String> used = usedWords == null ? Set.of() : usedWords.stream()
                .filter(Objects::nonNull)
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        DifficultyTier difficulty = requestedDifficulty != null ? requestedDifficulty : difficultyEstimator.estimate(attempts);

        CandidatePool pool = CandidatePool.TIER;
        List<String> candidates = unused(wordBank.words(difficulty), used);
        if (candidates.isEmpty()) {
            pool = CandidatePool.UNUSED_WORDS;
            candidates = unused(wordBank.allWords(), used);
        }
        if (candidates.isEmpty()) {
            pool = CandidatePool.WHOLE_BANK;
            candidates = wordBank.allWords();
        }

        List<String> focusLetters = LetterErrorScores.from(attempts).ranked();
        for (String letter : focusLetters.subList(0, Math.min(FOCUS_LETTERS, focusLetters.size()))) {
            List<String> subset = candidates.stream().filter(w -> w.contains(letter)).toList();
            if (!subset.isEmpty()) {
                String word = pick(subset, random);
                log.debug("Targeting problem letter '{}' with '{}' ({})", letter, word, difficulty.key());
                return new WordChoice(word, difficulty, letter, pool);
            }
        }
        return new WordChoice(pick(candidates, random), difficulty, null, pool);
    }

    private List<String> unused(List<String> words, Set<String> used) {
        return words.stream().filter(w -> !used.contains(w.toLowerCase(Locale.ROOT))).toList();
    }

    private String pick(List<String> words, Random random) {
        return words.get(random.nextInt(words.size()));
    }
}

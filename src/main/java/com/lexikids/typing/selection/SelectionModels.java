package com.lexikids.typing.selection;

import com.lexikids.typing.words.DifficultyTier;

public class SelectionModels {
    public record WordChoice(String word, DifficultyTier difficulty, String focusLetter, CandidatePool pool) {}

    public enum CandidatePool { TIER, UNUSED_WORDS, WHOLE_BANK }
}

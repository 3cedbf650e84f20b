package com.lexikids.typing.typing;

import com.lexikids.typing.analysis.AnalysisModels.EmotionalState;
import com.lexikids.typing.words.DifficultyTier;

import java.util.List;
import java.util.Map;

public class TypingModels {
    public record InitialWord(String word, DifficultyTier difficulty, boolean initial, String message) {}

    public record NextWord(String word, DifficultyTier difficulty, int recentAccuracy, String insight, String focusLetter) {}

    public record RealTimeFeedback(int accuracy,
                                   EmotionalState emotionalState,
                                   String encouragement,
                                   boolean needsSupport,
                                   DifficultyTier suggestedDifficulty) {}

    public record WordLists(Map<String, List<String>> tiers, int totalWords) {}
}

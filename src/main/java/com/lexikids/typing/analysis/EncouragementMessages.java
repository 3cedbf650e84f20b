package com.lexikids.typing.analysis;

import com.lexikids.typing.analysis.AnalysisModels.EmotionalState;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

final class EncouragementMessages {
    private static final Map<EmotionalState, List<String>> POOLS = new EnumMap<>(EmotionalState.class);

    static {
        POOLS.put(EmotionalState.EXCELLING, List.of(
                "Outstanding work! You're a typing superstar!",
                "Incredible progress! Keep up the amazing effort!",
                "You're mastering these letters beautifully!"));
        POOLS.put(EmotionalState.CONFIDENT, List.of(
                "Great job! You're doing really well!",
                "Nice progress! Keep practicing!",
                "You're on the right track!"));
        POOLS.put(EmotionalState.CHALLENGED, List.of(
                "You're learning and improving every day!",
                "Keep going! Every practice helps!",
                "You're making steady progress!"));
        POOLS.put(EmotionalState.STRUGGLING, List.of(
                "Learning takes time - you're doing great!",
                "Every attempt makes you stronger!",
                "It's okay to find this challenging - keep trying!"));
        POOLS.put(EmotionalState.FRUSTRATED, List.of(
                "Take a break if needed - you're doing your best!",
                "Remember, progress isn't always linear!",
                "You're working hard, and that's what matters!"));
    }

    private EncouragementMessages() {}

    static List<String> pool(EmotionalState state) {
        return POOLS.getOrDefault(state, POOLS.get(EmotionalState.CONFIDENT));
    }

    static String pick(EmotionalState state, Random random) {
        List<String> messages = pool(state);
        return messages.get(random.nextInt(messages.size()));
    }
}

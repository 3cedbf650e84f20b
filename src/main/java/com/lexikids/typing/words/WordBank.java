package com.lexikids.typing.words;

import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class WordBank {
    private static final List<String> EASY = List.of(
            "cat", "dog", "sun", "bed", "leg", "pie", "bee", "sea", "tea", "pea",
            "lip", "lid", "bib", "did", "dad", "bad", "pad", "lad",
            "bat", "pat", "tap", "nap", "pan", "man", "fan", "van", "jam", "yam",
            "sip", "lip", "tip", "dip", "pip", "rip", "zip", "mop", "pop"
    );

    private static final List<String> MEDIUM = List.of(
            "bell", "dell", "pill", "bill", "peel", "deep", "beep", "peep", "pipe", "pale",
            "bale", "bail", "pail", "leap", "deal",
            "was", "saw", "no", "on", "top", "pot", "ten", "net",
            "thin", "chin", "ship", "shop", "cash", "dash", "wish", "fish",
            "mild", "wild", "kind", "mind", "bend", "lend", "send", "tend"
    );

    private static final List<String> HARD = List.of(
            "pedal", "piped", "biped", "belle", "bleed", "bled", "idle", "bide", "pile", "piled",
            "deli", "bead", "lied", "bile",
            "dared", "bread", "brand", "grand", "blend", "trend", "flipped", "dripped",
            "thick", "think", "thank", "chunk", "shrimp", "crash", "flash", "splash",
            "below", "elbow", "window", "yellow", "mirror", "pillow", "shadow", "follow"
    );

    private final Map<DifficultyTier, List<String>> tiers;
    private final List<String> allWords;

    public WordBank() {
        this(Map.of(DifficultyTier.EASY, EASY, DifficultyTier.MEDIUM, MEDIUM, DifficultyTier.HARD, HARD));
    }

    WordBank(Map<DifficultyTier, List<String>> source) {
        Map<DifficultyTier, List<String>> byTier = new EnumMap<>(DifficultyTier.class);
        Set<String> all = new LinkedHashSet<>();
        for (DifficultyTier tier : DifficultyTier.values()) {
            List<String> words = List.copyOf(new LinkedHashSet<>(source.getOrDefault(tier, List.of())));
            byTier.put(tier, words);
            all.addAll(words);
        }
        this.tiers = Collections.unmodifiableMap(byTier);
        this.allWords = List.copyOf(all);
    }

    public List<String> words(DifficultyTier tier) {
        return tiers.getOrDefault(tier == null ? DifficultyTier.MEDIUM : tier, List.of());
    }

    public List<String> allWords() {
        return allWords;
    }

    public Map<DifficultyTier, List<String>> tiers() {
        return tiers;
    }

    public Optional<DifficultyTier> tierOf(String word) {
        if (word == null) return Optional.empty();
        String normalized = word.trim().toLowerCase(Locale.ROOT);
        return tiers.entrySet().stream()
                .filter(e -> e.getValue().contains(normalized))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public int size() {
        return allWords.size();
    }
}

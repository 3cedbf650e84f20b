package com.lexikids.typing.words;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DifficultyTier {
    EASY, MEDIUM, HARD;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DifficultyTier fromKey(String key) {
        if (key == null || key.isBlank()) return null;
        for (DifficultyTier tier : values()) {
            if (tier.key().equalsIgnoreCase(key.trim())) return tier;
        }
        return null;
    }
}

package com.lexikids.typing.domain;

import java.util.Locale;

public final class LetterAlignment {
    public static final String BLANK = "";

    private LetterAlignment() {}

    public static void align(String target, String typed, PositionVisitor visitor) {
        String t = normalize(target);
        String u = normalize(typed);
        int maxLen = Math.max(t.length(), u.length());
        for (int i = 0; i < maxLen; i++) {
            visitor.visit(charAt(t, i), charAt(u, i));
        }
    }

    public static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String charAt(String value, int index) {
        return index < value.length() ? String.valueOf(value.charAt(index)) : BLANK;
    }

    @FunctionalInterface
    public interface PositionVisitor {
        void visit(String targetLetter, String typedLetter);
    }
}

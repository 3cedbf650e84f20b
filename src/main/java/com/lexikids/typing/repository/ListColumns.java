package com.lexikids.typing.repository;

import java.util.Arrays;
import java.util.List;

final class ListColumns {
    private ListColumns() {}

    static String join(List<String> values) {
        if (values == null || values.isEmpty()) return "";
        return String.join(";", values);
    }

    static List<String> split(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}

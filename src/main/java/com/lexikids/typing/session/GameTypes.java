package com.lexikids.typing.session;

import java.util.Set;

public final class GameTypes {
    public static final String TYPING = "typing";
    public static final String PUZZLES = "puzzles";
    public static final String READING = "reading";
    public static final String TRACING = "tracing";

    public static final Set<String> SUPPORTED = Set.of(
            TYPING,
            PUZZLES,
            READING,
            TRACING
    );

    private GameTypes() {}
}

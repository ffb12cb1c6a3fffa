package org.cexpr;

import java.util.Locale;

/**
 * Grammar variant used to parse an expression.
 */
public enum Mode {
    C,
    CPP;

    /**
     * Parses "c" or "cpp" (also "c++"), ignoring case.
     */
    public static Mode of(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "c" -> C;
            case "cpp", "c++" -> CPP;
            default -> throw new IllegalArgumentException("Unknown mode: " + name);
        };
    }
}

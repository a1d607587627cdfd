package com.surrealsimple.core.sql;

/**
 * Helpers for embedding values into statement text.
 */
public final class SurrealLiterals {

    private SurrealLiterals() {
    }

    /**
     * Single-quoted string literal with backslashes and quotes escaped.
     */
    public static String quote(String value) {
        if (value == null) {
            return "NONE";
        }
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '\'') {
                quoted.append('\\');
            }
            quoted.append(c);
        }
        return quoted.append('\'').toString();
    }
}

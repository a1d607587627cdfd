package com.surrealsimple.core.sql;

import java.util.Objects;

/**
 * A single SurrealQL statement that passed the grammar.
 * Holds the canonical text that gets submitted and the text the caller supplied.
 */
public final class Statement {

    private final String text;
    private final String sourceText;

    Statement(String text, String sourceText) {
        this.text = Objects.requireNonNull(text, "text");
        this.sourceText = sourceText;
    }

    /**
     * Canonical form, without the terminating semicolon.
     */
    public String getText() {
        return text;
    }

    public String getSourceText() {
        return sourceText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Statement)) {
            return false;
        }
        return text.equals(((Statement) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}

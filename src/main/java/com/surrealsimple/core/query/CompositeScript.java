package com.surrealsimple.core.query;

import com.surrealsimple.core.sql.Statement;

import java.util.List;
import java.util.Objects;

/**
 * The single transaction script derived from accumulated statements:
 *
 * <pre>
 * BEGIN TRANSACTION;
 * CREATE person:uuid() CONTENT { name: 'a' };
 * SELECT * FROM person;
 * COMMIT TRANSACTION;
 * </pre>
 */
public final class CompositeScript {

    private final String text;
    private final int statementCount;

    private CompositeScript(String text, int statementCount) {
        this.text = text;
        this.statementCount = statementCount;
    }

    static CompositeScript of(List<Statement> statements) {
        StringBuilder script = new StringBuilder(TransactionMarker.BEGIN.getText()).append('\n');
        for (Statement statement : statements) {
            script.append(statement.getText()).append(";\n");
        }
        script.append(TransactionMarker.COMMIT.getText());
        return new CompositeScript(script.toString(), statements.size());
    }

    public String getText() {
        return text;
    }

    public int getStatementCount() {
        return statementCount;
    }

    public boolean isEmpty() {
        return statementCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompositeScript)) {
            return false;
        }
        return text.equals(((CompositeScript) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return text;
    }
}

package com.surrealsimple.core.exception;

/**
 * A statement did not parse under the SurrealQL grammar.
 * Raised locally; the statement never reaches the database.
 */
public class StatementParseException extends QueryException {

    private final int line;
    private final int column;
    private final String reason;

    public StatementParseException(String statementText, int line, int column, String reason) {
        super(String.format("Invalid statement at %d:%d: %s", line, column, reason), statementText);
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    public String getStatementText() {
        return getQueryText();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getReason() {
        return reason;
    }
}

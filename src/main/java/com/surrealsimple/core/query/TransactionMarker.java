package com.surrealsimple.core.query;

/**
 * Transaction boundary statements, exactly as they are sent.
 */
public enum TransactionMarker {
    BEGIN("BEGIN TRANSACTION;"),
    COMMIT("COMMIT TRANSACTION;"),
    CANCEL("CANCEL TRANSACTION;");

    private final String text;

    TransactionMarker(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }
}

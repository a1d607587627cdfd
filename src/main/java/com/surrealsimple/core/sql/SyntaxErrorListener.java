package com.surrealsimple.core.sql;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Stops lexing/parsing at the first syntax error instead of letting ANTLR
 * recover and print to stderr.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new SyntaxError(line, charPositionInLine, msg, e);
    }

    static final class SyntaxError extends RuntimeException {
        private final int line;
        private final int column;

        SyntaxError(int line, int column, String message, Throwable cause) {
            super(message, cause);
            this.line = line;
            this.column = column;
        }

        int getLine() {
            return line;
        }

        int getColumn() {
            return column;
        }
    }
}

package com.surrealsimple.core.sql;

import com.surrealsimple.core.exception.StatementParseException;
import com.surrealsimple.core.sql.grammar.SurrealQLLexer;
import com.surrealsimple.core.sql.grammar.SurrealQLParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates one SurrealQL statement and produces its canonical text.
 *
 * Stateless and safe to share; every call builds its own lexer and parser.
 */
public class StatementParser {
    private static final Logger logger = LoggerFactory.getLogger(StatementParser.class);

    /**
     * Parse exactly one statement. A single trailing semicolon is accepted.
     *
     * @param text statement text as supplied by the caller
     * @return the accepted statement in canonical form
     * @throws StatementParseException if the text is empty, holds more than one
     *         statement, is a transaction control statement or is not valid SurrealQL
     */
    public Statement parse(String text) throws StatementParseException {
        if (text == null || text.isBlank()) {
            throw new StatementParseException(text, 1, 0, "statement is empty");
        }

        SurrealQLLexer lexer = new SurrealQLLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        SurrealQLParser parser = new SurrealQLParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        SurrealQLParser.SingleStatementContext tree;
        try {
            tree = parser.singleStatement();
        } catch (SyntaxErrorListener.SyntaxError e) {
            logger.debug("Rejected statement [{}]: {}", text, e.getMessage());
            throw new StatementParseException(text, e.getLine(), e.getColumn(), e.getMessage());
        }

        if (tree.transactionControl() != null) {
            throw new StatementParseException(text, tree.start.getLine(), tree.start.getCharPositionInLine(),
                "transaction control statements cannot be accumulated, open a TransactionHandle instead");
        }

        return new Statement(CanonicalFormatter.format(tree.statement()), text);
    }
}

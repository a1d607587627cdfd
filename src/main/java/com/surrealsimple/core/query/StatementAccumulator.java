package com.surrealsimple.core.query;

import com.surrealsimple.core.exception.IndeterminateOutcomeException;
import com.surrealsimple.core.exception.ScriptExecutionException;
import com.surrealsimple.core.exception.StatementParseException;
import com.surrealsimple.core.session.DatabaseSession;
import com.surrealsimple.core.session.QueryResponse;
import com.surrealsimple.core.session.QueryResult;
import com.surrealsimple.core.session.SessionException;
import com.surrealsimple.core.session.SessionOutcomeUnknownException;
import com.surrealsimple.core.sql.Statement;
import com.surrealsimple.core.sql.StatementParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects validated statements and submits them as one transaction script.
 *
 * <p>Statements are parsed when added, so nothing malformed ever reaches the
 * database. {@link #execute(DatabaseSession)} sends the whole batch in a single
 * request wrapped in {@code BEGIN TRANSACTION; ... COMMIT TRANSACTION;}; the list
 * is cleared only when the engine reports every statement OK.
 *
 * <p>Not thread-safe. An accumulator belongs to one caller.
 */
public class StatementAccumulator {

    private final StatementParser parser;
    private final QueryListener listener;
    private final List<Statement> statements = new ArrayList<>();

    public StatementAccumulator() {
        this(new StatementParser(), QueryListener.NOOP);
    }

    public StatementAccumulator(StatementParser parser, QueryListener listener) {
        this.parser = parser;
        this.listener = listener != null ? listener : QueryListener.NOOP;
    }

    /**
     * Validate and append one statement.
     *
     * @throws StatementParseException if the text does not parse; the accumulator is unchanged
     */
    public StatementAccumulator add(String statementText) throws StatementParseException {
        Statement statement;
        try {
            statement = parser.parse(statementText);
        } catch (StatementParseException e) {
            listener.onStatementRejected(statementText, e);
            throw e;
        }
        statements.add(statement);
        listener.onStatementAccepted(statement, statements.size());
        return this;
    }

    public CompositeScript render() {
        return CompositeScript.of(statements);
    }

    /**
     * Submit every accumulated statement as one atomic script.
     *
     * <p>With nothing accumulated this returns an empty response without
     * contacting the session.
     *
     * @return one result slot per statement, in accumulation order
     * @throws IndeterminateOutcomeException if the reply was never observed
     * @throws ScriptExecutionException if the session failed or any statement reported an error
     */
    public QueryResponse execute(DatabaseSession session) throws ScriptExecutionException {
        if (statements.isEmpty()) {
            return QueryResponse.empty();
        }

        CompositeScript script = render();
        listener.beforeExecute(script);

        QueryResponse response;
        try {
            response = session.query(script.getText());
        } catch (SessionOutcomeUnknownException e) {
            IndeterminateOutcomeException failure = new IndeterminateOutcomeException(
                "Outcome of script is unknown: " + e.getMessage(), script.getText(), e);
            listener.afterExecute(script, null, failure);
            throw failure;
        } catch (SessionException e) {
            ScriptExecutionException failure = new ScriptExecutionException(
                "Script could not be executed: " + e.getMessage(), script.getText(), e);
            listener.afterExecute(script, null, failure);
            throw failure;
        }

        if (response.hasErrors()) {
            QueryResult firstError = response.firstError().orElseThrow();
            ScriptExecutionException failure = new ScriptExecutionException(
                "Script failed: " + firstError.getDetail(), script.getText(), response);
            listener.afterExecute(script, response, failure);
            throw failure;
        }

        statements.clear();
        listener.afterExecute(script, response, null);
        return response;
    }

    public void clear() {
        statements.clear();
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public List<Statement> getStatements() {
        return List.copyOf(statements);
    }
}

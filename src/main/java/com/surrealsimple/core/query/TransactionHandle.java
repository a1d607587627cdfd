package com.surrealsimple.core.query;

import com.surrealsimple.core.exception.IndeterminateOutcomeException;
import com.surrealsimple.core.exception.ScriptExecutionException;
import com.surrealsimple.core.exception.TransactionException;
import com.surrealsimple.core.exception.TransactionStateException;
import com.surrealsimple.core.session.DatabaseSession;
import com.surrealsimple.core.session.QueryResponse;
import com.surrealsimple.core.session.QueryResult;
import com.surrealsimple.core.session.SessionException;
import com.surrealsimple.core.session.SessionOutcomeUnknownException;

import java.util.Map;

/**
 * An explicitly scoped transaction on a borrowed session.
 *
 * <pre>
 * TransactionHandle tx = TransactionHandle.begin(session);
 * try {
 *     tx.query("DELETE person");
 *     tx.commit();
 * } catch (ScriptExecutionException e) {
 *     if (tx.isOpen()) {
 *         tx.rollback();
 *     }
 *     throw e;
 * }
 * </pre>
 *
 * A handle is used once. It never closes the session. Callers sharing a session
 * must keep other work off it while the handle is open.
 */
public class TransactionHandle {

    public enum State {
        UNOPENED,
        OPEN,
        COMMITTED,
        ROLLED_BACK,
        /** commit or rollback failed; the engine state must be re-read */
        FAILED
    }

    private final DatabaseSession session;
    private final QueryListener listener;
    private State state;

    private TransactionHandle(DatabaseSession session, QueryListener listener, State state) {
        this.session = session;
        this.listener = listener != null ? listener : QueryListener.NOOP;
        this.state = state;
    }

    public static TransactionHandle begin(DatabaseSession session) throws TransactionException {
        return begin(session, QueryListener.NOOP);
    }

    /**
     * Open a transaction on the session.
     *
     * @return an OPEN handle
     * @throws TransactionException if the engine refused or the session failed; no handle exists then
     */
    public static TransactionHandle begin(DatabaseSession session, QueryListener listener) throws TransactionException {
        TransactionHandle handle = new TransactionHandle(session, listener, State.UNOPENED);
        handle.submitMarker(TransactionMarker.BEGIN);
        handle.state = State.OPEN;
        return handle;
    }

    /**
     * A handle that was never begun. Every operation on it fails with
     * {@link TransactionStateException}.
     */
    public static TransactionHandle unopened(DatabaseSession session) {
        return new TransactionHandle(session, QueryListener.NOOP, State.UNOPENED);
    }

    public QueryResponse query(String text) throws ScriptExecutionException {
        return query(text, Map.of());
    }

    /**
     * Run a statement inside this transaction. Its effects become visible
     * only on commit.
     */
    public QueryResponse query(String text, Map<String, Object> variables) throws ScriptExecutionException {
        requireOpen("query");
        try {
            return session.query(text, variables);
        } catch (SessionOutcomeUnknownException e) {
            throw new IndeterminateOutcomeException("Outcome of statement is unknown: " + e.getMessage(), text, e);
        } catch (SessionException e) {
            throw new ScriptExecutionException("Statement could not be executed: " + e.getMessage(), text, e);
        }
    }

    public void commit() throws TransactionException {
        requireOpen("commit");
        finish(TransactionMarker.COMMIT, State.COMMITTED);
    }

    public void rollback() throws TransactionException {
        requireOpen("rollback");
        finish(TransactionMarker.CANCEL, State.ROLLED_BACK);
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public State getState() {
        return state;
    }

    private void finish(TransactionMarker marker, State next) throws TransactionException {
        try {
            submitMarker(marker);
        } catch (TransactionException e) {
            state = State.FAILED;
            throw e;
        }
        state = next;
    }

    private void submitMarker(TransactionMarker marker) throws TransactionException {
        String text = marker.getText();
        QueryResponse response;
        try {
            response = session.query(text);
        } catch (SessionOutcomeUnknownException e) {
            TransactionException failure = new IndeterminateOutcomeException(
                "Outcome of " + marker + " is unknown: " + e.getMessage(), text, e);
            listener.onTransactionBoundary(marker, false, failure);
            throw failure;
        } catch (SessionException e) {
            TransactionException failure = new TransactionException(
                marker + " failed: " + e.getMessage(), text, e);
            listener.onTransactionBoundary(marker, false, failure);
            throw failure;
        }

        if (response.hasErrors()) {
            QueryResult error = response.firstError().orElseThrow();
            TransactionException failure = new TransactionException(
                marker + " rejected: " + error.getDetail(), text, response);
            listener.onTransactionBoundary(marker, false, failure);
            throw failure;
        }
        listener.onTransactionBoundary(marker, true, null);
    }

    private void requireOpen(String operation) {
        if (state != State.OPEN) {
            throw new TransactionStateException("Cannot " + operation + " a transaction in state " + state);
        }
    }
}

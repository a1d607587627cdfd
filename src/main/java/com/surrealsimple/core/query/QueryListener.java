package com.surrealsimple.core.query;

import com.surrealsimple.core.exception.QueryException;
import com.surrealsimple.core.session.QueryResponse;
import com.surrealsimple.core.sql.Statement;

/**
 * Callbacks around statement accumulation, script execution and transaction
 * boundaries. Every method has an empty default, so implementations override
 * only what they observe.
 */
public interface QueryListener {

    QueryListener NOOP = new QueryListener() {
    };

    default void onStatementAccepted(Statement statement, int position) {
    }

    default void onStatementRejected(String text, QueryException error) {
    }

    default void beforeExecute(CompositeScript script) {
    }

    default void afterExecute(CompositeScript script, QueryResponse response, Exception error) {
    }

    default void onTransactionBoundary(TransactionMarker marker, boolean success, Exception error) {
    }
}

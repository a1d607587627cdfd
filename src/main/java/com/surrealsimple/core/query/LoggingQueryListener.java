package com.surrealsimple.core.query;

import com.surrealsimple.core.exception.QueryException;
import com.surrealsimple.core.session.QueryResponse;
import com.surrealsimple.core.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingQueryListener implements QueryListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingQueryListener.class);

    @Override
    public void onStatementAccepted(Statement statement, int position) {
        logger.debug("Accepted statement #{}: {}", position, statement);
    }

    @Override
    public void onStatementRejected(String text, QueryException error) {
        logger.warn("Rejected statement '{}': {}", text, error.getMessage());
    }

    @Override
    public void beforeExecute(CompositeScript script) {
        logger.debug("Executing script with {} statement(s):\n{}", script.getStatementCount(), script);
    }

    @Override
    public void afterExecute(CompositeScript script, QueryResponse response, Exception error) {
        if (error == null) {
            logger.info("✅ Script with {} statement(s) committed", script.getStatementCount());
        } else {
            logger.error("❌ Script with {} statement(s) failed: {}", script.getStatementCount(), error.getMessage());
        }
    }

    @Override
    public void onTransactionBoundary(TransactionMarker marker, boolean success, Exception error) {
        if (success) {
            logger.info("Transaction {} succeeded", marker);
        } else {
            logger.error("Transaction {} failed: {}", marker, error != null ? error.getMessage() : "unknown");
        }
    }
}

package com.surrealsimple.core.session;

import java.util.Map;

/**
 * An established, authenticated channel to the database engine.
 *
 * A session accepts a SurrealQL script (one or more statements) and answers
 * with one result slot per statement. Implementations may be shared between
 * threads, but a session carries at most one open transaction at a time, so
 * callers must serialize transactional units of work on a shared session.
 */
public interface DatabaseSession {

    /**
     * Submit a script and wait for its reply.
     *
     * @param script    SurrealQL text
     * @param variables values bound to {@code $name} parameters in the script
     * @return one result slot per statement, in submission order
     * @throws SessionOutcomeUnknownException if the script was sent but no reply was observed
     * @throws SessionException if the script could not be delivered or the engine refused it outright
     */
    QueryResponse query(String script, Map<String, Object> variables) throws SessionException;

    default QueryResponse query(String script) throws SessionException {
        return query(script, Map.of());
    }

    boolean isOpen();
}

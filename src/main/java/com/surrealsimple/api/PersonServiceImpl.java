package com.surrealsimple.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.surrealsimple.core.exception.IndeterminateOutcomeException;
import com.surrealsimple.core.exception.QueryException;
import com.surrealsimple.core.exception.ScriptExecutionException;
import com.surrealsimple.core.exception.TransactionException;
import com.surrealsimple.core.query.QueryListener;
import com.surrealsimple.core.query.StatementAccumulator;
import com.surrealsimple.core.query.TransactionHandle;
import com.surrealsimple.core.session.DatabaseSession;
import com.surrealsimple.core.session.QueryResponse;
import com.surrealsimple.core.session.SessionException;
import com.surrealsimple.core.session.SessionOutcomeUnknownException;
import com.surrealsimple.core.sql.StatementParser;
import com.surrealsimple.core.sql.SurrealLiterals;
import com.surrealsimple.entity.Person;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link PersonService} over a single shared {@link DatabaseSession}.
 *
 * The session carries server-side transaction state, so every call holds
 * {@code sessionLock}: nothing else may run on the connection while a
 * transaction opened by {@link #batchDown()} is in progress.
 */
@ApplicationScoped
public class PersonServiceImpl implements PersonService {
    private static final Logger logger = LoggerFactory.getLogger(PersonServiceImpl.class);

    static final String TABLE = "person";

    private static final String CREATE_ONE = "CREATE type::thing($tb, $id) CONTENT $content";
    private static final String SELECT_ONE = "SELECT * FROM type::thing($tb, $id)";
    private static final String UPDATE_ONE = "UPDATE type::thing($tb, $id) CONTENT $content";
    private static final String DELETE_ONE = "DELETE type::thing($tb, $id) RETURN BEFORE";
    private static final String SELECT_ALL = "SELECT * FROM " + TABLE;
    private static final String DELETE_ALL = "DELETE " + TABLE + " RETURN BEFORE";

    private final DatabaseSession session;
    private final QueryListener listener;
    private final ObjectMapper objectMapper;
    private final StatementParser parser = new StatementParser();
    private final ReentrantLock sessionLock = new ReentrantLock();

    @Inject
    public PersonServiceImpl(DatabaseSession session, QueryListener listener, ObjectMapper objectMapper) {
        this.session = session;
        this.listener = listener;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Person> create(String id, Person person) throws QueryException {
        return first(run(CREATE_ONE, Map.of("tb", TABLE, "id", id, "content", content(person))));
    }

    @Override
    public Optional<Person> read(String id) throws QueryException {
        return first(run(SELECT_ONE, Map.of("tb", TABLE, "id", id)));
    }

    @Override
    public Optional<Person> update(String id, Person person) throws QueryException {
        return first(run(UPDATE_ONE, Map.of("tb", TABLE, "id", id, "content", content(person))));
    }

    @Override
    public Optional<Person> delete(String id) throws QueryException {
        return first(run(DELETE_ONE, Map.of("tb", TABLE, "id", id)));
    }

    @Override
    public List<Person> list() throws QueryException {
        return toPeople(run(SELECT_ALL, Map.of()), SELECT_ALL);
    }

    @Override
    public List<Person> batchUp(List<Person> people) throws QueryException {
        StatementAccumulator accumulator = new StatementAccumulator(parser, listener);
        for (Person person : people) {
            accumulator.add("CREATE " + TABLE + ":uuid() CONTENT { name: " + SurrealLiterals.quote(person.getName()) + " }");
        }
        logger.info("Creating {} people in one transaction", accumulator.size());

        sessionLock.lock();
        try {
            accumulator.execute(session);
            return list();
        } finally {
            sessionLock.unlock();
        }
    }

    @Override
    public List<Person> batchDown() throws QueryException {
        sessionLock.lock();
        try {
            TransactionHandle tx = TransactionHandle.begin(session, listener);
            QueryResponse response;
            try {
                response = tx.query(DELETE_ALL);
                if (response.hasErrors()) {
                    throw new ScriptExecutionException(
                        "Delete failed: " + response.firstError().get().getDetail(), DELETE_ALL, response);
                }
            } catch (ScriptExecutionException e) {
                rollbackAfter(tx, e);
                throw e;
            }
            tx.commit();

            List<Person> deleted = toPeople(response.isEmpty() ? null : response.get(0).getResult(), DELETE_ALL);
            logger.info("Deleted {} people", deleted.size());
            return deleted;
        } finally {
            sessionLock.unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        return session.isOpen();
    }

    private void rollbackAfter(TransactionHandle tx, ScriptExecutionException failure) {
        try {
            tx.rollback();
            logger.warn("Rolled back after: {}", failure.getMessage());
        } catch (TransactionException rollbackFailure) {
            logger.error("Rollback failed, transaction state is unknown", rollbackFailure);
            failure.addSuppressed(rollbackFailure);
        }
    }

    private JsonNode run(String sql, Map<String, Object> variables) throws QueryException {
        logger.debug("Query: {} {}", sql, variables);
        QueryResponse response;
        sessionLock.lock();
        try {
            response = session.query(sql, variables);
        } catch (SessionOutcomeUnknownException e) {
            throw new IndeterminateOutcomeException("Outcome of query is unknown: " + e.getMessage(), sql, e);
        } catch (SessionException e) {
            throw new ScriptExecutionException("Query could not be executed: " + e.getMessage(), sql, e);
        } finally {
            sessionLock.unlock();
        }

        if (response.hasErrors()) {
            throw new ScriptExecutionException("Query failed: " + response.firstError().get().getDetail(), sql, response);
        }
        if (response.isEmpty()) {
            throw new ScriptExecutionException("Query returned no result", sql, response);
        }
        return response.get(0).getResult();
    }

    private Map<String, Object> content(Person person) {
        return Collections.<String, Object>singletonMap("name", person.getName());
    }

    private Optional<Person> first(JsonNode result) throws QueryException {
        List<Person> people = toPeople(result, null);
        return people.isEmpty() ? Optional.empty() : Optional.of(people.get(0));
    }

    private List<Person> toPeople(JsonNode result, String sql) throws QueryException {
        List<Person> people = new ArrayList<>();
        if (result == null || result.isNull() || result.isMissingNode()) {
            return people;
        }
        try {
            if (result.isArray()) {
                for (JsonNode record : result) {
                    people.add(objectMapper.treeToValue(record, Person.class));
                }
            } else {
                people.add(objectMapper.treeToValue(result, Person.class));
            }
        } catch (JsonProcessingException e) {
            throw new QueryException("Unexpected record shape: " + e.getOriginalMessage(), sql, e);
        }
        return people;
    }
}

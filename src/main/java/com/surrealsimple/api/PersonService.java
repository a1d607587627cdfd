package com.surrealsimple.api;

import com.surrealsimple.core.exception.QueryException;
import com.surrealsimple.entity.Person;

import java.util.List;
import java.util.Optional;

/**
 * Operations on the {@code person} table.
 *
 * Every method either completes against the database or throws; failures are
 * never reported as empty results.
 */
public interface PersonService {

    Optional<Person> create(String id, Person person) throws QueryException;

    Optional<Person> read(String id) throws QueryException;

    Optional<Person> update(String id, Person person) throws QueryException;

    Optional<Person> delete(String id) throws QueryException;

    List<Person> list() throws QueryException;

    /**
     * Create all given people in one atomic script, then return every stored person.
     */
    List<Person> batchUp(List<Person> people) throws QueryException;

    /**
     * Delete every person inside one explicit transaction and return what was deleted.
     * The transaction is rolled back if the delete fails.
     */
    List<Person> batchDown() throws QueryException;

    boolean isAvailable();
}

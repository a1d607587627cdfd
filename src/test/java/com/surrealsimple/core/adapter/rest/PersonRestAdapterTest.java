package com.surrealsimple.core.adapter.rest;

import com.surrealsimple.api.PersonService;
import com.surrealsimple.core.exception.IndeterminateOutcomeException;
import com.surrealsimple.core.exception.ScriptExecutionException;
import com.surrealsimple.core.exception.StatementParseException;
import com.surrealsimple.core.exception.TransactionStateException;
import com.surrealsimple.entity.Person;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class PersonRestAdapterTest {

    @Mock
    private PersonService personService;

    private PersonRestAdapter adapter;
    private HealthCheckAdapter healthCheck;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        adapter = new PersonRestAdapter();
        adapter.personService = personService;
        healthCheck = new HealthCheckAdapter();
        healthCheck.personService = personService;
    }

    @Test
    void testCreateReturnsStoredPerson() throws Exception {
        when(personService.create("1", new Person("John"))).thenReturn(Optional.of(new Person("John")));

        Response response = adapter.create("1", new Person("John"));

        assertEquals(200, response.getStatus());
        assertEquals(new Person("John"), response.getEntity());
    }

    @Test
    void testMissingPersonIs404() throws Exception {
        when(personService.read("nobody")).thenReturn(Optional.empty());

        Response response = adapter.read("nobody");

        assertEquals(404, response.getStatus());
        assertEquals(ErrorResponse.NOT_FOUND, ((ErrorResponse) response.getEntity()).getCode());
    }

    @Test
    void testBodyWithoutNameIs400() throws Exception {
        assertEquals(400, adapter.update("1", new Person()).getStatus());
        assertEquals(400, adapter.batchUp(null).getStatus());
        verify(personService, never()).update(any(), any());
    }

    @Test
    void testBatchUpReturnsEveryone() throws Exception {
        List<Person> people = List.of(new Person("a"), new Person("b"));
        when(personService.batchUp(people)).thenReturn(people);

        Response response = adapter.batchUp(people);

        assertEquals(200, response.getStatus());
        assertEquals(people, response.getEntity());
    }

    @Test
    void testParseErrorIs400() throws Exception {
        when(personService.batchUp(any())).thenThrow(new StatementParseException("CREATE (", 1, 8, "mismatched input"));

        Response response = adapter.batchUp(List.of(new Person("a")));

        assertEquals(400, response.getStatus());
        assertEquals(ErrorResponse.PARSE_ERROR, ((ErrorResponse) response.getEntity()).getCode());
    }

    @Test
    void testUnknownOutcomeIs503() throws Exception {
        when(personService.batchDown()).thenThrow(
            new IndeterminateOutcomeException("Outcome unknown", "COMMIT TRANSACTION;", null));

        Response response = adapter.batchDown();

        assertEquals(503, response.getStatus());
        assertEquals(ErrorResponse.OUTCOME_UNKNOWN, ((ErrorResponse) response.getEntity()).getCode());
    }

    @Test
    void testExecutionErrorIs502() throws Exception {
        when(personService.list()).thenThrow(
            new ScriptExecutionException("Query failed", "SELECT * FROM person", (Throwable) null));

        assertEquals(502, adapter.list().getStatus());
    }

    @Test
    void testTransactionMisuseIs500() throws Exception {
        when(personService.batchDown()).thenThrow(new TransactionStateException("Cannot commit a transaction in state COMMITTED"));

        Response response = adapter.batchDown();

        assertEquals(500, response.getStatus());
        assertEquals(ErrorResponse.STATE_ERROR, ((ErrorResponse) response.getEntity()).getCode());
    }

    @Test
    void testHealthCheck() {
        when(personService.isAvailable()).thenReturn(true);
        assertEquals(200, healthCheck.check().getStatus());

        when(personService.isAvailable()).thenReturn(false);
        assertEquals(503, healthCheck.check().getStatus());
    }
}

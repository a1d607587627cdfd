package com.surrealsimple.core.adapter.rest;

import com.surrealsimple.api.PersonService;
import com.surrealsimple.core.exception.IndeterminateOutcomeException;
import com.surrealsimple.core.exception.QueryException;
import com.surrealsimple.core.exception.StatementParseException;
import com.surrealsimple.core.exception.TransactionStateException;
import com.surrealsimple.entity.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Optional;

/**
 * REST adapter for the {@code person} table.
 *
 * Knows nothing about statements or sessions; it calls {@link PersonService}
 * and maps failures to status codes:
 * parse error 400, misuse of a transaction 500, unknown outcome 503,
 * any other database failure 502.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PersonRestAdapter {
    private static final Logger logger = LoggerFactory.getLogger(PersonRestAdapter.class);

    @Inject
    PersonService personService;

    /**
     * POST /person/{id}
     * Body: {"name": "..."}
     */
    @POST
    @Path("/person/{id}")
    public Response create(@PathParam("id") String id, Person person) {
        logger.debug("Received REST create: id={}", id);
        if (person == null || person.getName() == null) {
            return invalid("Body must be {\"name\": ...}");
        }
        try {
            return found(personService.create(id, person), id);
        } catch (Exception e) {
            return failure("create person " + id, e);
        }
    }

    @GET
    @Path("/person/{id}")
    public Response read(@PathParam("id") String id) {
        logger.debug("Received REST read: id={}", id);
        try {
            return found(personService.read(id), id);
        } catch (Exception e) {
            return failure("read person " + id, e);
        }
    }

    @PUT
    @Path("/person/{id}")
    public Response update(@PathParam("id") String id, Person person) {
        logger.debug("Received REST update: id={}", id);
        if (person == null || person.getName() == null) {
            return invalid("Body must be {\"name\": ...}");
        }
        try {
            return found(personService.update(id, person), id);
        } catch (Exception e) {
            return failure("update person " + id, e);
        }
    }

    @DELETE
    @Path("/person/{id}")
    public Response delete(@PathParam("id") String id) {
        logger.debug("Received REST delete: id={}", id);
        try {
            return found(personService.delete(id), id);
        } catch (Exception e) {
            return failure("delete person " + id, e);
        }
    }

    @GET
    @Path("/people")
    public Response list() {
        try {
            return Response.ok(personService.list()).build();
        } catch (Exception e) {
            return failure("list people", e);
        }
    }

    /**
     * Create every person in the body in one transaction.
     *
     * POST /person/batch_up
     * Body: [{"name": "..."}, ...]
     * Returns every stored person.
     */
    @POST
    @Path("/person/batch_up")
    public Response batchUp(List<Person> people) {
        logger.debug("Received REST batch_up: size={}", people != null ? people.size() : 0);
        if (people == null || people.stream().anyMatch(p -> p == null || p.getName() == null)) {
            return invalid("Body must be a list of {\"name\": ...}");
        }
        try {
            return Response.ok(personService.batchUp(people)).build();
        } catch (Exception e) {
            return failure("batch_up", e);
        }
    }

    /**
     * Delete every person inside one transaction.
     *
     * DELETE /person/batch_down
     */
    @DELETE
    @Path("/person/batch_down")
    public Response batchDown() {
        logger.debug("Received REST batch_down");
        try {
            return Response.ok(personService.batchDown()).build();
        } catch (Exception e) {
            return failure("batch_down", e);
        }
    }

    private Response found(Optional<Person> person, String id) {
        if (person.isPresent()) {
            return Response.ok(person.get()).build();
        }
        return Response.status(Response.Status.NOT_FOUND)
                      .entity(ErrorResponse.of(ErrorResponse.NOT_FOUND, "No person with id " + id))
                      .build();
    }

    private Response invalid(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                      .entity(ErrorResponse.of(ErrorResponse.INVALID_REQUEST, message))
                      .build();
    }

    private Response failure(String operation, Exception e) {
        if (e instanceof StatementParseException) {
            logger.warn("Rejected statement during {}: {}", operation, e.getMessage());
            return error(Response.Status.BAD_REQUEST, ErrorResponse.PARSE_ERROR, e);
        }
        if (e instanceof IndeterminateOutcomeException) {
            logger.error("Outcome unknown for {}", operation, e);
            return error(Response.Status.SERVICE_UNAVAILABLE, ErrorResponse.OUTCOME_UNKNOWN, e);
        }
        if (e instanceof TransactionStateException) {
            logger.error("Transaction misuse during {}", operation, e);
            return error(Response.Status.INTERNAL_SERVER_ERROR, ErrorResponse.STATE_ERROR, e);
        }
        if (e instanceof QueryException) {
            logger.error("Database failure during {}", operation, e);
            return error(Response.Status.BAD_GATEWAY, ErrorResponse.EXECUTION_ERROR, e);
        }
        logger.error("Error processing {}", operation, e);
        return error(Response.Status.INTERNAL_SERVER_ERROR, ErrorResponse.INTERNAL_ERROR, e);
    }

    private Response error(Response.Status status, String code, Exception e) {
        return Response.status(status)
                      .entity(ErrorResponse.of(code, e.getMessage()))
                      .build();
    }
}

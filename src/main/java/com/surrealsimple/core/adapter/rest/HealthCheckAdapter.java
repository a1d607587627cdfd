package com.surrealsimple.core.adapter.rest;

import com.surrealsimple.api.PersonService;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;

@Path("/health_check")
public class HealthCheckAdapter {

    @Inject
    PersonService personService;

    /**
     * 200 while the database session is connected, 503 otherwise.
     */
    @GET
    public Response check() {
        if (personService.isAvailable()) {
            return Response.ok().build();
        }
        return Response.status(Response.Status.SERVICE_UNAVAILABLE).build();
    }
}

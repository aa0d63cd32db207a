package org.acme.extender.resources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.acme.extender.config.ExtenderConfig;
import org.acme.extender.dto.ExtenderArgs;
import org.acme.extender.dto.ExtenderBindingArgs;
import org.acme.extender.dto.ExtenderBindingResult;
import org.acme.extender.dto.ExtenderFilterResult;
import org.acme.extender.index.PodNodeIndex;
import org.acme.extender.policy.ExtenderDispatcher;
import org.acme.extender.policy.UnknownPolicyException;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Scheduler extender callbacks. Bodies are decoded here rather than by the framework so that a
 * malformed filter or bind request is answered with the protocol's {@code Error} field and a 200.
 */
@Path("/scheduler")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SchedulerResource {

    @Inject
    ExtenderDispatcher dispatcher;

    @Inject
    PodNodeIndex index;

    @Inject
    ExtenderConfig config;

    @Inject
    ObjectMapper objectMapper;

    @POST
    @Path("/predicates/{name}")
    public Response filter(@PathParam("name") String name, String body) throws InterruptedException {
        if (body == null || body.isBlank()) {
            return badRequest("Empty filter request body");
        }
        if (!awaitIndex()) {
            return notReady();
        }
        ExtenderArgs args;
        try {
            args = objectMapper.readValue(body, ExtenderArgs.class);
        } catch (JsonProcessingException e) {
            Log.warnf("Undecodable filter request for predicate %s: %s", name, e.getOriginalMessage());
            return Response.ok(ExtenderFilterResult.error(e.getOriginalMessage())).build();
        }
        if (args == null) {
            return Response.ok(ExtenderFilterResult.error("Filter request carries no arguments")).build();
        }
        return Response.ok(dispatcher.filter(name, args)).build();
    }

    @POST
    @Path("/priorities/{name}")
    public Response prioritize(@PathParam("name") String name, String body) throws InterruptedException {
        if (body == null || body.isBlank()) {
            return badRequest("Empty prioritize request body");
        }
        if (!awaitIndex()) {
            return notReady();
        }
        ExtenderArgs args;
        try {
            args = objectMapper.readValue(body, ExtenderArgs.class);
        } catch (JsonProcessingException e) {
            Log.warnf("Undecodable prioritize request for priority %s: %s", name, e.getOriginalMessage());
            return badRequest(e.getOriginalMessage());
        }
        if (args == null) {
            return badRequest("Prioritize request carries no arguments");
        }
        return Response.ok(dispatcher.prioritize(name, args)).build();
    }

    @POST
    @Path("/bind")
    public Response bind(String body) {
        if (body == null || body.isBlank()) {
            return badRequest("Empty bind request body");
        }
        ExtenderBindingArgs args;
        try {
            args = objectMapper.readValue(body, ExtenderBindingArgs.class);
        } catch (JsonProcessingException e) {
            return Response.ok(new ExtenderBindingResult(e.getOriginalMessage())).build();
        }
        return Response.ok(dispatcher.bind(args)).build();
    }

    @POST
    @Path("/preemption")
    @Produces(MediaType.TEXT_PLAIN)
    public Response preemption() {
        return Response.status(Response.Status.NOT_IMPLEMENTED)
                .entity("This extender doesn't support preemption.")
                .build();
    }

    @ServerExceptionMapper
    public Response mapUnknownPolicy(UnknownPolicyException e) {
        return Response.status(Response.Status.NOT_FOUND)
                .type(MediaType.TEXT_PLAIN)
                .entity(e.getMessage())
                .build();
    }

    private boolean awaitIndex() throws InterruptedException {
        return index.isSynced() || index.awaitInitialSync(config.index().syncTimeout());
    }

    private static Response notReady() {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .type(MediaType.TEXT_PLAIN)
                .entity("Pod index is not synchronized yet")
                .build();
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.TEXT_PLAIN)
                .entity(message)
                .build();
    }
}

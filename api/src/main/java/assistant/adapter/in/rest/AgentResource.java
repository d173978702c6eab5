package assistant.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.Authenticated;
import io.smallrye.mutiny.Uni;

import assistant.adapter.in.dto.CreateAgentRequest;
import assistant.core.model.agent.AgentHandle;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.port.in.AgentManagement;

/**
 * REST resource for llama-stack agents.
 *
 * <p>{@code POST /api/agents} creates a new remote agent as the calling user.
 * {@code POST /api/agents/{agentId}/attach} returns a handle on an agent that
 * already exists, without contacting llama-stack.
 */
@Path("/api/agents")
@ApplicationScoped
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AgentResource {

    private final AgentManagement agents;

    @Inject
    public AgentResource(AgentManagement agents) {
        this.agents = agents;
    }

    @POST
    public Uni<Response> createAgent(
            @NotNull(message = "request body is required") @Valid CreateAgentRequest request,
            @Context HttpHeaders headers) {
        final var identity = ForwardedIdentity.from(headers::getHeaderString);
        return agents.create(request.agentKind(), request.toConfig(), identity)
                .map(handle -> Response.status(Response.Status.CREATED).entity(handle).build());
    }

    @POST
    @Path("/{agentId}/attach")
    public AgentHandle attachAgent(
            @PathParam("agentId") String agentId,
            @NotNull(message = "request body is required") @Valid CreateAgentRequest request) {
        return agents.attach(request.agentKind(), agentId, request.toConfig());
    }
}

package assistant.adapter.in.rest;

import java.util.List;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import assistant.adapter.in.dto.CreateUserRequest;
import assistant.adapter.in.problem.AssistantProblem;
import assistant.core.model.auth.UserRecord;
import assistant.core.port.in.UserManagement;

/**
 * REST resource for the local user directory.
 *
 * <p>Managing users requires the {@code admin} role. Any authenticated caller may
 * read their own record through {@code /api/users/me}.
 */
@Path("/api/users")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserResource {

    private final UserManagement users;
    private final SecurityIdentity identity;

    @Inject
    public UserResource(UserManagement users, SecurityIdentity identity) {
        this.users = users;
        this.identity = identity;
    }

    /**
     * Register a new user.
     *
     * @param request the registration request
     * @return 201 Created with the new user, or 409 if the username is taken
     */
    @POST
    @RolesAllowed(UserRecord.ADMIN_ROLE)
    public Uni<Response> createUser(@NotNull(message = "request body is required") @Valid CreateUserRequest request) {
        return users.create(request.username(), request.email(), request.role())
                .map(user -> Response.status(Response.Status.CREATED).entity(user).build());
    }

    @GET
    @RolesAllowed(UserRecord.ADMIN_ROLE)
    public Uni<List<UserRecord>> listUsers() {
        return users.list();
    }

    /**
     * Look up the record of the authenticated caller.
     *
     * @return the caller's user record or 404
     */
    @GET
    @Path("/me")
    @Authenticated
    public Uni<UserRecord> currentUser() {
        final var username = identity.getPrincipal().getName();
        return users.get(username)
                .map(opt -> opt.orElseThrow(() -> AssistantProblem.resourceNotFound("User", username)));
    }

    @GET
    @Path("/{username}")
    @RolesAllowed(UserRecord.ADMIN_ROLE)
    public Uni<UserRecord> getUser(@PathParam("username") String username) {
        return users.get(username)
                .map(opt -> opt.orElseThrow(() -> AssistantProblem.resourceNotFound("User", username)));
    }

    /**
     * Delete a user.
     *
     * @param username the username
     * @return 204 No Content, or 404 if the user does not exist
     */
    @DELETE
    @Path("/{username}")
    @RolesAllowed(UserRecord.ADMIN_ROLE)
    public Uni<Response> deleteUser(@PathParam("username") String username) {
        return users.delete(username).map(deleted -> {
            if (!deleted) {
                throw AssistantProblem.resourceNotFound("User", username);
            }
            return Response.noContent().build();
        });
    }
}

package assistant.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import assistant.core.model.LlamaStackException;
import assistant.core.model.auth.AuthServiceException;
import assistant.core.model.auth.AuthServiceTimeoutException;
import assistant.core.model.auth.AuthenticationRejectedException;
import assistant.core.model.auth.InvalidAuthResponseException;
import assistant.core.model.auth.UserAlreadyExistsException;
import assistant.core.model.auth.UserNotFoundException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Authentication outcomes keep their own messages so callers can tell a
 * rejected token from an unknown user.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapAuthenticationRejected(AuthenticationRejectedException e) {
        LOG.debugv("Authentication rejected: {0}", e.getMessage());
        return toResponse(AssistantProblem.forbidden(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUserNotFound(UserNotFoundException e) {
        LOG.debugv("Authenticated caller has no local user: {0}", e.getMessage());
        return toResponse(AssistantProblem.forbidden(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapAuthServiceTimeout(AuthServiceTimeoutException e) {
        LOG.warnv("Authentication service timed out: {0}", e.getMessage());
        return toResponse(AssistantProblem.gatewayTimeout(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapAuthServiceError(AuthServiceException e) {
        LOG.warnv(e.getCause(), "Authentication service error: {0}", e.getMessage());
        return toResponse(AssistantProblem.badGateway(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapInvalidAuthResponse(InvalidAuthResponseException e) {
        LOG.warnv("Invalid authentication response: {0}", e.getMessage());
        return toResponse(AssistantProblem.badGateway(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUserAlreadyExists(UserAlreadyExistsException e) {
        LOG.debugv("Duplicate user: {0}", e.username());
        return toResponse(AssistantProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapLlamaStackException(LlamaStackException e) {
        LOG.warnv("llama-stack call failed: {0}", e.getMessage());
        return toResponse(AssistantProblem.badGateway(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(AssistantProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}

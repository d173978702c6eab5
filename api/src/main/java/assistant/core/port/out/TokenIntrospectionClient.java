package assistant.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

/**
 * Port for the external token introspection endpoint.
 */
public interface TokenIntrospectionClient {

    /**
     * Present the given headers to the introspection endpoint.
     *
     * <p>Fails with {@link assistant.core.model.auth.AuthServiceTimeoutException}
     * when the deadline passes and with
     * {@link assistant.core.model.auth.AuthServiceException} for any other failure.
     *
     * @param headers outbound headers (Authorization plus forwarded identity)
     * @return the HTTP status returned by the endpoint
     */
    Uni<Integer> introspect(Map<String, String> headers);
}

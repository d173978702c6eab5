package assistant.adapter.out.http;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import io.netty.channel.ConnectTimeoutException;

import assistant.core.model.auth.AuthServiceException;
import assistant.core.model.auth.AuthServiceTimeoutException;
import assistant.core.model.auth.AuthenticationException;

/**
 * Maps transport failures of calls to the authentication sidecar onto the
 * authentication error kinds.
 */
final class AuthCallFailures {

    private AuthCallFailures() {
        // Utility class - prevent instantiation
    }

    /**
     * Translate a failure.
     *
     * <p>Authentication errors pass through unchanged. Timeouts anywhere in the
     * cause chain become {@link AuthServiceTimeoutException}; everything else is
     * wrapped in a generic {@link AuthServiceException}.
     *
     * @param error the failure
     * @param url   the URL that was called
     * @return the translated failure
     */
    static Throwable translate(Throwable error, String url) {
        if (error instanceof AuthenticationException) {
            return error;
        }
        if (isTimeout(error)) {
            return new AuthServiceTimeoutException("Authentication request to " + url + " timed out", error);
        }
        return new AuthServiceException(error);
    }

    static boolean isTimeout(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof ConnectTimeoutException) {
                return true;
            }
            // Vert.x request timeouts surface as NoStackTraceTimeoutException
            if (current.getClass().getSimpleName().endsWith("TimeoutException")) {
                return true;
            }
        }
        return false;
    }
}

package assistant.core.model.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Identity asserted by the fronting reverse proxy.
 *
 * <p>The proxy authenticates the user at the edge and injects
 * {@code X-Forwarded-User} and {@code X-Forwarded-Email}. Either entry may be
 * absent; absent entries are never replaced with defaults.
 *
 * @param user  the forwarded username, or null
 * @param email the forwarded email address, or null
 */
public record ForwardedIdentity(String user, String email) {

    public static final String USER_HEADER = "X-Forwarded-User";
    public static final String EMAIL_HEADER = "X-Forwarded-Email";

    private static final ForwardedIdentity EMPTY = new ForwardedIdentity(null, null);

    public ForwardedIdentity {
        user = blankToNull(user);
        email = blankToNull(email);
    }

    public static ForwardedIdentity empty() {
        return EMPTY;
    }

    /**
     * Read the forwarded identity through a header lookup function.
     *
     * <p>The canonical casing is tried first, then the lowercase variant.
     *
     * @param headerLookup returns the header value for a name, or null
     * @return the forwarded identity, possibly empty
     */
    public static ForwardedIdentity from(Function<String, String> headerLookup) {
        if (headerLookup == null) {
            return EMPTY;
        }
        return new ForwardedIdentity(lookup(headerLookup, USER_HEADER), lookup(headerLookup, EMAIL_HEADER));
    }

    /**
     * Read the forwarded identity from a plain header map.
     *
     * @param headers header map, may be null
     * @return the forwarded identity, possibly empty
     */
    public static ForwardedIdentity fromHeaders(Map<String, String> headers) {
        if (headers == null) {
            return EMPTY;
        }
        return from(headers::get);
    }

    public Optional<String> userOptional() {
        return Optional.ofNullable(user);
    }

    public Optional<String> emailOptional() {
        return Optional.ofNullable(email);
    }

    public boolean isEmpty() {
        return user == null && email == null;
    }

    /**
     * Headers under their canonical names, containing only present entries.
     *
     * @return ordered header map
     */
    public Map<String, String> toHeaders() {
        final var headers = new LinkedHashMap<String, String>();
        if (user != null) {
            headers.put(USER_HEADER, user);
        }
        if (email != null) {
            headers.put(EMAIL_HEADER, email);
        }
        return headers;
    }

    private static String lookup(Function<String, String> headerLookup, String canonicalName) {
        final var value = blankToNull(headerLookup.apply(canonicalName));
        if (value != null) {
            return value;
        }
        return blankToNull(headerLookup.apply(canonicalName.toLowerCase()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

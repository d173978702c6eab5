package assistant.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ForwardedIdentity")
class ForwardedIdentityTest {

    @Test
    @DisplayName("should prefer the canonical header over the lowercase one")
    void shouldPreferCanonicalHeader() {
        var identity = ForwardedIdentity.fromHeaders(Map.of(
                "X-Forwarded-User", "alice",
                "x-forwarded-user", "mallory"));

        assertEquals("alice", identity.user());
    }

    @Test
    @DisplayName("should fall back to the lowercase header")
    void shouldFallBackToLowercase() {
        var identity = ForwardedIdentity.fromHeaders(Map.of("x-forwarded-email", "bob@example.com"));

        assertNull(identity.user());
        assertEquals("bob@example.com", identity.email());
    }

    @Test
    @DisplayName("should treat blank values as absent")
    void shouldTreatBlankAsAbsent() {
        var headers = new HashMap<String, String>();
        headers.put("X-Forwarded-User", " ");
        headers.put("x-forwarded-user", "carol");

        var identity = ForwardedIdentity.fromHeaders(headers);

        assertEquals("carol", identity.user());
    }

    @Test
    @DisplayName("should never fabricate defaults")
    void shouldNotFabricateDefaults() {
        var identity = ForwardedIdentity.fromHeaders(Map.of());

        assertTrue(identity.isEmpty());
        assertTrue(identity.toHeaders().isEmpty());
    }

    @Test
    @DisplayName("should write only present entries under canonical names")
    void shouldWriteCanonicalHeaders() {
        var headers = new ForwardedIdentity(null, "dave@example.com").toHeaders();

        assertEquals(List.of("X-Forwarded-Email"), List.copyOf(headers.keySet()));
    }

    @Test
    @DisplayName("forIdentity should build a self-test request with lowercase header names")
    void forIdentityShouldUseLowercaseHeaders() {
        var request = AuthRequest.forIdentity("sa-token", new ForwardedIdentity("erin", "erin@example.com"));

        assertEquals("sa-token", request.apiKey());
        assertEquals("/", request.request().path());
        assertEquals(
                Map.of("x-forwarded-user", "erin", "x-forwarded-email", "erin@example.com"),
                request.request().headers());
        assertTrue(request.request().params().isEmpty());
        assertEquals("erin", request.request().forwardedIdentity().user());
    }
}

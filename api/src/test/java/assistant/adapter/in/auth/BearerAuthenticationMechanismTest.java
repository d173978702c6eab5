package assistant.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BearerAuthenticationMechanism")
class BearerAuthenticationMechanismTest {

    @Test
    @DisplayName("should strip the Bearer prefix")
    void shouldStripBearerPrefix() {
        assertEquals("abc.def", BearerAuthenticationMechanism.bearerToken("Bearer abc.def"));
        assertEquals("abc.def", BearerAuthenticationMechanism.bearerToken("  Bearer   abc.def  "));
    }

    @Test
    @DisplayName("should pass a bare token through")
    void shouldKeepBareToken() {
        assertEquals("abc.def", BearerAuthenticationMechanism.bearerToken("abc.def"));
    }

    @Test
    @DisplayName("should yield an empty token for a missing header")
    void shouldHandleMissingHeader() {
        assertEquals("", BearerAuthenticationMechanism.bearerToken(null));
        assertEquals("", BearerAuthenticationMechanism.bearerToken("   "));
    }
}

package assistant.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import assistant.core.config.AuthConfig;
import assistant.core.model.auth.AuthRequest;
import assistant.core.model.auth.AuthServiceException;
import assistant.core.model.auth.AuthServiceTimeoutException;
import assistant.core.model.auth.AuthenticationRejectedException;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.model.auth.InvalidAuthResponseException;

@DisplayName("VertxPeerAuthenticationClient")
@ExtendWith(MockitoExtension.class)
class VertxPeerAuthenticationClientTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);
    private static final AuthRequest REQUEST =
            AuthRequest.forIdentity("sa-token", new ForwardedIdentity("bob", "bob@example.com"));

    @Mock
    private AuthConfig config;

    @Mock
    private AuthConfig.Peer peer;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VertxPeerAuthenticationClient client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(config.peer()).thenReturn(peer);
        lenient().when(config.timeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(peer.url()).thenReturn(wireMockServer.baseUrl() + "/validate");
        client = new VertxPeerAuthenticationClient(vertx, config);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private void stubResponse(int status, String body) {
        wireMockServer.stubFor(post(urlEqualTo("/validate"))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Nested
    @DisplayName("Successful authentication")
    class Success {

        @Test
        @DisplayName("should post the llama-stack request shape and parse the decision")
        void shouldPostAndParse() {
            stubResponse(200, """
                    {"principal": "bob", "attributes": {"roles": ["user"]}, "message": "ok"}
                    """);

            var decision = client.authenticate(REQUEST).await().atMost(AWAIT);

            assertEquals("bob", decision.principal());
            assertEquals(Map.of("roles", List.of("user")), decision.attributes());
            wireMockServer.verify(postRequestedFor(urlEqualTo("/validate")).withRequestBody(equalToJson("""
                    {
                      "api_key": "sa-token",
                      "request": {
                        "path": "/",
                        "headers": {"x-forwarded-user": "bob", "x-forwarded-email": "bob@example.com"},
                        "params": {}
                      }
                    }
                    """)));
        }

        @Test
        @DisplayName("should accept a decision without attributes or message")
        void shouldAcceptMinimalDecision() {
            stubResponse(200, "{\"principal\": \"bob\"}");

            var decision = client.authenticate(REQUEST).await().atMost(AWAIT);

            assertEquals("bob", decision.principal());
            assertEquals(Map.of(), decision.attributes());
        }
    }

    @Nested
    @DisplayName("Distinct failure kinds")
    class Failures {

        @Test
        @DisplayName("non-200 should be a rejection")
        void non200ShouldBeRejection() {
            stubResponse(403, "{\"error\": \"denied\"}");

            var error = assertThrows(
                    AuthenticationRejectedException.class, () -> client.authenticate(REQUEST).await().atMost(AWAIT));
            assertEquals(403, error.status());
        }

        @Test
        @DisplayName("a body that is not JSON should be an invalid response")
        void garbageShouldBeInvalid() {
            stubResponse(200, "not json");

            var error = assertThrows(
                    InvalidAuthResponseException.class, () -> client.authenticate(REQUEST).await().atMost(AWAIT));
            assertEquals(InvalidAuthResponseException.MESSAGE, error.getMessage());
        }

        @Test
        @DisplayName("a body without principal should be an invalid response")
        void missingPrincipalShouldBeInvalid() {
            stubResponse(200, "{\"attributes\": {}}");

            assertThrows(InvalidAuthResponseException.class, () -> client.authenticate(REQUEST).await().atMost(AWAIT));
        }

        @Test
        @DisplayName("a slow peer should be a timeout")
        void slowPeerShouldTimeOut() {
            lenient().when(config.timeout()).thenReturn(Duration.ofMillis(200));
            client = new VertxPeerAuthenticationClient(vertx, config);
            wireMockServer.stubFor(post(urlEqualTo("/validate"))
                    .willReturn(aResponse().withStatus(200).withFixedDelay(2000).withBody("{}")));

            assertThrows(AuthServiceTimeoutException.class, () -> client.authenticate(REQUEST).await().atMost(AWAIT));
        }

        @Test
        @DisplayName("an unreachable peer should be a generic service error")
        void unreachablePeerShouldBeServiceError() {
            lenient().when(peer.url()).thenReturn("http://localhost:1/validate");
            client = new VertxPeerAuthenticationClient(vertx, config);

            assertThrows(AuthServiceException.class, () -> client.authenticate(REQUEST).await().atMost(AWAIT));
        }
    }
}

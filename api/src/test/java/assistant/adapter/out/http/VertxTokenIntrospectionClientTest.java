package assistant.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
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
import assistant.core.model.auth.AuthServiceException;
import assistant.core.model.auth.AuthServiceTimeoutException;

@DisplayName("VertxTokenIntrospectionClient")
@ExtendWith(MockitoExtension.class)
class VertxTokenIntrospectionClientTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);

    @Mock
    private AuthConfig config;

    @Mock
    private AuthConfig.Introspection introspection;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VertxTokenIntrospectionClient client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(config.introspection()).thenReturn(introspection);
        lenient().when(config.timeout()).thenReturn(Duration.ofSeconds(2));
        lenient().when(introspection.url()).thenReturn(wireMockServer.baseUrl() + "/validate-token");
        client = new VertxTokenIntrospectionClient(vertx, config);
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

    @Nested
    @DisplayName("Responses")
    class Responses {

        @Test
        @DisplayName("should send the headers with GET and return 200")
        void shouldSendHeaders() {
            wireMockServer.stubFor(get(urlEqualTo("/validate-token")).willReturn(aResponse().withStatus(200)));

            var status = client.introspect(Map.of("Authorization", "Bearer abc", "X-Forwarded-User", "alice"))
                    .await().atMost(AWAIT);

            assertEquals(200, status);
            wireMockServer.verify(getRequestedFor(urlEqualTo("/validate-token"))
                    .withHeader("Authorization", equalTo("Bearer abc"))
                    .withHeader("X-Forwarded-User", equalTo("alice"))
                    .withHeader("X-Forwarded-Email", absent()));
        }

        @Test
        @DisplayName("should return non-200 statuses without failing")
        void shouldReturnRejection() {
            wireMockServer.stubFor(get(urlEqualTo("/validate-token")).willReturn(aResponse().withStatus(401)));

            var status = client.introspect(Map.of("Authorization", "Bearer bad")).await().atMost(AWAIT);

            assertEquals(401, status);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should fail with a timeout when the sidecar is too slow")
        void shouldTimeOut() {
            lenient().when(config.timeout()).thenReturn(Duration.ofMillis(200));
            client = new VertxTokenIntrospectionClient(vertx, config);
            wireMockServer.stubFor(get(urlEqualTo("/validate-token"))
                    .willReturn(aResponse().withStatus(200).withFixedDelay(2000)));

            var uni = client.introspect(Map.of("Authorization", "Bearer abc"));

            assertThrows(AuthServiceTimeoutException.class, () -> uni.await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should wrap connection errors in a generic service error")
        void shouldWrapConnectionErrors() {
            lenient().when(introspection.url()).thenReturn("http://localhost:1/validate-token");
            client = new VertxTokenIntrospectionClient(vertx, config);

            var uni = client.introspect(Map.of());

            var error = assertThrows(AuthServiceException.class, () -> uni.await().atMost(AWAIT));
            assertEquals("Authentication service error", error.getMessage());
            assertNotNull(error.getCause());
        }
    }
}

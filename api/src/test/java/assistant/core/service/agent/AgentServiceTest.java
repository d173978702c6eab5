package assistant.core.service.agent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import assistant.core.model.agent.AgentConfig;
import assistant.core.model.agent.AgentKind;
import assistant.core.model.auth.ForwardedIdentity;
import assistant.core.port.out.LlamaStackGateway;
import assistant.core.port.out.ServiceAccountCredentials;

@DisplayName("AgentService")
@ExtendWith(MockitoExtension.class)
class AgentServiceTest {

    private static final AgentConfig CONFIG =
            new AgentConfig("llama3.2:3b", "You are helpful.", List.of("mcp::weather"), 0);

    @Mock
    private LlamaStackGateway gateway;

    @Mock
    private ServiceAccountCredentials credentials;

    private AgentService service;

    @BeforeEach
    void setUp() {
        service = new AgentService(gateway, credentials);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should create the agent remotely as the calling user")
        void shouldCreateRemotely() {
            when(credentials.token()).thenReturn(Optional.of("sa-token"));
            when(gateway.createAgent(eq(AgentKind.REACT), eq(CONFIG), any()))
                    .thenReturn(Uni.createFrom().item("agent-42"));

            var handle = service.create(AgentKind.REACT, CONFIG, new ForwardedIdentity("alice", null))
                    .await().atMost(Duration.ofSeconds(5));

            assertEquals("agent-42", handle.agentId());
            assertEquals(AgentKind.REACT, handle.kind());
            assertFalse(handle.attached());
            verify(gateway).createAgent(
                    AgentKind.REACT,
                    CONFIG,
                    Map.of("Authorization", "Bearer sa-token", "X-Forwarded-User", "alice"));
        }
    }

    @Nested
    @DisplayName("attach")
    class Attach {

        @Test
        @DisplayName("should bind to the existing identifier without calling llama-stack")
        void shouldNotCallRemote() {
            var handle = service.attach(AgentKind.STANDARD, "agent-7", CONFIG);

            assertEquals("agent-7", handle.agentId());
            assertTrue(handle.attached());
            assertEquals(10, handle.config().maxInferIters());
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("should reject a blank identifier")
        void shouldRejectBlankId() {
            assertThrows(IllegalArgumentException.class, () -> service.attach(AgentKind.STANDARD, " ", CONFIG));
        }
    }
}

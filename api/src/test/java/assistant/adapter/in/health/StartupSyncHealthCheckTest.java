package assistant.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import assistant.core.model.readiness.ServiceReadiness;
import assistant.core.model.sync.StartupSyncReport;
import assistant.core.model.sync.SyncOutcome;
import assistant.core.port.in.StartupSynchronization;

@DisplayName("StartupSyncHealthCheck")
@ExtendWith(MockitoExtension.class)
class StartupSyncHealthCheckTest {

    @Mock
    private StartupSynchronization synchronization;

    private StartupSyncHealthCheck check;

    @BeforeEach
    void setUp() {
        check = new StartupSyncHealthCheck(synchronization);
    }

    @Test
    @DisplayName("should report pending before the first run")
    void shouldReportPending() {
        when(synchronization.lastReport()).thenReturn(Optional.empty());

        var response = check.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("pending", response.getData().orElseThrow().get("status"));
    }

    @Test
    @DisplayName("should stay up and list failed routines")
    void shouldReportDegradedRun() {
        var report = new StartupSyncReport(
                ServiceReadiness.READY,
                List.of(
                        SyncOutcome.success("MCP servers", 2),
                        SyncOutcome.failure("Model servers", new IllegalStateException("boom"))),
                Instant.parse("2026-01-01T00:00:00Z"));
        when(synchronization.lastReport()).thenReturn(Optional.of(report));

        var response = check.call();
        var data = response.getData().orElseThrow();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("degraded", data.get("status"));
        assertEquals("READY", data.get("readiness"));
        assertEquals("synced 2", data.get("MCP servers"));
        assertEquals("failed", data.get("Model servers"));
    }
}

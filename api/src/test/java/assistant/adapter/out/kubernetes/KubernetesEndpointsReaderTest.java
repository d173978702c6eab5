package assistant.adapter.out.kubernetes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import io.fabric8.kubernetes.api.model.EndpointAddressBuilder;
import io.fabric8.kubernetes.api.model.EndpointSubsetBuilder;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.fabric8.kubernetes.api.model.EndpointsBuilder;
import io.fabric8.kubernetes.api.model.EndpointsList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import assistant.core.model.readiness.EndpointsLookupException;

@DisplayName("KubernetesEndpointsReader")
@ExtendWith(MockitoExtension.class)
class KubernetesEndpointsReaderTest {

    @Mock
    private KubernetesClient client;

    @Mock
    private MixedOperation<Endpoints, EndpointsList, Resource<Endpoints>> endpointsOperation;

    @Mock
    private NonNamespaceOperation<Endpoints, EndpointsList, Resource<Endpoints>> namespaced;

    @Mock
    private Resource<Endpoints> resource;

    private KubernetesEndpointsReader reader;

    @BeforeEach
    void setUp() {
        when(client.endpoints()).thenReturn(endpointsOperation);
        when(endpointsOperation.inNamespace("assistant")).thenReturn(namespaced);
        when(namespaced.withName("ai-virtual-assistant-authenticated")).thenReturn(resource);
        reader = new KubernetesEndpointsReader(client);
    }

    @Test
    @DisplayName("should count addresses across all subsets")
    void shouldCountAddresses() {
        when(resource.get()).thenReturn(new EndpointsBuilder()
                .withNewMetadata()
                .withName("ai-virtual-assistant-authenticated")
                .endMetadata()
                .addToSubsets(new EndpointSubsetBuilder()
                        .addToAddresses(new EndpointAddressBuilder().withIp("10.0.0.1").build())
                        .addToAddresses(new EndpointAddressBuilder().withIp("10.0.0.2").build())
                        .build())
                .addToSubsets(new EndpointSubsetBuilder()
                        .addToAddresses(new EndpointAddressBuilder().withIp("10.0.1.1").build())
                        .build())
                .build());

        var snapshot = reader.read("ai-virtual-assistant-authenticated", "assistant").orElseThrow();

        assertEquals(3, snapshot.readyAddresses());
        assertTrue(snapshot.isReady());
    }

    @Test
    @DisplayName("should report zero addresses when there are no subsets")
    void shouldReportNotReadyWithoutSubsets() {
        when(resource.get()).thenReturn(new EndpointsBuilder()
                .withNewMetadata()
                .withName("ai-virtual-assistant-authenticated")
                .endMetadata()
                .build());

        var snapshot = reader.read("ai-virtual-assistant-authenticated", "assistant").orElseThrow();

        assertFalse(snapshot.isReady());
    }

    @Test
    @DisplayName("should return empty when the Endpoints object does not exist")
    void shouldReturnEmptyWhenMissing() {
        when(resource.get()).thenReturn(null);

        assertTrue(reader.read("ai-virtual-assistant-authenticated", "assistant").isEmpty());
    }

    @Test
    @DisplayName("should carry the API status code of client failures")
    void shouldTranslateClientFailures() {
        var failure = new KubernetesClientException("endpoints is forbidden", 403, null);
        when(resource.get()).thenThrow(failure);

        var error = assertThrows(
                EndpointsLookupException.class,
                () -> reader.read("ai-virtual-assistant-authenticated", "assistant"));

        assertEquals(403, error.status());
        assertSame(failure, error.getCause());
    }
}

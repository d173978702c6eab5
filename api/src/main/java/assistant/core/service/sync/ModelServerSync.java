package assistant.core.service.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import assistant.core.config.LlamaStackConfig;
import assistant.core.model.sync.ModelServer;
import assistant.core.model.sync.ProviderDescriptor;
import assistant.core.port.out.LlamaStackGateway;
import assistant.core.port.out.StorageSession;
import assistant.core.service.auth.ServiceIdentityHeaders;

/**
 * Syncs model servers from the llama-stack inference providers.
 */
@ApplicationScoped
public class ModelServerSync implements ResourceSync {

    private static final Logger LOG = Logger.getLogger(ModelServerSync.class);

    private final LlamaStackGateway gateway;
    private final ServiceIdentityHeaders identityHeaders;
    private final LlamaStackConfig config;

    @Inject
    public ModelServerSync(LlamaStackGateway gateway, ServiceIdentityHeaders identityHeaders, LlamaStackConfig config) {
        this.gateway = gateway;
        this.identityHeaders = identityHeaders;
        this.config = config;
    }

    @Override
    public String label() {
        return "model servers";
    }

    @Override
    public int sync(StorageSession session) {
        final var providers =
                gateway.listProviders(identityHeaders.headers()).await().atMost(config.timeout());

        var synced = 0;
        for (ProviderDescriptor provider : providers) {
            if (!ModelServer.INFERENCE_API.equals(provider.api())) {
                continue;
            }
            session.modelServers()
                    .upsert(new ModelServer(provider.providerId(), null, provider.providerType(), null));
            synced++;
        }

        LOG.debugf("Model server sync: providers=%d, inference=%d", providers.size(), synced);
        return synced;
    }
}

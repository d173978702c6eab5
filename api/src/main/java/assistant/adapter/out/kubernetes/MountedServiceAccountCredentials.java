package assistant.adapter.out.kubernetes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import assistant.core.config.ClusterConfig;
import assistant.core.port.out.ServiceAccountCredentials;

/**
 * Reads the service-account token and namespace files that Kubernetes mounts into every pod.
 */
@ApplicationScoped
public class MountedServiceAccountCredentials implements ServiceAccountCredentials {

    private static final Logger LOG = Logger.getLogger(MountedServiceAccountCredentials.class);

    private final Path tokenPath;
    private final Path namespacePath;

    @Inject
    public MountedServiceAccountCredentials(ClusterConfig config) {
        this(
                Path.of(config.serviceAccount().tokenPath()),
                Path.of(config.serviceAccount().namespacePath()));
    }

    public MountedServiceAccountCredentials(Path tokenPath, Path namespacePath) {
        this.tokenPath = tokenPath;
        this.namespacePath = namespacePath;
    }

    @Override
    public Optional<String> token() {
        return readTrimmed(tokenPath, "service account token");
    }

    @Override
    public Optional<String> namespace() {
        return readTrimmed(namespacePath, "namespace");
    }

    private static Optional<String> readTrimmed(Path path, String what) {
        if (!Files.isRegularFile(path)) {
            LOG.debugf("No %s mounted at %s", what, path);
            return Optional.empty();
        }
        try {
            final var value = Files.readString(path).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException e) {
            LOG.warnf("Failed to read %s from %s: %s", what, path, e.getMessage());
            return Optional.empty();
        }
    }
}

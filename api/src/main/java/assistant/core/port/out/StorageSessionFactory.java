package assistant.core.port.out;

/**
 * Opens storage sessions. Implementations must be safe for concurrent use.
 */
public interface StorageSessionFactory {

    StorageSession open();
}

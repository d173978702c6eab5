package assistant.core.model.sync;

import java.util.Optional;

/**
 * Result of one startup sync routine.
 *
 * @param label     routine label (e.g. "MCP servers")
 * @param succeeded whether the routine completed
 * @param synced    number of records written
 * @param error     failure message when the routine failed
 */
public record SyncOutcome(String label, boolean succeeded, int synced, Optional<String> error) {

    public SyncOutcome {
        if (error == null) {
            error = Optional.empty();
        }
    }

    public static SyncOutcome success(String label, int synced) {
        return new SyncOutcome(label, true, synced, Optional.empty());
    }

    public static SyncOutcome failure(String label, Throwable error) {
        final var message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new SyncOutcome(label, false, 0, Optional.of(message));
    }
}

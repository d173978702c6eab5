package assistant.core.port.in;

import java.util.Optional;

import assistant.core.model.sync.StartupSyncReport;

/**
 * Port for the post-startup resource sync.
 */
public interface StartupSynchronization {

    /**
     * Wait for the companion service and run every sync routine.
     *
     * <p>Blocks the calling thread; never call it from an event loop.
     *
     * @return the run report
     */
    StartupSyncReport run();

    /**
     * @return the report of the most recent run, if any
     */
    Optional<StartupSyncReport> lastReport();
}

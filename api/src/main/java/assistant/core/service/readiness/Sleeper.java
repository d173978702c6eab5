package assistant.core.service.readiness;

import java.time.Duration;

/**
 * Pauses the calling thread.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

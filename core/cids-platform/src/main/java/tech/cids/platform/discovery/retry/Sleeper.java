package tech.cids.platform.discovery.retry;

import java.time.Duration;

/**
 * Waits between attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

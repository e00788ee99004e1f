package org.logkeeper.ingest.retry;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests to observe delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

package com.tessera.secrets;

import java.time.Duration;

/**
 * Blocking pause between resolution attempts. Replaced in tests to avoid real sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /** Sleeps on the calling thread. */
    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}

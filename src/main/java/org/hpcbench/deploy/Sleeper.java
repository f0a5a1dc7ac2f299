package org.hpcbench.deploy;

import java.time.Duration;

/**
 * Blocking pause used by polling loops; replaced by a clock-advancing fake in tests.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}

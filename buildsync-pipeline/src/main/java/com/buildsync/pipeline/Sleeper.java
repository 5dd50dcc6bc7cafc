package com.buildsync.pipeline;

import java.time.Duration;

/**
 * Blocking wait between target calls that need the target to catch up.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting " + duration, e);
        }
    };

    void sleep(Duration duration);
}

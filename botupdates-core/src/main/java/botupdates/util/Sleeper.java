package botupdates.util;

import java.time.Duration;

/**
 * Blocking wait used for poller backoff. Interruptible so that shutdown never waits
 * for a backoff to elapse.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the current thread via {@link Thread#sleep(long)}.
     */
    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    /**
     * Blocks for the given duration.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}

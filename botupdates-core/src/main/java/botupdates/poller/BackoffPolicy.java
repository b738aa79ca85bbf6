package botupdates.poller;

/**
 * Computes how long the poller waits after consecutive upstream conflicts.
 *
 * @see LinearBackoffPolicy
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param streak number of consecutive conflicts, 1 for the first
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int streak);
}

package botupdates.poller;

/**
 * Backoff growing by a fixed step per consecutive failure: {@code min(maxDelay, step * streak)}.
 *
 * <p>The default used for 409 conflicts is a 2 second step capped at 60 seconds, so three
 * conflicts in a row wait 2 s, 4 s and 6 s.
 */
public final class LinearBackoffPolicy implements BackoffPolicy {
    private final long stepMs;
    private final long maxDelayMs;

    /**
     * @param stepMs     delay added per failure (milliseconds)
     * @param maxDelayMs maximum delay (milliseconds)
     */
    public LinearBackoffPolicy(long stepMs, long maxDelayMs) {
        if (stepMs <= 0) {
            throw new IllegalArgumentException("stepMs must be > 0, got: " + stepMs);
        }
        if (maxDelayMs < 0) {
            throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
        }
        this.stepMs = stepMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Returns the conflict policy: 2 s per conflict, at most 60 s.
     */
    public static LinearBackoffPolicy conflictDefault() {
        return new LinearBackoffPolicy(2_000L, 60_000L);
    }

    @Override
    public long computeDelayMs(int streak) {
        if (streak <= 0) {
            return 0L;
        }
        // Overflow guard: past this point the product exceeds any sane cap
        if (streak > maxDelayMs / stepMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, stepMs * streak);
    }
}

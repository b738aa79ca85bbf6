package botupdates;

import java.time.Duration;
import java.util.Objects;

/**
 * The Bot API answered 429 and asked the caller to wait before the next request.
 *
 * <p>The poller sleeps for {@link #retryAfter()} (clamped to its configured bounds)
 * without counting the failure as a conflict.
 */
public class UpstreamRateLimitedException extends UpstreamException {

    private final Duration retryAfter;

    /**
     * @param retryAfter server-requested wait
     * @throws NullPointerException     if {@code retryAfter} is null
     * @throws IllegalArgumentException if {@code retryAfter} is negative
     */
    public UpstreamRateLimitedException(Duration retryAfter) {
        super("Rate limited, retry after " + validate(retryAfter).toSeconds() + "s");
        this.retryAfter = retryAfter;
    }

    public UpstreamRateLimitedException(Duration retryAfter, String message) {
        super(message);
        this.retryAfter = validate(retryAfter);
    }

    /**
     * Returns the server-requested wait (never null, never negative).
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    private static Duration validate(Duration retryAfter) {
        Objects.requireNonNull(retryAfter, "retryAfter must not be null");
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        return retryAfter;
    }
}

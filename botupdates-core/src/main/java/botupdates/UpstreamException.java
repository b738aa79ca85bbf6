package botupdates;

/**
 * Failure of a single upstream {@code getUpdates} call.
 *
 * <p>The three subclasses are the only kinds the poller distinguishes. None of them ever
 * reaches a subscriber: the poll loop backs off and tries again.
 *
 * @see UpstreamConflictException
 * @see UpstreamRateLimitedException
 * @see UpstreamFailureException
 */
public abstract class UpstreamException extends RuntimeException {

    protected UpstreamException(String message) {
        super(message);
    }

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}

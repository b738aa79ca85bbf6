package botupdates;

/**
 * Any upstream failure that is neither a conflict nor a rate limit: transport errors,
 * timeouts, non-ok responses, unparseable bodies.
 */
public class UpstreamFailureException extends UpstreamException {
    private final int errorCode;

    public UpstreamFailureException(String message) {
        this(message, 0, null);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    /**
     * @param errorCode Bot API {@code error_code}, or {@code 0} when the failure happened
     *                  before a response was parsed
     */
    public UpstreamFailureException(String message, int errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int errorCode() {
        return errorCode;
    }
}

package botupdates;

/**
 * The Bot API answered 409: another client is already long-polling the same token.
 */
public class UpstreamConflictException extends UpstreamException {

    public UpstreamConflictException(String message) {
        super(message);
    }
}

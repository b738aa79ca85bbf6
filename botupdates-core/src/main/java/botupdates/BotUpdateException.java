package botupdates;

/**
 * Base class for failures surfaced to callers of {@link BotUpdateHub#attach}.
 */
public class BotUpdateException extends RuntimeException {

    public BotUpdateException(String message) {
        super(message);
    }

    public BotUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}

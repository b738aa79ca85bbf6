package botupdates;

/**
 * Thrown when {@link BotUpdateHub#attach(long, java.time.Duration)} gives up before a
 * subscription was created, either because its timeout elapsed or the calling thread was
 * interrupted. In the latter case the interrupt flag is restored.
 */
public class AttachCancelledException extends BotUpdateException {

    public AttachCancelledException(String message) {
        super(message);
    }

    public AttachCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}

package botupdates;

/**
 * No credential record exists for the requested bot, or its token is blank.
 */
public class CredentialNotFoundException extends BotUpdateException {
    private final long botId;

    public CredentialNotFoundException(long botId) {
        super("Bot not found or has no token: " + botId);
        this.botId = botId;
    }

    public long botId() {
        return botId;
    }
}

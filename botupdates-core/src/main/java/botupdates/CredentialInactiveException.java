package botupdates;

/**
 * The credential record exists but is deactivated.
 */
public class CredentialInactiveException extends BotUpdateException {
    private final long botId;

    public CredentialInactiveException(long botId) {
        super("Bot is not active: " + botId);
        this.botId = botId;
    }

    public long botId() {
        return botId;
    }
}

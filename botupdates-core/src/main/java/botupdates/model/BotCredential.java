package botupdates.model;

import java.util.Objects;

/**
 * Source-of-truth view of one bot: its id, current token and whether it is enabled.
 *
 * @param botId  record id
 * @param token  Bot API token; the secret that identifies the upstream endpoint
 * @param active whether polling is allowed for this bot
 */
public record BotCredential(long botId, String token, boolean active) {

    public BotCredential {
        Objects.requireNonNull(token, "token");
        token = token.trim();
    }

    public boolean hasToken() {
        return !token.isEmpty();
    }

    @Override
    public String toString() {
        return "BotCredential{botId=" + botId + ", active=" + active + "}";
    }
}

package botupdates.model;

import java.util.Objects;

/**
 * A chat the bot currently belongs to, as derived from {@code my_chat_member} updates.
 *
 * @param chatId   Telegram chat id
 * @param chatType {@code channel}, {@code group} or {@code supergroup}
 * @param title    chat title (may be {@code null} if Telegram sent none)
 * @param username public username without {@code @}, or {@code null}
 */
public record ChatMembership(long chatId, String chatType, String title, String username) {

    public ChatMembership {
        Objects.requireNonNull(chatType, "chatType");
        if (chatId == 0L) {
            throw new IllegalArgumentException("chatId must not be 0");
        }
    }

    public boolean isBroadcast() {
        return "channel".equals(chatType);
    }
}

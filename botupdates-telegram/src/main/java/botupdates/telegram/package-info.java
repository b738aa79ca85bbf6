/**
 * Telegram Bot API integration: the HTTP {@link botupdates.spi.BotApiClient} and the
 * reconciler that turns {@code my_chat_member} updates into chat-membership records.
 */
package botupdates.telegram;

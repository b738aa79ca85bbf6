package botupdates.spi;

import botupdates.model.ChatMembership;

import java.util.List;

/**
 * Downstream record of which chats each bot belongs to.
 *
 * <p>A chat may be shared by several bots; it is stored once and referenced by one
 * membership row per bot.
 */
public interface ChatMembershipStore {

    /**
     * Inserts or refreshes the chat and the bot's membership in it.
     */
    void upsertMembership(long botId, ChatMembership chat);

    /**
     * Removes the bot's membership. Deletes the chat itself once no bot references it.
     *
     * @return {@code true} if a membership was removed
     */
    boolean removeMembership(long botId, long chatId);

    /**
     * Lists the chats the bot currently belongs to, ordered by chat id.
     */
    List<ChatMembership> findChats(long botId);
}

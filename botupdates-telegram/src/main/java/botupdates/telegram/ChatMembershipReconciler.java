package botupdates.telegram;

import botupdates.BotUpdate;
import botupdates.BotUpdateHub;
import botupdates.UpdateType;
import botupdates.model.ChatMembership;
import botupdates.spi.ChatMembershipStore;
import botupdates.subscription.BotUpdateSubscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies {@code my_chat_member} updates to a {@link ChatMembershipStore}.
 *
 * <p>Joining statuses ({@code creator}, {@code administrator}, {@code member} and
 * {@code restricted} while still a member) upsert the chat and the bot's membership.
 * {@code left} and {@code kicked} remove the membership. Private chats are not tracked.
 */
public final class ChatMembershipReconciler {
  private static final Logger logger = Logger.getLogger(ChatMembershipReconciler.class.getName());

  private static final Set<String> JOINED = Set.of("creator", "administrator", "member", "restricted");
  private static final Set<String> GONE = Set.of("left", "kicked");

  private final ChatMembershipStore store;
  private final ObjectMapper objectMapper;

  public ChatMembershipReconciler(ChatMembershipStore store) {
    this(store, new ObjectMapper());
  }

  public ChatMembershipReconciler(ChatMembershipStore store, ObjectMapper objectMapper) {
    this.store = Objects.requireNonNull(store, "store");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /**
   * Applies the given updates in order. Updates of other kinds are ignored.
   *
   * @param botId   bot whose membership the updates describe
   * @param updates updates as received from a subscription
   * @return number of store changes applied
   */
  public int forceRefreshSince(long botId, List<BotUpdate> updates) {
    Objects.requireNonNull(updates, "updates");
    int changes = 0;
    for (BotUpdate update : updates) {
      if (!update.is(UpdateType.MY_CHAT_MEMBER)) {
        continue;
      }
      try {
        if (apply(botId, update)) {
          changes++;
        }
      } catch (JsonProcessingException | IllegalArgumentException e) {
        logger.log(Level.WARNING, "Skipping malformed my_chat_member update " + update.updateId()
            + " for botId=" + botId, e);
      }
    }
    if (changes > 0) {
      logger.fine("Applied " + changes + " membership change(s) for botId=" + botId);
    }
    return changes;
  }

  /**
   * Attaches to the bot's stream, applies whatever the hub hands over immediately
   * (the buffered {@code my_chat_member} backlog plus anything already queued) and detaches.
   *
   * @return number of store changes applied
   */
  public int reconcileNow(BotUpdateHub hub, long botId) {
    Objects.requireNonNull(hub, "hub");
    try (BotUpdateSubscription subscription = hub.attach(botId)) {
      return forceRefreshSince(botId, subscription.drain());
    }
  }

  private boolean apply(long botId, BotUpdate update) throws JsonProcessingException {
    JsonNode member = objectMapper.readTree(update.payloadJson()).path("my_chat_member");
    JsonNode chat = member.path("chat");
    JsonNode chatId = chat.path("id");
    String chatType = chat.path("type").asText(null);
    if (!chatId.isIntegralNumber() || chatType == null) {
      throw new IllegalArgumentException("my_chat_member.chat lacks id or type");
    }
    if ("private".equals(chatType)) {
      return false;
    }

    JsonNode newMember = member.path("new_chat_member");
    String status = newMember.path("status").asText("");
    boolean stillMember = !"restricted".equals(status) || newMember.path("is_member").asBoolean(true);

    if (JOINED.contains(status) && stillMember) {
      store.upsertMembership(botId, new ChatMembership(
          chatId.asLong(),
          chatType,
          textOrNull(chat, "title"),
          textOrNull(chat, "username")));
      return true;
    }
    if (GONE.contains(status) || JOINED.contains(status)) {
      return store.removeMembership(botId, chatId.asLong());
    }
    logger.fine("Ignoring my_chat_member status '" + status + "' for botId=" + botId);
    return false;
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}

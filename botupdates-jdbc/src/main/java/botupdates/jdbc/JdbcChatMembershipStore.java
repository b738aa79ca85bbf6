package botupdates.jdbc;

import botupdates.model.ChatMembership;
import botupdates.spi.ChatMembershipStore;
import botupdates.spi.ConnectionProvider;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link ChatMembershipStore} over two tables: one row per chat, shared by every bot in it,
 * and one membership row per (bot, chat) pair.
 *
 * <p>Each write runs in its own transaction. A chat row is deleted together with the
 * last membership that references it.
 */
public final class JdbcChatMembershipStore implements ChatMembershipStore {
  private final ConnectionProvider connectionProvider;
  private final String chatTable;
  private final String memberTable;

  public JdbcChatMembershipStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.CHAT, TableNames.CHAT_MEMBER);
  }

  public JdbcChatMembershipStore(ConnectionProvider connectionProvider, String chatTable, String memberTable) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.chatTable = TableNames.validate(chatTable);
    this.memberTable = TableNames.validate(memberTable);
  }

  @Override
  public void upsertMembership(long botId, ChatMembership chat) {
    Objects.requireNonNull(chat, "chat");
    JdbcTemplate.inTransaction(connectionProvider, "upsert chat " + chat.chatId(), conn -> {
      Timestamp now = Timestamp.from(Instant.now());
      int updated = JdbcTemplate.update(conn,
          "UPDATE " + chatTable + " SET chat_type=?, title=?, username=?, updated_at=? WHERE chat_id=?",
          chat.chatType(), chat.title(), chat.username(), now, chat.chatId());
      if (updated == 0) {
        JdbcTemplate.update(conn,
            "INSERT INTO " + chatTable + " (chat_id, chat_type, title, username, updated_at) VALUES (?,?,?,?,?)",
            chat.chatId(), chat.chatType(), chat.title(), chat.username(), now);
      }
      Long existing = JdbcTemplate.queryOne(conn,
          "SELECT bot_id FROM " + memberTable + " WHERE bot_id=? AND chat_id=?",
          rs -> rs.getLong(1), botId, chat.chatId());
      if (existing == null) {
        JdbcTemplate.update(conn,
            "INSERT INTO " + memberTable + " (bot_id, chat_id, joined_at) VALUES (?,?,?)",
            botId, chat.chatId(), now);
      }
      return null;
    });
  }

  @Override
  public boolean removeMembership(long botId, long chatId) {
    return JdbcTemplate.inTransaction(connectionProvider, "remove chat " + chatId, conn -> {
      int removed = JdbcTemplate.update(conn,
          "DELETE FROM " + memberTable + " WHERE bot_id=? AND chat_id=?", botId, chatId);
      JdbcTemplate.update(conn,
          "DELETE FROM " + chatTable + " WHERE chat_id=? AND NOT EXISTS" +
              " (SELECT 1 FROM " + memberTable + " m WHERE m.chat_id=?)",
          chatId, chatId);
      return removed > 0;
    });
  }

  @Override
  public List<ChatMembership> findChats(long botId) {
    return JdbcTemplate.withConnection(connectionProvider, "list chats of bot " + botId, conn -> JdbcTemplate.query(conn,
        "SELECT c.chat_id, c.chat_type, c.title, c.username FROM " + chatTable + " c" +
            " JOIN " + memberTable + " m ON m.chat_id=c.chat_id" +
            " WHERE m.bot_id=? ORDER BY c.chat_id",
        rs -> new ChatMembership(rs.getLong("chat_id"), rs.getString("chat_type"),
            rs.getString("title"), rs.getString("username")),
        botId));
  }
}

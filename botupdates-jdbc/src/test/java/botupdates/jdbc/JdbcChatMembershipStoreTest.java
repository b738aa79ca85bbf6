package botupdates.jdbc;

import botupdates.model.ChatMembership;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcChatMembershipStoreTest {

    private static final ChatMembership NEWS = new ChatMembership(-1001L, "channel", "News", "news");
    private static final ChatMembership TEAM = new ChatMembership(-2002L, "supergroup", "Team", null);

    private JdbcDataSource dataSource;
    private JdbcChatMembershipStore store;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabases.h2();
        store = new JdbcChatMembershipStore(new DataSourceConnectionProvider(dataSource));
    }

    @Test
    void upsertAddsChatAndMembership() {
        store.upsertMembership(1L, NEWS);
        store.upsertMembership(1L, TEAM);

        assertEquals(List.of(TEAM, NEWS), store.findChats(1L));
    }

    @Test
    void upsertRefreshesChatDetails() {
        store.upsertMembership(1L, NEWS);
        ChatMembership renamed = new ChatMembership(NEWS.chatId(), "channel", "Breaking News", "breaking");

        store.upsertMembership(1L, renamed);

        assertEquals(List.of(renamed), store.findChats(1L));
    }

    @Test
    void sharedChatIsStoredOnce() throws SQLException {
        store.upsertMembership(1L, NEWS);
        store.upsertMembership(2L, NEWS);

        assertEquals(1, count("SELECT COUNT(*) FROM bot_chat"));
        assertEquals(2, count("SELECT COUNT(*) FROM bot_chat_member"));
    }

    @Test
    void removeKeepsChatReferencedByAnotherBot() throws SQLException {
        store.upsertMembership(1L, NEWS);
        store.upsertMembership(2L, NEWS);

        assertTrue(store.removeMembership(1L, NEWS.chatId()));

        assertTrue(store.findChats(1L).isEmpty());
        assertEquals(List.of(NEWS), store.findChats(2L));
        assertEquals(1, count("SELECT COUNT(*) FROM bot_chat"));
    }

    @Test
    void removeDeletesOrphanedChat() throws SQLException {
        store.upsertMembership(1L, NEWS);

        assertTrue(store.removeMembership(1L, NEWS.chatId()));

        assertEquals(0, count("SELECT COUNT(*) FROM bot_chat"));
    }

    @Test
    void removeUnknownMembershipReturnsFalse() {
        assertFalse(store.removeMembership(1L, NEWS.chatId()));
    }

    private int count(String sql) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             ResultSet rs = conn.createStatement().executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}

package botupdates.jdbc.cursor;

import botupdates.jdbc.BotUpdateStoreException;
import botupdates.jdbc.DataSourceConnectionProvider;
import botupdates.jdbc.TestDatabases;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcCursorStoreTest {

    private static final String TOKEN = "123456:AAE-secret";

    private JdbcDataSource dataSource;
    private JdbcCursorStore store;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabases.h2();
        store = new JdbcCursorStore(new DataSourceConnectionProvider(dataSource), new H2CursorStore());
    }

    @Test
    void unknownTokenHasNoCursor() {
        assertEquals(OptionalLong.empty(), store.loadCursor(TOKEN));
    }

    @Test
    void saveThenLoad() {
        store.saveCursor(TOKEN, 1001L);

        assertEquals(OptionalLong.of(1001L), store.loadCursor(TOKEN));
    }

    @Test
    void cursorAdvances() {
        store.saveCursor(TOKEN, 10L);
        store.saveCursor(TOKEN, 25L);

        assertEquals(OptionalLong.of(25L), store.loadCursor(TOKEN));
    }

    @Test
    void cursorNeverMovesBackwards() {
        store.saveCursor(TOKEN, 25L);
        store.saveCursor(TOKEN, 10L);
        store.saveCursor(TOKEN, 25L);

        assertEquals(OptionalLong.of(25L), store.loadCursor(TOKEN));
    }

    @Test
    void tokensAreIndependent() {
        store.saveCursor(TOKEN, 5L);
        store.saveCursor("999:other", 7L);

        assertEquals(OptionalLong.of(5L), store.loadCursor(TOKEN));
        assertEquals(OptionalLong.of(7L), store.loadCursor("999:other"));
    }

    @Test
    void tokenIsStoredAsDigest() throws SQLException {
        store.saveCursor(TOKEN, 5L);

        try (Connection conn = dataSource.getConnection();
             ResultSet rs = conn.createStatement().executeQuery("SELECT token_hash FROM bot_update_cursor")) {
            assertTrue(rs.next());
            String key = rs.getString(1);
            assertEquals(64, key.length());
            assertFalse(key.contains("secret"));
            assertEquals(AbstractJdbcCursorStore.tokenKey(TOKEN), key);
        }
    }

    @Test
    void tokenKeyIsStableSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                AbstractJdbcCursorStore.tokenKey(""));
    }

    @Test
    void missingTableIsWrapped() {
        JdbcCursorStore broken = new JdbcCursorStore(
                new DataSourceConnectionProvider(dataSource), new H2CursorStore("missing_cursor"));

        assertThrows(BotUpdateStoreException.class, () -> broken.saveCursor(TOKEN, 1L));
    }
}

package botupdates.jdbc.cursor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialectUpsertSqlTest {

    @Test
    void mySqlUpsertNeverLowersCursor() {
        String sql = new MySqlCursorStore("tg_cursor").upsertSql();

        assertTrue(sql.startsWith("INSERT INTO tg_cursor "));
        assertTrue(sql.contains("ON DUPLICATE KEY UPDATE"));
        assertTrue(sql.contains("next_offset=GREATEST(next_offset, VALUES(next_offset))"));
    }

    @Test
    void postgresUpsertNeverLowersCursor() {
        String sql = new PostgresCursorStore("tg_cursor").upsertSql();

        assertTrue(sql.startsWith("INSERT INTO tg_cursor AS c "));
        assertTrue(sql.contains("ON CONFLICT (token_hash) DO UPDATE"));
        assertTrue(sql.contains("WHERE c.next_offset < EXCLUDED.next_offset"));
    }

    @Test
    void rejectsInvalidTableName() {
        assertThrows(IllegalArgumentException.class, () -> new PostgresCursorStore("cursor;--"));
    }
}

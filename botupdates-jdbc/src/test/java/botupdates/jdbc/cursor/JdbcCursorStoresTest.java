package botupdates.jdbc.cursor;

import botupdates.jdbc.TestDatabases;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcCursorStoresTest {

    @Test
    void allReturnsBuiltInCursorStores() {
        List<AbstractJdbcCursorStore> stores = JdbcCursorStores.all();

        assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertEquals("mysql", JdbcCursorStores.get("MySQL").name());
        assertEquals("postgresql", JdbcCursorStores.get("POSTGRESQL").name());
    }

    @Test
    void getByNameThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcCursorStores.get("oracle"));
        assertTrue(ex.getMessage().contains("oracle"));
    }

    @Test
    void detectFromJdbcUrl() {
        assertEquals("mysql", JdbcCursorStores.detect("jdbc:mysql://localhost:3306/bots").name());
        assertEquals("mysql", JdbcCursorStores.detect("jdbc:mariadb://localhost:3306/bots").name());
        assertEquals("postgresql", JdbcCursorStores.detect("jdbc:postgresql://localhost:5432/bots").name());
        assertEquals("h2", JdbcCursorStores.detect("jdbc:h2:mem:bots").name());
    }

    @Test
    void detectFromDataSource() {
        assertEquals("h2", JdbcCursorStores.detect(TestDatabases.h2()).name());
    }

    @Test
    void detectRejectsUnknownUrl() {
        assertThrows(IllegalArgumentException.class, () -> JdbcCursorStores.detect("jdbc:oracle:thin:@db"));
        assertThrows(IllegalArgumentException.class, () -> JdbcCursorStores.detect(""));
    }

    @Test
    void withTableNameKeepsDialect() {
        AbstractJdbcCursorStore custom = JdbcCursorStores.get("postgresql").withTableName("tg_cursor");

        assertEquals("postgresql", custom.name());
        assertEquals("tg_cursor", custom.tableName());
    }
}

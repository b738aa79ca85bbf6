package botupdates.jdbc.cursor;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC cursor stores with auto-detection support.
 *
 * <p>Cursor stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/botupdates.jdbc.cursor.AbstractJdbcCursorStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcCursorStore dialect = JdbcCursorStores.detect(dataSource);
 * CursorStore cursors = new JdbcCursorStore(new DataSourceConnectionProvider(dataSource), dialect);
 *
 * // Get by name
 * AbstractJdbcCursorStore pg = JdbcCursorStores.get("postgresql");
 * }</pre>
 */
public final class JdbcCursorStores {

    private static final List<AbstractJdbcCursorStore> STORES;
    private static final Map<String, AbstractJdbcCursorStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcCursorStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcCursorStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcCursorStores() {
    }

    /**
     * Returns all registered cursor stores.
     */
    public static List<AbstractJdbcCursorStore> all() {
        return STORES;
    }

    /**
     * Gets a cursor store by name.
     *
     * @param name cursor store name (case-insensitive)
     * @return the cursor store
     * @throws IllegalArgumentException if no cursor store found
     */
    public static AbstractJdbcCursorStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcCursorStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown cursor store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the cursor store from a DataSource.
     *
     * @throws IllegalStateException if detection fails or no matching cursor store
     */
    public static AbstractJdbcCursorStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect cursor store from DataSource", e);
        }
    }

    /**
     * Auto-detects the cursor store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no matching cursor store found
     */
    public static AbstractJdbcCursorStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        for (AbstractJdbcCursorStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No cursor store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}

package botupdates.jdbc.cursor;

import botupdates.jdbc.JdbcTemplate;
import botupdates.jdbc.TableNames;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.OptionalLong;

/**
 * Base JDBC cursor store with standard SQL implementations.
 *
 * <p>Rows are keyed by the SHA-256 hex digest of the bot token, so the secret itself is
 * never written to the database. Writes are monotonic: a stored cursor is never moved
 * backwards, even when two processes share the table.
 *
 * <p>Subclasses override {@link #upsert} with a single-statement dialect upsert. Register
 * custom implementations via
 * {@code META-INF/services/botupdates.jdbc.cursor.AbstractJdbcCursorStore}.
 *
 * @see JdbcCursorStores
 * @see JdbcCursorStore
 */
public abstract class AbstractJdbcCursorStore {

  private final String tableName;

  protected AbstractJdbcCursorStore() {
    this(TableNames.CURSOR);
  }

  protected AbstractJdbcCursorStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this cursor store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this cursor store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store that uses a different table.
   */
  public abstract AbstractJdbcCursorStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  /**
   * Reads the stored cursor.
   *
   * @param conn     open connection
   * @param tokenKey digest from {@link #tokenKey(String)}
   */
  public OptionalLong load(Connection conn, String tokenKey) {
    Long value = JdbcTemplate.queryOne(conn,
        "SELECT next_offset FROM " + tableName() + " WHERE token_hash=?",
        rs -> rs.getLong(1), tokenKey);
    return value == null ? OptionalLong.empty() : OptionalLong.of(value);
  }

  /**
   * Stores {@code cursor} unless the stored value is already greater or equal.
   *
   * <p>The default runs a guarded update and falls back to an insert when no row exists.
   * It expects auto-commit or an enclosing transaction.
   *
   * @param conn     open connection
   * @param tokenKey digest from {@link #tokenKey(String)}
   * @param cursor   next offset to persist
   */
  public void upsert(Connection conn, String tokenKey, long cursor) {
    Timestamp now = Timestamp.from(Instant.now());
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET next_offset=?, updated_at=? WHERE token_hash=? AND next_offset<?",
        cursor, now, tokenKey, cursor);
    if (updated > 0 || load(conn, tokenKey).isPresent()) {
      return;
    }
    JdbcTemplate.update(conn,
        "INSERT INTO " + tableName() + " (token_hash, next_offset, updated_at) VALUES (?,?,?)",
        tokenKey, cursor, now);
  }

  /**
   * Returns the lowercase SHA-256 hex digest of the token.
   */
  public static String tokenKey(String token) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}

package botupdates.jdbc.cursor;

import botupdates.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL cursor store.
 *
 * <p>Uses {@code INSERT ... ON CONFLICT DO UPDATE} guarded by a {@code WHERE} clause so the
 * stored cursor only moves forward.
 */
public final class PostgresCursorStore extends AbstractJdbcCursorStore {

  public PostgresCursorStore() {
    super();
  }

  public PostgresCursorStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcCursorStore withTableName(String tableName) {
    return new PostgresCursorStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void upsert(Connection conn, String tokenKey, long cursor) {
    JdbcTemplate.update(conn, upsertSql(), tokenKey, cursor, Timestamp.from(Instant.now()));
  }

  String upsertSql() {
    return "INSERT INTO " + tableName() + " AS c (token_hash, next_offset, updated_at) VALUES (?,?,?)" +
        " ON CONFLICT (token_hash) DO UPDATE" +
        " SET next_offset=GREATEST(c.next_offset, EXCLUDED.next_offset), updated_at=EXCLUDED.updated_at" +
        " WHERE c.next_offset < EXCLUDED.next_offset";
  }
}

package botupdates.jdbc.cursor;

import botupdates.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * MySQL / TiDB cursor store.
 *
 * <p>Uses {@code INSERT ... ON DUPLICATE KEY UPDATE} with {@code GREATEST} so the stored
 * cursor only moves forward.
 */
public final class MySqlCursorStore extends AbstractJdbcCursorStore {

  public MySqlCursorStore() {
    super();
  }

  public MySqlCursorStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcCursorStore withTableName(String tableName) {
    return new MySqlCursorStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public void upsert(Connection conn, String tokenKey, long cursor) {
    JdbcTemplate.update(conn, upsertSql(), tokenKey, cursor, Timestamp.from(Instant.now()));
  }

  String upsertSql() {
    // updated_at is assigned first because MySQL evaluates assignments left to right
    return "INSERT INTO " + tableName() + " (token_hash, next_offset, updated_at) VALUES (?,?,?)" +
        " ON DUPLICATE KEY UPDATE" +
        " updated_at=IF(VALUES(next_offset)>next_offset, VALUES(updated_at), updated_at)," +
        " next_offset=GREATEST(next_offset, VALUES(next_offset))";
  }
}

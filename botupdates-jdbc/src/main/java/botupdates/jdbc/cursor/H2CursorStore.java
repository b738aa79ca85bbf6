package botupdates.jdbc.cursor;

import java.util.List;

/**
 * H2 cursor store. Primarily for testing.
 *
 * <p>Uses the default update-then-insert from {@link AbstractJdbcCursorStore}.
 */
public final class H2CursorStore extends AbstractJdbcCursorStore {

  public H2CursorStore() {
    super();
  }

  public H2CursorStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcCursorStore withTableName(String tableName) {
    return new H2CursorStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}

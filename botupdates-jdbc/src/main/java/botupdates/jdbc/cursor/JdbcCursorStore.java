package botupdates.jdbc.cursor;

import botupdates.jdbc.JdbcTemplate;
import botupdates.spi.ConnectionProvider;
import botupdates.spi.CursorStore;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * {@link CursorStore} that runs each call on its own auto-commit connection, delegating
 * the SQL to a dialect-specific {@link AbstractJdbcCursorStore}.
 */
public final class JdbcCursorStore implements CursorStore {
  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcCursorStore dialect;

  public JdbcCursorStore(ConnectionProvider connectionProvider, AbstractJdbcCursorStore dialect) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  public OptionalLong loadCursor(String token) {
    String key = AbstractJdbcCursorStore.tokenKey(token);
    return JdbcTemplate.withConnection(connectionProvider, "load cursor", conn -> dialect.load(conn, key));
  }

  @Override
  public void saveCursor(String token, long cursor) {
    String key = AbstractJdbcCursorStore.tokenKey(token);
    JdbcTemplate.withConnection(connectionProvider, "save cursor", conn -> {
      dialect.upsert(conn, key, cursor);
      return null;
    });
  }

  public AbstractJdbcCursorStore dialect() {
    return dialect;
  }
}

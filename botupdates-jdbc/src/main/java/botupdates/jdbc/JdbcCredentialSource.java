package botupdates.jdbc;

import botupdates.model.BotCredential;
import botupdates.spi.ConnectionProvider;
import botupdates.spi.CredentialSource;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link CredentialSource} reading the bot table ({@code id}, {@code token}, {@code is_active}).
 *
 * <p>A {@code NULL} token is reported as an empty one, which the hub treats as a missing bot.
 */
public final class JdbcCredentialSource implements CredentialSource {
  private final ConnectionProvider connectionProvider;
  private final String sql;

  public JdbcCredentialSource(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.BOT);
  }

  public JdbcCredentialSource(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.sql = "SELECT id, token, is_active FROM " + TableNames.validate(tableName) + " WHERE id=?";
  }

  @Override
  public Optional<BotCredential> findCredential(long botId) {
    BotCredential credential = JdbcTemplate.withConnection(connectionProvider, "load bot " + botId,
        conn -> JdbcTemplate.queryOne(conn, sql, rs -> {
          String token = rs.getString("token");
          return new BotCredential(rs.getLong("id"), token == null ? "" : token, rs.getBoolean("is_active"));
        }, botId));
    return Optional.ofNullable(credential);
  }
}

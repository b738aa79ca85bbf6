package botupdates.jdbc;

import botupdates.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Static JDBC helpers shared by the cursor, credential and chat-membership stores.
 *
 * <p>Every {@link SQLException} is rethrown as {@link BotUpdateStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }

  /**
   * Runs {@code work} on a fresh auto-commit connection and closes it afterwards.
   *
   * @param operation short description used in the exception message
   */
  public static <T> T withConnection(ConnectionProvider provider, String operation,
      ConnectionCallback<T> work) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(true);
      return work.doInConnection(conn);
    } catch (SQLException e) {
      throw new BotUpdateStoreException("Failed to " + operation, e);
    }
  }

  /**
   * Runs {@code work} in one transaction. Any exception rolls the transaction back.
   *
   * @param operation short description used in the exception message
   */
  public static <T> T inTransaction(ConnectionProvider provider, String operation,
      ConnectionCallback<T> work) {
    try (Connection conn = provider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.doInConnection(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new BotUpdateStoreException("Failed to " + operation, e);
    }
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new BotUpdateStoreException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new BotUpdateStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT expecting at most one row; returns {@code null} when there is none. */
  public static <T> T queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? null : rows.get(0);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private JdbcTemplate() {}
}

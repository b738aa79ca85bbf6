/**
 * JDBC-based {@link botupdates.spi.CursorStore} implementations.
 *
 * <p>{@link botupdates.jdbc.cursor.AbstractJdbcCursorStore} provides shared SQL; subclasses
 * supply database-specific monotonic upserts: H2 (guarded update, then insert),
 * MySQL ({@code ON DUPLICATE KEY UPDATE ... GREATEST}) and PostgreSQL
 * ({@code ON CONFLICT ... DO UPDATE ... WHERE}).
 *
 * @see botupdates.jdbc.cursor.AbstractJdbcCursorStore
 * @see botupdates.jdbc.cursor.JdbcCursorStores
 * @see botupdates.jdbc.cursor.JdbcCursorStore
 */
package botupdates.jdbc.cursor;

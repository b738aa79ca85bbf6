/**
 * JDBC implementations of the storage SPIs.
 *
 * <p>{@link botupdates.jdbc.JdbcCredentialSource} reads bot records,
 * {@link botupdates.jdbc.JdbcChatMembershipStore} keeps the chats each bot belongs to, and
 * the {@linkplain botupdates.jdbc.cursor cursor stores} persist poll offsets. DDL for H2,
 * MySQL and PostgreSQL ships under {@code schema/} on the classpath.
 *
 * @see botupdates.jdbc.JdbcTemplate
 * @see botupdates.jdbc.DataSourceConnectionProvider
 */
package botupdates.jdbc;

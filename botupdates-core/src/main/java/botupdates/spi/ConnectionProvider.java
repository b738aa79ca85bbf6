package botupdates.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the cursor, credential and chat-membership stores.
 *
 * <p>Every store borrows a connection per call and closes it before returning, so a pooled
 * provider is expected. {@code dataSource::getConnection} is a valid implementation.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}

package io.healing.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to the queue, worker, inspector and retention scheduler.
 *
 * <p>Callers close the returned connection.
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

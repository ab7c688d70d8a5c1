package io.eventlog.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the repository, failure tracker, retry worker and admin
 * facade. Each of them opens a connection per unit of work and manages its transaction.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see io.eventlog.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}

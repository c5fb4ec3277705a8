package banstore.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for store operations that run outside a caller's transaction
 * (implicit per-call transactions, lazy scans, delta cursors).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see banstore.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}

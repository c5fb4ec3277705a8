/**
 * JDBC plumbing shared by the address stores: statement helpers, table name validation
 * and {@link banstore.spi.ConnectionProvider} implementations.
 *
 * @see banstore.jdbc.JdbcTemplate
 * @see banstore.jdbc.DataSourceConnectionProvider
 * @see banstore.jdbc.SingleConnectionProvider
 */
package banstore.jdbc;

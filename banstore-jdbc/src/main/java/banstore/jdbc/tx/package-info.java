/**
 * Manual JDBC transaction management.
 *
 * <p>{@link banstore.jdbc.tx.JdbcTransactionManager} provides a lightweight
 * try-with-resources API for grouping several ban store operations into one transaction
 * with {@link banstore.jdbc.tx.ThreadLocalTxContext}.
 *
 * @see banstore.jdbc.tx.JdbcTransactionManager
 * @see banstore.jdbc.tx.ThreadLocalTxContext
 */
package banstore.jdbc.tx;

package banstore.spi;

import java.sql.Connection;

/**
 * Abstracts the caller's transaction so store operations can join it without depending
 * on a specific transaction manager. When no transaction is active, each store operation
 * runs in its own implicit transaction.
 *
 * <p>Implementations: {@link banstore.jdbc.tx.ThreadLocalTxContext} (manual JDBC),
 * {@code banstore.spring.SpringTxContext} (Spring-managed).
 *
 * @see banstore.jdbc.tx.ThreadLocalTxContext
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction. The store never closes it.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits.
   *
   * @param callback action to execute post-commit
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);

  /**
   * Registers a callback to run after the current transaction rolls back.
   *
   * @param callback action to execute post-rollback
   * @throws IllegalStateException if no transaction is active
   */
  void afterRollback(Runnable callback);
}

package banstore.jdbc.tx;

import banstore.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection, disables
 * auto-commit, applies the isolation level and binds the connection to a
 * {@link ThreadLocalTxContext}. Ban store operations on the same thread join it.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     banStore.incrementFailedLogin("10.0.0.1", now, 1);
 *     banStore.applyBan("10.0.0.1", now, now.plus(ban), now);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;
  private final int isolationLevel;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this(connectionProvider, txContext, Connection.TRANSACTION_SERIALIZABLE);
  }

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext,
      int isolationLevel) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.isolationLevel = isolationLevel;
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained or configured
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      connection.setTransactionIsolation(isolationLevel);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.setAutoCommit(true);
      } catch (SQLException suppressed) {
        e.addSuppressed(suppressed);
      } finally {
        connection.close();
      }
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(boolean committed) throws SQLException {
      RuntimeException callbackException = null;
      try {
        if (committed) {
          txContext.clearAfterCommit();
        } else {
          txContext.clearAfterRollback();
        }
      } catch (RuntimeException e) {
        callbackException = e;
      } finally {
        completed = true;
        try {
          connection.setAutoCommit(true);
        } catch (SQLException e) {
          if (callbackException != null) callbackException.addSuppressed(e);
        } finally {
          connection.close();
        }
      }
      if (callbackException != null) {
        throw callbackException;
      }
    }

    private void safeRollback(SQLException cause) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        cause.addSuppressed(e);
      }
    }
  }
}

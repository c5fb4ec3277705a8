package banstore.spring;

import banstore.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} that lets ban store operations join Spring-managed transactions.
 *
 * <p>The transaction's connection is looked up through {@link DataSourceUtils}, so the
 * {@link DataSource} must be the one the Spring transaction manager was built on.
 * Metrics callbacks are registered as {@link TransactionSynchronization}s and fire only
 * once Spring has committed or rolled back.
 *
 * <p>Isolation is governed by the Spring transaction definition. The ban store's own
 * isolation setting applies only to work it runs outside a Spring transaction.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active Spring transaction");
    }
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    register("afterCommit", new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        callback.run();
      }
    });
  }

  @Override
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    register("afterRollback", new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_ROLLED_BACK) {
          callback.run();
        }
      }
    });
  }

  private void register(String operation, TransactionSynchronization synchronization) {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active Spring transaction");
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register " + operation + " callback");
    }
    TransactionSynchronizationManager.registerSynchronization(synchronization);
  }
}

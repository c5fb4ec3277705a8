package banstore;

import banstore.model.AddressDelta;
import banstore.model.AddressEntry;
import banstore.model.AddressState;
import banstore.spi.AddressStore;
import banstore.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Lazy, transactional walk over pending firewall changes.
 *
 * <p>Each {@link #next()} reads one pending row and maps it to an {@link AddressDelta}:
 * ADD_PENDING yields {@code added=true}, REMOVE_PENDING and
 * REMOVE_PENDING_BECOME_FAILED_LOGIN yield {@code added=false}. Nothing is written until
 * {@link #commit(Instant, boolean)}; {@link #rollback()} or {@link #close()} without a
 * commit leaves every row as it was, so the same deltas come back next time.
 *
 * <p>When opened inside a caller transaction the cursor neither commits nor rolls back
 * the connection; it only applies (or skips) the terminal transitions, and its metrics
 * wait for the caller's commit.
 *
 * <p>Not thread-safe.
 */
public final class DeltaCursor implements Iterator<AddressDelta>, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeltaCursor.class.getName());

  private final Connection conn;
  private final boolean ownsTransaction;
  private final AddressStore addressStore;
  private final MetricsExporter metrics;
  private final Consumer<Runnable> reporter;
  private final Stream<AddressEntry> rows;
  private final Iterator<AddressEntry> iterator;
  private final List<AddressEntry> yielded = new ArrayList<>();
  private boolean finished;

  private DeltaCursor(Connection conn, boolean ownsTransaction, AddressStore addressStore,
      MetricsExporter metrics, Consumer<Runnable> reporter, Stream<AddressEntry> rows) {
    this.conn = conn;
    this.ownsTransaction = ownsTransaction;
    this.addressStore = addressStore;
    this.metrics = metrics;
    this.reporter = reporter;
    this.rows = rows;
    this.iterator = rows.iterator();
  }

  static DeltaCursor open(Connection conn, boolean ownsTransaction, AddressStore addressStore,
      MetricsExporter metrics, Consumer<Runnable> reporter) {
    Stream<AddressEntry> rows;
    try {
      rows = addressStore.scanPending(conn);
    } catch (RuntimeException e) {
      if (ownsTransaction) {
        BanStore.rollbackQuietly(conn);
        BanStore.release(conn);
      }
      throw e;
    }
    return new DeltaCursor(conn, ownsTransaction, addressStore, metrics, reporter, rows);
  }

  @Override
  public boolean hasNext() {
    if (finished) {
      return false;
    }
    try {
      return iterator.hasNext();
    } catch (RuntimeException e) {
      abort();
      throw e;
    }
  }

  @Override
  public AddressDelta next() {
    if (finished) {
      throw new NoSuchElementException("Delta cursor is closed");
    }
    AddressEntry entry;
    try {
      entry = iterator.next();
    } catch (NoSuchElementException e) {
      throw e;
    } catch (RuntimeException e) {
      abort();
      throw e;
    }
    yielded.add(entry);
    return new AddressDelta(entry.addressText(), entry.state() == AddressState.ADD_PENDING);
  }

  /**
   * Applies the terminal transitions to every yielded row and, when the cursor owns its
   * transaction, commits.
   *
   * @param now                   current time, the new {@code lastFailedLogin} of rows
   *                              returning to FAILED_LOGIN
   * @param resetFailedLoginCount whether updated rows get their counter reset to 0
   * @throws IllegalStateException if the cursor is not exhausted or already finished; the
   *                               reconciliation is rolled back
   */
  public void commit(Instant now, boolean resetFailedLoginCount) {
    Objects.requireNonNull(now, "now");
    if (finished) {
      throw new IllegalStateException("Delta cursor already finished");
    }
    if (hasNext()) {
      abort();
      throw new IllegalStateException("Delta cursor committed before it was exhausted");
    }
    int added = 0;
    for (AddressEntry entry : yielded) {
      if (entry.state() == AddressState.ADD_PENDING) {
        added++;
      }
    }
    int removed = yielded.size() - added;
    try {
      addressStore.completePending(conn, yielded, now, resetFailedLoginCount);
      if (ownsTransaction) {
        conn.commit();
      }
    } catch (SQLException e) {
      abort();
      throw new AddressStoreException("Failed to commit reconciliation", e);
    } catch (RuntimeException e) {
      abort();
      throw e;
    }
    finish();
    int addedCount = added;
    reporter.accept(() -> {
      metrics.recordDeltasCommitted(addedCount, removed);
      metrics.incrementReconcileCommitted();
    });
    if (!yielded.isEmpty()) {
      logger.log(Level.INFO, "Reconciled {0} firewall changes ({1} added, {2} removed)",
          new Object[] {yielded.size(), added, removed});
    }
  }

  /** Discards the reconciliation. No-op if already finished. */
  public void rollback() {
    if (!finished) {
      abort();
    }
  }

  /** Same as {@link #rollback()}. */
  @Override
  public void close() {
    rollback();
  }

  private void abort() {
    if (finished) {
      return;
    }
    if (ownsTransaction) {
      BanStore.rollbackQuietly(conn);
    }
    finish();
    reporter.accept(metrics::incrementReconcileRolledBack);
  }

  private void finish() {
    finished = true;
    try {
      rows.close();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Failed to close pending scan", e);
    }
    if (ownsTransaction) {
      BanStore.release(conn);
    }
  }
}

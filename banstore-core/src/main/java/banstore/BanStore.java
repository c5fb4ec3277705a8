package banstore;

import banstore.model.AddressDelta;
import banstore.model.AddressEntry;
import banstore.model.AddressRange;
import banstore.model.AddressState;
import banstore.model.BanRequest;
import banstore.model.BanWindow;
import banstore.model.EntryFilter;
import banstore.model.IpAddress;
import banstore.spi.AddressStore;
import banstore.spi.ConnectionProvider;
import banstore.spi.MetricsExporter;
import banstore.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for the policy engine and the firewall sync driver.
 *
 * <p>Every operation joins the transaction active on the calling thread (see
 * {@link TxContext}); in that case commit and rollback belong to the caller. Without an
 * active transaction, each operation runs in its own implicit transaction on a connection
 * checked out for the duration of the call, and is rolled back before any failure
 * propagates.
 *
 * <p>Implicit writes of one address by threads sharing this instance take turns: a
 * per-address lock is held from after the connection is checked out until the implicit
 * transaction ends. Writes joining a caller's transaction are not locked.
 *
 * <p>Malformed address text never throws: the operation is skipped and reports
 * {@code false}, {@code 0} or empty.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see DeltaCursor
 * @see AddressStore
 */
public final class BanStore {
  private static final Logger logger = Logger.getLogger(BanStore.class.getName());
  private static final int LOCK_STRIPES = 64;

  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;
  private final AddressStore addressStore;
  private final MetricsExporter metrics;
  private final int isolationLevel;
  private final ReentrantLock[] addressLocks = new ReentrantLock[LOCK_STRIPES];

  private BanStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(builder.txContext, "txContext");
    this.addressStore = Objects.requireNonNull(builder.addressStore, "addressStore");
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    int level = builder.isolationLevel == null
        ? addressStore.defaultIsolationLevel()
        : builder.isolationLevel;
    if (!isValidIsolation(level)) {
      throw new IllegalArgumentException("Unsupported isolation level: " + level);
    }
    this.isolationLevel = level;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      addressLocks[i] = new ReentrantLock();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── failed logins and bans ──────────────────────────────────────

  /**
   * Counts a failed login. Only rows in {@link AddressState#FAILED_LOGIN} (or absent rows,
   * which are created) are incremented; banned or pending rows keep their counter.
   *
   * @param address address text
   * @param when    time of the failed login; becomes {@code lastFailedLogin}
   * @param amount  increment, not negative
   * @return the counter after the attempted update, or 0 if the address is malformed
   * @throws IllegalArgumentException if {@code amount} is negative
   */
  public int incrementFailedLogin(String address, Instant when, int amount) {
    Objects.requireNonNull(when, "when");
    if (amount < 0) {
      throw new IllegalArgumentException("amount must not be negative: " + amount);
    }
    Optional<IpAddress> parsed = IpAddress.tryParse(address);
    if (parsed.isEmpty()) {
      return 0;
    }
    int count = inTransaction(List.of(parsed.get()),
        conn -> addressStore.incrementFailedLogin(conn, parsed.get(), when, amount));
    record(() -> metrics.incrementFailedLoginsReported(amount));
    return count;
  }

  /**
   * Records a ban unless the address already holds an unexpired ban or is pending removal.
   *
   * @param address address text
   * @param start   ban start
   * @param end     ban end
   * @param now     current time
   * @return {@code true} if the ban was newly applied (inserted or reopened)
   */
  public boolean applyBan(String address, Instant start, Instant end, Instant now) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    Objects.requireNonNull(now, "now");
    Optional<IpAddress> parsed = IpAddress.tryParse(address);
    if (parsed.isEmpty()) {
      return false;
    }
    int affected = inTransaction(List.of(parsed.get()),
        conn -> addressStore.upsertBan(conn, parsed.get(), start, end, now));
    if (affected != 0) {
      record(() -> metrics.incrementBansApplied(affected));
    }
    return affected != 0;
  }

  /**
   * Applies several bans atomically. Malformed addresses are skipped.
   *
   * @param bans ban requests
   * @param now  current time
   * @return the number of bans newly applied
   */
  public int applyBans(Collection<BanRequest> bans, Instant now) {
    Objects.requireNonNull(bans, "bans");
    Objects.requireNonNull(now, "now");
    List<BanRequest> requests = new ArrayList<>();
    List<IpAddress> keys = new ArrayList<>();
    for (BanRequest ban : bans) {
      Optional<IpAddress> parsed = IpAddress.tryParse(ban.address());
      if (parsed.isPresent()) {
        requests.add(ban);
        keys.add(parsed.get());
      }
    }
    int applied = inTransaction(keys, conn -> {
      int count = 0;
      for (int i = 0; i < requests.size(); i++) {
        BanRequest ban = requests.get(i);
        count += addressStore.upsertBan(conn, keys.get(i), ban.start(), ban.end(), now);
      }
      return count;
    });
    if (applied != 0) {
      record(() -> metrics.incrementBansApplied(applied));
    }
    return applied;
  }

  // ── lookups ─────────────────────────────────────────────────────

  public Optional<AddressEntry> getEntry(String address) {
    Optional<IpAddress> parsed = IpAddress.tryParse(address);
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    return withConnection(conn -> addressStore.find(conn, parsed.get()));
  }

  public Optional<AddressState> getState(String address) {
    Optional<IpAddress> parsed = IpAddress.tryParse(address);
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    return withConnection(conn -> addressStore.findState(conn, parsed.get()));
  }

  /**
   * Returns the recorded ban window, which may already have expired. Empty if the address
   * is malformed, absent, or has no ban window.
   */
  public Optional<BanWindow> getBanWindow(String address) {
    Optional<IpAddress> parsed = IpAddress.tryParse(address);
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    return withConnection(conn -> addressStore.findBanWindow(conn, parsed.get()));
  }

  public int count() {
    return withConnection(addressStore::count);
  }

  /** Counts rows that carry a ban start date, in any state. */
  public int countBanned() {
    return withConnection(addressStore::countBanned);
  }

  public int countByState(AddressState state) {
    Objects.requireNonNull(state, "state");
    return withConnection(conn -> addressStore.countByState(conn, state));
  }

  /**
   * Lazily enumerates rows matching {@code filter} in address order.
   *
   * <p>The stream holds a connection until closed; use try-with-resources. Outside a
   * transaction the scan runs in auto-commit mode without snapshot isolation.
   */
  public Stream<AddressEntry> streamEntries(EntryFilter filter) {
    Objects.requireNonNull(filter, "filter");
    return scan(conn -> addressStore.scan(conn, filter));
  }

  /** Eagerly collects {@link #streamEntries(EntryFilter)}. */
  public List<AddressEntry> listEntries(EntryFilter filter) {
    try (Stream<AddressEntry> entries = streamEntries(filter)) {
      return entries.collect(Collectors.toList());
    }
  }

  /**
   * Lazily enumerates the text of addresses whose ban is enforced by the firewall
   * ({@link AddressState#ACTIVE}). Must be closed.
   */
  public Stream<String> streamBannedAddresses() {
    return scan(addressStore::scanBanned);
  }

  // ── state machine ───────────────────────────────────────────────

  /**
   * Forces the state of the given addresses, atomically. Malformed entries are skipped.
   *
   * @param addresses address texts; {@code null} is treated as an empty collection
   * @param state     target state
   * @return the number of rows updated
   */
  public int setState(Collection<String> addresses, AddressState state) {
    Objects.requireNonNull(state, "state");
    if (addresses == null || addresses.isEmpty()) {
      return 0;
    }
    return inTransaction(conn -> {
      int count = 0;
      for (String address : addresses) {
        Optional<IpAddress> parsed = IpAddress.tryParse(address);
        if (parsed.isPresent()) {
          count += addressStore.updateState(conn, parsed.get(), state);
        }
      }
      return count;
    });
  }

  /**
   * Forces the state of every row.
   *
   * @return the number of rows updated
   */
  public int setStateForAll(AddressState state) {
    Objects.requireNonNull(state, "state");
    return inTransaction(conn -> addressStore.updateAllStates(conn, state));
  }

  /**
   * Opens a cursor over the pending firewall changes. The cursor owns a transaction (or
   * joins the caller's) until {@link DeltaCursor#commit} or {@link DeltaCursor#rollback};
   * use try-with-resources so abandoning it rolls back.
   */
  public DeltaCursor openDeltaCursor() {
    if (txContext.isTransactionActive()) {
      return DeltaCursor.open(txContext.currentConnection(), false, addressStore, metrics,
          this::record);
    }
    Connection conn = begin();
    return DeltaCursor.open(conn, true, addressStore, metrics, this::record);
  }

  /**
   * Enumerates pending firewall changes, handing each one to {@code applier} before the
   * next is read, then either commits the terminal transitions or rolls back.
   *
   * <p>If {@code applier} throws, the reconciliation is rolled back and the exception
   * propagates; the same deltas are produced by the next call.
   *
   * @param commit                whether to apply terminal transitions after enumeration
   * @param now                   current time
   * @param resetFailedLoginCount whether updated rows get their counter reset to 0
   * @param applier               applies one delta to the firewall
   * @return the deltas handed to {@code applier}, in order
   */
  public List<AddressDelta> enumerateDeltaAndUpdateState(boolean commit, Instant now,
      boolean resetFailedLoginCount, Consumer<AddressDelta> applier) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(applier, "applier");
    List<AddressDelta> applied = new ArrayList<>();
    try (DeltaCursor cursor = openDeltaCursor()) {
      while (cursor.hasNext()) {
        AddressDelta delta = cursor.next();
        applier.accept(delta);
        applied.add(delta);
      }
      if (commit) {
        cursor.commit(now, resetFailedLoginCount);
      } else {
        cursor.rollback();
      }
    }
    return applied;
  }

  // ── deletion ────────────────────────────────────────────────────

  /**
   * Deletes one address.
   *
   * @return {@code true} if a row was deleted
   */
  public boolean deleteAddress(String address) {
    Optional<IpAddress> parsed = IpAddress.tryParse(address);
    if (parsed.isEmpty()) {
      return false;
    }
    return inTransaction(conn -> addressStore.delete(conn, parsed.get())) != 0;
  }

  /**
   * Deletes several addresses atomically. Malformed entries are skipped.
   *
   * @return the number of rows deleted
   */
  public int deleteAddresses(Collection<String> addresses) {
    Objects.requireNonNull(addresses, "addresses");
    return inTransaction(conn -> {
      int count = 0;
      for (String address : addresses) {
        Optional<IpAddress> parsed = IpAddress.tryParse(address);
        if (parsed.isPresent()) {
          count += addressStore.delete(conn, parsed.get());
        }
      }
      return count;
    });
  }

  /**
   * Deletes every address of the range's family within the range.
   *
   * @return canonical text of the deleted addresses, in address order
   */
  public List<String> deleteRange(AddressRange range) {
    Objects.requireNonNull(range, "range");
    return inTransaction(conn -> addressStore.deleteRange(conn, range));
  }

  /**
   * Deletes rows in {@link AddressState#REMOVE_PENDING} without going through
   * reconciliation.
   *
   * @return the number of rows deleted
   */
  public int deletePendingRemove() {
    return inTransaction(conn -> addressStore.deleteByState(conn, AddressState.REMOVE_PENDING));
  }

  /**
   * Deletes all rows but keeps the database.
   *
   * @param confirm must be {@code true}, otherwise nothing happens
   * @return the number of rows deleted
   */
  public int truncate(boolean confirm) {
    if (!confirm) {
      return 0;
    }
    int deleted = inTransaction(addressStore::truncate);
    logger.log(Level.INFO, "Truncated ban store, {0} rows deleted", deleted);
    return deleted;
  }

  // ── connection and transaction plumbing ─────────────────────────

  private <T> T inTransaction(Function<Connection, T> work) {
    return inTransaction(List.of(), work);
  }

  /**
   * Runs {@code work} in the caller's transaction, or in an implicit one holding the
   * locks of {@code keys} until it commits or rolls back. Locks are taken after checkout
   * so a thread never waits for a connection while holding one.
   */
  private <T> T inTransaction(Collection<IpAddress> keys, Function<Connection, T> work) {
    if (txContext.isTransactionActive()) {
      return work.apply(txContext.currentConnection());
    }
    Connection conn = begin();
    List<ReentrantLock> held = lock(keys);
    boolean committed = false;
    try {
      T result = work.apply(conn);
      conn.commit();
      committed = true;
      return result;
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to commit", e);
    } finally {
      if (!committed) {
        rollbackQuietly(conn);
      }
      held.forEach(ReentrantLock::unlock);
      release(conn);
    }
  }

  // Stripes are taken in ascending order.
  private List<ReentrantLock> lock(Collection<IpAddress> keys) {
    TreeSet<Integer> stripes = new TreeSet<>();
    for (IpAddress key : keys) {
      stripes.add(Math.floorMod(key.hashCode(), LOCK_STRIPES));
    }
    List<ReentrantLock> held = new ArrayList<>(stripes.size());
    for (int stripe : stripes) {
      ReentrantLock lock = addressLocks[stripe];
      lock.lock();
      held.add(lock);
    }
    return held;
  }

  private <T> T withConnection(Function<Connection, T> work) {
    if (txContext.isTransactionActive()) {
      return work.apply(txContext.currentConnection());
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to obtain connection", e);
    }
  }

  private <T> Stream<T> scan(Function<Connection, Stream<T>> opener) {
    if (txContext.isTransactionActive()) {
      return opener.apply(txContext.currentConnection());
    }
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to obtain connection", e);
    }
    try {
      return opener.apply(conn).onClose(() -> closeQuietly(conn));
    } catch (RuntimeException e) {
      closeQuietly(conn);
      throw e;
    }
  }

  private Connection begin() {
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to obtain connection", e);
    }
    try {
      conn.setAutoCommit(false);
      conn.setTransactionIsolation(isolationLevel);
      return conn;
    } catch (SQLException e) {
      closeQuietly(conn);
      throw new AddressStoreException("Failed to begin transaction", e);
    }
  }

  private void record(Runnable metric) {
    if (txContext.isTransactionActive()) {
      txContext.afterCommit(() -> runSafely(metric));
    } else {
      runSafely(metric);
    }
  }

  private void initialize() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      addressStore.initializeSchema(conn);
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to initialize schema", e);
    }
  }

  static void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  static void release(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to restore auto-commit", e);
    } finally {
      closeQuietly(conn);
    }
  }

  private static void closeQuietly(Connection conn) {
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close connection", e);
    }
  }

  private static void runSafely(Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "Metrics export failed", ex);
    }
  }

  private static boolean isValidIsolation(int level) {
    return level == Connection.TRANSACTION_READ_COMMITTED
        || level == Connection.TRANSACTION_REPEATABLE_READ
        || level == Connection.TRANSACTION_SERIALIZABLE;
  }

  /** Builder for {@link BanStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private AddressStore addressStore;
    private MetricsExporter metrics;
    private Integer isolationLevel;
    private boolean initializeSchema = true;

    private Builder() {}

    /**
     * Sets the provider used for implicit transactions, scans and delta cursors.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the transaction context store operations join when a transaction is active.
     *
     * <p><b>Required.</b>
     *
     * @param txContext the transaction context
     * @return this builder
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * Sets the persistence backend.
     *
     * <p><b>Required.</b>
     *
     * @param addressStore the address store
     * @return this builder
     */
    public Builder addressStore(AddressStore addressStore) {
      this.addressStore = addressStore;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the isolation level of implicit transactions and delta cursors.
     *
     * <p>Optional. Defaults to {@link AddressStore#defaultIsolationLevel()}: SERIALIZABLE
     * for SQLite, READ COMMITTED for H2.
     *
     * @param isolationLevel one of the {@code Connection.TRANSACTION_*} constants
     * @return this builder
     */
    public Builder isolationLevel(int isolationLevel) {
      this.isolationLevel = isolationLevel;
      return this;
    }

    /**
     * Whether {@link #build()} creates and migrates the schema.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param initializeSchema {@code false} when the schema is managed externally
     * @return this builder
     */
    public Builder initializeSchema(boolean initializeSchema) {
      this.initializeSchema = initializeSchema;
      return this;
    }

    /**
     * Builds the store, applying schema setup unless disabled.
     *
     * @return a new {@link BanStore}
     * @throws NullPointerException if a required component is missing
     * @throws IllegalArgumentException if the isolation level is unsupported
     * @throws AddressStoreException if schema setup fails
     */
    public BanStore build() {
      BanStore store = new BanStore(this);
      if (initializeSchema) {
        store.initialize();
      }
      return store;
    }
  }
}

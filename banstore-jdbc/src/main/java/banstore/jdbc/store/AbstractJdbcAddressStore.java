package banstore.jdbc.store;

import banstore.AddressStoreException;
import banstore.jdbc.JdbcTemplate;
import banstore.jdbc.TableNames;
import banstore.model.AddressEntry;
import banstore.model.AddressRange;
import banstore.model.AddressState;
import banstore.model.BanWindow;
import banstore.model.EntryFilter;
import banstore.model.IpAddress;
import banstore.spi.AddressStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Base JDBC address store with standard SQL implementations.
 *
 * <p>The conditional upserts default to {@code MERGE INTO ... USING ... WHEN MATCHED AND}
 * (H2). Subclasses override {@link #mergeBan} and {@link #mergeFailedLogin} for databases
 * with a different upsert syntax. Register custom implementations via
 * {@code META-INF/services/banstore.jdbc.store.AbstractJdbcAddressStore}.
 *
 * <p>Timestamps are stored as epoch milliseconds in {@code BIGINT} columns; the address
 * key is the 4 or 16 byte binary form.
 *
 * @see JdbcAddressStores
 */
public abstract class AbstractJdbcAddressStore implements AddressStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcAddressStore.class.getName());

  protected static final String COLUMNS =
      "address, address_text, last_failed_login, failed_login_count, ban_date, state, ban_end_date";

  protected static final String PENDING_STATE_IN = "("
      + AddressState.ADD_PENDING.code() + ","
      + AddressState.REMOVE_PENDING.code() + ","
      + AddressState.REMOVE_PENDING_BECOME_FAILED_LOGIN.code() + ")";

  protected static final JdbcTemplate.RowMapper<AddressEntry> ENTRY_ROW_MAPPER = rs -> {
    IpAddress address = IpAddress.fromBytes(rs.getBytes("address"));
    Instant lastFailedLogin = Instant.ofEpochMilli(rs.getLong("last_failed_login"));
    int failedLoginCount = JdbcTemplate.clampToInt(rs.getLong("failed_login_count"));
    Instant banDate = toInstant(rs.getLong("ban_date"), rs.wasNull());
    AddressState state = AddressState.fromCode(rs.getInt("state"));
    Instant banEndDate = toInstant(rs.getLong("ban_end_date"), rs.wasNull());
    if (banDate == null) {
      banEndDate = null;
    } else if (banEndDate == null) {
      // rows banned before ban_end_date existed count as expired
      banEndDate = Instant.EPOCH;
    }
    return new AddressEntry(address, lastFailedLogin, failedLoginCount, banDate, banEndDate, state);
  };

  private final String tableName;

  protected AbstractJdbcAddressStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcAddressStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this address store (e.g., "h2", "sqlite").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this address store handles (e.g., "jdbc:h2:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   *
   * @param tableName a plain SQL identifier
   */
  public abstract AbstractJdbcAddressStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  // ── schema ──────────────────────────────────────────────────────

  @Override
  public void initializeSchema(Connection conn) {
    try {
      beforeSchema(conn);
      JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + tableName() + " ("
          + "address VARBINARY(16) NOT NULL, "
          + "address_text VARCHAR(64) NOT NULL, "
          + "last_failed_login BIGINT NOT NULL, "
          + "failed_login_count BIGINT NOT NULL, "
          + "ban_date BIGINT NULL, "
          + "PRIMARY KEY (address))");
      addColumnIfAbsent(conn, "state INT NOT NULL DEFAULT 0");
      addColumnIfAbsent(conn, "ban_end_date BIGINT NULL");
      createIndex(conn, "last_failed_login");
      createIndex(conn, "ban_date");
      createIndex(conn, "ban_end_date");
      createIndex(conn, "state");
      // rows from versions without a state column claim a ban they never had
      int healed = JdbcTemplate.update(conn, "UPDATE " + tableName()
          + " SET state=" + AddressState.FAILED_LOGIN.code()
          + " WHERE state IN (" + AddressState.ACTIVE.code() + "," + AddressState.ADD_PENDING.code() + ")"
          + " AND ban_date IS NULL");
      if (healed > 0) {
        logger.log(Level.INFO, "Moved {0} rows without ban date to FAILED_LOGIN", healed);
      }
      logger.log(Level.INFO, "Initialized {0} address table {1}", new Object[] {name(), tableName()});
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to initialize schema for " + tableName(), e);
    }
  }

  /**
   * Runs before the table is created, on an auto-commit connection. Default does nothing.
   */
  protected void beforeSchema(Connection conn) throws SQLException {
  }

  private void addColumnIfAbsent(Connection conn, String columnDefinition) {
    try {
      JdbcTemplate.execute(conn, "ALTER TABLE " + tableName() + " ADD COLUMN " + columnDefinition);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Column already present: " + columnDefinition, e);
    }
  }

  private void createIndex(Connection conn, String column) throws SQLException {
    JdbcTemplate.execute(conn, "CREATE INDEX IF NOT EXISTS " + tableName() + "_" + column
        + " ON " + tableName() + " (" + column + ")");
  }

  // ── lookups ─────────────────────────────────────────────────────

  @Override
  public Optional<AddressEntry> find(Connection conn, IpAddress address) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE address=?";
    return JdbcTemplate.queryForOptional(conn, sql, ENTRY_ROW_MAPPER, address.toBytes());
  }

  @Override
  public Optional<AddressState> findState(Connection conn, IpAddress address) {
    String sql = "SELECT state FROM " + tableName() + " WHERE address=?";
    return JdbcTemplate.queryForOptional(conn, sql, rs -> AddressState.fromCode(rs.getInt(1)),
        address.toBytes());
  }

  @Override
  public Optional<BanWindow> findBanWindow(Connection conn, IpAddress address) {
    String sql = "SELECT ban_date, ban_end_date FROM " + tableName() + " WHERE address=?";
    return JdbcTemplate.queryForOptional(conn, sql, rs -> {
      Instant start = toInstant(rs.getLong(1), rs.wasNull());
      Instant end = toInstant(rs.getLong(2), rs.wasNull());
      if (start == null) {
        return null;
      }
      return new BanWindow(start, end == null ? Instant.EPOCH : end);
    }, address.toBytes());
  }

  @Override
  public int count(Connection conn) {
    return JdbcTemplate.queryForInt(conn, "SELECT COUNT(*) FROM " + tableName());
  }

  @Override
  public int countBanned(Connection conn) {
    return JdbcTemplate.queryForInt(conn,
        "SELECT COUNT(*) FROM " + tableName() + " WHERE ban_date IS NOT NULL");
  }

  @Override
  public int countByState(Connection conn, AddressState state) {
    return JdbcTemplate.queryForInt(conn,
        "SELECT COUNT(*) FROM " + tableName() + " WHERE state=?", state.code());
  }

  @Override
  public Stream<AddressEntry> scan(Connection conn, EntryFilter filter) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName());
    List<Object> params = new ArrayList<>(2);
    if (!filter.matchesAll()) {
      List<String> clauses = new ArrayList<>(2);
      if (filter.failedLoginCutoff() != null) {
        clauses.add("(state=" + AddressState.FAILED_LOGIN.code() + " AND last_failed_login<=?)");
        params.add(filter.failedLoginCutoff().toEpochMilli());
      }
      if (filter.banCutoff() != null) {
        clauses.add("(state IN (" + AddressState.ACTIVE.code() + "," + AddressState.ADD_PENDING.code()
            + ") AND ban_end_date<=?)");
        params.add(filter.banCutoff().toEpochMilli());
      }
      sql.append(" WHERE ").append(String.join(" OR ", clauses));
    }
    sql.append(" ORDER BY address");
    return JdbcTemplate.stream(conn, sql.toString(), ENTRY_ROW_MAPPER, params.toArray());
  }

  @Override
  public Stream<String> scanBanned(Connection conn) {
    String sql = "SELECT address_text FROM " + tableName()
        + " WHERE ban_date IS NOT NULL AND state=" + AddressState.ACTIVE.code() + " ORDER BY address";
    return JdbcTemplate.stream(conn, sql, rs -> rs.getString(1));
  }

  @Override
  public Stream<AddressEntry> scanPending(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE state IN " + PENDING_STATE_IN + " ORDER BY address";
    return JdbcTemplate.stream(conn, sql, ENTRY_ROW_MAPPER);
  }

  // ── writes ──────────────────────────────────────────────────────

  @Override
  public int upsertBan(Connection conn, IpAddress address, Instant start, Instant end, Instant now) {
    return retryOnDuplicateKey(() -> mergeBan(conn, address.toBytes(), address.text(),
        start.toEpochMilli(), end.toEpochMilli(), now.toEpochMilli()));
  }

  @Override
  public int incrementFailedLogin(Connection conn, IpAddress address, Instant when, int amount) {
    byte[] key = address.toBytes();
    retryOnDuplicateKey(() -> mergeFailedLogin(conn, key, address.text(), when.toEpochMilli(), amount));
    return JdbcTemplate.queryForInt(conn,
        "SELECT failed_login_count FROM " + tableName() + " WHERE address=?", key);
  }

  /**
   * Inserts a row in ADD_PENDING, or reopens the ban window of an existing row that is
   * not REMOVE_PENDING and holds no unexpired ban. ACTIVE stays ACTIVE, anything else
   * becomes ADD_PENDING.
   *
   * @return rows inserted or updated
   */
  protected int mergeBan(Connection conn, byte[] key, String text, long start, long end, long now) {
    String sql = "MERGE INTO " + tableName() + " AS t"
        + " USING (SELECT CAST(? AS VARBINARY(16)) AS address) AS s ON t.address=s.address"
        + " WHEN MATCHED AND t.state<>" + AddressState.REMOVE_PENDING.code()
        + " AND (t.ban_end_date IS NULL OR t.ban_end_date<=?) THEN UPDATE SET ban_date=?,"
        + " state=CASE WHEN t.state=" + AddressState.ACTIVE.code() + " THEN " + AddressState.ACTIVE.code()
        + " ELSE " + AddressState.ADD_PENDING.code() + " END, ban_end_date=?"
        + " WHEN NOT MATCHED THEN INSERT (" + COLUMNS + ")"
        + " VALUES (s.address, ?, ?, 0, ?, " + AddressState.ADD_PENDING.code() + ", ?)";
    return JdbcTemplate.update(conn, sql, key, now, start, end, text, start, start, end);
  }

  /**
   * Inserts a row in FAILED_LOGIN with {@code amount} failures, or adds {@code amount}
   * to an existing FAILED_LOGIN row. Rows in other states are not touched.
   *
   * @return rows inserted or updated
   */
  protected int mergeFailedLogin(Connection conn, byte[] key, String text, long when, int amount) {
    String sql = "MERGE INTO " + tableName() + " AS t"
        + " USING (SELECT CAST(? AS VARBINARY(16)) AS address) AS s ON t.address=s.address"
        + " WHEN MATCHED AND t.state=" + AddressState.FAILED_LOGIN.code()
        + " THEN UPDATE SET last_failed_login=?, failed_login_count=t.failed_login_count+?"
        + " WHEN NOT MATCHED THEN INSERT (" + COLUMNS + ")"
        + " VALUES (s.address, ?, ?, ?, NULL, " + AddressState.FAILED_LOGIN.code() + ", NULL)";
    return JdbcTemplate.update(conn, sql, key, when, (long) amount, text, when, (long) amount);
  }

  @Override
  public int updateState(Connection conn, IpAddress address, AddressState state) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName() + " SET state=?" + clearWindow(state)
        + " WHERE address=?", state.code(), address.toBytes());
  }

  @Override
  public int updateAllStates(Connection conn, AddressState state) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName() + " SET state=?" + clearWindow(state),
        state.code());
  }

  // FAILED_LOGIN rows never carry a ban window
  private static String clearWindow(AddressState state) {
    return state == AddressState.FAILED_LOGIN ? ", ban_date=NULL, ban_end_date=NULL" : "";
  }

  @Override
  public int completePending(Connection conn, List<AddressEntry> pending, Instant now,
      boolean resetFailedLoginCount) {
    String reset = resetFailedLoginCount ? ", failed_login_count=0" : "";
    List<Object[]> activate = new ArrayList<>();
    List<Object[]> restore = new ArrayList<>();
    List<Object[]> remove = new ArrayList<>();
    long nowMillis = now.toEpochMilli();
    for (AddressEntry entry : pending) {
      byte[] key = entry.address().toBytes();
      switch (entry.state()) {
        case ADD_PENDING -> activate.add(new Object[] {key});
        case REMOVE_PENDING_BECOME_FAILED_LOGIN -> restore.add(new Object[] {nowMillis, key});
        case REMOVE_PENDING -> remove.add(new Object[] {key});
        default -> {
          // not pending, nothing to complete
        }
      }
    }
    int changed = 0;
    changed += JdbcTemplate.batchUpdate(conn, "UPDATE " + tableName()
        + " SET state=" + AddressState.ACTIVE.code() + reset
        + " WHERE address=? AND state=" + AddressState.ADD_PENDING.code(), activate);
    changed += JdbcTemplate.batchUpdate(conn, "UPDATE " + tableName()
        + " SET state=" + AddressState.FAILED_LOGIN.code() + ", last_failed_login=?"
        + clearWindow(AddressState.FAILED_LOGIN) + reset
        + " WHERE address=? AND state=" + AddressState.REMOVE_PENDING_BECOME_FAILED_LOGIN.code(), restore);
    changed += JdbcTemplate.batchUpdate(conn, "DELETE FROM " + tableName()
        + " WHERE address=? AND state=" + AddressState.REMOVE_PENDING.code(), remove);
    return changed;
  }

  // ── deletes ─────────────────────────────────────────────────────

  @Override
  public int delete(Connection conn, IpAddress address) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE address=?", address.toBytes());
  }

  @Override
  public List<String> deleteRange(Connection conn, AddressRange range) {
    String where = " WHERE address BETWEEN ? AND ? AND " + binaryLength("address") + "=?";
    byte[] begin = range.begin().toBytes();
    byte[] end = range.end().toBytes();
    int length = begin.length;
    List<String> deleted = JdbcTemplate.query(conn,
        "SELECT address_text FROM " + tableName() + where + " ORDER BY address",
        rs -> rs.getString(1), begin, end, length);
    if (!deleted.isEmpty()) {
      JdbcTemplate.update(conn, "DELETE FROM " + tableName() + where, begin, end, length);
    }
    return deleted;
  }

  @Override
  public int deleteByState(Connection conn, AddressState state) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE state=?", state.code());
  }

  @Override
  public int truncate(Connection conn) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName());
  }

  // ── dialect hooks ───────────────────────────────────────────────

  /**
   * SQL expression giving the byte length of a binary column.
   */
  protected String binaryLength(String column) {
    return "OCTET_LENGTH(" + column + ")";
  }

  /**
   * Whether {@code e} reports a primary key violation, as raised when two transactions
   * insert the same new address concurrently.
   */
  protected boolean isDuplicateKey(SQLException e) {
    String sqlState = e.getSQLState();
    return sqlState != null && sqlState.startsWith("23");
  }

  private int retryOnDuplicateKey(Supplier<Integer> statement) {
    try {
      return statement.get();
    } catch (AddressStoreException e) {
      if (e.getCause() instanceof SQLException sql && isDuplicateKey(sql)) {
        // the competing insert has committed, so the retry takes the update path
        logger.log(Level.FINE, "Concurrent insert detected, retrying upsert", e);
        return statement.get();
      }
      throw e;
    }
  }

  private static Instant toInstant(long epochMillis, boolean wasNull) {
    return wasNull ? null : Instant.ofEpochMilli(epochMillis);
  }
}

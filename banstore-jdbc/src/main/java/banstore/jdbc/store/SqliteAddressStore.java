package banstore.jdbc.store;

import banstore.jdbc.JdbcTemplate;
import banstore.model.AddressState;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * SQLite address store.
 *
 * <p>Upserts use {@code INSERT ... ON CONFLICT(address) DO UPDATE ... WHERE}, where
 * unqualified columns refer to the existing row. Schema setup switches the database to
 * incremental auto-vacuum and write-ahead logging.
 *
 * <p>The SQLite driver only accepts {@code TRANSACTION_SERIALIZABLE} (and read
 * uncommitted) isolation.
 */
public final class SqliteAddressStore extends AbstractJdbcAddressStore {
  private static final int SQLITE_CONSTRAINT = 19;

  public SqliteAddressStore() {
    super();
  }

  public SqliteAddressStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlite:");
  }

  @Override
  public SqliteAddressStore withTableName(String tableName) {
    return new SqliteAddressStore(tableName);
  }

  @Override
  protected void beforeSchema(Connection conn) throws SQLException {
    // journal_mode cannot change inside a transaction
    JdbcTemplate.execute(conn, "PRAGMA auto_vacuum = INCREMENTAL");
    JdbcTemplate.execute(conn, "PRAGMA journal_mode = WAL");
  }

  @Override
  protected int mergeBan(Connection conn, byte[] key, String text, long start, long end, long now) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ")"
        + " VALUES (?, ?, ?, 0, ?, " + AddressState.ADD_PENDING.code() + ", ?)"
        + " ON CONFLICT(address) DO UPDATE SET ban_date=excluded.ban_date,"
        + " state=CASE WHEN state=" + AddressState.ACTIVE.code() + " THEN " + AddressState.ACTIVE.code()
        + " ELSE " + AddressState.ADD_PENDING.code() + " END, ban_end_date=excluded.ban_end_date"
        + " WHERE state<>" + AddressState.REMOVE_PENDING.code()
        + " AND (ban_end_date IS NULL OR ban_end_date<=?)";
    return JdbcTemplate.update(conn, sql, key, text, start, start, end, now);
  }

  @Override
  protected int mergeFailedLogin(Connection conn, byte[] key, String text, long when, int amount) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ")"
        + " VALUES (?, ?, ?, ?, NULL, " + AddressState.FAILED_LOGIN.code() + ", NULL)"
        + " ON CONFLICT(address) DO UPDATE SET last_failed_login=excluded.last_failed_login,"
        + " failed_login_count=failed_login_count+excluded.failed_login_count"
        + " WHERE state=" + AddressState.FAILED_LOGIN.code();
    return JdbcTemplate.update(conn, sql, key, text, when, (long) amount);
  }

  @Override
  protected String binaryLength(String column) {
    return "LENGTH(" + column + ")";
  }

  @Override
  protected boolean isDuplicateKey(SQLException e) {
    return e.getErrorCode() == SQLITE_CONSTRAINT || super.isDuplicateKey(e);
  }
}

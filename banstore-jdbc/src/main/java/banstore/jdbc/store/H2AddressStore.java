package banstore.jdbc.store;

import java.sql.Connection;
import java.util.List;

/**
 * H2 address store. Primarily for testing and embedded deployments.
 *
 * <p>Uses the default {@code MERGE INTO ... USING} upserts from {@link AbstractJdbcAddressStore}.
 *
 * <p>H2's SERIALIZABLE and REPEATABLE READ are snapshot levels that fail concurrent writers
 * of one row with a duplicate key or "deadlock detected" error instead of waiting, so the
 * default here is READ COMMITTED: the MERGE waits on the row lock and then matches the
 * latest committed row.
 */
public final class H2AddressStore extends AbstractJdbcAddressStore {

  public H2AddressStore() {
    super();
  }

  public H2AddressStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public int defaultIsolationLevel() {
    return Connection.TRANSACTION_READ_COMMITTED;
  }

  @Override
  public H2AddressStore withTableName(String tableName) {
    return new H2AddressStore(tableName);
  }
}

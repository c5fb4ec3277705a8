package banstore.spring.boot;

import banstore.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.sql.Connection;

/**
 * Configuration properties for the ban store.
 *
 * @see BanStoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "banstore")
public class BanStoreProperties {

  /**
   * Database table holding the address rows.
   */
  private String tableName = TableNames.DEFAULT_TABLE;

  /**
   * Whether the table is created and migrated on startup.
   */
  private boolean initializeSchema = true;

  /**
   * Isolation level of transactions the store opens itself. Unset means the address
   * store's default: SERIALIZABLE for SQLite, READ_COMMITTED for H2.
   */
  private Isolation isolation;

  private final Metrics metrics = new Metrics();

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public boolean isInitializeSchema() {
    return initializeSchema;
  }

  public void setInitializeSchema(boolean initializeSchema) {
    this.initializeSchema = initializeSchema;
  }

  public Isolation getIsolation() {
    return isolation;
  }

  public void setIsolation(Isolation isolation) {
    this.isolation = isolation;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public enum Isolation {
    READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
    REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
    SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

    private final int level;

    Isolation(int level) {
      this.level = level;
    }

    /** The matching {@code Connection.TRANSACTION_*} constant. */
    public int level() {
      return level;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "banstore";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}

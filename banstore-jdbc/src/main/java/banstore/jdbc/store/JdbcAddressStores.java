package banstore.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC address stores with auto-detection support.
 *
 * <p>Address stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/banstore.jdbc.store.AbstractJdbcAddressStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcAddressStore store = JdbcAddressStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcAddressStore store = JdbcAddressStores.detect("jdbc:sqlite:ban.sqlite", "banned");
 *
 * // Get by name
 * AbstractJdbcAddressStore store = JdbcAddressStores.get("h2");
 * }</pre>
 */
public final class JdbcAddressStores {

    private static final List<AbstractJdbcAddressStore> STORES;
    private static final Map<String, AbstractJdbcAddressStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcAddressStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcAddressStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcAddressStores() {
    }

    /**
     * Returns all registered address stores.
     *
     * @return unmodifiable list of address stores
     */
    public static List<AbstractJdbcAddressStore> all() {
        return STORES;
    }

    /**
     * Gets an address store by name.
     *
     * @param name address store name (e.g., "h2", "sqlite")
     * @return the address store
     * @throws IllegalArgumentException if no address store found
     */
    public static AbstractJdbcAddressStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcAddressStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown address store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects address store from a DataSource.
     *
     * @param dataSource the data source
     * @return detected address store
     * @throws IllegalStateException if detection fails or no matching address store
     */
    public static AbstractJdbcAddressStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect address store from DataSource", e);
        }
    }

    /**
     * Auto-detects address store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected address store
     * @throws IllegalArgumentException if no matching address store found
     */
    public static AbstractJdbcAddressStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        for (AbstractJdbcAddressStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No address store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    /**
     * Auto-detects address store from a DataSource, bound to a custom table.
     *
     * @param dataSource the data source
     * @param tableName  the table name
     * @return detected address store using {@code tableName}
     * @throws IllegalStateException if detection fails or no matching address store
     */
    public static AbstractJdbcAddressStore detect(DataSource dataSource, String tableName) {
        return detect(dataSource).withTableName(tableName);
    }

    /**
     * Auto-detects address store from a JDBC URL, bound to a custom table.
     *
     * @param jdbcUrl   the JDBC URL
     * @param tableName the table name
     * @return detected address store using {@code tableName}
     * @throws IllegalArgumentException if no matching address store found or the table name is invalid
     */
    public static AbstractJdbcAddressStore detect(String jdbcUrl, String tableName) {
        return detect(jdbcUrl).withTableName(tableName);
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}

/**
 * JDBC-based {@link banstore.spi.AddressStore} implementations.
 *
 * <p>{@link banstore.jdbc.store.AbstractJdbcAddressStore} provides shared SQL, schema
 * migration and row mapping; subclasses supply database-specific upserts: H2
 * ({@code MERGE INTO ... USING}) and SQLite ({@code INSERT ... ON CONFLICT DO UPDATE}).
 *
 * @see banstore.jdbc.store.AbstractJdbcAddressStore
 * @see banstore.jdbc.store.H2AddressStore
 * @see banstore.jdbc.store.SqliteAddressStore
 * @see banstore.jdbc.store.JdbcAddressStores
 */
package banstore.jdbc.store;

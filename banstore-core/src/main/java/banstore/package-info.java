/**
 * Root API for the ban store: failed-login counters, ban windows and the per-address
 * state machine that keeps an external firewall in sync with persisted bans.
 *
 * <h2>Core Design</h2>
 * <p>The policy engine reports failed logins and applies bans through
 * {@link banstore.BanStore}. Bans are never pushed to the firewall directly; they land in
 * a pending state. The firewall sync driver periodically opens a
 * {@link banstore.DeltaCursor}, applies each {@link banstore.model.AddressDelta} to the
 * firewall and commits, which moves the pending rows to their terminal state. A rolled
 * back or abandoned cursor leaves the rows pending, so the same deltas are produced again.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>banstore-core</b>: model, SPI, facade and delta cursor (zero external deps)</li>
 *   <li><b>banstore-jdbc</b>: {@linkplain banstore.jdbc.store JDBC address stores}
 *       (H2, SQLite) and manual transactions</li>
 *   <li><b>banstore-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>banstore-spring-adapter</b>: optional Spring transaction integration</li>
 *   <li><b>banstore-spring-boot-starter</b>: auto-configuration under {@code banstore.*}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var addressStore = JdbcAddressStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var txContext    = new ThreadLocalTxContext();
 *
 * BanStore banStore = BanStore.builder()
 *     .connectionProvider(connProvider)
 *     .txContext(txContext)
 *     .addressStore(addressStore)
 *     .build();
 *
 * Instant now = Instant.now();
 * if (banStore.incrementFailedLogin("10.0.0.1", now, 1) >= 5) {
 *     banStore.applyBan("10.0.0.1", now, now.plus(Duration.ofDays(1)), now);
 * }
 *
 * // firewall sync
 * banStore.enumerateDeltaAndUpdateState(true, Instant.now(), true, firewall::apply);
 * }</pre>
 *
 * @see banstore.BanStore
 * @see banstore.DeltaCursor
 * @see banstore.model.AddressState
 */
package banstore;

package banstore.jdbc;

import banstore.BanStore;
import banstore.DeltaCursor;
import banstore.jdbc.store.AbstractJdbcAddressStore;
import banstore.jdbc.store.JdbcAddressStores;
import banstore.jdbc.tx.JdbcTransactionManager;
import banstore.jdbc.tx.ThreadLocalTxContext;
import banstore.model.AddressDelta;
import banstore.model.AddressEntry;
import banstore.model.AddressRange;
import banstore.model.AddressState;
import banstore.model.BanRequest;
import banstore.model.BanWindow;
import banstore.model.EntryFilter;
import banstore.model.IpAddress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour shared by every JDBC dialect, exercised through the {@link BanStore} facade.
 */
abstract class AbstractBanStoreIntegrationTest {
  protected static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  protected DataSource dataSource;
  protected AbstractJdbcAddressStore addressStore;
  protected DataSourceConnectionProvider connectionProvider;
  protected ThreadLocalTxContext txContext;
  protected JdbcTransactionManager txManager;
  protected BanStore banStore;

  protected abstract DataSource createDataSource() throws Exception;

  protected abstract String expectedStoreName();

  @BeforeEach
  void setUpStore() throws Exception {
    dataSource = createDataSource();
    addressStore = JdbcAddressStores.detect(dataSource);
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(connectionProvider, txContext);
    banStore = newBanStore(addressStore);
  }

  protected BanStore newBanStore(AbstractJdbcAddressStore store) {
    return BanStore.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .addressStore(store)
        .build();
  }

  protected static Instant t(int minutes) {
    return T0.plusSeconds(minutes * 60L);
  }

  private AddressEntry entry(String address) {
    return banStore.getEntry(address).orElseThrow();
  }

  private List<AddressDelta> reconcile(boolean reset, Instant now) {
    return banStore.enumerateDeltaAndUpdateState(true, now, reset, d -> { });
  }

  @Test
  void detectsDialectFromDataSource() {
    assertEquals(expectedStoreName(), addressStore.name());
  }

  // ── failed logins ───────────────────────────────────────────────

  @Test
  void incrementReturnsRunningCount() {
    assertEquals(1, banStore.incrementFailedLogin("10.0.0.1", t(1), 1));
    assertEquals(2, banStore.incrementFailedLogin("10.0.0.1", t(2), 1));
    assertEquals(3, banStore.incrementFailedLogin("10.0.0.1", t(3), 1));

    AddressEntry entry = entry("10.0.0.1");
    assertEquals(AddressState.FAILED_LOGIN, entry.state());
    assertEquals(3, entry.failedLoginCount());
    assertEquals(t(3), entry.lastFailedLogin());
    assertTrue(entry.banWindow().isEmpty());
  }

  @Test
  void incrementByAmount() {
    assertEquals(5, banStore.incrementFailedLogin("10.0.0.1", t(1), 5));
    assertEquals(8, banStore.incrementFailedLogin("10.0.0.1", t(2), 3));
  }

  @Test
  void incrementWhileBannedLeavesCounterAndState() {
    banStore.incrementFailedLogin("10.0.0.1", t(1), 2);
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));

    assertEquals(2, banStore.incrementFailedLogin("10.0.0.1", t(11), 1));

    AddressEntry entry = entry("10.0.0.1");
    assertEquals(AddressState.ADD_PENDING, entry.state());
    assertEquals(t(1), entry.lastFailedLogin());
  }

  // ── conditional ban upsert ──────────────────────────────────────

  @Test
  void banOnAbsentAddressInsertsAddPending() {
    assertTrue(banStore.applyBan("10.0.0.1", t(10), t(20), t(10)));

    AddressEntry entry = entry("10.0.0.1");
    assertEquals(AddressState.ADD_PENDING, entry.state());
    assertEquals(0, entry.failedLoginCount());
    assertEquals(t(10), entry.lastFailedLogin());
    assertEquals(new BanWindow(t(10), t(20)), entry.banWindow().orElseThrow());
  }

  @Test
  void failedLoginsThenBanThenReconcile() {
    banStore.incrementFailedLogin("10.0.0.1", t(1), 1);
    banStore.incrementFailedLogin("10.0.0.1", t(2), 1);
    banStore.incrementFailedLogin("10.0.0.1", t(3), 1);

    assertTrue(banStore.applyBan("10.0.0.1", t(10), t(20), t(10)));
    AddressEntry banned = entry("10.0.0.1");
    assertEquals(AddressState.ADD_PENDING, banned.state());
    assertEquals(3, banned.failedLoginCount());
    assertEquals(new BanWindow(t(10), t(20)), banned.banWindow().orElseThrow());

    assertEquals(List.of(new AddressDelta("10.0.0.1", true)), reconcile(false, t(11)));
    assertEquals(AddressState.ACTIVE, banStore.getState("10.0.0.1").orElseThrow());
  }

  @Test
  void unexpiredBanIsNotReplaced() {
    assertTrue(banStore.applyBan("10.0.0.1", t(10), t(20), t(10)));

    assertFalse(banStore.applyBan("10.0.0.1", t(15), t(30), t(15)));
    assertEquals(new BanWindow(t(10), t(20)), banStore.getBanWindow("10.0.0.1").orElseThrow());

    reconcile(false, t(16));
    assertFalse(banStore.applyBan("10.0.0.1", t(17), t(40), t(17)));
    assertEquals(AddressState.ACTIVE, banStore.getState("10.0.0.1").orElseThrow());
  }

  @Test
  void expiredActiveBanReopensWithoutFirewallChange() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    reconcile(false, t(11));

    assertTrue(banStore.applyBan("10.0.0.1", t(20), t(30), t(20)));

    assertEquals(AddressState.ACTIVE, banStore.getState("10.0.0.1").orElseThrow());
    assertEquals(new BanWindow(t(20), t(30)), banStore.getBanWindow("10.0.0.1").orElseThrow());
    assertTrue(reconcile(false, t(21)).isEmpty());
  }

  @Test
  void expiredPendingBanReopensAsPending() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));

    assertTrue(banStore.applyBan("10.0.0.1", t(25), t(35), t(25)));

    assertEquals(AddressState.ADD_PENDING, banStore.getState("10.0.0.1").orElseThrow());
    assertEquals(new BanWindow(t(25), t(35)), banStore.getBanWindow("10.0.0.1").orElseThrow());
  }

  @Test
  void removePendingBlocksBan() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    reconcile(false, t(11));
    banStore.setState(List.of("10.0.0.1"), AddressState.REMOVE_PENDING);

    assertFalse(banStore.applyBan("10.0.0.1", t(30), t(40), t(30)));
    assertEquals(AddressState.REMOVE_PENDING, banStore.getState("10.0.0.1").orElseThrow());
  }

  @Test
  void applyBansCountsNewlyAppliedOnly() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));

    int applied = banStore.applyBans(List.of(
        new BanRequest("10.0.0.1", t(11), t(30)),
        new BanRequest("10.0.0.2", t(11), t(30)),
        new BanRequest("garbage", t(11), t(30)),
        new BanRequest("10.0.0.3", t(11), t(30))), t(11));

    assertEquals(2, applied);
    assertEquals(3, banStore.count());
  }

  // ── reconciliation ──────────────────────────────────────────────

  @Test
  void removalCycleDeletesRow() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    reconcile(false, t(11));
    assertEquals(1, banStore.setState(List.of("10.0.0.1"), AddressState.REMOVE_PENDING));

    assertEquals(List.of(new AddressDelta("10.0.0.1", false)), reconcile(false, t(21)));

    assertTrue(banStore.getEntry("10.0.0.1").isEmpty());
    assertEquals(0, banStore.count());
  }

  @Test
  void removePendingBecomeFailedLoginReturnsToCounting() {
    banStore.incrementFailedLogin("10.0.0.1", t(1), 4);
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    reconcile(false, t(11));
    banStore.setState(List.of("10.0.0.1"), AddressState.REMOVE_PENDING_BECOME_FAILED_LOGIN);

    assertEquals(List.of(new AddressDelta("10.0.0.1", false)), reconcile(false, t(30)));

    AddressEntry entry = entry("10.0.0.1");
    assertEquals(AddressState.FAILED_LOGIN, entry.state());
    assertEquals(t(30), entry.lastFailedLogin());
    assertEquals(4, entry.failedLoginCount());
    assertTrue(entry.banWindow().isEmpty());
    assertEquals(5, banStore.incrementFailedLogin("10.0.0.1", t(31), 1));
  }

  @Test
  void resetFlagClearsCounters() {
    banStore.incrementFailedLogin("10.0.0.1", t(1), 3);
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    reconcile(true, t(11));
    assertEquals(0, entry("10.0.0.1").failedLoginCount());

    banStore.setState(List.of("10.0.0.1"), AddressState.REMOVE_PENDING_BECOME_FAILED_LOGIN);
    reconcile(true, t(30));
    assertEquals(0, entry("10.0.0.1").failedLoginCount());
  }

  @Test
  void declinedReconciliationIsRepeatable() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    banStore.applyBan("10.0.0.2", t(10), t(20), t(10));

    List<AddressDelta> first = banStore.enumerateDeltaAndUpdateState(false, t(11), false, d -> { });
    List<AddressDelta> second = banStore.enumerateDeltaAndUpdateState(false, t(11), false, d -> { });

    assertEquals(2, first.size());
    assertEquals(first, second);
    assertEquals(2, banStore.countByState(AddressState.ADD_PENDING));
  }

  @Test
  void committedDeltaIsNotProducedAgain() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));

    assertEquals(1, reconcile(false, t(11)).size());
    assertTrue(reconcile(false, t(12)).isEmpty());
  }

  @Test
  void applierFailureKeepsDeltaPending() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    banStore.applyBan("10.0.0.2", t(10), t(20), t(10));

    assertThrows(IllegalStateException.class, () -> banStore.enumerateDeltaAndUpdateState(
        true, t(11), false, d -> {
          if (d.address().equals("10.0.0.2")) {
            throw new IllegalStateException("firewall rejected");
          }
        }));

    assertEquals(2, banStore.countByState(AddressState.ADD_PENDING));
    assertEquals(2, reconcile(false, t(12)).size());
  }

  @Test
  void cursorCommitBeforeExhaustionRollsBack() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    banStore.applyBan("10.0.0.2", t(10), t(20), t(10));

    try (DeltaCursor cursor = banStore.openDeltaCursor()) {
      cursor.next();
      assertThrows(IllegalStateException.class, () -> cursor.commit(t(11), false));
    }

    assertEquals(2, banStore.countByState(AddressState.ADD_PENDING));
  }

  @Test
  void deltasAreOrderedByAddress() {
    banStore.applyBan("10.0.0.10", t(10), t(20), t(10));
    banStore.applyBan("10.0.0.2", t(10), t(20), t(10));
    banStore.applyBan("9.0.0.1", t(10), t(20), t(10));

    List<String> order = new ArrayList<>();
    reconcile(false, t(11)).forEach(d -> order.add(d.address()));

    assertEquals(List.of("9.0.0.1", "10.0.0.2", "10.0.0.10"), order);
  }

  @Test
  void mixedDeltaCarriesDirection() {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));
    banStore.applyBan("10.0.0.2", t(10), t(20), t(10));
    reconcile(false, t(11));
    banStore.setState(List.of("10.0.0.2"), AddressState.REMOVE_PENDING);
    banStore.applyBan("10.0.0.3", t(12), t(20), t(12));

    assertEquals(List.of(
        new AddressDelta("10.0.0.2", false),
        new AddressDelta("10.0.0.3", true)), reconcile(false, t(13)));
  }

  // ── explicit transactions ───────────────────────────────────────

  @Test
  void explicitTransactionGroupsOperations() throws Exception {
    try (var tx = txManager.begin()) {
      assertEquals(1, banStore.incrementFailedLogin("10.0.0.1", t(1), 1));
      assertEquals(2, banStore.incrementFailedLogin("10.0.0.1", t(2), 1));
      assertTrue(banStore.applyBan("10.0.0.1", t(3), t(20), t(3)));
      assertEquals(AddressState.ADD_PENDING, banStore.getState("10.0.0.1").orElseThrow());
      tx.commit();
    }

    AddressEntry entry = entry("10.0.0.1");
    assertEquals(AddressState.ADD_PENDING, entry.state());
    assertEquals(2, entry.failedLoginCount());
  }

  @Test
  void explicitTransactionRollbackDiscardsEverything() throws Exception {
    try (var tx = txManager.begin()) {
      banStore.incrementFailedLogin("10.0.0.1", t(1), 1);
      banStore.applyBan("10.0.0.2", t(1), t(20), t(1));
      tx.rollback();
    }

    assertEquals(0, banStore.count());
  }

  @Test
  void cursorJoinedToCallerTransactionFollowsCaller() throws Exception {
    banStore.applyBan("10.0.0.1", t(10), t(20), t(10));

    try (var tx = txManager.begin()) {
      assertEquals(1, reconcile(false, t(11)).size());
      assertEquals(AddressState.ACTIVE, banStore.getState("10.0.0.1").orElseThrow());
      tx.rollback();
    }

    assertEquals(AddressState.ADD_PENDING, banStore.getState("10.0.0.1").orElseThrow());
  }

  // ── queries ─────────────────────────────────────────────────────

  @Test
  void roundTripKeepsMillisecondPrecision() {
    Instant start = Instant.parse("2026-01-01T10:15:30.123456789Z");
    Instant end = Instant.parse("2026-01-02T10:15:30.987654321Z");

    banStore.applyBan("10.0.0.1", start, end, start);

    AddressEntry entry = entry("10.0.0.1");
    assertEquals(Instant.parse("2026-01-01T10:15:30.123Z"), entry.banStartDate());
    assertEquals(Instant.parse("2026-01-02T10:15:30.987Z"), entry.banEndDate());
    assertEquals(Instant.parse("2026-01-01T10:15:30.123Z"), entry.lastFailedLogin());
  }

  @Test
  void ipv6IsStoredCanonically() {
    assertTrue(banStore.applyBan("2001:DB8:0:0::0001", t(10), t(20), t(10)));

    assertEquals("2001:db8::1", entry("2001:db8::1").addressText());
    assertEquals(16, entry("2001:db8::1").address().length());
    assertTrue(banStore.getEntry("[2001:db8:0:0:0:0:0:1]").isPresent());
  }

  @Test
  void malformedAddressesTouchNothing() {
    assertEquals(0, banStore.incrementFailedLogin("10.0.0.256", t(1), 1));
    assertFalse(banStore.applyBan("host.example", t(1), t(2), t(1)));
    assertEquals(0, banStore.setState(List.of("nope"), AddressState.ACTIVE));
    assertFalse(banStore.deleteAddress(""));
    assertTrue(banStore.getEntry("x").isEmpty());

    assertEquals(0, banStore.count());
  }

  @Test
  void filterSelectsOldFailuresAndEndedBans() {
    banStore.incrementFailedLogin("10.0.0.1", t(5), 1);
    banStore.incrementFailedLogin("10.0.0.2", t(50), 1);
    banStore.applyBan("10.0.0.3", t(0), t(20), t(0));
    reconcile(false, t(1));
    banStore.applyBan("10.0.0.4", t(0), t(100), t(0));
    banStore.applyBan("10.0.0.5", t(0), t(10), t(0));
    banStore.applyBan("10.0.0.6", t(0), t(10), t(0));
    reconcile(false, t(1));
    banStore.setState(List.of("10.0.0.5"), AddressState.REMOVE_PENDING);

    assertEquals(List.of("10.0.0.1"), addresses(EntryFilter.failedLoginsBefore(t(10))));
    assertEquals(List.of("10.0.0.3", "10.0.0.6"), addresses(EntryFilter.bansEndingBefore(t(30))));
    assertEquals(List.of("10.0.0.1", "10.0.0.3", "10.0.0.6"),
        addresses(new EntryFilter(t(10), t(30))));
    assertEquals(6, addresses(EntryFilter.all()).size());
  }

  private List<String> addresses(EntryFilter filter) {
    return banStore.listEntries(filter).stream()
        .map(AddressEntry::addressText)
        .collect(Collectors.toList());
  }

  @Test
  void streamingReadsLazilyAndReleasesOnClose() {
    for (int i = 1; i <= 20; i++) {
      banStore.incrementFailedLogin("10.0.1." + i, t(i), 1);
    }

    try (Stream<AddressEntry> entries = banStore.streamEntries(EntryFilter.all())) {
      assertEquals("10.0.1.1", entries.findFirst().orElseThrow().addressText());
    }
    assertEquals(20, banStore.count());
  }

  @Test
  void bannedAddressesAreActiveOnly() {
    banStore.applyBan("10.0.0.1", t(0), t(20), t(0));
    banStore.applyBan("10.0.0.2", t(0), t(20), t(0));
    reconcile(false, t(1));
    banStore.applyBan("10.0.0.3", t(0), t(20), t(0));
    banStore.incrementFailedLogin("10.0.0.4", t(0), 1);

    try (Stream<String> banned = banStore.streamBannedAddresses()) {
      assertEquals(List.of("10.0.0.1", "10.0.0.2"), banned.collect(Collectors.toList()));
    }
  }

  @Test
  void counts() {
    banStore.applyBan("10.0.0.1", t(0), t(20), t(0));
    reconcile(false, t(1));
    banStore.applyBan("10.0.0.2", t(0), t(20), t(0));
    banStore.incrementFailedLogin("10.0.0.3", t(0), 1);

    assertEquals(3, banStore.count());
    assertEquals(2, banStore.countBanned());
    assertEquals(1, banStore.countByState(AddressState.ACTIVE));
    assertEquals(1, banStore.countByState(AddressState.ADD_PENDING));
    assertEquals(1, banStore.countByState(AddressState.FAILED_LOGIN));
  }

  @Test
  void setStateForAllForcesEveryRow() {
    banStore.applyBan("10.0.0.1", t(0), t(20), t(0));
    banStore.applyBan("10.0.0.2", t(0), t(20), t(0));

    assertEquals(2, banStore.setStateForAll(AddressState.REMOVE_PENDING));
    assertEquals(2, banStore.countByState(AddressState.REMOVE_PENDING));
  }

  @Test
  void forcingFailedLoginClearsBanWindow() {
    banStore.applyBan("10.0.0.1", t(0), t(20), t(0));

    banStore.setState(List.of("10.0.0.1"), AddressState.FAILED_LOGIN);

    assertTrue(banStore.getBanWindow("10.0.0.1").isEmpty());
    assertEquals(0, banStore.countBanned());
  }

  // ── deletion ────────────────────────────────────────────────────

  @Test
  void deleteSingleAndMany() {
    banStore.incrementFailedLogin("10.0.0.1", t(0), 1);
    banStore.incrementFailedLogin("10.0.0.2", t(0), 1);
    banStore.incrementFailedLogin("10.0.0.3", t(0), 1);

    assertTrue(banStore.deleteAddress("10.0.0.1"));
    assertFalse(banStore.deleteAddress("10.0.0.1"));
    assertEquals(2, banStore.deleteAddresses(List.of("10.0.0.2", "10.0.0.3", "10.0.0.9", "bad")));
    assertEquals(0, banStore.count());
  }

  @Test
  void deleteRangeReturnsDeletedAddressesOfSameFamily() {
    for (String address : List.of("10.0.0.1", "10.0.0.5", "10.0.0.9", "10.0.1.1", "::1", "::5")) {
      banStore.incrementFailedLogin(address, t(0), 1);
    }

    assertEquals(List.of("10.0.0.1", "10.0.0.5", "10.0.0.9"),
        banStore.deleteRange(AddressRange.parse("10.0.0.0/24")));
    assertEquals(List.of("::1"), banStore.deleteRange(AddressRange.parse("::1-::3")));
    assertTrue(banStore.deleteRange(AddressRange.parse("10.0.0.0/24")).isEmpty());

    assertEquals(2, banStore.count());
    assertTrue(banStore.getEntry("10.0.1.1").isPresent());
    assertTrue(banStore.getEntry("::5").isPresent());
  }

  @Test
  void deletePendingRemoveBypassesReconciliation() {
    banStore.applyBan("10.0.0.1", t(0), t(20), t(0));
    banStore.applyBan("10.0.0.2", t(0), t(20), t(0));
    banStore.setState(List.of("10.0.0.1"), AddressState.REMOVE_PENDING);

    assertEquals(1, banStore.deletePendingRemove());
    assertEquals(List.of(new AddressDelta("10.0.0.2", true)), reconcile(false, t(1)));
  }

  @Test
  void truncateNeedsConfirmation() {
    banStore.incrementFailedLogin("10.0.0.1", t(0), 1);
    banStore.incrementFailedLogin("10.0.0.2", t(0), 1);

    assertEquals(0, banStore.truncate(false));
    assertEquals(2, banStore.count());
    assertEquals(2, banStore.truncate(true));
    assertEquals(0, banStore.count());
  }

  // ── schema ──────────────────────────────────────────────────────

  @Test
  void schemaSetupIsRepeatable() {
    banStore.incrementFailedLogin("10.0.0.1", t(0), 1);

    BanStore reopened = newBanStore(addressStore);

    assertEquals(1, reopened.count());
  }

  @Test
  void migratesLegacyTable() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("CREATE TABLE legacy_addresses ("
          + "address VARBINARY(16) NOT NULL, address_text VARCHAR(64) NOT NULL, "
          + "last_failed_login BIGINT NOT NULL, failed_login_count BIGINT NOT NULL, "
          + "ban_date BIGINT NULL, PRIMARY KEY (address))");
      insertLegacy(conn, "10.0.0.1", 7, null);
      insertLegacy(conn, "10.0.0.2", 0, t(5).toEpochMilli());
    }

    BanStore migrated = newBanStore(addressStore.withTableName("legacy_addresses"));

    AddressEntry counting = migrated.getEntry("10.0.0.1").orElseThrow();
    assertEquals(AddressState.FAILED_LOGIN, counting.state());
    assertEquals(7, counting.failedLoginCount());

    AddressEntry banned = migrated.getEntry("10.0.0.2").orElseThrow();
    assertEquals(AddressState.ACTIVE, banned.state());
    assertEquals(new BanWindow(t(5), Instant.EPOCH), banned.banWindow().orElseThrow());

    assertTrue(migrated.applyBan("10.0.0.2", t(10), t(20), t(10)));
    assertEquals(AddressState.ACTIVE, migrated.getState("10.0.0.2").orElseThrow());
    assertEquals(8, migrated.incrementFailedLogin("10.0.0.1", t(11), 1));
    assertNull(migrated.getEntry("10.0.0.1").orElseThrow().banEndDate());
  }

  private static void insertLegacy(Connection conn, String address, long count, Long banDate)
      throws Exception {
    try (PreparedStatement ps = conn.prepareStatement("INSERT INTO legacy_addresses "
        + "(address, address_text, last_failed_login, failed_login_count, ban_date) VALUES (?,?,?,?,?)")) {
      ps.setBytes(1, IpAddress.parse(address).toBytes());
      ps.setString(2, address);
      ps.setLong(3, T0.toEpochMilli());
      ps.setLong(4, count);
      if (banDate == null) {
        ps.setNull(5, java.sql.Types.BIGINT);
      } else {
        ps.setLong(5, banDate);
      }
      ps.executeUpdate();
    }
  }
}

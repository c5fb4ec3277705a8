package banstore.spi;

import banstore.model.AddressEntry;
import banstore.model.AddressRange;
import banstore.model.AddressState;
import banstore.model.BanWindow;
import banstore.model.EntryFilter;
import banstore.model.IpAddress;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persistence contract for address rows and their lifecycle transitions:
 * FAILED_LOGIN → ADD_PENDING → ACTIVE → REMOVE_PENDING(_BECOME_FAILED_LOGIN) → deleted
 * or FAILED_LOGIN.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code banstore-jdbc} module.
 *
 * @see banstore.jdbc.store.AbstractJdbcAddressStore
 */
public interface AddressStore {

    /**
     * Creates the table if absent, adds columns introduced after the first schema version,
     * creates indexes and heals rows from older versions. Safe to run on every start.
     *
     * @param conn an auto-commit connection
     */
    void initializeSchema(Connection conn);

    /**
     * Looks up a single row.
     *
     * @param conn    the JDBC connection
     * @param address the address key
     * @return the row, or empty if absent
     */
    Optional<AddressEntry> find(Connection conn, IpAddress address);

    /**
     * Looks up the state of a single row.
     */
    Optional<AddressState> findState(Connection conn, IpAddress address);

    /**
     * Looks up the ban window of a single row. Empty if the row is absent or has no window.
     */
    Optional<BanWindow> findBanWindow(Connection conn, IpAddress address);

    /**
     * Inserts a row in ADD_PENDING, or reopens the ban window of an existing row unless it
     * is REMOVE_PENDING or still holds an unexpired ban. An ACTIVE row stays ACTIVE; any
     * other updated row becomes ADD_PENDING.
     *
     * @param conn    the JDBC connection
     * @param address the address key
     * @param start   ban start
     * @param end     ban end
     * @param now     current time, compared against the existing ban end
     * @return the number of rows inserted or updated (0 or 1)
     */
    int upsertBan(Connection conn, IpAddress address, Instant start, Instant end, Instant now);

    /**
     * Inserts a row in FAILED_LOGIN with the given count, or adds {@code amount} to the
     * counter of an existing FAILED_LOGIN row. Rows in other states are left untouched.
     *
     * <p>Implementations <strong>must</strong> read the counter back on the same
     * connection so that, inside a transaction, the result reflects this update.
     *
     * @param conn    the JDBC connection
     * @param address the address key
     * @param when    time of the failed login
     * @param amount  increment
     * @return the counter value after the attempted update
     */
    int incrementFailedLogin(Connection conn, IpAddress address, Instant when, int amount);

    /**
     * Sets the state of one row.
     *
     * @return the number of rows updated (0 or 1)
     */
    int updateState(Connection conn, IpAddress address, AddressState state);

    /**
     * Sets the state of every row.
     *
     * @return the number of rows updated
     */
    int updateAllStates(Connection conn, AddressState state);

    /**
     * Deletes one row.
     *
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, IpAddress address);

    /**
     * Deletes every row of the range's family whose key lies within the range.
     *
     * @return canonical text of the deleted addresses, in address order
     */
    List<String> deleteRange(Connection conn, AddressRange range);

    /**
     * Deletes every row in the given state.
     *
     * @return the number of rows deleted
     */
    int deleteByState(Connection conn, AddressState state);

    /**
     * Deletes every row.
     *
     * @return the number of rows deleted
     */
    int truncate(Connection conn);

    /** Counts all rows. */
    int count(Connection conn);

    /** Counts rows carrying a ban start date. */
    int countBanned(Connection conn);

    /** Counts rows in the given state. */
    int countByState(Connection conn, AddressState state);

    /**
     * Lazily scans rows matching {@code filter}, ordered by address key. Closing the stream
     * releases the statement; the connection stays open.
     */
    Stream<AddressEntry> scan(Connection conn, EntryFilter filter);

    /**
     * Lazily scans ACTIVE rows with a ban start date, ordered by address key.
     */
    Stream<String> scanBanned(Connection conn);

    /**
     * Lazily scans rows in ADD_PENDING, REMOVE_PENDING or
     * REMOVE_PENDING_BECOME_FAILED_LOGIN, ordered by address key.
     */
    Stream<AddressEntry> scanPending(Connection conn);

    /**
     * Applies the terminal reconciliation transitions to rows previously returned by
     * {@link #scanPending}: ADD_PENDING → ACTIVE, REMOVE_PENDING_BECOME_FAILED_LOGIN →
     * FAILED_LOGIN with {@code lastFailedLogin = now}, REMOVE_PENDING rows deleted. Each
     * update is guarded by the state the row was read in.
     *
     * @param conn                  the JDBC connection holding the reconciliation transaction
     * @param pending               rows as read by {@link #scanPending}
     * @param now                   current time
     * @param resetFailedLoginCount whether updated rows get their counter reset to 0
     * @return the number of rows updated or deleted
     */
    int completePending(Connection conn, List<AddressEntry> pending, Instant now,
        boolean resetFailedLoginCount);

    /**
     * Isolation level of implicit transactions and delta cursors when none is configured.
     * Must be a level under which this backend's guarded upserts are race-free.
     *
     * @return one of the {@code Connection.TRANSACTION_*} constants
     */
    default int defaultIsolationLevel() {
        return Connection.TRANSACTION_SERIALIZABLE;
    }
}

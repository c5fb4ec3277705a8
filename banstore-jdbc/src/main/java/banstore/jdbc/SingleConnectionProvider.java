package banstore.jdbc;

import banstore.spi.ConnectionProvider;

import java.sql.Array;
import java.sql.Blob;
import java.sql.CallableStatement;
import java.sql.ClientInfoStatus;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.NClob;
import java.sql.PreparedStatement;
import java.sql.SQLClientInfoException;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Struct;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ConnectionProvider} sharing one long-lived connection, for in-memory databases
 * (e.g. {@code jdbc:sqlite::memory:}) whose contents vanish when the last connection
 * closes.
 *
 * <p>Handed-out connections ignore {@code close()} apart from releasing the checkout.
 * Checkouts are serialized: a lock is held from {@link #getConnection()} until the handed
 * out connection is closed. A checkout must be closed on the thread that took it.
 *
 * <p>The lock is reentrant. A nested checkout on the same thread, taken while the outer
 * one has a transaction open, joins that transaction: its {@code commit}, {@code rollback},
 * {@code setAutoCommit} and {@code setTransactionIsolation} calls are ignored, so the work
 * commits or rolls back with the outer transaction.
 *
 * <p>{@link #close()} closes the underlying connection.
 */
public final class SingleConnectionProvider implements ConnectionProvider, AutoCloseable {
  private final Connection target;
  private final ReentrantLock lock = new ReentrantLock();

  public SingleConnectionProvider(Connection target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  @Override
  public Connection getConnection() throws SQLException {
    lock.lock();
    try {
      if (target.isClosed()) {
        throw new SQLException("Shared connection is closed");
      }
      boolean joined = lock.getHoldCount() > 1 && !target.getAutoCommit();
      return new Checkout(joined);
    } catch (SQLException | RuntimeException e) {
      lock.unlock();
      throw e;
    }
  }

  @Override
  public void close() throws SQLException {
    lock.lock();
    try {
      target.close();
    } finally {
      lock.unlock();
    }
  }

  private final class Checkout implements Connection {
    private final boolean joined;
    private boolean released;

    private Checkout(boolean joined) {
      this.joined = joined;
    }

    private Connection target() throws SQLException {
      if (released) {
        throw new SQLException("Connection checkout already closed");
      }
      return target;
    }

    // ── transaction control ───────────────────────────────────────

    @Override
    public void setAutoCommit(boolean autoCommit) throws SQLException {
      Connection conn = target();
      if (!joined) {
        conn.setAutoCommit(autoCommit);
      }
    }

    @Override
    public boolean getAutoCommit() throws SQLException {
      return target().getAutoCommit();
    }

    @Override
    public void commit() throws SQLException {
      Connection conn = target();
      if (!joined) {
        conn.commit();
      }
    }

    @Override
    public void rollback() throws SQLException {
      Connection conn = target();
      if (!joined) {
        conn.rollback();
      }
    }

    @Override
    public void rollback(Savepoint savepoint) throws SQLException {
      target().rollback(savepoint);
    }

    @Override
    public void setTransactionIsolation(int level) throws SQLException {
      Connection conn = target();
      if (!joined) {
        conn.setTransactionIsolation(level);
      }
    }

    @Override
    public int getTransactionIsolation() throws SQLException {
      return target().getTransactionIsolation();
    }

    @Override
    public Savepoint setSavepoint() throws SQLException {
      return target().setSavepoint();
    }

    @Override
    public Savepoint setSavepoint(String name) throws SQLException {
      return target().setSavepoint(name);
    }

    @Override
    public void releaseSavepoint(Savepoint savepoint) throws SQLException {
      target().releaseSavepoint(savepoint);
    }

    // ── checkout lifecycle ────────────────────────────────────────

    @Override
    public void close() {
      if (!released) {
        released = true;
        lock.unlock();
      }
    }

    @Override
    public boolean isClosed() throws SQLException {
      return released || target.isClosed();
    }

    @Override
    public boolean isValid(int timeout) throws SQLException {
      return !released && target.isValid(timeout);
    }

    @Override
    public void abort(Executor executor) throws SQLException {
      target().abort(executor);
    }

    // ── statements ────────────────────────────────────────────────

    @Override
    public Statement createStatement() throws SQLException {
      return target().createStatement();
    }

    @Override
    public Statement createStatement(int resultSetType, int resultSetConcurrency) throws SQLException {
      return target().createStatement(resultSetType, resultSetConcurrency);
    }

    @Override
    public Statement createStatement(int resultSetType, int resultSetConcurrency,
        int resultSetHoldability) throws SQLException {
      return target().createStatement(resultSetType, resultSetConcurrency, resultSetHoldability);
    }

    @Override
    public PreparedStatement prepareStatement(String sql) throws SQLException {
      return target().prepareStatement(sql);
    }

    @Override
    public PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency)
        throws SQLException {
      return target().prepareStatement(sql, resultSetType, resultSetConcurrency);
    }

    @Override
    public PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency,
        int resultSetHoldability) throws SQLException {
      return target().prepareStatement(sql, resultSetType, resultSetConcurrency, resultSetHoldability);
    }

    @Override
    public PreparedStatement prepareStatement(String sql, int autoGeneratedKeys) throws SQLException {
      return target().prepareStatement(sql, autoGeneratedKeys);
    }

    @Override
    public PreparedStatement prepareStatement(String sql, int[] columnIndexes) throws SQLException {
      return target().prepareStatement(sql, columnIndexes);
    }

    @Override
    public PreparedStatement prepareStatement(String sql, String[] columnNames) throws SQLException {
      return target().prepareStatement(sql, columnNames);
    }

    @Override
    public CallableStatement prepareCall(String sql) throws SQLException {
      return target().prepareCall(sql);
    }

    @Override
    public CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency)
        throws SQLException {
      return target().prepareCall(sql, resultSetType, resultSetConcurrency);
    }

    @Override
    public CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency,
        int resultSetHoldability) throws SQLException {
      return target().prepareCall(sql, resultSetType, resultSetConcurrency, resultSetHoldability);
    }

    @Override
    public String nativeSQL(String sql) throws SQLException {
      return target().nativeSQL(sql);
    }

    // ── plain delegation ──────────────────────────────────────────

    @Override
    public DatabaseMetaData getMetaData() throws SQLException {
      return target().getMetaData();
    }

    @Override
    public void setReadOnly(boolean readOnly) throws SQLException {
      target().setReadOnly(readOnly);
    }

    @Override
    public boolean isReadOnly() throws SQLException {
      return target().isReadOnly();
    }

    @Override
    public void setCatalog(String catalog) throws SQLException {
      target().setCatalog(catalog);
    }

    @Override
    public String getCatalog() throws SQLException {
      return target().getCatalog();
    }

    @Override
    public SQLWarning getWarnings() throws SQLException {
      return target().getWarnings();
    }

    @Override
    public void clearWarnings() throws SQLException {
      target().clearWarnings();
    }

    @Override
    public Map<String, Class<?>> getTypeMap() throws SQLException {
      return target().getTypeMap();
    }

    @Override
    public void setTypeMap(Map<String, Class<?>> map) throws SQLException {
      target().setTypeMap(map);
    }

    @Override
    public void setHoldability(int holdability) throws SQLException {
      target().setHoldability(holdability);
    }

    @Override
    public int getHoldability() throws SQLException {
      return target().getHoldability();
    }

    @Override
    public Clob createClob() throws SQLException {
      return target().createClob();
    }

    @Override
    public Blob createBlob() throws SQLException {
      return target().createBlob();
    }

    @Override
    public NClob createNClob() throws SQLException {
      return target().createNClob();
    }

    @Override
    public SQLXML createSQLXML() throws SQLException {
      return target().createSQLXML();
    }

    @Override
    public void setClientInfo(String name, String value) throws SQLClientInfoException {
      checkClientInfo();
      target.setClientInfo(name, value);
    }

    @Override
    public void setClientInfo(Properties properties) throws SQLClientInfoException {
      checkClientInfo();
      target.setClientInfo(properties);
    }

    private void checkClientInfo() throws SQLClientInfoException {
      if (released) {
        throw new SQLClientInfoException("Connection checkout already closed",
            Map.<String, ClientInfoStatus>of());
      }
    }

    @Override
    public String getClientInfo(String name) throws SQLException {
      return target().getClientInfo(name);
    }

    @Override
    public Properties getClientInfo() throws SQLException {
      return target().getClientInfo();
    }

    @Override
    public Array createArrayOf(String typeName, Object[] elements) throws SQLException {
      return target().createArrayOf(typeName, elements);
    }

    @Override
    public Struct createStruct(String typeName, Object[] attributes) throws SQLException {
      return target().createStruct(typeName, attributes);
    }

    @Override
    public void setSchema(String schema) throws SQLException {
      target().setSchema(schema);
    }

    @Override
    public String getSchema() throws SQLException {
      return target().getSchema();
    }

    @Override
    public void setNetworkTimeout(Executor executor, int milliseconds) throws SQLException {
      target().setNetworkTimeout(executor, milliseconds);
    }

    @Override
    public int getNetworkTimeout() throws SQLException {
      return target().getNetworkTimeout();
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
      return iface.isInstance(this) ? iface.cast(this) : target().unwrap(iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
      return iface.isInstance(this) || target().isWrapperFor(iface);
    }

    @Override
    public String toString() {
      return "SingleConnectionProvider checkout of " + target;
    }
  }
}

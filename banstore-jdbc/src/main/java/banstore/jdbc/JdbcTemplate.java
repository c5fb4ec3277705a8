package banstore.jdbc;

import banstore.AddressStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lightweight JDBC helper to reduce boilerplate in address store implementations.
 */
public final class JdbcTemplate {
  private static final Logger logger = Logger.getLogger(JdbcTemplate.class.getName());

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to execute update", e);
    }
  }

  /** Execute one statement per parameter row as a batch, return total rows affected. */
  public static int batchUpdate(Connection conn, String sql, List<Object[]> batch) {
    if (batch.isEmpty()) {
      return 0;
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] params : batch) {
        bindParams(ps, params);
        ps.addBatch();
      }
      int total = 0;
      for (int n : ps.executeBatch()) {
        // SUCCESS_NO_INFO counts as one row
        total += n == PreparedStatement.SUCCESS_NO_INFO ? 1 : Math.max(n, 0);
      }
      return total;
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to execute batch update", e);
    }
  }

  /** Execute a DDL or PRAGMA statement. */
  public static void execute(Connection conn, String sql) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.execute();
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT, map the first row if any. */
  public static <T> Optional<T> queryForOptional(Connection conn, String sql, RowMapper<T> mapper,
      Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new AddressStoreException("Failed to execute query", e);
    }
  }

  /** Execute a single-value SELECT (e.g. COUNT), 0 if no row. */
  public static int queryForInt(Connection conn, String sql, Object... params) {
    return queryForOptional(conn, sql, rs -> clampToInt(rs.getLong(1)), params).orElse(0);
  }

  /**
   * Execute SELECT and return a lazy stream over the rows. The statement stays open until
   * the stream is closed; the connection is never closed here.
   */
  public static <T> Stream<T> stream(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    PreparedStatement ps = null;
    try {
      ps = conn.prepareStatement(sql);
      bindParams(ps, params);
      ResultSet rs = ps.executeQuery();
      PreparedStatement statement = ps;
      Spliterator<T> rows = new Spliterators.AbstractSpliterator<T>(Long.MAX_VALUE, Spliterator.ORDERED) {
        @Override
        public boolean tryAdvance(Consumer<? super T> action) {
          try {
            if (!rs.next()) {
              return false;
            }
            action.accept(mapper.map(rs));
            return true;
          } catch (SQLException e) {
            throw new AddressStoreException("Failed to read row", e);
          }
        }
      };
      return StreamSupport.stream(rows, false).onClose(() -> closeQuietly(rs, statement));
    } catch (SQLException e) {
      if (ps != null) {
        closeQuietly(null, ps);
      }
      throw new AddressStoreException("Failed to execute query", e);
    }
  }

  /** Saturating long to int conversion for counters and counts. */
  public static int clampToInt(long value) {
    if (value > Integer.MAX_VALUE) return Integer.MAX_VALUE;
    if (value < Integer.MIN_VALUE) return Integer.MIN_VALUE;
    return (int) value;
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof byte[] b) {
        ps.setBytes(i + 1, b);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private static void closeQuietly(ResultSet rs, PreparedStatement ps) {
    try {
      if (rs != null) {
        rs.close();
      }
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close result set", e);
    }
    try {
      ps.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close statement", e);
    }
  }

  private JdbcTemplate() {}
}

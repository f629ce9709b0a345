package modeldeploy.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;

/**
 * Static JDBC helpers for the model stores. {@link SQLException}s surface as
 * {@link ModelStoreException}.
 */
public final class JdbcTemplate {

  /**
   * NULL parameter bound with an explicit SQL type, for drivers that cannot infer one.
   *
   * @param sqlType a {@link java.sql.Types} constant
   */
  public record TypedNull(int sqlType) {}

  public static TypedNull nullOf(int sqlType) {
    return new TypedNull(sqlType);
  }

  /** Execute DDL or any statement without parameters. */
  public static void execute(Connection conn, String sql) {
    try (Statement st = conn.createStatement()) {
      st.execute(sql);
    } catch (SQLException e) {
      throw new ModelStoreException("Failed to execute statement: " + sql, e);
    }
  }

  /**
   * Execute a single-row INSERT and return the generated key.
   *
   * @param keyColumns generated columns to ask the driver for, or {@code null} to let it
   *     return the identity column
   */
  public static long insertReturningKey(Connection conn, String sql, String[] keyColumns, Object... params) {
    try (PreparedStatement ps = keyColumns == null
        ? conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)
        : conn.prepareStatement(sql, keyColumns)) {
      bindParams(ps, params);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new ModelStoreException("Insert returned no generated key");
        }
        return keys.getLong(1);
      }
    } catch (SQLException e) {
      throw new ModelStoreException("Failed to execute insert", e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof TypedNull n) {
        ps.setNull(i + 1, n.sqlType());
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else if (param instanceof byte[] bytes) {
        ps.setBytes(i + 1, bytes);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}

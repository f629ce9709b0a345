package modeldeploy.jdbc;

import modeldeploy.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} that opens a fresh, unpooled connection per request through
 * {@link DriverManager}. The JDBC driver must be on the classpath.
 *
 * <p>No connection is opened until {@link #getConnection()} is called.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
  private final String jdbcUrl;
  private final String username;
  private final String password;

  public DriverManagerConnectionProvider(String jdbcUrl) {
    this(jdbcUrl, null, null);
  }

  public DriverManagerConnectionProvider(String jdbcUrl, String username, String password) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    this.username = username;
    this.password = password;
  }

  public static DriverManagerConnectionProvider of(DatabaseUri uri) {
    return new DriverManagerConnectionProvider(uri.jdbcUrl(), uri.username(), uri.password());
  }

  public String jdbcUrl() {
    return jdbcUrl;
  }

  @Override
  public Connection getConnection() throws SQLException {
    if (username == null) {
      return DriverManager.getConnection(jdbcUrl);
    }
    return DriverManager.getConnection(jdbcUrl, username, password);
  }

  @Override
  public String toString() {
    return "DriverManagerConnectionProvider{" + jdbcUrl + "}";
  }
}

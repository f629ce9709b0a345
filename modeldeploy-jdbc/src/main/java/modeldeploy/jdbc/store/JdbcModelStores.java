package modeldeploy.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Dialect lookup for the model stores registered in
 * {@code META-INF/services/modeldeploy.jdbc.store.AbstractJdbcModelStore}.
 *
 * <p>Stores hold no per-table state, so one instance per dialect serves every table.
 *
 * <pre>{@code
 * AbstractJdbcModelStore store = JdbcModelStores.detect(dataSource);
 * AbstractJdbcModelStore pg = JdbcModelStores.get("postgresql");
 * }</pre>
 */
public final class JdbcModelStores {

  private static final Map<String, AbstractJdbcModelStore> REGISTERED = load();

  private JdbcModelStores() {
  }

  private static Map<String, AbstractJdbcModelStore> load() {
    Map<String, AbstractJdbcModelStore> stores = new LinkedHashMap<>();
    for (AbstractJdbcModelStore store : ServiceLoader.load(AbstractJdbcModelStore.class)) {
      AbstractJdbcModelStore previous = stores.putIfAbsent(lower(store.name()), store);
      if (previous != null) {
        throw new IllegalStateException("Duplicate model store name '" + store.name() + "': "
            + previous.getClass().getName() + " and " + store.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(stores);
  }

  /**
   * Returns every registered store, in registration order.
   */
  public static List<AbstractJdbcModelStore> all() {
    return List.copyOf(REGISTERED.values());
  }

  /**
   * Returns the store registered under {@code name}, ignoring case.
   *
   * @throws IllegalArgumentException if no store has that name
   */
  public static AbstractJdbcModelStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcModelStore store = REGISTERED.get(lower(name));
    if (store == null) {
      throw new IllegalArgumentException("Unknown model store: " + name
          + ". Available: " + REGISTERED.keySet());
    }
    return store;
  }

  /**
   * Returns the store whose URL prefix matches {@code jdbcUrl}, if any.
   */
  public static Optional<AbstractJdbcModelStore> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    String url = lower(jdbcUrl);
    return REGISTERED.values().stream()
        .filter(store -> store.jdbcUrlPrefixes().stream().anyMatch(p -> url.startsWith(lower(p))))
        .findFirst();
  }

  /**
   * Detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or matches no store
   */
  public static AbstractJdbcModelStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No model store found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + prefixes()));
  }

  /**
   * Detects the store from a live connection: by URL first, then by database product name
   * for drivers that wrap another driver's URL.
   *
   * @throws IllegalStateException if neither matches a registered store
   */
  public static AbstractJdbcModelStore detect(Connection conn) throws SQLException {
    DatabaseMetaData meta = conn.getMetaData();
    String url = meta.getURL();
    Optional<AbstractJdbcModelStore> byUrl = find(url);
    if (byUrl.isPresent()) {
      return byUrl.get();
    }
    String productName = meta.getDatabaseProductName();
    String product = lower(String.valueOf(productName));
    return REGISTERED.values().stream()
        .filter(store -> store.productNames().stream().anyMatch(product::contains))
        .findFirst()
        .orElseThrow(() -> new IllegalStateException(
            "No model store for database '" + productName + "' at " + url));
  }

  /**
   * Detects the store from a connection borrowed from {@code dataSource}.
   *
   * @throws IllegalStateException if no connection can be obtained or no store matches
   */
  public static AbstractJdbcModelStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect model store from DataSource", e);
    }
  }

  private static List<String> prefixes() {
    return REGISTERED.values().stream()
        .flatMap(store -> store.jdbcUrlPrefixes().stream())
        .toList();
  }

  private static String lower(String s) {
    return s.toLowerCase(Locale.ROOT);
  }
}

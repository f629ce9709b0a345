package modeldeploy.schema;

import modeldeploy.DeploymentException;
import modeldeploy.spi.ConnectionProvider;
import modeldeploy.spi.MetricsExporter;
import modeldeploy.spi.ModelStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces one {@link TableSchema} per table name and makes sure its physical table exists.
 *
 * <p>The first request for a name checks whether the table exists and, if not, issues
 * the store's create statement on a dedicated auto-commit connection. Later requests for
 * the same name return the cached schema without touching the database. A table that
 * already exists is trusted as is: its columns are not compared with the schema, so a
 * mismatched table fails at insert time.
 *
 * <p>Safe for concurrent use. Two threads creating the same new table may both issue
 * the create statement; the loser's "already exists" failure counts as success.
 */
public final class SchemaRegistry {
  private static final Logger logger = Logger.getLogger(SchemaRegistry.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ModelStore modelStore;
  private final MetricsExporter metrics;
  private final Map<String, TableSchema> schemas = new ConcurrentHashMap<>();

  public SchemaRegistry(ConnectionProvider connectionProvider, ModelStore modelStore) {
    this(connectionProvider, modelStore, MetricsExporter.NOOP);
  }

  public SchemaRegistry(ConnectionProvider connectionProvider, ModelStore modelStore,
      MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.modelStore = Objects.requireNonNull(modelStore, "modelStore");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /**
   * Returns the schema for {@code tableName}, creating the physical table if absent.
   *
   * @throws DeploymentException with kind {@code SCHEMA_CREATION} if the name is invalid
   *     or the database rejects the table creation
   */
  public TableSchema getOrCreate(String tableName) {
    TableNames.validate(tableName);
    TableSchema cached = schemas.get(tableName);
    if (cached != null) {
      return cached;
    }
    TableSchema schema = TableSchema.deployedModels(tableName);
    ensureTable(schema);
    TableSchema previous = schemas.putIfAbsent(tableName, schema);
    return previous != null ? previous : schema;
  }

  private void ensureTable(TableSchema schema) {
    String tableName = schema.tableName();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (modelStore.tableExists(conn, tableName)) {
        logger.log(Level.FINE, "Table {0} already exists", tableName);
        return;
      }
      try {
        modelStore.createTable(conn, schema);
      } catch (RuntimeException e) {
        if (existsAfterFailure(conn, tableName, e)) {
          logger.log(Level.FINE, "Table {0} was created concurrently", tableName);
          return;
        }
        throw DeploymentException.schemaCreation(tableName, e);
      }
      logger.log(Level.INFO, "Created table {0}", tableName);
      try {
        metrics.incrementTableCreated();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Metrics exporter failed", e);
      }
    } catch (SQLException e) {
      throw DeploymentException.schemaCreation(tableName, e);
    }
  }

  private boolean existsAfterFailure(Connection conn, String tableName, RuntimeException failure) {
    try {
      return modelStore.tableExists(conn, tableName);
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
      return false;
    }
  }
}

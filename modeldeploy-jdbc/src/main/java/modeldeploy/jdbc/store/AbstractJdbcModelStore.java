package modeldeploy.jdbc.store;

import modeldeploy.jdbc.JdbcTemplate;
import modeldeploy.jdbc.ModelStoreException;
import modeldeploy.model.ModelRecordDraft;
import modeldeploy.schema.ColumnDefinition;
import modeldeploy.schema.ColumnType;
import modeldeploy.schema.TableSchema;
import modeldeploy.spi.ModelStore;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Base JDBC model store with standard SQL implementations.
 *
 * <p>Subclasses render {@link ColumnType}s in their dialect and may override the create
 * statement or the generated-key strategy. Register custom implementations via
 * {@code META-INF/services/modeldeploy.jdbc.store.AbstractJdbcModelStore}.
 *
 * <p>Stores are stateless; one instance serves every table.
 *
 * @see JdbcModelStores
 */
public abstract class AbstractJdbcModelStore implements ModelStore {

  /**
   * Unique identifier for this model store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this model store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Lower-case fragments of {@link java.sql.DatabaseMetaData#getDatabaseProductName()} this
   * store handles. Used when the JDBC URL belongs to a wrapping driver.
   */
  public List<String> productNames() {
    return List.of(name());
  }

  /**
   * Dialect type for a column, including any identity clause.
   */
  protected abstract String sqlType(ColumnDefinition column);

  @Override
  public boolean tableExists(Connection conn, String tableName) {
    try {
      DatabaseMetaData meta = conn.getMetaData();
      String escape = meta.getSearchStringEscape();
      String catalog = conn.getCatalog();
      String schema = conn.getSchema();
      // unquoted identifiers are folded differently per database
      for (String candidate : nameCandidates(tableName)) {
        try (ResultSet rs = meta.getTables(catalog, escapePattern(schema, escape),
            escapePattern(candidate, escape), null)) {
          while (rs.next()) {
            if (tableName.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
              return true;
            }
          }
        }
      }
      return false;
    } catch (SQLException e) {
      throw new ModelStoreException("Failed to check existence of table " + tableName, e);
    }
  }

  @Override
  public void createTable(Connection conn, TableSchema schema) {
    JdbcTemplate.execute(conn, createTableSql(schema));
  }

  @Override
  public long insert(Connection conn, TableSchema schema, ModelRecordDraft draft, Instant deploymentTime) {
    List<ColumnDefinition> columns = schema.insertableColumns();
    List<Object> params = new ArrayList<>(columns.size());
    for (ColumnDefinition column : columns) {
      params.add(value(column, draft, deploymentTime));
    }
    String sql = "INSERT INTO " + schema.tableName() + " ("
        + columns.stream().map(ColumnDefinition::name).collect(Collectors.joining(", "))
        + ") VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(",")) + ")";
    return JdbcTemplate.insertReturningKey(conn, sql, generatedKeyColumns(schema), params.toArray());
  }

  /**
   * Create-if-absent statement for the schema.
   */
  protected String createTableSql(TableSchema schema) {
    return "CREATE TABLE IF NOT EXISTS " + schema.tableName() + " (" + tableBody(schema) + ")";
  }

  /**
   * Column definitions and the named primary-key constraint.
   */
  protected String tableBody(TableSchema schema) {
    StringBuilder body = new StringBuilder();
    for (ColumnDefinition column : schema.columns()) {
      body.append(column.name()).append(' ').append(sqlType(column));
      if (!column.nullable() && !column.generated()) {
        body.append(" NOT NULL");
      }
      body.append(", ");
    }
    body.append("CONSTRAINT ").append(schema.primaryKeyName())
        .append(" PRIMARY KEY (").append(schema.primaryKeyColumn()).append(')');
    return body.toString();
  }

  /**
   * Columns to request from {@link java.sql.Connection#prepareStatement(String, String[])},
   * or {@code null} to use {@link java.sql.Statement#RETURN_GENERATED_KEYS}.
   */
  protected String[] generatedKeyColumns(TableSchema schema) {
    return null;
  }

  private static Object value(ColumnDefinition column, ModelRecordDraft draft, Instant deploymentTime) {
    switch (column.name()) {
      case TableSchema.MODEL_NAME:
        return draft.modelName();
      case TableSchema.MODEL_VERSION:
        return draft.modelVersion();
      case TableSchema.MODEL_FRAMEWORK:
        return draft.framework();
      case TableSchema.MODEL_FRAMEWORK_VERSION:
        return draft.frameworkVersion();
      case TableSchema.MODEL:
        return draft.payload();
      case TableSchema.MODEL_CREATION_TIME:
        return draft.creationTime() == null
            ? JdbcTemplate.nullOf(Types.TIMESTAMP) : Timestamp.from(draft.creationTime());
      case TableSchema.MODEL_DEPLOYMENT_TIME:
        return Timestamp.from(deploymentTime);
      case TableSchema.DEPLOYED_BY:
        return draft.deployedBy() == null ? JdbcTemplate.nullOf(Types.INTEGER) : draft.deployedBy();
      case TableSchema.MODEL_DESCRIPTION:
        return draft.description() == null ? JdbcTemplate.nullOf(Types.VARCHAR) : draft.description();
      case TableSchema.RUN_ID:
        return draft.runId() == null ? JdbcTemplate.nullOf(Types.VARCHAR) : draft.runId();
      default:
        throw new ModelStoreException("No value for column " + column.name());
    }
  }

  private static Set<String> nameCandidates(String tableName) {
    Set<String> names = new LinkedHashSet<>();
    names.add(tableName);
    names.add(tableName.toUpperCase(Locale.ROOT));
    names.add(tableName.toLowerCase(Locale.ROOT));
    return names;
  }

  private static String escapePattern(String name, String escape) {
    if (name == null || escape == null || escape.isEmpty()) {
      return name;
    }
    return name.replace(escape, escape + escape)
        .replace("_", escape + "_")
        .replace("%", escape + "%");
  }
}

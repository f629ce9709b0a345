package modeldeploy.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable row schema bound to one table name.
 *
 * <p>Two schemas built for the same table name are equal and describe the same columns
 * and constraints. Build them through {@link #deployedModels(String)}; the
 * {@link SchemaRegistry} keeps one instance per name.
 */
public final class TableSchema {
  public static final String MODEL_ID = "model_id";
  public static final String MODEL_NAME = "model_name";
  public static final String MODEL_VERSION = "model_version";
  public static final String MODEL_FRAMEWORK = "model_framework";
  public static final String MODEL_FRAMEWORK_VERSION = "model_framework_version";
  public static final String MODEL = "model";
  public static final String MODEL_CREATION_TIME = "model_creation_time";
  public static final String MODEL_DEPLOYMENT_TIME = "model_deployment_time";
  public static final String DEPLOYED_BY = "deployed_by";
  public static final String MODEL_DESCRIPTION = "model_description";
  public static final String RUN_ID = "run_id";

  private static final List<ColumnDefinition> DEPLOYED_MODEL_COLUMNS = List.of(
      ColumnDefinition.identity(MODEL_ID),
      ColumnDefinition.varchar(MODEL_NAME, 256, false),
      ColumnDefinition.varchar(MODEL_VERSION, 50, false),
      ColumnDefinition.varchar(MODEL_FRAMEWORK, 50, false),
      ColumnDefinition.varchar(MODEL_FRAMEWORK_VERSION, 50, false),
      ColumnDefinition.of(MODEL, ColumnType.BINARY, false),
      ColumnDefinition.of(MODEL_CREATION_TIME, ColumnType.TIMESTAMP, true),
      ColumnDefinition.of(MODEL_DEPLOYMENT_TIME, ColumnType.TIMESTAMP, false),
      ColumnDefinition.of(DEPLOYED_BY, ColumnType.INTEGER, true),
      ColumnDefinition.varchar(MODEL_DESCRIPTION, 1024, true),
      ColumnDefinition.varchar(RUN_ID, 100, true));

  private final String tableName;
  private final List<ColumnDefinition> columns;
  private final String primaryKeyColumn;
  private final String primaryKeyName;

  private TableSchema(String tableName, List<ColumnDefinition> columns, String primaryKeyColumn) {
    this.tableName = TableNames.validate(tableName);
    this.columns = List.copyOf(columns);
    this.primaryKeyColumn = primaryKeyColumn;
    this.primaryKeyName = "model_pk_" + tableName;
  }

  /**
   * Builds the deployed-model schema for the given table.
   *
   * @throws modeldeploy.DeploymentException with kind {@code SCHEMA_CREATION} if the name
   *     is not a valid identifier
   */
  public static TableSchema deployedModels(String tableName) {
    return new TableSchema(tableName, DEPLOYED_MODEL_COLUMNS, MODEL_ID);
  }

  public String tableName() {
    return tableName;
  }

  public List<ColumnDefinition> columns() {
    return columns;
  }

  public Optional<ColumnDefinition> column(String name) {
    return columns.stream().filter(c -> c.name().equals(name)).findFirst();
  }

  /** Columns the caller supplies values for, in declaration order. */
  public List<ColumnDefinition> insertableColumns() {
    return columns.stream().filter(c -> !c.generated()).collect(Collectors.toUnmodifiableList());
  }

  public String primaryKeyColumn() {
    return primaryKeyColumn;
  }

  public String primaryKeyName() {
    return primaryKeyName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TableSchema other)) return false;
    return tableName.equals(other.tableName) && columns.equals(other.columns)
        && primaryKeyColumn.equals(other.primaryKeyColumn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableName, columns, primaryKeyColumn);
  }

  @Override
  public String toString() {
    return "TableSchema{" + tableName + ", " + columns.size() + " columns}";
  }
}

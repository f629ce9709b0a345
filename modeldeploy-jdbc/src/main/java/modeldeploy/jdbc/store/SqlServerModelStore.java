package modeldeploy.jdbc.store;

import modeldeploy.schema.ColumnDefinition;
import modeldeploy.schema.TableSchema;

import java.util.List;

/**
 * Microsoft SQL Server model store.
 *
 * <p>SQL Server has no {@code CREATE TABLE IF NOT EXISTS}; creation is guarded with
 * {@code OBJECT_ID}. Text columns are {@code NVARCHAR}.
 */
public final class SqlServerModelStore extends AbstractJdbcModelStore {

  @Override
  public String name() {
    return "mssql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlserver:");
  }

  @Override
  public List<String> productNames() {
    return List.of("sql server");
  }

  @Override
  protected String sqlType(ColumnDefinition column) {
    return switch (column.type()) {
      case IDENTITY -> "INT IDENTITY(1,1) NOT NULL";
      case VARCHAR -> "NVARCHAR(" + column.length() + ")";
      case INTEGER -> "INT";
      case TIMESTAMP -> "DATETIME2";
      case BINARY -> "VARBINARY(MAX)";
    };
  }

  @Override
  protected String createTableSql(TableSchema schema) {
    return "IF OBJECT_ID(N'" + schema.tableName() + "', N'U') IS NULL CREATE TABLE "
        + schema.tableName() + " (" + tableBody(schema) + ")";
  }
}

package modeldeploy.jdbc.store;

import modeldeploy.schema.ColumnDefinition;
import modeldeploy.schema.TableSchema;

import java.util.List;

/**
 * PostgreSQL model store.
 *
 * <p>Asks only for {@code model_id} back from the insert; the driver would otherwise
 * append {@code RETURNING *} and ship the payload back.
 */
public final class PostgresModelStore extends AbstractJdbcModelStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String sqlType(ColumnDefinition column) {
    return switch (column.type()) {
      case IDENTITY -> "INTEGER GENERATED BY DEFAULT AS IDENTITY";
      case VARCHAR -> "VARCHAR(" + column.length() + ")";
      case INTEGER -> "INTEGER";
      case TIMESTAMP -> "TIMESTAMP";
      case BINARY -> "BYTEA";
    };
  }

  @Override
  protected String[] generatedKeyColumns(TableSchema schema) {
    return new String[]{schema.primaryKeyColumn()};
  }
}

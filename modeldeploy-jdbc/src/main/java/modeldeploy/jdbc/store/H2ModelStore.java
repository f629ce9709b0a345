package modeldeploy.jdbc.store;

import modeldeploy.schema.ColumnDefinition;

import java.util.List;

/**
 * H2 model store. Primarily for testing.
 */
public final class H2ModelStore extends AbstractJdbcModelStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String sqlType(ColumnDefinition column) {
    return switch (column.type()) {
      case IDENTITY -> "INTEGER GENERATED BY DEFAULT AS IDENTITY";
      case VARCHAR -> "VARCHAR(" + column.length() + ")";
      case INTEGER -> "INTEGER";
      case TIMESTAMP -> "TIMESTAMP";
      case BINARY -> "BLOB";
    };
  }
}

package modeldeploy.jdbc.store;

import modeldeploy.schema.ColumnDefinition;

import java.util.List;

/**
 * MySQL model store. Also handles MariaDB and TiDB URLs.
 *
 * <p>MySQL commits implicitly around DDL, which is why table creation runs on its own
 * connection before the insert transaction.
 */
public final class MySqlModelStore extends AbstractJdbcModelStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public List<String> productNames() {
    return List.of("mysql", "mariadb", "tidb");
  }

  @Override
  protected String sqlType(ColumnDefinition column) {
    return switch (column.type()) {
      case IDENTITY -> "INT NOT NULL AUTO_INCREMENT";
      case VARCHAR -> "VARCHAR(" + column.length() + ")";
      case INTEGER -> "INT";
      case TIMESTAMP -> "DATETIME(6)";
      case BINARY -> "LONGBLOB";
    };
  }
}

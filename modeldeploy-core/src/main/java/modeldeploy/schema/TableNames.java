package modeldeploy.schema;

import modeldeploy.DeploymentException;

/**
 * Shared table name validation. Table names are interpolated into DDL and DML, so only
 * plain identifiers are accepted. The length limit keeps the derived primary-key
 * constraint name ({@code model_pk_<table>}) within 63 characters.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "models";
  public static final int MAX_LENGTH = 54;
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * @throws DeploymentException with kind {@code SCHEMA_CREATION} if the name is not a
   *     plain identifier
   */
  public static String validate(String tableName) {
    if (tableName == null || tableName.length() > MAX_LENGTH
        || !tableName.matches(TABLE_NAME_PATTERN)) {
      throw DeploymentException.invalidTableName(tableName);
    }
    return tableName;
  }
}

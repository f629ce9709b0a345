package modeldeploy.schema;

import java.util.Objects;

/**
 * One column of a {@link TableSchema}.
 *
 * @param name     column name
 * @param type     portable type
 * @param length   maximum length for {@link ColumnType#VARCHAR}, otherwise 0
 * @param nullable whether the column accepts NULL
 */
public record ColumnDefinition(String name, ColumnType type, int length, boolean nullable) {

  public ColumnDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (type == ColumnType.VARCHAR && length <= 0) {
      throw new IllegalArgumentException("VARCHAR column " + name + " needs a positive length");
    }
  }

  static ColumnDefinition identity(String name) {
    return new ColumnDefinition(name, ColumnType.IDENTITY, 0, false);
  }

  static ColumnDefinition varchar(String name, int length, boolean nullable) {
    return new ColumnDefinition(name, ColumnType.VARCHAR, length, nullable);
  }

  static ColumnDefinition of(String name, ColumnType type, boolean nullable) {
    return new ColumnDefinition(name, type, 0, nullable);
  }

  /** Returns {@code true} if the store assigns the value. */
  public boolean generated() {
    return type == ColumnType.IDENTITY;
  }
}

package modeldeploy.schema;

/**
 * Portable column types. Each {@link modeldeploy.spi.ModelStore} renders them in its
 * own SQL dialect.
 */
public enum ColumnType {
  /** Store-assigned integer key. */
  IDENTITY,
  VARCHAR,
  INTEGER,
  TIMESTAMP,
  /** Unbounded binary payload. */
  BINARY
}

package modeldeploy.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link modeldeploy.jdbc.store.AbstractJdbcModelStore}
 * and its subclasses.
 */
public final class ModelStoreException extends RuntimeException {
  public ModelStoreException(String message) {
    super(message);
  }

  public ModelStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

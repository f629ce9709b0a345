package modeldeploy.tx;

import modeldeploy.DeploymentException;
import modeldeploy.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a unit of work inside one JDBC transaction with exactly one outcome.
 *
 * <pre>{@code
 * long id = txManager.withTransaction(tx ->
 *     store.insert(tx.connection(), schema, draft, Instant.now()));
 * }</pre>
 *
 * <p>The unit of work's result is returned after a successful commit. A failing commit
 * surfaces as {@link modeldeploy.ErrorKind#COMMIT}. If the unit of work throws, the
 * transaction is rolled back and the failure propagates: classified
 * {@link DeploymentException}s unchanged, anything else wrapped as
 * {@link modeldeploy.ErrorKind#INTERNAL}. The connection is released on every path.
 */
public final class TransactionManager {
  private static final Logger logger = Logger.getLogger(TransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public TransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Work executed inside a managed transaction.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface UnitOfWork<T> {
    T execute(Transaction tx) throws Exception;
  }

  /**
   * Executes {@code work} in a new transaction.
   *
   * @return the value returned by {@code work}
   * @throws DeploymentException on any failure, classified as described above
   */
  public <T> T withTransaction(UnitOfWork<T> work) {
    Objects.requireNonNull(work, "work");
    Transaction tx = begin();
    T result;
    try {
      result = work.execute(tx);
    } catch (Exception e) {
      DeploymentException failure = DeploymentException.classify(e);
      tx.rollback(failure);
      throw failure;
    } catch (Error e) {
      tx.rollback(e);
      throw e;
    }
    tx.commit();
    return result;
  }

  private Transaction begin() {
    Connection connection;
    try {
      connection = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw DeploymentException.internal("Failed to obtain a database connection", e);
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      DeploymentException failure =
          DeploymentException.internal("Failed to start a database transaction", e);
      closeQuietly(connection, failure);
      throw failure;
    }
    return new Transaction(connection);
  }

  private static void closeQuietly(Connection connection, Throwable failure) {
    try {
      connection.close();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  /**
   * Handle of the active transaction passed to a {@link UnitOfWork}.
   *
   * <p>Only the manager commits, rolls back or closes the underlying connection.
   */
  public static final class Transaction {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    private void commit() {
      DeploymentException failure = null;
      try {
        connection.commit();
      } catch (SQLException e) {
        failure = DeploymentException.commit(e);
        safeRollback(failure);
      } finally {
        release(failure);
      }
      if (failure != null) {
        throw failure;
      }
    }

    private void rollback(Throwable failure) {
      try {
        safeRollback(failure);
      } finally {
        release(failure);
      }
    }

    private void safeRollback(Throwable failure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        failure.addSuppressed(e);
      }
    }

    private void release(Throwable failure) {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        if (failure != null) {
          failure.addSuppressed(e);
        } else {
          logger.log(Level.FINE, "Failed to restore auto-commit", e);
        }
      } finally {
        try {
          connection.close();
        } catch (SQLException e) {
          if (failure != null) {
            failure.addSuppressed(e);
          } else {
            logger.log(Level.WARNING, "Failed to close connection after commit", e);
          }
        }
      }
    }
  }
}

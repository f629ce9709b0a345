package modeldeploy.tx;

import modeldeploy.DeploymentException;
import modeldeploy.ErrorKind;
import modeldeploy.spi.ConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransactionManagerTest {
  private JdbcDataSource dataSource;
  private RecordingProvider provider;
  private TransactionManager txManager;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:txmgr_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    provider = new RecordingProvider(dataSource, false);
    txManager = new TransactionManager(provider);

    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute(
          "CREATE TABLE test_data (id INT PRIMARY KEY, val VARCHAR(100))");
    }
  }

  @Test
  void constructorRejectsNullConnectionProvider() {
    assertThrows(NullPointerException.class, () -> new TransactionManager(null));
  }

  @Test
  void successCommitsAndReturnsResult() throws Exception {
    String result = txManager.withTransaction(tx -> {
      insert(tx.connection(), 1, "hello");
      return "done";
    });

    assertEquals("done", result);
    assertEquals("hello", queryValue(1));
    assertEquals(List.of("setAutoCommit(false)", "commit", "setAutoCommit(true)", "close"),
        provider.calls);
  }

  @Test
  void classifiedFailureRollsBackAndPropagatesUnchanged() throws Exception {
    DeploymentException original = DeploymentException.missingArtifactData("gone");

    DeploymentException thrown = assertThrows(DeploymentException.class, () ->
        txManager.withTransaction(tx -> {
          insert(tx.connection(), 1, "hello");
          throw original;
        }));

    assertSame(original, thrown);
    assertNull(queryValue(1));
    assertEquals(List.of("setAutoCommit(false)", "rollback", "setAutoCommit(true)", "close"),
        provider.calls);
  }

  @Test
  void unclassifiedFailureRollsBackAndIsWrappedAsInternal() throws Exception {
    IOException cause = new IOException("disk on fire");

    DeploymentException thrown = assertThrows(DeploymentException.class, () ->
        txManager.withTransaction(tx -> {
          insert(tx.connection(), 1, "hello");
          throw cause;
        }));

    assertEquals(ErrorKind.INTERNAL, thrown.kind());
    assertSame(cause, thrown.getCause());
    assertNull(queryValue(1));
  }

  @Test
  void rollbackIsTotalAfterPartialWork() throws Exception {
    assertThrows(DeploymentException.class, () ->
        txManager.withTransaction(tx -> {
          insert(tx.connection(), 1, "a");
          insert(tx.connection(), 2, "b");
          insert(tx.connection(), 1, "duplicate");
          return null;
        }));

    assertEquals(0, countRows());
  }

  @Test
  void errorsRollBackAndPropagateAsIs() throws Exception {
    AssertionError error = new AssertionError("boom");

    AssertionError thrown = assertThrows(AssertionError.class, () ->
        txManager.withTransaction(tx -> {
          insert(tx.connection(), 1, "hello");
          throw error;
        }));

    assertSame(error, thrown);
    assertNull(queryValue(1));
    assertTrue(provider.calls.contains("close"));
  }

  @Test
  void commitFailureIsCommitError() {
    RecordingProvider failing = new RecordingProvider(dataSource, true);
    TransactionManager manager = new TransactionManager(failing);

    DeploymentException thrown = assertThrows(DeploymentException.class, () ->
        manager.withTransaction(tx -> "never committed"));

    assertEquals(ErrorKind.COMMIT, thrown.kind());
    assertTrue(thrown.getCause() instanceof SQLException);
    assertEquals(List.of("setAutoCommit(false)", "commit", "rollback", "setAutoCommit(true)", "close"),
        failing.calls);
  }

  @Test
  void connectionFailureIsInternalAndNothingRollsBack() {
    ConnectionProvider broken = () -> {
      throw new SQLException("no route to host");
    };

    DeploymentException thrown = assertThrows(DeploymentException.class, () ->
        new TransactionManager(broken).withTransaction(tx -> "unused"));

    assertEquals(ErrorKind.INTERNAL, thrown.kind());
  }

  @Test
  void connectionIsUnusableAfterCompletion() {
    TransactionManager.Transaction[] captured = new TransactionManager.Transaction[1];
    txManager.withTransaction(tx -> {
      captured[0] = tx;
      return null;
    });

    assertThrows(IllegalStateException.class, () -> captured[0].connection());
  }

  private static void insert(Connection conn, int id, String val) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("INSERT INTO test_data (id, val) VALUES (?, ?)")) {
      ps.setInt(1, id);
      ps.setString(2, val);
      ps.executeUpdate();
    }
  }

  private String queryValue(int id) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement("SELECT val FROM test_data WHERE id = ?")) {
      ps.setInt(1, id);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getString(1) : null;
      }
    }
  }

  private int countRows() throws SQLException {
    try (Connection conn = dataSource.getConnection();
         ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM test_data")) {
      rs.next();
      return rs.getInt(1);
    }
  }

  /**
   * Hands out H2 connections wrapped in a proxy that records lifecycle calls.
   */
  private static final class RecordingProvider implements ConnectionProvider {
    private final JdbcDataSource dataSource;
    private final boolean failCommit;
    final List<String> calls = new ArrayList<>();

    RecordingProvider(JdbcDataSource dataSource, boolean failCommit) {
      this.dataSource = dataSource;
      this.failCommit = failCommit;
    }

    @Override
    public Connection getConnection() throws SQLException {
      Connection target = dataSource.getConnection();
      InvocationHandler handler = (proxy, method, args) -> {
        switch (method.getName()) {
          case "setAutoCommit" -> calls.add("setAutoCommit(" + args[0] + ")");
          case "commit" -> {
            calls.add("commit");
            if (failCommit) {
              throw new SQLException("serialization failure");
            }
          }
          case "rollback" -> {
            if (args == null) calls.add("rollback");
          }
          case "close" -> calls.add("close");
          default -> {
          }
        }
        try {
          return method.invoke(target, args);
        } catch (java.lang.reflect.InvocationTargetException e) {
          throw e.getCause();
        }
      };
      return (Connection) Proxy.newProxyInstance(TransactionManagerTest.class.getClassLoader(),
          new Class<?>[]{Connection.class}, handler);
    }
  }
}

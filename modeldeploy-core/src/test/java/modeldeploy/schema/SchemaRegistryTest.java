package modeldeploy.schema;

import modeldeploy.DeploymentException;
import modeldeploy.ErrorKind;
import modeldeploy.SpyConnectionProvider;
import modeldeploy.StubModelStore;
import modeldeploy.spi.MetricsExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaRegistryTest {

  private SpyConnectionProvider connections;
  private StubModelStore store;
  private AtomicInteger tablesCreated;
  private SchemaRegistry registry;

  @BeforeEach
  void setUp() {
    connections = new SpyConnectionProvider();
    store = new StubModelStore();
    tablesCreated = new AtomicInteger();
    registry = new SchemaRegistry(connections, store, new MetricsExporter() {
      @Override
      public void incrementDeploySuccess() {
      }

      @Override
      public void incrementDeployFailure(ErrorKind kind) {
      }

      @Override
      public void incrementTableCreated() {
        tablesCreated.incrementAndGet();
      }
    });
  }

  @Test
  void createsTableOnFirstUseAndMemoizes() {
    TableSchema first = registry.getOrCreate("prod_models");
    TableSchema second = registry.getOrCreate("prod_models");

    assertSame(first, second);
    assertEquals(1, store.createCalls.get());
    assertEquals(1, connections.requests.get());
    assertEquals(1, tablesCreated.get());
  }

  @Test
  void existingTableIsTrustedWithoutCreate() {
    store.tables.add("models");

    registry.getOrCreate("models");

    assertEquals(0, store.createCalls.get());
    assertEquals(0, tablesCreated.get());
  }

  @Test
  void distinctNamesGetDistinctSchemas() {
    TableSchema a = registry.getOrCreate("a_models");
    TableSchema b = registry.getOrCreate("b_models");

    assertEquals("a_models", a.tableName());
    assertEquals("b_models", b.tableName());
    assertEquals(2, store.createCalls.get());
  }

  @Test
  void invalidNameFailsBeforeConnecting() {
    DeploymentException e = assertThrows(DeploymentException.class,
        () -> registry.getOrCreate("bad name"));

    assertEquals(ErrorKind.SCHEMA_CREATION, e.kind());
    assertEquals(0, connections.requests.get());
  }

  @Test
  void nullNameIsSchemaCreationError() {
    DeploymentException e = assertThrows(DeploymentException.class,
        () -> registry.getOrCreate(null));

    assertEquals(ErrorKind.SCHEMA_CREATION, e.kind());
    assertEquals(0, connections.requests.get());
  }

  @Test
  void failingExporterDoesNotFailCreatedTable() {
    SchemaRegistry failingMetrics = new SchemaRegistry(connections, store, new MetricsExporter() {
      @Override
      public void incrementDeploySuccess() {
      }

      @Override
      public void incrementDeployFailure(ErrorKind kind) {
      }

      @Override
      public void incrementTableCreated() {
        throw new IllegalStateException("exporter down");
      }
    });

    TableSchema schema = failingMetrics.getOrCreate("models");

    assertEquals("models", schema.tableName());
    assertTrue(store.tables.contains("models"));
  }

  @Test
  void rejectedCreateIsSchemaCreationErrorAndNotCached() {
    IllegalStateException denied = new IllegalStateException("permission denied");
    store.createFailure = denied;

    DeploymentException e = assertThrows(DeploymentException.class,
        () -> registry.getOrCreate("models"));

    assertEquals(ErrorKind.SCHEMA_CREATION, e.kind());
    assertSame(denied, e.getCause());
    assertFalse(store.tables.contains("models"));

    store.createFailure = null;
    registry.getOrCreate("models");
    registry.getOrCreate("models");
    assertEquals(2, store.createCalls.get());
    assertEquals(2, connections.requests.get());
    assertTrue(store.tables.contains("models"));
  }

  @Test
  void alreadyExistsRaceCountsAsSuccess() {
    StubModelStore racing = new StubModelStore() {
      @Override
      public void createTable(java.sql.Connection conn, TableSchema schema) {
        createCalls.incrementAndGet();
        tables.add(schema.tableName());
        throw new IllegalStateException("table already exists");
      }
    };
    SchemaRegistry racingRegistry = new SchemaRegistry(connections, racing);

    TableSchema schema = racingRegistry.getOrCreate("models");

    assertEquals("models", schema.tableName());
    assertEquals(1, racing.createCalls.get());
  }

  @Test
  void connectionFailureIsSchemaCreationError() {
    connections.failure = new SQLException("connection refused");

    DeploymentException e = assertThrows(DeploymentException.class,
        () -> registry.getOrCreate("models"));

    assertEquals(ErrorKind.SCHEMA_CREATION, e.kind());
    assertSame(connections.failure, e.getCause());
  }
}

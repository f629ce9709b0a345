package modeldeploy.jdbc;

import modeldeploy.DeploymentOrchestrator;
import modeldeploy.jdbc.store.PostgresModelStore;
import modeldeploy.model.DeployedModelRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresModelDeploymentIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("modeldeploy_test");

  @TempDir
  Path artifactRoot;

  private ArtifactFixture artifacts;

  @BeforeEach
  void setUp() throws Exception {
    artifacts = new ArtifactFixture(artifactRoot);
    try (Connection conn = connect()) {
      conn.createStatement().execute("DROP TABLE IF EXISTS prod_models");
    }
  }

  @Test
  void deploysThroughSqlAlchemyStyleUri() throws Exception {
    byte[] payload = artifacts.onnxModel("fraud-detector", "3", "1.10", 4096);
    String dbUri = "postgresql+psycopg2://" + postgres.getUsername() + ":" + postgres.getPassword()
        + "@" + postgres.getHost() + ":" + postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT)
        + "/" + postgres.getDatabaseName();

    DeploymentOrchestrator orchestrator = ModelDeployments.forDatabase(dbUri, artifacts.collaborators());
    DeployedModelRecord first = orchestrator.deploy("models:/fraud-detector/3", 42, "onnx", "prod_models");
    DeployedModelRecord second = orchestrator.deploy("models:/fraud-detector/3", 42, "onnx", "prod_models");

    assertNotEquals(first.modelId(), second.modelId());
    try (Connection conn = connect();
         PreparedStatement ps = conn.prepareStatement(
             "SELECT model, model_framework_version FROM prod_models WHERE model_id = ?")) {
      ps.setLong(1, first.modelId());
      try (ResultSet rs = ps.executeQuery()) {
        assertTrue(rs.next());
        assertArrayEquals(payload, rs.getBytes(1));
        assertEquals("1.10", rs.getString(2));
      }
    }
  }

  @Test
  void tableExistenceIgnoresIdentifierCase() throws Exception {
    try (Connection conn = connect()) {
      conn.createStatement().execute("CREATE TABLE Prod_Models (id INTEGER)");
      assertTrue(new PostgresModelStore().tableExists(conn, "PROD_MODELS"));
      assertTrue(new PostgresModelStore().tableExists(conn, "prod_models"));
    }
  }

  private static Connection connect() throws Exception {
    return DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
  }
}

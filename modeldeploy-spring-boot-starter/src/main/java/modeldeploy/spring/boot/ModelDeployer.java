package modeldeploy.spring.boot;

import modeldeploy.DeploymentException;
import modeldeploy.DeploymentOrchestrator;
import modeldeploy.DeploymentRequest;
import modeldeploy.model.DeployedModelRecord;

import java.util.Objects;

/**
 * Deploys models into the configured default table unless a request names another one.
 *
 * @see ModelDeployProperties#getTableName()
 */
public class ModelDeployer {
  private final DeploymentOrchestrator orchestrator;
  private final String defaultTableName;

  public ModelDeployer(DeploymentOrchestrator orchestrator, String defaultTableName) {
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.defaultTableName = Objects.requireNonNull(defaultTableName, "defaultTableName");
  }

  /**
   * Deploys into the default table.
   *
   * @throws DeploymentException describing the first failure
   */
  public DeployedModelRecord deploy(String modelUri, Integer principal, String flavor) {
    return deploy(modelUri, principal, flavor, null);
  }

  /**
   * Deploys into {@code tableName}, or into the default table when it is {@code null}.
   *
   * @throws DeploymentException describing the first failure
   */
  public DeployedModelRecord deploy(String modelUri, Integer principal, String flavor, String tableName) {
    return orchestrator.deploy(DeploymentRequest.builder(modelUri)
        .principal(principal)
        .flavor(flavor)
        .tableName(tableName == null ? defaultTableName : tableName)
        .build());
  }

  public String defaultTableName() {
    return defaultTableName;
  }
}

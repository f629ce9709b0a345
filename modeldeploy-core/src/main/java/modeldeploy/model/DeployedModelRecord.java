package modeldeploy.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A committed deployed-model row: the draft plus the values assigned at insert time.
 * Write-once; nothing updates a row after its transaction commits.
 */
public final class DeployedModelRecord {
  private final long modelId;
  private final String tableName;
  private final Instant deploymentTime;
  private final ModelRecordDraft draft;

  public DeployedModelRecord(long modelId, String tableName, Instant deploymentTime,
      ModelRecordDraft draft) {
    this.modelId = modelId;
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.deploymentTime = Objects.requireNonNull(deploymentTime, "deploymentTime");
    this.draft = Objects.requireNonNull(draft, "draft");
  }

  public long modelId() {
    return modelId;
  }

  public String tableName() {
    return tableName;
  }

  public Instant deploymentTime() {
    return deploymentTime;
  }

  public String modelName() {
    return draft.modelName();
  }

  public String modelVersion() {
    return draft.modelVersion();
  }

  public String framework() {
    return draft.framework();
  }

  public String frameworkVersion() {
    return draft.frameworkVersion();
  }

  public byte[] payload() {
    return draft.payload();
  }

  public int payloadSize() {
    return draft.payloadSize();
  }

  public Instant creationTime() {
    return draft.creationTime();
  }

  public Integer deployedBy() {
    return draft.deployedBy();
  }

  public String description() {
    return draft.description();
  }

  public String runId() {
    return draft.runId();
  }

  @Override
  public String toString() {
    return "DeployedModelRecord{" + tableName + "#" + modelId + ", " + modelName() + "/"
        + modelVersion() + ", " + framework() + " " + frameworkVersion() + ", deployedAt="
        + deploymentTime + "}";
  }
}

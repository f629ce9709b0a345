package modeldeploy.model;

import modeldeploy.DeploymentException;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Field values of a deployed-model row before insertion.
 *
 * <p>A draft never carries {@code model_id} or {@code model_deployment_time}; both are
 * assigned by the insert. Column length limits are enforced here, so a draft that exists
 * always fits its row.
 */
public final class ModelRecordDraft {
  public static final int MAX_NAME_LENGTH = 256;
  public static final int MAX_VERSION_LENGTH = 50;
  public static final int MAX_FRAMEWORK_LENGTH = 50;
  public static final int MAX_FRAMEWORK_VERSION_LENGTH = 50;
  public static final int MAX_DESCRIPTION_LENGTH = 1024;
  public static final int MAX_RUN_ID_LENGTH = 100;

  private final String modelName;
  private final String modelVersion;
  private final String framework;
  private final String frameworkVersion;
  private final byte[] payload;
  private final Instant creationTime;
  private final Integer deployedBy;
  private final String description;
  private final String runId;

  private ModelRecordDraft(Builder builder) {
    this.modelName = required("modelName", builder.modelName, MAX_NAME_LENGTH);
    this.modelVersion = required("modelVersion", builder.modelVersion, MAX_VERSION_LENGTH);
    this.framework = required("framework", builder.framework, MAX_FRAMEWORK_LENGTH);
    this.frameworkVersion = required("frameworkVersion", builder.frameworkVersion,
        MAX_FRAMEWORK_VERSION_LENGTH);
    Objects.requireNonNull(builder.payload, "payload");
    this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
    this.creationTime = builder.creationTime;
    this.deployedBy = builder.deployedBy;
    this.description = truncate(builder.description);
    this.runId = optional("runId", builder.runId, MAX_RUN_ID_LENGTH);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String modelName() {
    return modelName;
  }

  public String modelVersion() {
    return modelVersion;
  }

  public String framework() {
    return framework;
  }

  public String frameworkVersion() {
    return frameworkVersion;
  }

  /** Returns a copy of the artifact payload. */
  public byte[] payload() {
    return Arrays.copyOf(payload, payload.length);
  }

  public int payloadSize() {
    return payload.length;
  }

  public Instant creationTime() {
    return creationTime;
  }

  public Integer deployedBy() {
    return deployedBy;
  }

  public String description() {
    return description;
  }

  public String runId() {
    return runId;
  }

  private static String required(String field, String value, int maxLength) {
    if (value == null || value.isBlank()) {
      throw DeploymentException.invalidMetadata(field + " must not be empty");
    }
    return optional(field, value, maxLength);
  }

  private static String optional(String field, String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw DeploymentException.invalidMetadata(
          field + " exceeds " + maxLength + " characters: " + value.length());
    }
    return value;
  }

  private static String truncate(String description) {
    if (description == null || description.length() <= MAX_DESCRIPTION_LENGTH) {
      return description;
    }
    return description.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "...";
  }

  @Override
  public String toString() {
    return "ModelRecordDraft{" + modelName + "/" + modelVersion + ", " + framework + " "
        + frameworkVersion + ", " + payload.length + " bytes}";
  }

  public static final class Builder {
    private String modelName;
    private String modelVersion;
    private String framework;
    private String frameworkVersion;
    private byte[] payload;
    private Instant creationTime;
    private Integer deployedBy;
    private String description;
    private String runId;

    private Builder() {
    }

    public Builder modelName(String modelName) {
      this.modelName = modelName;
      return this;
    }

    public Builder modelVersion(String modelVersion) {
      this.modelVersion = modelVersion;
      return this;
    }

    public Builder framework(String framework) {
      this.framework = framework;
      return this;
    }

    public Builder frameworkVersion(String frameworkVersion) {
      this.frameworkVersion = frameworkVersion;
      return this;
    }

    public Builder payload(byte[] payload) {
      this.payload = payload;
      return this;
    }

    public Builder creationTime(Instant creationTime) {
      this.creationTime = creationTime;
      return this;
    }

    public Builder deployedBy(Integer deployedBy) {
      this.deployedBy = deployedBy;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder runId(String runId) {
      this.runId = runId;
      return this;
    }

    public ModelRecordDraft build() {
      return new ModelRecordDraft(this);
    }
  }
}

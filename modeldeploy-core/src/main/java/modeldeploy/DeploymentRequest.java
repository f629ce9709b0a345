package modeldeploy;

import modeldeploy.schema.TableNames;

import java.util.Objects;

/**
 * Parameters of one deployment call.
 *
 * <p>Create instances via {@link #builder(String)}.
 */
public final class DeploymentRequest {
  private final String modelUri;
  private final Integer principal;
  private final String flavor;
  private final String tableName;

  private DeploymentRequest(Builder builder) {
    this.modelUri = Objects.requireNonNull(builder.modelUri, "modelUri");
    this.principal = builder.principal;
    this.flavor = builder.flavor;
    this.tableName = builder.tableName == null ? TableNames.DEFAULT_TABLE : builder.tableName;
  }

  /**
   * @param modelUri model reference such as {@code models:/fraud-detector/3}
   */
  public static Builder builder(String modelUri) {
    return new Builder(modelUri);
  }

  public String modelUri() {
    return modelUri;
  }

  /** Principal deploying the model, or {@code null}. */
  public Integer principal() {
    return principal;
  }

  /** Requested flavor, or {@code null} to auto-detect. */
  public String flavor() {
    return flavor;
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public String toString() {
    return "DeploymentRequest{" + modelUri + " -> " + tableName
        + (flavor == null ? "" : ", flavor=" + flavor) + "}";
  }

  public static final class Builder {
    private final String modelUri;
    private Integer principal;
    private String flavor;
    private String tableName;

    private Builder(String modelUri) {
      this.modelUri = modelUri;
    }

    public Builder principal(Integer principal) {
      this.principal = principal;
      return this;
    }

    public Builder flavor(String flavor) {
      this.flavor = flavor;
      return this;
    }

    /** Target table; defaults to {@value TableNames#DEFAULT_TABLE}. */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public DeploymentRequest build() {
      return new DeploymentRequest(this);
    }
  }
}

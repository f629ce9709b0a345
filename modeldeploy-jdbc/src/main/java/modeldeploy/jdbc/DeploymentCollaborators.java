package modeldeploy.jdbc;

import modeldeploy.flavor.FlavorValidator;
import modeldeploy.spi.ArtifactResolver;
import modeldeploy.spi.ManifestLoader;
import modeldeploy.spi.MetricsExporter;
import modeldeploy.spi.ModelRegistry;

import java.time.Clock;
import java.util.Objects;

/**
 * Non-database collaborators of a deployment: where artifacts come from, how manifests are
 * read and where registry metadata lives.
 *
 * <p>Create instances via {@link #builder()}. The artifact resolver and manifest loader
 * are required; everything else has a default.
 */
public final class DeploymentCollaborators {
  private final ArtifactResolver artifactResolver;
  private final ManifestLoader manifestLoader;
  private final ModelRegistry modelRegistry;
  private final FlavorValidator flavorValidator;
  private final MetricsExporter metrics;
  private final Clock clock;

  private DeploymentCollaborators(Builder builder) {
    this.artifactResolver = Objects.requireNonNull(builder.artifactResolver, "artifactResolver");
    this.manifestLoader = Objects.requireNonNull(builder.manifestLoader, "manifestLoader");
    this.modelRegistry = builder.modelRegistry == null ? ModelRegistry.NONE : builder.modelRegistry;
    this.flavorValidator = builder.flavorValidator == null ? new FlavorValidator() : builder.flavorValidator;
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ArtifactResolver artifactResolver() {
    return artifactResolver;
  }

  public ManifestLoader manifestLoader() {
    return manifestLoader;
  }

  public ModelRegistry modelRegistry() {
    return modelRegistry;
  }

  public FlavorValidator flavorValidator() {
    return flavorValidator;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  public Clock clock() {
    return clock;
  }

  public static final class Builder {
    private ArtifactResolver artifactResolver;
    private ManifestLoader manifestLoader;
    private ModelRegistry modelRegistry;
    private FlavorValidator flavorValidator;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    public Builder artifactResolver(ArtifactResolver artifactResolver) {
      this.artifactResolver = artifactResolver;
      return this;
    }

    public Builder manifestLoader(ManifestLoader manifestLoader) {
      this.manifestLoader = manifestLoader;
      return this;
    }

    public Builder modelRegistry(ModelRegistry modelRegistry) {
      this.modelRegistry = modelRegistry;
      return this;
    }

    public Builder flavorValidator(FlavorValidator flavorValidator) {
      this.flavorValidator = flavorValidator;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DeploymentCollaborators build() {
      return new DeploymentCollaborators(this);
    }
  }
}

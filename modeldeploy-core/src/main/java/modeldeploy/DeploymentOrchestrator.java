package modeldeploy;

import modeldeploy.flavor.FlavorValidator;
import modeldeploy.metadata.MetadataCollector;
import modeldeploy.model.CallerContext;
import modeldeploy.model.DeployedModelRecord;
import modeldeploy.model.ModelManifest;
import modeldeploy.model.ModelRecordDraft;
import modeldeploy.model.ModelReference;
import modeldeploy.model.ModelVersionInfo;
import modeldeploy.schema.SchemaRegistry;
import modeldeploy.schema.TableSchema;
import modeldeploy.spi.ArtifactResolver;
import modeldeploy.spi.ManifestLoader;
import modeldeploy.spi.MetricsExporter;
import modeldeploy.spi.ModelRegistry;
import modeldeploy.spi.ModelStore;
import modeldeploy.tx.TransactionManager;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deploys a model artifact into one row of a database table.
 *
 * <p>Each call runs these steps in order:
 * <ol>
 *   <li>parse the reference and fetch its registry metadata, pinning a stage label to
 *       the version the registry reports;</li>
 *   <li>resolve the artifact, load its manifest, validate the flavor and collect the
 *       row values;</li>
 *   <li>obtain the table schema, creating the table if absent;</li>
 *   <li>in one managed transaction, stamp the deployment time and insert the row.</li>
 * </ol>
 * Nothing before step 3 requests a database connection, so invalid input never
 * reaches the database. Every failure propagates as a single {@link DeploymentException}.
 * A failing {@link MetricsExporter} is logged and never changes the outcome of a call.
 *
 * <p>Create instances via {@link #builder()}. Instances are thread-safe; concurrent
 * deployments produce independent rows.
 *
 * @see DeploymentRequest
 */
public final class DeploymentOrchestrator {
  private static final Logger logger = Logger.getLogger(DeploymentOrchestrator.class.getName());

  private final ArtifactResolver artifactResolver;
  private final ManifestLoader manifestLoader;
  private final ModelRegistry modelRegistry;
  private final FlavorValidator flavorValidator;
  private final MetadataCollector metadataCollector;
  private final SchemaRegistry schemaRegistry;
  private final TransactionManager transactionManager;
  private final ModelStore modelStore;
  private final MetricsExporter metrics;
  private final Clock clock;

  private DeploymentOrchestrator(Builder builder) {
    this.artifactResolver = Objects.requireNonNull(builder.artifactResolver, "artifactResolver");
    this.manifestLoader = Objects.requireNonNull(builder.manifestLoader, "manifestLoader");
    this.schemaRegistry = Objects.requireNonNull(builder.schemaRegistry, "schemaRegistry");
    this.transactionManager = Objects.requireNonNull(builder.transactionManager, "transactionManager");
    this.modelStore = Objects.requireNonNull(builder.modelStore, "modelStore");
    this.modelRegistry = builder.modelRegistry == null ? ModelRegistry.NONE : builder.modelRegistry;
    this.flavorValidator = builder.flavorValidator == null ? new FlavorValidator() : builder.flavorValidator;
    this.metadataCollector = builder.metadataCollector == null
        ? new MetadataCollector() : builder.metadataCollector;
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Convenience overload of {@link #deploy(DeploymentRequest)}.
   *
   * @param modelUri  model reference such as {@code models:/fraud-detector/3}
   * @param principal who deploys the model, or {@code null}
   * @param flavor    flavor to deploy, or {@code null} to auto-detect
   * @param tableName target table, or {@code null} for the default {@code models} table
   */
  public DeployedModelRecord deploy(String modelUri, Integer principal, String flavor, String tableName) {
    return deploy(DeploymentRequest.builder(modelUri)
        .principal(principal)
        .flavor(flavor)
        .tableName(tableName)
        .build());
  }

  /**
   * Deploys the requested model.
   *
   * @return the committed row
   * @throws DeploymentException describing the first failure
   */
  public DeployedModelRecord deploy(DeploymentRequest request) {
    Objects.requireNonNull(request, "request");
    long startNanos = System.nanoTime();
    DeployedModelRecord record;
    try {
      record = doDeploy(request);
    } catch (RuntimeException e) {
      DeploymentException failure = DeploymentException.classify(e);
      logger.log(Level.WARNING, "Deployment of " + request.modelUri() + " failed ["
          + failure.kind() + "]: " + failure.getMessage());
      report(() -> metrics.incrementDeployFailure(failure.kind()));
      report(() -> metrics.recordDeployDurationMs(elapsedMillis(startNanos)));
      throw failure;
    }
    logger.log(Level.INFO, "Deployed {0}/{1} ({2} {3}) into {4} as model_id {5}",
        new Object[]{record.modelName(), record.modelVersion(), record.framework(),
            record.frameworkVersion(), record.tableName(), record.modelId()});
    report(metrics::incrementDeploySuccess);
    report(() -> metrics.recordArtifactBytes(record.payloadSize()));
    report(() -> metrics.recordDeployDurationMs(elapsedMillis(startNanos)));
    return record;
  }

  private DeployedModelRecord doDeploy(DeploymentRequest request) {
    ModelReference requested = ModelReference.parse(request.modelUri());
    // artifact and metadata must come from the version this lookup reports
    ModelVersionInfo versionInfo = modelRegistry.getModelVersion(requested).orElse(null);
    ModelReference reference = versionInfo == null || versionInfo.version() == null
        ? requested : requested.pinnedTo(versionInfo.version());

    Path artifactRoot = artifactResolver.resolve(reference);
    ModelManifest manifest = manifestLoader.load(artifactRoot).orElseThrow(() ->
        DeploymentException.manifestNotFound(manifestLoader.describeLocation(artifactRoot)));
    logger.log(Level.FINE, "Resolved {0} to {1} with flavors {2}",
        new Object[]{reference, artifactRoot, manifest.flavorNames()});

    String flavor = flavorValidator.validate(manifest, request.flavor());
    ModelRecordDraft draft = metadataCollector.collect(reference, artifactRoot, manifest, flavor,
        new CallerContext(request.principal(), versionInfo));

    TableSchema schema = schemaRegistry.getOrCreate(request.tableName());
    return transactionManager.withTransaction(tx -> {
      Instant deploymentTime = deploymentTime(draft);
      long modelId = modelStore.insert(tx.connection(), schema, draft, deploymentTime);
      return new DeployedModelRecord(modelId, schema.tableName(), deploymentTime, draft);
    });
  }

  private static void report(Runnable exporterCall) {
    try {
      exporterCall.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics exporter failed", e);
    }
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }

  private Instant deploymentTime(ModelRecordDraft draft) {
    // timestamp columns keep microseconds at most
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    Instant created = draft.creationTime();
    // registry clocks may run ahead of ours
    return created != null && created.isAfter(now) ? created : now;
  }

  public static final class Builder {
    private ArtifactResolver artifactResolver;
    private ManifestLoader manifestLoader;
    private ModelRegistry modelRegistry;
    private FlavorValidator flavorValidator;
    private MetadataCollector metadataCollector;
    private SchemaRegistry schemaRegistry;
    private TransactionManager transactionManager;
    private ModelStore modelStore;
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

    /** Optional; defaults to {@link ModelRegistry#NONE}. */
    public Builder modelRegistry(ModelRegistry modelRegistry) {
      this.modelRegistry = modelRegistry;
      return this;
    }

    /** Optional; defaults to a validator accepting {@code onnx} and {@code sklearn}. */
    public Builder flavorValidator(FlavorValidator flavorValidator) {
      this.flavorValidator = flavorValidator;
      return this;
    }

    public Builder metadataCollector(MetadataCollector metadataCollector) {
      this.metadataCollector = metadataCollector;
      return this;
    }

    public Builder schemaRegistry(SchemaRegistry schemaRegistry) {
      this.schemaRegistry = schemaRegistry;
      return this;
    }

    public Builder transactionManager(TransactionManager transactionManager) {
      this.transactionManager = transactionManager;
      return this;
    }

    public Builder modelStore(ModelStore modelStore) {
      this.modelStore = modelStore;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Clock used for {@code model_deployment_time}; defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DeploymentOrchestrator build() {
      return new DeploymentOrchestrator(this);
    }
  }
}

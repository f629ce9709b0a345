package modeldeploy.metadata;

import modeldeploy.DeploymentException;
import modeldeploy.model.CallerContext;
import modeldeploy.model.FlavorConfig;
import modeldeploy.model.ModelManifest;
import modeldeploy.model.ModelRecordDraft;
import modeldeploy.model.ModelReference;
import modeldeploy.model.ModelVersionInfo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles the field values of a deployed-model row from the artifact, its manifest,
 * the validated flavor and the caller's context.
 *
 * <p>The payload is read fully into memory and stored as opaque bytes. Registry metadata
 * takes precedence over what the reference and the manifest say. Without a registry
 * creation timestamp, the manifest's {@code utc_time_created} is used when it parses. The
 * collector leaves {@code model_id} and {@code model_deployment_time} to the insert.
 */
public final class MetadataCollector {
  private static final Logger logger = Logger.getLogger(MetadataCollector.class.getName());

  // "2024-01-01 12:00:00.123456", fraction optional
  private static final DateTimeFormatter MANIFEST_TIME = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .toFormatter();

  /**
   * Builds the row draft.
   *
   * @param reference    the model being deployed
   * @param artifactRoot local artifact root directory
   * @param manifest     the artifact's manifest
   * @param flavor       a flavor already accepted by {@link modeldeploy.flavor.FlavorValidator}
   * @param context      principal and registry metadata
   * @throws DeploymentException with kind {@code MALFORMED_FLAVOR_CONFIG},
   *     {@code MISSING_ARTIFACT_DATA}, {@code INVALID_METADATA} or {@code INTERNAL}
   */
  public ModelRecordDraft collect(ModelReference reference, Path artifactRoot,
      ModelManifest manifest, String flavor, CallerContext context) {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(artifactRoot, "artifactRoot");
    Objects.requireNonNull(manifest, "manifest");
    Objects.requireNonNull(flavor, "flavor");
    Objects.requireNonNull(context, "context");

    FlavorConfig config = manifest.flavor(flavor).orElseThrow(() ->
        DeploymentException.flavorNotPresent(flavor, manifest.flavorNames()));
    String frameworkVersion = config.version().orElseThrow(() ->
        DeploymentException.malformedFlavorConfig(
            "Flavor `" + flavor + "` does not declare `" + config.versionKey() + "`"));
    byte[] payload = readPayload(artifactRoot, config);

    ModelVersionInfo info = context.versionInfo();
    return ModelRecordDraft.builder()
        .modelName(info != null && info.name() != null ? info.name() : reference.name())
        .modelVersion(info != null && info.version() != null ? info.version() : reference.version())
        .framework(flavor)
        .frameworkVersion(frameworkVersion)
        .payload(payload)
        .creationTime(creationTime(info, manifest))
        .deployedBy(context.principal())
        .description(info == null ? null : info.description())
        .runId(info != null && info.runId() != null ? info.runId() : manifest.runId().orElse(null))
        .build();
  }

  private static byte[] readPayload(Path artifactRoot, FlavorConfig config) {
    String relative = config.dataPath().orElseThrow(() ->
        DeploymentException.malformedFlavorConfig(
            "Flavor `" + config.flavor() + "` does not declare a `" + FlavorConfig.DATA_KEY + "` path"));
    Path root = artifactRoot.toAbsolutePath().normalize();
    Path dataFile;
    try {
      dataFile = root.resolve(relative).normalize();
    } catch (InvalidPathException e) {
      throw DeploymentException.malformedFlavorConfig("Invalid data path `" + relative + "`");
    }
    if (!dataFile.startsWith(root)) {
      throw DeploymentException.malformedFlavorConfig(
          "Data path `" + relative + "` points outside the artifact directory");
    }
    if (!Files.isRegularFile(dataFile)) {
      throw DeploymentException.missingArtifactData(
          "Model data file `" + relative + "` declared by flavor `" + config.flavor()
              + "` does not exist in " + root);
    }
    try {
      return Files.readAllBytes(dataFile);
    } catch (IOException e) {
      throw DeploymentException.internal("Failed to read model data file " + dataFile, e);
    }
  }

  private static Instant creationTime(ModelVersionInfo info, ModelManifest manifest) {
    if (info != null && info.creationTimestampMillis() != null) {
      return Instant.ofEpochMilli(info.creationTimestampMillis());
    }
    return manifest.utcTimeCreated().map(MetadataCollector::parseManifestTime).orElse(null);
  }

  private static Instant parseManifestTime(String value) {
    try {
      return LocalDateTime.parse(value.trim(), MANIFEST_TIME).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      logger.log(Level.WARNING, "Ignoring unparseable utc_time_created `" + value + "`", e);
      return null;
    }
  }
}

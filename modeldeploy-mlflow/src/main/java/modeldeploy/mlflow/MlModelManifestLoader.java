package modeldeploy.mlflow;

import modeldeploy.DeploymentException;
import modeldeploy.model.ModelManifest;
import modeldeploy.spi.ManifestLoader;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.schema.FailsafeSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the {@code MLmodel} YAML file at the root of an MLflow model artifact.
 *
 * <p>All scalars are read as strings, so a version such as {@code 1.10} keeps its
 * trailing zero. Flavors keep the order in which the file lists them.
 */
public final class MlModelManifestLoader implements ManifestLoader {
  public static final String MANIFEST_FILE = "MLmodel";

  private static final String FLAVORS = "flavors";
  private static final String RUN_ID = "run_id";
  private static final String UTC_TIME_CREATED = "utc_time_created";

  private final LoadSettings settings = LoadSettings.builder()
      .setAllowDuplicateKeys(false)
      .setSchema(new FailsafeSchema())
      .setLabel(MANIFEST_FILE)
      .build();

  @Override
  public Optional<ModelManifest> load(Path artifactRoot) {
    Path file = artifactRoot.resolve(MANIFEST_FILE);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw DeploymentException.internal("Failed to read " + file, e);
    }
    return Optional.of(parse(content, file));
  }

  @Override
  public String describeLocation(Path artifactRoot) {
    return artifactRoot.resolve(MANIFEST_FILE).toString();
  }

  ModelManifest parse(String content, Path file) {
    Object document;
    try {
      document = new Load(settings).loadFromString(content);
    } catch (YamlEngineException e) {
      throw DeploymentException.malformedManifest("Invalid YAML in " + file + ": " + e.getMessage(), e);
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw DeploymentException.malformedManifest(file + " is not a YAML mapping", null);
    }
    if (!(root.get(FLAVORS) instanceof Map<?, ?> flavors) || flavors.isEmpty()) {
      throw DeploymentException.malformedManifest(file + " declares no `" + FLAVORS + "`", null);
    }

    ModelManifest.Builder manifest = ModelManifest.builder();
    for (Map.Entry<?, ?> entry : flavors.entrySet()) {
      String flavor = String.valueOf(entry.getKey());
      Object config = entry.getValue();
      if (config instanceof Map<?, ?> properties) {
        manifest.flavor(flavor, stringKeys(properties));
      } else if (config == null || "".equals(config)) {
        manifest.flavor(flavor, Map.of());
      } else {
        throw DeploymentException.malformedManifest(
            "Flavor `" + flavor + "` in " + file + " is not a mapping", null);
      }
    }
    if (root.get(RUN_ID) instanceof String runId) {
      manifest.runId(runId);
    }
    if (root.get(UTC_TIME_CREATED) instanceof String created) {
      manifest.utcTimeCreated(created);
    }
    return manifest.build();
  }

  private static Map<String, Object> stringKeys(Map<?, ?> properties) {
    Map<String, Object> result = new LinkedHashMap<>();
    properties.forEach((k, v) -> result.put(String.valueOf(k), v));
    return result;
  }
}

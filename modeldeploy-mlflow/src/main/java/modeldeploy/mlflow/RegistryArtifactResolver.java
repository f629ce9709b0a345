package modeldeploy.mlflow;

import modeldeploy.DeploymentException;
import modeldeploy.model.ModelReference;
import modeldeploy.spi.ArtifactResolver;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves references through the MLflow registry's download URI.
 *
 * <p>Only artifact locations on the local filesystem ({@code file:} URIs or plain absolute
 * paths) are supported; remote stores such as {@code s3:} are rejected with
 * {@code INVALID_REFERENCE}.
 */
public final class RegistryArtifactResolver implements ArtifactResolver {
  private static final Logger logger = Logger.getLogger(RegistryArtifactResolver.class.getName());

  private final MlflowRegistryClient client;

  public RegistryArtifactResolver(MlflowRegistryClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public Path resolve(ModelReference reference) {
    String location = client.getDownloadUri(reference);
    Path dir = toLocalPath(location);
    logger.log(Level.FINE, "Registry location of {0} is {1}", new Object[]{reference, dir});
    if (!Files.isDirectory(dir)) {
      throw DeploymentException.artifactNotFound(
          "Artifact directory " + dir + " of " + reference + " does not exist");
    }
    return dir;
  }

  static Path toLocalPath(String location) {
    if (location.startsWith("/")) {
      return Paths.get(location);
    }
    URI uri;
    try {
      uri = URI.create(location);
    } catch (IllegalArgumentException e) {
      throw DeploymentException.invalidReference("Unreadable artifact location: " + location);
    }
    if (!"file".equalsIgnoreCase(uri.getScheme())) {
      throw DeploymentException.invalidReference("Artifact location " + location
          + " is not on the local filesystem; only file: locations are supported");
    }
    try {
      return Paths.get(uri);
    } catch (IllegalArgumentException e) {
      throw DeploymentException.invalidReference("Unreadable artifact location: " + location);
    }
  }
}

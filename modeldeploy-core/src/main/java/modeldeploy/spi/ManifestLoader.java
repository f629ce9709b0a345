package modeldeploy.spi;

import modeldeploy.model.ModelManifest;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the packaging manifest of a local artifact.
 */
public interface ManifestLoader {

  /**
   * @param artifactRoot local artifact root directory
   * @return the manifest, or empty if the artifact has none
   * @throws modeldeploy.DeploymentException with kind {@code MALFORMED_MANIFEST} if a
   *     manifest exists but cannot be read
   */
  Optional<ModelManifest> load(Path artifactRoot);

  /** Human-readable location of the manifest, used in error messages. */
  default String describeLocation(Path artifactRoot) {
    return artifactRoot.toString();
  }
}

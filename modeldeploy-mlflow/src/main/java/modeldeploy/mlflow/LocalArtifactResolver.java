package modeldeploy.mlflow;

import modeldeploy.DeploymentException;
import modeldeploy.model.ModelReference;
import modeldeploy.spi.ArtifactResolver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves references against a local directory laid out as {@code <root>/<name>/<version>}.
 * Stage labels resolve only if a directory with that name exists.
 */
public final class LocalArtifactResolver implements ArtifactResolver {
  private final Path root;

  public LocalArtifactResolver(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  @Override
  public Path resolve(ModelReference reference) {
    Path dir = root.resolve(reference.name()).resolve(reference.version()).normalize();
    if (!dir.startsWith(root) || dir.equals(root)) {
      throw DeploymentException.invalidReference(
          "Model reference " + reference + " points outside " + root);
    }
    if (!Files.isDirectory(dir)) {
      throw DeploymentException.artifactNotFound(
          "No local artifact for " + reference + " under " + root);
    }
    return dir;
  }
}

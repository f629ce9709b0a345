package modeldeploy.spi;

import modeldeploy.model.ModelReference;

import java.nio.file.Path;

/**
 * Resolves a model reference to the root directory of a local copy of its artifact.
 *
 * <p>May block on network or filesystem I/O.
 */
public interface ArtifactResolver {

  /**
   * @param reference the model to resolve
   * @return local artifact root directory
   * @throws modeldeploy.DeploymentException with kind {@code ARTIFACT_NOT_FOUND} if the
   *     artifact does not exist, or {@code INVALID_REFERENCE} if the reference cannot be
   *     handled by this resolver
   */
  Path resolve(ModelReference reference);
}

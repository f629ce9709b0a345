package modeldeploy.spi;

import modeldeploy.model.ModelReference;
import modeldeploy.model.ModelVersionInfo;

import java.util.Optional;

/**
 * Source of registry metadata (creation time, description, run) for model versions.
 */
public interface ModelRegistry {

  /**
   * Registry that knows nothing; deployments then carry only manifest-derived metadata.
   */
  ModelRegistry NONE = reference -> Optional.empty();

  /**
   * @param reference the model reference being deployed
   * @return metadata of the referenced version, or empty if unavailable
   */
  Optional<ModelVersionInfo> getModelVersion(ModelReference reference);
}

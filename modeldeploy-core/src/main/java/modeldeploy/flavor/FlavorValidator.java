package modeldeploy.flavor;

import modeldeploy.DeploymentException;
import modeldeploy.model.ModelManifest;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decides which flavor of a model gets deployed.
 *
 * <p>With an explicit flavor the flavor must be supported and present in the manifest.
 * Without one, the first manifest flavor (in manifest order) that is supported wins.
 * Pure and thread-safe.
 */
public final class FlavorValidator {
  public static final String ONNX = "onnx";
  public static final String SKLEARN = "sklearn";
  public static final List<String> DEFAULT_SUPPORTED_FLAVORS = List.of(ONNX, SKLEARN);

  private final List<String> supportedFlavors;

  public FlavorValidator() {
    this(DEFAULT_SUPPORTED_FLAVORS);
  }

  public FlavorValidator(Collection<String> supportedFlavors) {
    Objects.requireNonNull(supportedFlavors, "supportedFlavors");
    if (supportedFlavors.isEmpty()) {
      throw new IllegalArgumentException("supportedFlavors must not be empty");
    }
    this.supportedFlavors = List.copyOf(supportedFlavors);
  }

  public List<String> supportedFlavors() {
    return supportedFlavors;
  }

  public boolean isSupported(String flavor) {
    return supportedFlavors.contains(flavor);
  }

  /**
   * Returns the flavor to deploy.
   *
   * @param manifest        the model manifest
   * @param requestedFlavor explicit flavor, or {@code null} to auto-detect
   * @throws DeploymentException with kind {@code UNSUPPORTED_FLAVOR} or {@code FLAVOR_NOT_PRESENT}
   */
  public String validate(ModelManifest manifest, String requestedFlavor) {
    Objects.requireNonNull(manifest, "manifest");
    if (requestedFlavor != null) {
      if (!isSupported(requestedFlavor)) {
        throw DeploymentException.unsupportedFlavor(requestedFlavor, supportedFlavors);
      }
      if (!manifest.hasFlavor(requestedFlavor)) {
        throw DeploymentException.flavorNotPresent(requestedFlavor, manifest.flavorNames());
      }
      return requestedFlavor;
    }
    for (String flavor : manifest.flavorNames()) {
      if (isSupported(flavor)) {
        return flavor;
      }
    }
    throw DeploymentException.noSupportedFlavor(manifest.flavorNames(), supportedFlavors);
  }
}

package modeldeploy;

import java.util.Collection;
import java.util.Objects;

/**
 * The single unchecked failure type of the deployment pipeline.
 *
 * <p>Every instance carries an {@link ErrorKind}. Code that needs to tell already
 * classified failures from unexpected ones uses {@link #classify(Throwable)}, which
 * passes classified exceptions through untouched and wraps anything else as
 * {@link ErrorKind#INTERNAL} with the original failure as cause.
 */
public final class DeploymentException extends RuntimeException {
  private final ErrorKind kind;

  public DeploymentException(ErrorKind kind, String message) {
    this(kind, message, null);
  }

  public DeploymentException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    if (kind == ErrorKind.INTERNAL && cause == null) {
      throw new IllegalArgumentException("INTERNAL errors must wrap a cause");
    }
  }

  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns {@code failure} itself if it already carries a kind, otherwise an
   * {@link ErrorKind#INTERNAL} exception wrapping it.
   */
  public static DeploymentException classify(Throwable failure) {
    Objects.requireNonNull(failure, "failure");
    if (failure instanceof DeploymentException classified) {
      return classified;
    }
    return internal("Unexpected failure: " + failure, failure);
  }

  public static DeploymentException unsupportedFlavor(String flavor, Collection<String> supported) {
    return new DeploymentException(ErrorKind.UNSUPPORTED_FLAVOR,
        "The model flavor `" + flavor + "` is not supported for deployment."
            + " Please use one of the supported flavors: " + supported);
  }

  public static DeploymentException noSupportedFlavor(Collection<String> manifestFlavors,
      Collection<String> supported) {
    return new DeploymentException(ErrorKind.UNSUPPORTED_FLAVOR,
        "The model flavors: `" + manifestFlavors + "` are not supported for deployment."
            + " Please use one of the supported flavors: " + supported);
  }

  public static DeploymentException flavorNotPresent(String flavor, Collection<String> manifestFlavors) {
    return new DeploymentException(ErrorKind.FLAVOR_NOT_PRESENT,
        "The model does not contain the requested flavor `" + flavor + "`."
            + " Available flavors: " + manifestFlavors);
  }

  public static DeploymentException invalidReference(String message) {
    return new DeploymentException(ErrorKind.INVALID_REFERENCE, message);
  }

  public static DeploymentException invalidMetadata(String message) {
    return new DeploymentException(ErrorKind.INVALID_METADATA, message);
  }

  public static DeploymentException invalidDatabaseUri(String message, Throwable cause) {
    return new DeploymentException(ErrorKind.INVALID_DATABASE_URI, message, cause);
  }

  public static DeploymentException manifestNotFound(String location) {
    return new DeploymentException(ErrorKind.MANIFEST_NOT_FOUND,
        "Failed to find model manifest within the model's root directory: " + location);
  }

  public static DeploymentException artifactNotFound(String message) {
    return new DeploymentException(ErrorKind.ARTIFACT_NOT_FOUND, message);
  }

  public static DeploymentException missingArtifactData(String message) {
    return new DeploymentException(ErrorKind.MISSING_ARTIFACT_DATA, message);
  }

  public static DeploymentException malformedFlavorConfig(String message) {
    return new DeploymentException(ErrorKind.MALFORMED_FLAVOR_CONFIG, message);
  }

  public static DeploymentException malformedManifest(String message, Throwable cause) {
    return new DeploymentException(ErrorKind.MALFORMED_MANIFEST, message, cause);
  }

  public static DeploymentException schemaCreation(String tableName, Throwable cause) {
    return new DeploymentException(ErrorKind.SCHEMA_CREATION,
        "Failed to create table " + tableName, cause);
  }

  public static DeploymentException invalidTableName(String tableName) {
    return new DeploymentException(ErrorKind.SCHEMA_CREATION, "Invalid table name: " + tableName);
  }

  public static DeploymentException commit(Throwable cause) {
    return new DeploymentException(ErrorKind.COMMIT, "Failed to commit deployment transaction", cause);
  }

  public static DeploymentException internal(String message, Throwable cause) {
    return new DeploymentException(ErrorKind.INTERNAL, message, Objects.requireNonNull(cause, "cause"));
  }
}

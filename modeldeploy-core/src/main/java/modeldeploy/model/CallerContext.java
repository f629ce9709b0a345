package modeldeploy.model;

/**
 * Caller-supplied context for a deployment.
 *
 * @param principal   identifier of whoever deploys the model, or {@code null}
 * @param versionInfo registry metadata for the model version, or {@code null} if unavailable
 */
public record CallerContext(Integer principal, ModelVersionInfo versionInfo) {

  public static CallerContext of(Integer principal) {
    return new CallerContext(principal, null);
  }
}

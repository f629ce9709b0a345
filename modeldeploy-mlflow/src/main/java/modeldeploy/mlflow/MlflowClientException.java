package modeldeploy.mlflow;

/**
 * Unchecked exception describing a failed MLflow REST call.
 */
public final class MlflowClientException extends RuntimeException {
  private final int statusCode;
  private final String errorCode;

  public MlflowClientException(String message, int statusCode, String errorCode) {
    super(message);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  /** HTTP status of the rejected call. */
  public int statusCode() {
    return statusCode;
  }

  /** MLflow {@code error_code}, such as {@code RESOURCE_DOES_NOT_EXIST}, or {@code null}. */
  public String errorCode() {
    return errorCode;
  }
}

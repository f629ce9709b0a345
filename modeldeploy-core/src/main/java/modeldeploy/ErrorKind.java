package modeldeploy;

/**
 * Structured kind carried by every {@link DeploymentException}.
 *
 * <p>Each kind belongs to a {@link Category} that tells the caller whether the failure
 * came from its own input, from the artifact, from the database or from an unexpected
 * condition. None of them is retried.
 */
public enum ErrorKind {
  UNSUPPORTED_FLAVOR(Category.USER_INPUT),
  FLAVOR_NOT_PRESENT(Category.USER_INPUT),
  INVALID_REFERENCE(Category.USER_INPUT),
  INVALID_METADATA(Category.USER_INPUT),
  INVALID_DATABASE_URI(Category.USER_INPUT),
  MANIFEST_NOT_FOUND(Category.RESOURCE_MISSING),
  ARTIFACT_NOT_FOUND(Category.RESOURCE_MISSING),
  MISSING_ARTIFACT_DATA(Category.RESOURCE_MALFORMED),
  MALFORMED_FLAVOR_CONFIG(Category.RESOURCE_MALFORMED),
  MALFORMED_MANIFEST(Category.RESOURCE_MALFORMED),
  SCHEMA_CREATION(Category.STORE),
  COMMIT(Category.STORE),
  INTERNAL(Category.INTERNAL);

  private final Category category;

  ErrorKind(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  public enum Category {
    USER_INPUT,
    RESOURCE_MISSING,
    RESOURCE_MALFORMED,
    STORE,
    INTERNAL
  }
}

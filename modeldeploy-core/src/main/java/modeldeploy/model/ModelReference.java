package modeldeploy.model;

import modeldeploy.DeploymentException;

import java.util.Objects;

/**
 * A parsed registry model reference of the form {@code models:/<name>/<version>}.
 *
 * <p>The version segment is either a numeric registry version or a stage label such as
 * {@code Production}.
 */
public final class ModelReference {
  public static final String SCHEME = "models";

  private final String uri;
  private final String name;
  private final String version;

  private ModelReference(String uri, String name, String version) {
    this.uri = uri;
    this.name = name;
    this.version = version;
  }

  /**
   * Parses a model URI.
   *
   * @throws DeploymentException with kind {@code INVALID_REFERENCE} if the URI is malformed
   */
  public static ModelReference parse(String uri) {
    if (uri == null || uri.isBlank()) {
      throw DeploymentException.invalidReference("Model URI must not be empty");
    }
    String trimmed = uri.trim();
    if (!trimmed.startsWith(SCHEME + ":/")) {
      throw DeploymentException.invalidReference(
          "Unsupported model URI, expected models:/<name>/<version>: " + trimmed);
    }
    String rest = trimmed.substring(SCHEME.length() + 1);
    while (rest.startsWith("/")) {
      rest = rest.substring(1);
    }
    String[] parts = rest.split("/", -1);
    if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
      throw DeploymentException.invalidReference(
          "Model URI must have the form models:/<name>/<version>, got: " + trimmed);
    }
    return new ModelReference(trimmed, parts[0], parts[1]);
  }

  /** Creates a reference for the given name and version or stage. */
  public static ModelReference of(String name, String version) {
    return parse(SCHEME + ":/" + name + "/" + version);
  }

  /**
   * Returns a reference to {@code version} of the same model, or this reference if it
   * already names that version.
   */
  public ModelReference pinnedTo(String version) {
    Objects.requireNonNull(version, "version");
    return this.version.equals(version) ? this : of(name, version);
  }

  public String uri() {
    return uri;
  }

  /** Registered model name. */
  public String name() {
    return name;
  }

  /** Version number or stage label. */
  public String version() {
    return version;
  }

  /** Returns {@code true} if the version segment is a numeric version rather than a stage label. */
  public boolean hasNumericVersion() {
    return version.chars().allMatch(Character::isDigit);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ModelReference other)) return false;
    return name.equals(other.name) && version.equals(other.version);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, version);
  }

  @Override
  public String toString() {
    return uri;
  }
}

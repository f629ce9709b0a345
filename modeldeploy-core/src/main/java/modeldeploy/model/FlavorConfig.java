package modeldeploy.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration block of one flavor inside a model manifest.
 */
public final class FlavorConfig {
  public static final String DATA_KEY = "data";

  private final String flavor;
  private final Map<String, Object> properties;

  public FlavorConfig(String flavor, Map<String, ?> properties) {
    this.flavor = Objects.requireNonNull(flavor, "flavor");
    this.properties = properties == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public String flavor() {
    return flavor;
  }

  public Map<String, Object> properties() {
    return properties;
  }

  /** Relative path of the data file, read from the {@code data} key. */
  public Optional<String> dataPath() {
    return string(DATA_KEY);
  }

  /** Packaging format version, read from the {@code <flavor>_version} key. */
  public Optional<String> version() {
    return string(versionKey());
  }

  public String versionKey() {
    return flavor + "_version";
  }

  private Optional<String> string(String key) {
    Object value = properties.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString();
    return text.isBlank() ? Optional.empty() : Optional.of(text);
  }

  @Override
  public String toString() {
    return "FlavorConfig{" + flavor + "=" + properties + "}";
  }
}

package modeldeploy.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Self-describing metadata of a model artifact: the flavors it is available in, in the
 * order the manifest lists them, plus the provenance fields the manifest records.
 */
public final class ModelManifest {
  private final Map<String, FlavorConfig> flavors;
  private final String runId;
  private final String utcTimeCreated;

  private ModelManifest(Builder builder) {
    this.flavors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.flavors));
    this.runId = builder.runId;
    this.utcTimeCreated = builder.utcTimeCreated;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Flavor names in manifest order. */
  public List<String> flavorNames() {
    return List.copyOf(flavors.keySet());
  }

  public Map<String, FlavorConfig> flavors() {
    return flavors;
  }

  public boolean hasFlavor(String flavor) {
    return flavors.containsKey(flavor);
  }

  public Optional<FlavorConfig> flavor(String flavor) {
    return Optional.ofNullable(flavors.get(flavor));
  }

  public Optional<String> runId() {
    return Optional.ofNullable(runId);
  }

  public Optional<String> utcTimeCreated() {
    return Optional.ofNullable(utcTimeCreated);
  }

  public static final class Builder {
    private final Map<String, FlavorConfig> flavors = new LinkedHashMap<>();
    private String runId;
    private String utcTimeCreated;

    private Builder() {
    }

    public Builder flavor(String name, Map<String, ?> config) {
      Objects.requireNonNull(name, "name");
      flavors.put(name, new FlavorConfig(name, config));
      return this;
    }

    public Builder runId(String runId) {
      this.runId = runId;
      return this;
    }

    public Builder utcTimeCreated(String utcTimeCreated) {
      this.utcTimeCreated = utcTimeCreated;
      return this;
    }

    public ModelManifest build() {
      return new ModelManifest(this);
    }
  }
}

package modeldeploy.spring.boot;

import modeldeploy.flavor.FlavorValidator;
import modeldeploy.schema.TableNames;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for model deployments.
 *
 * @see ModelDeployAutoConfiguration
 */
@ConfigurationProperties(prefix = "modeldeploy")
public class ModelDeployProperties {

  /**
   * Table receiving deployments that do not name one.
   */
  private String tableName = TableNames.DEFAULT_TABLE;

  /**
   * Flavors accepted for deployment.
   */
  private List<String> supportedFlavors = new ArrayList<>(FlavorValidator.DEFAULT_SUPPORTED_FLAVORS);

  private final Artifacts artifacts = new Artifacts();
  private final Mlflow mlflow = new Mlflow();
  private final Metrics metrics = new Metrics();

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public List<String> getSupportedFlavors() {
    return supportedFlavors;
  }

  public void setSupportedFlavors(List<String> supportedFlavors) {
    this.supportedFlavors = supportedFlavors;
  }

  public Artifacts getArtifacts() {
    return artifacts;
  }

  public Mlflow getMlflow() {
    return mlflow;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Artifacts {
    /**
     * Directory holding artifacts as {@code <root>/<name>/<version>}.
     */
    private Path localRoot;

    public Path getLocalRoot() {
      return localRoot;
    }

    public void setLocalRoot(Path localRoot) {
      this.localRoot = localRoot;
    }
  }

  public static class Mlflow {
    /**
     * Base URI of the MLflow tracking server.
     */
    private URI trackingUri;
    /**
     * Bearer token; takes precedence over username and password.
     */
    private String token;
    /**
     * Basic auth user, used when no token is set.
     */
    private String username;
    private String password;
    private Duration requestTimeout = Duration.ofSeconds(30);

    public URI getTrackingUri() {
      return trackingUri;
    }

    public void setTrackingUri(URI trackingUri) {
      this.trackingUri = trackingUri;
    }

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "modeldeploy";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}

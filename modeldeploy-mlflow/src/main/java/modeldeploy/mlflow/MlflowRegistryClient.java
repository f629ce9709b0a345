package modeldeploy.mlflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import modeldeploy.DeploymentException;
import modeldeploy.model.ModelReference;
import modeldeploy.model.ModelVersionInfo;
import modeldeploy.spi.ModelRegistry;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link ModelRegistry} backed by the MLflow model registry REST API (version 2.0).
 *
 * <pre>{@code
 * MlflowRegistryClient client = MlflowRegistryClient.builder()
 *     .trackingUri(URI.create("http://mlflow:5000"))
 *     .token(System.getenv("MLFLOW_TRACKING_TOKEN"))
 *     .build();
 * }</pre>
 *
 * <p>Numeric versions are fetched with {@code model-versions/get}. Stage labels such as
 * {@code Production} go through {@code registered-models/get-latest-versions}; the label
 * {@code latest} picks the highest version across all stages. An unknown model or version
 * fails with {@code ARTIFACT_NOT_FOUND}; any other failed call with {@code INTERNAL}.
 *
 * <p>Instances are thread-safe.
 */
public final class MlflowRegistryClient implements ModelRegistry {
  private static final Logger logger = Logger.getLogger(MlflowRegistryClient.class.getName());

  static final String API_PREFIX = "/api/2.0/mlflow/";
  static final String LATEST = "latest";
  private static final String RESOURCE_DOES_NOT_EXIST = "RESOURCE_DOES_NOT_EXIST";

  private final String baseUrl;
  private final String authorization;
  private final Duration requestTimeout;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  private MlflowRegistryClient(Builder builder) {
    Objects.requireNonNull(builder.trackingUri, "trackingUri");
    this.baseUrl = builder.trackingUri.toString().replaceAll("/+$", "");
    this.requestTimeout = builder.requestTimeout == null ? Duration.ofSeconds(30) : builder.requestTimeout;
    this.authorization = authorization(builder);
    this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
        .connectTimeout(requestTimeout)
        .build();
    this.objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optional<ModelVersionInfo> getModelVersion(ModelReference reference) {
    return Optional.of(fetchVersion(reference));
  }

  /**
   * Returns the artifact location of the referenced version, as reported by the registry.
   * A numeric version is asked for directly; a stage label is first resolved to the version
   * it currently points at.
   *
   * @throws DeploymentException with kind {@code ARTIFACT_NOT_FOUND} or {@code INTERNAL}
   */
  public String getDownloadUri(ModelReference reference) {
    ModelReference version = reference.hasNumericVersion()
        ? reference : reference.pinnedTo(fetchVersion(reference).version());
    Map<String, String> params = new LinkedHashMap<>();
    params.put("name", version.name());
    params.put("version", version.version());
    JsonNode body = get("model-versions/get-download-uri", params);
    String artifactUri = text(body, "artifact_uri");
    if (artifactUri == null) {
      throw DeploymentException.internal("MLflow returned no artifact_uri for " + reference,
          new MlflowClientException("Missing artifact_uri", 200, null));
    }
    return artifactUri;
  }

  private ModelVersionInfo fetchVersion(ModelReference reference) {
    if (reference.hasNumericVersion()) {
      Map<String, String> params = new LinkedHashMap<>();
      params.put("name", reference.name());
      params.put("version", reference.version());
      JsonNode version = get("model-versions/get", params).path("model_version");
      if (!version.isObject()) {
        throw DeploymentException.artifactNotFound("MLflow has no model version " + reference);
      }
      return toVersionInfo(version, reference);
    }

    ObjectNode request = objectMapper.createObjectNode().put("name", reference.name());
    if (!LATEST.equalsIgnoreCase(reference.version())) {
      request.putArray("stages").add(reference.version());
    }
    JsonNode latest = null;
    for (JsonNode candidate : post("registered-models/get-latest-versions", request).path("model_versions")) {
      if (latest == null || versionNumber(candidate) > versionNumber(latest)) {
        latest = candidate;
      }
    }
    if (latest == null) {
      throw DeploymentException.artifactNotFound(
          "MLflow has no version of " + reference.name() + " in stage " + reference.version());
    }
    return toVersionInfo(latest, reference);
  }

  private ModelVersionInfo toVersionInfo(JsonNode node, ModelReference reference) {
    String name = text(node, "name");
    String version = text(node, "version");
    JsonNode created = node.path("creation_timestamp");
    Long creationTimestamp = null;
    if (created.isNumber()) {
      creationTimestamp = created.asLong();
    } else if (created.isTextual() && !created.asText().isBlank()) {
      // int64 fields may arrive as JSON strings
      creationTimestamp = Long.parseLong(created.asText());
    }
    return new ModelVersionInfo(
        name != null ? name : reference.name(),
        version != null ? version : reference.version(),
        creationTimestamp,
        text(node, "description"),
        text(node, "run_id"),
        text(node, "source"));
  }

  private static long versionNumber(JsonNode node) {
    JsonNode version = node.path("version");
    return version.isNumber() ? version.asLong() : Long.parseLong(version.asText("0"));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  private JsonNode get(String endpoint, Map<String, String> params) {
    String query = params.entrySet().stream()
        .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
    return send(endpoint, request(endpoint + "?" + query).GET());
  }

  private JsonNode post(String endpoint, JsonNode body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw DeploymentException.internal("Failed to encode MLflow request", e);
    }
    return send(endpoint, request(endpoint)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json)));
  }

  private HttpRequest.Builder request(String pathAndQuery) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + API_PREFIX + pathAndQuery))
        .header("Accept", "application/json")
        .timeout(requestTimeout);
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    return builder;
  }

  private JsonNode send(String endpoint, HttpRequest.Builder builder) {
    HttpRequest request = builder.build();
    logger.log(Level.FINE, "{0} {1}", new Object[]{request.method(), request.uri()});
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw DeploymentException.internal("MLflow request " + endpoint + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw DeploymentException.internal("Interrupted while calling MLflow " + endpoint, e);
    }

    JsonNode body = parse(response.body());
    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      if (body == null) {
        throw DeploymentException.internal("MLflow returned an unreadable body for " + endpoint,
            new MlflowClientException("Unreadable response body", status, null));
      }
      return body;
    }

    String errorCode = body == null ? null : text(body, "error_code");
    String message = body == null ? null : text(body, "message");
    String description = "MLflow " + endpoint + " returned HTTP " + status
        + (errorCode == null ? "" : " " + errorCode) + (message == null ? "" : ": " + message);
    if (status == 404 || RESOURCE_DOES_NOT_EXIST.equals(errorCode)) {
      throw DeploymentException.artifactNotFound(description);
    }
    throw DeploymentException.internal(description, new MlflowClientException(description, status, errorCode));
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      logger.log(Level.FINE, "Non-JSON response from MLflow", e);
      return null;
    }
  }

  private static String authorization(Builder builder) {
    if (builder.token != null && !builder.token.isBlank()) {
      return "Bearer " + builder.token;
    }
    if (builder.username != null) {
      String credentials = builder.username + ":" + (builder.password == null ? "" : builder.password);
      return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
    return null;
  }

  public static final class Builder {
    private URI trackingUri;
    private String token;
    private String username;
    private String password;
    private Duration requestTimeout;
    private HttpClient httpClient;

    private Builder() {
    }

    /** Base URI of the MLflow tracking server, e.g. {@code http://mlflow:5000}. */
    public Builder trackingUri(URI trackingUri) {
      this.trackingUri = trackingUri;
      return this;
    }

    /** Bearer token; takes precedence over basic credentials. */
    public Builder token(String token) {
      this.token = token;
      return this;
    }

    public Builder basicAuth(String username, String password) {
      this.username = username;
      this.password = password;
      return this;
    }

    /** Per-request timeout; defaults to 30 seconds. */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public MlflowRegistryClient build() {
      return new MlflowRegistryClient(this);
    }
  }
}

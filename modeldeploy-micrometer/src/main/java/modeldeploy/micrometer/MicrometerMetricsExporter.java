package modeldeploy.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import modeldeploy.ErrorKind;
import modeldeploy.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code modeldeploy.deploy.success}: committed deployments</li>
 *   <li>{@code modeldeploy.deploy.failure}: failed deployments, tagged {@code kind} and {@code category}</li>
 *   <li>{@code modeldeploy.table.created}: tables created by this process</li>
 * </ul>
 *
 * <h3>Timers and summaries</h3>
 * <ul>
 *   <li>{@code modeldeploy.deploy.duration}: wall time of each deployment call</li>
 *   <li>{@code modeldeploy.artifact.bytes}: size of deployed payloads</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "modeldeploy";

  private final MeterRegistry registry;
  private final Counter deploySuccess;
  private final Map<ErrorKind, Counter> deployFailure = new EnumMap<>(ErrorKind.class);
  private final Counter tableCreated;
  private final Timer deployDuration;
  private final DistributionSummary artifactBytes;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "modeldeploy"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "serving.modeldeploy"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.deploySuccess = Counter.builder(namePrefix + ".deploy.success")
        .description("Deployments committed")
        .register(registry);
    for (ErrorKind kind : ErrorKind.values()) {
      deployFailure.put(kind, Counter.builder(namePrefix + ".deploy.failure")
          .description("Deployments failed")
          .tag("kind", kind.name())
          .tag("category", kind.category().name())
          .register(registry));
    }
    this.tableCreated = Counter.builder(namePrefix + ".table.created")
        .description("Model tables created")
        .register(registry);
    this.deployDuration = Timer.builder(namePrefix + ".deploy.duration")
        .description("Wall time of a deployment call")
        .register(registry);
    this.artifactBytes = DistributionSummary.builder(namePrefix + ".artifact.bytes")
        .description("Size of deployed model payloads")
        .baseUnit("bytes")
        .register(registry);
  }

  @Override
  public void incrementDeploySuccess() {
    if (closed) return;
    deploySuccess.increment();
  }

  @Override
  public void incrementDeployFailure(ErrorKind kind) {
    if (closed) return;
    deployFailure.get(kind == null ? ErrorKind.INTERNAL : kind).increment();
  }

  @Override
  public void incrementTableCreated() {
    if (closed) return;
    tableCreated.increment();
  }

  @Override
  public void recordDeployDurationMs(long durationMs) {
    if (closed) return;
    deployDuration.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void recordArtifactBytes(long bytes) {
    if (closed) return;
    artifactBytes.record(bytes);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(deployFailure.values());
    meters.addAll(List.of(deploySuccess, tableCreated, deployDuration, artifactBytes));
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

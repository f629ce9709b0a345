package modeldeploy.spi;

import modeldeploy.ErrorKind;

/**
 * Observability hook for exporting deployment counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Exceptions thrown by an
 * exporter are logged by the caller and never change the result of a deployment.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of committed deployments.
   */
  void incrementDeploySuccess();

  /**
   * Increments the count of failed deployments.
   *
   * @param kind the kind of the propagated error
   */
  void incrementDeployFailure(ErrorKind kind);

  /**
   * Increments the count of physical tables created by this process.
   */
  void incrementTableCreated();

  /**
   * Records the wall time of one deployment call, successful or not.
   */
  default void recordDeployDurationMs(long durationMs) {
  }

  /**
   * Records the size of a deployed artifact payload.
   */
  default void recordArtifactBytes(long bytes) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementDeploySuccess() {
    }

    @Override
    public void incrementDeployFailure(ErrorKind kind) {
    }

    @Override
    public void incrementTableCreated() {
    }
  }
}

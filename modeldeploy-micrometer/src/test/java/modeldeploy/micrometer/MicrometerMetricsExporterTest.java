package modeldeploy.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import modeldeploy.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementDeploySuccess() {
    exporter.incrementDeploySuccess();
    exporter.incrementDeploySuccess();
    assertEquals(2.0, counter("modeldeploy.deploy.success").count());
  }

  @Test
  void failuresAreTaggedByKind() {
    exporter.incrementDeployFailure(ErrorKind.UNSUPPORTED_FLAVOR);
    exporter.incrementDeployFailure(ErrorKind.UNSUPPORTED_FLAVOR);
    exporter.incrementDeployFailure(ErrorKind.COMMIT);

    assertEquals(2.0, registry.get("modeldeploy.deploy.failure")
        .tag("kind", "UNSUPPORTED_FLAVOR").counter().count());
    assertEquals(1.0, registry.get("modeldeploy.deploy.failure")
        .tag("kind", "COMMIT").tag("category", "STORE").counter().count());
    assertEquals(0.0, registry.get("modeldeploy.deploy.failure")
        .tag("kind", "INTERNAL").counter().count());
  }

  @Test
  void incrementTableCreated() {
    exporter.incrementTableCreated();
    assertEquals(1.0, counter("modeldeploy.table.created").count());
  }

  @Test
  void recordsDurationAndArtifactSize() {
    exporter.recordDeployDurationMs(250);
    exporter.recordArtifactBytes(2048);
    exporter.recordArtifactBytes(1024);

    assertEquals(1, registry.get("modeldeploy.deploy.duration").timer().count());
    assertEquals(250.0, registry.get("modeldeploy.deploy.duration").timer().totalTime(TimeUnit.MILLISECONDS));
    assertEquals(3072.0, registry.get("modeldeploy.artifact.bytes").summary().totalAmount());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry other = new SimpleMeterRegistry();
    new MicrometerMetricsExporter(other, "serving.models").incrementDeploySuccess();
    assertEquals(1.0, other.get("serving.models.deploy.success").counter().count());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "models."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementDeploySuccess();
    exporter.incrementDeployFailure(ErrorKind.INTERNAL);
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }
}

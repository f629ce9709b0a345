package modeldeploy.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import modeldeploy.micrometer.MicrometerMetricsExporter;
import modeldeploy.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class ModelDeployMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(ModelDeployMicrometerAutoConfiguration.class));

  @Test
  void createsMicrometerExporterByDefault() {
    runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withUserConfiguration(MeterRegistryConfig.class)
        .withPropertyValues("modeldeploy.metrics.name-prefix=serving.models")
        .run(ctx -> {
          var registry = ctx.getBean(MeterRegistry.class);
          assertNotNull(registry.find("serving.models.deploy.success").counter());
          assertNull(registry.find("modeldeploy.deploy.success").counter());
        });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withUserConfiguration(MeterRegistryConfig.class)
        .withPropertyValues("modeldeploy.metrics.enabled=false")
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void skippedWithoutMeterRegistry() {
    runner.run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(MeterRegistryConfig.class, CustomExporterConfig.class).run(ctx -> {
      var exporter = ctx.getBean(MetricsExporter.class);
      assertFalse(exporter instanceof MicrometerMetricsExporter);
    });
  }

  @Test
  void metersRemovedOnContextClose() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    runner.withBean(MeterRegistry.class, () -> registry).run(ctx ->
        assertNotNull(registry.find("modeldeploy.deploy.success").counter()));
    assertNull(registry.find("modeldeploy.deploy.success").counter());
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customMetricsExporter() {
      return MetricsExporter.NOOP;
    }
  }
}

package modeldeploy.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelDeployPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(ModelDeployProperties.class);
      assertEquals("models", props.getTableName());
      assertEquals(List.of("onnx", "sklearn"), props.getSupportedFlavors());
      assertNull(props.getArtifacts().getLocalRoot());
      assertNull(props.getMlflow().getTrackingUri());
      assertNull(props.getMlflow().getToken());
      assertNull(props.getMlflow().getUsername());
      assertNull(props.getMlflow().getPassword());
      assertEquals(Duration.ofSeconds(30), props.getMlflow().getRequestTimeout());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("modeldeploy", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "modeldeploy.table-name=prod_models",
        "modeldeploy.supported-flavors=onnx",
        "modeldeploy.artifacts.local-root=/srv/artifacts",
        "modeldeploy.mlflow.tracking-uri=http://mlflow:5000",
        "modeldeploy.mlflow.token=secret",
        "modeldeploy.mlflow.username=ml",
        "modeldeploy.mlflow.password=pw",
        "modeldeploy.mlflow.request-timeout=5s",
        "modeldeploy.metrics.enabled=false",
        "modeldeploy.metrics.name-prefix=serving.models"
    ).run(ctx -> {
      var props = ctx.getBean(ModelDeployProperties.class);
      assertEquals("prod_models", props.getTableName());
      assertEquals(List.of("onnx"), props.getSupportedFlavors());
      assertEquals(Path.of("/srv/artifacts"), props.getArtifacts().getLocalRoot());
      assertEquals(URI.create("http://mlflow:5000"), props.getMlflow().getTrackingUri());
      assertEquals("secret", props.getMlflow().getToken());
      assertEquals("ml", props.getMlflow().getUsername());
      assertEquals("pw", props.getMlflow().getPassword());
      assertEquals(Duration.ofSeconds(5), props.getMlflow().getRequestTimeout());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("serving.models", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(ModelDeployProperties.class)
  static class PropsConfig {
  }
}

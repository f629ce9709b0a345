package modeldeploy.flavor;

import modeldeploy.DeploymentException;
import modeldeploy.ErrorKind;
import modeldeploy.model.ModelManifest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlavorValidatorTest {

  private final FlavorValidator validator = new FlavorValidator();

  private static ModelManifest manifest(String... flavors) {
    ModelManifest.Builder builder = ModelManifest.builder();
    for (String flavor : flavors) {
      builder.flavor(flavor, Map.of("data", "model.bin", flavor + "_version", "1.0"));
    }
    return builder.build();
  }

  @Test
  void explicitSupportedAndPresentFlavorIsReturned() {
    assertEquals("onnx", validator.validate(manifest("python_function", "onnx"), "onnx"));
  }

  @Test
  void explicitUnsupportedFlavorFailsEvenIfPresent() {
    DeploymentException e = assertThrows(DeploymentException.class,
        () -> validator.validate(manifest("tensorflow", "onnx"), "tensorflow"));

    assertEquals(ErrorKind.UNSUPPORTED_FLAVOR, e.kind());
    assertTrue(e.getMessage().contains("tensorflow"));
  }

  @Test
  void explicitFlavorMissingFromManifestNamesAvailableFlavors() {
    DeploymentException e = assertThrows(DeploymentException.class,
        () -> validator.validate(manifest("python_function", "sklearn"), "onnx"));

    assertEquals(ErrorKind.FLAVOR_NOT_PRESENT, e.kind());
    assertTrue(e.getMessage().contains("[python_function, sklearn]"), e.getMessage());
  }

  @Test
  void autoDetectPicksFirstSupportedFlavorInManifestOrder() {
    assertEquals("sklearn", validator.validate(manifest("python_function", "sklearn", "onnx"), null));
    assertEquals("onnx", validator.validate(manifest("onnx", "sklearn"), null));
  }

  @Test
  void autoDetectIsDeterministic() {
    ModelManifest manifest = manifest("keras", "sklearn", "onnx");
    for (int i = 0; i < 10; i++) {
      assertEquals("sklearn", validator.validate(manifest, null));
    }
  }

  @Test
  void autoDetectWithoutSupportedFlavorListsBothSets() {
    DeploymentException e = assertThrows(DeploymentException.class,
        () -> validator.validate(manifest("python_function", "keras"), null));

    assertEquals(ErrorKind.UNSUPPORTED_FLAVOR, e.kind());
    assertTrue(e.getMessage().contains("[python_function, keras]"), e.getMessage());
    assertTrue(e.getMessage().contains("[onnx, sklearn]"), e.getMessage());
  }

  @Test
  void customSupportedSetIsHonoured() {
    FlavorValidator custom = new FlavorValidator(List.of("keras"));

    assertEquals("keras", custom.validate(manifest("onnx", "keras"), null));
    assertEquals(ErrorKind.UNSUPPORTED_FLAVOR, assertThrows(DeploymentException.class,
        () -> custom.validate(manifest("onnx"), "onnx")).kind());
  }

  @Test
  void emptySupportedSetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new FlavorValidator(List.of()));
  }
}

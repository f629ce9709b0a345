package modeldeploy;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeploymentExceptionTest {

  @Test
  void classifyPassesClassifiedErrorsThrough() {
    DeploymentException original = DeploymentException.flavorNotPresent("onnx", java.util.List.of("sklearn"));

    assertSame(original, DeploymentException.classify(original));
  }

  @Test
  void classifyWrapsUnclassifiedFailuresAsInternal() {
    SQLException cause = new SQLException("duplicate key");

    DeploymentException wrapped = DeploymentException.classify(cause);

    assertEquals(ErrorKind.INTERNAL, wrapped.kind());
    assertSame(cause, wrapped.getCause());
  }

  @Test
  void internalErrorsRequireCause() {
    assertThrows(IllegalArgumentException.class,
        () -> new DeploymentException(ErrorKind.INTERNAL, "no cause"));
    assertThrows(NullPointerException.class, () -> DeploymentException.internal("no cause", null));
  }

  @Test
  void kindsCarryCategories() {
    assertEquals(ErrorKind.Category.USER_INPUT, ErrorKind.UNSUPPORTED_FLAVOR.category());
    assertEquals(ErrorKind.Category.USER_INPUT, ErrorKind.INVALID_DATABASE_URI.category());
    assertEquals(ErrorKind.Category.RESOURCE_MISSING, ErrorKind.MANIFEST_NOT_FOUND.category());
    assertEquals(ErrorKind.Category.RESOURCE_MALFORMED, ErrorKind.MALFORMED_FLAVOR_CONFIG.category());
    assertEquals(ErrorKind.Category.STORE, ErrorKind.COMMIT.category());
  }
}

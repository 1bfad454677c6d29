package ca.gc.cra.hostbridge.domain.scene;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class Vector3Test {

  @Test
  void parseAcceptsParenthesizedAndBareForms() {
    assertEquals(new Vector3(1f, 2.5f, -3f), Vector3.parse("(1, 2.5, -3)"));
    assertEquals(new Vector3(1f, 2.5f, -3f), Vector3.parse("1,2.5,-3"));
  }

  @Test
  void parseRejectsWrongArity() {
    assertThrows(IllegalArgumentException.class, () -> Vector3.parse("1,2"));
    assertThrows(IllegalArgumentException.class, () -> Vector3.parse("a,b,c"));
  }

  @Test
  void toStringTrimsTrailingZeros() {
    assertEquals("(1, 2.5, 0)", new Vector3(1f, 2.5f, 0f).toString());
  }

  @Test
  void fromMapFillsMissingComponents() {
    assertEquals(new Vector3(4f, 1f, 1f), Vector3.fromMap(Map.of("x", 4), Vector3.ONE));
  }
}

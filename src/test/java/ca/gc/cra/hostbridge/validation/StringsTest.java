package ca.gc.cra.hostbridge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireIdentifierAcceptsCommandNames() {
    assertEquals("GetComponentProperty", Strings.requireIdentifier("command", "GetComponentProperty"));
    assertEquals("ping", Strings.requireIdentifier("command", "ping"));
  }

  @Test
  void requireIdentifierRejectsSpaces() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireIdentifier("command", "Create Entity"));
    assertTrue(ex.getMessage().startsWith("command "));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attrs", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }
}

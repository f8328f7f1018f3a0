package ca.gc.cra.vigil.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("vigil.yaml", Strings.requireNonBlank("config", "  vigil.yaml  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("config", "   "));
    assertEquals("config must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("config", "bad\u0001"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("config", null));
  }

  @Test
  void containsControlDetectsIsoControls() {
    assertTrue(Strings.containsControl("a\tb"));
    assertFalse(Strings.containsControl("Warning"));
  }
}

package ca.gc.cra.teleq.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
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
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "\u0000prod"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "\u0007"));
  }

  @Test
  void requireNonBlankTrimsSurroundingWhitespace() {
    assertEquals("prod", Strings.requireNonBlank("test", " \tprod\n"));
  }

  @Test
  void requireNonBlankNamesTheValueInTheMessage() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("workspaceRoot", "  "));
    assertEquals("workspaceRoot must not be blank", ex.getMessage());
  }

  @Test
  void trimToNullCollapsesBlankValues() {
    assertNull(Strings.trimToNull(" \t "));
    assertNull(Strings.trimToNull(null));
    assertEquals("x", Strings.trimToNull(" x "));
  }

  @Test
  void firstNonBlankSkipsBlankCandidates() {
    assertEquals("b", Strings.firstNonBlank(null, " ", " b ", "c"));
    assertNull(Strings.firstNonBlank(" ", null));
    assertTrue(Strings.isBlank(""));
  }
}

package io.pandaproxy.validation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("bblp", Strings.requireNonBlank("username", "  bblp "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("accessCode", "12\n34"));
  }

  @Test
  void requireNonBlankRejectsNull() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("accessCode", null));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("accessCode", "café", 32));
  }

  @Test
  void requireAsciiFieldEnforcesWidth() {
    assertArrayEquals("12345678".getBytes(StandardCharsets.US_ASCII),
        Strings.requireAsciiField("accessCode", "12345678", 32));
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requireAsciiField("accessCode", "x".repeat(33), 32));
  }
}

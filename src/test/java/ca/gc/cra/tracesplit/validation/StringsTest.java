package ca.gc.cra.tracesplit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("labels.h5", Strings.requireNonBlank("in", "  labels.h5 "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank("in", "   "));
    assertEquals("in must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("in", null));
  }

  @Test
  void datasetPathAcceptsAbsoluteAndRelativeForms() {
    assertEquals("labels", Strings.requireDatasetPath("dataset", "labels"));
    assertEquals("/traces/v2/labels", Strings.requireDatasetPath("dataset", "/traces/v2/labels"));
  }

  @Test
  void datasetPathRejectsMalformedSegments() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDatasetPath("dataset", "/"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDatasetPath("dataset", "a//b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDatasetPath("dataset", "my labels"));
  }

  @Test
  void printableAsciiEnforcesLengthAndCharset() {
    assertEquals("http://collector:4317", Strings.requirePrintableAscii("otelEndpoint", "http://collector:4317", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("v", "abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("v", "café", 10));
  }
}

package ca.gc.cra.tracesplit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableFileMustExistAndBeRegular() throws IOException {
    Path file = Files.writeString(tempDir.resolve("labels.ndjson"), "{}\n");

    assertEquals(file.toAbsolutePath().normalize(), Paths.validateReadableFile("in", file));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateReadableFile("in", tempDir.resolve("missing.h5")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile("in", tempDir));
  }

  @Test
  void writableFileRefusesOverwriteUnlessAllowed() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("splits.ndjson"), "");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableFile("out", existing, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(existing.toAbsolutePath().normalize(), Paths.validateWritableFile("out", existing, true));
  }

  @Test
  void writableFileNeedsExistingParent() {
    assertEquals(tempDir.resolve("new.ndjson").toAbsolutePath().normalize(),
        Paths.validateWritableFile("out", tempDir.resolve("new.ndjson"), false));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableFile("out", tempDir.resolve("nope").resolve("x.ndjson"), false));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile("out", tempDir, true));
  }
}

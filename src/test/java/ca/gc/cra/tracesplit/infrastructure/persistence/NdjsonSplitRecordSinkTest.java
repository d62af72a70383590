package ca.gc.cra.tracesplit.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracesplit.domain.split.SplitRecord;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonSplitRecordSinkTest {
  @TempDir Path tempDir;

  @Test
  void writesCompactObjectPerLineInFixedKeyOrder() throws Exception {
    StringWriter buffer = new StringWriter();
    try (NdjsonSplitRecordSink sink = new NdjsonSplitRecordSink(buffer, "buffer", false)) {
      sink.write(new SplitRecord(0, new int[] {3, 1}, new int[] {2}, new int[] {5}, new int[] {2, 1, 3}));
      sink.write(new SplitRecord(1, new int[] {4}, new int[0], new int[] {0}, new int[] {4}));
    }

    assertEquals("{\"train\":[3,1],\"val\":[2],\"test\":[5],\"train-val\":[2,1,3]}\n"
        + "{\"train\":[4],\"val\":[],\"test\":[0],\"train-val\":[4]}\n", buffer.toString());
  }

  @Test
  void fileSinkRefusesToReplaceExistingFileUnlessAllowed() throws Exception {
    Path out = Files.writeString(tempDir.resolve("splits.ndjson"), "old\n");

    assertThrows(FileAlreadyExistsException.class, () -> NdjsonSplitRecordSink.toFile(out, false));

    try (NdjsonSplitRecordSink sink = NdjsonSplitRecordSink.toFile(out, true)) {
      sink.write(new SplitRecord(0, new int[] {1}, new int[0], new int[] {2}, new int[] {1}));
    }
    assertEquals("{\"train\":[1],\"val\":[],\"test\":[2],\"train-val\":[1]}\n",
        Files.readString(out, StandardCharsets.UTF_8));
  }

  @Test
  void fileSinkCreatesNewFile() throws IOException {
    Path out = tempDir.resolve("fresh.ndjson");

    NdjsonSplitRecordSink.toFile(out, false).close();

    assertEquals("", Files.readString(out));
  }

  @Test
  void failedOpenClosesWriterAndRemovesNewFile() {
    Path out = tempDir.resolve("partial.ndjson");
    Writer[] opened = new Writer[1];

    IOException ex = assertThrows(IOException.class, () -> NdjsonSplitRecordSink.toFile(out, false,
        (writer, destination) -> {
          opened[0] = writer;
          throw new IOException("generator unavailable");
        }));

    assertEquals("generator unavailable", ex.getMessage());
    assertFalse(Files.exists(out));
    assertThrows(IOException.class, () -> opened[0].write('x'));
  }

  @Test
  void failedOverwriteKeepsTheExistingFile() throws IOException {
    Path out = Files.writeString(tempDir.resolve("splits.ndjson"), "old\n");

    assertThrows(IOException.class, () -> NdjsonSplitRecordSink.toFile(out, true, (writer, destination) -> {
      throw new IOException("generator unavailable");
    }));

    assertTrue(Files.exists(out));
  }
}

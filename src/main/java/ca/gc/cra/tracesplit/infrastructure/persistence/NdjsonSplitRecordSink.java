package ca.gc.cra.tracesplit.infrastructure.persistence;

import ca.gc.cra.tracesplit.application.port.SplitRecordSink;
import ca.gc.cra.tracesplit.domain.split.SplitRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes split records as newline-delimited JSON.
 * <p><strong>Role:</strong> Output adapter implementing {@link SplitRecordSink}.</p>
 * <p><strong>Format:</strong> One object per line with integer-array fields {@code train}, {@code val}, {@code test},
 * {@code train-val} in that order and no whitespace.</p>
 * <p><strong>Thread-safety:</strong> Single writer.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonSplitRecordSink implements SplitRecordSink {
  private static final Logger log = LoggerFactory.getLogger(NdjsonSplitRecordSink.class);
  private static final JsonFactory JSON = new JsonFactory();

  private final Writer writer;
  private final JsonGenerator generator;
  private final String destination;
  private final boolean closeTarget;
  private long written;

  /**
   * Creates a sink over an open writer.
   *
   * @param writer destination writer
   * @param destination description used in logs
   * @param closeTarget whether {@link #close()} closes {@code writer}
   * @throws IOException if the JSON generator cannot be created
   */
  public NdjsonSplitRecordSink(Writer writer, String destination, boolean closeTarget) throws IOException {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.destination = Objects.requireNonNull(destination, "destination");
    this.closeTarget = closeTarget;
    this.generator = JSON.createGenerator(writer);
    this.generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    this.generator.setRootValueSeparator(null);
  }

  /**
   * Opens a sink writing to a file.
   *
   * @param path output file
   * @param allowOverwrite whether an existing file may be replaced
   * @return open sink
   * @throws IOException if the file exists and overwriting is not allowed, or cannot be created
   */
  public static NdjsonSplitRecordSink toFile(Path path, boolean allowOverwrite) throws IOException {
    return toFile(path, allowOverwrite, (writer, destination) -> new NdjsonSplitRecordSink(writer, destination, true));
  }

  static NdjsonSplitRecordSink toFile(Path path, boolean allowOverwrite, SinkOpener opener) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(opener, "opener");
    OpenOption[] options = allowOverwrite
        ? new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE}
        : new OpenOption[] {StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE};
    Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, options);
    try {
      return opener.open(writer, path.toString());
    } catch (IOException | RuntimeException ex) {
      try {
        writer.close();
        if (!allowOverwrite) {
          Files.deleteIfExists(path);
        }
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }

  /** Wraps an opened file writer in a sink. */
  @FunctionalInterface
  interface SinkOpener {
    NdjsonSplitRecordSink open(Writer writer, String destination) throws IOException;
  }

  /**
   * Opens a sink writing to standard output; stdout itself stays open after {@link #close()}.
   *
   * @return open sink
   * @throws IOException if the JSON generator cannot be created
   */
  public static NdjsonSplitRecordSink toStdout() throws IOException {
    Writer writer = new BufferedWriter(
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8));
    return new NdjsonSplitRecordSink(writer, "stdout", false);
  }

  @Override
  public void write(SplitRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    generator.writeStartObject();
    writeArray("train", record.train());
    writeArray("val", record.validation());
    writeArray("test", record.test());
    writeArray("train-val", record.trainValidation());
    generator.writeEndObject();
    generator.writeRaw('\n');
    written++;
  }

  private void writeArray(String field, int[] values) throws IOException {
    generator.writeFieldName(field);
    generator.writeArray(values, 0, values.length);
  }

  @Override
  public void flush() throws IOException {
    generator.flush();
  }

  @Override
  public void close() throws IOException {
    generator.flush();
    generator.close();
    if (closeTarget) {
      writer.close();
    }
    log.info("Wrote {} split records to {}", written, destination);
  }
}

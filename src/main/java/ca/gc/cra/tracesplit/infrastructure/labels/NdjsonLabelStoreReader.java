package ca.gc.cra.tracesplit.infrastructure.labels;

import ca.gc.cra.tracesplit.application.port.LabelStoreException;
import ca.gc.cra.tracesplit.application.port.LabelStoreReader;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Reads labels from newline-delimited JSON.
 * <p><strong>Format:</strong> One object per line with {@code class} (int), {@code group} (int), {@code protocol}
 * (string) and {@code region} (string). Blank lines are skipped; other fields are ignored. The n-th non-blank line
 * becomes record index {@code n}.</p>
 * <p><strong>Thread-safety:</strong> Single use.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonLabelStoreReader implements LabelStoreReader {
  private static final JsonFactory JSON = new JsonFactory();

  private final Path path;

  /**
   * Creates a reader for the given file.
   *
   * @param path NDJSON label file
   */
  public NdjsonLabelStoreReader(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public LabelTable read() throws LabelStoreException {
    LabelTable.Builder builder = LabelTable.builder();
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        parseLine(line, lineNumber, builder);
      }
    } catch (NoSuchFileException ex) {
      throw new LabelStoreException("label file not found: " + path, ex);
    } catch (JsonProcessingException ex) {
      throw new LabelStoreException(path + " line " + lineNumber + ": malformed JSON ("
          + ex.getOriginalMessage() + ")", ex);
    } catch (IOException ex) {
      throw new LabelStoreException("failed to read " + path, ex);
    }
    try {
      return builder.build();
    } catch (IllegalArgumentException ex) {
      throw new LabelStoreException(path + ": " + ex.getMessage(), ex);
    }
  }

  private void parseLine(String line, int lineNumber, LabelTable.Builder builder)
      throws IOException, LabelStoreException {
    Integer classId = null;
    Integer group = null;
    String protocol = null;
    String region = null;
    try (JsonParser parser = JSON.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw rowError(lineNumber, "expected a JSON object");
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "class" -> classId = intValue(parser, value, field, lineNumber);
          case "group" -> group = intValue(parser, value, field, lineNumber);
          case "protocol" -> protocol = textValue(parser, value, field, lineNumber);
          case "region" -> region = textValue(parser, value, field, lineNumber);
          default -> parser.skipChildren();
        }
      }
      if (parser.nextToken() != null) {
        throw rowError(lineNumber, "trailing content after the object");
      }
    }
    if (classId == null || group == null || protocol == null || region == null) {
      throw rowError(lineNumber, "missing field; expected class, group, protocol and region");
    }
    try {
      builder.add(classId, group, protocol, region);
    } catch (IllegalArgumentException ex) {
      throw rowError(lineNumber, ex.getMessage());
    }
  }

  private int intValue(JsonParser parser, JsonToken token, String field, int lineNumber)
      throws IOException, LabelStoreException {
    if (token != JsonToken.VALUE_NUMBER_INT) {
      throw rowError(lineNumber, "field '" + field + "' must be an integer");
    }
    if (parser.getNumberType() != JsonParser.NumberType.INT) {
      throw rowError(lineNumber, "field '" + field + "' is out of int range");
    }
    return parser.getIntValue();
  }

  private String textValue(JsonParser parser, JsonToken token, String field, int lineNumber)
      throws IOException, LabelStoreException {
    if (token != JsonToken.VALUE_STRING) {
      throw rowError(lineNumber, "field '" + field + "' must be a string");
    }
    return parser.getText();
  }

  private LabelStoreException rowError(int lineNumber, String message) {
    return new LabelStoreException(path + " line " + lineNumber + ": " + message);
  }

  @Override
  public String describe() {
    return "ndjson:" + path;
  }
}

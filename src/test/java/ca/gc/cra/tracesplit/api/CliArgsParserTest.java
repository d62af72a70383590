package ca.gc.cra.tracesplit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsAndLaterDuplicatesWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "in=labels.h5", " nSplits = 5 ", "nSplits=4", "otelResourceAttributes=service.name=tracesplit"});

    assertEquals("labels.h5", map.get("in"));
    assertEquals("4", map.get("nSplits"));
    assertEquals("service.name=tracesplit", map.get("otelResourceAttributes"));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"labels.h5"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"seed="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"se ed=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a\u0000b"}));
  }
}

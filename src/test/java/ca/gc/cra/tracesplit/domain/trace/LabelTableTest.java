package ca.gc.cra.tracesplit.domain.trace;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LabelTableTest {

  @Test
  void exposesColumnsByIndex() {
    LabelTable table = LabelTable.builder()
        .add(3, 0, "tcp", "toronto")
        .add(-1, -7, "quic", " frankfurt ")
        .build();

    assertEquals(2, table.size());
    assertEquals(3, table.classOf(0));
    assertTrue(table.isMonitored(0));
    assertTrue(table.isTcp(0));
    assertFalse(table.isMonitored(1));
    assertFalse(table.isTcp(1));
    assertEquals(-7, table.groupOf(1));
    assertEquals("frankfurt", table.regionOf(1));
    assertEquals(new TraceRecord(1, -1, -7, TransportProtocol.of("quic"), "frankfurt"), table.record(1));
  }

  @Test
  void selectsIndicesMatchingPredicate() {
    LabelTable table = LabelTable.builder()
        .add(0, 0, "tcp", "r")
        .add(0, 0, "quic", "r")
        .add(-1, -1, "tcp", "r")
        .build();

    assertArrayEquals(new int[] {0, 1, 2}, table.allIndices());
    assertArrayEquals(new int[] {0, 2}, table.select(table::isTcp));
  }

  @Test
  void unmonitoredRowsNeedNegativeGroup() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> LabelTable.builder().add(0, 0, "tcp", "r").add(-1, 4, "tcp", "r").build());
    assertTrue(ex.getMessage().contains("row 1"));
  }

  @Test
  void rejectsClassBelowSentinel() {
    assertThrows(IllegalArgumentException.class,
        () -> LabelTable.of(new int[] {-2}, new int[] {-1}, new String[] {"tcp"}, new String[] {"r"}));
  }

  @Test
  void rejectsColumnsOfDifferentLength() {
    assertThrows(IllegalArgumentException.class,
        () -> LabelTable.of(new int[] {0, 1}, new int[] {0}, new String[] {"tcp"}, new String[] {"r"}));
  }

  @Test
  void builderRejectsInvalidRowWhenAdded() {
    LabelTable.Builder builder = LabelTable.builder().add(0, 0, "tcp", "r");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> builder.add(-1, 2, "quic", "r"));
    assertTrue(ex.getMessage().contains("row 1"));
    assertEquals(1, builder.size());
  }
}

package ca.gc.cra.tracesplit.application.split;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class TraceSelectorTest {
  private final LabelTable table = buildTable();

  @Test
  void disabledSelectorKeepsEverySample() {
    TraceSelector selector = new TraceSelector(0, 0);

    assertFalse(selector.enabled());
    assertArrayEquals(table.allIndices(), selector.select(table, SplitRandom.seeded(1L)));
  }

  @Test
  void keepsOnlyClassesReachingTheBudgetPlusUnmonitored() {
    int[] universe = new TraceSelector(4, 0).select(table, SplitRandom.seeded(1L));

    assertArrayEquals(IndexSets.sorted(universe), universe);
    int[] perClass = new int[3];
    int unmonitored = 0;
    for (int index : universe) {
      if (table.isMonitored(index)) {
        perClass[table.classOf(index)]++;
      } else {
        unmonitored++;
      }
    }
    assertArrayEquals(new int[] {4, 4, 0}, perClass);
    assertEquals(2, unmonitored);
    int tcp = 0;
    for (int index : universe) {
      if (table.isMonitored(index) && table.isTcp(index)) {
        tcp++;
      }
    }
    assertEquals(4, tcp);
  }

  @Test
  void drawsRequestedNumberOfClasses() {
    int[] universe = new TraceSelector(4, 1).select(table, SplitRandom.seeded(5L));

    Set<Integer> classes = new TreeSet<>();
    for (int index : universe) {
      if (table.isMonitored(index)) {
        classes.add(table.classOf(index));
      }
    }
    assertEquals(1, classes.size());
    assertTrue(classes.contains(0) || classes.contains(1));
    assertEquals(6, universe.length);
  }

  @Test
  void moreClassesThanQualifyIsAConfigurationError() {
    SplitConfigurationException ex = assertThrows(SplitConfigurationException.class,
        () -> new TraceSelector(4, 3).select(table, SplitRandom.seeded(1L)));
    assertTrue(ex.getMessage().contains("only 2 of the requested 3 classes"));
  }

  @Test
  void budgetMustDivideAcrossProtocols() {
    assertThrows(SplitConfigurationException.class,
        () -> new TraceSelector(3, 0).select(table, SplitRandom.seeded(1L)));
  }

  @Test
  void classMissingARegionIsDropped() {
    LabelTable.Builder builder = LabelTable.builder();
    for (String region : new String[] {"a", "b", "c"}) {
      builder.add(0, 0, "tcp", region);
      builder.add(0, 0, "quic", region);
    }
    for (String region : new String[] {"a", "b"}) {
      for (int i = 0; i < 2; i++) {
        builder.add(1, 0, "tcp", region);
        builder.add(1, 0, "quic", region);
      }
    }
    LabelTable unbalanced = builder.build();

    int[] universe = new TraceSelector(6, 0).select(unbalanced, SplitRandom.seeded(3L));

    int[] perClass = new int[2];
    for (int index : universe) {
      perClass[unbalanced.classOf(index)]++;
    }
    assertArrayEquals(new int[] {6, 0}, perClass);
  }

  @Test
  void classCountNeedsABudget() {
    assertThrows(SplitConfigurationException.class, () -> new TraceSelector(0, 2));
  }

  private static LabelTable buildTable() {
    LabelTable.Builder builder = LabelTable.builder();
    for (int c = 0; c < 2; c++) {
      for (String region : new String[] {"toronto", "frankfurt"}) {
        for (int i = 0; i < 2; i++) {
          builder.add(c, 0, "tcp", region);
          builder.add(c, 0, "quic", region);
        }
      }
    }
    builder.add(2, 0, "tcp", "toronto");
    builder.add(2, 0, "quic", "toronto");
    builder.add(2, 0, "quic", "toronto");
    builder.add(2, 0, "quic", "frankfurt");
    builder.add(2, 0, "quic", "frankfurt");
    builder.add(-1, -1, "tcp", "toronto");
    builder.add(-1, -1, "quic", "toronto");
    return builder.build();
  }
}

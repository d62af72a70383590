package ca.gc.cra.tracesplit.application.split;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tracesplit.domain.split.Holdout;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.testutil.LabelFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class StratifiedHoldoutTest {

  @Test
  void allocatesProportionallyToEachClass() {
    LabelTable table = LabelFixtures.closedWorld(5, 18);
    int[] tcp = table.select(table::isTcp);

    Holdout holdout = StratifiedHoldout.split(table, tcp, 0.1, SplitRandom.seeded(11L));

    assertEquals(9, holdout.heldOut().length);
    assertEquals(81, holdout.retained().length);
    int[] perClass = new int[5];
    for (int index : holdout.heldOut()) {
      perClass[table.classOf(index)]++;
    }
    for (int count : perClass) {
      assertEquals(true, count == 1 || count == 2, "unbalanced validation class count " + count);
    }
    assertEquals(0, IndexSets.overlap(holdout.retained(), holdout.heldOut()));
  }

  @Test
  void largestRemainderBreaksTiesTowardLowerCodes() {
    List<int[]> members = List.of(new int[3], new int[3], new int[3]);

    assertArrayEquals(new int[] {1, 1, 0}, StratifiedHoldout.allocate(members, 2));
    assertArrayEquals(new int[] {2, 1, 1}, StratifiedHoldout.allocate(members, 4));
  }

  @Test
  void rejectsClassThatCannotKeepASampleOnEachSide() {
    LabelTable table = LabelTable.builder()
        .add(0, 0, "tcp", "r")
        .add(1, 0, "tcp", "r")
        .add(1, 0, "tcp", "r")
        .add(1, 0, "tcp", "r")
        .build();

    assertThrows(SplitConfigurationException.class,
        () -> StratifiedHoldout.split(table, table.allIndices(), 0.5, SplitRandom.seeded(1L)));
  }
}

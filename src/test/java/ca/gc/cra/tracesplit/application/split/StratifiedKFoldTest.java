package ca.gc.cra.tracesplit.application.split;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracesplit.domain.split.Holdout;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.testutil.LabelFixtures;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class StratifiedKFoldTest {

  @Test
  void everySampleIsHeldOutExactlyOncePerRepeat() {
    LabelTable table = LabelFixtures.closedWorld(4, 10);
    int[] universe = table.allIndices();

    List<Holdout> folds = new StratifiedKFold(5, 2)
        .split(StratumEncoder.byClassAndProtocol(table, universe), SplitRandom.seeded(7L));

    assertEquals(10, folds.size());
    for (int repeat = 0; repeat < 2; repeat++) {
      BitSet seen = new BitSet();
      for (int fold = 0; fold < 5; fold++) {
        Holdout holdout = folds.get(repeat * 5 + fold);
        assertEquals(0, IndexSets.overlap(holdout.retained(), holdout.heldOut()));
        assertEquals(universe.length, holdout.retained().length + holdout.heldOut().length);
        for (int index : holdout.heldOut()) {
          assertTrue(!seen.get(index), "index held out twice: " + index);
          seen.set(index);
        }
      }
      assertEquals(universe.length, seen.cardinality());
    }
  }

  @Test
  void eachFoldHoldsAnEqualShareOfEveryStratum() {
    LabelTable table = LabelFixtures.closedWorld(3, 20);
    List<Holdout> folds = new StratifiedKFold(4, 1)
        .split(StratumEncoder.byClassAndProtocol(table, table.allIndices()), SplitRandom.seeded(1L));

    for (Holdout fold : folds) {
      int[] perStratum = new int[6];
      for (int index : fold.heldOut()) {
        perStratum[table.classOf(index) * 2 + (table.isTcp(index) ? 1 : 0)]++;
      }
      assertArrayEquals(new int[] {5, 5, 5, 5, 5, 5}, perStratum);
    }
  }

  @Test
  void rejectsStratumSmallerThanFoldCount() {
    LabelTable table = LabelFixtures.closedWorld(2, 3);

    SplitConfigurationException ex = assertThrows(SplitConfigurationException.class,
        () -> new StratifiedKFold(4, 1)
            .split(StratumEncoder.byClassAndProtocol(table, table.allIndices()), SplitRandom.seeded(1L)));
    assertTrue(ex.getMessage().contains("has 3 samples"));
  }

  @Test
  void sameSeedGivesSameFolds() {
    LabelTable table = LabelFixtures.closedWorld(3, 10);
    List<Holdout> first = new StratifiedKFold(5, 1)
        .split(StratumEncoder.byClassAndProtocol(table, table.allIndices()), SplitRandom.seeded(42L));
    List<Holdout> second = new StratifiedKFold(5, 1)
        .split(StratumEncoder.byClassAndProtocol(table, table.allIndices()), SplitRandom.seeded(42L));

    assertEquals(first, second);
  }
}

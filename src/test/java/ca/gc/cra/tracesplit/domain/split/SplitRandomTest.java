package ca.gc.cra.tracesplit.domain.split;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SplitRandomTest {

  @Test
  void sameSeedGivesSameSequence() {
    SplitRandom a = SplitRandom.seeded(16248L);
    SplitRandom b = SplitRandom.seeded(16248L);

    assertArrayEquals(a.permutation(50), b.permutation(50));
    assertArrayEquals(a.fork().permutation(50), b.fork().permutation(50));
  }

  @Test
  void forksAreIndependentOfEachOther() {
    SplitRandom root = SplitRandom.seeded(1L);
    int[] first = root.fork().permutation(100);
    int[] second = root.fork().permutation(100);

    assertFalse(Arrays.equals(first, second));
  }

  @Test
  void permutationContainsEveryIndexOnce() {
    int[] permutation = SplitRandom.seeded(3L).permutation(64);

    int[] sorted = permutation.clone();
    Arrays.sort(sorted);
    for (int i = 0; i < sorted.length; i++) {
      assertEquals(i, sorted[i]);
    }
  }

  @Test
  void chooseDrawsDistinctMembersWithoutTouchingPool() {
    int[] pool = {10, 20, 30, 40, 50};
    int[] drawn = SplitRandom.seeded(9L).choose(pool, 3);

    assertEquals(3, drawn.length);
    assertTrue(IndexSets.distinct(drawn));
    assertEquals(3, IndexSets.overlap(pool, drawn));
    assertArrayEquals(new int[] {10, 20, 30, 40, 50}, pool);
  }

  @Test
  void chooseRejectsOversizedDraw() {
    assertThrows(IllegalArgumentException.class, () -> SplitRandom.seeded(0L).choose(new int[] {1}, 2));
  }
}

package ca.gc.cra.tracesplit.application.split;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.Split;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.SplitRecord;
import org.junit.jupiter.api.Test;

class SplitAssemblerTest {

  @Test
  void concatenatesSameNamedPartitionsAndBuildsTrainValidation() {
    Split monitored = new Split(new int[] {1, 2, 3}, new int[] {4}, new int[] {5, 6});
    Split unmonitored = new Split(new int[] {10, 11}, new int[] {12}, new int[] {13});

    SplitRecord record = new SplitAssembler().assemble(3, monitored, unmonitored, SplitRandom.seeded(8L));

    assertEquals(3, record.repetition());
    assertArrayEquals(new int[] {1, 2, 3, 10, 11}, IndexSets.sorted(record.train()));
    assertArrayEquals(new int[] {4, 12}, IndexSets.sorted(record.validation()));
    assertArrayEquals(new int[] {5, 6, 13}, IndexSets.sorted(record.test()));
    assertArrayEquals(new int[] {1, 2, 3, 4, 10, 11, 12}, IndexSets.sorted(record.trainValidation()));
  }

  @Test
  void sameSeedGivesSameOrder() {
    Split monitored = new Split(new int[] {1, 2, 3, 7, 8, 9}, new int[] {4}, new int[] {5, 6});

    SplitRecord first = new SplitAssembler().assemble(0, monitored, Split.empty(), SplitRandom.seeded(8L));
    SplitRecord second = new SplitAssembler().assemble(0, monitored, Split.empty(), SplitRandom.seeded(8L));

    assertEquals(first, second);
  }
}

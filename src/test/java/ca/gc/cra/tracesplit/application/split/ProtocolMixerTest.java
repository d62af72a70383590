package ca.gc.cra.tracesplit.application.split;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.testutil.LabelFixtures;
import org.junit.jupiter.api.Test;

class ProtocolMixerTest {
  private final ProtocolMixer mixer = new ProtocolMixer();
  private final LabelTable table = LabelFixtures.closedWorld(4, 10);

  @Test
  void zeroQuicFractionKeepsOnlyTcp() {
    int[] mixed = mixer.mix(table, table.allIndices(), 0.0, SplitRandom.seeded(1L));

    assertArrayEquals(table.select(table::isTcp), IndexSets.sorted(mixed));
  }

  @Test
  void fullQuicFractionKeepsOnlyQuic() {
    int[] mixed = mixer.mix(table, table.allIndices(), 1.0, SplitRandom.seeded(1L));

    assertArrayEquals(table.select(index -> !table.isTcp(index)), IndexSets.sorted(mixed));
  }

  @Test
  void halfFractionBalancesEveryClass() {
    int[] mixed = mixer.mix(table, table.allIndices(), 0.5, SplitRandom.seeded(3L));

    assertEquals(40, mixed.length);
    int[][] perClass = new int[4][2];
    for (int index : mixed) {
      perClass[table.classOf(index)][table.isTcp(index) ? 0 : 1]++;
    }
    for (int[] counts : perClass) {
      assertArrayEquals(new int[] {5, 5}, counts);
    }
  }

  @Test
  void singleSampleGroupsKeepTheirSampleAtOneHalf() {
    LabelTable tiny = LabelTable.builder().add(0, 0, "tcp", "r").add(0, 0, "quic", "r").build();

    assertEquals(2, mixer.mix(tiny, tiny.allIndices(), 0.5, SplitRandom.seeded(1L)).length);
  }

  @Test
  void rejectsFractionOutsideUnitInterval() {
    assertThrows(SplitConfigurationException.class,
        () -> mixer.mix(table, table.allIndices(), -0.1, SplitRandom.seeded(1L)));
  }
}

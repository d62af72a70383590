package ca.gc.cra.tracesplit.domain.split;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.tracesplit.domain.split.StratumEncoder.Strata;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder.StratumKey;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.domain.trace.TransportProtocol;
import java.util.List;
import org.junit.jupiter.api.Test;

class StratumEncoderTest {
  private final LabelTable table = LabelTable.builder()
      .add(2, 0, "tcp", "r")
      .add(0, 0, "quic", "r")
      .add(2, 0, "quic", "r")
      .add(0, 0, "tcp", "r")
      .add(2, 0, "tcp", "r")
      .build();

  @Test
  void codesFollowSortedClassThenProtocol() {
    Strata strata = StratumEncoder.byClassAndProtocol(table, table.allIndices());

    assertEquals(4, strata.count());
    assertEquals(List.of(
        new StratumKey(0, TransportProtocol.of("quic")),
        new StratumKey(0, TransportProtocol.TCP),
        new StratumKey(2, TransportProtocol.of("quic")),
        new StratumKey(2, TransportProtocol.TCP)), strata.keys());
    assertArrayEquals(new int[] {3, 0, 2, 1, 3}, strata.codes());
  }

  @Test
  void codesDoNotDependOnRowOrder() {
    Strata forward = StratumEncoder.byClassAndProtocol(table, new int[] {0, 1, 2, 3, 4});
    Strata reversed = StratumEncoder.byClassAndProtocol(table, new int[] {4, 3, 2, 1, 0});

    assertEquals(forward.keys(), reversed.keys());
    assertArrayEquals(new int[] {3, 1, 2, 0, 3}, reversed.codes());
  }

  @Test
  void byClassGroupsMembers() {
    Strata strata = StratumEncoder.byClass(table, table.allIndices());

    assertEquals(2, strata.count());
    assertArrayEquals(new int[] {1, 3}, strata.members().get(0));
    assertArrayEquals(new int[] {0, 2, 4}, strata.members().get(1));
  }

  @Test
  void membersDecodeThroughKey() {
    Strata strata = StratumEncoder.byClassAndProtocol(table, table.allIndices());
    List<int[]> members = strata.members();

    assertEquals(new StratumKey(2, TransportProtocol.TCP), strata.key(3));
    assertArrayEquals(new int[] {0, 4}, members.get(3));
    assertArrayEquals(new int[] {1}, members.get(0));
  }
}

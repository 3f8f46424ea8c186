package DFAMin;

import DFAMin.Model.StateId;
import DFAMin.Model.StatePair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class PairTableTest {
  @Test
  void testIndexing() {
    PairTable table = new PairTable(List.of(StateId.of("C"), StateId.of("A"), StateId.of("B")));
    Assertions.assertEquals(List.of(StateId.of("A"), StateId.of("B"), StateId.of("C")), table.getStates());
    Assertions.assertEquals(0, table.indexOf(StateId.of("A")));
    Assertions.assertEquals(2, table.indexOf(StateId.of("C")));
    Assertions.assertEquals(PairTable.MISSING_ELEMENT, table.indexOf(StateId.of("Z")));
    Assertions.assertEquals(3, table.pairCount());

    // every pair gets its own bit
    Assertions.assertEquals(0, PairTable.position(0, 1));
    Assertions.assertEquals(1, PairTable.position(0, 2));
    Assertions.assertEquals(2, PairTable.position(1, 2));
    Assertions.assertEquals(PairTable.position(2, 1), PairTable.position(1, 2));
  }

  @Test
  void testMarking() {
    PairTable table = new PairTable(List.of(StateId.of("A"), StateId.of("B"), StateId.of("C")));
    Assertions.assertEquals(0, table.markedCount());
    Assertions.assertTrue(table.mark(2, 0));
    Assertions.assertFalse(table.mark(0, 2)); // already marked
    Assertions.assertTrue(table.isMarked(0, 2));
    Assertions.assertTrue(table.isMarked(StateId.of("C"), StateId.of("A")));
    Assertions.assertFalse(table.isMarked(0, 1));
    Assertions.assertFalse(table.isMarked(1, 1));
    Assertions.assertEquals(1, table.markedCount());

    Assertions.assertEquals(List.of(StatePair.of(StateId.of("A"), StateId.of("C"))), List.copyOf(table.markedPairs()));
    Assertions.assertEquals(List.of(
        StatePair.of(StateId.of("A"), StateId.of("B")),
        StatePair.of(StateId.of("B"), StateId.of("C"))), List.copyOf(table.unmarkedPairs()));

    assertThrows(IllegalArgumentException.class, () -> table.mark(1, 1));
    assertThrows(IllegalArgumentException.class, () -> table.isMarked(StateId.of("A"), StateId.of("Z")));
  }

  @Test
  void testSingleState() {
    PairTable table = new PairTable(List.of(StateId.of("A")));
    Assertions.assertEquals(0, table.pairCount());
    Assertions.assertTrue(table.markedPairs().isEmpty());
    Assertions.assertTrue(table.unmarkedPairs().isEmpty());
  }
}

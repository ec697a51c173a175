package MTBridge.Symbolic;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SharedBddManagerTest {
  @Test
  void testFindIsCanonical() {
    SharedBddManager manager = new SharedBddManager();
    int zero = manager.findLeaf(0);
    int one = manager.findLeaf(1);
    Assertions.assertEquals(zero, manager.findLeaf(0));

    int node = manager.findNode(zero, one, 1);
    Assertions.assertEquals(node, manager.findNode(zero, one, 1));
    Assertions.assertEquals(3, manager.size());

    // redundant test is not stored
    Assertions.assertEquals(one, manager.findNode(one, one, 0));
    Assertions.assertEquals(3, manager.size());

    Assertions.assertTrue(manager.isLeaf(one));
    Assertions.assertFalse(manager.isLeaf(node));
    Assertions.assertEquals(1, manager.leafValue(one));
    Assertions.assertEquals(1, manager.varIndex(node));
    Assertions.assertEquals(zero, manager.low(node));
    Assertions.assertEquals(one, manager.high(node));
    Assertions.assertThrows(IllegalArgumentException.class, () -> manager.leafValue(node));
  }

  @Test
  void testVariableOrder() {
    SharedBddManager manager = new SharedBddManager();
    int zero = manager.findLeaf(0);
    int one = manager.findLeaf(1);
    int node = manager.findNode(zero, one, 1);
    Assertions.assertThrows(IllegalArgumentException.class, () -> manager.findNode(node, zero, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> manager.findNode(zero, node, 2));
    Assertions.assertThrows(IllegalArgumentException.class, () -> manager.findNode(zero, 17, 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> manager.findLeaf(-1));
  }

  @Test
  void testExportMarksReachableNodes() {
    SharedBddManager manager = new SharedBddManager();
    int zero = manager.findLeaf(0);
    int one = manager.findLeaf(1);
    int unused = manager.findLeaf(2);
    int inner = manager.findNode(zero, one, 1);
    int root = manager.findNode(inner, one, 0);

    ExportedTable table = manager.export(new int[] {root, one});
    Assertions.assertEquals(4, table.size());
    Assertions.assertEquals(0, table.rootPositions()[0]);

    int onePosition = table.rootPositions()[1];
    Assertions.assertTrue(table.isLeaf(onePosition));
    Assertions.assertEquals(1, table.value()[onePosition]);
    Assertions.assertEquals(onePosition, table.high()[0]);

    int innerPosition = table.low()[0];
    Assertions.assertEquals(1, table.varIndex()[innerPosition]);
    Assertions.assertEquals(onePosition, table.high()[innerPosition]);
    for (int position = 0; position < table.size(); position++) {
      Assertions.assertNotEquals(2, table.value()[position]);
    }
    Assertions.assertTrue(manager.isLeaf(unused));
    Assertions.assertEquals(5, manager.size()); // export allocates nothing
  }
}

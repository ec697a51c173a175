package MTBridge.Diagram;

import java.util.ArrayList;
import java.util.List;

import MTBridge.Symbolic.SharedBddManager;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class MtRobddTest {

  private static MtRobdd twoStateDiagram() {
    MtRobdd diagram = new MtRobdd(2);
    diagram.insertPath(0, BitVector.of(0, 0), 1);
    diagram.insertPath(0, BitVector.of(0, 1), 1);
    diagram.insertPath(0, BitVector.of(1, 0), 0);
    diagram.insertPath(1, BitVector.of(1, 1), 1);
    return diagram;
  }

  private static void assertComplete(MtRobdd diagram) {
    for (BddNode node : diagram.nodes()) {
      if (node.isInner()) {
        Assertions.assertTrue(node.hasLow() && node.hasHigh(), "incomplete node " + node);
      }
    }
  }

  @Test
  void testUsageErrors() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new MtRobdd(0));
    MtRobdd diagram = new MtRobdd(2);
    Assertions.assertThrows(IllegalArgumentException.class, () -> diagram.insertPath(0, BitVector.empty(), 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> diagram.insertPath(0, BitVector.of(0, 1, 1), 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> diagram.insertPath(0, BitVector.of(0, 1), -3));
    Assertions.assertEquals(0, diagram.numOfRoots());
  }

  @Test
  void testAbsentRoot() {
    MtRobdd diagram = twoStateDiagram();
    Assertions.assertTrue(diagram.getAllBitStringsFromRoot(7).isEmpty());
    Assertions.assertNull(diagram.rootNode(7));
    Assertions.assertFalse(diagram.hasRoot(7));
    Assertions.assertTrue(diagram.hasRoot(1));
  }

  @Test
  void testDontCareExpansion() {
    MtRobdd diagram = new MtRobdd(3);
    diagram.insertPath(1, BitVector.of(0, 0, 0), 5);
    diagram.insertPath(1, BitVector.of(0, 0, 1), 5);
    diagram.insertPath(1, BitVector.of(0, 1, 0), 5);
    diagram.insertPath(1, BitVector.of(0, 1, 1), 5);
    diagram.trim().removeRedundantTests();

    // x0 with a low edge straight to the terminal
    Assertions.assertEquals(2, diagram.numOfNodes());
    BddNode root = diagram.rootNode(1);
    Assertions.assertEquals(0, root.varIndex());
    Assertions.assertFalse(root.hasHigh());
    Assertions.assertTrue(diagram.node(root.low()).isTerminal());

    List<Path> expected = List.of(
        new Path(BitVector.of(0, 0, 0), 5),
        new Path(BitVector.of(0, 0, 1), 5),
        new Path(BitVector.of(0, 1, 0), 5),
        new Path(BitVector.of(0, 1, 1), 5));
    Assertions.assertEquals(expected, diagram.getAllBitStringsFromRoot(1));
  }

  @Test
  void testTerminalRoot() {
    MtRobdd diagram = new MtRobdd(2);
    for (int i = 0; i < 4; i++) {
      diagram.insertPath(0, BitVector.fromLong(i, 2), 3);
    }
    diagram.removeRedundantTests();
    Assertions.assertTrue(diagram.rootNode(0).isTerminal());

    List<Path> paths = diagram.getAllBitStringsFromRoot(0);
    Assertions.assertEquals(4, paths.size());
    for (int i = 0; i < 4; i++) {
      Assertions.assertEquals(new Path(BitVector.fromLong(i, 2), 3), paths.get(i));
    }
  }

  @Test
  void testReplaceAndTrim() {
    MtRobdd diagram = new MtRobdd(2);
    diagram.insertPath(0, BitVector.of(0, 0), 1);
    diagram.insertPath(0, BitVector.of(0, 0), 2);
    Assertions.assertEquals(6, diagram.numOfNodes());

    diagram.trim();
    Assertions.assertEquals(3, diagram.numOfNodes());
    Assertions.assertEquals(List.of(new Path(BitVector.of(0, 0), 2)), diagram.getAllBitStringsFromRoot(0));

    diagram.trim();
    Assertions.assertEquals(3, diagram.numOfNodes());
  }

  @Test
  void testReductionIdempotent() {
    MtRobdd diagram = twoStateDiagram().trim().removeRedundantTests();
    int nodes = diagram.numOfNodes();
    List<Path> root0 = diagram.getAllBitStringsFromRoot(0);

    diagram.removeRedundantTests();
    Assertions.assertEquals(nodes, diagram.numOfNodes());
    Assertions.assertEquals(root0, diagram.getAllBitStringsFromRoot(0));
    for (BddNode node : diagram.nodes()) {
      if (node.isInner()) {
        Assertions.assertFalse(node.hasLow() && node.low() == node.high());
      }
    }
  }

  @Test
  void testInsertIntoReducedDiagram() {
    MtRobdd diagram = new MtRobdd(2);
    diagram.insertPath(0, BitVector.of(0, 0), 1);
    diagram.insertPath(0, BitVector.of(0, 1), 1);
    diagram.removeRedundantTests();

    diagram.insertPath(0, BitVector.of(0, 1), 2);
    Assertions.assertEquals(
        List.of(new Path(BitVector.of(0, 0), 1), new Path(BitVector.of(0, 1), 2)),
        diagram.getAllBitStringsFromRoot(0));
  }

  @Test
  void testInsertionOrderIrrelevant() {
    List<BitVector> codes = List.of(BitVector.of(1, 1, 0), BitVector.of(0, 0, 1), BitVector.of(0, 1, 1),
        BitVector.of(1, 0, 0), BitVector.of(0, 0, 0));

    MtRobdd forward = new MtRobdd(3);
    for (int i = 0; i < codes.size(); i++) {
      forward.insertPath(0, codes.get(i), i % 2);
    }
    MtRobdd backward = new MtRobdd(3);
    for (int i = codes.size() - 1; i >= 0; i--) {
      backward.insertPath(0, codes.get(i), i % 2);
    }

    forward.trim().removeRedundantTests();
    backward.trim().removeRedundantTests();
    Assertions.assertEquals(forward.numOfNodes(), backward.numOfNodes());
    Assertions.assertEquals(forward.getAllBitStringsFromRoot(0), backward.getAllBitStringsFromRoot(0));
  }

  @Test
  void testMakeComplete() {
    MtRobdd diagram = twoStateDiagram().trim().removeRedundantTests().makeComplete(2);
    assertComplete(diagram);
    Assertions.assertEquals(List.of(0, 1, 2), new ArrayList<>(diagram.rootNames()));

    Assertions.assertEquals(List.of(
        new Path(BitVector.of(0, 0), 2),
        new Path(BitVector.of(0, 1), 2),
        new Path(BitVector.of(1, 0), 2),
        new Path(BitVector.of(1, 1), 1)), diagram.getAllBitStringsFromRoot(1));
    Assertions.assertEquals(List.of(
        new Path(BitVector.of(0, 0), 1),
        new Path(BitVector.of(0, 1), 1),
        new Path(BitVector.of(1, 0), 0),
        new Path(BitVector.of(1, 1), 2)), diagram.getAllBitStringsFromRoot(0));
    Assertions.assertTrue(diagram.rootNode(2).isTerminal());
    Assertions.assertEquals(4, diagram.getAllBitStringsFromRoot(2).size());
  }

  @Test
  void testCompleteTerminalNodes() {
    MtRobdd withTerminals = new MtRobdd(1);
    withTerminals.insertPath(0, BitVector.of(0), 5);
    withTerminals.makeComplete(6, true);
    Assertions.assertEquals(List.of(0, 5, 6), new ArrayList<>(withTerminals.rootNames()));
    Assertions.assertEquals(withTerminals.rootNode(6), withTerminals.rootNode(5));

    MtRobdd withoutTerminals = new MtRobdd(1);
    withoutTerminals.insertPath(0, BitVector.of(0), 5);
    withoutTerminals.makeComplete(6, false);
    Assertions.assertEquals(List.of(0, 6), new ArrayList<>(withoutTerminals.rootNames()));

    MtRobdd required = new MtRobdd(1);
    required.insertPath(0, BitVector.of(0), 1);
    required.makeComplete(6, false, 3);
    Assertions.assertEquals(List.of(0, 1, 2, 6), new ArrayList<>(required.rootNames()));
  }

  @Test
  void testUnusedSink() {
    MtRobdd diagram = new MtRobdd(1);
    diagram.insertPath(0, BitVector.of(0), 0);
    diagram.insertPath(0, BitVector.of(1), 0);
    diagram.removeRedundantTests().makeComplete(1);
    Assertions.assertEquals(1, diagram.numOfRoots());
    Assertions.assertEquals(1, diagram.numOfNodes());
  }

  @Test
  void testSinkCollidesWithRoot() {
    MtRobdd diagram = new MtRobdd(1);
    diagram.insertPath(0, BitVector.of(0), 0);
    diagram.insertPath(0, BitVector.of(1), 1);
    Assertions.assertThrows(IllegalArgumentException.class, () -> diagram.makeComplete(0));
  }

  @Test
  void testExportImport() {
    MtRobdd diagram = twoStateDiagram().trim().removeRedundantTests().makeComplete(2);
    SharedBddManager manager = new SharedBddManager();
    int[] behaviours = diagram.exportTo(manager);
    Assertions.assertEquals(3, behaviours.length);

    MtRobdd imported = MtRobdd.fromSymbolic(2, manager, behaviours);
    Assertions.assertEquals(diagram.rootNames(), imported.rootNames());
    Assertions.assertEquals(diagram.numOfNodes(), imported.numOfNodes());
    for (int root = 0; root < 3; root++) {
      Assertions.assertEquals(diagram.getAllBitStringsFromRoot(root), imported.getAllBitStringsFromRoot(root));
    }
  }

  @Test
  void testExportPreconditions() {
    MtRobdd incomplete = new MtRobdd(2);
    incomplete.insertPath(0, BitVector.of(0, 0), 0);
    Assertions.assertThrows(IllegalStateException.class, () -> incomplete.exportTo(new SharedBddManager()));

    MtRobdd gap = new MtRobdd(1);
    gap.insertPath(0, BitVector.of(0), 0);
    gap.insertPath(0, BitVector.of(1), 0);
    gap.insertPath(2, BitVector.of(0), 0);
    gap.insertPath(2, BitVector.of(1), 0);
    Assertions.assertThrows(IllegalStateException.class, () -> gap.exportTo(new SharedBddManager()));
  }

  @Test
  void testDot() {
    MtRobdd diagram = twoStateDiagram().trim().removeRedundantTests().makeComplete(2);
    String dot = diagram.toDot();
    Assertions.assertTrue(dot.startsWith("digraph MtRobdd {"));
    Assertions.assertTrue(dot.contains("r2 [label=\"sink\"]"));
    Assertions.assertTrue(dot.contains("[label=\"x1\"]"));
    Assertions.assertTrue(dot.contains("[label=\"1\"];"));
    Assertions.assertTrue(dot.contains("r0 -> n"));
    Assertions.assertTrue(dot.trim().endsWith("}"));
  }
}

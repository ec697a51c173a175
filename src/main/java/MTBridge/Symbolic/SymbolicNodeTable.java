package MTBridge.Symbolic;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Node manager of a symbolic (shared multi-terminal BDD) automaton engine.
 * Pointers are non-negative ints; a leaf stores its value, an inner node a variable index and two children.
 */
public interface SymbolicNodeTable {
    int LEAF_INDEX = -1;

    /**
     * Find or create the leaf carrying value.
     */
    int findLeaf(int value);

    /**
     * Find or create the inner node (varIndex, low, high).
     * Tests with equal children are not stored: the shared child is returned instead.
     */
    int findNode(int low, int high, int varIndex);

    int varIndex(int pointer);

    int low(int pointer);

    int high(int pointer);

    int leafValue(int pointer);

    /**
     * @return number of allocated nodes
     */
    int size();

    default boolean isLeaf(int pointer) {
        return varIndex(pointer) == LEAF_INDEX;
    }

    /**
     * Mark every node reachable from roots with a sequential position and return the
     * positioned table, children rewritten as positions.
     * @param roots behaviour pointers, one per state
     * @return table of all reachable nodes, and the position of each root
     */
    default ExportedTable export(int[] roots) {
        final int[] mark = new int[size()];
        Arrays.fill(mark, -1);
        final IntArrayList order = new IntArrayList();
        final IntArrayList stack = new IntArrayList();

        for (int root : roots) {
            if (mark[root] < 0) {
                mark[root] = order.size();
                order.add(root);
                stack.push(root);
            }
            while (!stack.isEmpty()) {
                final int pointer = stack.popInt();
                if (isLeaf(pointer)) {
                    continue;
                }
                for (int child : new int[] {low(pointer), high(pointer)}) {
                    if (mark[child] < 0) {
                        mark[child] = order.size();
                        order.add(child);
                        stack.push(child);
                    }
                }
            }
        }

        final int count = order.size();
        final int[] varIndex = new int[count];
        final int[] low = new int[count];
        final int[] high = new int[count];
        final int[] value = new int[count];
        for (int position = 0; position < count; position++) {
            final int pointer = order.getInt(position);
            varIndex[position] = varIndex(pointer);
            if (isLeaf(pointer)) {
                low[position] = -1;
                high[position] = -1;
                value[position] = leafValue(pointer);
            } else {
                low[position] = mark[low(pointer)];
                high[position] = mark[high(pointer)];
                value[position] = -1;
            }
        }

        final int[] rootPositions = new int[roots.length];
        for (int i = 0; i < roots.length; i++) {
            rootPositions[i] = mark[roots[i]];
        }
        return new ExportedTable(varIndex, low, high, value, rootPositions);
    }
}

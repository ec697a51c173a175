package MTBridge.Symbolic;

/**
 * Position-indexed node table produced by {@link SymbolicNodeTable#export(int[])}.
 * For a leaf at position p, varIndex[p] is LEAF_INDEX, value[p] its value and low/high are -1;
 * for an inner node, low/high are positions and value is -1.
 */
public record ExportedTable(int[] varIndex, int[] low, int[] high, int[] value, int[] rootPositions) {

    public int size() {
        return varIndex.length;
    }

    public boolean isLeaf(int position) {
        return varIndex[position] == SymbolicNodeTable.LEAF_INDEX;
    }
}

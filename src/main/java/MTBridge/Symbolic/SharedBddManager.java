package MTBridge.Symbolic;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * In-memory node manager shared by the behaviours of all states of a {@link SymbolicDFA}.
 */
public class SharedBddManager implements SymbolicNodeTable {
    private static final int MISSING = -1;

    private final IntList varIndices;
    private final IntList lows;
    private final IntList highs;
    private final IntList leafValues;
    private final Object2IntMap<Entry> unique;

    public SharedBddManager() {
        this.varIndices = new IntArrayList();
        this.lows = new IntArrayList();
        this.highs = new IntArrayList();
        this.leafValues = new IntArrayList();
        this.unique = new Object2IntOpenHashMap<>();
        this.unique.defaultReturnValue(MISSING);
    }

    @Override
    public int findLeaf(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Invalid leaf value: " + value);
        }
        return findOrAdd(new Entry(LEAF_INDEX, MISSING, MISSING, value));
    }

    @Override
    public int findNode(int low, int high, int varIndex) {
        if (varIndex < 0) {
            throw new IllegalArgumentException("Invalid variable index: " + varIndex);
        }
        checkChild(low, varIndex);
        checkChild(high, varIndex);
        if (low == high) {
            return low;
        }
        return findOrAdd(new Entry(varIndex, low, high, MISSING));
    }

    private void checkChild(int child, int varIndex) {
        checkPointer(child);
        final int childIndex = varIndices.getInt(child);
        if (childIndex != LEAF_INDEX && childIndex <= varIndex) {
            throw new IllegalArgumentException(
                "Variable order violated: node on x" + varIndex + " above node on x" + childIndex);
        }
    }

    private int findOrAdd(Entry entry) {
        int pointer = unique.getInt(entry);
        if (pointer == MISSING) {
            pointer = varIndices.size();
            varIndices.add(entry.varIndex());
            lows.add(entry.low());
            highs.add(entry.high());
            leafValues.add(entry.value());
            unique.put(entry, pointer);
        }
        return pointer;
    }

    @Override
    public int varIndex(int pointer) {
        checkPointer(pointer);
        return varIndices.getInt(pointer);
    }

    @Override
    public int low(int pointer) {
        checkPointer(pointer);
        return lows.getInt(pointer);
    }

    @Override
    public int high(int pointer) {
        checkPointer(pointer);
        return highs.getInt(pointer);
    }

    @Override
    public int leafValue(int pointer) {
        checkPointer(pointer);
        if (varIndices.getInt(pointer) != LEAF_INDEX) {
            throw new IllegalArgumentException("Not a leaf: " + pointer);
        }
        return leafValues.getInt(pointer);
    }

    @Override
    public int size() {
        return varIndices.size();
    }

    private void checkPointer(int pointer) {
        if (pointer < 0 || pointer >= varIndices.size()) {
            throw new IllegalArgumentException("Unknown node pointer: " + pointer);
        }
    }

    private record Entry(int varIndex, int low, int high, int value) { }
}

package MTBridge.Diagram;

import java.util.BitSet;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Arena of decision diagram nodes addressed by integer handles, hash-consed on
 * (variable index, low handle, high handle, value).
 */
public class NodeStore {
    public static final int NO_NODE = -1;
    public static final int TERMINAL_INDEX = -1;
    public static final int NO_VALUE = -1;

    private IntArrayList varIndices;
    private IntArrayList lows;
    private IntArrayList highs;
    private IntArrayList values;
    private Object2IntMap<NodeKey> unique;

    public NodeStore() {
        this.varIndices = new IntArrayList();
        this.lows = new IntArrayList();
        this.highs = new IntArrayList();
        this.values = new IntArrayList();
        this.unique = newUniqueTable();
    }

    private static Object2IntMap<NodeKey> newUniqueTable() {
        final Object2IntMap<NodeKey> table = new Object2IntOpenHashMap<>();
        table.defaultReturnValue(NO_NODE); // if missing, return NO_NODE
        return table;
    }

    /**
     * Get the canonical node for the given tuple, creating it if necessary.
     * @param varIndex variable tested by the node, or TERMINAL_INDEX
     * @param low child for bit 0 (NO_NODE if absent)
     * @param high child for bit 1 (NO_NODE if absent)
     * @param value terminal value, NO_VALUE for inner nodes
     * @return handle of the unique node with these fields
     */
    public int createNode(int varIndex, int low, int high, int value) {
        checkTuple(varIndex, low, high, value);
        final NodeKey key = new NodeKey(varIndex, low, high, value);
        int node = unique.getInt(key);
        if (node == NO_NODE) {
            node = append(varIndex, low, high, value);
            unique.put(key, node);
        }
        return node;
    }

    public int createTerminalNode(int value) {
        return createNode(TERMINAL_INDEX, NO_NODE, NO_NODE, value);
    }

    /**
     * Allocate an unregistered placeholder to be completed by {@link #fill}.
     * Allows building graphs whose children are not known yet.
     */
    public int reserve(int varIndex) {
        if (varIndex < TERMINAL_INDEX) {
            throw new IllegalArgumentException("Invalid variable index: " + varIndex);
        }
        return append(varIndex, NO_NODE, NO_NODE, NO_VALUE);
    }

    /**
     * Set the fields of a placeholder and register it.
     */
    public void fill(int node, int low, int high, int value) {
        checkHandle(node);
        final int varIndex = varIndices.getInt(node);
        checkTuple(varIndex, low, high, value);
        final NodeKey key = new NodeKey(varIndex, low, high, value);
        final int existing = unique.getInt(key);
        if (existing != NO_NODE && existing != node) {
            throw new IllegalStateException("Node " + node + " duplicates node " + existing);
        }
        lows.set(node, low);
        highs.set(node, high);
        values.set(node, value);
        unique.put(key, node);
    }

    /**
     * Replace the store by the live nodes only. Children of live nodes must be live.
     * @param live handles to keep
     * @return mapping from old handles to new handles (NO_NODE for dropped nodes)
     */
    public int[] retain(BitSet live) {
        final int oldSize = size();
        final int[] remap = new int[oldSize];
        int next = 0;
        for (int node = 0; node < oldSize; node++) {
            remap[node] = live.get(node) ? next++ : NO_NODE;
        }

        final IntArrayList newVarIndices = new IntArrayList(next);
        final IntArrayList newLows = new IntArrayList(next);
        final IntArrayList newHighs = new IntArrayList(next);
        final IntArrayList newValues = new IntArrayList(next);
        final Object2IntMap<NodeKey> newUnique = newUniqueTable();

        for (int node = live.nextSetBit(0); node >= 0 && node < oldSize; node = live.nextSetBit(node + 1)) {
            final int low = remapChild(remap, lows.getInt(node));
            final int high = remapChild(remap, highs.getInt(node));
            newVarIndices.add(varIndices.getInt(node));
            newLows.add(low);
            newHighs.add(high);
            newValues.add(values.getInt(node));
            newUnique.put(new NodeKey(varIndices.getInt(node), low, high, values.getInt(node)), remap[node]);
        }

        this.varIndices = newVarIndices;
        this.lows = newLows;
        this.highs = newHighs;
        this.values = newValues;
        this.unique = newUnique;
        return remap;
    }

    private static int remapChild(int[] remap, int child) {
        if (child == NO_NODE) {
            return NO_NODE;
        }
        assert remap[child] != NO_NODE : "live node with dropped child " + child;
        return remap[child];
    }

    public int size() {
        return varIndices.size();
    }

    public int varIndex(int node) {
        checkHandle(node);
        return varIndices.getInt(node);
    }

    public int low(int node) {
        checkHandle(node);
        return lows.getInt(node);
    }

    public int high(int node) {
        checkHandle(node);
        return highs.getInt(node);
    }

    public int value(int node) {
        checkHandle(node);
        return values.getInt(node);
    }

    public boolean isTerminal(int node) {
        return varIndex(node) == TERMINAL_INDEX;
    }

    public BddNode view(int node) {
        checkHandle(node);
        return new BddNode(node, varIndices.getInt(node), lows.getInt(node), highs.getInt(node), values.getInt(node));
    }

    private int append(int varIndex, int low, int high, int value) {
        final int node = varIndices.size();
        varIndices.add(varIndex);
        lows.add(low);
        highs.add(high);
        values.add(value);
        return node;
    }

    private void checkTuple(int varIndex, int low, int high, int value) {
        if (varIndex == TERMINAL_INDEX) {
            if (low != NO_NODE || high != NO_NODE) {
                throw new IllegalArgumentException("Terminal nodes have no children");
            }
            if (value < 0) {
                throw new IllegalArgumentException("Invalid terminal value: " + value);
            }
        } else if (varIndex < 0) {
            throw new IllegalArgumentException("Invalid variable index: " + varIndex);
        } else {
            if (value != NO_VALUE) {
                throw new IllegalArgumentException("Inner nodes carry no value");
            }
            if (low != NO_NODE) {
                checkHandle(low);
            }
            if (high != NO_NODE) {
                checkHandle(high);
            }
        }
    }

    private void checkHandle(int node) {
        if (node < 0 || node >= varIndices.size()) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
    }

    private record NodeKey(int varIndex, int low, int high, int value) { }
}

package MTBridge.Diagram;

import static MTBridge.Diagram.NodeStore.NO_NODE;
import static MTBridge.Diagram.NodeStore.NO_VALUE;
import static MTBridge.Diagram.NodeStore.TERMINAL_INDEX;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import MTBridge.Symbolic.ExportedTable;
import MTBridge.Symbolic.SymbolicNodeTable;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Multi-terminal reduced ordered BDD with named roots.
 * Each root describes the transition behaviour of one automaton state: a path of
 * numOfVars bits leads to a terminal carrying the successor state.
 */
public class MtRobdd {
    private final int numOfVars;
    private final NodeStore store;
    private Int2IntSortedMap roots;
    private int sinkValue = NO_VALUE;

    public MtRobdd(int numOfVars) {
        if (numOfVars <= 0) {
            throw new IllegalArgumentException("Number of variables must be positive, got " + numOfVars);
        }
        this.numOfVars = numOfVars;
        this.store = new NodeStore();
        this.roots = newRootMap();
    }

    private static Int2IntSortedMap newRootMap() {
        final Int2IntSortedMap map = new Int2IntRBTreeMap();
        map.defaultReturnValue(NO_NODE);
        return map;
    }

    public int numOfVars() {
        return numOfVars;
    }

    public int numOfNodes() {
        return store.size();
    }

    public int numOfRoots() {
        return roots.size();
    }

    public IntSortedSet rootNames() {
        return new IntRBTreeSet(roots.keySet());
    }

    public boolean hasRoot(int rootName) {
        return roots.containsKey(rootName);
    }

    /**
     * @return the node of the root, or null if there is no such root
     */
    public BddNode rootNode(int rootName) {
        final int node = roots.get(rootName);
        return node == NO_NODE ? null : store.view(node);
    }

    public BddNode node(int id) {
        return store.view(id);
    }

    public List<BddNode> nodes() {
        final List<BddNode> result = new ArrayList<>(store.size());
        for (int node = 0; node < store.size(); node++) {
            result.add(store.view(node));
        }
        return result;
    }

    /**
     * Add the path bits -> terminalValue to the behaviour of rootName.
     * @param rootName root to extend (created if missing)
     * @param bits one bit per variable
     * @param terminalValue value at the end of the path
     */
    public void insertPath(int rootName, BitVector bits, int terminalValue) {
        if (bits.isEmpty()) {
            throw new IllegalArgumentException("Cannot insert an empty bit vector");
        }
        if (bits.length() != numOfVars) {
            throw new IllegalArgumentException(
                "Bit vector of length " + bits.length() + " for a diagram with " + numOfVars + " variables");
        }
        if (terminalValue < 0) {
            throw new IllegalArgumentException("Invalid terminal value: " + terminalValue);
        }
        roots.put(rootName, insertPath(roots.get(rootName), 0, bits, terminalValue));
    }

    private int insertPath(int node, int varIndex, BitVector bits, int terminalValue) {
        if (varIndex == numOfVars) {
            return store.createTerminalNode(terminalValue);
        }

        final boolean bit = bits.get(varIndex);

        if (node == NO_NODE) {
            final int child = insertPath(NO_NODE, varIndex + 1, bits, terminalValue);
            return bit == BitVector.HI
                ? store.createNode(varIndex, NO_NODE, child, NO_VALUE)
                : store.createNode(varIndex, child, NO_NODE, NO_VALUE);
        }

        // a node below this level covers both branches of the skipped test
        final int oldLow;
        final int oldHigh;
        if (store.varIndex(node) == varIndex) {
            oldLow = store.low(node);
            oldHigh = store.high(node);
        } else {
            oldLow = node;
            oldHigh = node;
        }

        int low = oldLow;
        int high = oldHigh;
        if (bit == BitVector.HI) {
            high = insertPath(oldHigh, varIndex + 1, bits, terminalValue);
        } else {
            low = insertPath(oldLow, varIndex + 1, bits, terminalValue);
        }

        if (low == oldLow && high == oldHigh) {
            return node;
        }
        return store.createNode(varIndex, low, high, NO_VALUE);
    }

    /**
     * Drop all nodes not reachable from a root.
     */
    public MtRobdd trim() {
        retain(reachable());
        return this;
    }

    private BitSet reachable() {
        final BitSet useful = new BitSet(store.size());
        final IntArrayList worklist = new IntArrayList();
        for (int root : roots.values()) {
            if (!useful.get(root)) {
                useful.set(root);
                worklist.push(root);
            }
        }

        while (!worklist.isEmpty()) {
            final int node = worklist.popInt();
            final int low = store.low(node);
            final int high = store.high(node);
            if (low != NO_NODE && !useful.get(low)) {
                useful.set(low);
                worklist.push(low);
            }
            if (high != NO_NODE && !useful.get(high)) {
                useful.set(high);
                worklist.push(high);
            }
        }
        return useful;
    }

    private void retain(BitSet live) {
        final int[] remap = store.retain(live);
        final Int2IntSortedMap newRoots = newRootMap();
        for (Int2IntMap.Entry entry : roots.int2IntEntrySet()) {
            newRoots.put(entry.getIntKey(), remap[entry.getIntValue()]);
        }
        this.roots = newRoots;
    }

    /**
     * Remove every test whose two outcomes lead to the same node.
     */
    public MtRobdd removeRedundantTests() {
        final Int2IntMap reduced = new Int2IntOpenHashMap();
        reduced.defaultReturnValue(NO_NODE);

        final Int2IntSortedMap newRoots = newRootMap();
        for (Int2IntMap.Entry entry : roots.int2IntEntrySet()) {
            newRoots.put(entry.getIntKey(), removeRedundantTests(entry.getIntValue(), reduced));
        }
        this.roots = newRoots;
        retain(reachable());
        return this;
    }

    private int removeRedundantTests(int node, Int2IntMap reduced) {
        if (node == NO_NODE || store.isTerminal(node)) {
            return node;
        }
        final int known = reduced.get(node);
        if (known != NO_NODE) {
            return known;
        }

        final int low = removeRedundantTests(store.low(node), reduced);
        final int high = removeRedundantTests(store.high(node), reduced);

        final int result;
        if (low != NO_NODE && low == high) {
            result = low;
        } else {
            result = store.createNode(store.varIndex(node), low, high, NO_VALUE);
        }
        reduced.put(node, result);
        return result;
    }

    public MtRobdd makeComplete(int sinkValue) {
        return makeComplete(sinkValue, true);
    }

    public MtRobdd makeComplete(int sinkValue, boolean completeTerminalNodes) {
        return makeComplete(sinkValue, completeTerminalNodes, 0);
    }

    /**
     * Redirect every missing child to a single sink terminal.
     * @param sinkValue value of the sink terminal, and name of its root
     * @param completeTerminalNodes also bind each terminal value without a root to the sink
     * @param requiredRoots root names in [0, requiredRoots) without a root are bound to the sink
     */
    public MtRobdd makeComplete(int sinkValue, boolean completeTerminalNodes, int requiredRoots) {
        final int sink = store.createTerminalNode(sinkValue);
        final int existing = roots.get(sinkValue);
        if (existing != NO_NODE && existing != sink) {
            throw new IllegalArgumentException("Sink value " + sinkValue + " is already a root name");
        }

        final Completion completion = new Completion(sink);
        final Int2IntSortedMap newRoots = newRootMap();
        for (Int2IntMap.Entry entry : roots.int2IntEntrySet()) {
            newRoots.put(entry.getIntKey(), completion.complete(entry.getIntValue()));
        }
        this.roots = newRoots;

        if (completeTerminalNodes) {
            final BitSet live = reachable();
            for (int node = live.nextSetBit(0); node >= 0; node = live.nextSetBit(node + 1)) {
                if (node != sink && store.isTerminal(node) && !roots.containsKey(store.value(node))) {
                    roots.put(store.value(node), sink);
                    completion.used = true;
                }
            }
        }

        for (int name = 0; name < requiredRoots; name++) {
            if (!roots.containsKey(name)) {
                roots.put(name, sink);
                completion.used = true;
            }
        }

        if (completion.used) {
            roots.put(sinkValue, sink);
            this.sinkValue = sinkValue;
        }
        retain(reachable());
        return this;
    }

    private final class Completion {
        private final int sink;
        private final Int2IntMap completed;
        private boolean used;

        Completion(int sink) {
            this.sink = sink;
            this.completed = new Int2IntOpenHashMap();
            this.completed.defaultReturnValue(NO_NODE);
        }

        int complete(int node) {
            if (store.isTerminal(node)) {
                return node;
            }
            final int known = completed.get(node);
            if (known != NO_NODE) {
                return known;
            }

            int low = store.low(node);
            int high = store.high(node);
            if (low == NO_NODE) {
                low = sink;
                used = true;
            } else {
                low = complete(low);
            }
            if (high == NO_NODE) {
                high = sink;
                used = true;
            } else {
                high = complete(high);
            }

            final int result = store.createNode(store.varIndex(node), low, high, NO_VALUE);
            completed.put(node, result);
            return result;
        }
    }

    /**
     * Enumerate all concrete paths of a root. Skipped levels are expanded into every combination of bits.
     * @param rootName root to enumerate
     * @return paths in ascending bit-string order; empty if there is no such root
     */
    public List<Path> getAllBitStringsFromRoot(int rootName) {
        final int root = roots.get(rootName);
        if (root == NO_NODE) {
            return List.of();
        }

        final List<Path> result = new ArrayList<>();
        final Deque<PathRecord> worklist = new ArrayDeque<>();

        pushWithDontCares(worklist, root, BitVector.empty(), transitionLength(0, root));

        while (!worklist.isEmpty()) {
            final PathRecord curr = worklist.pop();
            final int node = curr.node();

            if (store.isTerminal(node)) {
                result.add(new Path(curr.prefix(), store.value(node)));
                continue;
            }

            final int varIndex = store.varIndex(node);
            // high first, so that the low branch is popped first
            final int high = store.high(node);
            if (high != NO_NODE) {
                final int length = transitionLength(varIndex, high);
                assert length > 0;
                pushWithDontCares(worklist, high, curr.prefix().append(BitVector.HI), length - 1);
            }
            final int low = store.low(node);
            if (low != NO_NODE) {
                final int length = transitionLength(varIndex, low);
                assert length > 0;
                pushWithDontCares(worklist, low, curr.prefix().append(BitVector.LO), length - 1);
            }
        }
        return result;
    }

    private int transitionLength(int fromIndex, int target) {
        final int targetIndex = store.varIndex(target);
        if (targetIndex == TERMINAL_INDEX) {
            return numOfVars - fromIndex;
        }
        return targetIndex - fromIndex;
    }

    private static void pushWithDontCares(Deque<PathRecord> worklist, int node, BitVector base, int dontCares) {
        for (long combination = (1L << dontCares) - 1; combination >= 0; combination--) {
            worklist.push(new PathRecord(node, base.concat(BitVector.fromLong(combination, dontCares))));
        }
    }

    private record PathRecord(int node, BitVector prefix) { }

    /**
     * Rebuild the diagram inside a symbolic node table.
     * Root names must be exactly 0..numOfRoots-1 and every inner node must be complete.
     * @param table target node table
     * @return the node table pointer of each root, indexed by root name
     */
    public int[] exportTo(SymbolicNodeTable table) {
        final int numOfRoots = roots.size();
        if (numOfRoots == 0 || roots.firstIntKey() != 0 || roots.lastIntKey() != numOfRoots - 1) {
            throw new IllegalStateException("Root names are not contiguous from 0: " + roots.keySet());
        }

        // Flat node table, positions in store order
        final int count = store.size();
        final int[] position = new int[count];
        final int[] varIndex = new int[count];
        final int[] low = new int[count];
        final int[] high = new int[count];
        final int[] value = new int[count];
        int next = 0;
        for (int node = 0; node < count; node++) {
            position[node] = next++;
        }
        for (int node = 0; node < count; node++) {
            final int pos = position[node];
            varIndex[pos] = store.varIndex(node);
            value[pos] = store.value(node);
            low[pos] = store.low(node) == NO_NODE ? NO_NODE : position[store.low(node)];
            high[pos] = store.high(node) == NO_NODE ? NO_NODE : position[store.high(node)];
        }

        final int[] pointer = new int[count];
        Arrays.fill(pointer, NO_NODE); // uncreated

        final int[] behaviour = new int[numOfRoots];
        for (Int2IntMap.Entry entry : roots.int2IntEntrySet()) {
            behaviour[entry.getIntKey()] =
                makeSymbolicNode(table, position[entry.getIntValue()], varIndex, low, high, value, pointer);
        }
        return behaviour;
    }

    private static int makeSymbolicNode(SymbolicNodeTable table, int pos, int[] varIndex, int[] low, int[] high,
                                        int[] value, int[] pointer) {
        if (pointer[pos] != NO_NODE) {
            return pointer[pos];
        }
        if (varIndex[pos] == TERMINAL_INDEX) {
            pointer[pos] = table.findLeaf(value[pos]);
        } else {
            if (low[pos] == NO_NODE || high[pos] == NO_NODE) {
                throw new IllegalStateException("Cannot export incomplete node on variable " + varIndex[pos]);
            }
            final int lo = makeSymbolicNode(table, low[pos], varIndex, low, high, value, pointer);
            final int hi = makeSymbolicNode(table, high[pos], varIndex, low, high, value, pointer);
            pointer[pos] = table.findNode(lo, hi, varIndex[pos]);
        }
        return pointer[pos];
    }

    /**
     * Import the behaviours of a symbolic automaton; root i is bound to roots[i].
     * @param numOfVars number of variables of the encoding
     * @param table node table holding the behaviours
     * @param roots behaviour pointer of each state
     * @return a diagram with roots 0..roots.length-1
     */
    public static MtRobdd fromSymbolic(int numOfVars, SymbolicNodeTable table, int[] roots) {
        final ExportedTable exported = table.export(roots);
        final MtRobdd diagram = new MtRobdd(numOfVars);

        // Placeholders first: children may point anywhere in the table
        final int[] handle = new int[exported.size()];
        for (int pos = 0; pos < exported.size(); pos++) {
            final int varIndex = exported.varIndex()[pos];
            if (varIndex >= numOfVars) {
                throw new IllegalArgumentException(
                    "Node on variable " + varIndex + " in an encoding with " + numOfVars + " variables");
            }
            handle[pos] = diagram.store.reserve(exported.isLeaf(pos) ? TERMINAL_INDEX : varIndex);
        }

        for (int pos = 0; pos < exported.size(); pos++) {
            if (exported.isLeaf(pos)) {
                diagram.store.fill(handle[pos], NO_NODE, NO_NODE, exported.value()[pos]);
            } else {
                diagram.store.fill(handle[pos], handle[exported.low()[pos]], handle[exported.high()[pos]], NO_VALUE);
            }
        }

        for (int state = 0; state < roots.length; state++) {
            diagram.roots.put(state, handle[exported.rootPositions()[state]]);
        }
        return diagram;
    }

    /**
     * Write the diagram in Graphviz format: roots, one rank per variable level, then terminals.
     */
    public void writeDot(Appendable out) throws IOException {
        final Int2ObjectRBTreeMap<IntArrayList> levels = new Int2ObjectRBTreeMap<>();
        for (int node = 0; node < store.size(); node++) {
            IntArrayList level = levels.get(store.varIndex(node));
            if (level == null) {
                level = new IntArrayList();
                levels.put(store.varIndex(node), level);
            }
            level.add(node);
        }

        out.append("digraph MtRobdd {\n");
        out.append("  rankdir=LR;\n");

        out.append("  node [shape=circle];\n");
        out.append("  // Roots\n");
        out.append("  { rank=same; ");
        for (int name : roots.keySet()) {
            out.append("r").append(String.valueOf(name)).append(" [label=\"").append(label(name)).append("\"]; ");
        }
        out.append("}\n");

        out.append("  node [shape=box];\n");
        for (int level = 0; level < numOfVars; level++) {
            out.append("  // Level ").append(String.valueOf(level)).append('\n');
            out.append("  { rank=same; ");
            for (int node : levels.getOrDefault(level, new IntArrayList())) {
                out.append("n").append(String.valueOf(node))
                    .append(" [label=\"x").append(String.valueOf(level)).append("\"]; ");
            }
            out.append("}\n");
        }

        out.append("  node [shape=doublecircle];\n");
        out.append("  // Terminals\n");
        out.append("  { rank=same; ");
        for (int node : levels.getOrDefault(TERMINAL_INDEX, new IntArrayList())) {
            out.append("n").append(String.valueOf(node))
                .append(" [label=\"").append(label(store.value(node))).append("\"]; ");
        }
        out.append("}\n");

        out.append("  // Root edges\n");
        for (Int2IntMap.Entry entry : roots.int2IntEntrySet()) {
            out.append("  r").append(String.valueOf(entry.getIntKey()))
                .append(" -> n").append(String.valueOf(entry.getIntValue())).append(";\n");
        }

        out.append("  // Node edges\n");
        for (int node = 0; node < store.size(); node++) {
            if (store.low(node) != NO_NODE) {
                out.append("  n").append(String.valueOf(node)).append(" -> n")
                    .append(String.valueOf(store.low(node))).append(" [label=\"0\"];\n");
            }
            if (store.high(node) != NO_NODE) {
                out.append("  n").append(String.valueOf(node)).append(" -> n")
                    .append(String.valueOf(store.high(node))).append(" [label=\"1\"];\n");
            }
        }
        out.append("}\n");
    }

    private String label(int value) {
        return value == sinkValue ? "sink" : String.valueOf(value);
    }

    public String toDot() {
        final StringBuilder sb = new StringBuilder();
        try {
            writeDot(sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringBuilder does not throw
        }
        return sb.toString();
    }

    public void saveAsDot(java.nio.file.Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeDot(writer);
        }
    }

    @Override
    public String toString() {
        return "MtRobdd[vars=" + numOfVars + ", nodes=" + store.size() + ", roots=" + roots.size() + "]";
    }
}

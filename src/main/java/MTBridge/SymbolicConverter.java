package MTBridge;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import MTBridge.Codec.AlphabetCodec;
import MTBridge.Codec.UnknownCodeException;
import MTBridge.Diagram.BitVector;
import MTBridge.Diagram.MtRobdd;
import MTBridge.Diagram.Path;
import MTBridge.Model.Measurements;
import MTBridge.Symbolic.SharedBddManager;
import MTBridge.Symbolic.SymbolicDFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion between explicit NFAs and symbolic automata whose transition function is a
 * multi-terminal BDD per state.
 */
public class SymbolicConverter {
    public static boolean DEBUG = false;

    private final Measurements measurements;

    public SymbolicConverter() {
        this(Measurements.noop());
    }

    public SymbolicConverter(Measurements measurements) {
        this.measurements = measurements;
    }

    public Measurements getMeasurements() {
        return measurements;
    }

    public static <I> EncodedNFA<I> encode(NFA<Integer, I> nfa, Alphabet<I> inputs) {
        return new SymbolicConverter().fromExplicitNFA(nfa, inputs);
    }

    public static <I> CompactNFA<I> decode(EncodedNFA<I> encoded) {
        return new SymbolicConverter().toExplicitNFA(encoded);
    }

    /**
     * Encode nfa; symbols are coded in input alphabet order, skipping symbols that label no transition.
     */
    public <I> EncodedNFA<I> fromExplicitNFA(NFA<Integer, I> nfa, Alphabet<I> inputs) {
        return fromExplicitNFA(nfa, inputs, null);
    }

    /**
     * Encode nfa as a symbolic automaton.
     * Every letter is [symbol code][index of the target among the sorted targets].
     * @param nfa - Original NFA, states 0..size-1; not modified
     * @param inputs - Input symbols
     * @param alphabetOrder - order of the symbol codes, or null for the used symbols in input order
     * @return the encoded automaton
     * @param <I> - Input symbol type, e.g., Integer
     */
    public <I> EncodedNFA<I> fromExplicitNFA(NFA<Integer, I> nfa, Alphabet<I> inputs, List<I> alphabetOrder) {
        final CompactNFA<I> unified;
        try (Measurements.Split ignored = measurements.start("unify")) {
            unified = NFAOps.unifyInitialStates(nfa, inputs);
        }
        final int numOfStates = unified.size();
        final int initialState = unified.getInitialStates().iterator().next();

        final AlphabetCodec<I> codec = new AlphabetCodec<>(symbolOrder(unified, inputs, alphabetOrder));
        final int level = NFAOps.nondeterminismLevel(unified, codec.symbols());
        int numOfNondetVars = AlphabetCodec.bitWidth(level);
        if (codec.width() + numOfNondetVars == 0) {
            numOfNondetVars = 1; // a diagram needs at least one variable
        }

        final MtRobdd diagram = new MtRobdd(codec.width() + numOfNondetVars);
        try (Measurements.Split ignored = measurements.start("encode")) {
            for (int q = 0; q < numOfStates; q++) {
                for (I a : codec.symbols()) {
                    final BitVector code = codec.encode(a);
                    final int[] targets = NFAOps.sortedSuccessors(unified, q, a);
                    for (int i = 0; i < targets.length; i++) {
                        diagram.insertPath(q, code.concat(BitVector.fromLong(i, numOfNondetVars)), targets[i]);
                    }
                }
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Encoded " + numOfStates + " states, " + codec.size() + " symbols, "
                + "nondeterminism " + level + ": " + diagram);
        }

        try (Measurements.Split ignored = measurements.start("reduce")) {
            diagram.trim().removeRedundantTests().makeComplete(numOfStates, true, numOfStates);
        }
        if (DEBUG) {
            System.out.println("DEBUG: Reduced and completed: " + diagram);
            System.out.println(diagram.toDot());
        }

        final SymbolicDFA dfa;
        try (Measurements.Split ignored = measurements.start("export")) {
            dfa = new SymbolicDFA(new SharedBddManager(), diagram.numOfRoots());
            for (int state = 0; state < dfa.size(); state++) {
                final boolean accepting = state < numOfStates && unified.isAccepting(state);
                dfa.setAcceptMarker(state, accepting ? SymbolicDFA.ACCEPT : SymbolicDFA.REJECT);
            }
            dfa.setInitialState(initialState);
            dfa.setBehaviours(diagram.exportTo(dfa.getNodeTable()));
        }
        if (DEBUG) {
            System.out.println("DEBUG: Exported " + dfa.size() + " states, "
                + dfa.getNodeTable().size() + " symbolic nodes");
        }

        return new EncodedNFA<>(dfa, codec, inputs, numOfNondetVars, level, numOfStates);
    }

    private static <I> List<I> symbolOrder(NFA<Integer, I> nfa, Alphabet<I> inputs, List<I> alphabetOrder) {
        final List<I> used = NFAOps.usedSymbols(nfa, inputs);
        if (alphabetOrder == null) {
            return used;
        }
        final Set<I> ordered = new HashSet<>(alphabetOrder);
        for (I a : used) {
            if (!ordered.contains(a)) {
                throw new IllegalArgumentException("Symbol " + a + " labels a transition but has no code");
            }
        }
        for (I a : alphabetOrder) {
            if (!inputs.contains(a)) {
                throw new IllegalArgumentException("Symbol " + a + " is not in the input alphabet");
            }
        }
        return alphabetOrder;
    }

    /**
     * Decode a symbolic automaton into an NFA with one state per symbolic state.
     * Letters whose symbol bits have no symbol (e.g. unused codes leading to the sink) are dropped.
     * @param encoded - automaton produced by {@link #fromExplicitNFA}
     * @return NFA over the input alphabet of encoded
     * @param <I> - Input symbol type, e.g., Integer
     */
    public <I> CompactNFA<I> toExplicitNFA(EncodedNFA<I> encoded) {
        final SymbolicDFA dfa = encoded.getDFA();
        final AlphabetCodec<I> codec = encoded.getCodec();

        final MtRobdd diagram;
        try (Measurements.Split ignored = measurements.start("import")) {
            diagram = MtRobdd.fromSymbolic(encoded.numOfVars(), dfa.getNodeTable(), dfa.getBehaviours());
        }
        if (DEBUG) {
            System.out.println("DEBUG: Imported " + diagram);
        }

        final CompactNFA<I> out = new CompactNFA<>(encoded.getInputAlphabet(), dfa.size());
        try (Measurements.Split ignored = measurements.start("decode")) {
            for (int state = 0; state < dfa.size(); state++) {
                out.addState(dfa.isAccepting(state));
            }
            out.setInitial(dfa.getInitialState(), true);

            for (int state = 0; state < dfa.size(); state++) {
                for (Path path : diagram.getAllBitStringsFromRoot(state)) {
                    final I symbol;
                    try {
                        symbol = codec.decode(path.bits().prefix(codec.width()));
                    } catch (UnknownCodeException e) {
                        continue; // unused code
                    }
                    final int target = path.value();
                    out.addTransition(state, symbol, target);
                }
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Decoded " + out.size() + " states");
        }
        return out;
    }
}

package MTBridge;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.fsa.NFAs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Queries and rewrites on explicit NFAs whose states are 0..size-1.
 */
public class NFAOps {
    public static <I> CompactNFA<I> trim(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        return NFAs.trim(nfa, alphabet, new CompactNFA<>(alphabet));
    }

    /**
     * Copy of nfa with exactly one initial state. Unless nfa already has a single initial state,
     * a fresh initial state is appended that is accepting iff some initial state is, and
     * has the union of the initial states' outgoing transitions.
     * @param nfa - original NFA, not modified
     * @param alphabet - input symbols
     * @return NFA with a single initial state
     * @param <I> - Input symbol type, e.g., Integer
     */
    public static <I> CompactNFA<I> unifyInitialStates(NFA<Integer, I> nfa, Alphabet<I> alphabet) {
        final int size = nfa.size();
        final CompactNFA<I> out = new CompactNFA<>(alphabet, size + 1);

        for (int q = 0; q < size; q++) {
            out.addState(nfa.isAccepting(q));
        }
        for (int q = 0; q < size; q++) {
            for (I a : alphabet) {
                for (int t : nfa.getTransitions(q, a)) {
                    out.addTransition(q, a, t);
                }
            }
        }

        final Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.size() == 1) {
            out.setInitial(initialStates.iterator().next(), true);
            return out;
        }

        boolean accepting = false;
        for (int init : initialStates) {
            accepting |= nfa.isAccepting(init);
        }
        final int fresh = out.addState(accepting);
        for (int init : initialStates) {
            for (I a : alphabet) {
                for (int t : nfa.getTransitions(init, a)) {
                    out.addTransition(fresh, a, t);
                }
            }
        }
        out.setInitial(fresh, true);
        return out;
    }

    /**
     * Maximum number of successors of a state on a single symbol; 1 (or 0) for deterministic automata.
     */
    public static <I> int nondeterminismLevel(NFA<Integer, I> nfa, Collection<? extends I> inputs) {
        int maxTargets = 0;
        for (int q = 0; q < nfa.size(); q++) {
            for (I a : inputs) {
                maxTargets = Math.max(maxTargets, nfa.getTransitions(q, a).size());
            }
        }
        return maxTargets;
    }

    /**
     * Symbols labelling at least one transition, in alphabet order.
     */
    public static <I> List<I> usedSymbols(NFA<Integer, I> nfa, Alphabet<I> alphabet) {
        final List<I> used = new ArrayList<>();
        for (I a : alphabet) {
            for (int q = 0; q < nfa.size(); q++) {
                if (!nfa.getTransitions(q, a).isEmpty()) {
                    used.add(a);
                    break;
                }
            }
        }
        return used;
    }

    /**
     * Successors of state on symbol, ascending.
     */
    public static <I> int[] sortedSuccessors(NFA<Integer, I> nfa, int state, I symbol) {
        final Collection<Integer> successors = nfa.getTransitions(state, symbol);
        final int[] targets = new int[successors.size()];
        int i = 0;
        for (Integer t : successors) {
            targets[i++] = t;
        }
        Arrays.sort(targets);
        return targets;
    }
}

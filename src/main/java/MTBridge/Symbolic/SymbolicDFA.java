package MTBridge.Symbolic;

import java.util.Arrays;
import java.util.List;

import MTBridge.Diagram.BitVector;

/**
 * Complete deterministic automaton over bit-vector letters. The behaviour of each state is a
 * multi-terminal BDD in the shared node table whose leaves are successor states.
 */
public class SymbolicDFA {
    public static final int ACCEPT = 1;
    public static final int DONT_KNOW = 0;
    public static final int REJECT = -1;

    private final SymbolicNodeTable nodeTable;
    private final int[] accept;
    private final int[] behaviour;
    private int initialState;

    public SymbolicDFA(SymbolicNodeTable nodeTable, int numOfStates) {
        if (numOfStates <= 0) {
            throw new IllegalArgumentException("A symbolic automaton needs at least one state");
        }
        this.nodeTable = nodeTable;
        this.accept = new int[numOfStates];
        this.behaviour = new int[numOfStates];
        Arrays.fill(this.accept, REJECT);
        Arrays.fill(this.behaviour, -1);
    }

    public SymbolicNodeTable getNodeTable() {
        return nodeTable;
    }

    public int size() {
        return accept.length;
    }

    public int getInitialState() {
        return initialState;
    }

    public void setInitialState(int state) {
        checkState(state);
        this.initialState = state;
    }

    public int getAcceptMarker(int state) {
        checkState(state);
        return accept[state];
    }

    public void setAcceptMarker(int state, int marker) {
        checkState(state);
        if (marker != ACCEPT && marker != REJECT && marker != DONT_KNOW) {
            throw new IllegalArgumentException("Invalid accept marker: " + marker);
        }
        accept[state] = marker;
    }

    public boolean isAccepting(int state) {
        return getAcceptMarker(state) == ACCEPT;
    }

    public int getBehaviour(int state) {
        checkState(state);
        return behaviour[state];
    }

    /**
     * @return copy of the per-state behaviour pointers
     */
    public int[] getBehaviours() {
        return behaviour.clone();
    }

    public void setBehaviours(int[] pointers) {
        if (pointers.length != behaviour.length) {
            throw new IllegalArgumentException(
                "Expected " + behaviour.length + " behaviours, got " + pointers.length);
        }
        for (int pointer : pointers) {
            if (pointer < 0 || pointer >= nodeTable.size()) {
                throw new IllegalArgumentException("Unknown node pointer: " + pointer);
            }
        }
        System.arraycopy(pointers, 0, behaviour, 0, pointers.length);
    }

    /**
     * Follow one letter through the behaviour of state.
     */
    public int successor(int state, BitVector letter) {
        int pointer = getBehaviour(state);
        if (pointer < 0) {
            throw new IllegalStateException("State " + state + " has no behaviour");
        }
        while (!nodeTable.isLeaf(pointer)) {
            pointer = letter.get(nodeTable.varIndex(pointer)) ? nodeTable.high(pointer) : nodeTable.low(pointer);
        }
        return nodeTable.leafValue(pointer);
    }

    public boolean accepts(List<BitVector> word) {
        int state = initialState;
        for (BitVector letter : word) {
            state = successor(state, letter);
        }
        return isAccepting(state);
    }

    private void checkState(int state) {
        if (state < 0 || state >= accept.length) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
    }
}

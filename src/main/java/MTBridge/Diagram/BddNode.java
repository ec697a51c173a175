package MTBridge.Diagram;

/**
 * Snapshot of a diagram node. Children are handles into the owning diagram, or NodeStore.NO_NODE.
 */
public record BddNode(int id, int varIndex, int low, int high, int value) {

    public boolean isTerminal() {
        return varIndex == NodeStore.TERMINAL_INDEX;
    }

    public boolean isInner() {
        return varIndex >= 0;
    }

    public boolean hasLow() {
        return low != NodeStore.NO_NODE;
    }

    public boolean hasHigh() {
        return high != NodeStore.NO_NODE;
    }
}

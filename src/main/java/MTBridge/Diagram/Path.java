package MTBridge.Diagram;

/**
 * A concrete root-to-terminal path: full-length bit string and the terminal value it leads to.
 */
public record Path(BitVector bits, int value) { }

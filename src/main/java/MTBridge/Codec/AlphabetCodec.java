package MTBridge.Codec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import MTBridge.Diagram.BitVector;

/**
 * Fixed-width binary encoding of a finite alphabet. The i-th symbol (in the given order)
 * is encoded as i in big-endian binary with {@link #bitWidth(int)} of the alphabet size bits.
 * @param <I> - Input symbol type, e.g., Integer
 */
public class AlphabetCodec<I> {
    private final List<I> symbols;
    private final int width;
    private final Map<I, BitVector> encodeDict;
    private final Map<BitVector, I> decodeDict;

    public AlphabetCodec(Collection<? extends I> symbols) {
        this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
        this.width = bitWidth(this.symbols.size());
        this.encodeDict = new HashMap<>();
        this.decodeDict = new HashMap<>();

        for (int code = 0; code < this.symbols.size(); code++) {
            final I symbol = this.symbols.get(code);
            final BitVector bits = BitVector.fromLong(code, width);
            if (encodeDict.put(symbol, bits) != null) {
                throw new IllegalArgumentException("Duplicate symbol: " + symbol);
            }
            decodeDict.put(bits, symbol);
        }
    }

    /**
     * Number of bits needed to distinguish n values: ceil(log2(n)), and 0 for n <= 1.
     */
    public static int bitWidth(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Negative size: " + n);
        }
        if (n <= 1) {
            return 0;
        }
        return Integer.SIZE - Integer.numberOfLeadingZeros(n - 1);
    }

    public int width() {
        return width;
    }

    public int size() {
        return symbols.size();
    }

    public List<I> symbols() {
        return symbols;
    }

    public boolean contains(I symbol) {
        return encodeDict.containsKey(symbol);
    }

    public BitVector encode(I symbol) {
        final BitVector code = encodeDict.get(symbol);
        if (code == null) {
            throw new UnknownCodeException("No code for symbol " + symbol);
        }
        return code;
    }

    public I decode(BitVector code) {
        final I symbol = decodeDict.get(code);
        if (symbol == null) {
            throw new UnknownCodeException("No symbol for code " + code);
        }
        return symbol;
    }

    public Map<I, BitVector> encodeMap() {
        return Collections.unmodifiableMap(encodeDict);
    }

    public Map<BitVector, I> decodeMap() {
        return Collections.unmodifiableMap(decodeDict);
    }

    @Override
    public String toString() {
        return "AlphabetCodec" + encodeDict;
    }
}

package MTBridge.Diagram;

import java.util.BitSet;

/**
 * Immutable fixed-length bit string. Position 0 is the first (most significant) variable.
 */
public final class BitVector {
    public static final boolean LO = false;
    public static final boolean HI = true;

    private static final BitVector EMPTY = new BitVector(new BitSet(), 0);

    private final BitSet bits;
    private final int length;

    private BitVector(BitSet bits, int length) {
        this.bits = bits;
        this.length = length;
    }

    public static BitVector empty() {
        return EMPTY;
    }

    /**
     * Build a bit vector from 0/1 values.
     */
    public static BitVector of(int... values) {
        final BitSet bits = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == 1) {
                bits.set(i);
            } else if (values[i] != 0) {
                throw new IllegalArgumentException("Not a bit: " + values[i]);
            }
        }
        return new BitVector(bits, values.length);
    }

    /**
     * Big-endian binary representation of value with the given width.
     */
    public static BitVector fromLong(long value, int width) {
        if (width < 0 || width > Long.SIZE - 1) {
            throw new IllegalArgumentException("Unsupported width: " + width);
        }
        if (value < 0 || (width < Long.SIZE - 1 && value >= (1L << width))) {
            throw new IllegalArgumentException(value + " does not fit into " + width + " bits");
        }
        final BitSet bits = new BitSet(width);
        for (int i = 0; i < width; i++) {
            if ((value & (1L << (width - i - 1))) != 0) {
                bits.set(i);
            }
        }
        return new BitVector(bits, width);
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public boolean get(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Bit " + index + " of a vector of length " + length);
        }
        return bits.get(index);
    }

    public BitVector append(boolean bit) {
        final BitSet copy = (BitSet) bits.clone();
        copy.set(length, bit);
        return new BitVector(copy, length + 1);
    }

    public BitVector concat(BitVector suffix) {
        if (suffix.length == 0) {
            return this;
        }
        final BitSet copy = (BitSet) bits.clone();
        for (int i = suffix.bits.nextSetBit(0); i >= 0; i = suffix.bits.nextSetBit(i + 1)) {
            copy.set(length + i);
        }
        return new BitVector(copy, length + suffix.length);
    }

    public BitVector prefix(int prefixLength) {
        if (prefixLength < 0 || prefixLength > length) {
            throw new IndexOutOfBoundsException("Prefix " + prefixLength + " of a vector of length " + length);
        }
        return new BitVector(bits.get(0, prefixLength), prefixLength);
    }

    public BitVector suffix(int from) {
        if (from < 0 || from > length) {
            throw new IndexOutOfBoundsException("Suffix from " + from + " of a vector of length " + length);
        }
        return new BitVector(bits.get(from, length), length - from);
    }

    /**
     * Inverse of {@link #fromLong(long, int)}.
     */
    public long toLong() {
        if (length > Long.SIZE - 1) {
            throw new ArithmeticException("Vector of length " + length + " does not fit into a long");
        }
        long value = 0;
        for (int i = 0; i < length; i++) {
            value = (value << 1) | (bits.get(i) ? 1 : 0);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitVector)) {
            return false;
        }
        BitVector other = (BitVector) o;
        return length == other.length && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * bits.hashCode() + length;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(bits.get(i) ? '1' : '0');
        }
        return sb.toString();
    }
}

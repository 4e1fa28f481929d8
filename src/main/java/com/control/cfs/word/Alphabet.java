package com.control.cfs.word;

import com.control.cfs.api.ConfigurationException;

import java.util.Arrays;

/**
 * The fixed symbol set {x0, x1, ..., xm} of a computation, together with the
 * order in which symbols are taken when words are generated.
 *
 * Symbol ids carry meaning: id 0 is the drift channel (constant input 1, field
 * g0), ids 1..m are the controlled channels (input u_i, field g_i). The
 * position of a symbol is where it sits in the generation order. The standard
 * alphabet has position == id; a permuted alphabet reorders positions only,
 * so the drift symbol stays the drift symbol wherever it is placed.
 */
public final class Alphabet {
    // order[p] = symbol id at position p
    private final int[] order;
    // positions[id] = position of symbol id
    private final int[] positions;

    private Alphabet(int[] order) {
        this.order = order;
        this.positions = new int[order.length];
        for (int p = 0; p < order.length; p++)
            positions[order[p]] = p;
    }

    /**
     * Alphabet with one drift symbol and {@code controlledChannels} controlled
     * symbols in natural order x0..xm.
     */
    public static Alphabet standard(int controlledChannels) {
        if (controlledChannels < 0)
            throw new ConfigurationException("Controlled channel count must be >= 0, got " + controlledChannels);
        return ofSize(controlledChannels + 1);
    }

    /** Alphabet of {@code size} symbols x0..x(size-1) in natural order. */
    public static Alphabet ofSize(int size) {
        if (size < 1)
            throw new ConfigurationException("Alphabet size must be >= 1, got " + size);
        int[] order = new int[size];
        for (int i = 0; i < size; i++)
            order[i] = i;
        return new Alphabet(order);
    }

    /**
     * Alphabet whose generation order is the given permutation of symbol ids
     * 0..n-1.
     */
    public static Alphabet ofOrder(int... order) {
        if (order.length < 1)
            throw new ConfigurationException("Alphabet size must be >= 1, got 0");
        boolean[] seen = new boolean[order.length];
        for (int id : order) {
            if (id < 0 || id >= order.length || seen[id])
                throw new ConfigurationException("Alphabet order is not a permutation of 0.."
                        + (order.length - 1) + ": " + Arrays.toString(order));
            seen[id] = true;
        }
        return new Alphabet(order.clone());
    }

    public int size() {
        return order.length;
    }

    /** Number of controlled channels m (the alphabet size minus the drift symbol). */
    public int controlledChannels() {
        return order.length - 1;
    }

    /** Symbol id at the given generation position. */
    public int symbolAt(int position) {
        return order[position];
    }

    /** Generation position of the given symbol id. */
    public int positionOf(int symbol) {
        if (symbol < 0 || symbol >= positions.length)
            throw new IllegalArgumentException("Unknown symbol x" + symbol + " for alphabet of size " + size());
        return positions[symbol];
    }

    public boolean isStandard() {
        for (int p = 0; p < order.length; p++)
            if (order[p] != p)
                return false;
        return true;
    }

    public static String symbolName(int symbol) {
        return "x" + symbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Alphabet other && Arrays.equals(order, other.order);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(order);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int p = 0; p < order.length; p++) {
            if (p > 0)
                sb.append(", ");
            sb.append(symbolName(order[p]));
        }
        return sb.append('}').toString();
    }
}

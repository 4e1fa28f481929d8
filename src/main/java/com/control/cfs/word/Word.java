package com.control.cfs.word;

import java.util.Arrays;

/**
 * An immutable finite sequence of alphabet symbol ids, read left to right.
 *
 * For the word x_i1 x_i2 ... x_ik the leftmost letter x_i1 is the outermost
 * integration in E_{x_i1 ... x_ik} and the first field applied in its
 * coefficient (c, x_i1 ... x_ik) = L_{g_ik} ... L_{g_i2} L_{g_i1} h. Words are
 * generated by prepending, never mutated.
 */
public final class Word implements Comparable<Word> {
    public static final Word EMPTY = new Word(new int[0]);

    private final int[] symbols;

    private Word(int[] symbols) {
        this.symbols = symbols;
    }

    public static Word of(int... symbols) {
        if (symbols.length == 0)
            return EMPTY;
        for (int s : symbols)
            if (s < 0)
                throw new IllegalArgumentException("Negative symbol id: " + s);
        return new Word(symbols.clone());
    }

    /**
     * Parses the compact notation produced by {@link #toString()}, e.g.
     * {@code "x1x0"} or {@code "x2 x0 x1"}. {@code "ε"} or a blank string is
     * the empty word.
     */
    public static Word parse(String text) {
        String s = text.replace(" ", "");
        if (s.isEmpty() || s.equals("ε"))
            return EMPTY;
        String[] parts = s.split("x", -1);
        if (!parts[0].isEmpty())
            throw new IllegalArgumentException("Malformed word: " + text);
        int[] ids = new int[parts.length - 1];
        for (int i = 1; i < parts.length; i++) {
            try {
                ids[i - 1] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed word: " + text, e);
            }
        }
        return of(ids);
    }

    /** Returns x_symbol followed by this word. */
    public Word prepend(int symbol) {
        if (symbol < 0)
            throw new IllegalArgumentException("Negative symbol id: " + symbol);
        int[] next = new int[symbols.length + 1];
        next[0] = symbol;
        System.arraycopy(symbols, 0, next, 1, symbols.length);
        return new Word(next);
    }

    public int length() {
        return symbols.length;
    }

    public boolean isEmpty() {
        return symbols.length == 0;
    }

    public int symbolAt(int i) {
        return symbols[i];
    }

    /** Leftmost symbol. */
    public int first() {
        if (symbols.length == 0)
            throw new IllegalStateException("Empty word has no first symbol");
        return symbols[0];
    }

    /** The word without its leftmost symbol (η for x_i η). */
    public Word tail() {
        if (symbols.length == 0)
            throw new IllegalStateException("Empty word has no tail");
        return symbols.length == 1 ? EMPTY : new Word(Arrays.copyOfRange(symbols, 1, symbols.length));
    }

    /** Largest symbol id used, or -1 for the empty word. */
    public int maxSymbol() {
        int max = -1;
        for (int s : symbols)
            max = Math.max(max, s);
        return max;
    }

    @Override
    public int compareTo(Word o) {
        if (symbols.length != o.symbols.length)
            return Integer.compare(symbols.length, o.symbols.length);
        return Arrays.compare(symbols, o.symbols);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Word w && Arrays.equals(symbols, w.symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        if (symbols.length == 0)
            return "ε";
        StringBuilder sb = new StringBuilder(symbols.length * 3);
        for (int s : symbols)
            sb.append(Alphabet.symbolName(s));
        return sb.toString();
    }
}

package com.control.cfs.word;

import com.control.cfs.api.ConfigurationException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * WordIndex -- the canonical row layout of every word of length 0..N.
 *
 * Both the iterated-integral table and the Lie-derivative table are flat
 * arrays indexed by the rows of this class. Two tables can only be combined
 * when they were built from equal indexes, so this is the single source of
 * truth for the word/row correspondence.
 *
 * Layout: layered, CSR-style.
 * - layerOffset[k] is the first row of layer k (words of length k);
 * layerOffset[k+1] is one past its last row. Layer k holds size^k rows.
 * - Inside layer k+1, the word x_p η (η at local position j of layer k, x_p
 * at alphabet position p) sits at local position j * size + p. The prepended
 * symbol varies fastest, so every extension of one η is a contiguous block.
 * - parentRow[r] is the row of η for row r = x_p η; symbolOf[r] is the id of
 * the prepended symbol. Row 0 is the empty word (parent -1, symbol -1).
 * - The row of η x_p (appended on the right) is also O(1): see
 * {@link #appendRow(int, int)}. Iterated integrals grow words on the left,
 * Lie-derivative coefficients on the right.
 *
 * Prefix stability: a word's row depends only on the alphabet order and its
 * own length, never on N. The index at depth N is a prefix of the index at
 * depth N+1.
 */
@Log4j2
public final class WordIndex {
    private final Alphabet alphabet;
    private final int depth;

    // layerOffset[k] = first row of layer k, layerOffset[depth + 1] = row count
    private final int[] layerOffset;

    // Parent row (η of x_i η) per row, -1 for ε.
    private final int[] parentRow;

    // Prepended symbol id per row, -1 for ε.
    private final int[] symbolOf;

    private final Word[] words;
    private final Map<Word, Integer> rowByWord;

    private WordIndex(Alphabet alphabet, int depth, int[] layerOffset, int[] parentRow, int[] symbolOf,
            Word[] words, Map<Word, Integer> rowByWord) {
        this.alphabet = alphabet;
        this.depth = depth;
        this.layerOffset = layerOffset;
        this.parentRow = parentRow;
        this.symbolOf = symbolOf;
        this.words = words;
        this.rowByWord = rowByWord;
    }

    /**
     * Enumerates every word over the standard alphabet of {@code alphabetSize}
     * symbols up to length {@code depth}.
     */
    public static WordIndex enumerate(int alphabetSize, int depth) {
        return of(Alphabet.ofSize(alphabetSize), depth);
    }

    /**
     * Enumerates every word over {@code alphabet} up to length {@code depth},
     * taking symbols in the alphabet's order.
     *
     * @throws ConfigurationException if depth is negative or the table would
     *                                exceed the addressable row count.
     */
    public static WordIndex of(Alphabet alphabet, int depth) {
        Objects.requireNonNull(alphabet, "alphabet");
        if (depth < 0)
            throw new ConfigurationException("Truncation depth must be >= 0, got " + depth);

        final int size = alphabet.size();

        // 1. Layer offsets, guarding against int overflow of (size)^k growth
        int[] offsets = new int[depth + 2];
        long layer = 1;
        long total = 0;
        for (int k = 0; k <= depth; k++) {
            offsets[k] = (int) total;
            total += layer;
            if (total > Integer.MAX_VALUE - 8)
                throw new ConfigurationException("Word table for alphabet size " + size + " and depth " + depth
                        + " exceeds " + (Integer.MAX_VALUE - 8) + " rows");
            layer *= size;
        }
        offsets[depth + 1] = (int) total;

        int rows = (int) total;
        int[] parents = new int[rows];
        int[] symbols = new int[rows];
        Word[] ws = new Word[rows];
        Map<Word, Integer> lookup = new HashMap<>(Math.min(rows, 1 << 24) * 2);

        // 2. Layer 0 is {ε}
        parents[0] = -1;
        symbols[0] = -1;
        ws[0] = Word.EMPTY;
        lookup.put(Word.EMPTY, 0);

        // 3. Layer k+1: prepend every symbol (in alphabet order) to every word of layer k
        for (int k = 0; k < depth; k++) {
            int start = offsets[k];
            int end = offsets[k + 1];
            int next = offsets[k + 1];
            for (int r = start; r < end; r++) {
                for (int p = 0; p < size; p++) {
                    int s = alphabet.symbolAt(p);
                    parents[next] = r;
                    symbols[next] = s;
                    ws[next] = ws[r].prepend(s);
                    lookup.put(ws[next], next);
                    next++;
                }
            }
        }

        WordIndex index = new WordIndex(alphabet, depth, offsets, parents, symbols, ws, lookup);
        log.debug("Built word index {} with {} rows", index.signature(), rows);
        return index;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /** Truncation depth N. */
    public int depth() {
        return depth;
    }

    /** Total number of words, Σ_{k=0}^{N} size^k. */
    public int size() {
        return layerOffset[depth + 1];
    }

    public int layerStart(int k) {
        checkLayer(k);
        return layerOffset[k];
    }

    public int layerEnd(int k) {
        checkLayer(k);
        return layerOffset[k + 1];
    }

    public int layerSize(int k) {
        checkLayer(k);
        return layerOffset[k + 1] - layerOffset[k];
    }

    /** Returns the word stored at the given row. */
    public Word word(int row) {
        return words[row];
    }

    /** Resolves a word to its row. O(1) hash lookup. */
    public int row(Word word) {
        Integer r = rowByWord.get(word);
        if (r == null)
            throw new IllegalArgumentException("Word " + word + " is not part of index " + signature());
        return r;
    }

    public boolean contains(Word word) {
        return rowByWord.containsKey(word);
    }

    /** Row of η for the word x_i η at {@code row}; -1 for the empty word. */
    public int parentRow(int row) {
        return parentRow[row];
    }

    /** Id of the leftmost symbol of the word at {@code row}; -1 for the empty word. */
    public int symbolOf(int row) {
        return symbolOf[row];
    }

    /** Length of the word at {@code row}. */
    public int lengthOf(int row) {
        if (row < 0 || row >= size())
            throw new IndexOutOfBoundsException("Row " + row + " outside [0, " + size() + ")");
        int k = 0;
        while (layerOffset[k + 1] <= row)
            k++;
        return k;
    }

    /**
     * Row of x_s η where η is at {@code parentRow}. The parent must be shorter
     * than the index depth.
     */
    public int childRow(int parentRow, int symbol) {
        int k = lengthOf(parentRow);
        if (k >= depth)
            throw new IllegalArgumentException("Word " + words[parentRow] + " has no extension at depth " + depth);
        return layerOffset[k + 1] + (parentRow - layerOffset[k]) * alphabet.size() + alphabet.positionOf(symbol);
    }

    /**
     * Row of η x_s (s appended on the right) where η is at {@code row}. Under
     * the prepend layout the appended symbol is the most significant digit of
     * the local position, so the m+1 right extensions of η are strided by the
     * size of η's layer.
     */
    public int appendRow(int row, int symbol) {
        int k = lengthOf(row);
        if (k >= depth)
            throw new IllegalArgumentException("Word " + words[row] + " has no extension at depth " + depth);
        return layerOffset[k + 1] + (row - layerOffset[k])
                + alphabet.positionOf(symbol) * (layerOffset[k + 1] - layerOffset[k]);
    }

    /** Words of layer k in row order. */
    public List<Word> words(int k) {
        checkLayer(k);
        return Collections.unmodifiableList(Arrays.asList(words).subList(layerOffset[k], layerOffset[k + 1]));
    }

    /** All words in row order. */
    public List<Word> words() {
        return Collections.unmodifiableList(Arrays.asList(words));
    }

    /**
     * Human-readable identity of this index: alphabet order and depth. Two
     * indexes with the same signature produce the same row layout.
     */
    public String signature() {
        return "alphabet=" + alphabet + ",depth=" + depth + ",rows=" + size();
    }

    private void checkLayer(int k) {
        if (k < 0 || k > depth)
            throw new IndexOutOfBoundsException("Layer " + k + " outside [0, " + depth + "]");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof WordIndex other && depth == other.depth && alphabet.equals(other.alphabet);
    }

    @Override
    public int hashCode() {
        return 31 * alphabet.hashCode() + depth;
    }

    @Override
    public String toString() {
        return "WordIndex[" + signature() + "]";
    }
}

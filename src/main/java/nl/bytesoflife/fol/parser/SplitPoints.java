package nl.bytesoflife.fol.parser;

import java.util.NoSuchElementException;

/**
 * Walks the ways to cut the token range {@code [from, to)} into {@code parts} non-empty
 * slices, as the start indices of slices 2..n in increasing lexicographic order. The first
 * slice always starts at {@code from}.
 * <p>
 * When a slice is known not to parse, {@link #skip(int)} jumps past every remaining
 * candidate that keeps that slice unchanged.
 */
final class SplitPoints {

    private final int from;
    private final int to;
    private final int cuts;
    private int[] indices;

    SplitPoints(int from, int to, int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("parts must be positive: " + parts);
        }
        this.from = from;
        this.to = to;
        this.cuts = parts - 1;
        this.indices = first();
    }

    private int[] first() {
        if (to - from < cuts + 1) return null;
        int[] first = new int[cuts];
        for (int i = 0; i < cuts; i++) {
            first[i] = from + 1 + i;
        }
        return first;
    }

    boolean isExhausted() {
        return indices == null;
    }

    /**
     * The current cut indices.
     */
    int[] cuts() {
        requireCandidate();
        return indices.clone();
    }

    /**
     * The slice boundaries of the current candidate: {@code from, cut1, ..., cutk, to}.
     */
    int[] boundaries() {
        requireCandidate();
        int[] bounds = new int[cuts + 2];
        bounds[0] = from;
        System.arraycopy(indices, 0, bounds, 1, cuts);
        bounds[bounds.length - 1] = to;
        return bounds;
    }

    /**
     * Moves to the lexicographic successor.
     */
    void next() {
        requireCandidate();
        advance(cuts - 1);
    }

    /**
     * Moves to the first later candidate in which slice {@code slice} (0-based) has other
     * boundaries.
     */
    void skip(int slice) {
        requireCandidate();
        // the last slice always ends at to, so only its start can move
        advance(Math.min(slice, cuts - 1));
    }

    private void advance(int start) {
        int i = start;
        // the i-th cut may go no further than to - (cuts - i)
        while (i >= 0 && indices[i] == to - cuts + i) {
            i--;
        }
        if (i < 0) {
            indices = null;
            return;
        }
        indices[i]++;
        for (int j = i + 1; j < cuts; j++) {
            indices[j] = indices[j - 1] + 1;
        }
    }

    private void requireCandidate() {
        if (indices == null) {
            throw new NoSuchElementException("No split left");
        }
    }
}

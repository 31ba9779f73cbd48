package io.surfworks.tsetlin.core.tensor;

import java.util.Arrays;

/**
 * Active automata of a sparse machine, clause by clause.
 *
 * <p>Each clause holds an ordered list of (automaton id, state) nodes. The id
 * numbers automata in canonical order: {@code id = literal * 2 + polarity}.
 * Automata absent from a clause's list are at the sparse floor and are not stored.
 */
public final class SparseClauseState {

    private final int numLiterals;
    private final int[][] ids;
    private final byte[][] states;

    public SparseClauseState(int numLiterals, int[][] ids, byte[][] states) {
        if (ids.length != states.length) {
            throw new IllegalArgumentException(
                    "Clause count mismatch: " + ids.length + " id lists, " + states.length + " state lists");
        }
        for (int c = 0; c < ids.length; c++) {
            if (ids[c].length != states[c].length) {
                throw new IllegalArgumentException("Clause " + c + " has " + ids[c].length
                        + " ids but " + states[c].length + " states");
            }
            for (int id : ids[c]) {
                if (id < 0 || id >= numLiterals * 2) {
                    throw new IllegalArgumentException(
                            "Automaton id " + id + " out of range for " + numLiterals + " literals");
                }
            }
        }
        this.numLiterals = numLiterals;
        this.ids = ids;
        this.states = states;
    }

    public int numClauses() {
        return ids.length;
    }

    public int numLiterals() {
        return numLiterals;
    }

    public int[] ids(int clause) {
        return ids[clause];
    }

    public byte[] states(int clause) {
        return states[clause];
    }

    /**
     * Returns the number of stored nodes per clause.
     */
    public int[] literalCounts() {
        int[] counts = new int[ids.length];
        for (int c = 0; c < ids.length; c++) {
            counts[c] = ids[c].length;
        }
        return counts;
    }

    public long totalNodes() {
        long total = 0;
        for (int[] clause : ids) {
            total += clause.length;
        }
        return total;
    }

    /**
     * Expands the lists into a dense canonical tensor, filling absent automata with {@code floor}.
     */
    public ClauseTensor toDense(byte floor) {
        ClauseTensor dense = ClauseTensor.filled(ids.length, numLiterals, floor);
        byte[] data = dense.data();
        for (int c = 0; c < ids.length; c++) {
            for (int i = 0; i < ids[c].length; i++) {
                data[c * numLiterals * 2 + ids[c][i]] = states[c][i];
            }
        }
        return dense;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SparseClauseState other)) return false;
        return numLiterals == other.numLiterals && Arrays.deepEquals(ids, other.ids)
                && Arrays.deepEquals(states, other.states);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(ids) + Arrays.deepHashCode(states);
    }
}

package io.surfworks.tsetlin.core.tensor;

import java.util.Arrays;

/**
 * Automaton states in canonical order, shape (clauses, literals, 2), signed 8-bit.
 *
 * <p>Polarity 0 is the automaton for the literal itself, polarity 1 for its negation.
 */
public final class ClauseTensor {

    private final int numClauses;
    private final int numLiterals;
    private final byte[] data;

    public ClauseTensor(int numClauses, int numLiterals, byte[] data) {
        if (numClauses < 0 || numLiterals < 0) {
            throw new IllegalArgumentException("Negative dimension: " + numClauses + " x " + numLiterals);
        }
        if (data.length != (long) numClauses * numLiterals * 2) {
            throw new IllegalArgumentException(String.format(
                    "Clause tensor data has %d elements, expected %d", data.length,
                    (long) numClauses * numLiterals * 2));
        }
        this.numClauses = numClauses;
        this.numLiterals = numLiterals;
        this.data = data;
    }

    public static ClauseTensor filled(int numClauses, int numLiterals, byte value) {
        byte[] data = new byte[numClauses * numLiterals * 2];
        Arrays.fill(data, value);
        return new ClauseTensor(numClauses, numLiterals, data);
    }

    public int numClauses() {
        return numClauses;
    }

    public int numLiterals() {
        return numLiterals;
    }

    public int[] shape() {
        return new int[] {numClauses, numLiterals, 2};
    }

    public byte get(int clause, int literal, int polarity) {
        return data[StateOrder.LITERAL_MAJOR.index(clause, literal, polarity, numLiterals)];
    }

    /**
     * Returns the backing array. Callers must not modify it.
     */
    public byte[] data() {
        return data;
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClauseTensor other)) return false;
        return numClauses == other.numClauses && numLiterals == other.numLiterals
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * numClauses + numLiterals) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ClauseTensor[" + numClauses + ", " + numLiterals + ", 2]";
    }
}

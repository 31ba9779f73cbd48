package io.surfworks.tsetlin.core.tensor;

import java.util.Arrays;

/**
 * Clause-to-class vote weights, shape (clauses, classes), signed 16-bit, row-major.
 */
public final class WeightTensor {

    private final int numClauses;
    private final int numClasses;
    private final short[] data;

    public WeightTensor(int numClauses, int numClasses, short[] data) {
        if (data.length != (long) numClauses * numClasses) {
            throw new IllegalArgumentException(String.format(
                    "Weight tensor data has %d elements, expected %d for (%d, %d)",
                    data.length, (long) numClauses * numClasses, numClauses, numClasses));
        }
        this.numClauses = numClauses;
        this.numClasses = numClasses;
        this.data = data;
    }

    public int numClauses() {
        return numClauses;
    }

    public int numClasses() {
        return numClasses;
    }

    public int[] shape() {
        return new int[] {numClauses, numClasses};
    }

    public short get(int clause, int cls) {
        return data[clause * numClasses + cls];
    }

    /**
     * Returns the backing array. Callers must not modify it.
     */
    public short[] data() {
        return data;
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightTensor other)) return false;
        return numClauses == other.numClauses && numClasses == other.numClasses
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * numClauses + numClasses) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "WeightTensor[" + numClauses + ", " + numClasses + "]";
    }
}

package io.surfworks.tsetlin.core.engine;

import java.io.Serializable;

/**
 * Argument list of the engine's create primitive, in ABI order.
 *
 * <p>The label vector size and element width describe the label buffer passed
 * to train and predict. Classifiers always pass one 32-bit label per row.
 *
 * @param numClasses       number of classes C
 * @param threshold        vote clamp T
 * @param numLiterals      number of input features
 * @param numClauses       clauses per machine
 * @param maxState         upper automaton bound
 * @param minState         lower automaton bound
 * @param boostTruePositive whether true-positive feedback is boosted
 * @param labelVectorSize  labels per row
 * @param labelElementWidth bytes per label element
 * @param sensitivity      specificity parameter s
 * @param seed             unsigned 32-bit PRNG seed, carried as an int
 */
public record CreateParams(
        int numClasses,
        int threshold,
        int numLiterals,
        int numClauses,
        byte maxState,
        byte minState,
        boolean boostTruePositive,
        int labelVectorSize,
        int labelElementWidth,
        float sensitivity,
        int seed
) implements Serializable {

    public static final int LABEL_VECTOR_SIZE = 1;
    public static final int LABEL_ELEMENT_WIDTH = Integer.BYTES;

    public CreateParams {
        if (numClasses < 1 || numLiterals < 1 || numClauses < 1) {
            throw new IllegalArgumentException(String.format(
                    "classes, literals and clauses must be positive: %d, %d, %d",
                    numClasses, numLiterals, numClauses));
        }
    }

    /**
     * Creates parameters for one 32-bit class index per row.
     */
    public static CreateParams forClassification(int numClasses, int threshold, int numLiterals, int numClauses,
                                                 byte maxState, byte minState, boolean boostTruePositive,
                                                 float sensitivity, int seed) {
        return new CreateParams(numClasses, threshold, numLiterals, numClauses, maxState, minState,
                boostTruePositive, LABEL_VECTOR_SIZE, LABEL_ELEMENT_WIDTH, sensitivity, seed);
    }

    /**
     * Returns the seed as the unsigned value the engine sees.
     */
    public long unsignedSeed() {
        return Integer.toUnsignedLong(seed);
    }
}

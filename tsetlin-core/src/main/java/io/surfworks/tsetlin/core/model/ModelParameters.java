package io.surfworks.tsetlin.core.model;

/**
 * The scalar header shared by every model file: enough to size and recreate a machine.
 *
 * @param threshold         vote clamp T
 * @param numLiterals       features per sample
 * @param numClauses        clauses per machine
 * @param numClasses        number of classes
 * @param maxState          upper automaton bound
 * @param minState          lower automaton bound
 * @param boostTruePositive true-positive feedback boost flag
 * @param sensitivity       specificity s, kept at double precision on disk
 */
public record ModelParameters(
        int threshold,
        int numLiterals,
        int numClauses,
        int numClasses,
        byte maxState,
        byte minState,
        boolean boostTruePositive,
        double sensitivity
) {

    public ModelParameters {
        if (numLiterals < 0 || numClauses < 0 || numClasses < 0) {
            throw new IllegalArgumentException(String.format(
                    "Negative dimension in parameters: literals=%d clauses=%d classes=%d",
                    numLiterals, numClauses, numClasses));
        }
    }

    public static ModelParameters of(Hyperparameters hp, int numLiterals, int numClasses) {
        return new ModelParameters(hp.threshold(), numLiterals, hp.numClauses(), numClasses,
                hp.maxState(), hp.minState(), hp.boostTruePositiveFeedback(), hp.sensitivity());
    }

    /**
     * Returns the element count of the (clauses, literals, 2) state tensor.
     */
    public long stateCount() {
        return (long) numClauses * numLiterals * 2;
    }

    /**
     * Returns the element count of the (clauses, classes) weight tensor.
     */
    public long weightCount() {
        return (long) numClauses * numClasses;
    }

    /**
     * Returns hyperparameters that recreate a machine with this header.
     */
    public Hyperparameters toHyperparameters(int epochs) {
        return Hyperparameters.builder()
                .numClauses(numClauses)
                .threshold(threshold)
                .maxState(maxState)
                .minState(minState)
                .boostTruePositiveFeedback(boostTruePositive)
                .sensitivity((float) sensitivity)
                .epochs(epochs)
                .build();
    }
}

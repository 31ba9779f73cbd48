package io.surfworks.tsetlin.core.model;

import io.surfworks.tsetlin.core.classifier.ClassifierException;

import java.io.Serializable;
import java.util.SplittableRandom;

/**
 * Immutable training configuration of a classifier.
 *
 * <p>Example usage:
 * <pre>{@code
 * Hyperparameters hp = Hyperparameters.builder()
 *     .numClauses(10)
 *     .threshold(15)
 *     .sensitivity(3.0f)
 *     .randomState(42L)
 *     .build();
 * }</pre>
 *
 * @param numClauses                clauses per machine
 * @param threshold                 vote clamp T
 * @param maxState                  upper automaton bound, signed 8-bit
 * @param minState                  lower automaton bound, signed 8-bit
 * @param boostTruePositiveFeedback true-positive feedback boost flag
 * @param sensitivity               specificity s
 * @param epochs                    passes over the data per fit
 * @param randomState               seed source; {@code null} draws a fresh seed for each machine
 */
public record Hyperparameters(
        int numClauses,
        int threshold,
        byte maxState,
        byte minState,
        boolean boostTruePositiveFeedback,
        float sensitivity,
        int epochs,
        Long randomState
) implements Serializable {

    public static final int DEFAULT_NUM_CLAUSES = 1000;
    public static final int DEFAULT_THRESHOLD = 1000;
    public static final byte DEFAULT_MAX_STATE = 127;
    public static final byte DEFAULT_MIN_STATE = -127;
    public static final float DEFAULT_SENSITIVITY = 3.0f;
    public static final int DEFAULT_EPOCHS = 10;

    public Hyperparameters {
        if (numClauses < 1) {
            throw ClassifierException.validation("numClauses must be at least 1, got " + numClauses);
        }
        if (threshold < 1) {
            throw ClassifierException.validation("threshold must be at least 1, got " + threshold);
        }
        if (minState > maxState) {
            throw ClassifierException.validation(
                    String.format("minState (%d) must not exceed maxState (%d)", minState, maxState));
        }
        if (!(sensitivity >= 1.0f) || Float.isInfinite(sensitivity)) {
            throw ClassifierException.validation("sensitivity must be a finite value >= 1.0, got " + sensitivity);
        }
        if (epochs < 1) {
            throw ClassifierException.validation("epochs must be at least 1, got " + epochs);
        }
    }

    public static Hyperparameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .numClauses(numClauses)
                .threshold(threshold)
                .maxState(maxState)
                .minState(minState)
                .boostTruePositiveFeedback(boostTruePositiveFeedback)
                .sensitivity(sensitivity)
                .epochs(epochs)
                .randomState(randomState);
    }

    public Hyperparameters withEpochs(int epochs) {
        return toBuilder().epochs(epochs).build();
    }

    public Hyperparameters withRandomState(Long randomState) {
        return toBuilder().randomState(randomState).build();
    }

    /**
     * Creates the seed generator for this configuration.
     *
     * <p>With a random state every generator yields the same seed sequence.
     */
    public SeedSequence seedSequence() {
        return new SeedSequence(randomState == null ? new SplittableRandom() : new SplittableRandom(randomState));
    }

    /**
     * Source of unsigned 32-bit engine seeds.
     */
    public static final class SeedSequence {

        private final SplittableRandom random;

        private SeedSequence(SplittableRandom random) {
            this.random = random;
        }

        /**
         * Returns the next seed, uniformly distributed over [0, 2^32), as its int bit pattern.
         */
        public int nextSeed() {
            return (int) random.nextLong(1L << 32);
        }
    }

    /**
     * Builder for Hyperparameters.
     */
    public static final class Builder {
        private int numClauses = DEFAULT_NUM_CLAUSES;
        private int threshold = DEFAULT_THRESHOLD;
        private byte maxState = DEFAULT_MAX_STATE;
        private byte minState = DEFAULT_MIN_STATE;
        private boolean boostTruePositiveFeedback = false;
        private float sensitivity = DEFAULT_SENSITIVITY;
        private int epochs = DEFAULT_EPOCHS;
        private Long randomState;

        public Builder numClauses(int numClauses) {
            this.numClauses = numClauses;
            return this;
        }

        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder maxState(int maxState) {
            this.maxState = toInt8("maxState", maxState);
            return this;
        }

        public Builder minState(int minState) {
            this.minState = toInt8("minState", minState);
            return this;
        }

        public Builder boostTruePositiveFeedback(boolean boost) {
            this.boostTruePositiveFeedback = boost;
            return this;
        }

        public Builder sensitivity(float sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder epochs(int epochs) {
            this.epochs = epochs;
            return this;
        }

        public Builder randomState(Long randomState) {
            this.randomState = randomState;
            return this;
        }

        public Hyperparameters build() {
            return new Hyperparameters(numClauses, threshold, maxState, minState,
                    boostTruePositiveFeedback, sensitivity, epochs, randomState);
        }

        private static byte toInt8(String name, int value) {
            if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE) {
                throw ClassifierException.validation(name + " must fit in a signed 8-bit integer, got " + value);
            }
            return (byte) value;
        }
    }
}

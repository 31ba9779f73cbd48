package io.surfworks.tsetlin.core.model;

import io.surfworks.tsetlin.core.classifier.ClassifierException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HyperparametersTest {

    @Test
    void defaults() {
        Hyperparameters hp = Hyperparameters.defaults();

        assertEquals(1000, hp.numClauses());
        assertEquals(1000, hp.threshold());
        assertEquals(127, hp.maxState());
        assertEquals(-127, hp.minState());
        assertFalse(hp.boostTruePositiveFeedback());
        assertEquals(3.0f, hp.sensitivity());
        assertEquals(10, hp.epochs());
        assertNull(hp.randomState());
    }

    @Nested
    class Validation {

        @Test
        void rejectsZeroClauses() {
            assertThrows(ClassifierException.class, () -> Hyperparameters.builder().numClauses(0).build());
        }

        @Test
        void rejectsInvertedStateBounds() {
            assertThrows(ClassifierException.class,
                    () -> Hyperparameters.builder().maxState(-10).minState(10).build());
        }

        @Test
        void rejectsStateOutsideInt8() {
            assertThrows(ClassifierException.class, () -> Hyperparameters.builder().maxState(128));
            assertThrows(ClassifierException.class, () -> Hyperparameters.builder().minState(-129));
        }

        @Test
        void rejectsSensitivityBelowOne() {
            assertThrows(ClassifierException.class, () -> Hyperparameters.builder().sensitivity(0.5f).build());
            assertThrows(ClassifierException.class, () -> Hyperparameters.builder().sensitivity(Float.NaN).build());
        }

        @Test
        void rejectsZeroEpochs() {
            assertThrows(ClassifierException.class, () -> Hyperparameters.builder().epochs(0).build());
        }
    }

    @Nested
    class Seeds {

        @Test
        void sameRandomStateGivesSameSeeds() {
            Hyperparameters hp = Hyperparameters.builder().randomState(42L).build();

            Hyperparameters.SeedSequence a = hp.seedSequence();
            Hyperparameters.SeedSequence b = hp.seedSequence();

            assertEquals(a.nextSeed(), b.nextSeed());
            assertEquals(a.nextSeed(), b.nextSeed());
        }

        @Test
        void differentRandomStatesDiffer() {
            int a = Hyperparameters.builder().randomState(1L).build().seedSequence().nextSeed();
            int b = Hyperparameters.builder().randomState(2L).build().seedSequence().nextSeed();

            assertNotEquals(a, b);
        }
    }

    @Test
    void toBuilderCopiesEveryField() {
        Hyperparameters hp = Hyperparameters.builder()
                .numClauses(10).threshold(15).maxState(100).minState(-100)
                .boostTruePositiveFeedback(true).sensitivity(3.9f).epochs(4).randomState(9L)
                .build();

        assertEquals(hp, hp.toBuilder().build());
        assertEquals(7, hp.withEpochs(7).epochs());
    }

    @Test
    void modelParametersRecreateHyperparameters() {
        ModelParameters params = new ModelParameters(15, 4, 10, 2, (byte) 127, (byte) -127, true, 3.0);

        Hyperparameters hp = params.toHyperparameters(5);

        assertEquals(10, hp.numClauses());
        assertEquals(15, hp.threshold());
        assertTrue(hp.boostTruePositiveFeedback());
        assertEquals(5, hp.epochs());
        assertEquals(80, params.stateCount());
        assertEquals(20, params.weightCount());
    }
}

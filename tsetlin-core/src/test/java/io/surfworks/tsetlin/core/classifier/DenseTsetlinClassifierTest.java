package io.surfworks.tsetlin.core.classifier;

import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineException;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.engine.mock.MockEngineBinding;
import io.surfworks.tsetlin.core.estimate.ModelSizeEstimator;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import io.surfworks.tsetlin.core.tensor.StateOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static io.surfworks.tsetlin.core.classifier.ClassifierFixtures.smallMachine;
import static io.surfworks.tsetlin.core.classifier.ClassifierFixtures.xorLabels;
import static io.surfworks.tsetlin.core.classifier.ClassifierFixtures.xorRows;
import static org.junit.jupiter.api.Assertions.*;

class DenseTsetlinClassifierTest {

    @TempDir
    Path tempDir;

    private MockEngineBinding engine;
    private DenseTsetlinClassifier<Integer> clf;

    @BeforeEach
    void setUp() {
        engine = new MockEngineBinding(EngineVariant.DENSE);
        clf = new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
    }

    @Nested
    @DisplayName("fit")
    class Fit {

        @Test
        @DisplayName("Smoke scenario predicts every training row")
        void predictsTrainingRows() {
            clf.fit(xorRows(), xorLabels());

            assertTrue(clf.isFitted());
            assertEquals(xorLabels(), clf.predict(xorRows()));
            assertEquals(1.0, clf.score(xorRows(), xorLabels()));
            assertEquals(List.of(0, 1), clf.classes());
            assertEquals(4, clf.numLiterals());
        }

        @Test
        void refitReplacesMachine() {
            clf.fit(xorRows(), xorLabels());
            clf.fit(xorRows(), xorLabels());

            assertEquals(2, engine.createCount());
            assertEquals(1, engine.freeCount());
            assertEquals(1, engine.liveMachines());
        }

        @Test
        void passesConfiguredEpochs() {
            clf.fit(xorRows(), xorLabels());

            assertEquals(8L * 10, engine.rowsTrained(0x1000L));
        }

        @Test
        @DisplayName("Non-binary input leaves an unbound classifier unbound")
        void nonBinaryInputKeepsUnbound() {
            ClassifierException ex = assertThrows(ClassifierException.class,
                    () -> clf.fit(BinaryMatrix.of(new int[][] {{0, 2}, {1, 0}}), List.of(0, 1)));

            assertTrue(ex.isValidation());
            assertFalse(clf.isFitted());
            assertEquals(0, engine.createCount());
        }

        @Test
        void singleClassIsRejectedBeforeTouchingMachine() {
            clf.fit(xorRows(), xorLabels());

            assertThrows(ClassifierException.class,
                    () -> clf.fit(xorRows(), List.of(1, 1, 1, 1, 1, 1, 1, 1)));

            assertTrue(clf.isFitted());
            assertEquals(1, engine.createCount());
            assertEquals(xorLabels(), clf.predict(xorRows()));
        }

        @Test
        void rowCountMismatchIsRejected() {
            assertThrows(ClassifierException.class, () -> clf.fit(xorRows(), List.of(0, 1)));
        }

        @Test
        void randomStateFixesSeed() {
            clf.fit(xorRows(), xorLabels());
            DenseTsetlinClassifier<Integer> other =
                    new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
            other.fit(xorRows(), xorLabels());

            assertEquals(clf.lastSeed(), other.lastSeed());
        }

        @Test
        void createFailureLeavesUnbound() {
            clf.fit(xorRows(), xorLabels());
            engine.failNextCreate();

            EngineException ex = assertThrows(EngineException.class, () -> clf.fit(xorRows(), xorLabels()));

            assertEquals(EngineException.ErrorCode.CREATE_FAILED, ex.errorCode());
            assertFalse(clf.isFitted());
            assertEquals(0, engine.liveMachines());
        }
    }

    @Nested
    @DisplayName("partialFit")
    class PartialFit {

        @Test
        void initializesFromClassesOnFirstCall() {
            clf.partialFit(xorRows(), xorLabels(), List.of(0, 1, 2), 1);

            assertEquals(List.of(0, 1, 2), clf.classes());
            assertTrue(clf.isFitted());
        }

        @Test
        void accumulatesTraining() {
            clf.partialFit(xorRows(), xorLabels(), null, 2);
            long machine = 0x1000L;
            assertEquals(16, engine.rowsTrained(machine));

            clf.partialFit(xorRows(), xorLabels(), List.of(0, 1), 3);

            assertEquals(16 + 24, engine.rowsTrained(machine));
            assertEquals(1, engine.createCount());
        }

        @Test
        void rejectsDifferentFeatureCount() {
            clf.partialFit(xorRows(), xorLabels());

            ClassifierException ex = assertThrows(ClassifierException.class,
                    () -> clf.partialFit(BinaryMatrix.of(new int[][] {{0, 1, 1}, {1, 0, 0}}), List.of(0, 1)));
            assertEquals("Number of features of the input must be 4, got 3", ex.getMessage());
        }

        @Test
        void rejectsReorderedClasses() {
            clf.partialFit(xorRows(), xorLabels());

            ClassifierException ex = assertThrows(ClassifierException.class,
                    () -> clf.partialFit(xorRows(), xorLabels(), List.of(1, 0), null));
            assertEquals("Provided classes do not match the classes seen during initialization.", ex.getMessage());
        }

        @Test
        void rejectsUnseenLabel() {
            clf.partialFit(xorRows(), xorLabels());

            assertThrows(ClassifierException.class,
                    () -> clf.partialFit(xorRows(), List.of(0, 1, 1, 0, 0, 1, 1, 5)));
        }

        @Test
        void initEmptyStateThenPartialFit() {
            clf.initEmptyState(4, List.of(1, 0));
            assertEquals(0, engine.rowsTrained(0x1000L));

            clf.partialFit(xorRows(), xorLabels());

            assertEquals(xorLabels(), clf.predict(xorRows()));
        }
    }

    @Nested
    @DisplayName("predict and reset")
    class PredictAndReset {

        @Test
        void predictBeforeFitIsNotFitted() {
            ClassifierException ex = assertThrows(ClassifierException.class, () -> clf.predict(xorRows()));

            assertTrue(ex.isNotFitted());
        }

        @Test
        void predictRejectsWrongWidth() {
            clf.fit(xorRows(), xorLabels());

            assertThrows(ClassifierException.class,
                    () -> clf.predict(BinaryMatrix.of(new int[][] {{0, 1}})));
        }

        @Test
        void resetIsIdempotentAndFreesOnce() {
            clf.fit(xorRows(), xorLabels());

            clf.reset();
            clf.reset();

            assertEquals(1, engine.freeCount());
            assertFalse(clf.isFitted());
            assertThrows(ClassifierException.class, clf::classes);
            assertThrows(ClassifierException.class, () -> clf.predict(xorRows()));
        }

        @Test
        void resetSwallowsFreeFailure() {
            clf.fit(xorRows(), xorLabels());
            engine.failNextFree(new IllegalStateException("engine refused"));

            assertDoesNotThrow(clf::reset);
            assertFalse(clf.isFitted());
        }

        @Test
        void closeReleasesMachine() {
            try (DenseTsetlinClassifier<Integer> scoped =
                         new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine)) {
                scoped.fit(xorRows(), xorLabels());
                assertEquals(1, engine.liveMachines());
            }
            assertEquals(0, engine.liveMachines());
        }
    }

    @Nested
    @DisplayName("State access")
    class StateAccess {

        @Test
        void snapshotRestoreRoundTrip() {
            clf.fit(xorRows(), xorLabels());
            ModelSnapshot snapshot = clf.snapshot();

            DenseTsetlinClassifier<Integer> copy =
                    new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
            copy.restore(snapshot, List.of(0, 1));

            assertEquals(snapshot.weights(), copy.snapshot().weights());
            assertEquals(snapshot.states(), copy.snapshot().states());
            assertEquals(snapshot.parameters(), copy.snapshot().parameters());
        }

        @Test
        void snapshotIsCanonicalRegardlessOfEngineOrder() {
            MockEngineBinding polarityMajor = new MockEngineBinding(EngineVariant.DENSE, StateOrder.POLARITY_MAJOR);
            DenseTsetlinClassifier<Integer> a =
                    new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
            DenseTsetlinClassifier<Integer> b = new DenseTsetlinClassifier<>(smallMachine(),
                    EngineConfig.mock().withStateOrder(StateOrder.POLARITY_MAJOR), polarityMajor);
            a.fit(xorRows(), xorLabels());
            b.fit(xorRows(), xorLabels());

            assertEquals(a.snapshot().states(), b.snapshot().states());
        }

        @Test
        void restoreRejectsWrongClassCount() {
            clf.fit(xorRows(), xorLabels());
            ModelSnapshot snapshot = clf.snapshot();

            assertThrows(ClassifierException.class, () -> clf.restore(snapshot, List.of(0, 1, 2)));
        }

        @Test
        void estimateModelSizeUsesBoundShape() {
            clf.fit(xorRows(), xorLabels());

            assertEquals(ModelSizeEstimator.dense(10, 4, 2), clf.estimateModelSize());
        }

        @Test
        void estimateBeforeFitIsNotFitted() {
            assertThrows(ClassifierException.class, clf::estimateModelSize);
        }
    }

    @Nested
    @DisplayName("Engine-native persistence")
    class NativePersistence {

        @Test
        void saveAndLoadNative() throws IOException {
            clf.fit(xorRows(), xorLabels());
            Path file = tempDir.resolve("model.bin");

            clf.saveNative(file);
            DenseTsetlinClassifier<Integer> loaded =
                    new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
            loaded.loadNative(file, List.of(0, 1));

            assertTrue(Files.size(file) > 0);
            assertEquals(clf.snapshot().states(), loaded.snapshot().states());
            assertEquals(clf.snapshot().weights(), loaded.snapshot().weights());
            assertEquals(4, loaded.numLiterals());
        }

        @Test
        void selfDescribingRoundTrip() throws IOException {
            clf.fit(xorRows(), xorLabels());
            Path file = tempDir.resolve("model.fbs");

            clf.saveNativeSelfDescribing(file);
            DenseTsetlinClassifier<Integer> loaded =
                    new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
            loaded.loadNativeSelfDescribing(file, List.of(0, 1));

            assertEquals(xorLabels(), loaded.predict(xorRows()));
        }

        @Test
        @DisplayName("A loaded file with invalid parameters leaves the bound machine in place")
        void invalidLoadedHeaderKeepsCurrentMachine() throws IOException {
            clf.fit(xorRows(), xorLabels());
            Path file = tempDir.resolve("low-s.bin");
            clf.saveNative(file);
            byte[] bytes = Files.readAllBytes(file);
            ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putDouble(19, 0.5);
            Files.write(file, bytes);
            int live = engine.liveMachines();

            ClassifierException ex = assertThrows(ClassifierException.class,
                    () -> clf.loadNative(file, List.of(0, 1)));

            assertTrue(ex.isValidation());
            assertTrue(clf.isFitted());
            assertEquals(live, engine.liveMachines());
            assertEquals(List.of(0, 1), clf.classes());
            assertEquals(smallMachine(), clf.hyperparameters());
            assertEquals(xorLabels(), clf.predict(xorRows()));
        }

        @Test
        void classCountMismatchOnLoadKeepsCurrentMachine() throws IOException {
            clf.fit(xorRows(), xorLabels());
            Path file = tempDir.resolve("model.bin");
            clf.saveNative(file);
            int live = engine.liveMachines();

            assertThrows(ClassifierException.class, () -> clf.loadNative(file, List.of(0, 1, 2)));

            assertTrue(clf.isFitted());
            assertEquals(live, engine.liveMachines());
            assertEquals(xorLabels(), clf.predict(xorRows()));
        }

        @Test
        void missingPrimitiveIsUnsupported() {
            MockEngineBinding bare = new MockEngineBinding(EngineVariant.DENSE, StateOrder.POLARITY_MAJOR,
                    EnumSet.of(EngineCapability.READ_STATE));
            DenseTsetlinClassifier<Integer> limited =
                    new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), bare);
            limited.fit(xorRows(), xorLabels());

            EngineException ex = assertThrows(EngineException.class,
                    () -> limited.saveNativeSelfDescribing(tempDir.resolve("x.fbs")));

            assertEquals(EngineException.ErrorCode.NOT_SUPPORTED, ex.errorCode());
            assertFalse(Files.exists(tempDir.resolve("x.fbs")));
            assertThrows(EngineException.class, () -> limited.restore(limited.snapshot(), List.of(0, 1)));
        }

        @Test
        void loadRejectsLabelCountMismatchAndFreesLoadedMachine() throws IOException {
            clf.fit(xorRows(), xorLabels());
            Path file = tempDir.resolve("model.bin");
            clf.saveNative(file);
            int live = engine.liveMachines();

            DenseTsetlinClassifier<Integer> loaded =
                    new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
            assertThrows(ClassifierException.class, () -> loaded.loadNative(file, List.of(0, 1, 2)));

            assertEquals(live, engine.liveMachines());
            assertFalse(loaded.isFitted());
        }
    }
}

package io.surfworks.tsetlin.data.store;

import io.surfworks.tsetlin.core.classifier.BinaryMatrix;
import io.surfworks.tsetlin.core.classifier.DenseTsetlinClassifier;
import io.surfworks.tsetlin.core.classifier.SparseTsetlinClassifier;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.engine.mock.MockEngineBinding;
import io.surfworks.tsetlin.core.model.Hyperparameters;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import io.surfworks.tsetlin.core.model.SparseModelSnapshot;
import io.surfworks.tsetlin.core.tensor.StateOrder;
import io.surfworks.tsetlin.data.format.ModelFormat;
import io.surfworks.tsetlin.data.format.ModelFormatException;
import io.surfworks.tsetlin.data.format.RawBinaryFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelStoreTest {

    @TempDir
    Path tempDir;

    private final ModelStore store = ModelStore.defaults();
    private DenseTsetlinClassifier<String> trained;

    private static Hyperparameters hyperparameters() {
        return Hyperparameters.builder()
                .numClauses(10)
                .threshold(15)
                .sensitivity(3.0f)
                .epochs(5)
                .randomState(7L)
                .build();
    }

    private static BinaryMatrix rows() {
        return BinaryMatrix.of(new int[][] {
                {0, 0, 1, 0}, {0, 1, 1, 0}, {1, 0, 0, 1}, {1, 1, 0, 1},
        });
    }

    private static DenseTsetlinClassifier<String> dense(MockEngineBinding engine) {
        return new DenseTsetlinClassifier<>(hyperparameters(), EngineConfig.mock(), engine);
    }

    @BeforeEach
    void setUp() {
        trained = dense(new MockEngineBinding(EngineVariant.DENSE));
        trained.fit(rows(), List.of("no", "yes", "yes", "no"));
    }

    @Nested
    @DisplayName("Dense classifiers")
    class Dense {

        @Test
        void rawRoundTripRestoresTensors() throws IOException {
            Path file = tempDir.resolve("model.bin");
            store.save(trained, file, ModelFormat.RAW);

            DenseTsetlinClassifier<String> loaded = dense(new MockEngineBinding(EngineVariant.DENSE));
            store.load(loaded, file, ModelFormat.RAW, List.of("no", "yes"));

            ModelSnapshot expected = trained.snapshot();
            ModelSnapshot actual = loaded.snapshot();
            assertEquals(expected.parameters(), actual.parameters());
            assertEquals(expected.weights(), actual.weights());
            assertEquals(expected.states(), actual.states());
            assertEquals(List.of("no", "yes"), loaded.classes());
            assertEquals(4, loaded.numLiterals());
        }

        @Test
        @DisplayName("A model reloaded from a raw file predicts like the one that was saved")
        void rawRoundTripPreservesPredictions() throws IOException {
            Path file = tempDir.resolve("model.bin");
            store.save(trained, file, ModelFormat.RAW);

            DenseTsetlinClassifier<String> loaded = dense(new MockEngineBinding(EngineVariant.DENSE));
            store.load(loaded, file, ModelFormat.RAW, List.of("no", "yes"));

            assertEquals(List.of("no", "yes", "yes", "no"), trained.predict(rows()));
            assertEquals(trained.predict(rows()), loaded.predict(rows()));
        }

        @Test
        @DisplayName("A model reloaded from a self-describing file predicts like the one that was saved")
        void selfDescribingRoundTripPreservesPredictions() throws IOException {
            Path file = tempDir.resolve("model.fbs");
            store.save(trained, file, ModelFormat.SELF_DESCRIBING);

            DenseTsetlinClassifier<String> loaded = dense(new MockEngineBinding(EngineVariant.DENSE));
            store.load(loaded, file, ModelFormat.SELF_DESCRIBING, List.of("no", "yes"));

            assertEquals(trained.predict(rows()), loaded.predict(rows()));
        }

        @Test
        void selfDescribingRoundTripRestoresTensors() throws IOException {
            Path file = tempDir.resolve("model.fbs");
            store.save(trained, file, ModelFormat.SELF_DESCRIBING);

            DenseTsetlinClassifier<String> loaded = dense(new MockEngineBinding(EngineVariant.DENSE));
            store.load(loaded, file, ModelFormat.SELF_DESCRIBING, List.of("no", "yes"));

            assertEquals(trained.snapshot().states(), loaded.snapshot().states());
            assertEquals(trained.snapshot().weights(), loaded.snapshot().weights());
        }

        @Test
        @DisplayName("Engines without tensor writes load through a staged raw file")
        void stagedLoadWithoutWriteState() throws IOException {
            Path file = tempDir.resolve("model.bin");
            store.save(trained, file, ModelFormat.RAW);
            EnumSet<EngineCapability> caps = EnumSet.allOf(EngineCapability.class);
            caps.remove(EngineCapability.WRITE_STATE);
            MockEngineBinding readOnly = new MockEngineBinding(EngineVariant.DENSE, StateOrder.POLARITY_MAJOR, caps);

            DenseTsetlinClassifier<String> loaded = dense(readOnly);
            store.load(loaded, file, ModelFormat.RAW, List.of("no", "yes"));

            assertEquals(trained.snapshot().states(), loaded.snapshot().states());
            assertEquals(trained.predict(rows()), loaded.predict(rows()));
            assertEquals(1, readOnly.liveMachines());
        }

        @Test
        void engineOrderDoesNotLeakIntoFiles() throws IOException {
            DenseTsetlinClassifier<String> polarityMajor = dense(
                    new MockEngineBinding(EngineVariant.DENSE, StateOrder.POLARITY_MAJOR));
            polarityMajor.fit(rows(), List.of("no", "yes", "yes", "no"));
            Path file = tempDir.resolve("model.bin");
            store.save(polarityMajor, file, ModelFormat.RAW);

            ModelSnapshot onDisk = RawBinaryFormat.aligned().read(file);

            assertEquals(polarityMajor.snapshot().states(), onDisk.states());
        }

        @Test
        void classCountMustMatchFile() throws IOException {
            Path file = tempDir.resolve("model.bin");
            store.save(trained, file, ModelFormat.RAW);

            DenseTsetlinClassifier<String> loaded = dense(new MockEngineBinding(EngineVariant.DENSE));
            assertThrows(RuntimeException.class,
                    () -> store.load(loaded, file, ModelFormat.RAW, List.of("a", "b", "c")));
            assertFalse(loaded.isFitted());
        }

        @Test
        void convertRawToSelfDescribing() throws IOException {
            Path raw = tempDir.resolve("model.bin");
            Path fbs = tempDir.resolve("model.fbs");
            store.save(trained, raw, ModelFormat.RAW);

            store.convert(raw, ModelFormat.RAW, fbs, ModelFormat.SELF_DESCRIBING);

            assertEquals(store.readSnapshot(raw, ModelFormat.RAW).states(),
                    store.readSnapshot(fbs, ModelFormat.SELF_DESCRIBING).states());
            assertEquals(trained.snapshot().parameters().numClauses(),
                    store.readParameters(fbs, ModelFormat.SELF_DESCRIBING).numClauses());
        }
    }

    @Nested
    @DisplayName("Sparse classifiers")
    class Sparse {

        @Test
        @DisplayName("Loading a dense file keeps only automata at or above the middle state")
        void loadsDenseFile() throws IOException {
            Path file = tempDir.resolve("model.bin");
            store.save(trained, file, ModelFormat.RAW);
            ModelSnapshot source = trained.snapshot();

            SparseTsetlinClassifier<String> sparse = new SparseTsetlinClassifier<>(
                    hyperparameters(), EngineConfig.mock(), new MockEngineBinding(EngineVariant.SPARSE));
            store.load(sparse, file, ModelFormat.RAW, List.of("no", "yes"));

            SparseModelSnapshot snapshot = sparse.sparseSnapshot();
            long active = 0;
            for (byte state : source.states().data()) {
                if (state >= 0) {
                    active++;
                }
            }
            assertEquals(active, snapshot.states().totalNodes());
            assertEquals(source.weights(), snapshot.weights());
            assertEquals(trained.predict(rows()), sparse.predict(rows()));
        }

        @Test
        void sparseFileRoundTrip() throws IOException {
            SparseTsetlinClassifier<String> sparse = new SparseTsetlinClassifier<>(
                    hyperparameters(), EngineConfig.mock(), new MockEngineBinding(EngineVariant.SPARSE));
            sparse.fit(rows(), List.of("no", "yes", "yes", "no"));
            Path file = tempDir.resolve("model.sbin");

            store.save(sparse, file);

            ModelSnapshot expanded = store.readSnapshot(file, ModelFormat.SPARSE_RAW);
            assertEquals(sparse.sparseSnapshot().toDense(), expanded);
        }

        @Test
        void sparseFilesCannotBeLoaded() {
            SparseTsetlinClassifier<String> sparse = new SparseTsetlinClassifier<>(
                    hyperparameters(), EngineConfig.mock(), new MockEngineBinding(EngineVariant.SPARSE));

            assertThrows(ModelFormatException.class,
                    () -> store.load(sparse, tempDir.resolve("x.sbin"), ModelFormat.SPARSE_RAW, List.of("a", "b")));
        }
    }

    @Test
    void formatFromExtension() {
        assertEquals(ModelFormat.SELF_DESCRIBING, ModelFormat.fromPath(Path.of("m.FBS")));
        assertEquals(ModelFormat.SPARSE_RAW, ModelFormat.fromPath(Path.of("m.sbin")));
        assertEquals(ModelFormat.RAW, ModelFormat.fromPath(Path.of("m.bin")));
        assertEquals(ModelFormat.RAW, ModelFormat.fromPath(Path.of("model")));
        assertEquals(ModelFormat.SELF_DESCRIBING, ModelFormat.parse("fbs"));
        assertThrows(IllegalArgumentException.class, () -> ModelFormat.parse("onnx"));
    }
}

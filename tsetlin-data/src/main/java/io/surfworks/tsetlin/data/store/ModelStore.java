package io.surfworks.tsetlin.data.store;

import io.surfworks.tsetlin.core.classifier.DenseTsetlinClassifier;
import io.surfworks.tsetlin.core.classifier.SparseTsetlinClassifier;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import io.surfworks.tsetlin.data.format.ModelFormat;
import io.surfworks.tsetlin.data.format.ModelFormatException;
import io.surfworks.tsetlin.data.format.RawBinaryFormat;
import io.surfworks.tsetlin.data.format.SelfDescribingFormat;
import io.surfworks.tsetlin.data.format.SparseBinaryFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Saves classifiers to model files and loads them back.
 *
 * <p>Dense classifiers are written from {@link DenseTsetlinClassifier#snapshot()} and
 * restored with {@link DenseTsetlinClassifier#restore}. When the engine cannot write
 * tensors directly, and always for sparse classifiers, the snapshot is staged as an
 * engine-readable raw file and handed to the engine's own loader.
 */
public final class ModelStore {

    private static final Logger LOG = Logger.getLogger(ModelStore.class.getName());

    private final RawBinaryFormat raw;
    private final SparseBinaryFormat sparse;
    private final SelfDescribingFormat selfDescribing;

    public ModelStore(RawBinaryFormat raw, SparseBinaryFormat sparse, SelfDescribingFormat selfDescribing) {
        this.raw = raw;
        this.sparse = sparse;
        this.selfDescribing = selfDescribing;
    }

    /**
     * Aligned raw files, standard sparse files, FlatBuffers without derived literal names.
     */
    public static ModelStore defaults() {
        return new ModelStore(RawBinaryFormat.aligned(), SparseBinaryFormat.standard(),
                SelfDescribingFormat.standard());
    }

    public RawBinaryFormat rawFormat() {
        return raw;
    }

    public SelfDescribingFormat selfDescribingFormat() {
        return selfDescribing;
    }

    // ==================== Dense ====================

    public void save(DenseTsetlinClassifier<?> classifier, Path path, ModelFormat format) throws IOException {
        ModelSnapshot snapshot = classifier.snapshot();
        write(snapshot, path, format);
        LOG.fine(() -> "Saved " + format + " model to " + path);
    }

    /**
     * Loads a dense model into {@code classifier}, replacing whatever it held.
     *
     * @param classes class labels in index order; their count must match the file
     */
    public <L extends Comparable<? super L>> void load(DenseTsetlinClassifier<L> classifier, Path path,
            ModelFormat format, List<? extends L> classes) throws IOException {
        ModelSnapshot snapshot = readSnapshot(path, format);
        if (classifier.engine().supports(EngineCapability.WRITE_STATE)) {
            classifier.restore(snapshot, classes);
        } else {
            LOG.fine("Engine cannot write tensors; loading through the engine's raw loader");
            withStagedFile(snapshot, staged -> classifier.loadNative(staged, classes));
        }
    }

    // ==================== Sparse ====================

    public void save(SparseTsetlinClassifier<?> classifier, Path path) throws IOException {
        sparse.write(classifier.sparseSnapshot(), path);
        LOG.fine(() -> "Saved sparse model to " + path);
    }

    /**
     * Loads a dense model file (raw or self-describing) into a sparse classifier.
     * Automata below the middle state are dropped by the engine.
     */
    public <L extends Comparable<? super L>> void load(SparseTsetlinClassifier<L> classifier, Path path,
            ModelFormat format, List<? extends L> classes) throws IOException {
        if (format == ModelFormat.SPARSE_RAW) {
            throw new ModelFormatException(
                    "Sparse node-list files cannot be loaded into an engine; load a dense model file instead");
        }
        ModelSnapshot snapshot = readSnapshot(path, format);
        withStagedFile(snapshot, staged -> classifier.loadDense(staged, classes));
    }

    // ==================== Files ====================

    /**
     * Reads a dense snapshot. {@link ModelFormat#SPARSE_RAW} files are expanded to dense.
     */
    public ModelSnapshot readSnapshot(Path path, ModelFormat format) throws IOException {
        return switch (format) {
            case RAW -> raw.read(path);
            case SPARSE_RAW -> sparse.read(path).toDense();
            case SELF_DESCRIBING -> selfDescribing.read(path);
        };
    }

    public ModelParameters readParameters(Path path, ModelFormat format) throws IOException {
        return switch (format) {
            case RAW -> raw.readHeader(path);
            case SPARSE_RAW -> sparse.read(path).parameters();
            case SELF_DESCRIBING -> selfDescribing.read(path).parameters();
        };
    }

    public void write(ModelSnapshot snapshot, Path path, ModelFormat format) throws IOException {
        switch (format) {
            case RAW -> raw.write(snapshot, path);
            case SELF_DESCRIBING -> selfDescribing.write(snapshot, path);
            case SPARSE_RAW -> throw new ModelFormatException(
                    "Dense snapshots cannot be written as sparse node lists; save a sparse classifier instead");
        }
    }

    /**
     * Rewrites a model file in another format.
     */
    public void convert(Path source, ModelFormat from, Path target, ModelFormat to) throws IOException {
        write(readSnapshot(source, from), target, to);
    }

    @FunctionalInterface
    private interface StagedLoad {
        void load(Path staged);
    }

    private static void withStagedFile(ModelSnapshot snapshot, StagedLoad load) throws IOException {
        Path staged = Files.createTempFile("tsetlin-model-", ".bin");
        try {
            RawBinaryFormat.packed().write(snapshot, staged);
            load.load(staged);
        } finally {
            try {
                Files.deleteIfExists(staged);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to delete staged model file " + staged, e);
            }
        }
    }
}

package io.surfworks.tsetlin.core.classifier;

import io.surfworks.tsetlin.core.engine.CreateParams;
import io.surfworks.tsetlin.core.engine.EngineBinding;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineException;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.engine.Engines;
import io.surfworks.tsetlin.core.engine.NativeHandle;
import io.surfworks.tsetlin.core.estimate.SizeBreakdown;
import io.surfworks.tsetlin.core.model.Hyperparameters;
import io.surfworks.tsetlin.core.model.LabelMapping;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.util.AtomicFiles;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Owns one native machine and drives it through fit, incremental training,
 * prediction and reset.
 *
 * <p>A classifier is either <em>unbound</em> (no machine) or <em>bound</em>
 * (a live machine plus the label mapping it was created with). The mapping
 * and machine are always replaced together.
 *
 * <h2>Cross-process use</h2>
 * <p>Classifiers are {@link Serializable}. The engine binding and the machine
 * are not: after deserialization the classifier keeps its hyperparameters,
 * labels and literal count but holds no machine, and the engine is re-opened
 * from the saved {@link EngineConfig} on first use. Persist trained state with
 * the model codecs, not with Java serialization.
 *
 * <h2>Thread safety</h2>
 * <p>Not thread-safe. Callers serialize access.
 *
 * @param <L> label type
 */
public abstract class TsetlinClassifier<L extends Comparable<? super L>> implements Serializable, AutoCloseable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = Logger.getLogger(TsetlinClassifier.class.getName());

    private Hyperparameters hyperparameters;
    private final EngineConfig engineConfig;

    private LabelMapping<L> mapping;
    private int numLiterals;
    private Integer lastSeed;

    private transient EngineBinding binding;
    private transient NativeHandle handle;
    private transient Hyperparameters.SeedSequence seeds;

    protected TsetlinClassifier(Hyperparameters hyperparameters, EngineConfig engineConfig, EngineBinding binding) {
        this.hyperparameters = Objects.requireNonNull(hyperparameters, "hyperparameters");
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
        if (binding != null && binding.variant() != variant()) {
            throw new IllegalArgumentException(
                    "Binding drives the " + binding.variant() + " engine, expected " + variant());
        }
        this.binding = binding;
    }

    /**
     * Returns the engine variant this classifier binds to.
     */
    public abstract EngineVariant variant();

    /**
     * Estimates the native memory held by the bound machine.
     */
    public abstract SizeBreakdown estimateModelSize();

    // ==================== Lifecycle ====================

    /**
     * Trains a fresh machine on {@code x} and {@code y}, replacing any current one.
     *
     * <p>Input is validated before the current machine is touched: on a
     * validation failure the classifier is unchanged.
     *
     * @throws ClassifierException with {@code VALIDATION} if the input is rejected
     */
    public void fit(BinaryMatrix x, List<? extends L> y) {
        checkRows(x, y);
        LabelMapping<L> newMapping = LabelMapping.fit(y);
        int[] encoded = newMapping.encode(y);

        bind(x.columns(), newMapping);
        engine().train(handle.address(), x.data(), encoded, x.rows(), hyperparameters.epochs());
        LOG.fine(() -> String.format("Fitted %s machine on %d rows x %d literals, %d classes, %d epochs",
                variant(), x.rows(), x.columns(), newMapping.size(), hyperparameters.epochs()));
    }

    /**
     * Creates an untrained machine for {@code numLiterals} features and the full class list.
     *
     * @throws ClassifierException with {@code VALIDATION} if fewer than two classes are given
     */
    public void initEmptyState(int numLiterals, List<? extends L> classes) {
        if (numLiterals < 1) {
            throw ClassifierException.validation("numLiterals must be at least 1, got " + numLiterals);
        }
        bind(numLiterals, LabelMapping.fit(classes));
    }

    /**
     * Trains incrementally. An unbound classifier is first initialised from
     * {@code classes}, or from the distinct labels of {@code y} when
     * {@code classes} is null.
     *
     * @param classes full class list, or null
     * @param epochs  epochs for this call, or null for the configured count
     * @throws ClassifierException with {@code VALIDATION} if the feature count
     *         or classes disagree with the bound machine, or a label is unseen
     */
    public void partialFit(BinaryMatrix x, List<? extends L> y, List<? extends L> classes, Integer epochs) {
        checkRows(x, y);
        int epochsToUse = epochs == null ? hyperparameters.epochs() : epochs;
        if (epochsToUse < 1) {
            throw ClassifierException.validation("epochs must be at least 1, got " + epochsToUse);
        }

        int[] encoded;
        if (!isFitted()) {
            LabelMapping<L> newMapping = LabelMapping.fit(classes != null ? classes : y);
            encoded = newMapping.encode(y);
            bind(x.columns(), newMapping);
        } else {
            if (x.columns() != numLiterals) {
                throw ClassifierException.featureMismatch(numLiterals, x.columns());
            }
            if (classes != null && !mapping.matches(classes)) {
                throw ClassifierException.classesMismatch();
            }
            encoded = mapping.encode(y);
        }

        engine().train(handle.address(), x.data(), encoded, x.rows(), epochsToUse);
    }

    /**
     * Trains incrementally with the configured epoch count and no explicit class list.
     */
    public void partialFit(BinaryMatrix x, List<? extends L> y) {
        partialFit(x, y, null, null);
    }

    /**
     * Predicts one label per row.
     *
     * @throws ClassifierException with {@code NOT_FITTED} if no machine is bound
     */
    public List<L> predict(BinaryMatrix x) {
        requireFitted("predict");
        if (x.columns() != numLiterals) {
            throw ClassifierException.featureMismatch(numLiterals, x.columns());
        }
        int[] indices = engine().predict(handle.address(), x.data(), x.rows());
        return mapping.decode(indices);
    }

    /**
     * Returns the fraction of rows whose prediction equals {@code y}.
     */
    public double score(BinaryMatrix x, List<? extends L> y) {
        checkRows(x, y);
        List<L> predicted = predict(x);
        int correct = 0;
        for (int i = 0; i < predicted.size(); i++) {
            if (predicted.get(i).equals(y.get(i))) {
                correct++;
            }
        }
        return (double) correct / predicted.size();
    }

    /**
     * Releases the machine and forgets the labels. Free failures are logged. Idempotent.
     */
    public void reset() {
        releaseHandle();
        mapping = null;
        numLiterals = 0;
        lastSeed = null;
    }

    @Override
    public void close() {
        reset();
    }

    // ==================== Engine-native persistence ====================

    /**
     * Saves the bound machine with the engine's raw save primitive.
     *
     * @throws EngineException with {@code NOT_SUPPORTED} if the engine does not export it
     */
    public void saveNative(Path path) throws IOException {
        requireFitted("saveNative");
        requireCapability(EngineCapability.SAVE_NATIVE, "save");
        long address = handle.address();
        AtomicFiles.writeVia(path, temp -> engine().save(address, temp));
    }

    /**
     * Replaces the bound machine with one loaded by the engine's raw load primitive.
     *
     * @param classes labels for class indices 0..C-1, in order
     */
    public void loadNative(Path path, List<? extends L> classes) {
        requireCapability(EngineCapability.LOAD_NATIVE, variant() == EngineVariant.SPARSE ? "load_dense" : "load");
        adoptLoaded(engine().load(path), classes);
    }

    /**
     * Saves the bound machine with the engine's self-describing save primitive.
     */
    public void saveNativeSelfDescribing(Path path) throws IOException {
        requireFitted("saveNativeSelfDescribing");
        requireCapability(EngineCapability.SAVE_SELF_DESCRIBING, "save_fbs");
        long address = handle.address();
        AtomicFiles.writeVia(path, temp -> engine().saveSelfDescribing(address, temp));
    }

    /**
     * Replaces the bound machine with one loaded by the engine's self-describing load primitive.
     */
    public void loadNativeSelfDescribing(Path path, List<? extends L> classes) {
        requireCapability(EngineCapability.LOAD_SELF_DESCRIBING, "load_fbs");
        adoptLoaded(engine().loadSelfDescribing(path), classes);
    }

    // ==================== Accessors ====================

    public boolean isFitted() {
        return handle != null && handle.isLive();
    }

    public Hyperparameters hyperparameters() {
        return hyperparameters;
    }

    public EngineConfig engineConfig() {
        return engineConfig;
    }

    /**
     * Returns the sorted class labels.
     *
     * @throws ClassifierException with {@code NOT_FITTED} if no labels are known
     */
    public List<L> classes() {
        if (mapping == null) {
            throw ClassifierException.notFitted("classes");
        }
        return mapping.classes();
    }

    public LabelMapping<L> labelMapping() {
        return mapping;
    }

    /**
     * Returns the literal count of the bound machine, or 0 when no labels are known.
     */
    public int numLiterals() {
        return numLiterals;
    }

    /**
     * Returns the seed handed to the engine for the current machine, or null.
     */
    public Integer lastSeed() {
        return lastSeed;
    }

    /**
     * Returns the engine binding, opening it on first use.
     *
     * @throws EngineException with {@code LINK_FAILED} if the engine cannot be opened
     */
    public EngineBinding engine() {
        if (binding == null) {
            binding = Engines.load(engineConfig, variant());
        }
        return binding;
    }

    // ==================== Subclass support ====================

    /**
     * Returns the live machine address.
     *
     * @throws ClassifierException with {@code NOT_FITTED} if no machine is bound
     */
    protected long machine(String operation) {
        requireFitted(operation);
        return handle.address();
    }

    protected void requireFitted(String operation) {
        if (!isFitted()) {
            throw ClassifierException.notFitted(operation);
        }
    }

    protected void requireCapability(EngineCapability capability, String primitive) {
        if (!engine().supports(capability)) {
            throw EngineException.notSupported(variant(), primitive);
        }
    }

    /**
     * Creates a fresh machine sized by {@code params} and binds it with {@code newMapping}.
     *
     * @return the new machine address
     */
    protected long bind(ModelParameters params, LabelMapping<L> newMapping) {
        if (params.numClasses() != newMapping.size()) {
            throw ClassifierException.validation(String.format(
                    "Model has %d classes but %d labels were supplied", params.numClasses(), newMapping.size()));
        }
        bind(params.numLiterals(), newMapping, loadedHyperparameters(params));
        return handle.address();
    }

    // ==================== Internals ====================

    private void bind(int literals, LabelMapping<L> newMapping) {
        bind(literals, newMapping, hyperparameters);
    }

    private void bind(int literals, LabelMapping<L> newMapping, Hyperparameters settings) {
        EngineBinding engine = engine();
        releaseHandle();
        mapping = null;

        int seed = nextSeed();
        CreateParams params = CreateParams.forClassification(
                newMapping.size(),
                settings.threshold(),
                literals,
                settings.numClauses(),
                settings.maxState(),
                settings.minState(),
                settings.boostTruePositiveFeedback(),
                settings.sensitivity(),
                seed);
        handle = NativeHandle.adopt(engine, engine.create(params));
        hyperparameters = settings;
        mapping = newMapping;
        numLiterals = literals;
        lastSeed = seed;
    }

    /**
     * Takes ownership of a machine produced by an engine load primitive. The
     * loaded header and the class list are validated before the current
     * machine is released; on failure the loaded machine is freed and the
     * classifier keeps its current state.
     */
    private void adoptLoaded(long address, List<? extends L> classes) {
        NativeHandle loaded = NativeHandle.adopt(engine(), address);
        ModelParameters params;
        LabelMapping<L> newMapping;
        Hyperparameters settings;
        try {
            params = engine().readParameters(address);
            newMapping = LabelMapping.fit(classes);
            if (newMapping.size() != params.numClasses()) {
                throw ClassifierException.validation(String.format(
                        "Loaded model has %d classes but %d labels were supplied",
                        params.numClasses(), newMapping.size()));
            }
            settings = loadedHyperparameters(params);
        } catch (RuntimeException e) {
            loaded.close();
            throw e;
        }
        releaseHandle();
        handle = loaded;
        mapping = newMapping;
        numLiterals = params.numLiterals();
        lastSeed = null;
        hyperparameters = settings;
        LOG.fine(() -> String.format("Loaded %s machine: %d clauses, %d literals, %d classes",
                variant(), params.numClauses(), params.numLiterals(), params.numClasses()));
    }

    private Hyperparameters loadedHyperparameters(ModelParameters params) {
        return params.toHyperparameters(hyperparameters.epochs())
                .withRandomState(hyperparameters.randomState());
    }

    private void releaseHandle() {
        NativeHandle current = handle;
        handle = null;
        if (current != null) {
            current.close();
        }
    }

    private int nextSeed() {
        if (seeds == null) {
            seeds = hyperparameters.seedSequence();
        }
        return seeds.nextSeed();
    }

    private static void checkRows(BinaryMatrix x, List<?> y) {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        if (x.rows() != y.size()) {
            throw ClassifierException.validation(String.format(
                    "Found input variables with inconsistent numbers of samples: [%d, %d]", x.rows(), y.size()));
        }
    }

    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        binding = null;
        handle = null;
        seeds = null;
    }
}

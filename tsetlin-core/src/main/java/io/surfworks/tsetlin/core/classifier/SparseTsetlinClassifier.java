package io.surfworks.tsetlin.core.classifier;

import io.surfworks.tsetlin.core.engine.EngineBinding;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.estimate.ModelSizeEstimator;
import io.surfworks.tsetlin.core.estimate.SizeBreakdown;
import io.surfworks.tsetlin.core.model.Hyperparameters;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.model.SparseModelSnapshot;
import io.surfworks.tsetlin.core.tensor.SparseClauseState;
import io.surfworks.tsetlin.core.tensor.WeightTensor;

import java.nio.file.Path;
import java.util.List;

/**
 * Classifier over the sparse engine, whose machines keep only active automata
 * in per-clause lists.
 *
 * <p>Sparse machines cannot be written into from Java. They are rebuilt from
 * files through the engine's own loaders, one of which reads the dense raw layout.
 *
 * @param <L> label type
 */
public class SparseTsetlinClassifier<L extends Comparable<? super L>> extends TsetlinClassifier<L> {

    private static final long serialVersionUID = 1L;

    public SparseTsetlinClassifier(Hyperparameters hyperparameters) {
        this(hyperparameters, EngineConfig.fromSystemProperties());
    }

    public SparseTsetlinClassifier(Hyperparameters hyperparameters, EngineConfig engineConfig) {
        super(hyperparameters, engineConfig, null);
    }

    public SparseTsetlinClassifier(Hyperparameters hyperparameters, EngineConfig engineConfig, EngineBinding binding) {
        super(hyperparameters, engineConfig, binding);
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.SPARSE;
    }

    /**
     * Estimates from the live machine's list lengths.
     */
    @Override
    public SizeBreakdown estimateModelSize() {
        long machine = machine("estimateModelSize");
        requireCapability(EngineCapability.READ_STATE, "read_state");
        SparseClauseState states = engine().readSparseStates(machine);
        return ModelSizeEstimator.sparse(states.literalCounts(), classes().size());
    }

    /**
     * Copies the bound machine's header, weights and active automata.
     */
    public SparseModelSnapshot sparseSnapshot() {
        long machine = machine("sparseSnapshot");
        requireCapability(EngineCapability.READ_STATE, "read_state");
        EngineBinding engine = engine();
        ModelParameters params = engine.readParameters(machine);
        WeightTensor weights = new WeightTensor(params.numClauses(), params.numClasses(), engine.readWeights(machine));
        return new SparseModelSnapshot(params, weights, engine.readSparseStates(machine));
    }

    /**
     * Replaces the bound machine with one built by the engine from a dense raw
     * model file. Automata below the engine's activity threshold are dropped.
     *
     * @param classes labels for class indices 0..C-1, in order
     */
    public void loadDense(Path path, List<? extends L> classes) {
        loadNative(path, classes);
    }
}

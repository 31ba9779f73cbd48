package io.surfworks.tsetlin.core.classifier;

import io.surfworks.tsetlin.core.engine.EngineBinding;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.estimate.ModelSizeEstimator;
import io.surfworks.tsetlin.core.estimate.SizeBreakdown;
import io.surfworks.tsetlin.core.model.Hyperparameters;
import io.surfworks.tsetlin.core.model.LabelMapping;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import io.surfworks.tsetlin.core.tensor.ClauseTensor;
import io.surfworks.tsetlin.core.tensor.TensorLayout;
import io.surfworks.tsetlin.core.tensor.WeightTensor;

import java.util.List;

/**
 * Classifier over the dense engine, whose machines keep every automaton in a flat array.
 *
 * <p>Besides the lifecycle inherited from {@link TsetlinClassifier}, dense
 * machines can be copied out as a {@link ModelSnapshot} and rebuilt from one,
 * which is how the model codecs persist them.
 *
 * @param <L> label type
 */
public class DenseTsetlinClassifier<L extends Comparable<? super L>> extends TsetlinClassifier<L> {

    private static final long serialVersionUID = 1L;

    /**
     * Uses the engine selected by {@code tsetlin.engine.*} system properties.
     */
    public DenseTsetlinClassifier(Hyperparameters hyperparameters) {
        this(hyperparameters, EngineConfig.fromSystemProperties());
    }

    public DenseTsetlinClassifier(Hyperparameters hyperparameters, EngineConfig engineConfig) {
        super(hyperparameters, engineConfig, null);
    }

    /**
     * Uses an already opened binding. After deserialization the engine is re-opened from {@code engineConfig}.
     */
    public DenseTsetlinClassifier(Hyperparameters hyperparameters, EngineConfig engineConfig, EngineBinding binding) {
        super(hyperparameters, engineConfig, binding);
    }

    @Override
    public EngineVariant variant() {
        return EngineVariant.DENSE;
    }

    /**
     * Estimates from the hyperparameters and bound shape; no engine call is made.
     */
    @Override
    public SizeBreakdown estimateModelSize() {
        LabelMapping<L> mapping = labelMapping();
        if (mapping == null) {
            throw ClassifierException.notFitted("estimateModelSize");
        }
        return ModelSizeEstimator.dense(hyperparameters().numClauses(), numLiterals(), mapping.size());
    }

    /**
     * Copies the bound machine's header, weights and states, states in canonical order.
     */
    public ModelSnapshot snapshot() {
        long machine = machine("snapshot");
        requireCapability(EngineCapability.READ_STATE, "read_state");
        EngineBinding engine = engine();
        ModelParameters params = engine.readParameters(machine);
        WeightTensor weights = new WeightTensor(params.numClauses(), params.numClasses(), engine.readWeights(machine));
        ClauseTensor states = TensorLayout.toCanonical(engine.readStates(machine),
                params.numClauses(), params.numLiterals(), engine.stateOrder());
        return new ModelSnapshot(params, weights, states);
    }

    /**
     * Replaces the bound machine with a fresh one holding the snapshot's tensors.
     *
     * @param classes labels for class indices 0..C-1, in order
     */
    public void restore(ModelSnapshot snapshot, List<? extends L> classes) {
        requireCapability(EngineCapability.WRITE_STATE, "write_state");
        ModelParameters params = snapshot.parameters();
        if (params.numLiterals() < 1 || params.numClauses() < 1) {
            throw ClassifierException.validation("Cannot restore a model with no literals or clauses");
        }
        long machine = bind(params, LabelMapping.fit(classes));
        EngineBinding engine = engine();
        engine.writeWeights(machine, snapshot.weights().data());
        engine.writeStates(machine, TensorLayout.fromCanonical(snapshot.states(), engine.stateOrder()));
    }
}

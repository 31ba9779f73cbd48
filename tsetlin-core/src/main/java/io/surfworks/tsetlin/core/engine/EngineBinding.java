package io.surfworks.tsetlin.core.engine;

import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.tensor.SparseClauseState;
import io.surfworks.tsetlin.core.tensor.StateOrder;

import java.nio.file.Path;
import java.util.Set;

/**
 * Typed view of one variant of a native Tsetlin Machine engine.
 *
 * <p>Machines are identified by the raw address the engine returned from
 * create or load. Addresses are never zero; callers own them and must release
 * each exactly once through {@link #free(long)} (normally via {@link NativeHandle}).
 *
 * <p>Bindings do no locking. A single machine must not be used from two
 * threads at once.
 *
 * <p>Operations tied to an {@link EngineCapability} throw
 * {@link EngineException} with {@code NOT_SUPPORTED} when the capability is absent.
 */
public interface EngineBinding {

    /**
     * Returns the machine flavour this binding drives.
     */
    EngineVariant variant();

    /**
     * Returns a short name for logs, e.g. {@code "jna"} or {@code "mock"}.
     */
    String backendName();

    /**
     * Returns the optional features the loaded library provides.
     */
    Set<EngineCapability> capabilities();

    default boolean supports(EngineCapability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Returns the memory order of the dense state tensor inside a live machine.
     */
    StateOrder stateOrder();

    // ==================== Mandatory primitives ====================

    /**
     * Creates a machine.
     *
     * @return non-zero machine address
     * @throws EngineException with {@code CREATE_FAILED} if the engine returns null
     */
    long create(CreateParams params);

    /**
     * Trains in place.
     *
     * @param machine machine address
     * @param x       row-major rows x literals matrix of 0/1 bytes
     * @param y       one class index per row
     * @param rows    number of rows
     * @param epochs  passes over the rows
     */
    void train(long machine, byte[] x, int[] y, int rows, int epochs);

    /**
     * Predicts class indices for {@code rows} rows of {@code x}.
     */
    int[] predict(long machine, byte[] x, int rows);

    /**
     * Releases a machine. The address must not be used afterwards.
     */
    void free(long machine);

    // ==================== Optional primitives ====================

    /**
     * Writes the engine's raw model file.
     */
    void save(long machine, Path path);

    /**
     * Creates a machine from a raw model file. The sparse variant reads the dense layout.
     *
     * @throws EngineException with {@code LOAD_FAILED} if the engine returns null
     */
    long load(Path path);

    /**
     * Writes the engine's self-describing model file.
     */
    void saveSelfDescribing(long machine, Path path);

    /**
     * Creates a machine from a self-describing model file.
     */
    long loadSelfDescribing(Path path);

    // ==================== Direct state access ====================

    /**
     * Reads the header scalars out of a live machine.
     */
    ModelParameters readParameters(long machine);

    /**
     * Copies the (clauses, classes) weights out of a live machine.
     */
    short[] readWeights(long machine);

    /**
     * Copies the dense automaton states out of a live machine, in {@link #stateOrder()}.
     */
    byte[] readStates(long machine);

    /**
     * Walks the per-clause lists of a live sparse machine.
     */
    SparseClauseState readSparseStates(long machine);

    /**
     * Overwrites the weights of a live machine.
     */
    void writeWeights(long machine, short[] weights);

    /**
     * Overwrites the dense automaton states of a live machine; {@code states} is in {@link #stateOrder()}.
     */
    void writeStates(long machine, byte[] states);
}

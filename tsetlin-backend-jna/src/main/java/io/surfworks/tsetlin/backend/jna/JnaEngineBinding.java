package io.surfworks.tsetlin.backend.jna;

import com.sun.jna.Function;
import com.sun.jna.Memory;
import com.sun.jna.Native;
import com.sun.jna.Pointer;
import io.surfworks.tsetlin.core.engine.CreateParams;
import io.surfworks.tsetlin.core.engine.EngineBinding;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineException;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.tensor.SparseClauseState;
import io.surfworks.tsetlin.core.tensor.StateOrder;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link EngineBinding} over the native engine library, called through JNA.
 *
 * <p>Direct state access reads and writes the machine struct in place through
 * {@link DenseMachineStruct} and {@link SparseMachineStruct}.
 */
public final class JnaEngineBinding implements EngineBinding {

    private static final Logger LOG = Logger.getLogger(JnaEngineBinding.class.getName());

    private final EngineVariant variant;
    private final EngineFunctions functions;
    private final StateOrder stateOrder;
    private final Set<EngineCapability> capabilities;

    JnaEngineBinding(EngineVariant variant, EngineFunctions functions, StateOrder stateOrder) {
        this.variant = variant;
        this.functions = functions;
        this.stateOrder = stateOrder;

        Set<EngineCapability> caps = EnumSet.of(EngineCapability.READ_STATE);
        caps.addAll(functions.persistenceCapabilities());
        if (variant == EngineVariant.DENSE) {
            caps.add(EngineCapability.WRITE_STATE);
        }
        this.capabilities = Collections.unmodifiableSet(caps);
        LOG.fine(() -> variant + " engine capabilities: " + capabilities);
    }

    @Override
    public EngineVariant variant() {
        return variant;
    }

    @Override
    public String backendName() {
        return "jna";
    }

    @Override
    public Set<EngineCapability> capabilities() {
        return capabilities;
    }

    @Override
    public StateOrder stateOrder() {
        return stateOrder;
    }

    // ==================== Mandatory primitives ====================

    @Override
    public long create(CreateParams p) {
        Pointer machine = functions.create.invokePointer(new Object[] {
                p.numClasses(), p.threshold(), p.numLiterals(), p.numClauses(),
                p.maxState(), p.minState(), (byte) (p.boostTruePositive() ? 1 : 0),
                p.labelVectorSize(), p.labelElementWidth(), p.sensitivity(), p.seed()
        });
        if (machine == null) {
            throw EngineException.createFailed(variant);
        }
        return Pointer.nativeValue(machine);
    }

    @Override
    public void train(long machine, byte[] x, int[] y, int rows, int epochs) {
        Memory xs = bytes(x);
        Memory ys = ints(y);
        functions.train.invokeVoid(new Object[] {new Pointer(machine), xs, ys, rows, epochs});
    }

    @Override
    public int[] predict(long machine, byte[] x, int rows) {
        Memory xs = bytes(x);
        Memory out = new Memory((long) Math.max(rows, 1) * Integer.BYTES);
        out.clear();
        functions.predict.invokeVoid(new Object[] {new Pointer(machine), xs, out, rows});
        return out.getIntArray(0, rows);
    }

    @Override
    public void free(long machine) {
        functions.free.invokeVoid(new Object[] {new Pointer(machine)});
    }

    // ==================== Optional primitives ====================

    @Override
    public void save(long machine, Path path) {
        require(functions.save, "save").invokeVoid(new Object[] {new Pointer(machine), path.toString()});
    }

    @Override
    public long load(Path path) {
        Function load = functions.load;
        if (load == null) {
            throw EngineException.notSupported(variant, variant == EngineVariant.SPARSE ? "load_dense" : "load");
        }
        return loaded(load.invokePointer(new Object[] {
                path.toString(), CreateParams.LABEL_VECTOR_SIZE, CreateParams.LABEL_ELEMENT_WIDTH
        }), functions.loadSymbol(), path);
    }

    @Override
    public void saveSelfDescribing(long machine, Path path) {
        require(functions.saveSelfDescribing, "save_fbs")
                .invokeVoid(new Object[] {new Pointer(machine), path.toString()});
    }

    @Override
    public long loadSelfDescribing(Path path) {
        Function load = require(functions.loadSelfDescribing, "load_fbs");
        return loaded(load.invokePointer(new Object[] {
                path.toString(), CreateParams.LABEL_VECTOR_SIZE, CreateParams.LABEL_ELEMENT_WIDTH
        }), variant.symbol("load_fbs"), path);
    }

    // ==================== Direct state access ====================

    @Override
    public ModelParameters readParameters(long machine) {
        if (variant == EngineVariant.DENSE) {
            DenseMachineStruct tm = new DenseMachineStruct(new Pointer(machine));
            return new ModelParameters(tm.threshold, tm.numLiterals, tm.numClauses, tm.numClasses,
                    tm.maxState, tm.minState, tm.boostTruePositiveFeedback != 0, tm.s);
        }
        SparseMachineStruct stm = new SparseMachineStruct(new Pointer(machine));
        return new ModelParameters(stm.threshold, stm.numLiterals, stm.numClauses, stm.numClasses,
                stm.maxState, stm.minState, stm.boostTruePositiveFeedback != 0, stm.s);
    }

    @Override
    public short[] readWeights(long machine) {
        ModelParameters p = readParameters(machine);
        return weightsPointer(machine).getShortArray(0, Math.toIntExact(p.weightCount()));
    }

    @Override
    public byte[] readStates(long machine) {
        DenseMachineStruct tm = dense(machine, "read_state");
        return tm.taState.getByteArray(0, Math.toIntExact((long) tm.numClauses * tm.numLiterals * 2));
    }

    @Override
    public SparseClauseState readSparseStates(long machine) {
        if (variant != EngineVariant.SPARSE) {
            throw EngineException.notSupported(variant, "read_sparse_state");
        }
        SparseMachineStruct stm = new SparseMachineStruct(new Pointer(machine));
        int automata = stm.numLiterals * 2;
        int[][] ids = new int[stm.numClauses][];
        byte[][] states = new byte[stm.numClauses][];
        int[] idBuf = new int[automata];
        byte[] stateBuf = new byte[automata];

        for (int c = 0; c < stm.numClauses; c++) {
            Pointer node = stm.taState.getPointer((long) c * Native.POINTER_SIZE);
            int count = 0;
            while (node != null) {
                if (count == automata) {
                    throw new EngineException("Clause " + c + " list is longer than its " + automata + " automata",
                            EngineException.ErrorCode.UNKNOWN);
                }
                StateNodeStruct n = new StateNodeStruct(node);
                idBuf[count] = n.taId;
                stateBuf[count] = n.taState;
                count++;
                node = n.next;
            }
            ids[c] = Arrays.copyOf(idBuf, count);
            states[c] = Arrays.copyOf(stateBuf, count);
        }
        return new SparseClauseState(stm.numLiterals, ids, states);
    }

    @Override
    public void writeWeights(long machine, short[] weights) {
        DenseMachineStruct tm = dense(machine, "write_state");
        checkLength("weights", weights.length, (long) tm.numClauses * tm.numClasses);
        tm.weights.write(0, weights, 0, weights.length);
    }

    @Override
    public void writeStates(long machine, byte[] states) {
        DenseMachineStruct tm = dense(machine, "write_state");
        checkLength("states", states.length, (long) tm.numClauses * tm.numLiterals * 2);
        tm.taState.write(0, states, 0, states.length);
    }

    // ==================== Internals ====================

    private Function require(Function function, String primitive) {
        if (function == null) {
            throw EngineException.notSupported(variant, primitive);
        }
        return function;
    }

    private static long loaded(Pointer machine, String symbol, Path path) {
        if (machine == null) {
            throw EngineException.loadFailed(symbol, path.toString());
        }
        return Pointer.nativeValue(machine);
    }

    private DenseMachineStruct dense(long machine, String primitive) {
        if (variant != EngineVariant.DENSE) {
            throw EngineException.notSupported(variant, primitive);
        }
        return new DenseMachineStruct(new Pointer(machine));
    }

    private Pointer weightsPointer(long machine) {
        if (variant == EngineVariant.DENSE) {
            return new DenseMachineStruct(new Pointer(machine)).weights;
        }
        return new SparseMachineStruct(new Pointer(machine)).weights;
    }

    private static void checkLength(String what, int actual, long expected) {
        if (actual != expected) {
            throw new IllegalArgumentException(String.format("Expected %d %s, got %d", expected, what, actual));
        }
    }

    private static Memory bytes(byte[] data) {
        Memory memory = new Memory(Math.max(data.length, 1));
        memory.write(0, data, 0, data.length);
        return memory;
    }

    private static Memory ints(int[] data) {
        Memory memory = new Memory((long) Math.max(data.length, 1) * Integer.BYTES);
        memory.write(0, data, 0, data.length);
        return memory;
    }
}

package io.surfworks.tsetlin.core.engine.mock;

import io.surfworks.tsetlin.core.engine.CreateParams;
import io.surfworks.tsetlin.core.engine.EngineBinding;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineException;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.tensor.SparseClauseState;
import io.surfworks.tsetlin.core.tensor.StateOrder;
import io.surfworks.tsetlin.core.tensor.TensorLayout;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * In-process engine for tests and for machines without the native library.
 *
 * <p>Each machine memorizes training rows as clause patterns in its state
 * tensor and votes with its weight tensor, so a machine rebuilt from saved
 * weights and states predicts exactly as the one that was saved. The mock
 * keeps its dense states in the order given at construction.
 *
 * <p>Raw model files use the engine's packed layout: the dense variant writes
 * canonical states, the sparse variant writes its node lists, and both variants
 * load the dense layout. Self-describing files written by the mock are
 * Java-serialized and readable only by the mock.
 */
public final class MockEngineBinding implements EngineBinding {

    private static final Logger LOG = Logger.getLogger(MockEngineBinding.class.getName());

    private static final String SELF_DESCRIBING_MAGIC = "mock-tm-fbs";

    private final EngineVariant variant;
    private final StateOrder stateOrder;
    private final Set<EngineCapability> capabilities;

    private final Map<Long, Machine> machines = new ConcurrentHashMap<>();
    private final AtomicLong nextAddress = new AtomicLong(0x1000L);
    private final AtomicInteger createCount = new AtomicInteger();
    private final AtomicInteger freeCount = new AtomicInteger();
    private volatile RuntimeException nextFreeFailure;
    private volatile boolean failNextCreate;

    public MockEngineBinding(EngineVariant variant) {
        this(variant, EngineConfig.DEFAULT_STATE_ORDER);
    }

    public MockEngineBinding(EngineVariant variant, StateOrder stateOrder) {
        this(variant, stateOrder, defaultCapabilities(variant));
    }

    public MockEngineBinding(EngineVariant variant, StateOrder stateOrder, Set<EngineCapability> capabilities) {
        this.variant = variant;
        this.stateOrder = stateOrder;
        this.capabilities = capabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    /**
     * Returns every capability the variant can offer. The sparse variant cannot accept written states.
     */
    public static Set<EngineCapability> defaultCapabilities(EngineVariant variant) {
        EnumSet<EngineCapability> caps = EnumSet.allOf(EngineCapability.class);
        if (variant == EngineVariant.SPARSE) {
            caps.remove(EngineCapability.WRITE_STATE);
        }
        return caps;
    }

    @Override
    public EngineVariant variant() {
        return variant;
    }

    @Override
    public String backendName() {
        return "mock";
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
    public long create(CreateParams params) {
        if (failNextCreate) {
            failNextCreate = false;
            throw EngineException.createFailed(variant);
        }
        Machine machine = new Machine(params);
        long address = nextAddress.getAndAdd(0x100L);
        machines.put(address, machine);
        createCount.incrementAndGet();
        LOG.fine(() -> String.format("Created mock %s machine 0x%x (%d clauses, %d literals, %d classes)",
                variant, address, params.numClauses(), params.numLiterals(), params.numClasses()));
        return address;
    }

    @Override
    public void train(long machine, byte[] x, int[] y, int rows, int epochs) {
        machine(machine).train(x, y, rows, epochs, stateOrder);
    }

    @Override
    public int[] predict(long machine, byte[] x, int rows) {
        return machine(machine).predict(x, rows, stateOrder);
    }

    @Override
    public void free(long machine) {
        RuntimeException failure = nextFreeFailure;
        if (failure != null) {
            nextFreeFailure = null;
            throw failure;
        }
        if (machines.remove(machine) == null) {
            throw new IllegalStateException(String.format("Double free of mock machine 0x%x", machine));
        }
        freeCount.incrementAndGet();
    }

    // ==================== Optional primitives ====================

    @Override
    public void save(long machine, Path path) {
        require(EngineCapability.SAVE_NATIVE, "save");
        Machine m = machine(machine);
        try {
            if (variant == EngineVariant.SPARSE) {
                MockModelFiles.writeSparse(path, m.params, m.weights, m.activeAutomata(stateOrder));
            } else {
                MockModelFiles.writeDense(path, m.params, m.weights, m.canonicalStates(stateOrder));
            }
        } catch (IOException e) {
            throw new EngineException("Mock engine failed to write " + path, EngineException.ErrorCode.UNKNOWN, e);
        }
    }

    @Override
    public long load(Path path) {
        String primitive = variant == EngineVariant.SPARSE ? "load_dense" : "load";
        require(EngineCapability.LOAD_NATIVE, primitive);
        MockModelFiles.DenseFile file;
        try {
            file = MockModelFiles.readDense(path);
        } catch (IOException e) {
            throw new EngineException(variant.symbol(primitive) + " failed for " + path,
                    EngineException.ErrorCode.LOAD_FAILED, e);
        }
        if (file == null) {
            throw EngineException.loadFailed(variant.symbol(primitive), path.toString());
        }
        Machine m = new Machine(file.params());
        System.arraycopy(file.weights(), 0, m.weights, 0, m.weights.length);
        byte[] states = TensorLayout.permute(file.canonicalStates(), file.params().numClauses(),
                file.params().numLiterals(), StateOrder.LITERAL_MAJOR, stateOrder);
        System.arraycopy(states, 0, m.states, 0, m.states.length);
        return adopt(m);
    }

    @Override
    public void saveSelfDescribing(long machine, Path path) {
        require(EngineCapability.SAVE_SELF_DESCRIBING, "save_fbs");
        writeSerialized(SELF_DESCRIBING_MAGIC, machine(machine), path);
    }

    @Override
    public long loadSelfDescribing(Path path) {
        require(EngineCapability.LOAD_SELF_DESCRIBING, "load_fbs");
        return adopt(readSerialized(SELF_DESCRIBING_MAGIC, path, variant.symbol("load_fbs")));
    }

    // ==================== Direct state access ====================

    @Override
    public ModelParameters readParameters(long machine) {
        require(EngineCapability.READ_STATE, "read_state");
        Machine m = machine(machine);
        CreateParams p = m.params;
        return new ModelParameters(p.threshold(), p.numLiterals(), p.numClauses(), p.numClasses(),
                p.maxState(), p.minState(), p.boostTruePositive(), p.sensitivity());
    }

    @Override
    public short[] readWeights(long machine) {
        require(EngineCapability.READ_STATE, "read_state");
        return machine(machine).weights.clone();
    }

    @Override
    public byte[] readStates(long machine) {
        require(EngineCapability.READ_STATE, "read_state");
        requireVariant(EngineVariant.DENSE, "readStates");
        return machine(machine).states.clone();
    }

    @Override
    public SparseClauseState readSparseStates(long machine) {
        require(EngineCapability.READ_STATE, "read_state");
        requireVariant(EngineVariant.SPARSE, "readSparseStates");
        return machine(machine).activeAutomata(stateOrder);
    }

    @Override
    public void writeWeights(long machine, short[] weights) {
        require(EngineCapability.WRITE_STATE, "write_state");
        Machine m = machine(machine);
        if (weights.length != m.weights.length) {
            throw new IllegalArgumentException("Expected " + m.weights.length + " weights, got " + weights.length);
        }
        System.arraycopy(weights, 0, m.weights, 0, weights.length);
    }

    @Override
    public void writeStates(long machine, byte[] states) {
        require(EngineCapability.WRITE_STATE, "write_state");
        requireVariant(EngineVariant.DENSE, "writeStates");
        Machine m = machine(machine);
        if (states.length != m.states.length) {
            throw new IllegalArgumentException("Expected " + m.states.length + " states, got " + states.length);
        }
        System.arraycopy(states, 0, m.states, 0, states.length);
    }

    // ==================== Test hooks ====================

    /**
     * Makes the next {@link #free(long)} throw {@code failure} without releasing anything.
     */
    public void failNextFree(RuntimeException failure) {
        this.nextFreeFailure = failure;
    }

    /**
     * Makes the next {@link #create(CreateParams)} report a null machine.
     */
    public void failNextCreate() {
        this.failNextCreate = true;
    }

    public int liveMachines() {
        return machines.size();
    }

    public int createCount() {
        return createCount.get();
    }

    public int freeCount() {
        return freeCount.get();
    }

    public boolean isLive(long machine) {
        return machines.containsKey(machine);
    }

    /**
     * Returns the total rows seen by a machine, counting every epoch.
     */
    public long rowsTrained(long machine) {
        return machine(machine).rowsTrained;
    }

    public int lastSeed(long machine) {
        return machine(machine).params.seed();
    }

    // ==================== Internals ====================

    private Machine machine(long address) {
        Machine m = machines.get(address);
        if (m == null) {
            throw new IllegalStateException(String.format("Unknown or freed mock machine 0x%x", address));
        }
        return m;
    }

    private void require(EngineCapability capability, String primitive) {
        if (!capabilities.contains(capability)) {
            throw EngineException.notSupported(variant, primitive);
        }
    }

    private void requireVariant(EngineVariant expected, String operation) {
        if (variant != expected) {
            throw new EngineException(operation + " is not available on the " + variant + " engine",
                    EngineException.ErrorCode.NOT_SUPPORTED);
        }
    }

    private long adopt(Machine machine) {
        long address = nextAddress.getAndAdd(0x100L);
        machines.put(address, machine);
        createCount.incrementAndGet();
        return address;
    }

    private static void writeSerialized(String magic, Machine machine, Path path) {
        try (OutputStream out = Files.newOutputStream(path);
             ObjectOutputStream oos = new ObjectOutputStream(out)) {
            oos.writeUTF(magic);
            oos.writeObject(machine);
        } catch (IOException e) {
            throw new EngineException("Mock engine failed to write " + path, EngineException.ErrorCode.UNKNOWN, e);
        }
    }

    private static Machine readSerialized(String magic, Path path, String primitive) {
        try (InputStream in = Files.newInputStream(path);
             ObjectInputStream ois = new ObjectInputStream(in)) {
            if (!magic.equals(ois.readUTF())) {
                throw EngineException.loadFailed(primitive, path.toString());
            }
            return (Machine) ois.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new EngineException(primitive + " failed for " + path, EngineException.ErrorCode.LOAD_FAILED, e);
        }
    }

    /**
     * A memorizing clause machine. An automaton at or above the mid state is
     * an include. Training writes each unseen row into a free clause as a
     * pattern of includes and votes with that clause's weight for the row's
     * class. Prediction reads only the weights and states: clauses whose
     * includes all hold vote with their weights, and when none fires the
     * clauses with the fewest violated includes vote instead.
     */
    private static final class Machine implements Serializable {
        private static final long serialVersionUID = 2L;

        private final CreateParams params;
        private final short[] weights;
        private final byte[] states;
        private long rowsTrained;

        Machine(CreateParams params) {
            this.params = params;
            this.weights = new short[params.numClauses() * params.numClasses()];
            this.states = new byte[params.numClauses() * params.numLiterals() * 2];
            SplittableRandom random = new SplittableRandom(params.unsignedSeed());
            for (int i = 0; i < weights.length; i++) {
                weights[i] = (short) (random.nextBoolean() ? 1 : -1);
            }
            Arrays.fill(states, excludeState());
        }

        byte midState() {
            return (byte) ((params.maxState() + params.minState()) / 2);
        }

        private byte excludeState() {
            return (byte) Math.max(params.minState(), midState() - 1);
        }

        void train(byte[] x, int[] y, int rows, int epochs, StateOrder order) {
            for (int e = 0; e < epochs; e++) {
                for (int r = 0; r < rows; r++) {
                    int cls = y[r];
                    if (cls < 0 || cls >= params.numClasses()) {
                        throw new IllegalArgumentException("Class index " + cls + " out of range");
                    }
                    int clause = firingClause(x, r, order);
                    if (clause >= 0) {
                        reinforce(clause, x, r, order);
                    } else {
                        clause = unusedClause(order);
                        if (clause >= 0) {
                            memorize(clause, x, r, order);
                        } else {
                            clause = nearestClause(x, r, order);
                        }
                    }
                    int w = clause * params.numClasses() + cls;
                    weights[w] = (short) Math.min(Short.MAX_VALUE, weights[w] + 1);
                    rowsTrained++;
                }
            }
        }

        int[] predict(byte[] x, int rows, StateOrder order) {
            int classes = params.numClasses();
            int[] out = new int[rows];
            long[] votes = new long[classes];
            for (int r = 0; r < rows; r++) {
                Arrays.fill(votes, 0L);
                int best = Integer.MAX_VALUE;
                for (int c = 0; c < params.numClauses(); c++) {
                    if (!isUsed(c, order)) {
                        continue;
                    }
                    int distance = violations(c, x, r, order);
                    if (distance < best) {
                        best = distance;
                        Arrays.fill(votes, 0L);
                    }
                    if (distance == best) {
                        for (int k = 0; k < classes; k++) {
                            votes[k] += weights[c * classes + k];
                        }
                    }
                }
                out[r] = argmax(votes);
            }
            return out;
        }

        byte[] canonicalStates(StateOrder order) {
            return TensorLayout.permute(states, params.numClauses(), params.numLiterals(),
                    order, StateOrder.LITERAL_MAJOR);
        }

        SparseClauseState activeAutomata(StateOrder order) {
            int clauses = params.numClauses();
            int literals = params.numLiterals();
            byte mid = midState();
            int[][] ids = new int[clauses][];
            byte[][] active = new byte[clauses][];
            for (int c = 0; c < clauses; c++) {
                int count = 0;
                int[] idBuf = new int[literals * 2];
                byte[] stateBuf = new byte[literals * 2];
                for (int id = 0; id < literals * 2; id++) {
                    byte state = states[order.index(c, id / 2, id % 2, literals)];
                    if (state >= mid) {
                        idBuf[count] = id;
                        stateBuf[count] = state;
                        count++;
                    }
                }
                ids[c] = Arrays.copyOf(idBuf, count);
                active[c] = Arrays.copyOf(stateBuf, count);
            }
            return new SparseClauseState(literals, ids, active);
        }

        private boolean isUsed(int clause, StateOrder order) {
            int literals = params.numLiterals();
            byte mid = midState();
            for (int l = 0; l < literals; l++) {
                for (int p = 0; p < 2; p++) {
                    if (states[order.index(clause, l, p, literals)] >= mid) {
                        return true;
                    }
                }
            }
            return false;
        }

        // Polarity 0 is the literal itself, polarity 1 its negation.
        private int violations(int clause, byte[] x, int row, StateOrder order) {
            int literals = params.numLiterals();
            byte mid = midState();
            int count = 0;
            for (int l = 0; l < literals; l++) {
                int falsePolarity = x[row * literals + l] == 1 ? 1 : 0;
                if (states[order.index(clause, l, falsePolarity, literals)] >= mid) {
                    count++;
                }
            }
            return count;
        }

        private int firingClause(byte[] x, int row, StateOrder order) {
            for (int c = 0; c < params.numClauses(); c++) {
                if (isUsed(c, order) && violations(c, x, row, order) == 0) {
                    return c;
                }
            }
            return -1;
        }

        private int unusedClause(StateOrder order) {
            for (int c = 0; c < params.numClauses(); c++) {
                if (!isUsed(c, order)) {
                    return c;
                }
            }
            return -1;
        }

        private int nearestClause(byte[] x, int row, StateOrder order) {
            int best = 0;
            int bestDistance = Integer.MAX_VALUE;
            for (int c = 0; c < params.numClauses(); c++) {
                int distance = violations(c, x, row, order);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = c;
                }
            }
            return best;
        }

        private void memorize(int clause, byte[] x, int row, StateOrder order) {
            int literals = params.numLiterals();
            for (int l = 0; l < literals; l++) {
                int truePolarity = x[row * literals + l] == 1 ? 0 : 1;
                states[order.index(clause, l, truePolarity, literals)] = midState();
                states[order.index(clause, l, 1 - truePolarity, literals)] = excludeState();
            }
            Arrays.fill(weights, clause * params.numClasses(), (clause + 1) * params.numClasses(), (short) 0);
        }

        private void reinforce(int clause, byte[] x, int row, StateOrder order) {
            int literals = params.numLiterals();
            byte mid = midState();
            for (int l = 0; l < literals; l++) {
                int truePolarity = x[row * literals + l] == 1 ? 0 : 1;
                int include = order.index(clause, l, truePolarity, literals);
                if (states[include] >= mid) {
                    states[include] = (byte) Math.min(params.maxState(), states[include] + 1);
                }
                int exclude = order.index(clause, l, 1 - truePolarity, literals);
                if (states[exclude] < mid) {
                    states[exclude] = (byte) Math.max(params.minState(), states[exclude] - 1);
                }
            }
        }

        private static int argmax(long[] votes) {
            int best = 0;
            for (int i = 1; i < votes.length; i++) {
                if (votes[i] > votes[best]) {
                    best = i;
                }
            }
            return best;
        }
    }
}

package io.surfworks.tsetlin.data.format;

import com.google.flatbuffers.FlatBufferBuilder;
import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import io.surfworks.tsetlin.core.tensor.ClauseTensor;
import io.surfworks.tsetlin.core.tensor.WeightTensor;
import io.surfworks.tsetlin.core.util.AtomicFiles;

import java.io.IOException;
import java.io.InputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * FlatBuffers model container, namespace {@code TsetlinMachine}.
 *
 * <pre>
 * table Parameters {
 *   threshold: uint32; n_literals: uint32; n_clauses: uint32; n_classes: uint32;
 *   max_state: int8; min_state: int8; boost_tp: uint8; learn_s: float32;
 * }
 * table ClauseWeightsTensor   { weights: [int16]; shape: [uint32]; }
 * table AutomatonStatesTensor { states: [int8];   shape: [uint32]; }
 * table Model {
 *   params: Parameters; automaton_states: AutomatonStatesTensor;
 *   clause_weights: ClauseWeightsTensor; literal_names: [string];
 * }
 * root_type Model;
 * </pre>
 *
 * <p>Each tensor carries its own shape. The reader sizes tensors from those
 * shapes and rejects files whose shapes disagree with the parameters or with
 * the data length. States are stored in canonical (clauses, literals, 2) order.
 *
 * <p>Writing goes through {@link FlatBufferBuilder}; reading goes through the
 * {@link com.google.flatbuffers.Table} accessors in {@link ModelTables}.
 */
public final class SelfDescribingFormat {

    private static final Logger LOG = Logger.getLogger(SelfDescribingFormat.class.getName());

    // Model slots
    static final int MODEL_PARAMS = 0;
    static final int MODEL_AUTOMATON_STATES = 1;
    static final int MODEL_CLAUSE_WEIGHTS = 2;
    static final int MODEL_LITERAL_NAMES = 3;

    // Parameters slots
    static final int PARAM_THRESHOLD = 0;
    static final int PARAM_N_LITERALS = 1;
    static final int PARAM_N_CLAUSES = 2;
    static final int PARAM_N_CLASSES = 3;
    static final int PARAM_MAX_STATE = 4;
    static final int PARAM_MIN_STATE = 5;
    static final int PARAM_BOOST_TP = 6;
    static final int PARAM_LEARN_S = 7;

    // Tensor slots, shared by both tensor tables
    static final int TENSOR_DATA = 0;
    static final int TENSOR_SHAPE = 1;

    private final boolean writeLiteralNames;

    private SelfDescribingFormat(boolean writeLiteralNames) {
        this.writeLiteralNames = writeLiteralNames;
    }

    /**
     * Writes literal names only when the snapshot carries them.
     */
    public static SelfDescribingFormat standard() {
        return new SelfDescribingFormat(false);
    }

    /**
     * Always writes literal names, deriving {@code "Literal i"} when the snapshot has none.
     */
    public static SelfDescribingFormat withLiteralNames() {
        return new SelfDescribingFormat(true);
    }

    // ==================== Writing ====================

    public void write(ModelSnapshot snapshot, Path path) throws IOException {
        byte[] bytes = encode(snapshot);
        AtomicFiles.write(path, out -> out.write(bytes));
    }

    /**
     * Encodes a snapshot as a finished FlatBuffer.
     */
    public byte[] encode(ModelSnapshot snapshot) {
        ModelParameters p = snapshot.parameters();
        FlatBufferBuilder builder = new FlatBufferBuilder(1024 + (int) Math.min(Integer.MAX_VALUE / 2,
                p.stateCount() + p.weightCount() * 2));

        List<String> names = literalNamesFor(snapshot);
        int namesVector = 0;
        if (!names.isEmpty()) {
            int[] offsets = new int[names.size()];
            for (int i = 0; i < offsets.length; i++) {
                offsets[i] = builder.createString(names.get(i));
            }
            namesVector = builder.createVectorOfTables(offsets);
        }

        short[] weights = snapshot.weights().data();
        builder.startVector(Short.BYTES, weights.length, Short.BYTES);
        for (int i = weights.length - 1; i >= 0; i--) {
            builder.addShort(weights[i]);
        }
        int weightsVector = builder.endVector();
        int weightsShape = uintVector(builder, snapshot.weights().shape());

        int statesVector = builder.createByteVector(snapshot.states().data());
        int statesShape = uintVector(builder, snapshot.states().shape());

        builder.startTable(2);
        builder.addOffset(TENSOR_DATA, weightsVector, 0);
        builder.addOffset(TENSOR_SHAPE, weightsShape, 0);
        int clauseWeights = builder.endTable();

        builder.startTable(2);
        builder.addOffset(TENSOR_DATA, statesVector, 0);
        builder.addOffset(TENSOR_SHAPE, statesShape, 0);
        int automatonStates = builder.endTable();

        builder.startTable(8);
        builder.addInt(PARAM_THRESHOLD, p.threshold(), 0);
        builder.addInt(PARAM_N_LITERALS, p.numLiterals(), 0);
        builder.addInt(PARAM_N_CLAUSES, p.numClauses(), 0);
        builder.addInt(PARAM_N_CLASSES, p.numClasses(), 0);
        builder.addByte(PARAM_MAX_STATE, p.maxState(), 0);
        builder.addByte(PARAM_MIN_STATE, p.minState(), 0);
        builder.addByte(PARAM_BOOST_TP, (byte) (p.boostTruePositive() ? 1 : 0), 0);
        builder.addFloat(PARAM_LEARN_S, (float) p.sensitivity(), 0.0);
        int params = builder.endTable();

        builder.startTable(4);
        builder.addOffset(MODEL_PARAMS, params, 0);
        builder.addOffset(MODEL_AUTOMATON_STATES, automatonStates, 0);
        builder.addOffset(MODEL_CLAUSE_WEIGHTS, clauseWeights, 0);
        if (namesVector != 0) {
            builder.addOffset(MODEL_LITERAL_NAMES, namesVector, 0);
        }
        int model = builder.endTable();
        builder.finish(model);
        return builder.sizedByteArray();
    }

    private List<String> literalNamesFor(ModelSnapshot snapshot) {
        if (snapshot.hasLiteralNames()) {
            return snapshot.literalNames();
        }
        if (!writeLiteralNames) {
            return List.of();
        }
        List<String> derived = LiteralNames.derive(snapshot.parameters().numLiterals());
        if (derived.isEmpty()) {
            LOG.info("No literal names could be derived; writing model without literal names");
        }
        return derived;
    }

    private static int uintVector(FlatBufferBuilder builder, int[] values) {
        builder.startVector(Integer.BYTES, values.length, Integer.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addInt(values[i]);
        }
        return builder.endVector();
    }

    // ==================== Reading ====================

    public ModelSnapshot read(Path path) throws IOException {
        return decode(Files.readAllBytes(path));
    }

    public ModelSnapshot read(InputStream in) throws IOException {
        return decode(in.readAllBytes());
    }

    /**
     * Decodes a FlatBuffer produced by this class, the engine's self-describing save, or any
     * writer of the same schema.
     *
     * @throws ModelFormatException if the buffer is malformed or its shapes disagree
     */
    public ModelSnapshot decode(byte[] bytes) throws ModelFormatException {
        try {
            return decode(ModelTables.Model.root(ByteBuffer.wrap(bytes)), bytes.length);
        } catch (IndexOutOfBoundsException | BufferUnderflowException | IllegalArgumentException e) {
            throw new ModelFormatException("Truncated or malformed FlatBuffer: " + e, e);
        }
    }

    private static ModelSnapshot decode(ModelTables.Model model, int bufferBytes) throws ModelFormatException {
        ModelTables.Parameters params = model.params();
        if (params == null) {
            throw new ModelFormatException("Missing Model.params");
        }
        ModelParameters p = new ModelParameters(
                dimension(params.threshold(), "threshold"),
                dimension(params.nLiterals(), "n_literals"),
                dimension(params.nClauses(), "n_clauses"),
                dimension(params.nClasses(), "n_classes"),
                params.maxState(),
                params.minState(),
                params.boostTp() != 0,
                params.learnS());

        ModelTables.Tensor weightsTable = requiredTensor(model.clauseWeights(), "Model.clause_weights");
        int[] weightsShape = shape(weightsTable, "ClauseWeightsTensor.shape", bufferBytes);
        int weightCount = dataLength(weightsTable, Short.BYTES, "ClauseWeightsTensor.weights", bufferBytes);
        checkShape("ClauseWeightsTensor", weightsShape, new int[] {p.numClauses(), p.numClasses()}, weightCount);
        short[] weights = new short[weightCount];
        for (int i = 0; i < weightCount; i++) {
            weights[i] = weightsTable.int16(i);
        }

        ModelTables.Tensor statesTable = requiredTensor(model.automatonStates(), "Model.automaton_states");
        int[] statesShape = shape(statesTable, "AutomatonStatesTensor.shape", bufferBytes);
        int stateCount = dataLength(statesTable, Byte.BYTES, "AutomatonStatesTensor.states", bufferBytes);
        checkShape("AutomatonStatesTensor", statesShape,
                new int[] {p.numClauses(), p.numLiterals(), 2}, stateCount);
        byte[] states = new byte[stateCount];
        statesTable.int8(states);

        int nameCount = model.literalNamesLength();
        if (nameCount < 0 || (long) nameCount * Integer.BYTES > bufferBytes) {
            throw new ModelFormatException("Model.literal_names length out of range: " + nameCount);
        }
        List<String> names = new ArrayList<>(nameCount);
        for (int i = 0; i < nameCount; i++) {
            names.add(model.literalNames(i));
        }
        if (!names.isEmpty() && names.size() != p.numLiterals()) {
            throw new ModelFormatException(String.format(
                    "Model has %d literals but %d literal names", p.numLiterals(), names.size()));
        }

        return new ModelSnapshot(p,
                new WeightTensor(p.numClauses(), p.numClasses(), weights),
                new ClauseTensor(p.numClauses(), p.numLiterals(), states),
                names);
    }

    private static int dimension(long value, String field) throws ModelFormatException {
        if (value > Integer.MAX_VALUE) {
            throw new ModelFormatException("Parameters." + field + " out of range: " + value);
        }
        return (int) value;
    }

    private static ModelTables.Tensor requiredTensor(ModelTables.Tensor tensor, String what)
            throws ModelFormatException {
        if (tensor == null) {
            throw new ModelFormatException("Missing " + what);
        }
        return tensor;
    }

    private static int dataLength(ModelTables.Tensor tensor, int elementBytes, String what, int bufferBytes)
            throws ModelFormatException {
        if (!tensor.hasData()) {
            throw new ModelFormatException("Missing " + what);
        }
        int length = tensor.dataLength();
        if (length < 0 || (long) length * elementBytes > bufferBytes) {
            throw new ModelFormatException(what + " length out of range: " + Integer.toUnsignedLong(length));
        }
        return length;
    }

    private static int[] shape(ModelTables.Tensor tensor, String what, int bufferBytes) throws ModelFormatException {
        if (!tensor.hasShape()) {
            throw new ModelFormatException("Missing " + what);
        }
        int length = tensor.shapeLength();
        if (length < 0 || (long) length * Integer.BYTES > bufferBytes) {
            throw new ModelFormatException(what + " length out of range: " + Integer.toUnsignedLong(length));
        }
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            long v = tensor.shape(i);
            if (v > Integer.MAX_VALUE) {
                throw new ModelFormatException(what + " dimension out of range: " + v);
            }
            values[i] = (int) v;
        }
        return values;
    }

    private static void checkShape(String tensor, int[] shape, int[] expected, int length)
            throws ModelFormatException {
        if (!Arrays.equals(shape, expected)) {
            throw new ModelFormatException(String.format("%s shape %s disagrees with parameters %s",
                    tensor, Arrays.toString(shape), Arrays.toString(expected)));
        }
        long product = 1;
        for (int dim : shape) {
            product *= dim;
        }
        if (product != length) {
            throw new ModelFormatException(String.format("%s shape %s needs %d elements, data holds %d",
                    tensor, Arrays.toString(shape), product, length));
        }
    }
}

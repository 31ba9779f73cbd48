package io.surfworks.tsetlin.data.format;

import com.google.flatbuffers.Table;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.MODEL_AUTOMATON_STATES;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.MODEL_CLAUSE_WEIGHTS;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.MODEL_LITERAL_NAMES;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.MODEL_PARAMS;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_BOOST_TP;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_LEARN_S;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_MAX_STATE;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_MIN_STATE;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_N_CLASSES;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_N_CLAUSES;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_N_LITERALS;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.PARAM_THRESHOLD;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.TENSOR_DATA;
import static io.surfworks.tsetlin.data.format.SelfDescribingFormat.TENSOR_SHAPE;

/**
 * Read accessors for the tables of a self-describing model buffer, one
 * {@link Table} subclass per schema table.
 *
 * <p>Accessors follow the FlatBuffers runtime: absent scalars read as their
 * default, absent tables as {@code null}, absent vectors as length 0. They do
 * not bounds-check; a malformed buffer surfaces as a runtime exception from
 * {@link ByteBuffer}, which {@link SelfDescribingFormat#decode(byte[])} turns
 * into a {@link ModelFormatException}.
 */
final class ModelTables {

    private ModelTables() {}

    /** Byte offset of a field's entry in its table's vtable. */
    static int vtableOffset(int slot) {
        return 4 + 2 * slot;
    }

    static final class Model extends Table {

        static Model root(ByteBuffer bb) {
            bb.order(ByteOrder.LITTLE_ENDIAN);
            Model model = new Model();
            model.__reset(bb.getInt(bb.position()) + bb.position(), bb);
            return model;
        }

        Parameters params() {
            int o = __offset(vtableOffset(MODEL_PARAMS));
            return o != 0 ? new Parameters().assign(__indirect(o + bb_pos), bb) : null;
        }

        Tensor automatonStates() {
            int o = __offset(vtableOffset(MODEL_AUTOMATON_STATES));
            return o != 0 ? new Tensor().assign(__indirect(o + bb_pos), bb) : null;
        }

        Tensor clauseWeights() {
            int o = __offset(vtableOffset(MODEL_CLAUSE_WEIGHTS));
            return o != 0 ? new Tensor().assign(__indirect(o + bb_pos), bb) : null;
        }

        int literalNamesLength() {
            int o = __offset(vtableOffset(MODEL_LITERAL_NAMES));
            return o != 0 ? __vector_len(o) : 0;
        }

        String literalNames(int j) {
            int o = __offset(vtableOffset(MODEL_LITERAL_NAMES));
            return o != 0 ? __string(__vector(o) + j * 4) : null;
        }
    }

    static final class Parameters extends Table {

        Parameters assign(int i, ByteBuffer bb) {
            __reset(i, bb);
            return this;
        }

        long threshold() {
            return uint32(PARAM_THRESHOLD);
        }

        long nLiterals() {
            return uint32(PARAM_N_LITERALS);
        }

        long nClauses() {
            return uint32(PARAM_N_CLAUSES);
        }

        long nClasses() {
            return uint32(PARAM_N_CLASSES);
        }

        byte maxState() {
            int o = __offset(vtableOffset(PARAM_MAX_STATE));
            return o != 0 ? bb.get(o + bb_pos) : 0;
        }

        byte minState() {
            int o = __offset(vtableOffset(PARAM_MIN_STATE));
            return o != 0 ? bb.get(o + bb_pos) : 0;
        }

        int boostTp() {
            int o = __offset(vtableOffset(PARAM_BOOST_TP));
            return o != 0 ? bb.get(o + bb_pos) & 0xFF : 0;
        }

        float learnS() {
            int o = __offset(vtableOffset(PARAM_LEARN_S));
            return o != 0 ? bb.getFloat(o + bb_pos) : 0.0f;
        }

        private long uint32(int slot) {
            int o = __offset(vtableOffset(slot));
            return o != 0 ? (long) bb.getInt(o + bb_pos) & 0xFFFFFFFFL : 0L;
        }
    }

    /**
     * Layout shared by {@code ClauseWeightsTensor} and {@code AutomatonStatesTensor}.
     */
    static final class Tensor extends Table {

        Tensor assign(int i, ByteBuffer bb) {
            __reset(i, bb);
            return this;
        }

        boolean hasData() {
            return __offset(vtableOffset(TENSOR_DATA)) != 0;
        }

        int dataLength() {
            int o = __offset(vtableOffset(TENSOR_DATA));
            return o != 0 ? __vector_len(o) : 0;
        }

        short int16(int j) {
            int o = __offset(vtableOffset(TENSOR_DATA));
            return o != 0 ? bb.getShort(__vector(o) + j * 2) : 0;
        }

        /** Copies {@code target.length} int8 elements out of the data vector. */
        void int8(byte[] target) {
            int o = __offset(vtableOffset(TENSOR_DATA));
            if (o != 0) {
                bb.get(__vector(o), target);
            }
        }

        boolean hasShape() {
            return __offset(vtableOffset(TENSOR_SHAPE)) != 0;
        }

        int shapeLength() {
            int o = __offset(vtableOffset(TENSOR_SHAPE));
            return o != 0 ? __vector_len(o) : 0;
        }

        long shape(int j) {
            int o = __offset(vtableOffset(TENSOR_SHAPE));
            return o != 0 ? (long) bb.getInt(__vector(o) + j * 4) & 0xFFFFFFFFL : 0L;
        }
    }
}

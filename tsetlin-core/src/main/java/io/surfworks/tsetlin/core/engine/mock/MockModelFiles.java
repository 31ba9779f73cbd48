package io.surfworks.tsetlin.core.engine.mock;

import io.surfworks.tsetlin.core.engine.CreateParams;
import io.surfworks.tsetlin.core.tensor.SparseClauseState;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes model files the way the native engine lays them out: a
 * packed little-endian header (s as float64 right after the boost byte), the
 * weights, then either the canonical dense states or the sparse node lists.
 */
final class MockModelFiles {

    static final int PACKED_HEADER_BYTES = 4 * 4 + 3 + 8;
    static final int NODE_LIST_END = 0xFFFFFFFF;
    static final int LOAD_SEED = 42;

    private MockModelFiles() {}

    /**
     * Contents of a dense file.
     */
    record DenseFile(CreateParams params, short[] weights, byte[] canonicalStates) {}

    static void writeDense(Path path, CreateParams p, short[] weights, byte[] canonicalStates) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(PACKED_HEADER_BYTES + weights.length * 2 + canonicalStates.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        putHeader(buf, p);
        for (short w : weights) {
            buf.putShort(w);
        }
        buf.put(canonicalStates);
        Files.write(path, buf.array());
    }

    static void writeSparse(Path path, CreateParams p, short[] weights, SparseClauseState states) throws IOException {
        long nodes = states.totalNodes();
        long size = PACKED_HEADER_BYTES + weights.length * 2L + nodes * 5 + states.numClauses() * 4L;
        ByteBuffer buf = ByteBuffer.allocate(Math.toIntExact(size)).order(ByteOrder.LITTLE_ENDIAN);
        putHeader(buf, p);
        for (short w : weights) {
            buf.putShort(w);
        }
        for (int c = 0; c < states.numClauses(); c++) {
            int[] ids = states.ids(c);
            byte[] values = states.states(c);
            for (int i = 0; i < ids.length; i++) {
                buf.putInt(ids[i]);
                buf.put(values[i]);
            }
            buf.putInt(NODE_LIST_END);
        }
        Files.write(path, buf.array());
    }

    /**
     * Reads a dense file, or returns null when it is truncated, as the engine's loader does.
     */
    static DenseFile readDense(Path path) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(Files.readAllBytes(path)).order(ByteOrder.LITTLE_ENDIAN);
        try {
            int threshold = buf.getInt();
            int literals = buf.getInt();
            int clauses = buf.getInt();
            int classes = buf.getInt();
            byte max = buf.get();
            byte min = buf.get();
            boolean boost = buf.get() != 0;
            double s = buf.getDouble();
            long declared = Integer.toUnsignedLong(clauses) * Integer.toUnsignedLong(classes) * 2
                    + Integer.toUnsignedLong(clauses) * Integer.toUnsignedLong(literals) * 2;
            if (declared > buf.remaining()) {
                return null;
            }
            CreateParams params = CreateParams.forClassification(classes, threshold, literals, clauses,
                    max, min, boost, (float) s, LOAD_SEED);
            short[] weights = new short[clauses * classes];
            for (int i = 0; i < weights.length; i++) {
                weights[i] = buf.getShort();
            }
            byte[] states = new byte[clauses * literals * 2];
            buf.get(states);
            return new DenseFile(params, weights, states);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            return null;
        }
    }

    private static void putHeader(ByteBuffer buf, CreateParams p) {
        buf.putInt(p.threshold());
        buf.putInt(p.numLiterals());
        buf.putInt(p.numClauses());
        buf.putInt(p.numClasses());
        buf.put(p.maxState());
        buf.put(p.minState());
        buf.put((byte) (p.boostTruePositive() ? 1 : 0));
        buf.putDouble(p.sensitivity());
    }
}

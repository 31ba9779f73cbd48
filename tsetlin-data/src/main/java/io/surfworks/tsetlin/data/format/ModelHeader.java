package io.surfworks.tsetlin.data.format;

import io.surfworks.tsetlin.core.model.ModelParameters;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Reads and writes the raw header shared by the dense and sparse raw formats.
 */
final class ModelHeader {

    /** Largest single allocation made before the bytes behind it have arrived. */
    static final int CHUNK_BYTES = 1 << 20;

    private ModelHeader() {}

    static void write(ModelParameters p, HeaderLayout layout, SensitivityEncoding encoding, OutputStream out)
            throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(layout.headerBytes()).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(p.threshold());
        buf.putInt(p.numLiterals());
        buf.putInt(p.numClauses());
        buf.putInt(p.numClasses());
        buf.put(p.maxState());
        buf.put(p.minState());
        buf.put((byte) (p.boostTruePositive() ? 1 : 0));
        buf.position(layout.sensitivityOffset());
        switch (encoding) {
            case FLOAT64 -> buf.putDouble(p.sensitivity());
            case FLOAT32_LOW_WORD -> buf.putFloat((float) p.sensitivity()).putInt(0);
        }
        out.write(buf.array());
    }

    static ModelParameters read(DataInputStream in, HeaderLayout layout, SensitivityEncoding encoding)
            throws IOException {
        byte[] header = new byte[layout.headerBytes()];
        readFully(in, header, "header");
        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        long threshold = Integer.toUnsignedLong(buf.getInt());
        long literals = Integer.toUnsignedLong(buf.getInt());
        long clauses = Integer.toUnsignedLong(buf.getInt());
        long classes = Integer.toUnsignedLong(buf.getInt());
        byte max = buf.get();
        byte min = buf.get();
        int boost = Byte.toUnsignedInt(buf.get());
        buf.position(layout.sensitivityOffset());
        double s = switch (encoding) {
            case FLOAT64 -> buf.getDouble();
            case FLOAT32_LOW_WORD -> buf.getFloat();
        };

        if (literals > Integer.MAX_VALUE || clauses > Integer.MAX_VALUE
                || classes > Integer.MAX_VALUE || threshold > Integer.MAX_VALUE) {
            throw new ModelFormatException(String.format(
                    "Header dimensions out of range: threshold=%d literals=%d clauses=%d classes=%d",
                    threshold, literals, clauses, classes));
        }
        if (boost > 1) {
            throw new ModelFormatException("Boost flag must be 0 or 1, got " + boost);
        }
        if (clauses * literals * 2 > Integer.MAX_VALUE || clauses * classes > Integer.MAX_VALUE / 2) {
            throw new ModelFormatException(String.format(
                    "Tensors too large: %d clauses x %d literals x %d classes", clauses, literals, classes));
        }
        return new ModelParameters((int) threshold, (int) literals, (int) clauses, (int) classes,
                max, min, boost == 1, s);
    }

    static short[] readWeights(DataInputStream in, ModelParameters p) throws IOException {
        byte[] raw = readBytes(in, p.weightCount() * 2, "clause weights");
        short[] weights = new short[raw.length / 2];
        ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer().get(weights);
        return weights;
    }

    static void writeWeights(short[] weights, OutputStream out) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(weights.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        buf.asShortBuffer().put(weights);
        out.write(buf.array());
    }

    /**
     * Reads {@code length} bytes, allocating at most one chunk ahead of the data received.
     */
    static byte[] readBytes(DataInputStream in, long length, String section) throws IOException {
        if (length <= CHUNK_BYTES) {
            byte[] target = new byte[(int) length];
            readFully(in, target, section);
            return target;
        }
        ByteArrayOutputStream collected = new ByteArrayOutputStream(CHUNK_BYTES);
        byte[] chunk = new byte[CHUNK_BYTES];
        long remaining = length;
        while (remaining > 0) {
            int n = (int) Math.min(chunk.length, remaining);
            readFully(in, chunk, n, section);
            collected.write(chunk, 0, n);
            remaining -= n;
        }
        return collected.toByteArray();
    }

    static void readFully(DataInputStream in, byte[] target, String section) throws IOException {
        readFully(in, target, target.length, section);
    }

    private static void readFully(DataInputStream in, byte[] target, int length, String section) throws IOException {
        try {
            in.readFully(target, 0, length);
        } catch (EOFException e) {
            throw new ModelFormatException("Truncated model file: unexpected end of data in " + section, e);
        }
    }

    /**
     * Fails when a file is shorter than the size its header declares.
     */
    static void requireSize(long actual, long required, ModelParameters p) throws ModelFormatException {
        if (actual < required) {
            throw new ModelFormatException(String.format(
                    "Truncated model file: header declares %d literals, %d clauses, %d classes "
                            + "needing at least %d bytes, file holds %d",
                    p.numLiterals(), p.numClauses(), p.numClasses(), required, actual));
        }
    }
}

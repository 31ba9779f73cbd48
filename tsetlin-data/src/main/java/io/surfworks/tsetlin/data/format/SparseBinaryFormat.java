package io.surfworks.tsetlin.data.format;

import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.model.SparseModelSnapshot;
import io.surfworks.tsetlin.core.tensor.SparseClauseState;
import io.surfworks.tsetlin.core.tensor.WeightTensor;
import io.surfworks.tsetlin.core.util.AtomicFiles;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Raw model file of the sparse engine: a packed header, the weights, then per
 * clause its (uint32 automaton id, int8 state) nodes closed by a
 * {@code 0xFFFFFFFF} delimiter.
 *
 * <p>Not interchangeable with {@link RawBinaryFormat}.
 */
public final class SparseBinaryFormat {

    static final int DELIMITER = 0xFFFFFFFF;
    private static final int NODE_BYTES = 5;

    private final SensitivityEncoding sensitivityEncoding;

    public SparseBinaryFormat(SensitivityEncoding sensitivityEncoding) {
        this.sensitivityEncoding = sensitivityEncoding;
    }

    public static SparseBinaryFormat standard() {
        return new SparseBinaryFormat(SensitivityEncoding.FLOAT64);
    }

    /**
     * Files written by the sparse engine's save primitive.
     */
    public static SparseBinaryFormat engineSaved() {
        return new SparseBinaryFormat(SensitivityEncoding.FLOAT32_LOW_WORD);
    }

    /**
     * Returns the smallest file that can hold a model with these parameters:
     * every node list empty.
     */
    public long minimumFileSize(ModelParameters params) {
        return HeaderLayout.PACKED.headerBytes() + params.weightCount() * 2 + (long) params.numClauses() * 4;
    }

    /**
     * Reads a sparse model file, checking its size against the header first.
     *
     * @throws ModelFormatException if the file is shorter than its header declares
     */
    public SparseModelSnapshot read(Path path) throws IOException {
        long size = Files.size(path);
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            DataInputStream dis = new DataInputStream(bis);
            ModelParameters params = ModelHeader.read(dis, HeaderLayout.PACKED, sensitivityEncoding);
            ModelHeader.requireSize(size, minimumFileSize(params), params);
            return readBody(dis, params);
        }
    }

    /**
     * Reads a sparse model.
     *
     * @throws ModelFormatException if a list is unterminated, holds an id out of
     *         range, or holds more nodes than the clause has automata
     */
    public SparseModelSnapshot read(InputStream in) throws IOException {
        DataInputStream dis = new DataInputStream(in);
        return readBody(dis, ModelHeader.read(dis, HeaderLayout.PACKED, sensitivityEncoding));
    }

    private static SparseModelSnapshot readBody(DataInputStream dis, ModelParameters params) throws IOException {
        short[] weights = ModelHeader.readWeights(dis, params);

        int automata = params.numLiterals() * 2;
        List<int[]> ids = new ArrayList<>();
        List<byte[]> states = new ArrayList<>();
        byte[] word = new byte[4];
        for (int c = 0; c < params.numClauses(); c++) {
            int[] idBuf = new int[Math.min(automata, 16)];
            byte[] stateBuf = new byte[idBuf.length];
            int count = 0;
            while (true) {
                ModelHeader.readFully(dis, word, "node list of clause " + c);
                int id = ByteBuffer.wrap(word).order(ByteOrder.LITTLE_ENDIAN).getInt();
                if (id == DELIMITER) {
                    break;
                }
                if (Integer.toUnsignedLong(id) >= automata) {
                    throw new ModelFormatException(String.format(
                            "Clause %d holds automaton id %d, but there are only %d automata",
                            c, Integer.toUnsignedLong(id), automata));
                }
                if (count == automata) {
                    throw new ModelFormatException("Clause " + c + " holds more nodes than automata");
                }
                if (count == idBuf.length) {
                    idBuf = Arrays.copyOf(idBuf, Math.min(automata, idBuf.length * 2));
                    stateBuf = Arrays.copyOf(stateBuf, idBuf.length);
                }
                byte[] state = new byte[1];
                ModelHeader.readFully(dis, state, "node list of clause " + c);
                idBuf[count] = id;
                stateBuf[count] = state[0];
                count++;
            }
            ids.add(Arrays.copyOf(idBuf, count));
            states.add(Arrays.copyOf(stateBuf, count));
        }

        return new SparseModelSnapshot(params,
                new WeightTensor(params.numClauses(), params.numClasses(), weights),
                new SparseClauseState(params.numLiterals(),
                        ids.toArray(new int[0][]), states.toArray(new byte[0][])));
    }

    public void write(SparseModelSnapshot snapshot, Path path) throws IOException {
        AtomicFiles.write(path, out -> {
            BufferedOutputStream bos = new BufferedOutputStream(out);
            write(snapshot, bos);
            bos.flush();
        });
    }

    public void write(SparseModelSnapshot snapshot, OutputStream out) throws IOException {
        ModelHeader.write(snapshot.parameters(), HeaderLayout.PACKED, sensitivityEncoding, out);
        ModelHeader.writeWeights(snapshot.weights().data(), out);
        SparseClauseState states = snapshot.states();
        for (int c = 0; c < states.numClauses(); c++) {
            int[] ids = states.ids(c);
            byte[] values = states.states(c);
            ByteBuffer buf = ByteBuffer.allocate(ids.length * NODE_BYTES + 4).order(ByteOrder.LITTLE_ENDIAN);
            for (int i = 0; i < ids.length; i++) {
                buf.putInt(ids[i]);
                buf.put(values[i]);
            }
            buf.putInt(DELIMITER);
            out.write(buf.array());
        }
    }
}

package io.surfworks.tsetlin.data.format;

import io.surfworks.tsetlin.core.model.ModelParameters;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import io.surfworks.tsetlin.core.tensor.ClauseTensor;
import io.surfworks.tsetlin.core.tensor.WeightTensor;
import io.surfworks.tsetlin.core.util.AtomicFiles;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Raw little-endian dense model file.
 *
 * <pre>
 * offset  type     field
 *      0  uint32   threshold
 *      4  uint32   num_literals
 *      8  uint32   num_clauses
 *     12  uint32   num_classes
 *     16  int8     max_state
 *     17  int8     min_state
 *     18  uint8    boost_true_positive_feedback
 *    s_o  float64  s            (s_o = 24 aligned, 19 packed)
 *  s_o+8  int16[]  weights      (num_clauses x num_classes)
 *    ...  int8[]   states       (num_clauses x num_literals x 2, canonical order)
 * </pre>
 *
 * <p>The file has no magic number or version. Trailing bytes after the states are ignored.
 */
public final class RawBinaryFormat {

    private final HeaderLayout layout;
    private final SensitivityEncoding sensitivityEncoding;

    public RawBinaryFormat(HeaderLayout layout, SensitivityEncoding sensitivityEncoding) {
        this.layout = layout;
        this.sensitivityEncoding = sensitivityEncoding;
    }

    /**
     * The default layout: s at offset 24, weights at 32.
     */
    public static RawBinaryFormat aligned() {
        return new RawBinaryFormat(HeaderLayout.ALIGNED, SensitivityEncoding.FLOAT64);
    }

    /**
     * The layout the engine's own loaders read: s at offset 19, weights at 27.
     */
    public static RawBinaryFormat packed() {
        return new RawBinaryFormat(HeaderLayout.PACKED, SensitivityEncoding.FLOAT64);
    }

    /**
     * Files written by the engine's own save primitive: packed, s stored as float32.
     */
    public static RawBinaryFormat engineSaved() {
        return new RawBinaryFormat(HeaderLayout.PACKED, SensitivityEncoding.FLOAT32_LOW_WORD);
    }

    public HeaderLayout layout() {
        return layout;
    }

    public SensitivityEncoding sensitivityEncoding() {
        return sensitivityEncoding;
    }

    /**
     * Returns the exact file size for a model with these parameters.
     */
    public long fileSize(ModelParameters params) {
        return layout.headerBytes() + params.weightCount() * 2 + params.stateCount();
    }

    // ==================== Reading ====================

    /**
     * Reads a model file, checking its size against the header before the tensors are read.
     *
     * @throws ModelFormatException if the file is shorter than its header declares
     */
    public ModelSnapshot read(Path path) throws IOException {
        long size = Files.size(path);
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            DataInputStream dis = new DataInputStream(bis);
            ModelParameters params = ModelHeader.read(dis, layout, sensitivityEncoding);
            ModelHeader.requireSize(size, fileSize(params), params);
            return readBody(dis, params);
        }
    }

    /**
     * Reads a model.
     *
     * @throws ModelFormatException if the stream ends early or the header is out of range
     */
    public ModelSnapshot read(InputStream in) throws IOException {
        DataInputStream dis = new DataInputStream(in);
        return readBody(dis, ModelHeader.read(dis, layout, sensitivityEncoding));
    }

    private static ModelSnapshot readBody(DataInputStream dis, ModelParameters params) throws IOException {
        short[] weights = ModelHeader.readWeights(dis, params);
        byte[] states = ModelHeader.readBytes(dis, params.stateCount(), "automaton states");
        return new ModelSnapshot(params,
                new WeightTensor(params.numClauses(), params.numClasses(), weights),
                new ClauseTensor(params.numClauses(), params.numLiterals(), states));
    }

    /**
     * Reads only the header.
     */
    public ModelParameters readHeader(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            return ModelHeader.read(new DataInputStream(bis), layout, sensitivityEncoding);
        }
    }

    // ==================== Writing ====================

    /**
     * Writes a model atomically: the target is replaced only once the whole file is written.
     */
    public void write(ModelSnapshot snapshot, Path path) throws IOException {
        AtomicFiles.write(path, out -> {
            BufferedOutputStream bos = new BufferedOutputStream(out);
            write(snapshot, bos);
            bos.flush();
        });
    }

    public void write(ModelSnapshot snapshot, OutputStream out) throws IOException {
        ModelHeader.write(snapshot.parameters(), layout, sensitivityEncoding, out);
        ModelHeader.writeWeights(snapshot.weights().data(), out);
        out.write(snapshot.states().data());
    }
}

package io.surfworks.tsetlin.data.format;

import com.google.flatbuffers.FlatBufferBuilder;
import io.surfworks.tsetlin.core.model.ModelSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static io.surfworks.tsetlin.data.format.Snapshots.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class SelfDescribingFormatTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        void saveThenLoadIsIdentity() throws IOException {
            Path file = tempDir.resolve("model.fbs");
            SelfDescribingFormat.standard().write(snapshot(), file);

            ModelSnapshot loaded = SelfDescribingFormat.standard().read(file);

            assertEquals(snapshot().weights(), loaded.weights());
            assertEquals(snapshot().states(), loaded.states());
            assertEquals(15, loaded.parameters().threshold());
            assertEquals(3.9f, (float) loaded.parameters().sensitivity());
            assertTrue(loaded.parameters().boostTruePositive());
        }

        @Test
        @DisplayName("Literal names are absent unless present or requested")
        void literalNamesOptional() throws ModelFormatException {
            byte[] plain = SelfDescribingFormat.standard().encode(snapshot());
            byte[] named = SelfDescribingFormat.withLiteralNames().encode(snapshot());

            assertFalse(SelfDescribingFormat.standard().decode(plain).hasLiteralNames());
            assertEquals(List.of("Literal 0", "Literal 1", "Literal 2", "Literal 3"),
                    SelfDescribingFormat.standard().decode(named).literalNames());
        }

        @Test
        void keepsSnapshotLiteralNames() throws ModelFormatException {
            List<String> names = List.of("a", "b", "ç", "d");
            byte[] bytes = SelfDescribingFormat.standard().encode(snapshot().withLiteralNames(names));

            assertEquals(names, SelfDescribingFormat.standard().decode(bytes).literalNames());
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        void shapeDisagreesWithParameters() {
            byte[] bytes = modelWithWeightShape(new int[] {3, 3}, 9);

            ModelFormatException ex = assertThrows(ModelFormatException.class,
                    () -> SelfDescribingFormat.standard().decode(bytes));
            assertTrue(ex.getMessage().contains("ClauseWeightsTensor"));
        }

        @Test
        void shapeDisagreesWithDataLength() {
            byte[] bytes = modelWithWeightShape(new int[] {3, 2}, 5);

            ModelFormatException ex = assertThrows(ModelFormatException.class,
                    () -> SelfDescribingFormat.standard().decode(bytes));
            assertTrue(ex.getMessage().contains("data holds 5"));
        }

        @Test
        void truncatedBuffer() {
            byte[] bytes = SelfDescribingFormat.standard().encode(snapshot());

            assertThrows(ModelFormatException.class,
                    () -> SelfDescribingFormat.standard().decode(Arrays.copyOf(bytes, bytes.length / 3)));
        }

        @Test
        void emptyBuffer() {
            assertThrows(ModelFormatException.class, () -> SelfDescribingFormat.standard().decode(new byte[0]));
        }

        @Test
        void rootOffsetOutsideBuffer() {
            byte[] bytes = {0x40, 0, 0, 0, 0, 0, 0, 0};

            ModelFormatException ex = assertThrows(ModelFormatException.class,
                    () -> SelfDescribingFormat.standard().decode(bytes));
            assertInstanceOf(IndexOutOfBoundsException.class, ex.getCause());
        }

        @Test
        @DisplayName("A vector length larger than the buffer is rejected before allocating")
        void vectorLengthBeyondBuffer() {
            byte[] bytes = SelfDescribingFormat.standard().encode(snapshot());
            int lengthPos = statesVectorLengthPosition(bytes);
            ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putInt(lengthPos, Integer.MAX_VALUE);

            ModelFormatException ex = assertThrows(ModelFormatException.class,
                    () -> SelfDescribingFormat.standard().decode(bytes));
            assertTrue(ex.getMessage().contains("AutomatonStatesTensor.states length out of range"), ex.getMessage());
        }

        @Test
        void missingParametersTable() {
            FlatBufferBuilder b = new FlatBufferBuilder(64);
            b.startTable(4);
            b.finish(b.endTable());

            ModelFormatException ex = assertThrows(ModelFormatException.class,
                    () -> SelfDescribingFormat.standard().decode(b.sizedByteArray()));
            assertTrue(ex.getMessage().contains("Model.params"));
        }
    }

    /** Finds the length prefix of the 24 automaton states written for {@code snapshot()}. */
    private static int statesVectorLengthPosition(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        for (int pos = 0; pos + 6 <= bytes.length; pos++) {
            if (buf.getInt(pos) == 24 && bytes[pos + 4] == (byte) -120 && bytes[pos + 5] == (byte) -109) {
                return pos;
            }
        }
        throw new AssertionError("states vector not found");
    }

    /** Builds a model for 3 clauses, 4 literals, 2 classes with a chosen weight tensor shape. */
    private static byte[] modelWithWeightShape(int[] shape, int weightCount) {
        FlatBufferBuilder b = new FlatBufferBuilder(256);
        b.startVector(2, weightCount, 2);
        for (int i = 0; i < weightCount; i++) {
            b.addShort((short) i);
        }
        int weights = b.endVector();
        b.startVector(4, shape.length, 4);
        for (int i = shape.length - 1; i >= 0; i--) {
            b.addInt(shape[i]);
        }
        int weightShape = b.endVector();
        int states = b.createByteVector(new byte[24]);
        b.startVector(4, 3, 4);
        b.addInt(2);
        b.addInt(4);
        b.addInt(3);
        int stateShape = b.endVector();

        b.startTable(2);
        b.addOffset(SelfDescribingFormat.TENSOR_DATA, weights, 0);
        b.addOffset(SelfDescribingFormat.TENSOR_SHAPE, weightShape, 0);
        int weightTable = b.endTable();
        b.startTable(2);
        b.addOffset(SelfDescribingFormat.TENSOR_DATA, states, 0);
        b.addOffset(SelfDescribingFormat.TENSOR_SHAPE, stateShape, 0);
        int stateTable = b.endTable();
        b.startTable(8);
        b.addInt(SelfDescribingFormat.PARAM_THRESHOLD, 15, 0);
        b.addInt(SelfDescribingFormat.PARAM_N_LITERALS, 4, 0);
        b.addInt(SelfDescribingFormat.PARAM_N_CLAUSES, 3, 0);
        b.addInt(SelfDescribingFormat.PARAM_N_CLASSES, 2, 0);
        int params = b.endTable();
        b.startTable(4);
        b.addOffset(SelfDescribingFormat.MODEL_PARAMS, params, 0);
        b.addOffset(SelfDescribingFormat.MODEL_AUTOMATON_STATES, stateTable, 0);
        b.addOffset(SelfDescribingFormat.MODEL_CLAUSE_WEIGHTS, weightTable, 0);
        b.finish(b.endTable());
        return b.sizedByteArray();
    }
}

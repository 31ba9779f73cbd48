package io.surfworks.tsetlin.core.engine.mock;

import io.surfworks.tsetlin.core.engine.CreateParams;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineException;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.tensor.StateOrder;
import io.surfworks.tsetlin.core.tensor.TensorLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class MockEngineBindingTest {

    @TempDir
    Path tempDir;

    private static CreateParams params() {
        return CreateParams.forClassification(2, 15, 4, 3, (byte) 127, (byte) -127, false, 3.0f, 7);
    }

    @Test
    void saveWritesPackedCanonicalFile() throws IOException {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.DENSE, StateOrder.POLARITY_MAJOR);
        long machine = engine.create(params());
        Path file = tempDir.resolve("m.bin");

        engine.save(machine, file);

        ByteBuffer buf = ByteBuffer.wrap(Files.readAllBytes(file)).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(27 + 3 * 2 * 2 + 3 * 4 * 2, buf.capacity());
        assertEquals(3.0, buf.getDouble(19));
        byte[] canonical = new byte[24];
        buf.get(27 + 12, canonical);
        byte[] engineOrder = TensorLayout.permute(canonical, 3, 4, StateOrder.LITERAL_MAJOR, StateOrder.POLARITY_MAJOR);
        assertArrayEquals(engine.readStates(machine), engineOrder);
    }

    @Test
    void loadRoundTripsSavedMachine() {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.DENSE);
        long machine = engine.create(params());
        Path file = tempDir.resolve("m.bin");
        engine.save(machine, file);

        long loaded = engine.load(file);

        assertNotEquals(machine, loaded);
        assertArrayEquals(engine.readWeights(machine), engine.readWeights(loaded));
        assertArrayEquals(engine.readStates(machine), engine.readStates(loaded));
        assertEquals(engine.readParameters(machine), engine.readParameters(loaded));
    }

    private static final byte[] ROWS = {
            0, 0, 1, 1,
            1, 1, 0, 0,
            1, 0, 1, 0,
    };
    private static final int[] LABELS = {0, 1, 1};

    @Test
    void reloadedMachinePredictsFromSavedTensors() {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.DENSE, StateOrder.POLARITY_MAJOR);
        long machine = engine.create(params());
        engine.train(machine, ROWS, LABELS, 3, 2);
        Path file = tempDir.resolve("trained.bin");
        engine.save(machine, file);

        long loaded = engine.load(file);

        assertArrayEquals(LABELS, engine.predict(machine, ROWS, 3));
        assertArrayEquals(LABELS, engine.predict(loaded, ROWS, 3));
    }

    @Test
    void predictionFollowsWrittenTensors() {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.DENSE);
        long trained = engine.create(params());
        engine.train(trained, ROWS, LABELS, 3, 1);
        long fresh = engine.create(CreateParams.forClassification(
                2, 15, 4, 3, (byte) 127, (byte) -127, false, 3.0f, 99));

        engine.writeWeights(fresh, engine.readWeights(trained));
        engine.writeStates(fresh, engine.readStates(trained));

        assertArrayEquals(LABELS, engine.predict(fresh, ROWS, 3));
    }

    @Test
    void untrainedMachinePredictsFirstClass() {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.DENSE);
        long machine = engine.create(params());

        assertArrayEquals(new int[] {0, 0, 0}, engine.predict(machine, ROWS, 3));
    }

    @Test
    void truncatedFileIsLoadFailure() throws IOException {
        Path file = tempDir.resolve("short.bin");
        Files.write(file, new byte[12]);

        EngineException ex = assertThrows(EngineException.class,
                () -> new MockEngineBinding(EngineVariant.DENSE).load(file));
        assertEquals(EngineException.ErrorCode.LOAD_FAILED, ex.errorCode());
    }

    @Test
    void missingCapabilityIsNotSupported() {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.SPARSE, StateOrder.POLARITY_MAJOR,
                EnumSet.of(EngineCapability.READ_STATE));
        long machine = engine.create(params());

        EngineException ex = assertThrows(EngineException.class, () -> engine.save(machine, tempDir.resolve("x")));
        assertEquals(EngineException.ErrorCode.NOT_SUPPORTED, ex.errorCode());
        assertTrue(ex.getMessage().contains("stm_save"));
    }

    @Test
    void sparseKeepsOnlyActiveAutomata() {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.SPARSE);
        long machine = engine.create(params());

        var sparse = engine.readSparseStates(machine);

        for (int c = 0; c < sparse.numClauses(); c++) {
            for (byte state : sparse.states(c)) {
                assertTrue(state >= 0);
            }
        }
        assertFalse(engine.supports(EngineCapability.WRITE_STATE));
    }

    @Test
    void doubleFreeIsDetected() {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.DENSE);
        long machine = engine.create(params());
        engine.free(machine);

        assertThrows(IllegalStateException.class, () -> engine.free(machine));
        assertEquals(1, engine.freeCount());
    }
}

package io.surfworks.tsetlin.core.classifier;

import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineVariant;
import io.surfworks.tsetlin.core.engine.mock.MockEngineBinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.List;

import static io.surfworks.tsetlin.core.classifier.ClassifierFixtures.smallMachine;
import static io.surfworks.tsetlin.core.classifier.ClassifierFixtures.xorLabels;
import static io.surfworks.tsetlin.core.classifier.ClassifierFixtures.xorRows;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cross-process reconstruction")
class ClassifierSerializationTest {

    @SuppressWarnings("unchecked")
    private static <T> T roundTrip(T value) throws IOException, ClassNotFoundException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            return (T) in.readObject();
        }
    }

    @Test
    void machineDoesNotCrossTheBoundary() throws Exception {
        MockEngineBinding engine = new MockEngineBinding(EngineVariant.DENSE);
        DenseTsetlinClassifier<Integer> clf =
                new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), engine);
        clf.fit(xorRows(), xorLabels());

        DenseTsetlinClassifier<Integer> copy = roundTrip(clf);

        assertFalse(copy.isFitted());
        assertEquals(List.of(0, 1), copy.classes());
        assertEquals(4, copy.numLiterals());
        assertEquals(clf.hyperparameters(), copy.hyperparameters());
        assertEquals(clf.lastSeed(), copy.lastSeed());
        ClassifierException ex = assertThrows(ClassifierException.class, () -> copy.predict(xorRows()));
        assertTrue(ex.isNotFitted());
        assertTrue(clf.isFitted());
    }

    @Test
    void engineIsReopenedFromConfig() throws Exception {
        DenseTsetlinClassifier<Integer> clf =
                new DenseTsetlinClassifier<>(smallMachine(), EngineConfig.mock(), new MockEngineBinding(EngineVariant.DENSE));
        clf.fit(xorRows(), xorLabels());

        DenseTsetlinClassifier<Integer> copy = roundTrip(clf);
        copy.fit(xorRows(), xorLabels());

        assertTrue(copy.isFitted());
        assertNotSame(clf.engine(), copy.engine());
        assertEquals("mock", copy.engine().backendName());
        assertEquals(xorLabels(), copy.predict(xorRows()));
    }

    @Test
    void unfittedClassifierRoundTrips() throws Exception {
        SparseTsetlinClassifier<String> clf = new SparseTsetlinClassifier<>(smallMachine(), EngineConfig.mock());

        SparseTsetlinClassifier<String> copy = roundTrip(clf);

        assertFalse(copy.isFitted());
        assertNull(copy.labelMapping());
        assertEquals(EngineConfig.mock(), copy.engineConfig());
    }
}

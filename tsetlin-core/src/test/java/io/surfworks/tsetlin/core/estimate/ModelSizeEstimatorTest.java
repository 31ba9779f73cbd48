package io.surfworks.tsetlin.core.estimate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelSizeEstimatorTest {

    @Test
    void denseMatchesPerBufferArithmetic() {
        int clauses = 1000;
        int literals = 784;
        int classes = 10;

        SizeBreakdown size = ModelSizeEstimator.dense(clauses, literals, classes);

        long states = 1000L * 784 * 2;
        long weights = 1000L * 10 * 2;
        long outputs = 1000;
        long feedback = 1000L * 10 * 3;
        long votes = 10 * 4;
        assertEquals(states, size.bytes(ModelSizeEstimator.AUTOMATON_STATES));
        assertEquals(feedback, size.bytes(ModelSizeEstimator.FEEDBACK));
        assertEquals(states + weights + outputs + feedback + votes, size.totalBytes());
    }

    @Test
    void smallDenseModel() {
        // 10*4*2 + 10*2*2 + 10 + 10*2*3 + 2*4
        assertEquals(80 + 40 + 10 + 60 + 8, ModelSizeEstimator.dense(10, 4, 2).totalBytes());
    }

    @Test
    void sparseCountsNodesAndPointers() {
        int[] sizes = {3, 0, 5, 2};

        SizeBreakdown size = ModelSizeEstimator.sparse(sizes, 3);

        long nodes = 10L * 16;
        long heads = 4L * 8;
        long activePtrs = 3L * 8;
        long clauseSizes = 4L * 4;
        long weights = 4L * 3 * 2;
        long outputs = 4;
        long votes = 3L * 4;
        assertEquals(nodes, size.bytes(ModelSizeEstimator.AUTOMATON_STATES));
        assertEquals(nodes + heads + activePtrs + clauseSizes + weights + outputs + votes, size.totalBytes());
        assertEquals(0, size.bytes(ModelSizeEstimator.FEEDBACK));
    }

    @Test
    void sparsePointerWidthIsConfigurable() {
        SizeBreakdown wide = ModelSizeEstimator.sparse(new int[] {1, 1}, 2, 8);
        SizeBreakdown narrow = ModelSizeEstimator.sparse(new int[] {1, 1}, 2, 4);

        assertEquals((2 + 2) * 4, wide.totalBytes() - narrow.totalBytes());
    }
}

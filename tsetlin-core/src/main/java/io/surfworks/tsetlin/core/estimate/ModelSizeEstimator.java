package io.surfworks.tsetlin.core.estimate;

import java.util.List;

/**
 * Estimates the memory the native engine allocates for a machine.
 *
 * <p>The arithmetic mirrors the engine's own allocations. Struct headers and
 * allocator overhead are not counted.
 */
public final class ModelSizeEstimator {

    /** Bytes of one sparse list node: {uint32 id; int8 state; next pointer} after alignment. */
    public static final int SPARSE_NODE_BYTES = 16;

    /** Pointer width assumed when none is given. */
    public static final int DEFAULT_POINTER_BYTES = 8;

    public static final String AUTOMATON_STATES = "automaton_states";
    public static final String CLAUSE_WEIGHTS = "clause_weights";
    public static final String CLAUSE_OUTPUTS = "clause_outputs";
    public static final String FEEDBACK = "feedback";
    public static final String CLASS_VOTES = "class_votes";
    public static final String CLAUSE_LIST_HEADS = "clause_list_heads";
    public static final String ACTIVE_LITERAL_POINTERS = "active_literal_pointers";
    public static final String CLAUSE_SIZES = "clause_sizes";

    private ModelSizeEstimator() {} // Utility class

    /**
     * Dense machine: states, weights, clause outputs, a three-byte feedback slot
     * per clause and class, and one 32-bit vote per class.
     */
    public static SizeBreakdown dense(int numClauses, int numLiterals, int numClasses) {
        long clauses = numClauses;
        return new SizeBreakdown(List.of(
                new SizeBreakdown.Entry(AUTOMATON_STATES, clauses * numLiterals * 2 * Byte.BYTES),
                new SizeBreakdown.Entry(CLAUSE_WEIGHTS, clauses * numClasses * Short.BYTES),
                new SizeBreakdown.Entry(CLAUSE_OUTPUTS, clauses * Byte.BYTES),
                new SizeBreakdown.Entry(FEEDBACK, clauses * numClasses * 3 * Byte.BYTES),
                new SizeBreakdown.Entry(CLASS_VOTES, (long) numClasses * Integer.BYTES)));
    }

    /**
     * Sparse machine with the default pointer width.
     *
     * @param clauseSizes stored node count per clause
     */
    public static SizeBreakdown sparse(int[] clauseSizes, int numClasses) {
        return sparse(clauseSizes, numClasses, DEFAULT_POINTER_BYTES);
    }

    /**
     * Sparse machine: list nodes, one list head per clause, one active-literal
     * pointer per class, per-clause sizes, weights, clause outputs and votes.
     */
    public static SizeBreakdown sparse(int[] clauseSizes, int numClasses, int pointerBytes) {
        long clauses = clauseSizes.length;
        long nodes = 0;
        for (int size : clauseSizes) {
            nodes += Integer.toUnsignedLong(size);
        }
        return new SizeBreakdown(List.of(
                new SizeBreakdown.Entry(AUTOMATON_STATES, nodes * SPARSE_NODE_BYTES),
                new SizeBreakdown.Entry(CLAUSE_LIST_HEADS, clauses * pointerBytes),
                new SizeBreakdown.Entry(ACTIVE_LITERAL_POINTERS, (long) numClasses * pointerBytes),
                new SizeBreakdown.Entry(CLAUSE_SIZES, clauses * Integer.BYTES),
                new SizeBreakdown.Entry(CLAUSE_WEIGHTS, clauses * numClasses * Short.BYTES),
                new SizeBreakdown.Entry(CLAUSE_OUTPUTS, clauses * Byte.BYTES),
                new SizeBreakdown.Entry(CLASS_VOTES, (long) numClasses * Integer.BYTES)));
    }
}

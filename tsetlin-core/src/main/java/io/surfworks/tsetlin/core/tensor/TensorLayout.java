package io.surfworks.tsetlin.core.tensor;

/**
 * Converts automaton state tensors between the engine's memory order and the
 * canonical (clauses, literals, 2) order used by every codec.
 *
 * <p>Pure permutations: {@code fromCanonical(toCanonical(a))} returns {@code a}
 * element for element, for every shape.
 */
public final class TensorLayout {

    private TensorLayout() {} // Utility class

    /**
     * Reorders raw engine states into a canonical clause tensor.
     *
     * @param engineStates states as the engine stores them
     * @param numClauses   clause count
     * @param numLiterals  literal count
     * @param engineOrder  order of {@code engineStates}
     * @return canonical clause tensor (a fresh copy)
     */
    public static ClauseTensor toCanonical(byte[] engineStates, int numClauses, int numLiterals,
                                           StateOrder engineOrder) {
        checkLength(engineStates, numClauses, numLiterals);
        byte[] canonical = permute(engineStates, numClauses, numLiterals, engineOrder, StateOrder.LITERAL_MAJOR);
        return new ClauseTensor(numClauses, numLiterals, canonical);
    }

    /**
     * Reorders a canonical clause tensor into the engine's memory order.
     *
     * @return raw states in {@code engineOrder} (a fresh copy)
     */
    public static byte[] fromCanonical(ClauseTensor tensor, StateOrder engineOrder) {
        return permute(tensor.data(), tensor.numClauses(), tensor.numLiterals(),
                StateOrder.LITERAL_MAJOR, engineOrder);
    }

    /**
     * Copies {@code source} from one order to another.
     */
    public static byte[] permute(byte[] source, int numClauses, int numLiterals, StateOrder from, StateOrder to) {
        checkLength(source, numClauses, numLiterals);
        if (from == to) {
            return source.clone();
        }
        byte[] target = new byte[source.length];
        for (int c = 0; c < numClauses; c++) {
            for (int l = 0; l < numLiterals; l++) {
                for (int p = 0; p < 2; p++) {
                    target[to.index(c, l, p, numLiterals)] = source[from.index(c, l, p, numLiterals)];
                }
            }
        }
        return target;
    }

    private static void checkLength(byte[] states, int numClauses, int numLiterals) {
        long expected = (long) numClauses * numLiterals * 2;
        if (states.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "State tensor has %d elements, expected %d for (%d, %d, 2)",
                    states.length, expected, numClauses, numLiterals));
        }
    }
}

package io.surfworks.tsetlin.core.tensor;

/**
 * Memory order of an automaton state tensor with logical axes
 * (clause, literal, polarity).
 */
public enum StateOrder {

    /**
     * Shape (clauses, 2, literals): all positive-polarity automata of a clause,
     * then all negated ones.
     */
    POLARITY_MAJOR,

    /**
     * Shape (clauses, literals, 2): the two automata of a literal sit side by
     * side. This is the canonical on-disk order.
     */
    LITERAL_MAJOR;

    /**
     * Returns the flat index of one automaton in a tensor stored in this order.
     */
    public int index(int clause, int literal, int polarity, int numLiterals) {
        return switch (this) {
            case POLARITY_MAJOR -> (clause * 2 + polarity) * numLiterals + literal;
            case LITERAL_MAJOR -> (clause * numLiterals + literal) * 2 + polarity;
        };
    }
}

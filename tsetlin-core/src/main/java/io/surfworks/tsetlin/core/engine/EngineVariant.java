package io.surfworks.tsetlin.core.engine;

/**
 * The two machine flavours a native engine library exposes.
 *
 * <p>Each variant publishes its primitives under its own symbol prefix, so
 * {@code DENSE} resolves {@code tm_create}, {@code tm_train}, ... and
 * {@code SPARSE} resolves {@code stm_create}, {@code stm_train}, ...
 */
public enum EngineVariant {

    /** Fixed-size automaton state array, one entry per literal and polarity. */
    DENSE("tm_"),

    /** Per-clause linked lists holding only the active automata. */
    SPARSE("stm_");

    private final String symbolPrefix;

    EngineVariant(String symbolPrefix) {
        this.symbolPrefix = symbolPrefix;
    }

    public String symbolPrefix() {
        return symbolPrefix;
    }

    /**
     * Returns the exported symbol name for a primitive of this variant.
     */
    public String symbol(String primitive) {
        return symbolPrefix + primitive;
    }
}

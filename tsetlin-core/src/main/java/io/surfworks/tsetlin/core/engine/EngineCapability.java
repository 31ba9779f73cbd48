package io.surfworks.tsetlin.core.engine;

/**
 * Optional features an engine binding may or may not provide.
 *
 * <p>Create, train, predict and free are mandatory and therefore not listed.
 */
public enum EngineCapability {
    /** Engine-native raw save ({@code tm_save} / {@code stm_save}). */
    SAVE_NATIVE,
    /** Engine-native raw load ({@code tm_load} / {@code stm_load_dense}). */
    LOAD_NATIVE,
    /** Engine-native self-describing save ({@code *_save_fbs}). */
    SAVE_SELF_DESCRIBING,
    /** Engine-native self-describing load ({@code *_load_fbs}). */
    LOAD_SELF_DESCRIBING,
    /** Reading parameters and tensors directly out of a live machine. */
    READ_STATE,
    /** Writing weights and automaton states into a live machine. */
    WRITE_STATE
}

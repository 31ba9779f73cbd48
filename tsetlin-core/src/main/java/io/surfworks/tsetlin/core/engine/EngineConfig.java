package io.surfworks.tsetlin.core.engine;

import io.surfworks.tsetlin.core.tensor.StateOrder;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where and how to load the native engine.
 *
 * <p>The record is serializable so a classifier can re-open its engine after
 * crossing a process boundary.
 *
 * @param libraryDirectory directory holding the engine library, or {@code null}
 *                         to use the platform's default search path
 * @param mode             {@link #MODE_NATIVE} or {@link #MODE_MOCK}
 * @param provider         name of the {@link EngineProvider} to use, or {@code null} for the first found
 * @param stateOrder       memory order of the dense state tensor inside the engine
 */
public record EngineConfig(
        String libraryDirectory,
        String mode,
        String provider,
        StateOrder stateOrder
) implements Serializable {

    public static final String MODE_PROPERTY = "tsetlin.engine.mode";
    public static final String LIB_DIR_PROPERTY = "tsetlin.engine.lib.dir";
    public static final String PROVIDER_PROPERTY = "tsetlin.engine.provider";
    public static final String STATE_ORDER_PROPERTY = "tsetlin.engine.state.order";

    public static final String MODE_NATIVE = "native";
    public static final String MODE_MOCK = "mock";

    /** The native engines index {@code ta_state} as {@code (clause * literals + literal) * 2 + polarity}. */
    public static final StateOrder DEFAULT_STATE_ORDER = StateOrder.LITERAL_MAJOR;

    public EngineConfig {
        if (mode == null) {
            mode = MODE_NATIVE;
        }
        if (!MODE_NATIVE.equalsIgnoreCase(mode) && !MODE_MOCK.equalsIgnoreCase(mode)) {
            throw new IllegalArgumentException("Unknown engine mode: " + mode);
        }
        if (stateOrder == null) {
            stateOrder = DEFAULT_STATE_ORDER;
        }
    }

    /**
     * Native engine loaded from {@code libraryDirectory}.
     */
    public static EngineConfig of(Path libraryDirectory) {
        return new EngineConfig(libraryDirectory.toString(), MODE_NATIVE, null, DEFAULT_STATE_ORDER);
    }

    /**
     * The in-process mock engine.
     */
    public static EngineConfig mock() {
        return new EngineConfig(null, MODE_MOCK, null, DEFAULT_STATE_ORDER);
    }

    /**
     * Reads {@code tsetlin.engine.*} system properties.
     */
    public static EngineConfig fromSystemProperties() {
        String order = System.getProperty(STATE_ORDER_PROPERTY);
        return new EngineConfig(
                System.getProperty(LIB_DIR_PROPERTY),
                System.getProperty(MODE_PROPERTY, MODE_NATIVE),
                System.getProperty(PROVIDER_PROPERTY),
                order == null ? DEFAULT_STATE_ORDER : StateOrder.valueOf(order.toUpperCase()));
    }

    public boolean isMock() {
        return MODE_MOCK.equalsIgnoreCase(mode);
    }

    public Path libraryPath() {
        return libraryDirectory == null ? null : Paths.get(libraryDirectory);
    }

    public EngineConfig withLibraryDirectory(Path dir) {
        return new EngineConfig(dir == null ? null : dir.toString(), mode, provider, stateOrder);
    }

    public EngineConfig withStateOrder(StateOrder order) {
        return new EngineConfig(libraryDirectory, mode, provider, order);
    }

    public EngineConfig withProvider(String name) {
        return new EngineConfig(libraryDirectory, mode, name, stateOrder);
    }
}

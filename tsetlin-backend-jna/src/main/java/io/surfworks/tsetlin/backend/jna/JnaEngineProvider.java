package io.surfworks.tsetlin.backend.jna;

import com.sun.jna.NativeLibrary;
import io.surfworks.tsetlin.core.engine.EngineBinding;
import io.surfworks.tsetlin.core.engine.EngineConfig;
import io.surfworks.tsetlin.core.engine.EngineProvider;
import io.surfworks.tsetlin.core.engine.EngineVariant;

/**
 * Opens the native engine with JNA. Registered under {@code META-INF/services}.
 */
public final class JnaEngineProvider implements EngineProvider {

    public static final String NAME = "jna";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EngineBinding open(EngineConfig config, EngineVariant variant) {
        NativeLibrary library = EngineLibraryLoader.load(config.libraryPath());
        return new JnaEngineBinding(variant, EngineFunctions.resolve(library, variant), config.stateOrder());
    }
}

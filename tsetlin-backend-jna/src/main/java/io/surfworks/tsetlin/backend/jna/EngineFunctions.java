package io.surfworks.tsetlin.backend.jna;

import com.sun.jna.Function;
import com.sun.jna.NativeLibrary;
import io.surfworks.tsetlin.core.engine.EngineCapability;
import io.surfworks.tsetlin.core.engine.EngineException;
import io.surfworks.tsetlin.core.engine.EngineVariant;

import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The exported functions of one engine variant.
 *
 * <p>create, train, predict and free must be present. The persistence primitives are
 * looked up; absent ones are {@code null} and surface as missing capabilities.
 */
final class EngineFunctions {

    private static final Logger LOG = Logger.getLogger(EngineFunctions.class.getName());

    final Function create;
    final Function train;
    final Function predict;
    final Function free;

    // Optional
    final Function save;
    final Function load;
    final Function saveSelfDescribing;
    final Function loadSelfDescribing;

    private final String loadSymbol;

    private EngineFunctions(NativeLibrary library, EngineVariant variant) {
        this.create = required(library, variant.symbol("create"));
        this.train = required(library, variant.symbol("train"));
        this.predict = required(library, variant.symbol("predict"));
        this.free = required(library, variant.symbol("free"));

        this.loadSymbol = loadSymbol(variant);
        this.save = optional(library, variant.symbol("save"));
        this.load = optional(library, loadSymbol);
        this.saveSelfDescribing = optional(library, variant.symbol("save_fbs"));
        this.loadSelfDescribing = optional(library, variant.symbol("load_fbs"));
    }

    static EngineFunctions resolve(NativeLibrary library, EngineVariant variant) {
        return new EngineFunctions(library, variant);
    }

    /**
     * The sparse engine only loads the dense file layout.
     */
    static String loadSymbol(EngineVariant variant) {
        return variant == EngineVariant.SPARSE ? variant.symbol("load_dense") : variant.symbol("load");
    }

    String loadSymbol() {
        return loadSymbol;
    }

    Set<EngineCapability> persistenceCapabilities() {
        Set<EngineCapability> caps = EnumSet.noneOf(EngineCapability.class);
        if (save != null) caps.add(EngineCapability.SAVE_NATIVE);
        if (load != null) caps.add(EngineCapability.LOAD_NATIVE);
        if (saveSelfDescribing != null) caps.add(EngineCapability.SAVE_SELF_DESCRIBING);
        if (loadSelfDescribing != null) caps.add(EngineCapability.LOAD_SELF_DESCRIBING);
        return caps;
    }

    private static Function required(NativeLibrary library, String symbol) {
        try {
            return library.getFunction(symbol);
        } catch (UnsatisfiedLinkError e) {
            throw EngineException.linkFailed("missing symbol " + symbol + " in " + library.getName(), e);
        }
    }

    private static Function optional(NativeLibrary library, String symbol) {
        try {
            return library.getFunction(symbol);
        } catch (UnsatisfiedLinkError e) {
            LOG.fine(() -> "Engine does not export " + symbol);
            return null;
        }
    }
}

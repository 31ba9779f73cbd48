package io.surfworks.tsetlin.core.engine;

import io.surfworks.tsetlin.core.engine.mock.MockEngineBinding;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Factory for {@link EngineBinding} instances.
 *
 * <h2>Implementation Selection</h2>
 * <ol>
 *   <li>If the config (or {@code -Dtsetlin.engine.mode=mock}) selects mock, use the in-process mock</li>
 *   <li>Otherwise use the named {@link EngineProvider}, or the first one on the class path</li>
 *   <li>If no provider is present or the library cannot be opened, fail with {@code LINK_FAILED}</li>
 * </ol>
 *
 * <p>There is no fallback from a native engine to the mock.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EngineBinding dense = Engines.load(EngineConfig.of(Path.of("/opt/tm/lib")), EngineVariant.DENSE);
 * }</pre>
 */
public final class Engines {

    private static final Logger LOG = Logger.getLogger(Engines.class.getName());

    private Engines() {} // Utility class

    /**
     * Loads a binding for {@code variant}.
     *
     * @throws EngineException with {@code LINK_FAILED} if no engine can be bound
     */
    public static EngineBinding load(EngineConfig config, EngineVariant variant) {
        if (config.isMock()) {
            LOG.fine(() -> "Using mock engine for " + variant);
            return new MockEngineBinding(variant, config.stateOrder());
        }

        List<EngineProvider> providers = providers();
        if (providers.isEmpty()) {
            throw new EngineException(
                    "No native engine provider on the class path (add tsetlin-backend-jna)",
                    EngineException.ErrorCode.LINK_FAILED);
        }
        for (EngineProvider provider : providers) {
            if (config.provider() == null || config.provider().equals(provider.name())) {
                LOG.fine(() -> "Opening " + variant + " engine through provider " + provider.name());
                return provider.open(config, variant);
            }
        }
        throw new EngineException("Engine provider not found: " + config.provider(),
                EngineException.ErrorCode.LINK_FAILED);
    }

    /**
     * Loads a binding configured from system properties.
     */
    public static EngineBinding load(EngineVariant variant) {
        return load(EngineConfig.fromSystemProperties(), variant);
    }

    /**
     * Returns the registered providers in discovery order.
     */
    public static List<EngineProvider> providers() {
        List<EngineProvider> found = new ArrayList<>();
        for (EngineProvider provider : ServiceLoader.load(EngineProvider.class)) {
            found.add(provider);
        }
        return found;
    }

    /**
     * Returns whether a native engine can be bound with {@code config}.
     */
    public static boolean isAvailable(EngineConfig config, EngineVariant variant) {
        try {
            load(config, variant);
            return true;
        } catch (EngineException e) {
            LOG.fine(() -> "Engine not available: " + e.getMessage());
            return false;
        }
    }
}

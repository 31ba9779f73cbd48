package io.surfworks.tsetlin.core.engine;

/**
 * Service provider interface for native engine backends.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} from
 * {@code META-INF/services/io.surfworks.tsetlin.core.engine.EngineProvider}.
 */
public interface EngineProvider {

    /**
     * Returns the provider name, matched against {@link EngineConfig#provider()}.
     */
    String name();

    /**
     * Opens the engine library described by {@code config} and binds one variant.
     *
     * @throws EngineException with {@code LINK_FAILED} if the library cannot be opened
     */
    EngineBinding open(EngineConfig config, EngineVariant variant);
}

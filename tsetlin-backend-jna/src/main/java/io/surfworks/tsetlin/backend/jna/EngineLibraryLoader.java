package io.surfworks.tsetlin.backend.jna;

import com.sun.jna.Library;
import com.sun.jna.NativeLibrary;
import com.sun.jna.Platform;
import io.surfworks.tsetlin.core.engine.EngineException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Locates and opens the native engine library.
 *
 * <p>The engine ships as {@code libtsetlin_machine_c.{so,dylib,dll}}, optionally next to the
 * FlatBuffers runtime {@code libflatccrt}. When the runtime is present it is opened first and
 * with global symbol visibility so the engine's self-describing primitives can bind to it.
 */
public final class EngineLibraryLoader {

    private static final Logger LOG = Logger.getLogger(EngineLibraryLoader.class.getName());

    static final String ENGINE_LIBRARY = "tsetlin_machine_c";
    static final String FLATCC_RUNTIME = "flatccrt";

    // dlopen flags
    private static final int RTLD_LAZY = 0x1;
    private static final int RTLD_GLOBAL_LINUX = 0x100;
    private static final int RTLD_GLOBAL_MACOS = 0x8;

    private EngineLibraryLoader() {}

    /**
     * Returns the file name of {@code base} on the named operating system, e.g.
     * {@code libtsetlin_machine_c.so}. The {@code lib} prefix is used on every platform.
     */
    static String fileName(String base, String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        String extension;
        if (os.contains("win")) {
            extension = ".dll";
        } else if (os.contains("mac") || os.contains("darwin")) {
            extension = ".dylib";
        } else {
            extension = ".so";
        }
        return "lib" + base + extension;
    }

    static String engineFileName() {
        return fileName(ENGINE_LIBRARY, System.getProperty("os.name"));
    }

    /**
     * Returns the dlopen flags for the current platform, or {@code null} on Windows.
     */
    static Integer openFlags() {
        if (Platform.isWindows()) {
            return null;
        }
        return RTLD_LAZY | (Platform.isMac() ? RTLD_GLOBAL_MACOS : RTLD_GLOBAL_LINUX);
    }

    /**
     * Opens the engine library.
     *
     * @param directory directory holding the library, or {@code null} to search
     *                  {@code jna.library.path} and the system paths
     * @throws EngineException with {@code LINK_FAILED} if the library cannot be opened
     */
    public static NativeLibrary load(Path directory) {
        Integer flags = openFlags();
        Map<String, Object> options = flags == null ? Map.of() : Map.of(Library.OPTION_OPEN_FLAGS, flags);

        if (directory == null) {
            LOG.fine("No engine library directory configured; searching default paths");
            return open(ENGINE_LIBRARY, options);
        }

        Path engine = directory.resolve(engineFileName());
        if (!Files.isRegularFile(engine)) {
            throw EngineException.linkFailed(engine + " does not exist", null);
        }

        Path runtime = directory.resolve(fileName(FLATCC_RUNTIME, System.getProperty("os.name")));
        if (Files.isRegularFile(runtime)) {
            open(runtime.toAbsolutePath().toString(), options);
            LOG.fine(() -> "Opened FlatBuffers runtime " + runtime);
        } else {
            LOG.fine(() -> "No FlatBuffers runtime at " + runtime + "; self-describing primitives may be absent");
        }

        NativeLibrary library = open(engine.toAbsolutePath().toString(), options);
        LOG.info("Loaded Tsetlin Machine engine from " + engine);
        return library;
    }

    private static NativeLibrary open(String name, Map<String, Object> options) {
        try {
            return NativeLibrary.getInstance(name, options);
        } catch (UnsatisfiedLinkError e) {
            throw EngineException.linkFailed("cannot open " + name, e);
        }
    }
}

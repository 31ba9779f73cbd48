package io.surfworks.tsetlin.data.format;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Model file kinds.
 */
public enum ModelFormat {

    /** Dense raw binary, {@code .bin}. */
    RAW(".bin"),

    /** Sparse node-list raw binary, {@code .sbin}. */
    SPARSE_RAW(".sbin"),

    /** FlatBuffers container, {@code .fbs}. */
    SELF_DESCRIBING(".fbs");

    private final String extension;

    ModelFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Guesses the format from the file name. Unknown extensions are treated as {@link #RAW}.
     */
    public static ModelFormat fromPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (ModelFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        return RAW;
    }

    /**
     * Parses a CLI-style name: {@code raw}, {@code sparse-raw} or {@code self-describing} (alias {@code fbs}).
     */
    public static ModelFormat parse(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "raw", "bin" -> RAW;
            case "sparse-raw", "sparse", "sbin" -> SPARSE_RAW;
            case "self-describing", "fbs", "flatbuffers" -> SELF_DESCRIBING;
            default -> throw new IllegalArgumentException("Unknown model format: " + name);
        };
    }
}

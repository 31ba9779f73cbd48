package io.surfworks.tsetlin.core.util;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes files through a sibling temporary file and a rename, so readers see
 * either the old contents or the complete new contents.
 */
public final class AtomicFiles {

    private static final Logger LOG = Logger.getLogger(AtomicFiles.class.getName());

    private AtomicFiles() {} // Utility class

    /**
     * Produces file contents from a temporary path.
     */
    @FunctionalInterface
    public interface PathWriter {
        void writeTo(Path temp) throws IOException;
    }

    /**
     * Produces file contents on a stream.
     */
    @FunctionalInterface
    public interface StreamWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    /**
     * Lets {@code writer} fill a temporary file, then moves it onto {@code target}.
     *
     * @throws IOException if the writer fails, leaves the file empty, or the move fails
     */
    public static void writeVia(Path target, PathWriter writer) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
        boolean moved = false;
        try {
            writer.writeTo(temp);
            if (Files.size(temp) == 0) {
                throw new IOException("Nothing was written for " + target);
            }
            move(temp, absolute);
            moved = true;
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Streams contents into a temporary file, then moves it onto {@code target}.
     */
    public static void write(Path target, StreamWriter writer) throws IOException {
        writeVia(target, temp -> {
            try (OutputStream out = Files.newOutputStream(temp)) {
                writer.writeTo(out);
            }
        });
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.fine(() -> "Atomic move not supported, replacing " + target + " non-atomically");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to delete temporary file " + temp, e);
        }
    }
}

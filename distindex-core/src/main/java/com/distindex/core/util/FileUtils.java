package com.distindex.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Prepares a path to receive a freshly generated database file.
     *
     * <p>Creates the parent directory if needed and removes any file already at
     * {@code target}. Every run rebuilds the store from scratch.
     *
     * @param target database file path
     * @throws IOException if the directory cannot be created or the old file cannot be removed
     */
    public static void prepareTarget(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
            if (!Files.isDirectory(parent)) {
                throw new IOException("Failed to create '" + parent + "'");
            }
        }
        Files.deleteIfExists(target);
        if (Files.exists(target)) {
            throw new IOException("Failed to clear " + target);
        }
    }

    /**
     * Checks if a path is an existing, readable regular file.
     *
     * @param path path to check, may be null
     * @return true if the file can be read
     */
    public static boolean isReadableFile(Path path) {
        return path != null && Files.isRegularFile(path) && Files.isReadable(path);
    }

    /**
     * Returns how long ago a file was last modified.
     *
     * @param path file path
     * @param now reference instant
     * @return age of the file, or empty if it cannot be determined
     */
    public static Optional<Duration> age(Path path, Instant now) {
        if (!isReadableFile(path)) {
            return Optional.empty();
        }
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            Duration age = Duration.between(modified.toInstant(), now);
            return Optional.of(age.isNegative() ? Duration.ZERO : age);
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}

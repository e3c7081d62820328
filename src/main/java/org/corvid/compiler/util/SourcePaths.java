package org.corvid.compiler.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Helpers for presenting source file paths to the user.
 */
public final class SourcePaths {

    private SourcePaths() {}

    /**
     * Renders a file path relative to the current working directory if it lies beneath it.
     * @param file The file path as known to the compiler.
     * @return The relative path, or {@code file} unchanged.
     */
    public static String relativeToCwd(String file) {
        return relativeTo(file, Path.of("").toAbsolutePath());
    }

    /**
     * Renders a file path relative to {@code base} if it lies beneath it.
     * Relative paths and paths outside {@code base} are returned unchanged.
     *
     * @param file The file path.
     * @param base An absolute directory.
     * @return The relative path, or {@code file} unchanged.
     */
    public static String relativeTo(String file, Path base) {
        final Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException e) {
            return file;
        }
        if (!path.isAbsolute()) {
            return file;
        }
        Path normalized = path.normalize();
        Path normalizedBase = base.normalize();
        if (normalized.equals(normalizedBase) || !normalized.startsWith(normalizedBase)) {
            return file;
        }
        return normalizedBase.relativize(normalized).toString();
    }
}

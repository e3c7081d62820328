package org.corvid.compiler.api;

import java.util.Objects;

/**
 * A pure data class representing a resolved position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number, or {@code 0} if no specific line is known.
 */
public record SourceLocation(String fileName, int lineNumber) {

    /** Line number used when a diagnostic is not tied to a specific line. */
    public static final int NO_LINE = 0;

    public SourceLocation {
        Objects.requireNonNull(fileName, "fileName");
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must not be negative: " + lineNumber);
        }
    }

    /**
     * Creates a location that is not tied to a specific line.
     * @param fileName The file name.
     * @return A location with line {@link #NO_LINE}.
     */
    public static SourceLocation ofFile(String fileName) {
        return new SourceLocation(fileName, NO_LINE);
    }

    /**
     * @return {@code true} if this location points at a concrete line.
     */
    public boolean hasLine() {
        return lineNumber != NO_LINE;
    }

    /**
     * Renders the location as {@code file} or {@code file:line}.
     * @return The rendered location.
     */
    public String describe() {
        return hasLine() ? fileName + ":" + lineNumber : fileName;
    }

    @Override
    public String toString() {
        return describe();
    }
}

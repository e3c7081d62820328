package org.corvid.compiler.diagnostics;

import org.corvid.compiler.api.DiagnosticKind;
import org.corvid.compiler.api.SourceLocation;

import java.util.Objects;

/**
 * Represents a single fatal diagnostic that occurs during the compilation process.
 *
 * @param kind The kind of the diagnostic.
 * @param message The normalized, user-facing message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue, {@code 0} if none.
 */
public record Diagnostic(
        DiagnosticKind kind,
        String message,
        String fileName,
        int lineNumber
) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(fileName, "fileName");
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number must not be negative: " + lineNumber);
        }
    }

    /**
     * Creates a diagnostic at the given resolved location.
     * @param kind The kind of the diagnostic.
     * @param message The message.
     * @param location The resolved location.
     * @return The diagnostic.
     */
    public static Diagnostic at(DiagnosticKind kind, String message, SourceLocation location) {
        return new Diagnostic(kind, message, location.fileName(), location.lineNumber());
    }

    /**
     * @return The location of this diagnostic.
     */
    public SourceLocation location() {
        return new SourceLocation(fileName, lineNumber);
    }

    @Override
    public String toString() {
        return String.format("%s: %s", location().describe(), message);
    }
}

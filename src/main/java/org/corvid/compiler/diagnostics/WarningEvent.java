package org.corvid.compiler.diagnostics;

import org.corvid.compiler.api.SourceLocation;

/**
 * A warning forwarded to the compilation session.
 *
 * @param fileName The file the warning refers to.
 * @param lineNumber The line, {@code 0} if none.
 * @param text The warning text.
 */
public record WarningEvent(String fileName, int lineNumber, String text) {

    public SourceLocation location() {
        return new SourceLocation(fileName, lineNumber);
    }
}

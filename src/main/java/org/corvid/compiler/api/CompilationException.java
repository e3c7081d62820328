package org.corvid.compiler.api;

import org.corvid.compiler.diagnostics.Diagnostic;

/**
 * Thrown when a fatal diagnostic aborts the current compilation unit.
 * <p>
 * The exception unwinds to the nearest enclosing handler, which is responsible for
 * presenting it. Its message has the form {@code file[:line]: description}.
 */
public class CompilationException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new compilation exception carrying the given diagnostic.
     * @param diagnostic The diagnostic that aborted the compilation.
     */
    public CompilationException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    /**
     * @return The diagnostic carried by this exception.
     */
    public Diagnostic diagnostic() {
        return diagnostic;
    }

    public DiagnosticKind kind() {
        return diagnostic.kind();
    }

    /**
     * @return The normalized message without the location prefix.
     */
    public String description() {
        return diagnostic.message();
    }

    public String file() {
        return diagnostic.fileName();
    }

    public int line() {
        return diagnostic.lineNumber();
    }
}

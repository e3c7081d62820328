package org.corvid.compiler.diagnostics;

/**
 * The component that tracks the warnings of a running compilation.
 * <p>
 * Implementations must not block: both methods are called from the compiling thread
 * while it reports a warning.
 */
public interface CompilationSession {

    /**
     * Delivers a located warning. Fire-and-forget, no acknowledgment is expected.
     * @param event The warning.
     */
    void notifyWarning(WarningEvent event);

    /**
     * Increments the number of warnings emitted by the compilation.
     */
    void registerWarning();
}

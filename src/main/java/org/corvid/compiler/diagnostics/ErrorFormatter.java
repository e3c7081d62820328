package org.corvid.compiler.diagnostics;

/**
 * Turns the error description of a compiler pass into message text.
 *
 * @param <D> The type of description the pass reports.
 */
@FunctionalInterface
public interface ErrorFormatter<D> {

    /**
     * @param description The pass-specific description of the problem.
     * @return The message text.
     */
    String formatError(D description);
}

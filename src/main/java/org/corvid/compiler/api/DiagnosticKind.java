package org.corvid.compiler.api;

/**
 * The closed set of fatal diagnostic kinds a compilation unit can be aborted with.
 */
public enum DiagnosticKind {
    /** A generic compile-time failure with a caller-supplied message. */
    COMPILE_ERROR("CompileError"),
    /** The input ended before a construct was complete. */
    TOKEN_MISSING_ERROR("TokenMissingError"),
    /** A malformed token sequence. */
    SYNTAX_ERROR("SyntaxError");

    private final String displayName;

    DiagnosticKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The user-facing name of this kind, e.g. {@code SyntaxError}.
     */
    public String displayName() {
        return displayName;
    }
}

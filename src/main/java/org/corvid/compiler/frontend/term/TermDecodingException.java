package org.corvid.compiler.frontend.term;

/**
 * Thrown when a structured token cannot be decoded, either because its text is not a
 * well-formed term or because the term does not have the expected shape.
 * <p>
 * Structured tokens are produced by the compiler itself, so this signals an internal
 * invariant violation rather than a problem with user input.
 */
public class TermDecodingException extends RuntimeException {

    private final int column;

    /**
     * @param message The detail message.
     * @param column The 1-based column of the failure, or {@code -1} if it concerns the whole term.
     */
    public TermDecodingException(String message, int column) {
        super(column > 0 ? message + " (column " + column + ")" : message);
        this.column = column;
    }

    /**
     * @param message The detail message.
     */
    public TermDecodingException(String message) {
        this(message, -1);
    }

    public int getColumn() {
        return column;
    }
}

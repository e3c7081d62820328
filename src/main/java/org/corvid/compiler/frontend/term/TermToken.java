package org.corvid.compiler.frontend.term;

/**
 * Represents a single token extracted from a serialized term by the {@link TermLexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param value The processed value of the token (atom name, {@link java.math.BigInteger},
 *              {@link Double} or string contents), {@code null} for punctuation.
 * @param column The 1-based column where the token begins.
 */
public record TermToken(
        TermTokenType type,
        String text,
        Object value,
        int column
) {
    /**
     * Creates the terminator that is appended after the last scanned token.
     * @param column The column just past the input.
     * @return A {@link TermTokenType#DOT} token.
     */
    static TermToken terminator(int column) {
        return new TermToken(TermTokenType.DOT, ".", null, column);
    }
}

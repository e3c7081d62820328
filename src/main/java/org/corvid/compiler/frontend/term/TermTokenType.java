package org.corvid.compiler.frontend.term;

/**
 * Defines the different types of tokens that the {@link TermLexer} can recognize.
 */
public enum TermTokenType {
    // Delimiters.
    /** The '{' character, opening a tuple. */
    LEFT_BRACE,
    /** The '}' character, closing a tuple. */
    RIGHT_BRACE,
    /** The '[' character, opening a list. */
    LEFT_BRACKET,
    /** The ']' character, closing a list. */
    RIGHT_BRACKET,
    /** The '&lt;&lt;' sequence, opening a binary. */
    BINARY_OPEN,
    /** The '&gt;&gt;' sequence, closing a binary. */
    BINARY_CLOSE,

    // Punctuation.
    /** The ',' separator. */
    COMMA,
    /** The '|' separator of an improper list tail. */
    PIPE,
    /** The ':' of a binary segment size. */
    COLON,
    /** The '/' of a binary segment type specifier. */
    SLASH,
    /** A sign in front of a number. */
    MINUS,
    /** A sign in front of a number. */
    PLUS,

    // Literals.
    /** An atom, bare or quoted. */
    ATOM,
    /** A variable name. Never valid in a term, kept for error reporting. */
    VARIABLE,
    /** An integer, including character literals such as {@code $a}. */
    INTEGER,
    /** A floating-point number. */
    FLOAT,
    /** A double-quoted string. */
    STRING,

    // Miscellaneous.
    /** The terminator that ends a term. */
    DOT
}

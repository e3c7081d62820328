package org.corvid.compiler.diagnostics.normalize;

import java.util.Objects;

/**
 * A failure reported by the lexer or parser before it is turned into a diagnostic.
 *
 * @param prefix The error text.
 * @param token The literal text of the offending token, empty if the input ended.
 */
public record RawErrorFragment(ErrorPrefix prefix, String token) {

    public RawErrorFragment {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(token, "token");
    }

    public static RawErrorFragment of(String prefix, String token) {
        return new RawErrorFragment(ErrorPrefix.of(prefix), token);
    }

    /**
     * @return {@code true} if the prefix is plain text equal to the given value.
     */
    boolean hasPlainPrefix(String text) {
        return prefix instanceof ErrorPrefix.Plain plain && plain.text().equals(text);
    }

    boolean hasPlainPrefix() {
        return prefix instanceof ErrorPrefix.Plain;
    }
}

package org.corvid.compiler.frontend.term;

import java.util.List;
import java.util.Optional;

/**
 * The structured content extracted from an offending token that was reported as a serialized term.
 */
public sealed interface DecodedToken {

    /**
     * A sigil.
     * @param tag The sigil letter, e.g. {@code r} for {@code ~r}.
     * @param content The first content part if it is plain text.
     */
    record Sigil(String tag, Optional<String> content) implements DecodedToken {}

    /**
     * A quoted alias.
     * @param name The alias name.
     */
    record Identifier(String name) implements DecodedToken {}

    /**
     * A list wrapping binary or interpolated content.
     * @param elements The list elements.
     */
    record ListValue(List<Term> elements) implements DecodedToken {
        public ListValue {
            elements = List.copyOf(elements);
        }

        /**
         * @return The first element if it is a binary.
         */
        public Optional<String> leadingText() {
            if (!elements.isEmpty() && elements.get(0) instanceof Term.BinaryTerm binary) {
                return Optional.of(binary.text());
            }
            return Optional.empty();
        }
    }
}

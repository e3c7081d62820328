package org.corvid.compiler.frontend.term;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * A decoded term value.
 */
public sealed interface Term {

    /**
     * An atom such as {@code sigil} or {@code 'Elixir.Foo'}.
     * @param name The atom text without quotes.
     */
    record Atom(String name) implements Term {}

    /**
     * An integer, also used for character literals.
     * @param value The value.
     */
    record IntegerTerm(BigInteger value) implements Term {}

    record FloatTerm(double value) implements Term {}

    /**
     * A binary, decoded as UTF-8 text.
     * @param text The contents.
     */
    record BinaryTerm(String text) implements Term {}

    /**
     * A double-quoted string, which is a list of character codes rather than a binary.
     * @param text The contents.
     */
    record StringTerm(String text) implements Term {}

    record TupleTerm(List<Term> elements) implements Term {
        public TupleTerm {
            elements = List.copyOf(elements);
        }
    }

    /**
     * A list. Proper lists have no tail; {@code [a | b]} keeps {@code b} as its tail.
     * @param elements The elements before the tail.
     * @param tail The improper tail, if any.
     */
    record ListTerm(List<Term> elements, Optional<Term> tail) implements Term {
        public ListTerm {
            elements = List.copyOf(elements);
        }

        public static ListTerm proper(List<Term> elements) {
            return new ListTerm(elements, Optional.empty());
        }
    }
}

package org.corvid.compiler.frontend.term;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes offending tokens that the parser reports as serialized terms instead of plain text.
 * <p>
 * Each method tokenizes the text with the {@link TermLexer}, appends the terminator,
 * parses exactly one term with the {@link TermParser} and checks the expected shape.
 */
public final class StructuredTokenDecoder {

    private static final int SIGIL_TUPLE_SIZE = 6;

    private StructuredTokenDecoder() {}

    /**
     * Decodes a sigil token of the shape {@code {sigil, Meta, Tag, [Content | _], Modifiers, Delimiter}}.
     * @param text The serialized token.
     * @return The sigil tag and its content, if the content is plain text.
     * @throws TermDecodingException if the text is malformed or not a sigil.
     */
    public static DecodedToken.Sigil decodeSigil(String text) {
        Term term = decodeTerm(text);
        if (!(term instanceof Term.TupleTerm tuple)
                || tuple.elements().size() != SIGIL_TUPLE_SIZE
                || !new Term.Atom("sigil").equals(tuple.elements().get(0))) {
            throw new TermDecodingException("Not a sigil token: " + text);
        }
        if (!(tuple.elements().get(2) instanceof Term.IntegerTerm tag) || !isCodePoint(tag.value())) {
            throw new TermDecodingException("Sigil tag is not a character: " + text);
        }
        if (!(tuple.elements().get(3) instanceof Term.ListTerm parts) || parts.elements().isEmpty()) {
            throw new TermDecodingException("Sigil has no content parts: " + text);
        }
        Optional<String> content = parts.elements().get(0) instanceof Term.BinaryTerm binary
                ? Optional.of(binary.text())
                : Optional.empty();
        return new DecodedToken.Sigil(new String(Character.toChars(tag.value().intValue())), content);
    }

    private static boolean isCodePoint(BigInteger value) {
        return value.bitLength() < Integer.SIZE && Character.isValidCodePoint(value.intValue());
    }

    /**
     * Decodes an alias token of the shape {@code ['Name']}.
     * @param text The serialized token.
     * @return The alias name.
     * @throws TermDecodingException if the text is malformed or not a single wrapped atom.
     */
    public static DecodedToken.Identifier decodeAlias(String text) {
        Term term = decodeTerm(text);
        if (term instanceof Term.ListTerm list
                && list.tail().isEmpty()
                && list.elements().size() == 1
                && list.elements().get(0) instanceof Term.Atom atom) {
            return new DecodedToken.Identifier(atom.name());
        }
        throw new TermDecodingException("Not an alias token: " + text);
    }

    /**
     * Decodes a token that wraps binary or interpolated content in a list.
     * @param text The serialized token.
     * @return The list elements.
     * @throws TermDecodingException if the text is malformed or not a list.
     */
    public static DecodedToken.ListValue decodeList(String text) {
        Term term = decodeTerm(text);
        if (term instanceof Term.ListTerm list) {
            return new DecodedToken.ListValue(list.elements());
        }
        throw new TermDecodingException("Not a list token: " + text);
    }

    static Term decodeTerm(String text) {
        List<TermToken> tokens = new ArrayList<>(new TermLexer(text).scanTokens());
        tokens.add(TermToken.terminator(text.length() + 1));
        return new TermParser(tokens).parse();
    }
}

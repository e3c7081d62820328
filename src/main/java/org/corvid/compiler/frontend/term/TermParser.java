package org.corvid.compiler.frontend.term;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a token stream produced by the {@link TermLexer} into exactly one {@link Term}.
 * The stream must end with a {@link TermTokenType#DOT} terminator.
 */
public class TermParser {

    private final List<TermToken> tokens;
    private int current = 0;

    /**
     * Constructs a new TermParser.
     * @param tokens The tokens to parse, ending with a terminator.
     */
    public TermParser(List<TermToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a single term followed by the terminator.
     * @return The parsed term.
     * @throws TermDecodingException if the tokens do not form exactly one term.
     */
    public Term parse() {
        Term term = term();
        consume(TermTokenType.DOT, "Expected end of term");
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected token after end of term: " + peek().text());
        }
        return term;
    }

    private Term term() {
        TermToken token = advance();
        switch (token.type()) {
            case LEFT_BRACE:
                return new Term.TupleTerm(elements(TermTokenType.RIGHT_BRACE));
            case LEFT_BRACKET:
                return list();
            case BINARY_OPEN:
                return binary();
            case ATOM:
                return new Term.Atom((String) token.value());
            case INTEGER:
                return new Term.IntegerTerm((BigInteger) token.value());
            case FLOAT:
                return new Term.FloatTerm((Double) token.value());
            case STRING:
                return new Term.StringTerm(adjacentStrings((String) token.value()));
            case MINUS:
            case PLUS:
                return signedNumber(token);
            case VARIABLE:
                throw error(token, "Variables are not allowed in a term: " + token.text());
            default:
                throw error(token, "Unexpected token: " + describe(token));
        }
    }

    private List<Term> elements(TermTokenType closing) {
        List<Term> elements = new ArrayList<>();
        if (match(closing)) {
            return elements;
        }
        do {
            elements.add(term());
        } while (match(TermTokenType.COMMA));
        consume(closing, "Expected ',' or closing delimiter");
        return elements;
    }

    private Term list() {
        List<Term> elements = new ArrayList<>();
        if (match(TermTokenType.RIGHT_BRACKET)) {
            return Term.ListTerm.proper(elements);
        }
        do {
            elements.add(term());
        } while (match(TermTokenType.COMMA));

        Optional<Term> tail = Optional.empty();
        if (match(TermTokenType.PIPE)) {
            Term tailTerm = term();
            if (tailTerm instanceof Term.ListTerm tailList) {
                // [a | [b, c]] is the proper list [a, b, c]
                elements.addAll(tailList.elements());
                tail = tailList.tail();
            } else {
                tail = Optional.of(tailTerm);
            }
        }
        consume(TermTokenType.RIGHT_BRACKET, "Expected ',', '|' or ']'");
        return new Term.ListTerm(elements, tail);
    }

    private Term binary() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        if (!match(TermTokenType.BINARY_CLOSE)) {
            do {
                segment(bytes);
            } while (match(TermTokenType.COMMA));
            consume(TermTokenType.BINARY_CLOSE, "Expected ',' or '>>'");
        }
        return new Term.BinaryTerm(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
    }

    private void segment(ByteArrayOutputStream bytes) {
        TermToken value = advance();
        if (value.type() != TermTokenType.STRING && value.type() != TermTokenType.INTEGER) {
            throw error(value, "Unsupported binary segment: " + describe(value));
        }
        if (match(TermTokenType.COLON)) {
            TermToken size = consume(TermTokenType.INTEGER, "Expected segment size");
            if (!BigInteger.valueOf(8).equals(size.value())) {
                throw error(size, "Unsupported binary segment size: " + size.text());
            }
        }
        boolean utf8 = false;
        if (match(TermTokenType.SLASH)) {
            do {
                TermToken specifier = consume(TermTokenType.ATOM, "Expected segment type");
                String name = (String) specifier.value();
                switch (name) {
                    case "utf8" -> utf8 = true;
                    case "integer", "unsigned", "big", "binary" -> { }
                    default -> throw error(specifier, "Unsupported binary segment type: " + name);
                }
            } while (match(TermTokenType.MINUS));
        }

        if (value.type() == TermTokenType.STRING) {
            boolean encodeUtf8 = utf8;
            String text = adjacentStrings((String) value.value());
            text.codePoints().forEach(codePoint -> writeCodePoint(bytes, codePoint, encodeUtf8));
            return;
        }
        BigInteger number = (BigInteger) value.value();
        if (utf8 && (number.bitLength() >= Integer.SIZE || !Character.isValidCodePoint(number.intValue()))) {
            throw error(value, "Invalid utf8 segment value: " + value.text());
        }
        writeCodePoint(bytes, number.intValue(), utf8);
    }

    private static void writeCodePoint(ByteArrayOutputStream bytes, int codePoint, boolean utf8) {
        if (utf8) {
            byte[] encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
            bytes.write(encoded, 0, encoded.length);
        } else {
            bytes.write(codePoint & 0xFF);
        }
    }

    private String adjacentStrings(String first) {
        StringBuilder sb = new StringBuilder(first);
        while (check(TermTokenType.STRING)) {
            sb.append((String) advance().value());
        }
        return sb.toString();
    }

    private Term signedNumber(TermToken sign) {
        TermToken number = advance();
        boolean negate = sign.type() == TermTokenType.MINUS;
        if (number.type() == TermTokenType.INTEGER) {
            BigInteger value = (BigInteger) number.value();
            return new Term.IntegerTerm(negate ? value.negate() : value);
        }
        if (number.type() == TermTokenType.FLOAT) {
            double value = (Double) number.value();
            return new Term.FloatTerm(negate ? -value : value);
        }
        throw error(number, "Expected a number after '" + sign.text() + "'");
    }

    private TermToken consume(TermTokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message + ", found " + describe(peek()));
    }

    private boolean match(TermTokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TermTokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private TermToken advance() {
        if (isAtEnd()) {
            throw new TermDecodingException("Unexpected end of input");
        }
        return tokens.get(current++);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private TermToken peek() {
        if (isAtEnd()) {
            throw new TermDecodingException("Unexpected end of input");
        }
        return tokens.get(current);
    }

    private static String describe(TermToken token) {
        return token.type() == TermTokenType.DOT ? "end of term" : "'" + token.text() + "'";
    }

    private static TermDecodingException error(TermToken token, String message) {
        return new TermDecodingException(message, token.column());
    }
}

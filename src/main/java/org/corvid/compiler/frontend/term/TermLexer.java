package org.corvid.compiler.frontend.term;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts the text of a serialized term into a sequence of tokens.
 * <p>
 * The lexer follows the generic lexical grammar terms are printed in: bare and quoted
 * atoms, variables, integers (including {@code base#digits} and {@code $c} character
 * literals), floats, double-quoted strings, binary delimiters and punctuation.
 * It does not append a terminator; that is the caller's job.
 */
public class TermLexer {

    private static final Set<String> RESERVED_WORDS = Set.of(
            "after", "and", "andalso", "band", "begin", "bnot", "bor", "bsl", "bsr", "bxor",
            "case", "catch", "cond", "div", "end", "fun", "if", "let", "not", "of", "or",
            "orelse", "receive", "rem", "try", "when", "xor");

    private final String source;
    private final List<TermToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new TermLexer.
     * @param source The serialized term.
     */
    public TermLexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire input.
     * @return The recognized tokens, without a terminator.
     * @throws TermDecodingException if the input contains a character or literal that cannot be scanned.
     */
    public List<TermToken> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n':
                break;
            case '%':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '{': addToken(TermTokenType.LEFT_BRACE); break;
            case '}': addToken(TermTokenType.RIGHT_BRACE); break;
            case '[': addToken(TermTokenType.LEFT_BRACKET); break;
            case ']': addToken(TermTokenType.RIGHT_BRACKET); break;
            case ',': addToken(TermTokenType.COMMA); break;
            case '|': addToken(TermTokenType.PIPE); break;
            case ':': addToken(TermTokenType.COLON); break;
            case '/': addToken(TermTokenType.SLASH); break;
            case '-': addToken(TermTokenType.MINUS); break;
            case '+': addToken(TermTokenType.PLUS); break;
            case '<':
                if (!match('<')) throw error("Unexpected character: <");
                addToken(TermTokenType.BINARY_OPEN);
                break;
            case '>':
                if (!match('>')) throw error("Unexpected character: >");
                addToken(TermTokenType.BINARY_CLOSE);
                break;
            case '.':
                // Only a dot followed by whitespace, a comment or the end of input terminates a term.
                if (!isAtEnd() && !isWhitespace(peek()) && peek() != '%') {
                    throw error("Unexpected character: .");
                }
                addToken(TermTokenType.DOT);
                break;
            case '\'': quotedAtom(); break;
            case '"': string(); break;
            case '$': character(); break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (Character.isLowerCase(c)) {
                    atom();
                } else if (Character.isUpperCase(c) || c == '_') {
                    variable();
                } else {
                    throw error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void atom() {
        while (isNameChar(peek())) advance();
        String text = source.substring(start, current);
        if (RESERVED_WORDS.contains(text)) {
            throw error("Reserved word is not a valid term: " + text);
        }
        addToken(TermTokenType.ATOM, text);
    }

    private void variable() {
        while (isNameChar(peek())) advance();
        addToken(TermTokenType.VARIABLE, source.substring(start, current));
    }

    private void quotedAtom() {
        addToken(TermTokenType.ATOM, quoted('\'', "Unterminated quoted atom"));
    }

    private void string() {
        addToken(TermTokenType.STRING, quoted('"', "Unterminated string"));
    }

    private String quoted(char quote, String unterminatedMessage) {
        StringBuilder sb = new StringBuilder();
        while (peek() != quote && !isAtEnd()) {
            char c = advance();
            if (c == '\\') {
                sb.appendCodePoint(escape());
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) {
            throw error(unterminatedMessage);
        }
        // The closing quote
        advance();
        return sb.toString();
    }

    private void character() {
        if (isAtEnd()) {
            throw error("Character literal is missing its character");
        }
        char c = advance();
        int codePoint;
        if (c == '\\') {
            codePoint = escape();
        } else if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
            codePoint = Character.toCodePoint(c, advance());
        } else {
            codePoint = c;
        }
        addToken(TermTokenType.INTEGER, BigInteger.valueOf(codePoint));
    }

    private int escape() {
        if (isAtEnd()) {
            throw error("Unterminated escape sequence");
        }
        char c = advance();
        switch (c) {
            case 'b': return '\b';
            case 'd': return 127;
            case 'e': return 27;
            case 'f': return '\f';
            case 'n': return '\n';
            case 'r': return '\r';
            case 's': return ' ';
            case 't': return '\t';
            case 'v': return 11;
            case '^':
                if (isAtEnd()) throw error("Unterminated escape sequence");
                return advance() & 31;
            case 'x':
                return hexEscape();
            default:
                if (isOctalDigit(c)) {
                    int value = c - '0';
                    for (int i = 0; i < 2 && isOctalDigit(peek()); i++) {
                        value = value * 8 + (advance() - '0');
                    }
                    return value;
                }
                return c;
        }
    }

    private int hexEscape() {
        int digitsStart;
        int digitsEnd;
        if (match('{')) {
            digitsStart = current;
            while (isHexDigit(peek())) advance();
            digitsEnd = current;
            if (!match('}')) throw error("Unterminated hexadecimal escape");
        } else {
            digitsStart = current;
            for (int i = 0; i < 2 && isHexDigit(peek()); i++) advance();
            digitsEnd = current;
        }
        if (digitsStart == digitsEnd) {
            throw error("Hexadecimal escape without digits");
        }
        String digits = source.substring(digitsStart, digitsEnd);
        int codePoint;
        try {
            codePoint = Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw error("Invalid hexadecimal escape: " + digits);
        }
        if (!Character.isValidCodePoint(codePoint)) {
            throw error("Hexadecimal escape is not a character: " + digits);
        }
        return codePoint;
    }

    private void number() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();

        if (peek() == '#') {
            int radix = parseRadix(source.substring(start, current));
            advance(); // consume '#'
            int digitsStart = current;
            while (isAlphaNumeric(peek()) || (peek() == '_' && isAlphaNumeric(peekNext()))) advance();
            String digits = source.substring(digitsStart, current).replace("_", "");
            try {
                addToken(TermTokenType.INTEGER, new BigInteger(digits, radix));
            } catch (NumberFormatException e) {
                throw error("Invalid base " + radix + " integer: " + source.substring(start, current));
            }
            return;
        }

        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
            if ((peek() == 'e' || peek() == 'E') && isExponentStart()) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
            String text = source.substring(start, current).replace("_", "");
            addToken(TermTokenType.FLOAT, Double.parseDouble(text));
            return;
        }

        addToken(TermTokenType.INTEGER, new BigInteger(source.substring(start, current).replace("_", "")));
    }

    private int parseRadix(String text) {
        int radix;
        try {
            radix = Integer.parseInt(text.replace("_", ""));
        } catch (NumberFormatException e) {
            throw error("Invalid integer base: " + text);
        }
        if (radix < Character.MIN_RADIX || radix > Character.MAX_RADIX) {
            throw error("Integer base out of range: " + radix);
        }
        return radix;
    }

    private boolean isExponentStart() {
        char next = peekNext();
        if (isDigit(next)) return true;
        return (next == '+' || next == '-') && current + 2 < source.length() && isDigit(source.charAt(current + 2));
    }

    private void addToken(TermTokenType type) {
        addToken(type, null);
    }

    private void addToken(TermTokenType type, Object value) {
        tokens.add(new TermToken(type, source.substring(start, current), value, start + 1));
    }

    private TermDecodingException error(String message) {
        return new TermDecodingException(message, start + 1);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlphaNumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c);
    }

    private boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '@';
    }
}

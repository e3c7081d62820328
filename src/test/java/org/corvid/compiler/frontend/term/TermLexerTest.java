package org.corvid.compiler.frontend.term;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link TermLexer}.
 * These tests verify that serialized terms are split into the expected tokens and that
 * malformed input is rejected with the column of the offending character.
 */
@Tag("unit")
public class TermLexerTest {

    @Test
    void testSigilTokenization() {
        // Arrange
        TermLexer lexer = new TermLexer("{sigil,1,114,[<<\"foo\">>],[],nil}");

        // Act
        List<TermToken> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(TermToken::type).containsExactly(
                TermTokenType.LEFT_BRACE, TermTokenType.ATOM, TermTokenType.COMMA,
                TermTokenType.INTEGER, TermTokenType.COMMA, TermTokenType.INTEGER, TermTokenType.COMMA,
                TermTokenType.LEFT_BRACKET, TermTokenType.BINARY_OPEN, TermTokenType.STRING,
                TermTokenType.BINARY_CLOSE, TermTokenType.RIGHT_BRACKET, TermTokenType.COMMA,
                TermTokenType.LEFT_BRACKET, TermTokenType.RIGHT_BRACKET, TermTokenType.COMMA,
                TermTokenType.ATOM, TermTokenType.RIGHT_BRACE);
        assertThat(tokens.get(1)).extracting(TermToken::text, TermToken::value).containsExactly("sigil", "sigil");
        assertThat(tokens.get(5).value()).isEqualTo(BigInteger.valueOf(114));
        assertThat(tokens.get(9).value()).isEqualTo("foo");
        assertThat(tokens.get(9).column()).isEqualTo(17);
    }

    @Test
    void testQuotedAtomKeepsDots() {
        List<TermToken> tokens = new TermLexer("['Elixir.Foo.Bar']").scanTokens();

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(1)).extracting(TermToken::type, TermToken::value)
                .containsExactly(TermTokenType.ATOM, "Elixir.Foo.Bar");
    }

    @Test
    void testNumbersAndCharacters() {
        List<TermToken> tokens = new TermLexer("16#FF 1_000 $a $\\n 1.5e3 2#101").scanTokens();

        assertThat(tokens).extracting(TermToken::value).containsExactly(
                BigInteger.valueOf(255), BigInteger.valueOf(1000), BigInteger.valueOf(97),
                BigInteger.valueOf(10), 1500.0, BigInteger.valueOf(5));
        assertThat(tokens.get(4).type()).isEqualTo(TermTokenType.FLOAT);
    }

    @Test
    void testStringEscapes() {
        List<TermToken> tokens = new TermLexer("\"a\\tb\\x41\\x{263A}\\101\\\"\"").scanTokens();

        assertThat(tokens).singleElement()
                .extracting(TermToken::value)
                .isEqualTo("a\tbA☺A\"");
    }

    @Test
    void testVariablesAndCommentsAreScanned() {
        List<TermToken> tokens = new TermLexer("[Foo, _bar] % trailing comment").scanTokens();

        assertThat(tokens).extracting(TermToken::type).containsExactly(
                TermTokenType.LEFT_BRACKET, TermTokenType.VARIABLE, TermTokenType.COMMA,
                TermTokenType.VARIABLE, TermTokenType.RIGHT_BRACKET);
    }

    @Test
    void testUnexpectedCharacterReportsColumn() {
        assertThatThrownBy(() -> new TermLexer("{a, #{}}").scanTokens())
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Unexpected character: #")
                .extracting(e -> ((TermDecodingException) e).getColumn())
                .isEqualTo(5);
    }

    @Test
    void testUnterminatedStringIsRejected() {
        assertThatThrownBy(() -> new TermLexer("[<<\"foo>>]").scanTokens())
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Unterminated string");
    }

    @Test
    void testHexEscapeOutsideUnicodeIsRejected() {
        assertThatThrownBy(() -> new TermLexer("[<<\"\\x{110000}\">>]").scanTokens())
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Hexadecimal escape is not a character: 110000");
    }

    @Test
    void testReservedWordIsRejected() {
        assertThatThrownBy(() -> new TermLexer("[end]").scanTokens())
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Reserved word");
    }
}

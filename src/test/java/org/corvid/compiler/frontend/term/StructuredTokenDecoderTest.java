package org.corvid.compiler.frontend.term;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StructuredTokenDecoder} and the {@link TermParser} behind it.
 */
@Tag("unit")
class StructuredTokenDecoderTest {

    @Test
    @DisplayName("Sigil with a binary content part yields its tag and content")
    void decodeSigil_withBinaryContent() {
        DecodedToken.Sigil sigil = StructuredTokenDecoder.decodeSigil("{sigil,1,114,[<<\"foo\">>],[],nil}");

        assertThat(sigil.tag()).isEqualTo("r");
        assertThat(sigil.content()).contains("foo");
    }

    @Test
    @DisplayName("Sigil starting with interpolation has no content")
    void decodeSigil_withInterpolatedContent() {
        DecodedToken.Sigil sigil = StructuredTokenDecoder.decodeSigil(
                "{sigil,3,115,[{'{',[{line,3}],[x]},<<\" tail\">>],[],nil}");

        assertThat(sigil.tag()).isEqualTo("s");
        assertThat(sigil.content()).isEmpty();
    }

    @Test
    @DisplayName("Sigil tuples of the wrong size are rejected")
    void decodeSigil_rejectsWrongShape() {
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeSigil("{sigil,1,114,[<<\"foo\">>]}"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Not a sigil token");
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeSigil("{sigil,1,114,[],[],nil}"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("no content parts");
    }

    @Test
    @DisplayName("Sigil tags that are not characters are rejected")
    void decodeSigil_rejectsInvalidTag() {
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeSigil("{sigil,1,-1,[<<\"a\">>],[],nil}"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Sigil tag is not a character");
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeSigil("{sigil,1,1114112,[<<\"a\">>],[],nil}"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Sigil tag is not a character");
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeSigil("{sigil,1,4294967410,[<<\"a\">>],[],nil}"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Sigil tag is not a character");
    }

    @Test
    void decodeList_rejectsUtf8SegmentOutsideUnicode() {
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeList("[<<1114112/utf8>>]"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Invalid utf8 segment value: 1114112")
                .extracting(e -> ((TermDecodingException) e).getColumn())
                .isEqualTo(4);
        assertThat(StructuredTokenDecoder.decodeList("[<<233/utf8>>]").leadingText()).contains("é");
    }

    @Test
    void decodeAlias_returnsAtomName() {
        assertThat(StructuredTokenDecoder.decodeAlias("['Foo']").name()).isEqualTo("Foo");
        assertThat(StructuredTokenDecoder.decodeAlias("['Elixir.Foo.Bar']").name()).isEqualTo("Elixir.Foo.Bar");
        assertThat(StructuredTokenDecoder.decodeAlias("[foo]").name()).isEqualTo("foo");
    }

    @Test
    void decodeAlias_rejectsListsThatAreNotASingleAtom() {
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeAlias("['Foo','Bar']"))
                .isInstanceOf(TermDecodingException.class);
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeAlias("['Foo' | tail]"))
                .isInstanceOf(TermDecodingException.class);
    }

    @Test
    void decodeList_exposesLeadingBinary() {
        assertThat(StructuredTokenDecoder.decodeList("[<<\"hello\">>]").leadingText()).contains("hello");
        assertThat(StructuredTokenDecoder.decodeList("[<<\"ol\\x{E1}\"/utf8>>, x]").leadingText()).contains("olá");
        assertThat(StructuredTokenDecoder.decodeList("[<<104,105>>]").leadingText()).contains("hi");
        assertThat(StructuredTokenDecoder.decodeList("[{interpolation,1}]").leadingText()).isEmpty();
        assertThat(StructuredTokenDecoder.decodeList("[]").leadingText()).isEmpty();
        assertThat(StructuredTokenDecoder.decodeList("[\"chars\"]").leadingText()).isEmpty();
    }

    @Test
    void decodeTerm_flattensProperTailsAndKeepsImproperOnes() {
        Term proper = StructuredTokenDecoder.decodeTerm("[a | [b, c]]");
        Term improper = StructuredTokenDecoder.decodeTerm("[a | b]");

        assertThat(proper).isEqualTo(Term.ListTerm.proper(List.of(
                new Term.Atom("a"), new Term.Atom("b"), new Term.Atom("c"))));
        assertThat(improper).isEqualTo(new Term.ListTerm(List.of(new Term.Atom("a")), Optional.of(new Term.Atom("b"))));
    }

    @Test
    void decodeTerm_handlesSignedNumbersAndAdjacentStrings() {
        Term term = StructuredTokenDecoder.decodeTerm("{-5, +2.5, \"ab\" \"cd\"}");

        assertThat(term).isEqualTo(new Term.TupleTerm(List.of(
                new Term.IntegerTerm(BigInteger.valueOf(-5)),
                new Term.FloatTerm(2.5),
                new Term.StringTerm("abcd"))));
    }

    @Test
    void decodeTerm_rejectsVariables() {
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeTerm("[Foo]"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Variables are not allowed");
    }

    @Test
    void decodeTerm_rejectsTrailingTokens() {
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeTerm("{a,b} extra"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Expected end of term, found 'extra'");
    }

    @Test
    void decodeTerm_rejectsIncompleteTerms() {
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeTerm("{a, b"))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("found end of term");
        assertThatThrownBy(() -> StructuredTokenDecoder.decodeTerm(""))
                .isInstanceOf(TermDecodingException.class)
                .hasMessageContaining("Unexpected token: end of term");
    }
}

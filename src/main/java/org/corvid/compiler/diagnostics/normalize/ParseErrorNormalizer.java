package org.corvid.compiler.diagnostics.normalize;

import org.corvid.compiler.api.DiagnosticKind;
import org.corvid.compiler.api.SourceLocation;
import org.corvid.compiler.diagnostics.Diagnostic;
import org.corvid.compiler.frontend.term.DecodedToken;
import org.corvid.compiler.frontend.term.StructuredTokenDecoder;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Rewrites raw parser failures into user-facing diagnostics.
 * <p>
 * Rules are tried in declaration order and the first matching rule produces the diagnostic.
 * The last rule matches every fragment. Tokens that the parser reports as serialized terms
 * (sigils, aliases and wrapped binaries) are decoded with the {@link StructuredTokenDecoder};
 * a malformed term propagates as {@link org.corvid.compiler.frontend.term.TermDecodingException}.
 */
public final class ParseErrorNormalizer {

    static final String SYNTAX_ERROR_BEFORE = "syntax error before: ";

    /**
     * A single entry of the rule table.
     *
     * @param name A short name of the rule, used in logs and tests.
     * @param matches Whether the rule applies to a fragment.
     * @param kind The kind of diagnostic the rule produces.
     * @param message Builds the message for a matching fragment.
     */
    record Rule(
            String name,
            Predicate<RawErrorFragment> matches,
            DiagnosticKind kind,
            Function<RawErrorFragment, String> message
    ) {}

    private static final List<Rule> RULES = List.of(
            new Rule("incomplete-expression",
                    f -> f.token().isEmpty() && f.hasPlainPrefix(SYNTAX_ERROR_BEFORE),
                    DiagnosticKind.TOKEN_MISSING_ERROR,
                    f -> "syntax error: expression is incomplete"),
            new Rule("missing-token",
                    f -> f.token().isEmpty(),
                    DiagnosticKind.TOKEN_MISSING_ERROR,
                    f -> f.prefix().render()),
            new Rule("end-of-line",
                    f -> f.hasPlainPrefix(SYNTAX_ERROR_BEFORE) && f.token().equals("eol"),
                    DiagnosticKind.SYNTAX_ERROR,
                    f -> "unexpectedly reached end of line. The current expression is invalid or incomplete"),
            new Rule("unexpected-end",
                    f -> f.hasPlainPrefix(SYNTAX_ERROR_BEFORE) && f.token().equals("'end'"),
                    DiagnosticKind.SYNTAX_ERROR,
                    f -> "unexpected token: end"),
            new Rule("sigil",
                    f -> f.hasPlainPrefix(SYNTAX_ERROR_BEFORE) && f.token().startsWith("{sigil,"),
                    DiagnosticKind.SYNTAX_ERROR,
                    ParseErrorNormalizer::sigilMessage),
            // Must stay ahead of "wrapped-list": aliases are lists too.
            new Rule("alias",
                    f -> f.hasPlainPrefix() && f.token().startsWith("['"),
                    DiagnosticKind.SYNTAX_ERROR,
                    f -> f.prefix().render() + StructuredTokenDecoder.decodeAlias(f.token()).name()),
            new Rule("wrapped-list",
                    f -> f.hasPlainPrefix() && f.token().startsWith("["),
                    DiagnosticKind.SYNTAX_ERROR,
                    ParseErrorNormalizer::wrappedListMessage),
            new Rule("surrounding",
                    f -> f.prefix() instanceof ErrorPrefix.Surrounding,
                    DiagnosticKind.SYNTAX_ERROR,
                    ParseErrorNormalizer::surroundingMessage),
            new Rule("verbatim",
                    f -> true,
                    DiagnosticKind.SYNTAX_ERROR,
                    f -> f.prefix().render() + f.token())
    );

    private ParseErrorNormalizer() {}

    /**
     * Normalizes a raw parser failure.
     *
     * @param line The line of the failure, {@code 0} if unknown.
     * @param file The file being parsed.
     * @param fragment The raw failure.
     * @return The diagnostic to raise.
     */
    public static Diagnostic normalize(int line, String file, RawErrorFragment fragment) {
        Rule rule = ruleFor(fragment);
        return Diagnostic.at(rule.kind(), rule.message().apply(fragment), new SourceLocation(file, line));
    }

    /**
     * @param fragment The raw failure.
     * @return The first rule that matches the fragment.
     */
    static Rule ruleFor(RawErrorFragment fragment) {
        for (Rule rule : RULES) {
            if (rule.matches().test(fragment)) {
                return rule;
            }
        }
        throw new IllegalStateException("No normalization rule matched " + fragment);
    }

    static List<Rule> rules() {
        return RULES;
    }

    private static String sigilMessage(RawErrorFragment fragment) {
        DecodedToken.Sigil sigil = StructuredTokenDecoder.decodeSigil(fragment.token());
        return SYNTAX_ERROR_BEFORE + "sigil ~" + sigil.tag()
                + " starting with content '" + sigil.content().orElse("") + "'";
    }

    private static String wrappedListMessage(RawErrorFragment fragment) {
        DecodedToken.ListValue list = StructuredTokenDecoder.decodeList(fragment.token());
        String rendered = list.leadingText()
                .map(text -> "\"" + text + "\"")
                .orElse("\"");
        return fragment.prefix().render() + rendered;
    }

    private static String surroundingMessage(RawErrorFragment fragment) {
        ErrorPrefix.Surrounding surrounding = (ErrorPrefix.Surrounding) fragment.prefix();
        return surrounding.prefix() + fragment.token() + surrounding.suffix();
    }
}

package com.phillippitts.mathscrap.service.markup;

import com.phillippitts.mathscrap.domain.CanonicalMarkup;
import com.phillippitts.mathscrap.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Canonicalizes recognizer output into {@link CanonicalMarkup}.
 *
 * <p>Stages, applied in order:
 * <ol>
 *   <li>balance {@code {}}, {@code ()} and {@code []} by count, appending closers or
 *       prepending openers on whichever side is short</li>
 *   <li>collapse malformed constructs: repeated operators, {@code **} powers, broken
 *       {@code \cal}/{@code \overline} decorations, doubled braces, {@code <a,b>} pairs</li>
 *   <li>canonical spacing around binary operators and grouping punctuation</li>
 *   <li>explicit grouping of every exponent and subscript ({@code x^2} becomes {@code x^{2}})</li>
 * </ol>
 *
 * <p>The stage list is re-run until the text stops changing, so the output is a fixpoint and
 * {@code normalize(normalize(s)).equals(normalize(s))}. No stage adds or removes an unpaired
 * delimiter, so the balance established by stage 1 survives the later stages.
 *
 * <p>Blank input is returned unchanged.
 */
@Component
public class MarkupNormalizer {

    private static final Logger LOG = LogManager.getLogger(MarkupNormalizer.class);

    private static final int MAX_PASSES = 8;

    static final List<RewriteRule> BALANCE = List.of(
            new RewriteRule("balance-braces", s -> balance(s, '{', '}')),
            new RewriteRule("balance-parens", s -> balance(s, '(', ')')),
            new RewriteRule("balance-brackets", s -> balance(s, '[', ']'))
    );

    static final List<RewriteRule> COLLAPSE = List.of(
            RewriteRule.regex("gamma-star-caret", "\\\\gamma\\^\\*\\^\\*", "\\\\gamma^*"),
            RewriteRule.regex("gamma-double-star", "\\\\gamma\\*\\*", "\\\\gamma^*"),
            RewriteRule.regex("double-star-power", "\\*\\*", "^"),
            RewriteRule.regex("cal-star", "\\\\cal\\{([^{}]*)\\}\\*", "\\\\mathcal{$1}"),
            RewriteRule.regex("cal-equals", "\\\\cal\\{=\\}", "="),
            RewriteRule.regex("cal-minus", "\\\\cal\\{-\\}", "-"),
            RewriteRule.regex("overline-star", "\\\\overline\\{([^{}]*)\\}\\*", "\\\\overline{$1}"),
            RewriteRule.regex("repeated-star", "\\*{2,}", "*"),
            RewriteRule.regex("repeated-caret", "\\^{2,}", "^"),
            RewriteRule.regex("repeated-plus", "\\+(?:\\s*\\+)+", "+"),
            RewriteRule.regex("repeated-equals", "=(?:\\s*=)+", "="),
            RewriteRule.regex("repeated-minus", "-(?:\\s*-)+", "-"),
            RewriteRule.fixpoint("double-brace", "\\{\\{([^{}]*)\\}\\}", "{$1}"),
            RewriteRule.regex("angle-pair", "<([^<>]*,[^<>]*)>", "\\\\langle $1 \\\\rangle")
    );

    static final List<RewriteRule> SPACING = List.of(
            RewriteRule.regex("script-operator-spacing", "\\s*([\\^_])\\s*", "$1"),
            RewriteRule.regex("equals-spacing", "\\s*=\\s*", " = "),
            RewriteRule.regex("binary-plus-spacing", "(?<=[\\w)}\\]])\\s*\\+\\s*", " + "),
            RewriteRule.regex("binary-minus-spacing", "(?<=[\\w)}\\]])\\s*-\\s*", " - "),
            RewriteRule.regex("star-to-cdot", "(?<!\\^)\\s*\\*\\s*", " \\\\cdot "),
            RewriteRule.regex("command-operator-spacing",
                    "\\s*\\\\(cdot|times|div|pm|mp|leq|geq|neq|approx)(?![A-Za-z])\\s*", " \\\\$1 "),
            RewriteRule.regex("open-group-trim", "([({\\[])\\s+", "$1"),
            RewriteRule.regex("close-group-trim", "\\s+([)}\\]])", "$1"),
            RewriteRule.regex("column-separator-spacing", "\\s*&\\s*", " & "),
            RewriteRule.regex("row-separator-spacing", "\\\\\\\\\\s*", "\\\\\\\\ "),
            RewriteRule.regex("number-letter-join", "(\\d)\\s+([A-Za-z])", "$1$2"),
            RewriteRule.regex("whitespace-collapse", "\\s+", " "),
            new RewriteRule("trim", String::strip)
    );

    static final List<RewriteRule> GROUPING = List.of(
            RewriteRule.regex("letter-digit-subscript", "(?<![A-Za-z\\\\])([A-Za-z])(\\d)", "$1_{$2}"),
            RewriteRule.regex("exponent-digits", "\\^(\\d+)", "^{$1}"),
            RewriteRule.regex("exponent-letter", "\\^([A-Za-z])", "^{$1}"),
            RewriteRule.regex("exponent-command", "\\^(\\\\[A-Za-z]+)", "^{$1}"),
            RewriteRule.regex("subscript-digits", "_(\\d+)", "_{$1}"),
            RewriteRule.regex("subscript-letter", "_([A-Za-z])", "_{$1}"),
            RewriteRule.regex("subscript-command", "_(\\\\[A-Za-z]+)", "_{$1}")
    );

    private static final List<RewriteRule> PIPELINE = concat(BALANCE, COLLAPSE, SPACING, GROUPING);

    /**
     * Normalizes raw markup.
     *
     * @param raw recognizer output (null treated as empty)
     * @return canonical markup; blank input comes back unchanged
     */
    public CanonicalMarkup normalize(String raw) {
        if (raw == null) {
            return new CanonicalMarkup("");
        }
        if (raw.isBlank()) {
            return new CanonicalMarkup(raw);
        }
        String current = raw;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = RewriteRule.applyAll(PIPELINE, current);
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Normalized markup '{}' -> '{}'",
                    LogSanitizer.preview(raw), LogSanitizer.preview(current));
        }
        return new CanonicalMarkup(current);
    }

    static String balance(String s, char open, char close) {
        int opens = count(s, open);
        int closes = count(s, close);
        if (opens > closes) {
            return s + String.valueOf(close).repeat(opens - closes);
        }
        if (closes > opens) {
            return String.valueOf(open).repeat(closes - opens) + s;
        }
        return s;
    }

    static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    @SafeVarargs
    private static List<RewriteRule> concat(List<RewriteRule>... groups) {
        return java.util.Arrays.stream(groups).flatMap(List::stream).toList();
    }
}

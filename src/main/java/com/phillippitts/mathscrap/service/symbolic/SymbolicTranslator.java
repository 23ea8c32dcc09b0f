package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.config.properties.TranslatorProperties;
import com.phillippitts.mathscrap.domain.CanonicalMarkup;
import com.phillippitts.mathscrap.exception.ExpressionParseException;
import com.phillippitts.mathscrap.service.markup.RewriteRule;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker.Reason;
import com.phillippitts.mathscrap.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates canonical markup into a {@link SymbolicExpression}.
 *
 * <p>Markup is first rewritten into plain expression syntax by an ordered list of
 * {@link RewriteRule}s, then handed to {@link ExpressionParser}. Translation never throws:
 * text outside the configured length window or text that does not parse yields an
 * {@link UnparseableMarker}.
 *
 * <p>Tabular environments are handled separately: the body is split into cells, cells
 * without an arithmetic operator are dropped, and the first remaining cell that translates
 * is returned.
 */
@Component
public class SymbolicTranslator {

    private static final Logger LOG = LogManager.getLogger(SymbolicTranslator.class);

    private static final String TABULAR_NAMES = "array|matrix|pmatrix|bmatrix|aligned";
    private static final Pattern TABULAR_START = Pattern.compile("\\\\begin\\{(?:" + TABULAR_NAMES + ")\\}");
    private static final Pattern TABULAR = Pattern.compile(
            "(?s)\\\\begin\\{(" + TABULAR_NAMES + ")\\}(?:\\{[^{}]*\\})?(.*?)\\\\end\\{\\1\\}");
    private static final Pattern CELL_SEPARATOR = Pattern.compile("\\\\\\\\|&");
    private static final Pattern INTEGRAL = Pattern.compile("\\\\[io]?i?nt(?![A-Za-z])");
    private static final Pattern DIFFERENTIAL = Pattern.compile("(?:\\\\[,;:!]\\s*|\\s+)d([A-Za-z])(?![A-Za-z])");

    /** Minimum length of a tabular cell worth translating. */
    private static final int MIN_CELL_LENGTH = 3;
    private static final String CELL_OPERATORS = "+-*/^=()[]";

    static final List<RewriteRule> RULES = buildRules();

    private final TranslatorProperties props;

    public SymbolicTranslator(TranslatorProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public SymbolicExpression translate(CanonicalMarkup markup) {
        return translate(markup == null ? null : markup.value());
    }

    /**
     * Translates markup text.
     *
     * @param markup markup; null is treated as empty
     * @return the expression, or an {@link UnparseableMarker}; never null
     */
    public SymbolicExpression translate(String markup) {
        String source = markup == null ? "" : markup.strip();
        if (TABULAR_START.matcher(source).find()) {
            return translateTabular(source);
        }
        return translatePlain(source);
    }

    /** Rewrites markup into the plain syntax accepted by {@link ExpressionParser}. */
    static String rewrite(String markup) {
        return RewriteRule.applyAll(RULES, markup);
    }

    private SymbolicExpression translatePlain(String markup) {
        String rewritten = rewrite(markup);
        if (rewritten.length() < props.minLength() || rewritten.length() > props.maxLength()) {
            LOG.debug("Rewritten expression length {} outside [{}, {}]",
                    rewritten.length(), props.minLength(), props.maxLength());
            return new UnparseableMarker(Reason.COMPLEX);
        }
        try {
            return ExpressionParser.parse(rewritten);
        } catch (ExpressionParseException | ArithmeticException e) {
            LOG.debug("Could not parse '{}': {}", LogSanitizer.preview(rewritten), e.getMessage());
            return new UnparseableMarker(Reason.UNPARSEABLE);
        }
    }

    private SymbolicExpression translateTabular(String markup) {
        Matcher matcher = TABULAR.matcher(markup);
        if (!matcher.find()) {
            return new UnparseableMarker(Reason.ARRAY);
        }
        for (String cell : candidateCells(matcher.group(2))) {
            SymbolicExpression expression = translatePlain(cell);
            if (!(expression instanceof UnparseableMarker)) {
                return expression;
            }
        }
        LOG.debug("No cell of the tabular body translated");
        return new UnparseableMarker(Reason.COMPLEX_ARRAY);
    }

    static List<String> candidateCells(String body) {
        List<String> cells = new ArrayList<>();
        for (String cell : CELL_SEPARATOR.split(body)) {
            String trimmed = cell.strip();
            if (trimmed.length() >= MIN_CELL_LENGTH && containsOperator(trimmed)) {
                cells.add(trimmed);
            }
        }
        return cells;
    }

    private static boolean containsOperator(String cell) {
        for (int i = 0; i < cell.length(); i++) {
            if (CELL_OPERATORS.indexOf(cell.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static List<RewriteRule> buildRules() {
        List<RewriteRule> rules = new ArrayList<>();
        rules.add(RewriteRule.regex("overline", "\\\\overline\\{([^{}]+)\\}", "$1"));
        rules.add(RewriteRule.regex("calligraphic", "\\\\(?:mathcal|cal)\\{([^{}]+)\\}", "$1"));
        rules.add(RewriteRule.regex("roman", "\\\\(?:mathrm|text|operatorname)\\{([^{}]+)\\}", "$1"));
        rules.add(RewriteRule.regex("inner-product", "\\\\langle([^\\\\]+)\\\\rangle", "($1)"));
        rules.add(RewriteRule.fixpointGroup("structure", List.of(
                RewriteRule.regex("fraction", "\\\\[dt]?frac\\{([^{}]*)\\}\\{([^{}]*)\\}", "($1)/($2)"),
                RewriteRule.regex("nth-root", "\\\\sqrt\\[([^\\[\\]{}]+)\\]\\{([^{}]*)\\}", "($2)**(1/($1))"),
                RewriteRule.regex("root", "\\\\sqrt\\{([^{}]*)\\}", "sqrt($1)"),
                RewriteRule.regex("power-grouped", "\\^\\{([^{}]*)\\}", "**($1)"),
                RewriteRule.regex("power-bare", "\\^([A-Za-z0-9])", "**$1"),
                RewriteRule.regex("subscript-simple", "_\\{([A-Za-z0-9]+)\\}", "_$1"),
                RewriteRule.regex("subscript-grouped", "_\\{([^{}]*)\\}", "_($1)"),
                RewriteRule.regex("bare-group", "(?<![A-Za-z\\\\_^}\\]])\\{([^{}]*)\\}", "($1)")
        )));
        rules.add(RewriteRule.regex("greek-variant", "\\\\var(epsilon|theta|phi)(?![A-Za-z])", "$1"));
        rules.add(RewriteRule.regex("greek",
                "\\\\(alpha|beta|gamma|delta|epsilon|zeta|eta|theta|iota|kappa|lambda|mu|nu|xi|pi|rho"
                        + "|sigma|tau|upsilon|phi|chi|psi|omega)(?![A-Za-z])", "$1"));
        rules.add(RewriteRule.regex("functions", "\\\\(sin|cos|tan|log|ln|exp)(?![A-Za-z])", "$1"));
        rules.add(RewriteRule.regex("multiplication", "\\\\(?:cdot|times)(?![A-Za-z])", "*"));
        rules.add(RewriteRule.regex("division", "\\\\div(?![A-Za-z])", "/"));
        rules.add(new RewriteRule("differential",
                s -> INTEGRAL.matcher(s).find() ? DIFFERENTIAL.matcher(s).replaceAll("") : s));
        rules.add(RewriteRule.regex("big-operators",
                "\\\\(?:int|iint|oint|sum|prod|lim)(?![A-Za-z])"
                        + "(?:_\\([^()]*\\)|_[A-Za-z0-9]+|\\*\\*\\([^()]*\\)|\\*\\*[A-Za-z0-9])*", ""));
        rules.add(RewriteRule.regex("row-separator", "\\\\\\\\", ""));
        rules.add(RewriteRule.regex("spacing-commands", "\\\\[,;:! ]", ""));
        rules.add(RewriteRule.regex("escaped-braces", "\\\\([{}])", "$1"));
        rules.add(RewriteRule.regex("unknown-commands", "\\\\[A-Za-z]+", ""));
        rules.add(RewriteRule.regex("whitespace", "\\s+", ""));
        rules.add(RewriteRule.regex("open-groups", "[{\\[]", "("));
        rules.add(RewriteRule.regex("close-groups", "[}\\]]", ")"));
        rules.add(RewriteRule.regex("allow-list", "[^A-Za-z0-9+\\-*/().,=_]", ""));
        return List.copyOf(rules);
    }
}

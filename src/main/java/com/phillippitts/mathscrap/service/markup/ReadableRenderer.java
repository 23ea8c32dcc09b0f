package com.phillippitts.mathscrap.service.markup;

import com.phillippitts.mathscrap.config.properties.ReadableProperties;
import com.phillippitts.mathscrap.domain.CanonicalMarkup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders canonical markup as an English sentence.
 *
 * <p>Independent of symbolic translation: it produces text even for markup that does not
 * parse. Structural commands (fraction, root, power, subscript) are rewritten innermost-first
 * until stable; command words and operators follow, then leftover commands and braces are
 * stripped. Over-long or over-nested text collapses to {@link #COMPLEX_EXPRESSION}.
 */
@Component
public class ReadableRenderer {

    public static final String EMPTY_EXPRESSION = "Empty expression";
    public static final String COMPLEX_EXPRESSION = "Complex mathematical expression";
    public static final String GENERIC_EXPRESSION = "Mathematical expression";

    private static final Map<String, String> GREEK = new LinkedHashMap<>();

    static {
        for (String letter : List.of("alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta",
                "theta", "iota", "kappa", "lambda", "mu", "nu", "xi", "pi", "rho", "sigma", "tau",
                "upsilon", "phi", "chi", "psi", "omega")) {
            GREEK.put(letter, letter);
        }
        GREEK.put("varepsilon", "epsilon");
        GREEK.put("vartheta", "theta");
        GREEK.put("varphi", "phi");
    }

    static final List<RewriteRule> RULES = buildRules();

    private final ReadableProperties props;

    public ReadableRenderer(ReadableProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public String render(CanonicalMarkup markup) {
        return render(markup == null ? null : markup.value());
    }

    /**
     * Renders markup text.
     *
     * @param markup markup (null or blank yields {@link #EMPTY_EXPRESSION})
     * @return readable sentence or one of the fixed sentinels
     */
    public String render(String markup) {
        if (markup == null || markup.isBlank()) {
            return EMPTY_EXPRESSION;
        }
        String readable = RewriteRule.applyAll(RULES, markup).strip();
        if (readable.length() > props.maxLength() || countOpenParens(readable) > props.maxParentheses()) {
            return COMPLEX_EXPRESSION;
        }
        return readable.isEmpty() ? GENERIC_EXPRESSION : readable;
    }

    private static int countOpenParens(String s) {
        return (int) s.chars().filter(c -> c == '(').count();
    }

    private static List<RewriteRule> buildRules() {
        List<RewriteRule> rules = new ArrayList<>();
        rules.add(RewriteRule.regex("tabular",
                "(?s)\\\\begin\\{(array|matrix|pmatrix|bmatrix|aligned)\\}.*?\\\\end\\{\\1\\}",
                "matrix or array expression"));
        rules.add(RewriteRule.fixpointGroup("structure", List.of(
                RewriteRule.regex("fraction", "\\\\frac\\{([^{}]+)\\}\\{([^{}]+)\\}", "($1) divided by ($2)"),
                RewriteRule.regex("root", "\\\\sqrt\\{([^{}]+)\\}", "square root of ($1)"),
                RewriteRule.regex("power-grouped", "([A-Za-z0-9]+)\\^\\{([^{}]+)\\}", "$1 to the power of ($2)"),
                RewriteRule.regex("power-bare", "([A-Za-z0-9]+)\\^([A-Za-z0-9])", "$1 to the power of $2"),
                RewriteRule.regex("subscript-grouped", "([A-Za-z]+)_\\{([^{}]+)\\}", "$1 subscript ($2)"),
                RewriteRule.regex("subscript-bare", "([A-Za-z]+)_([A-Za-z0-9])", "$1 subscript $2")
        )));
        rules.add(RewriteRule.regex("power-any", "\\^\\{([^{}]*)\\}", " to the power of ($1)"));
        rules.add(RewriteRule.regex("sum", "\\\\sum(?![A-Za-z])", "sum of"));
        rules.add(RewriteRule.regex("integral", "\\\\int(?![A-Za-z])", "integral of"));
        rules.add(RewriteRule.regex("limit", "\\\\lim(?![A-Za-z])", "limit of"));
        for (Map.Entry<String, String> greek : GREEK.entrySet()) {
            rules.add(RewriteRule.regex("greek-" + greek.getKey(),
                    "\\\\" + greek.getKey() + "(?![A-Za-z])", greek.getValue()));
        }
        rules.add(command("sin", "sine of"));
        rules.add(command("cos", "cosine of"));
        rules.add(command("tan", "tangent of"));
        rules.add(command("log", "logarithm of"));
        rules.add(command("ln", "natural log of"));
        rules.add(command("cdot", " times "));
        rules.add(command("times", " times "));
        rules.add(command("div", " divided by "));
        rules.add(command("pm", " plus or minus "));
        rules.add(command("mp", " minus or plus "));
        rules.add(command("leq", " less than or equal to "));
        rules.add(command("geq", " greater than or equal to "));
        rules.add(command("neq", " not equal to "));
        rules.add(command("approx", " approximately equal to "));
        rules.add(command("infty", "infinity"));
        rules.add(command("partial", "partial derivative"));
        rules.add(command("nabla", "nabla"));
        rules.add(RewriteRule.regex("overline", "\\\\overline\\{([^{}]+)\\}", "($1) with overline"));
        rules.add(RewriteRule.regex("underline", "\\\\underline\\{([^{}]+)\\}", "($1) with underline"));
        rules.add(RewriteRule.regex("inner-product", "\\\\langle([^\\\\]+)\\\\rangle", "inner product of ($1)"));
        rules.add(RewriteRule.regex("strip-commands", "\\\\[A-Za-z]+", ""));
        rules.add(RewriteRule.regex("strip-spacing-commands", "\\\\[,;:! ]", " "));
        rules.add(RewriteRule.regex("strip-braces", "[{}]", ""));
        rules.add(RewriteRule.literal("equals", "=", " equals "));
        rules.add(RewriteRule.literal("plus", "+", " plus "));
        rules.add(RewriteRule.literal("minus", "-", " minus "));
        rules.add(RewriteRule.literal("times", "*", " times "));
        rules.add(RewriteRule.literal("divided-by", "/", " divided by "));
        rules.add(RewriteRule.regex("collapse-spaces", "\\s+", " "));
        return List.copyOf(rules);
    }

    private static RewriteRule command(String name, String words) {
        return RewriteRule.regex(name, "\\\\" + name + "(?![A-Za-z])", words);
    }
}

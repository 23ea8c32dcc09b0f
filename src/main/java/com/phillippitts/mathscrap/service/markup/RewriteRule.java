package com.phillippitts.mathscrap.service.markup;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named, pure string rewrite. Rule lists are applied in order and the order matters.
 *
 * @param name      identifier used in tests and debug logs
 * @param transform the rewrite itself; must not return null
 */
public record RewriteRule(String name, UnaryOperator<String> transform) {

    /** Upper bound on passes for fixpoint rules. */
    static final int MAX_FIXPOINT_PASSES = 32;

    public RewriteRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transform, "transform");
    }

    /**
     * Regex replacement applied once over the whole input.
     * The replacement uses {@link Matcher#replaceAll(String)} group syntax.
     */
    public static RewriteRule regex(String name, String regex, String replacement) {
        Pattern pattern = Pattern.compile(regex);
        return new RewriteRule(name, s -> pattern.matcher(s).replaceAll(replacement));
    }

    /**
     * Regex replacement re-applied until the input stops changing. Used for innermost-first
     * patterns so that nested constructs unwind from the inside out.
     */
    public static RewriteRule fixpoint(String name, String regex, String replacement) {
        RewriteRule once = regex(name, regex, replacement);
        return new RewriteRule(name, s -> untilStable(s, List.of(once)));
    }

    /** Applies a group of rules repeatedly, in order, until a full pass changes nothing. */
    public static RewriteRule fixpointGroup(String name, List<RewriteRule> rules) {
        List<RewriteRule> copy = List.copyOf(rules);
        return new RewriteRule(name, s -> untilStable(s, copy));
    }

    /** Literal (non-regex) substring replacement. */
    public static RewriteRule literal(String name, String target, String replacement) {
        return new RewriteRule(name, s -> s.replace(target, replacement));
    }

    public String apply(String input) {
        return transform.apply(input);
    }

    /** Applies each rule in order to the input. */
    public static String applyAll(List<RewriteRule> rules, String input) {
        String out = input;
        for (RewriteRule rule : rules) {
            out = rule.apply(out);
        }
        return out;
    }

    static String untilStable(String input, List<RewriteRule> rules) {
        String current = input;
        for (int pass = 0; pass < MAX_FIXPOINT_PASSES; pass++) {
            String next = applyAll(rules, current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }
}

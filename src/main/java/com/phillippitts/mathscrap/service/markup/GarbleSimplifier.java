package com.phillippitts.mathscrap.service.markup;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collapses garbled markup to the simplest expression matching its first structural cue.
 *
 * <p>Cue priority: sum, integral, fraction (two letters), root (one letter), letter and
 * number, letter, then a constant literal. Letters and numbers are taken from the markup
 * with command names removed, so {@code \sum} itself never supplies the letter {@code s}.
 * The result is deliberately lossy.
 */
@Component
public class GarbleSimplifier {

    private static final Pattern COMMAND = Pattern.compile("\\\\[A-Za-z]+");
    private static final Pattern LETTER = Pattern.compile("[A-Za-z]");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    public String simplify(String markup) {
        String text = markup == null ? "" : markup;
        String bare = COMMAND.matcher(text).replaceAll(" ");
        List<String> letters = findAll(LETTER, bare);
        List<String> numbers = findAll(NUMBER, bare);

        if (text.contains("\\sum")) {
            return letters.isEmpty() ? "\\sum" : "\\sum " + letters.get(0);
        }
        if (text.contains("\\int")) {
            return letters.isEmpty() ? "\\int f(x) dx" : "\\int " + letters.get(0) + " dx";
        }
        if (text.contains("\\frac") && letters.size() >= 2) {
            return "\\frac{" + letters.get(0) + "}{" + letters.get(1) + "}";
        }
        if (text.contains("\\sqrt") && !letters.isEmpty()) {
            return "\\sqrt{" + letters.get(0) + "}";
        }
        if (!letters.isEmpty() && !numbers.isEmpty()) {
            return letters.get(0) + "^{" + numbers.get(0) + "}";
        }
        if (!letters.isEmpty()) {
            return letters.get(0);
        }
        return numbers.isEmpty() ? "0" : numbers.get(0);
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> out = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }
}

package com.phillippitts.mathscrap.service.markup;

import com.phillippitts.mathscrap.config.properties.GarbleDetectionProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores raw recognizer markup for signs of hallucination (runaway nesting or repetition).
 *
 * <p>Each indicator is a threshold crossing on a count of one construct; a firing indicator
 * adds its weight. The markup is garbled once the total reaches the configured threshold.
 */
@Component
public class GarbleDetector {

    private final GarbleDetectionProperties props;

    public GarbleDetector(GarbleDetectionProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public boolean isGarbled(String markup) {
        return assess(markup).garbled();
    }

    /**
     * Scores the markup.
     *
     * @param markup raw markup (null treated as empty)
     * @return verdict with score and fired indicator names
     */
    public GarbleVerdict assess(String markup) {
        String text = markup == null ? "" : markup;
        List<String> fired = new ArrayList<>();
        int score = 0;

        if (count(text, "{") > props.getMaxOpenBraces() || count(text, "}") > props.getMaxCloseBraces()) {
            score += fire(fired, "braces", props.getBraceWeight());
        }
        if (count(text, "\\scriptstyle") > props.getMaxScriptstyle()) {
            score += fire(fired, "scriptstyle", 1);
        }
        if (count(text, "\\frac") > props.getMaxFractions()) {
            score += fire(fired, "fractions", props.getFractionWeight());
        }
        if (count(text, "\\overbrace") + count(text, "\\underbrace") > props.getMaxOverUnderBraces()) {
            score += fire(fired, "over-under-braces", 1);
        }
        if (count(text, "\\sqrt") > props.getMaxRoots()) {
            score += fire(fired, "roots", 1);
        }
        // \cdotp also contains \cdot, so it is counted twice
        if (count(text, "\\cdot") + count(text, "\\cdotp") > props.getMaxDots()) {
            score += fire(fired, "dots", 1);
        }
        if (text.length() > props.getMaxLength()) {
            score += fire(fired, "length", 1);
        }
        if (text.contains("\\cdot{\\cdot") || text.contains("\\sqrt{\\sqrt{\\sqrt")) {
            score += fire(fired, "repetition", props.getRepetitionWeight());
        }
        if (count(text, "\\mathrm") > props.getMaxMathrm()) {
            score += fire(fired, "mathrm", 1);
        }
        if (count(text, "\\overline") > props.getMaxOverlines()) {
            score += fire(fired, "overlines", 1);
        }
        if (text.contains("\\scriptstyle{\\frac{\\scriptstyle")) {
            score += fire(fired, "nested-script-fraction", props.getNestedScriptFractionWeight());
        }
        return new GarbleVerdict(score, score >= props.getDecisionThreshold(), fired);
    }

    private static int fire(List<String> fired, String name, int weight) {
        fired.add(name);
        return weight;
    }

    static int count(String text, String token) {
        if (token.isEmpty()) {
            return 0;
        }
        int n = 0;
        int idx = text.indexOf(token);
        while (idx >= 0) {
            n++;
            idx = text.indexOf(token, idx + token.length());
        }
        return n;
    }
}

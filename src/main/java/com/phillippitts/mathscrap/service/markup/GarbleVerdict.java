package com.phillippitts.mathscrap.service.markup;

import java.util.List;

/**
 * Outcome of scoring markup for hallucination.
 *
 * @param score      accumulated indicator weight
 * @param garbled    score reached the decision threshold
 * @param indicators names of the indicators that fired, in evaluation order
 */
public record GarbleVerdict(int score, boolean garbled, List<String> indicators) {

    public GarbleVerdict {
        indicators = List.copyOf(indicators);
    }
}

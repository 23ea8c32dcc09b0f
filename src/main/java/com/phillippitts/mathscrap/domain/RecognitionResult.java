package com.phillippitts.mathscrap.domain;

import java.util.Objects;

/**
 * Immutable result of recognizing one image.
 *
 * @param markup       recognized markup (may be empty, never null)
 * @param confidence   tier-assigned confidence in [0.0, 1.0]
 * @param sourceTag    backend that produced the markup
 * @param readableText plain-language rendering of the markup
 */
public record RecognitionResult(
        String markup,
        double confidence,
        BackendTag sourceTag,
        String readableText
) {

    public RecognitionResult {
        Objects.requireNonNull(markup, "Markup must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(sourceTag, "Source tag must not be null");
        readableText = readableText == null ? "" : readableText;
    }

    /**
     * Returns a copy carrying different markup and confidence, same source.
     */
    public RecognitionResult withMarkup(String newMarkup, double newConfidence, String newReadableText) {
        return new RecognitionResult(newMarkup, newConfidence, sourceTag, newReadableText);
    }
}

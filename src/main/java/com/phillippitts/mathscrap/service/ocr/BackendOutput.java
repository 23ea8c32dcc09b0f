package com.phillippitts.mathscrap.service.ocr;

import java.util.Objects;

/**
 * Markup and tier confidence produced by one backend.
 *
 * @param markup       recognized markup, never blank
 * @param confidence   tier confidence in [0, 1]
 * @param readableText canned reading of the markup, or null to have it rendered
 */
public record BackendOutput(String markup, double confidence, String readableText) {

    public BackendOutput {
        Objects.requireNonNull(markup, "markup");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static BackendOutput of(String markup, double confidence) {
        return new BackendOutput(markup, confidence, null);
    }
}

package com.phillippitts.mathscrap.domain;

import java.util.Locale;

/**
 * Why a recognition backend did not produce markup for an image.
 * Every kind is recoverable: the cascade moves to the next tier.
 */
public enum FailureKind {
    /** Runtime, binary or model data not present. */
    UNAVAILABLE,
    /** Runtime present but the model could not be loaded. */
    MODEL_LOAD_FAILED,
    /** The backend crashed or exited abnormally while recognizing. */
    RUNTIME_ERROR,
    /** The backend ran but its output could not be interpreted. */
    MALFORMED_OUTPUT,
    /** The recognition call exceeded its time budget. */
    TIMEOUT;

    /** Lowercase tag value for metrics and logs. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

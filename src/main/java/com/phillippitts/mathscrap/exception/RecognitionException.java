package com.phillippitts.mathscrap.exception;

import com.phillippitts.mathscrap.domain.FailureKind;

/**
 * Thrown inside a recognition backend when it cannot produce markup for an image.
 *
 * <p>Backends never let this escape their {@code recognize} call: the adapter base class
 * converts it into a failed outcome tagged with {@link #getKind()} so the cascade can
 * decide on fallback without unwinding.
 */
public class RecognitionException extends MathScrapException {

    private final String backendName;
    private final FailureKind kind;

    public RecognitionException(String message, String backendName, FailureKind kind) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
        this.kind = kind;
    }

    public RecognitionException(String message, String backendName, FailureKind kind, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
        this.kind = kind;
    }

    public String getBackendName() {
        return backendName;
    }

    public FailureKind getKind() {
        return kind;
    }
}

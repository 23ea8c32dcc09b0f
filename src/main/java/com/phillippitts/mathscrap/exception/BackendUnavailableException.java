package com.phillippitts.mathscrap.exception;

import com.phillippitts.mathscrap.domain.FailureKind;

/**
 * Thrown when a backend's runtime, binary or model data cannot be found.
 */
public class BackendUnavailableException extends RecognitionException {

    private final String missingResource;

    public BackendUnavailableException(String backendName, String missingResource) {
        super("Backend runtime not available: " + missingResource, backendName, FailureKind.UNAVAILABLE);
        this.missingResource = missingResource;
    }

    public String getMissingResource() {
        return missingResource;
    }
}

package com.phillippitts.mathscrap.exception;

import com.phillippitts.mathscrap.domain.FailureKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link RecognitionException} with contextual information.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw RecognitionExceptionBuilder.create("Process failed")
 *         .backend("pix2tex")
 *         .kind(FailureKind.RUNTIME_ERROR)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class RecognitionExceptionBuilder {

    private final String message;
    private String backendName;
    private FailureKind kind = FailureKind.RUNTIME_ERROR;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RecognitionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static RecognitionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RecognitionExceptionBuilder(message);
    }

    public RecognitionExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public RecognitionExceptionBuilder kind(FailureKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public RecognitionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public RecognitionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public RecognitionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata pair to the message. Null keys or values are ignored.
     */
    public RecognitionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public RecognitionException build() {
        String detailed = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";
        if (cause != null) {
            return new RecognitionException(detailed, backend, kind, cause);
        }
        return new RecognitionException(detailed, backend, kind);
    }

    private String buildDetailedMessage() {
        StringBuilder details = new StringBuilder();
        if (exitCode != null) {
            details.append("exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            appendSeparator(details);
            details.append("durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            appendSeparator(details);
            details.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return details.isEmpty() ? message : message + " (" + details + ")";
    }

    private static void appendSeparator(StringBuilder sb) {
        if (!sb.isEmpty()) {
            sb.append(", ");
        }
    }
}

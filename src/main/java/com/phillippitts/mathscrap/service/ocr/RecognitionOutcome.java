package com.phillippitts.mathscrap.service.ocr;

import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.domain.FailureKind;

import java.util.Objects;

/**
 * Result of one backend recognition call: markup, or a failure with its kind.
 */
public sealed interface RecognitionOutcome {

    BackendTag tag();

    static RecognitionOutcome recognized(BackendTag tag, BackendOutput output) {
        return new Recognized(tag, output);
    }

    static RecognitionOutcome failed(BackendTag tag, FailureKind kind, String detail, Throwable cause) {
        return new Failed(tag, kind, detail, cause);
    }

    record Recognized(BackendTag tag, BackendOutput output) implements RecognitionOutcome {
        public Recognized {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(output, "output");
        }
    }

    /**
     * @param detail human-readable description
     * @param cause  underlying exception, may be null
     */
    record Failed(BackendTag tag, FailureKind kind, String detail, Throwable cause) implements RecognitionOutcome {
        public Failed {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(kind, "kind");
            detail = detail == null ? kind.tag() : detail;
        }
    }
}

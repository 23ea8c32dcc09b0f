package com.phillippitts.mathscrap.service.ocr.event;

import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.domain.FailureKind;

import java.time.Instant;

/**
 * Published when a recognition tier fails and the cascade moves on.
 *
 * @param tag    backend that failed
 * @param kind   failure kind
 * @param detail message, without recognized content
 * @param at     when the failure was observed
 */
public record BackendFailureEvent(BackendTag tag, FailureKind kind, String detail, Instant at) {
}

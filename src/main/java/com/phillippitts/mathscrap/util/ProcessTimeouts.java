package com.phillippitts.mathscrap.util;

import java.time.Duration;

/**
 * Timeout values for external recognizer processes and their output readers.
 *
 * @see com.phillippitts.mathscrap.service.ocr.process.OcrProcessRunner
 */
public final class ProcessTimeouts {

    /** Time allowed for stream gobblers to flush after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join during cleanup; gobblers are daemon threads. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
    }
}

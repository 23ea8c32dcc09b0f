package com.phillippitts.mathscrap.service.events;

import com.phillippitts.mathscrap.service.ocr.event.BackendFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing handler for backend failure events. Throttled per backend and failure kind
 * to avoid log spam when a tier is down.
 */
@Component
class RecognitionEventsListener {
    private static final Logger LOG = LogManager.getLogger(RecognitionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onBackendFailure(BackendFailureEvent e) {
        String key = e.tag().backendName() + '-' + e.kind().tag();
        if (shouldLog(key)) {
            switch (e.kind()) {
                case UNAVAILABLE, MODEL_LOAD_FAILED -> LOG.warn(
                        "Backend '{}' cannot run ({}). Install its runtime or fix ocr.{}.* settings.",
                        e.tag().backendName(), e.kind().tag(), e.tag().backendName());
                case TIMEOUT -> LOG.warn("Backend '{}' timed out. Consider raising ocr.cascade.recognition-timeout-ms.",
                        e.tag().backendName());
                default -> LOG.warn("Backend '{}' failed: kind={}", e.tag().backendName(), e.kind().tag());
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

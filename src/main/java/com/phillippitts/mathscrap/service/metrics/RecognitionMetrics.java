package com.phillippitts.mathscrap.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for image recognition and markup analysis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Recognition latency per backend</li>
 *   <li>Success/failure counts per backend, failures tagged with their kind</li>
 *   <li>Garbled recognizer output and unparseable translations</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RecognitionMetrics {

    private static final String METRIC_PREFIX = "mathscrap.recognition";

    private final MeterRegistry registry;

    public RecognitionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of one backend call.
     *
     * @param backendName backend name (pix2tex, easyocr, ...)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String backendName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a recognition backend")
                .tag("backend", backendName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String backendName) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful recognitions")
                .tag("backend", backendName)
                .register(registry)
                .increment();
    }

    /**
     * @param backendName backend name
     * @param kind        failure kind tag (timeout, unavailable, ...)
     */
    public void incrementFailure(String backendName, String kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed recognitions")
                .tag("backend", backendName)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementGarbled(String backendName) {
        Counter.builder(METRIC_PREFIX + ".garbled")
                .description("Recognitions classified as garbled and simplified")
                .tag("backend", backendName)
                .register(registry)
                .increment();
    }

    public void incrementUnparseable() {
        Counter.builder(METRIC_PREFIX + ".unparseable")
                .description("Canonical markup that did not translate to an expression")
                .register(registry)
                .increment();
    }
}

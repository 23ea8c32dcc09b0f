package com.phillippitts.mathscrap.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RecognitionMetricsTest {

    private MeterRegistry registry;
    private RecognitionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RecognitionMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerBackend() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordLatency("pix2tex", durationNanos);

        Timer timer = registry.find("mathscrap.recognition.latency")
                .tag("backend", "pix2tex")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldAccumulateLatenciesForSameBackend() {
        metrics.recordLatency("tesseract", TimeUnit.MILLISECONDS.toNanos(100));
        metrics.recordLatency("tesseract", TimeUnit.MILLISECONDS.toNanos(300));

        Timer timer = registry.find("mathscrap.recognition.latency")
                .tag("backend", "tesseract")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400);
    }

    @Test
    void shouldCountSuccessesPerBackend() {
        metrics.incrementSuccess("easyocr");
        metrics.incrementSuccess("easyocr");
        metrics.incrementSuccess("paddleocr");

        assertThat(registry.find("mathscrap.recognition.success").tag("backend", "easyocr").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("mathscrap.recognition.success").tag("backend", "paddleocr").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldTagFailuresWithKind() {
        metrics.incrementFailure("pix2tex", "timeout");
        metrics.incrementFailure("pix2tex", "unavailable");
        metrics.incrementFailure("pix2tex", "timeout");

        Counter timeouts = registry.find("mathscrap.recognition.failure")
                .tag("backend", "pix2tex")
                .tag("kind", "timeout")
                .counter();

        assertThat(timeouts).isNotNull();
        assertThat(timeouts.count()).isEqualTo(2.0);
        assertThat(registry.find("mathscrap.recognition.failure").tag("kind", "unavailable").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCountGarbledAndUnparseable() {
        metrics.incrementGarbled("pix2tex");
        metrics.incrementUnparseable();
        metrics.incrementUnparseable();

        assertThat(registry.find("mathscrap.recognition.garbled").tag("backend", "pix2tex").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("mathscrap.recognition.unparseable").counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldNotCreateMetersBeforeUse() {
        assertThat(registry.find("mathscrap.recognition.success").counter()).isNull();
        assertThat(registry.find("mathscrap.recognition.latency").timer()).isNull();
    }
}

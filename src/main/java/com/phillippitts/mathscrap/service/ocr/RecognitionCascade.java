package com.phillippitts.mathscrap.service.ocr;

import com.phillippitts.mathscrap.config.properties.CascadeProperties;
import com.phillippitts.mathscrap.domain.FailureKind;
import com.phillippitts.mathscrap.domain.RasterImage;
import com.phillippitts.mathscrap.domain.RecognitionResult;
import com.phillippitts.mathscrap.service.metrics.RecognitionMetrics;
import com.phillippitts.mathscrap.service.ocr.RecognitionOutcome.Failed;
import com.phillippitts.mathscrap.service.ocr.RecognitionOutcome.Recognized;
import com.phillippitts.mathscrap.service.ocr.event.BackendFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a preprocessed image down the backend ladder until one tier produces markup.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Take the cached ladder from {@link BackendSelector}</li>
 *   <li>For each neural tier, submit {@code recognize} to the recognition executor and wait
 *       at most {@link CascadeProperties#recognitionTimeoutMs()}</li>
 *   <li>A {@link Recognized} outcome ends the cascade</li>
 *   <li>A {@link Failed} outcome, a timeout, a rejected submission or a crashed task is
 *       recorded, published as a {@link BackendFailureEvent}, and the next tier is tried</li>
 *   <li>When every tier has failed, the rule-based fallback answers from the file name</li>
 * </ol>
 *
 * <p>The caller's thread only waits; inference runs on the recognition executor, so concurrent
 * requests are not serialized behind a slow backend.
 *
 * @since 1.0
 */
@Service
public class RecognitionCascade {

    private static final Logger LOG = LogManager.getLogger(RecognitionCascade.class);

    private final BackendSelector selector;
    private final Executor recognitionExecutor;
    private final CascadeProperties props;
    private final RecognitionMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public RecognitionCascade(BackendSelector selector,
                              @Qualifier("recognitionExecutor") Executor recognitionExecutor,
                              CascadeProperties props,
                              RecognitionMetrics metrics,
                              ApplicationEventPublisher publisher) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.recognitionExecutor = Objects.requireNonNull(recognitionExecutor, "recognitionExecutor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Recognizes an image. Never fails: the last resort is the rule-based fallback.
     *
     * @param image preprocessed raster
     * @return result of the first tier that produced markup
     */
    public RecognitionResult recognize(RasterImage image) {
        Objects.requireNonNull(image, "image");
        List<OcrBackend> ladder = selector.ladder();
        for (OcrBackend backend : ladder) {
            if (backend.tag().isFallback()) {
                break;
            }
            RecognitionOutcome outcome = invoke(backend, image);
            if (outcome instanceof Recognized recognized) {
                metrics.incrementSuccess(backend.name());
                return toResult(recognized);
            }
            Failed failed = (Failed) outcome;
            onFailure(failed);
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Interrupted during recognition; skipping remaining tiers");
                break;
            }
        }
        BackendOutput output = selector.fallback().fallbackFor(image.source());
        metrics.incrementSuccess(selector.fallback().name());
        LOG.info("Using rule-based fallback for {}", image);
        return new RecognitionResult(output.markup(), output.confidence(), selector.fallback().tag(),
                output.readableText());
    }

    private RecognitionOutcome invoke(OcrBackend backend, RasterImage image) {
        long start = System.nanoTime();
        CompletableFuture<RecognitionOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(() -> backend.recognize(image), recognitionExecutor);
        } catch (RejectedExecutionException e) {
            return RecognitionOutcome.failed(backend.tag(), FailureKind.TIMEOUT,
                    "Recognition executor saturated", e);
        }
        try {
            return future.get(props.recognitionTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return RecognitionOutcome.failed(backend.tag(), FailureKind.TIMEOUT,
                    "No result within " + props.recognitionTimeoutMs() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return RecognitionOutcome.failed(backend.tag(), FailureKind.RUNTIME_ERROR, cause.toString(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return RecognitionOutcome.failed(backend.tag(), FailureKind.RUNTIME_ERROR, "Interrupted", e);
        } finally {
            metrics.recordLatency(backend.name(), System.nanoTime() - start);
        }
    }

    private void onFailure(Failed failed) {
        String backendName = failed.tag().backendName();
        metrics.incrementFailure(backendName, failed.kind().tag());
        LOG.warn("Recognition backend '{}' failed ({}): {}", backendName, failed.kind().tag(), failed.detail());
        publisher.publishEvent(new BackendFailureEvent(failed.tag(), failed.kind(), failed.detail(), Instant.now()));
    }

    private static RecognitionResult toResult(Recognized recognized) {
        BackendOutput output = recognized.output();
        return new RecognitionResult(output.markup(), output.confidence(), recognized.tag(), output.readableText());
    }
}

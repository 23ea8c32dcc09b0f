package com.phillippitts.mathscrap.service.orchestration;

import com.phillippitts.mathscrap.config.logging.MdcKeys;
import com.phillippitts.mathscrap.config.properties.GarbleDetectionProperties;
import com.phillippitts.mathscrap.domain.CanonicalMarkup;
import com.phillippitts.mathscrap.domain.ImageAnalysis;
import com.phillippitts.mathscrap.domain.RasterImage;
import com.phillippitts.mathscrap.domain.RecognitionResult;
import com.phillippitts.mathscrap.domain.ValidationResult;
import com.phillippitts.mathscrap.exception.UnreadableImageException;
import com.phillippitts.mathscrap.service.image.ImagePreprocessor;
import com.phillippitts.mathscrap.service.markup.GarbleDetector;
import com.phillippitts.mathscrap.service.markup.GarbleSimplifier;
import com.phillippitts.mathscrap.service.markup.GarbleVerdict;
import com.phillippitts.mathscrap.service.markup.MarkupNormalizer;
import com.phillippitts.mathscrap.service.markup.ReadableRenderer;
import com.phillippitts.mathscrap.service.metrics.RecognitionMetrics;
import com.phillippitts.mathscrap.service.ocr.RecognitionCascade;
import com.phillippitts.mathscrap.service.validation.ExpressionValidationService;
import com.phillippitts.mathscrap.util.LogSanitizer;
import com.phillippitts.mathscrap.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the per-image pipeline: preprocess, recognize, garble check, normalize, then validate
 * and render in parallel.
 *
 * <p><b>Failure semantics:</b> every recoverable condition degrades the result instead of
 * failing it. Backend failures fall through the cascade, garbled markup is simplified with a
 * forced low confidence, and unparseable markup produces an invalid validation. An unreadable
 * image, or any other stage failure, yields an {@link ImageAnalysis} with an error on both the
 * synchronous and asynchronous paths, and within a job it never affects sibling images.
 *
 * <p>The {@code jobId} and {@code image} MDC keys are set while an image is processed and are
 * carried onto the worker threads by the executors' task decorator.
 *
 * @since 1.0
 */
@Service
public class MathPipelineService {

    private static final Logger LOG = LogManager.getLogger(MathPipelineService.class);

    private final ImagePreprocessor preprocessor;
    private final RecognitionCascade cascade;
    private final GarbleDetector garbleDetector;
    private final GarbleSimplifier garbleSimplifier;
    private final GarbleDetectionProperties garbleProps;
    private final MarkupNormalizer normalizer;
    private final ExpressionValidationService validationService;
    private final ReadableRenderer renderer;
    private final RecognitionMetrics metrics;
    private final Executor analysisExecutor;
    private final Executor pipelineExecutor;

    public MathPipelineService(ImagePreprocessor preprocessor,
                               RecognitionCascade cascade,
                               GarbleDetector garbleDetector,
                               GarbleSimplifier garbleSimplifier,
                               GarbleDetectionProperties garbleProps,
                               MarkupNormalizer normalizer,
                               ExpressionValidationService validationService,
                               ReadableRenderer renderer,
                               RecognitionMetrics metrics,
                               @Qualifier("analysisExecutor") Executor analysisExecutor,
                               @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.cascade = Objects.requireNonNull(cascade, "cascade");
        this.garbleDetector = Objects.requireNonNull(garbleDetector, "garbleDetector");
        this.garbleSimplifier = Objects.requireNonNull(garbleSimplifier, "garbleSimplifier");
        this.garbleProps = Objects.requireNonNull(garbleProps, "garbleProps");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.validationService = Objects.requireNonNull(validationService, "validationService");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.analysisExecutor = Objects.requireNonNull(analysisExecutor, "analysisExecutor");
        this.pipelineExecutor = Objects.requireNonNull(pipelineExecutor, "pipelineExecutor");
    }

    /**
     * Processes one image. Never throws for an unreadable image or a failing stage; the failure
     * is carried in the returned analysis.
     *
     * @param jobId     job the image belongs to (may be null)
     * @param imagePath image file
     */
    public ImageAnalysis processImage(String jobId, Path imagePath) {
        Objects.requireNonNull(imagePath, "imagePath");
        String image = imagePath.toString();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext
                .put(MdcKeys.JOB_ID, jobId == null ? "-" : jobId)
                .put(MdcKeys.IMAGE, String.valueOf(imagePath.getFileName()))) {
            long start = System.nanoTime();
            try {
                RasterImage raster = preprocessor.preprocess(imagePath);
                RecognitionResult recognized = cascade.recognize(raster);
                ImageAnalysis analysis = analyze(jobId, image, recognized);
                LOG.info("Processed image in {} ms (source={}, confidence={}, garbled={})",
                        TimeUtils.elapsedMillis(start), recognized.sourceTag().backendName(),
                        analysis.recognition().confidence(), analysis.garbled());
                return analysis;
            } catch (UnreadableImageException e) {
                LOG.warn("Unreadable image: {}", e.getReason());
                return ImageAnalysis.failure(jobId, image, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Processing failed for image {} of job {}", image, jobId, e);
                return ImageAnalysis.failure(jobId, image, "Processing failed: " + e.getMessage());
            }
        }
    }

    /**
     * Processes a job's images in order. A failure on one image never stops the others.
     */
    public List<ImageAnalysis> processJob(String jobId, List<Path> imagePaths) {
        Objects.requireNonNull(imagePaths, "imagePaths");
        List<ImageAnalysis> results = new ArrayList<>(imagePaths.size());
        for (Path path : imagePaths) {
            try {
                results.add(processImage(jobId, path));
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure processing image {} of job {}", path, jobId, e);
                results.add(ImageAnalysis.failure(jobId, String.valueOf(path),
                        "Processing failed: " + e.getMessage()));
            }
        }
        LOG.info("Job {} processed {} image(s)", jobId, results.size());
        return results;
    }

    /**
     * Submits {@link #processImage(String, Path)} to the pipeline executor.
     */
    public CompletableFuture<ImageAnalysis> processImageAsync(String jobId, Path imagePath) {
        return CompletableFuture.supplyAsync(() -> processImage(jobId, imagePath), pipelineExecutor);
    }

    /**
     * Post-recognition stages for one recognition result.
     */
    ImageAnalysis analyze(String jobId, String image, RecognitionResult recognized) {
        RecognitionResult result = recognized;
        GarbleVerdict verdict = garbleDetector.assess(recognized.markup());
        if (verdict.garbled()) {
            String simplified = garbleSimplifier.simplify(recognized.markup());
            LOG.warn("Garbled output from {} (score={}, indicators={}); simplified to '{}'",
                    recognized.sourceTag().backendName(), verdict.score(), verdict.indicators(),
                    LogSanitizer.preview(simplified));
            metrics.incrementGarbled(recognized.sourceTag().backendName());
            result = recognized.withMarkup(simplified, garbleProps.getForcedConfidence(), null);
        }

        CanonicalMarkup canonical = normalizer.normalize(result.markup());
        CompletableFuture<ValidationResult> validation =
                CompletableFuture.supplyAsync(() -> validationService.validate(canonical), analysisExecutor);
        CompletableFuture<String> rendered =
                CompletableFuture.supplyAsync(() -> renderer.render(canonical), analysisExecutor);

        ValidationResult validationResult;
        String readable;
        try {
            validationResult = validation.join();
            readable = rendered.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
        if (!validationResult.valid()
                && ExpressionValidationService.UNPARSEABLE_ERROR.equals(validationResult.error())) {
            metrics.incrementUnparseable();
        }

        String text = verdict.garbled() || result.readableText().isEmpty() ? readable : result.readableText();
        RecognitionResult finalResult = new RecognitionResult(canonical.value(), result.confidence(),
                result.sourceTag(), text);
        return ImageAnalysis.success(jobId, image, finalResult, validationResult, verdict.garbled());
    }
}

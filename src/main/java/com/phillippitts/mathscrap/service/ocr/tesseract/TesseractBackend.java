package com.phillippitts.mathscrap.service.ocr.tesseract;

import com.phillippitts.mathscrap.config.ocr.TesseractConfig;
import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.domain.FailureKind;
import com.phillippitts.mathscrap.domain.RasterImage;
import com.phillippitts.mathscrap.exception.BackendUnavailableException;
import com.phillippitts.mathscrap.exception.RecognitionExceptionBuilder;
import com.phillippitts.mathscrap.service.ocr.AbstractOcrBackend;
import com.phillippitts.mathscrap.service.ocr.BackendOutput;
import com.phillippitts.mathscrap.util.TimeUtils;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Tier 4: Tesseract via Tess4J, running in-process against the native library.
 *
 * <p>The engine is configured for a single uniform block of text with a math-oriented
 * character whitelist. Output lines are joined with spaces.
 *
 * <p><b>Thread Safety:</b> a Tess4J instance is not safe for concurrent use, so every
 * recognition call configures its own engine. Concurrent calls never share native state.
 *
 * @since 1.0
 */
@Component
public class TesseractBackend extends AbstractOcrBackend {

    private static final Logger LOG = LogManager.getLogger(TesseractBackend.class);

    static final double CONFIDENCE = 0.70;

    private final TesseractConfig cfg;
    private final Supplier<ITesseract> engineFactory;

    @Autowired
    public TesseractBackend(TesseractConfig cfg) {
        this(cfg, Tesseract::new);
    }

    TesseractBackend(TesseractConfig cfg, Supplier<ITesseract> engineFactory) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
    }

    @Override
    public BackendTag tag() {
        return BackendTag.TESSERACT;
    }

    /**
     * Available when {@code <dataPath>/<language>.traineddata} exists.
     */
    @Override
    public boolean probe() {
        boolean available = Files.isRegularFile(trainedData());
        LOG.debug("Probe {}: traineddata={} available={}", name(), trainedData(), available);
        return available;
    }

    @Override
    protected void doLoad() {
        if (!probe()) {
            throw new BackendUnavailableException(name(), trainedData().toString());
        }
        LOG.info("Tesseract backend ready: data={}, lang={}, psm={}", cfg.dataPath(), cfg.language(),
                cfg.pageSegMode());
    }

    @Override
    protected BackendOutput doRecognize(RasterImage image) {
        Objects.requireNonNull(image, "image");
        long startTime = System.nanoTime();
        String raw;
        try {
            raw = newEngine().doOCR(image.toBufferedImage());
        } catch (TesseractException e) {
            throw RecognitionExceptionBuilder.create("Tesseract recognition failed: " + e.getMessage())
                    .backend(name())
                    .kind(FailureKind.RUNTIME_ERROR)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .cause(e)
                    .build();
        } catch (LinkageError e) {
            throw RecognitionExceptionBuilder.create("Native Tesseract library could not be loaded")
                    .backend(name())
                    .kind(FailureKind.MODEL_LOAD_FAILED)
                    .metadata("error", e.toString())
                    .cause(e)
                    .build();
        }
        String text = joinLines(raw);
        if (text.isEmpty()) {
            throw RecognitionExceptionBuilder.create("Tesseract detected no text")
                    .backend(name())
                    .kind(FailureKind.MALFORMED_OUTPUT)
                    .build();
        }
        LOG.debug("Tesseract recognized {} in {} ms (chars={})", image, TimeUtils.elapsedMillis(startTime),
                text.length());
        return BackendOutput.of(text, CONFIDENCE);
    }

    private ITesseract newEngine() {
        ITesseract t = engineFactory.get();
        t.setDatapath(cfg.dataPath());
        t.setLanguage(cfg.language());
        t.setPageSegMode(cfg.pageSegMode());
        t.setVariable("tessedit_char_whitelist", cfg.charWhitelist());
        return t;
    }

    static String joinLines(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.strip().replaceAll("\\s*\\R\\s*", " ");
    }

    private Path trainedData() {
        return Path.of(cfg.dataPath()).resolve(cfg.language() + ".traineddata");
    }
}

package com.phillippitts.mathscrap.service.ocr.process;

import com.phillippitts.mathscrap.config.ocr.ProcessBackendConfig;
import com.phillippitts.mathscrap.domain.FailureKind;
import com.phillippitts.mathscrap.domain.RasterImage;
import com.phillippitts.mathscrap.exception.BackendUnavailableException;
import com.phillippitts.mathscrap.exception.RecognitionException;
import com.phillippitts.mathscrap.exception.RecognitionExceptionBuilder;
import com.phillippitts.mathscrap.service.ocr.AbstractOcrBackend;
import com.phillippitts.mathscrap.service.ocr.BackendOutput;
import com.phillippitts.mathscrap.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Base class for backends that run an external recognizer executable.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>Writes the preprocessed raster to a temporary PNG</li>
 *   <li>Invokes the executable via {@link OcrProcessRunner} with the configured timeout</li>
 *   <li>Parses stdout into markup and deletes the temporary file</li>
 * </ul>
 *
 * <p>Every call uses its own temp file and process, so concurrent recognitions are isolated.
 */
public abstract class ProcessOcrBackend extends AbstractOcrBackend {

    private static final Logger LOG = LogManager.getLogger(ProcessOcrBackend.class);

    private final ProcessBackendConfig cfg;
    private final OcrProcessRunner runner;

    protected ProcessOcrBackend(ProcessBackendConfig cfg, OcrProcessRunner runner) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Available when the configured binary is an executable regular file.
     */
    @Override
    public boolean probe() {
        Path binary = binaryPath();
        boolean available = Files.isRegularFile(binary) && Files.isExecutable(binary);
        LOG.debug("Probe {}: binary={} available={}", name(), binary, available);
        return available;
    }

    @Override
    protected void doLoad() {
        if (!probe()) {
            throw new BackendUnavailableException(name(), binaryPath().toString());
        }
        LOG.info("{} backend ready: bin={}, timeout={}s", name(), cfg.binaryPath(), cfg.timeoutSeconds());
    }

    @Override
    protected BackendOutput doRecognize(RasterImage image) {
        Objects.requireNonNull(image, "image");
        Path png = null;
        long startTime = System.nanoTime();
        try {
            png = writeTempPng(image);
            List<String> command = buildCommand(binaryPath().toString(), png);
            String stdout = runner.run(command, png.getParent(), cfg, name());
            BackendOutput output = parseOutput(stdout);
            LOG.debug("{} recognized {} in {} ms (chars={})", name(), image, TimeUtils.elapsedMillis(startTime),
                    output.markup().length());
            return output;
        } finally {
            cleanupTempFile(png);
        }
    }

    /**
     * Builds the command line for one image.
     *
     * @param binary absolute path of the executable
     * @param image  temporary PNG holding the preprocessed raster
     */
    protected abstract List<String> buildCommand(String binary, Path image);

    /**
     * Converts stdout into markup.
     *
     * @throws RecognitionException with {@link FailureKind#MALFORMED_OUTPUT} when nothing usable was printed
     */
    protected abstract BackendOutput parseOutput(String stdout);

    protected final ProcessBackendConfig config() {
        return cfg;
    }

    /** Failure for output that does not contain markup. */
    protected final RecognitionException malformed(String reason) {
        return RecognitionExceptionBuilder.create(reason)
                .backend(name())
                .kind(FailureKind.MALFORMED_OUTPUT)
                .build();
    }

    private Path binaryPath() {
        Path path = Path.of(cfg.binaryPath());
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Path writeTempPng(RasterImage image) {
        try {
            Path png = Files.createTempFile("mathscrap-" + name() + "-", ".png");
            if (!ImageIO.write(image.toBufferedImage(), "png", png.toFile())) {
                Files.deleteIfExists(png);
                throw new IOException("no PNG writer available");
            }
            return png;
        } catch (IOException e) {
            throw RecognitionExceptionBuilder.create("Failed to write temporary image: " + e.getMessage())
                    .backend(name())
                    .kind(FailureKind.RUNTIME_ERROR)
                    .cause(e)
                    .build();
        }
    }

    private void cleanupTempFile(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary image {}: {}", file, e.toString());
        }
    }
}

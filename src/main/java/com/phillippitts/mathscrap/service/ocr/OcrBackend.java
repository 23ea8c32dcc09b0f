package com.phillippitts.mathscrap.service.ocr;

import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.domain.RasterImage;

/**
 * Contract for recognition backends.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #probe()} is called once by the {@link BackendSelector} to decide whether the
 *       backend's runtime is present; it must be cheap and must not load models</li>
 *   <li>The first {@link #recognize(RasterImage)} call loads the backend; later calls reuse it</li>
 * </ol>
 *
 * <p>{@link #recognize(RasterImage)} never throws for backend-level problems: every failure is
 * reported as a {@link RecognitionOutcome.Failed} so the cascade can fall back on data.
 *
 * <p>Thread Safety: implementations must tolerate concurrent {@code recognize} calls.
 */
public interface OcrBackend {

    /** Tier this backend implements. */
    BackendTag tag();

    /** Short backend name for logs and metrics. */
    default String name() {
        return tag().backendName();
    }

    /**
     * Checks whether the backend's runtime (binary, model data) is present.
     *
     * @return true when the backend can be tried
     */
    boolean probe();

    /**
     * Recognizes the markup in a preprocessed image.
     *
     * @param image preprocessed grayscale raster
     * @return recognized markup or a typed failure; never null
     */
    RecognitionOutcome recognize(RasterImage image);
}

package com.phillippitts.mathscrap.service.ocr;

import com.phillippitts.mathscrap.domain.FailureKind;
import com.phillippitts.mathscrap.domain.RasterImage;
import com.phillippitts.mathscrap.exception.RecognitionException;
import com.phillippitts.mathscrap.exception.RecognitionExceptionBuilder;
import com.phillippitts.mathscrap.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for recognition backends providing lazy, single loading and failure mapping.
 *
 * <p>This class implements the Template Method pattern. The first {@link #recognize(RasterImage)}
 * call runs {@link #doLoad()} under an internal lock, so concurrent first requests never load
 * twice. A failed load is remembered and reported on every later call without retrying.
 *
 * <p>Every {@link RecognitionException} thrown by a subclass is converted to a
 * {@link RecognitionOutcome.Failed} carrying the exception's {@link FailureKind}; any other
 * runtime exception becomes {@link FailureKind#RUNTIME_ERROR}.
 *
 * <p><b>Subclass Responsibilities:</b>
 * <ul>
 *   <li>{@link #doLoad()} - load models or validate the runtime; throw on failure</li>
 *   <li>{@link #doRecognize(RasterImage)} - produce markup for one image</li>
 *   <li>{@link #doClose()} - optional cleanup</li>
 * </ul>
 *
 * @see OcrBackend
 */
public abstract class AbstractOcrBackend implements OcrBackend {

    private static final Logger LOG = LogManager.getLogger(AbstractOcrBackend.class);

    /**
     * Guards {@link #loaded}, {@link #loadFailure} and {@link #closed}.
     */
    protected final Object lock = new Object();

    private boolean loaded;
    private boolean closed;
    private RecognitionException loadFailure;

    @Override
    public final RecognitionOutcome recognize(RasterImage image) {
        try {
            ensureLoaded();
            return RecognitionOutcome.recognized(tag(), doRecognize(image));
        } catch (RecognitionException e) {
            return RecognitionOutcome.failed(tag(), e.getKind(), e.getMessage(), e);
        } catch (RuntimeException e) {
            return RecognitionOutcome.failed(tag(), FailureKind.RUNTIME_ERROR,
                    name() + " recognition failed: " + e.getMessage(), e);
        }
    }

    /**
     * Loads the backend once. Later calls return immediately, or rethrow the remembered
     * load failure.
     *
     * @throws RecognitionException when loading failed now or earlier
     */
    protected final void ensureLoaded() {
        synchronized (lock) {
            if (closed) {
                throw RecognitionExceptionBuilder.create("Backend closed")
                        .backend(name())
                        .kind(FailureKind.UNAVAILABLE)
                        .build();
            }
            if (loaded) {
                return;
            }
            if (loadFailure != null) {
                throw loadFailure;
            }
            long start = System.nanoTime();
            try {
                doLoad();
                loaded = true;
                LOG.info("Loaded recognition backend '{}' in {} ms", name(),
                        TimeUtils.elapsedMillis(start));
            } catch (RecognitionException e) {
                loadFailure = e;
                throw e;
            } catch (RuntimeException | LinkageError e) {
                loadFailure = RecognitionExceptionBuilder.create("Model load failed: " + e.getMessage())
                        .backend(name())
                        .kind(FailureKind.MODEL_LOAD_FAILED)
                        .cause(e)
                        .build();
                throw loadFailure;
            }
        }
    }

    /** True once {@link #doLoad()} has succeeded. */
    public final boolean isLoaded() {
        synchronized (lock) {
            return loaded && !closed;
        }
    }

    /**
     * Releases backend resources. Idempotent.
     */
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            if (loaded) {
                doClose();
            }
            closed = true;
            loaded = false;
        }
    }

    /**
     * Backend-specific loading. Called at most once successfully, under the lock.
     *
     * @throws RecognitionException when the runtime or model is unusable
     */
    protected abstract void doLoad();

    /**
     * Backend-specific recognition of one image.
     *
     * @throws RecognitionException on failure, with the matching {@link FailureKind}
     */
    protected abstract BackendOutput doRecognize(RasterImage image);

    /** Backend-specific cleanup; must not throw. */
    protected void doClose() {
    }
}

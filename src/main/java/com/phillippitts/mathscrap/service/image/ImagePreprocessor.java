package com.phillippitts.mathscrap.service.image;

import com.phillippitts.mathscrap.domain.RasterImage;
import com.phillippitts.mathscrap.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Loads an image and prepares it for recognition.
 *
 * <p>Steps, in order: upscale small images, deskew, contrast stretch, 3x3 median denoise,
 * adaptive threshold, invert a dark background. The loaded raster is never modified; every
 * step derives a new one.
 */
@Component
public class ImagePreprocessor {

    private static final Logger LOG = LogManager.getLogger(ImagePreprocessor.class);

    static final List<ImageOperation> OPERATIONS = List.of(
            new ImageOperation("upscale", ImageOperations::upscale),
            new ImageOperation("deskew", ImageOperations::deskew),
            new ImageOperation("contrast-stretch", ImageOperations::stretchContrast),
            new ImageOperation("median-denoise", ImageOperations::medianFilter),
            new ImageOperation("adaptive-threshold", ImageOperations::adaptiveThreshold),
            new ImageOperation("invert-dark-background", ImageOperations::invertIfDark));

    private final ImageLoader loader;

    public ImagePreprocessor(ImageLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Loads and preprocesses an image file.
     *
     * @throws com.phillippitts.mathscrap.exception.UnreadableImageException when the file cannot be loaded
     */
    public RasterImage preprocess(Path path) {
        return preprocess(loader.load(path));
    }

    public RasterImage preprocess(RasterImage image) {
        RasterImage current = Objects.requireNonNull(image, "image");
        long start = System.nanoTime();
        for (ImageOperation operation : OPERATIONS) {
            long stepStart = System.nanoTime();
            current = operation.apply(current);
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} -> {} in {} ms", operation.name(), current, TimeUtils.elapsedMillis(stepStart));
            }
        }
        LOG.debug("Preprocessed {} in {} ms", image, TimeUtils.elapsedMillis(start));
        return current;
    }
}

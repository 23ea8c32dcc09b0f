package com.phillippitts.mathscrap.service.image;

import com.phillippitts.mathscrap.domain.RasterImage;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A named preprocessing step. Steps never modify their input; each returns a new raster
 * (or the input itself when there is nothing to do).
 *
 * @param name      identifier used in debug logs
 * @param transform the step itself
 */
public record ImageOperation(String name, UnaryOperator<RasterImage> transform) {

    public ImageOperation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transform, "transform");
    }

    public RasterImage apply(RasterImage image) {
        return transform.apply(image);
    }
}

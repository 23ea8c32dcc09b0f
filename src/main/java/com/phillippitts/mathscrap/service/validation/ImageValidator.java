package com.phillippitts.mathscrap.service.validation;

import com.phillippitts.mathscrap.config.properties.ImageValidationProperties;
import com.phillippitts.mathscrap.exception.UnreadableImageException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Validates input image files before and after header decoding.
 */
@Component
public class ImageValidator {
    private final ImageValidationProperties props;

    public ImageValidator(ImageValidationProperties props) {
        this.props = props;
    }

    /**
     * Checks that the path names a readable regular file within the size limit.
     * @param path image file
     * @throws UnreadableImageException when the file is missing, unreadable or too large
     */
    public void validateFile(Path path) {
        if (path == null) {
            throw new UnreadableImageException("null", "Image path is null");
        }
        if (!Files.isRegularFile(path)) {
            throw new UnreadableImageException(path.toString(), "file does not exist or is not a regular file");
        }
        if (!Files.isReadable(path)) {
            throw new UnreadableImageException(path.toString(), "file is not readable");
        }
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            throw new UnreadableImageException(path.toString(), "could not determine file size", e);
        }
        // Guard against oversized payloads before decoding anything
        if (size > props.maxFileBytes()) {
            throw new UnreadableImageException(path.toString(), "file too large: " + size
                    + " bytes. Max: " + props.maxFileBytes() + " bytes ("
                    + (props.maxFileBytes() / (1024 * 1024)) + " MB)");
        }
        if (size == 0) {
            throw new UnreadableImageException(path.toString(), "file is empty");
        }
    }

    /**
     * Checks decoded dimensions against the pixel limit.
     * @throws UnreadableImageException when the image is degenerate or exceeds the limit
     */
    public void validateDimensions(Path path, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new UnreadableImageException(String.valueOf(path), "invalid dimensions " + width + "x" + height);
        }
        long pixels = (long) width * height;
        if (pixels > props.maxPixels()) {
            throw new UnreadableImageException(String.valueOf(path), "image too large: " + width + "x" + height
                    + " (" + pixels + " pixels). Max: " + props.maxPixels() + " pixels");
        }
    }
}

package com.phillippitts.mathscrap.service.image;

import com.phillippitts.mathscrap.domain.RasterImage;
import com.phillippitts.mathscrap.exception.UnreadableImageException;
import com.phillippitts.mathscrap.service.validation.ImageValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;

/**
 * Decodes image files into grayscale {@link RasterImage}s with {@link ImageIO}.
 *
 * <p>File size is checked before decoding and pixel dimensions are checked from the image
 * header before the pixel data is read.
 */
@Component
public class ImageLoader {

    private static final Logger LOG = LogManager.getLogger(ImageLoader.class);

    private final ImageValidator validator;

    public ImageLoader(ImageValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Loads an image file.
     *
     * @throws UnreadableImageException when the file is missing, too large, or not a decodable image
     */
    public RasterImage load(Path path) {
        validator.validateFile(path);
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in == null) {
                throw new UnreadableImageException(path.toString(), "could not open image stream");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new UnreadableImageException(path.toString(), "not a supported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                validator.validateDimensions(path, reader.getWidth(0), reader.getHeight(0));
                BufferedImage decoded = reader.read(0);
                LOG.debug("Decoded {} as {} {}x{}", path.getFileName(), reader.getFormatName(),
                        decoded.getWidth(), decoded.getHeight());
                return RasterImage.fromBufferedImage(path, decoded);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new UnreadableImageException(path.toString(), "failed to decode image", e);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            // ImageIO decoders signal corrupt headers and truncated data this way
            throw new UnreadableImageException(path.toString(), "corrupt image data", e);
        }
    }
}

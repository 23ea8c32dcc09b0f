package com.phillippitts.mathscrap.service.image;

import com.phillippitts.mathscrap.domain.RasterImage;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.RotatedRect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.BORDER_REPLICATE;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.bitwise_not;
import static org.bytedeco.opencv.global.opencv_core.countNonZero;
import static org.bytedeco.opencv.global.opencv_core.findNonZero;
import static org.bytedeco.opencv.global.opencv_imgproc.ADAPTIVE_THRESH_MEAN_C;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_CUBIC;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_BINARY;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_BINARY_INV;
import static org.bytedeco.opencv.global.opencv_imgproc.getRotationMatrix2D;
import static org.bytedeco.opencv.global.opencv_imgproc.medianBlur;
import static org.bytedeco.opencv.global.opencv_imgproc.minAreaRect;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;
import static org.bytedeco.opencv.global.opencv_imgproc.threshold;
import static org.bytedeco.opencv.global.opencv_imgproc.warpAffine;

/**
 * Grayscale raster operations used by the {@link ImagePreprocessor}, implemented with OpenCV.
 *
 * <p>All operations are pure: each copies the input raster into a native {@link Mat}, runs the
 * OpenCV call and copies the result back into a new {@link RasterImage}. Native buffers are
 * released before returning.
 *
 * @since 1.0
 */
public final class ImageOperations {

    private ImageOperations() {
        // Utility class
    }

    /** Images with either side below this are upscaled. */
    static final int MIN_SIDE = 64;

    /** Smallest upscale factor applied to an undersized image. */
    static final double MIN_UPSCALE_FACTOR = 2.0;

    /** Skew estimates beyond this magnitude are treated as layout, not skew. */
    static final double MAX_SKEW_DEGREES = 10.0;

    /** Skew below this magnitude is left alone. */
    static final double MIN_CORRECTED_SKEW_DEGREES = 0.5;

    static final double LOW_PERCENTILE = 0.01;
    static final double HIGH_PERCENTILE = 0.99;

    static final int MEDIAN_KERNEL = 3;
    static final int THRESHOLD_BLOCK = 11;
    static final int THRESHOLD_OFFSET = 2;

    /** Mean intensity below which the background is taken to be dark. */
    static final double DARK_BACKGROUND_MEAN = 127.0;

    /**
     * Upscales an image whose width or height is below {@value #MIN_SIDE} pixels by
     * {@code max(64 / h, 64 / w, 2.0)} with bicubic interpolation.
     */
    public static RasterImage upscale(RasterImage image) {
        int w = image.width();
        int h = image.height();
        if (w >= MIN_SIDE && h >= MIN_SIDE) {
            return image;
        }
        double factor = Math.max(MIN_UPSCALE_FACTOR, Math.max((double) MIN_SIDE / h, (double) MIN_SIDE / w));
        int newW = (int) Math.round(w * factor);
        int newH = (int) Math.round(h * factor);
        try (Mat src = toMat(image); Mat dst = new Mat(); Size size = new Size(newW, newH)) {
            resize(src, dst, size, 0, 0, INTER_CUBIC);
            return fromMat(image.source(), dst);
        }
    }

    /**
     * Estimates skew from the minimum-area rectangle around the ink pixels and rotates the
     * image upright.
     *
     * <p><b>Algorithm:</b>
     * <ol>
     *   <li>Mask pixels darker than the mean (lighter on a dark background) as ink</li>
     *   <li>Fit {@code minAreaRect} to the ink coordinates</li>
     *   <li>Fold the rectangle angle onto its long side, in (-45, 45] degrees</li>
     *   <li>Rotate back with {@code warpAffine} when 0.5 &lt; |angle| &lt;= 10 degrees</li>
     * </ol>
     */
    public static RasterImage deskew(RasterImage image) {
        double angle = estimateSkewDegrees(image);
        if (Math.abs(angle) <= MIN_CORRECTED_SKEW_DEGREES || Math.abs(angle) > MAX_SKEW_DEGREES) {
            return image;
        }
        return rotate(image, angle);
    }

    /**
     * Clockwise skew of the ink in degrees, as displayed (y pointing down). Zero when the
     * image has no ink.
     */
    static double estimateSkewDegrees(RasterImage image) {
        double mean = image.meanIntensity();
        boolean darkBackground = mean < DARK_BACKGROUND_MEAN;
        try (Mat src = toMat(image); Mat ink = new Mat(); Mat points = new Mat()) {
            if (darkBackground) {
                threshold(src, ink, Math.floor(mean), 255, THRESH_BINARY);
            } else {
                threshold(src, ink, Math.ceil(mean) - 1, 255, THRESH_BINARY_INV);
            }
            if (countNonZero(ink) == 0) {
                return 0.0;
            }
            findNonZero(ink, points);
            try (RotatedRect box = minAreaRect(points)) {
                double angle = box.angle();
                if (box.size().width() < box.size().height()) {
                    angle -= 90.0;
                }
                while (angle > 45.0) {
                    angle -= 90.0;
                }
                while (angle <= -45.0) {
                    angle += 90.0;
                }
                return angle;
            }
        }
    }

    /** Rotates counter-clockwise (as displayed) about the centre, replicating the border. */
    static RasterImage rotate(RasterImage image, double degrees) {
        int w = image.width();
        int h = image.height();
        try (Mat src = toMat(image);
             Mat dst = new Mat();
             Point2f center = new Point2f(w / 2.0f, h / 2.0f);
             Mat matrix = getRotationMatrix2D(center, degrees, 1.0);
             Size size = new Size(w, h);
             Scalar border = new Scalar(0, 0, 0, 0)) {
            warpAffine(src, dst, matrix, size, INTER_CUBIC, BORDER_REPLICATE, border);
            return fromMat(image.source(), dst);
        }
    }

    /**
     * Linearly maps the 1st..99th percentile intensity range onto 0..255, saturating outside it.
     * A flat image is returned unchanged.
     */
    public static RasterImage stretchContrast(RasterImage image) {
        int[] pixels = image.pixels();
        int[] histogram = new int[256];
        for (int v : pixels) {
            histogram[v]++;
        }
        int low = percentile(histogram, pixels.length, LOW_PERCENTILE);
        int high = percentile(histogram, pixels.length, HIGH_PERCENTILE);
        if (high <= low) {
            return image;
        }
        double scale = 255.0 / (high - low);
        try (Mat src = toMat(image); Mat dst = new Mat()) {
            src.convertTo(dst, CV_8U, scale, -low * scale);
            return fromMat(image.source(), dst);
        }
    }

    private static int percentile(int[] histogram, int total, double fraction) {
        long target = Math.max(1, (long) Math.ceil(total * fraction));
        long cumulative = 0;
        for (int v = 0; v < histogram.length; v++) {
            cumulative += histogram[v];
            if (cumulative >= target) {
                return v;
            }
        }
        return histogram.length - 1;
    }

    /** {@value #MEDIAN_KERNEL}x{@value #MEDIAN_KERNEL} median filter. */
    public static RasterImage medianFilter(RasterImage image) {
        try (Mat src = toMat(image); Mat dst = new Mat()) {
            medianBlur(src, dst, MEDIAN_KERNEL);
            return fromMat(image.source(), dst);
        }
    }

    /**
     * Adaptive mean threshold: a pixel becomes white when it is brighter than the mean of its
     * {@value #THRESHOLD_BLOCK}x{@value #THRESHOLD_BLOCK} neighbourhood minus
     * {@value #THRESHOLD_OFFSET}, black otherwise.
     */
    public static RasterImage adaptiveThreshold(RasterImage image) {
        try (Mat src = toMat(image); Mat dst = new Mat()) {
            opencv_imgproc.adaptiveThreshold(src, dst, 255,
                    ADAPTIVE_THRESH_MEAN_C, THRESH_BINARY, THRESHOLD_BLOCK, THRESHOLD_OFFSET);
            return fromMat(image.source(), dst);
        }
    }

    /** Inverts the image when its mean intensity indicates a dark background. */
    public static RasterImage invertIfDark(RasterImage image) {
        if (image.meanIntensity() >= DARK_BACKGROUND_MEAN) {
            return image;
        }
        try (Mat src = toMat(image); Mat dst = new Mat()) {
            bitwise_not(src, dst);
            return fromMat(image.source(), dst);
        }
    }

    static Mat toMat(RasterImage image) {
        int[] pixels = image.pixels();
        byte[] data = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            data[i] = (byte) pixels[i];
        }
        Mat mat = new Mat(image.height(), image.width(), CV_8UC1);
        mat.data().put(data, 0, data.length);
        return mat;
    }

    static RasterImage fromMat(Path source, Mat mat) {
        if (!mat.isContinuous()) {
            try (Mat copy = mat.clone()) {
                return fromMat(source, copy);
            }
        }
        int w = mat.cols();
        int h = mat.rows();
        byte[] data = new byte[w * h];
        mat.data().get(data, 0, data.length);
        int[] pixels = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            pixels[i] = data[i] & 0xFF;
        }
        return RasterImage.of(source, w, h, pixels);
    }
}

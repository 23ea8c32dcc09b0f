package com.phillippitts.mathscrap.service.image;

import com.phillippitts.mathscrap.domain.RasterImage;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImageOperationsTest {

    private static final Path SOURCE = Path.of("test.png");

    private static RasterImage uniform(int w, int h, int value) {
        int[] pixels = new int[w * h];
        Arrays.fill(pixels, value);
        return RasterImage.of(SOURCE, w, h, pixels);
    }

    /** White canvas with a 3px dark line at the given slope through the centre. */
    private static RasterImage line(double degrees) {
        int w = 200;
        int h = 100;
        int[] pixels = new int[w * h];
        Arrays.fill(pixels, 255);
        double slope = Math.tan(Math.toRadians(degrees));
        for (int x = 20; x <= 180; x++) {
            int yc = (int) Math.round(50 + (x - 100) * slope);
            for (int y = yc - 1; y <= yc + 1; y++) {
                pixels[y * w + x] = 0;
            }
        }
        return RasterImage.of(SOURCE, w, h, pixels);
    }

    @Test
    void upscaleEnlargesSmallImagesToAtLeastMinimumSide() {
        // Arrange
        RasterImage small = uniform(20, 10, 255);

        // Act
        RasterImage scaled = ImageOperations.upscale(small);

        // Assert: factor max(2, 64/10, 64/20) = 6.4
        assertThat(scaled.width()).isEqualTo(128);
        assertThat(scaled.height()).isEqualTo(64);
        assertThat(scaled.source()).isEqualTo(SOURCE);
    }

    @Test
    void upscaleAppliesMinimumFactorOfTwo() {
        RasterImage scaled = ImageOperations.upscale(uniform(100, 40, 255));

        assertThat(scaled.width()).isEqualTo(200);
        assertThat(scaled.height()).isEqualTo(80);
    }

    @Test
    void upscaleLeavesLargeImagesAlone() {
        RasterImage image = uniform(100, 100, 255);

        assertThat(ImageOperations.upscale(image)).isSameAs(image);
    }

    @Test
    void skewOfBlankImageIsZero() {
        assertThat(ImageOperations.estimateSkewDegrees(uniform(50, 50, 200))).isZero();
    }

    @Test
    void horizontalLineIsNotRotated() {
        // Arrange
        RasterImage image = line(0.0);

        // Act
        double skew = ImageOperations.estimateSkewDegrees(image);
        RasterImage result = ImageOperations.deskew(image);

        // Assert
        assertThat(skew).isCloseTo(0.0, within(0.5));
        assertThat(result).isSameAs(image);
    }

    @Test
    void steepLineIsTreatedAsLayoutAndLeftAlone() {
        // Arrange
        RasterImage image = line(30.0);

        // Act
        double skew = ImageOperations.estimateSkewDegrees(image);
        RasterImage result = ImageOperations.deskew(image);

        // Assert
        assertThat(skew).isCloseTo(30.0, within(1.0));
        assertThat(result).isSameAs(image);
    }

    @Test
    void skewedLineIsDetectedAndStraightened() {
        // Arrange
        RasterImage image = line(5.0);

        // Act
        double skew = ImageOperations.estimateSkewDegrees(image);
        RasterImage result = ImageOperations.deskew(image);

        // Assert
        assertThat(skew).isCloseTo(5.0, within(1.0));
        assertThat(result).isNotSameAs(image);
        assertThat(result.width()).isEqualTo(image.width());
        assertThat(ImageOperations.estimateSkewDegrees(result)).isCloseTo(0.0, within(1.0));
    }

    @Test
    void contrastStretchMapsPercentileRangeToFullScale() {
        // Arrange: left half 100, right half 150
        int[] pixels = new int[100];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (i % 10) < 5 ? 100 : 150;
        }
        RasterImage image = RasterImage.of(SOURCE, 10, 10, pixels);

        // Act
        RasterImage stretched = ImageOperations.stretchContrast(image);

        // Assert
        assertThat(stretched.pixel(0, 0)).isZero();
        assertThat(stretched.pixel(9, 9)).isEqualTo(255);
        assertThat(stretched.source()).isEqualTo(SOURCE);
    }

    @Test
    void contrastStretchSaturatesOutliers() {
        // Arrange: one dark and one bright outlier around a 100..150 ramp
        int[] pixels = new int[200];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = 100 + (i % 51);
        }
        pixels[0] = 0;
        pixels[1] = 255;
        RasterImage image = RasterImage.of(SOURCE, 20, 10, pixels);

        // Act
        RasterImage stretched = ImageOperations.stretchContrast(image);

        // Assert
        assertThat(stretched.pixel(0, 0)).isZero();
        assertThat(stretched.pixel(1, 0)).isEqualTo(255);
        assertThat(Arrays.stream(stretched.pixels()).boxed().toList()).allSatisfy(v -> assertThat(v).isBetween(0, 255));
    }

    @Test
    void contrastStretchLeavesFlatImageAlone() {
        RasterImage flat = uniform(10, 10, 90);

        assertThat(ImageOperations.stretchContrast(flat)).isSameAs(flat);
    }

    @Test
    void medianFilterRemovesIsolatedSpeck() {
        // Arrange
        int[] pixels = new int[25];
        Arrays.fill(pixels, 200);
        pixels[12] = 0;
        RasterImage image = RasterImage.of(SOURCE, 5, 5, pixels);

        // Act
        RasterImage filtered = ImageOperations.medianFilter(image);

        // Assert
        assertThat(filtered.pixels()).containsOnly(200);
        assertThat(image.pixel(2, 2)).as("input untouched").isZero();
    }

    @Test
    void adaptiveThresholdKeepsDarkMarkOnLightBackground() {
        // Arrange
        int[] pixels = new int[21 * 21];
        Arrays.fill(pixels, 240);
        pixels[10 * 21 + 10] = 20;
        RasterImage image = RasterImage.of(SOURCE, 21, 21, pixels);

        // Act
        RasterImage binary = ImageOperations.adaptiveThreshold(image);

        // Assert
        assertThat(binary.pixel(10, 10)).isZero();
        assertThat(binary.pixel(0, 0)).isEqualTo(255);
        assertThat(binary.pixels()).containsOnly(0, 255);
    }

    @Test
    void uniformRegionThresholdsToWhite() {
        RasterImage binary = ImageOperations.adaptiveThreshold(uniform(15, 15, 0));

        assertThat(binary.pixels()).containsOnly(255);
    }

    @Test
    void darkBackgroundIsInverted() {
        RasterImage inverted = ImageOperations.invertIfDark(uniform(4, 4, 10));

        assertThat(inverted.pixels()).containsOnly(245);
    }

    @Test
    void lightBackgroundIsNotInverted() {
        RasterImage image = uniform(4, 4, 200);

        assertThat(ImageOperations.invertIfDark(image)).isSameAs(image);
    }
}

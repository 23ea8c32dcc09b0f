package com.phillippitts.mathscrap.domain;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterImageTest {

    private static final Path SOURCE = Path.of("/in/eq.png");

    @Test
    void ofClampsAndCopiesPixels() {
        int[] pixels = {-10, 0, 128, 300};

        RasterImage image = RasterImage.of(SOURCE, 2, 2, pixels);
        pixels[1] = 99;

        assertThat(image.pixels()).containsExactly(0, 0, 128, 255);
        assertThat(image.pixel(1, 1)).isEqualTo(255);
        assertThat(image.meanIntensity()).isEqualTo(95.75);
    }

    @Test
    void pixelsReturnsCopy() {
        RasterImage image = RasterImage.of(SOURCE, 1, 2, new int[] {10, 20});

        image.pixels()[0] = 200;

        assertThat(image.pixel(0, 0)).isEqualTo(10);
    }

    @Test
    void rejectsMismatchedDimensions() {
        assertThatThrownBy(() -> RasterImage.of(SOURCE, 3, 3, new int[4]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3x3");
        assertThatThrownBy(() -> RasterImage.of(SOURCE, 0, 1, new int[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertsColourToLuminance() {
        BufferedImage rgb = new BufferedImage(3, 1, BufferedImage.TYPE_INT_ARGB);
        rgb.setRGB(0, 0, 0xFF00FF00);
        rgb.setRGB(1, 0, 0xFFFFFFFF);
        rgb.setRGB(2, 0, 0x00000000);

        RasterImage image = RasterImage.fromBufferedImage(SOURCE, rgb);

        assertThat(image.pixel(0, 0)).isEqualTo(150);
        assertThat(image.pixel(1, 0)).isEqualTo(255);
        assertThat(image.pixel(2, 0)).as("transparent over white").isEqualTo(255);
    }

    @Test
    void deriveKeepsSource() {
        RasterImage image = RasterImage.of(SOURCE, 1, 1, new int[] {0});

        RasterImage derived = image.derive(2, 1, new int[] {1, 2});

        assertThat(derived.source()).isEqualTo(SOURCE);
        assertThat(derived.width()).isEqualTo(2);
        assertThat(derived.toString()).isEqualTo("RasterImage[eq.png 2x1]");
    }
}

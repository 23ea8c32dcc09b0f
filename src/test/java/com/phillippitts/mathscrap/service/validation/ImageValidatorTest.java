package com.phillippitts.mathscrap.service.validation;

import com.phillippitts.mathscrap.config.properties.ImageValidationProperties;
import com.phillippitts.mathscrap.exception.UnreadableImageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageValidatorTest {

    @TempDir
    Path tempDir;

    private final ImageValidator validator = new ImageValidator(new ImageValidationProperties(100, 1_000));

    @Test
    void acceptsSmallRegularFile() throws IOException {
        Path file = Files.write(tempDir.resolve("ok.png"), new byte[50]);

        assertThatCode(() -> validator.validateFile(file)).doesNotThrowAnyException();
    }

    @Test
    void rejectsNullPath() {
        assertThatThrownBy(() -> validator.validateFile(null))
                .isInstanceOf(UnreadableImageException.class)
                .hasMessageContaining("Image path is null");
    }

    @Test
    void rejectsDirectory() {
        assertThatThrownBy(() -> validator.validateFile(tempDir))
                .isInstanceOf(UnreadableImageException.class)
                .hasMessageContaining("not a regular file");
    }

    @Test
    void rejectsEmptyFile() throws IOException {
        Path file = Files.createFile(tempDir.resolve("empty.png"));

        assertThatThrownBy(() -> validator.validateFile(file))
                .isInstanceOf(UnreadableImageException.class)
                .hasMessageContaining("file is empty");
    }

    @Test
    void rejectsOversizedFile() throws IOException {
        // Arrange
        Path file = Files.write(tempDir.resolve("big.png"), new byte[101]);

        // Act & Assert
        assertThatThrownBy(() -> validator.validateFile(file))
                .isInstanceOf(UnreadableImageException.class)
                .hasMessageContaining("file too large: 101 bytes");
    }

    @Test
    void dimensionsWithinLimitPass() {
        assertThatCode(() -> validator.validateDimensions(Path.of("a.png"), 40, 25)).doesNotThrowAnyException();
    }

    @Test
    void degenerateDimensionsAreRejected() {
        assertThatThrownBy(() -> validator.validateDimensions(Path.of("a.png"), 0, 10))
                .isInstanceOf(UnreadableImageException.class)
                .hasMessageContaining("invalid dimensions 0x10");
    }

    @Test
    void tooManyPixelsAreRejected() {
        assertThatThrownBy(() -> validator.validateDimensions(Path.of("a.png"), 40, 26))
                .isInstanceOf(UnreadableImageException.class)
                .hasMessageContaining("1040 pixels");
    }
}

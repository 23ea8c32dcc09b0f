package com.phillippitts.mathscrap.config.ocr;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the PaddleOCR command-line recognizer.
 */
@ConfigurationProperties(prefix = "ocr.paddleocr")
@Validated
public record PaddleOcrConfig(
        @NotBlank @DefaultValue("/usr/local/bin/paddleocr")
        String binaryPath,

        @NotBlank @DefaultValue("en")
        String language,

        @Positive @DefaultValue("30")
        int timeoutSeconds,

        @Positive @DefaultValue("65536")
        int maxStdoutBytes
) implements ProcessBackendConfig {

    @ConstructorBinding
    public PaddleOcrConfig {
    }

    public PaddleOcrConfig() {
        this("/usr/local/bin/paddleocr", "en", 30, 65536);
    }
}

package com.phillippitts.mathscrap.config.ocr;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the EasyOCR command-line recognizer.
 *
 * @param binaryPath            path to the {@code easyocr} executable
 * @param language              language code passed with {@code -l}
 * @param timeoutSeconds        maximum time for one recognition
 * @param maxStdoutBytes        stdout cap
 * @param minFragmentConfidence fragments scored below this are dropped
 */
@ConfigurationProperties(prefix = "ocr.easyocr")
@Validated
public record EasyOcrConfig(
        @NotBlank @DefaultValue("/usr/local/bin/easyocr")
        String binaryPath,

        @NotBlank @DefaultValue("en")
        String language,

        @Positive @DefaultValue("30")
        int timeoutSeconds,

        @Positive @DefaultValue("65536")
        int maxStdoutBytes,

        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.5")
        double minFragmentConfidence
) implements ProcessBackendConfig {

    @ConstructorBinding
    public EasyOcrConfig {
    }

    public EasyOcrConfig() {
        this("/usr/local/bin/easyocr", "en", 30, 65536, 0.5);
    }
}

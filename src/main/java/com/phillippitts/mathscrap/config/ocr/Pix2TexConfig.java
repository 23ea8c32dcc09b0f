package com.phillippitts.mathscrap.config.ocr;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the pix2tex (LaTeX-OCR) command-line recognizer.
 *
 * <p>Example application.properties:
 * <pre>
 * ocr.pix2tex.binary-path=/usr/local/bin/pix2tex
 * ocr.pix2tex.timeout-seconds=30
 * ocr.pix2tex.max-stdout-bytes=65536
 * </pre>
 *
 * @param binaryPath     path to the {@code pix2tex} executable
 * @param timeoutSeconds maximum time for one recognition
 * @param maxStdoutBytes stdout cap
 */
@ConfigurationProperties(prefix = "ocr.pix2tex")
@Validated
public record Pix2TexConfig(
        @NotBlank(message = "pix2tex binary path must not be blank")
        @DefaultValue("/usr/local/bin/pix2tex")
        String binaryPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("30")
        int timeoutSeconds,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("65536")
        int maxStdoutBytes
) implements ProcessBackendConfig {

    @ConstructorBinding
    public Pix2TexConfig {
    }

    public Pix2TexConfig() {
        this("/usr/local/bin/pix2tex", 30, 65536);
    }
}

package com.phillippitts.mathscrap.config.ocr;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the in-process Tesseract recognizer (Tess4J).
 *
 * <p>Example application.properties:
 * <pre>
 * ocr.tesseract.data-path=/usr/share/tesseract-ocr/4.00/tessdata
 * ocr.tesseract.language=eng
 * ocr.tesseract.page-seg-mode=6
 * </pre>
 *
 * @param dataPath      tessdata directory containing {@code <language>.traineddata}
 * @param language      trained data name
 * @param pageSegMode   page segmentation mode (6 = single uniform block of text)
 * @param charWhitelist characters Tesseract may emit
 */
@ConfigurationProperties(prefix = "ocr.tesseract")
@Validated
public record TesseractConfig(
        @NotBlank(message = "tessdata path must not be blank")
        @DefaultValue("/usr/share/tesseract-ocr/4.00/tessdata")
        String dataPath,

        @NotBlank @DefaultValue("eng")
        String language,

        @Min(0) @Max(13) @DefaultValue("6")
        int pageSegMode,

        @DefaultValue(DEFAULT_WHITELIST)
        String charWhitelist
) {

    public static final String DEFAULT_WHITELIST =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz+-=(){}[]^_/|<>.,";

    @ConstructorBinding
    public TesseractConfig {
    }

    public TesseractConfig() {
        this("/usr/share/tesseract-ocr/4.00/tessdata", "eng", 6, DEFAULT_WHITELIST);
    }
}

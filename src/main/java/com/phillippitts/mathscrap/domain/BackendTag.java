package com.phillippitts.mathscrap.domain;

/**
 * Closed set of recognition backends, in cascade priority order (most math-specialized first).
 */
public enum BackendTag {
    PIX2TEX("pix2tex", "pix2tex_latex_ocr"),
    EASYOCR("easyocr", "easyocr_math"),
    PADDLEOCR("paddleocr", "paddleocr_math"),
    TESSERACT("tesseract", "tesseract_math"),
    RULE_FALLBACK("fallback", "fallback_ocr");

    private final String backendName;
    private final String sourceId;

    BackendTag(String backendName, String sourceId) {
        this.backendName = backendName;
        this.sourceId = sourceId;
    }

    /** Short name used in logs, metrics and configuration. */
    public String backendName() {
        return backendName;
    }

    /** Value reported as {@code source} in recognition payloads. */
    public String sourceId() {
        return sourceId;
    }

    public boolean isFallback() {
        return this == RULE_FALLBACK;
    }
}

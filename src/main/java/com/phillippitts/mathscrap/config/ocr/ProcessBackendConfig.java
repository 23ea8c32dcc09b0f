package com.phillippitts.mathscrap.config.ocr;

/**
 * Settings shared by recognizers that run as an external command-line process.
 */
public interface ProcessBackendConfig {

    /** Path to the recognizer executable. */
    String binaryPath();

    /** Maximum time to wait for one recognition. */
    int timeoutSeconds();

    /** Cap on captured stdout. */
    int maxStdoutBytes();
}

/**
 * Recognition backends and the cascade that runs them.
 *
 * <p>Backends implement {@link com.phillippitts.mathscrap.service.ocr.OcrBackend} and report
 * every failure as a {@link com.phillippitts.mathscrap.service.ocr.RecognitionOutcome.Failed}
 * value. {@link com.phillippitts.mathscrap.service.ocr.BackendSelector} probes them once in
 * priority order; {@link com.phillippitts.mathscrap.service.ocr.RecognitionCascade} walks the
 * resulting ladder and ends at the rule-based fallback.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code process} - external command-line recognizers (pix2tex, EasyOCR, PaddleOCR)</li>
 *   <li>{@code tesseract} - in-process Tesseract via Tess4J</li>
 *   <li>{@code fallback} - deterministic file-name rules</li>
 *   <li>{@code event} - failure events</li>
 * </ul>
 */
package com.phillippitts.mathscrap.service.ocr;

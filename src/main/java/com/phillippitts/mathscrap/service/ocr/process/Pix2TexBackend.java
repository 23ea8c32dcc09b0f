package com.phillippitts.mathscrap.service.ocr.process;

import com.phillippitts.mathscrap.config.ocr.Pix2TexConfig;
import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.service.ocr.BackendOutput;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Tier 1: pix2tex (LaTeX-OCR), the math-specialized recognizer. Emits LaTeX directly.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} ${image}
 * </pre>
 */
@Component
public class Pix2TexBackend extends ProcessOcrBackend {

    static final double CONFIDENCE = 0.90;

    public Pix2TexBackend(Pix2TexConfig cfg, OcrProcessRunner runner) {
        super(cfg, runner);
    }

    @Override
    public BackendTag tag() {
        return BackendTag.PIX2TEX;
    }

    @Override
    protected List<String> buildCommand(String binary, Path image) {
        return List.of(binary, image.toAbsolutePath().toString());
    }

    @Override
    protected BackendOutput parseOutput(String stdout) {
        String latex = OcrOutputParser.parsePix2Tex(stdout);
        if (latex.isEmpty()) {
            throw malformed("pix2tex produced no LaTeX");
        }
        return BackendOutput.of(latex, CONFIDENCE);
    }
}

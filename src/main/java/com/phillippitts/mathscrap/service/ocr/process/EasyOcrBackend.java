package com.phillippitts.mathscrap.service.ocr.process;

import com.phillippitts.mathscrap.config.ocr.EasyOcrConfig;
import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.service.ocr.BackendOutput;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Tier 2: EasyOCR. General text recognizer; detected fragments are joined with spaces and
 * fragments scored below {@link EasyOcrConfig#minFragmentConfidence()} are dropped.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -l ${language} -f ${image} --detail 1 --gpu False
 * </pre>
 */
@Component
public class EasyOcrBackend extends ProcessOcrBackend {

    static final double CONFIDENCE = 0.80;

    private final EasyOcrConfig cfg;

    public EasyOcrBackend(EasyOcrConfig cfg, OcrProcessRunner runner) {
        super(cfg, runner);
        this.cfg = cfg;
    }

    @Override
    public BackendTag tag() {
        return BackendTag.EASYOCR;
    }

    @Override
    protected List<String> buildCommand(String binary, Path image) {
        return List.of(binary,
                "-l", cfg.language(),
                "-f", image.toAbsolutePath().toString(),
                "--detail", "1",
                "--gpu", "False");
    }

    @Override
    protected BackendOutput parseOutput(String stdout) {
        String text = OcrOutputParser.joinFragments(OcrOutputParser.parseFragments(stdout),
                cfg.minFragmentConfidence());
        if (text.isEmpty()) {
            throw malformed("easyocr detected no text above confidence " + cfg.minFragmentConfidence());
        }
        return BackendOutput.of(text, CONFIDENCE);
    }
}

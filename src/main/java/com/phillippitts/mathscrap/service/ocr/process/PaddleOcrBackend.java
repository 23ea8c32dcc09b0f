package com.phillippitts.mathscrap.service.ocr.process;

import com.phillippitts.mathscrap.config.ocr.PaddleOcrConfig;
import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.service.ocr.BackendOutput;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Tier 3: PaddleOCR. Every detected fragment is kept and joined with spaces.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} --image_dir ${image} --lang ${language} --use_angle_cls true --use_gpu false
 * </pre>
 */
@Component
public class PaddleOcrBackend extends ProcessOcrBackend {

    static final double CONFIDENCE = 0.75;

    private final PaddleOcrConfig cfg;

    public PaddleOcrBackend(PaddleOcrConfig cfg, OcrProcessRunner runner) {
        super(cfg, runner);
        this.cfg = cfg;
    }

    @Override
    public BackendTag tag() {
        return BackendTag.PADDLEOCR;
    }

    @Override
    protected List<String> buildCommand(String binary, Path image) {
        return List.of(binary,
                "--image_dir", image.toAbsolutePath().toString(),
                "--lang", cfg.language(),
                "--use_angle_cls", "true",
                "--use_gpu", "false");
    }

    @Override
    protected BackendOutput parseOutput(String stdout) {
        String text = OcrOutputParser.joinFragments(OcrOutputParser.parseFragments(stdout), 0.0);
        if (text.isEmpty()) {
            throw malformed("paddleocr detected no text");
        }
        return BackendOutput.of(text, CONFIDENCE);
    }
}

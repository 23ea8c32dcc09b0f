package com.phillippitts.mathscrap;

import com.phillippitts.mathscrap.domain.ImageAnalysis;
import com.phillippitts.mathscrap.service.ocr.BackendSelector;
import com.phillippitts.mathscrap.service.orchestration.MathPipelineService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        // no recognizer runtimes in tests; the cascade degrades to the rule-based tier
        "ocr.pix2tex.binary-path=/nonexistent/pix2tex",
        "ocr.easyocr.binary-path=/nonexistent/easyocr",
        "ocr.paddleocr.binary-path=/nonexistent/paddleocr",
        "ocr.tesseract.data-path=/nonexistent/tessdata"
    }
)
class MathScrapApplicationTests {

    @Autowired
    private BackendSelector selector;

    @Autowired
    private MathPipelineService pipeline;

    @TempDir
    Path tempDir;

    @Test
    void contextLoads() {
        assertThat(selector.fallbackOnly()).isTrue();
        assertThat(selector.selected().name()).isEqualTo("fallback");
    }

    @Test
    void pipelineRunsThroughWiredExecutors() throws IOException {
        BufferedImage img = new BufferedImage(80, 80, BufferedImage.TYPE_INT_RGB);
        Path file = tempDir.resolve("integral.png");
        ImageIO.write(img, "png", file.toFile());

        ImageAnalysis analysis = pipeline.processImageAsync("job-it", file).join();

        assertThat(analysis.error()).isNull();
        assertThat(analysis.recognition().source()).isEqualTo("fallback_ocr");
        assertThat(analysis.recognition().text())
                .isEqualTo("integral from 0 to 1 of x squared dx equals one third");
    }
}

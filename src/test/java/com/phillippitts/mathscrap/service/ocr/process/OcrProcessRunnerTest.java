package com.phillippitts.mathscrap.service.ocr.process;

import com.phillippitts.mathscrap.config.ocr.Pix2TexConfig;
import com.phillippitts.mathscrap.domain.FailureKind;
import com.phillippitts.mathscrap.exception.RecognitionException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.mathscrap.service.ocr.process.OcrProcessTestDoubles.FailingProcessFactory;
import static com.phillippitts.mathscrap.service.ocr.process.OcrProcessTestDoubles.ProcessBehavior;
import static com.phillippitts.mathscrap.service.ocr.process.OcrProcessTestDoubles.StubProcessFactory;
import static com.phillippitts.mathscrap.service.ocr.process.OcrProcessTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OcrProcessRunnerTest {

    private static final List<String> COMMAND = List.of("/opt/ocr/pix2tex", "/tmp/formula.png");

    @Test
    void successReturnsStdout() {
        // Arrange
        TestProcess tp = new TestProcess(new ProcessBehavior("formula.png: x^{2}", "", 0, 0));
        StubProcessFactory factory = new StubProcessFactory(tp);
        OcrProcessRunner runner = new OcrProcessRunner(factory);
        Pix2TexConfig cfg = new Pix2TexConfig("/opt/ocr/pix2tex", 2, 65536);

        // Act
        String out = runner.run(COMMAND, Path.of("/tmp"), cfg, "pix2tex");

        // Assert
        assertThat(out).isEqualTo("formula.png: x^{2}");
        assertThat(factory.commands).containsExactly(COMMAND);
    }

    @Test
    void nonZeroExitIsRuntimeErrorWithStderrSnippet() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "CUDA not found", 3, 0));
        OcrProcessRunner runner = new OcrProcessRunner(new StubProcessFactory(tp));
        Pix2TexConfig cfg = new Pix2TexConfig("/opt/ocr/pix2tex", 2, 65536);

        assertThatThrownBy(() -> runner.run(COMMAND, null, cfg, "pix2tex"))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Non-zero exit: 3")
                .hasMessageContaining("exitCode=3")
                .hasMessageContaining("stderr=CUDA not found")
                .hasMessageContaining("backend: pix2tex")
                .extracting(e -> ((RecognitionException) e).getKind())
                .isEqualTo(FailureKind.RUNTIME_ERROR);
    }

    @Test
    void timeoutKillsProcessAndReportsTimeout() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, -1));
        OcrProcessRunner runner = new OcrProcessRunner(new StubProcessFactory(tp));
        Pix2TexConfig cfg = new Pix2TexConfig("/opt/ocr/pix2tex", 1, 65536);

        long start = System.nanoTime();
        assertThatThrownBy(() -> runner.run(COMMAND, null, cfg, "pix2tex"))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Timeout after 1s")
                .extracting(e -> ((RecognitionException) e).getKind())
                .isEqualTo(FailureKind.TIMEOUT);
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        assertThat(durationMs).isLessThan(5000);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(tp::wasDestroyCalled);
    }

    @Test
    void missingBinaryIsUnavailable() {
        OcrProcessRunner runner = new OcrProcessRunner(new FailingProcessFactory());
        Pix2TexConfig cfg = new Pix2TexConfig("/opt/ocr/pix2tex", 1, 65536);

        assertThatThrownBy(() -> runner.run(COMMAND, null, cfg, "pix2tex"))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Failed to start process")
                .hasMessageContaining("binaryPath=/opt/ocr/pix2tex")
                .extracting(e -> ((RecognitionException) e).getKind())
                .isEqualTo(FailureKind.UNAVAILABLE);
    }

    @Test
    void stdoutIsCappedAtConfiguredSize() {
        String big = "a".repeat(5000);
        TestProcess tp = new TestProcess(new ProcessBehavior(big, "", 0, 0));
        OcrProcessRunner runner = new OcrProcessRunner(new StubProcessFactory(tp));
        Pix2TexConfig cfg = new Pix2TexConfig("/opt/ocr/pix2tex", 2, 1024);

        String out = runner.run(COMMAND, null, cfg, "pix2tex");

        assertThat(out).hasSize(1024);
    }
}

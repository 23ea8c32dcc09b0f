package com.phillippitts.mathscrap.exception;

import com.phillippitts.mathscrap.domain.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void mathScrapExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        MathScrapException ex = new MathScrapException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }

    @Test
    void unreadableImageExceptionShouldIncludePathAndReason() {
        UnreadableImageException ex = new UnreadableImageException("/data/eq.png", "file is empty");

        assertThat(ex.getMessage()).isEqualTo("Unreadable image (/data/eq.png): file is empty");
        assertThat(ex.getImagePath()).isEqualTo("/data/eq.png");
        assertThat(ex.getReason()).isEqualTo("file is empty");
        assertThat(ex).isInstanceOf(MathScrapException.class);
    }

    @Test
    void recognitionExceptionShouldIncludeBackendAndKind() {
        RecognitionException ex = new RecognitionException("timeout occurred", "easyocr", FailureKind.TIMEOUT);

        assertThat(ex.getMessage()).isEqualTo("timeout occurred (backend: easyocr)");
        assertThat(ex.getBackendName()).isEqualTo("easyocr");
        assertThat(ex.getKind()).isEqualTo(FailureKind.TIMEOUT);
    }

    @Test
    void backendUnavailableIsRecognitionFailureOfKindUnavailable() {
        BackendUnavailableException ex = new BackendUnavailableException("tesseract", "/tessdata/eng.traineddata");

        assertThat(ex).isInstanceOf(RecognitionException.class);
        assertThat(ex.getKind()).isEqualTo(FailureKind.UNAVAILABLE);
        assertThat(ex.getMissingResource()).isEqualTo("/tessdata/eng.traineddata");
        assertThat(ex.getMessage()).contains("/tessdata/eng.traineddata").contains("tesseract");
    }

    @Test
    void expressionParseExceptionShouldIncludePosition() {
        ExpressionParseException ex = new ExpressionParseException("Unexpected ')'", 4);

        assertThat(ex.getMessage()).isEqualTo("Unexpected ')' at position 4");
        assertThat(ex.getPosition()).isEqualTo(4);
    }

    @Test
    void builderAppendsDiagnosticsInOrder() {
        IOException cause = new IOException("pipe closed");

        RecognitionException ex = RecognitionExceptionBuilder.create("Process failed")
                .backend("pix2tex")
                .kind(FailureKind.RUNTIME_ERROR)
                .exitCode(2)
                .durationMs(150)
                .metadata("stderr", "boom")
                .metadata("ignored", null)
                .cause(cause)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Process failed (exitCode=2, durationMs=150, stderr=boom) (backend: pix2tex)");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getKind()).isEqualTo(FailureKind.RUNTIME_ERROR);
    }

    @Test
    void builderWithoutBackendUsesUnknown() {
        RecognitionException ex = RecognitionExceptionBuilder.create("failed").build();

        assertThat(ex.getMessage()).isEqualTo("failed (backend: unknown)");
        assertThat(ex.getBackendName()).isEqualTo("unknown");
    }
}

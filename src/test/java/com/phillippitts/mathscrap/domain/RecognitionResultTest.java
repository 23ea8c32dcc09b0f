package com.phillippitts.mathscrap.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognitionResultTest {

    @Test
    void shouldCreateValidResult() {
        RecognitionResult result = new RecognitionResult("x + 1", 0.9, BackendTag.PIX2TEX, "x plus 1");

        assertThat(result.markup()).isEqualTo("x + 1");
        assertThat(result.confidence()).isEqualTo(0.9);
        assertThat(result.sourceTag()).isEqualTo(BackendTag.PIX2TEX);
        assertThat(result.readableText()).isEqualTo("x plus 1");
    }

    @Test
    void nullReadableTextBecomesEmpty() {
        assertThat(new RecognitionResult("", 0.0, BackendTag.TESSERACT, null).readableText()).isEmpty();
    }

    @Test
    void shouldRejectNullMarkup() {
        assertThatThrownBy(() -> new RecognitionResult(null, 0.5, BackendTag.EASYOCR, ""))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Markup");
    }

    @Test
    void shouldRejectConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> new RecognitionResult("x", 1.1, BackendTag.EASYOCR, ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1.1");
        assertThatThrownBy(() -> new RecognitionResult("x", -0.1, BackendTag.EASYOCR, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withMarkupKeepsSource() {
        RecognitionResult original = new RecognitionResult("\\sqrt{\\sqrt{x}}", 0.9, BackendTag.PADDLEOCR, "t");

        RecognitionResult simplified = original.withMarkup("\\sqrt{x}", 0.4, null);

        assertThat(simplified.sourceTag()).isEqualTo(BackendTag.PADDLEOCR);
        assertThat(simplified.confidence()).isEqualTo(0.4);
        assertThat(simplified.readableText()).isEmpty();
    }

    @Test
    void tagsExposeNamesAndSourceIds() {
        assertThat(BackendTag.TESSERACT.backendName()).isEqualTo("tesseract");
        assertThat(BackendTag.EASYOCR.sourceId()).isEqualTo("easyocr_math");
        assertThat(BackendTag.RULE_FALLBACK.isFallback()).isTrue();
        assertThat(BackendTag.PIX2TEX.compareTo(BackendTag.TESSERACT)).isNegative();
        assertThat(FailureKind.MODEL_LOAD_FAILED.tag()).isEqualTo("model_load_failed");
    }
}

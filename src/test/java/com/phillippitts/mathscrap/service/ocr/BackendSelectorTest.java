package com.phillippitts.mathscrap.service.ocr;

import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.service.ocr.fallback.RuleBasedFallbackBackend;
import com.phillippitts.mathscrap.testutil.FakeOcrBackend;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackendSelectorTest {

    private final RuleBasedFallbackBackend fallback = new RuleBasedFallbackBackend();

    @Test
    void ordersAvailableBackendsByPriorityAndAppendsFallback() {
        // Arrange: injected in arbitrary order
        List<OcrBackend> backends = List.of(
                FakeOcrBackend.succeeding(BackendTag.TESSERACT, "t", 0.7),
                FakeOcrBackend.unavailable(BackendTag.EASYOCR),
                FakeOcrBackend.succeeding(BackendTag.PIX2TEX, "p", 0.9));

        // Act
        BackendSelector selector = new BackendSelector(backends, fallback);

        // Assert
        assertThat(selector.ladder()).extracting(OcrBackend::tag)
                .containsExactly(BackendTag.PIX2TEX, BackendTag.TESSERACT, BackendTag.RULE_FALLBACK);
        assertThat(selector.selected().tag()).isEqualTo(BackendTag.PIX2TEX);
        assertThat(selector.fallbackOnly()).isFalse();
    }

    @Test
    void fallbackOnlyWhenNothingProbes() {
        BackendSelector selector = new BackendSelector(
                List.of(FakeOcrBackend.unavailable(BackendTag.PIX2TEX), FakeOcrBackend.unavailable(BackendTag.PADDLEOCR)),
                fallback);

        assertThat(selector.ladder()).containsExactly(fallback);
        assertThat(selector.fallbackOnly()).isTrue();
    }

    @Test
    void fallbackInjectedAsBackendIsNotDuplicated() {
        BackendSelector selector = new BackendSelector(List.of(fallback), fallback);

        assertThat(selector.ladder()).hasSize(1);
    }

    @Test
    void probesOnceAndCachesLadder() {
        OcrBackend backend = mock(OcrBackend.class);
        when(backend.tag()).thenReturn(BackendTag.EASYOCR);
        when(backend.probe()).thenReturn(true);
        BackendSelector selector = new BackendSelector(List.of(backend), fallback);

        selector.ladder();
        selector.ladder();
        selector.selected();

        verify(backend, times(1)).probe();
    }

    @Test
    void probeThatThrowsCountsAsUnavailable() {
        OcrBackend backend = mock(OcrBackend.class);
        when(backend.tag()).thenReturn(BackendTag.PIX2TEX);
        when(backend.name()).thenReturn("pix2tex");
        when(backend.probe()).thenThrow(new IllegalStateException("boom"));
        BackendSelector selector = new BackendSelector(List.of(backend), fallback);

        assertThat(selector.fallbackOnly()).isTrue();
    }
}

package com.phillippitts.mathscrap.service.ocr;

import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.service.ocr.fallback.RuleBasedFallbackBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Decides which recognition backends this process may use.
 *
 * <p><b>Selection Algorithm:</b>
 * <ol>
 *   <li>Order the neural backends by {@link BackendTag} priority (most math-specialized first)</li>
 *   <li>Probe each once; keep those whose runtime is present</li>
 *   <li>Append the rule-based fallback, which is always available</li>
 * </ol>
 *
 * <p>The resulting ladder is computed on first use and cached for the process lifetime;
 * requests never re-probe. Its head is the selected backend; when a tier fails the cascade
 * continues with the next rung.
 *
 * <p><b>Thread Safety:</b> the ladder is computed under a lock and immutable afterwards.
 *
 * @since 1.0
 */
@Component
public class BackendSelector {

    private static final Logger LOG = LogManager.getLogger(BackendSelector.class);

    private final List<OcrBackend> neuralBackends;
    private final RuleBasedFallbackBackend fallback;

    private List<OcrBackend> ladder;

    public BackendSelector(List<OcrBackend> backends, RuleBasedFallbackBackend fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        List<OcrBackend> neural = new ArrayList<>();
        for (OcrBackend backend : Objects.requireNonNull(backends, "backends")) {
            if (!backend.tag().isFallback()) {
                neural.add(backend);
            }
        }
        neural.sort(Comparator.comparing(OcrBackend::tag));
        this.neuralBackends = List.copyOf(neural);
    }

    /**
     * Usable backends in cascade order; the fallback is always the last element.
     */
    public synchronized List<OcrBackend> ladder() {
        if (ladder == null) {
            List<OcrBackend> usable = new ArrayList<>();
            for (OcrBackend backend : neuralBackends) {
                if (probeQuietly(backend)) {
                    usable.add(backend);
                } else {
                    LOG.info("Recognition backend '{}' not available", backend.name());
                }
            }
            usable.add(fallback);
            ladder = List.copyOf(usable);
            LOG.info("Selected recognition backend '{}' (tiers: {})", ladder.get(0).name(),
                    ladder.stream().map(OcrBackend::name).toList());
        }
        return ladder;
    }

    /** Head of the ladder. */
    public OcrBackend selected() {
        return ladder().get(0);
    }

    /** True when no neural backend survived probing. */
    public boolean fallbackOnly() {
        return selected().tag().isFallback();
    }

    public RuleBasedFallbackBackend fallback() {
        return fallback;
    }

    private static boolean probeQuietly(OcrBackend backend) {
        try {
            return backend.probe();
        } catch (RuntimeException e) {
            LOG.warn("Probe of '{}' failed: {}", backend.name(), e.toString());
            return false;
        }
    }
}

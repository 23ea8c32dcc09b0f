package com.phillippitts.mathscrap.service.health;

import com.phillippitts.mathscrap.service.ocr.AbstractOcrBackend;
import com.phillippitts.mathscrap.service.ocr.BackendSelector;
import com.phillippitts.mathscrap.service.ocr.OcrBackend;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the recognition backend ladder.
 *
 * <ul>
 *   <li>UP: a neural backend is selected</li>
 *   <li>DEGRADED: only the rule-based fallback is available</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class OcrBackendHealthIndicator implements HealthIndicator {

    private final BackendSelector selector;

    public OcrBackendHealthIndicator(BackendSelector selector) {
        this.selector = selector;
    }

    @Override
    public Health health() {
        Map<String, String> tiers = new LinkedHashMap<>();
        for (OcrBackend backend : selector.ladder()) {
            tiers.put(backend.name(), backendStatus(backend));
        }
        Health.Builder builder = selector.fallbackOnly()
                ? new Health.Builder().status("DEGRADED").withDetail("status", "Rule-based fallback only")
                : new Health.Builder().up().withDetail("status", "Neural backend available");
        return builder
                .withDetail("selected", selector.selected().name())
                .withDetail("tiers", tiers)
                .build();
    }

    private static String backendStatus(OcrBackend backend) {
        if (backend instanceof AbstractOcrBackend base && base.isLoaded()) {
            return "loaded";
        }
        return "available";
    }
}

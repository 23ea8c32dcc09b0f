package com.phillippitts.mathscrap.presentation.controller;

import com.phillippitts.mathscrap.service.ocr.BackendSelector;
import com.phillippitts.mathscrap.service.ocr.OcrBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Liveness endpoint reporting which recognition tiers survived probing.
 *
 * <p>The first call triggers backend probing if no image has been processed yet.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final BackendSelector selector;

    PingController(BackendSelector selector) {
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        List<String> tiers = selector.ladder().stream().map(OcrBackend::name).toList();
        log.debug("Ping: recognition tiers {}", tiers);
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "selectedBackend", tiers.get(0),
                "fallbackOnly", tiers.size() == 1,
                "tiers", tiers,
                "timestamp", Instant.now().toString()
        ));
    }
}

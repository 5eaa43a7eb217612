package com.github.salilvnair.formflow.api.controller;

import com.github.salilvnair.formflow.api.dto.HealthResponse;
import com.github.salilvnair.formflow.config.FormFlowProperties;
import com.github.salilvnair.formflow.engine.extraction.LlmExtractionProvider;
import com.github.salilvnair.formflow.engine.extraction.ProviderHealthTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String MODE_INTELLIGENT = "intelligent";
    static final String MODE_FALLBACK = "fallback";

    private final LlmExtractionProvider llmExtractionProvider;
    private final ProviderHealthTracker healthTracker;
    private final FormFlowProperties properties;

    @GetMapping("/health")
    public HealthResponse health() {
        HealthResponse res = new HealthResponse();
        res.setStatus("ok");
        res.setMode(mode());
        res.setVersion(properties.getVersion());
        return res;
    }

    /**
     * Same as {@link #health()} plus the configured provider and the last failure, if any.
     */
    @GetMapping("/health/ai")
    public HealthResponse aiHealth() {
        HealthResponse res = health();
        res.setProvider(llmExtractionProvider.name());
        ProviderHealthTracker.Outcome last = healthTracker.lastOutcome();
        if (last != null && !last.success() && last.errorCode() != null) {
            res.setLastError(last.errorCode().name());
        }
        return res;
    }

    String mode() {
        return llmExtractionProvider.isAvailable() && healthTracker.isLastCallSuccessful()
                ? MODE_INTELLIGENT
                : MODE_FALLBACK;
    }
}

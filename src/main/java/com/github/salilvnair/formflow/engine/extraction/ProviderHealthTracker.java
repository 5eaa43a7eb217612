package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers how the last intelligent extraction call went, for the health endpoints.
 */
@Component
public class ProviderHealthTracker {

    public record Outcome(boolean success, FormFlowErrorCode errorCode, String message, Instant at) {
    }

    private final AtomicReference<Outcome> lastOutcome = new AtomicReference<>();

    public void recordSuccess() {
        lastOutcome.set(new Outcome(true, null, null, Instant.now()));
    }

    public void recordFailure(FormFlowErrorCode errorCode, String message) {
        lastOutcome.set(new Outcome(false, errorCode, message, Instant.now()));
    }

    /** {@code true} until a call fails, and again after the next successful call. */
    public boolean isLastCallSuccessful() {
        Outcome outcome = lastOutcome.get();
        return outcome == null || outcome.success();
    }

    public Outcome lastOutcome() {
        return lastOutcome.get();
    }
}

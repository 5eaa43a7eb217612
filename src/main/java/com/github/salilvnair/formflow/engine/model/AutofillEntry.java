package com.github.salilvnair.formflow.engine.model;

import java.time.OffsetDateTime;

public record AutofillEntry(
        String value,
        String label,
        double confidence,
        int usageCount,
        OffsetDateTime lastUsedAt
) {
}

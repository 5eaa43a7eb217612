package com.github.salilvnair.formflow.engine.model;

import java.util.List;

public record ExtractedEntity(
        String field,
        String value,
        double confidence,
        List<String> issues
) {
    public ExtractedEntity {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public ExtractedEntity withConfidence(double adjusted) {
        return new ExtractedEntity(field, value, adjusted, issues);
    }
}

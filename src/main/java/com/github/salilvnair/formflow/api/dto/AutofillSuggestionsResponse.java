package com.github.salilvnair.formflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.salilvnair.formflow.engine.model.AutofillEntry;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AutofillSuggestionsResponse {

    private boolean success;
    private List<Suggestion> suggestions;

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Suggestion(String value, String label, double confidence, int usageCount) {
        public static Suggestion from(AutofillEntry entry) {
            return new Suggestion(entry.value(), entry.label(), entry.confidence(), entry.usageCount());
        }
    }
}

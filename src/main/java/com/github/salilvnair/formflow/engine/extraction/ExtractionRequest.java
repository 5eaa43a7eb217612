package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.QaHistoryEntry;

import java.util.List;
import java.util.Map;

public record ExtractionRequest(
        String transcript,
        FieldDescriptor targetField,
        List<FieldDescriptor> remainingFields,
        Map<String, String> formContext,
        List<QaHistoryEntry> qaHistory,
        Double asrConfidence
) {
    public ExtractionRequest {
        remainingFields = remainingFields == null ? List.of() : List.copyOf(remainingFields);
        formContext = formContext == null ? Map.of() : Map.copyOf(formContext);
        qaHistory = qaHistory == null ? List.of() : List.copyOf(qaHistory);
    }
}

package com.github.salilvnair.formflow.engine.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.model.ExtractedEntity;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.QaHistoryEntry;
import com.github.salilvnair.formflow.llm.core.LlmClient;
import com.github.salilvnair.formflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.*;

@Slf4j
@Component
@RequiredArgsConstructor
public class LlmExtractionProvider implements ExtractionProvider {

    static final int MAX_QA_CONTEXT = 10;

    private static final String HINT = """
            You fill web forms from spoken answers.
            The user was asked about target_field. Extract the value they gave for it.
            If the utterance clearly answers two or more of remaining_fields, return kind "batch"
            with one entity per field. Otherwise return kind "single" for target_field.
            Confidence is 0.0 to 1.0 and must drop when the transcript is garbled or ambiguous.
            Put format problems in issues and likely corrections in suggestions.
            Return JSON only.
            """;

    private static final String SCHEMA = """
            {
              "type":"object",
              "required":["kind"],
              "properties":{
                "kind":{"type":"string","enum":["single","batch"]},
                "value":{"type":"string"},
                "confidence":{"type":"number"},
                "issues":{"type":"array","items":{"type":"string"}},
                "suggestions":{"type":"array","items":{"type":"string"}},
                "detected_language":{"type":"string"},
                "entities":{
                  "type":"array",
                  "items":{
                    "type":"object",
                    "required":["field","value","confidence"],
                    "properties":{
                      "field":{"type":"string"},
                      "value":{"type":"string"},
                      "confidence":{"type":"number"},
                      "issues":{"type":"array","items":{"type":"string"}}
                    }
                  }
                }
              }
            }
            """;

    private final ObjectProvider<LlmClient> llmClientProvider;

    @Override
    public boolean isAvailable() {
        return llmClientProvider.getIfAvailable() != null;
    }

    @Override
    public String name() {
        LlmClient client = llmClientProvider.getIfAvailable();
        return client == null ? "none" : client.providerName();
    }

    @Override
    public ExtractionResult extract(ExtractionRequest request) {
        LlmClient llm = llmClientProvider.getIfAvailable();
        if (llm == null) {
            throw new FormFlowException(FormFlowErrorCode.EXTRACTION_PROVIDER_UNAVAILABLE, "No LlmClient bean is configured");
        }
        String raw;
        try {
            raw = llm.generateJson(HINT, SCHEMA, JsonUtil.toJson(context(request)));
        } catch (FormFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FormFlowException(
                    FormFlowErrorCode.EXTRACTION_PROVIDER_UNAVAILABLE,
                    "LLM call failed: " + e.getMessage(),
                    e
            );
        }
        return parse(raw, request);
    }

    ExtractionResult parse(String raw, ExtractionRequest request) {
        JsonNode node = JsonUtil.parseOrNull(raw);
        if (node == null || !node.isObject()) {
            throw new FormFlowException(FormFlowErrorCode.EXTRACTION_INVALID_RESPONSE)
                    .withMetaData(Map.of("raw", String.valueOf(raw)));
        }
        Set<String> known = new HashSet<>();
        for (FieldDescriptor field : request.remainingFields()) {
            known.add(field.getName());
        }
        String target = request.targetField().getName();
        known.add(target);

        Map<String, ExtractedEntity> entities = new LinkedHashMap<>();
        for (JsonNode entity : node.path("entities")) {
            String field = JsonUtil.text(entity, "field");
            String value = JsonUtil.text(entity, "value");
            if (field == null || value == null || !known.contains(field)) {
                continue;
            }
            entities.putIfAbsent(field, new ExtractedEntity(
                    field, value, confidence(entity), strings(entity.path("issues"))));
        }
        if (entities.size() >= 2) {
            return new ExtractionResult.Batch(new ArrayList<>(entities.values()));
        }

        String value = JsonUtil.text(node, "value");
        double confidence = confidence(node);
        List<String> issues = strings(node.path("issues"));
        if (value == null && entities.containsKey(target)) {
            ExtractedEntity only = entities.get(target);
            value = only.value();
            confidence = only.confidence();
            issues = only.issues();
        }
        if (value == null) {
            throw new FormFlowException(FormFlowErrorCode.EXTRACTION_INVALID_RESPONSE, "LLM response carried no value for " + target);
        }
        return new ExtractionResult.Single(
                target,
                value,
                confidence,
                issues,
                strings(node.path("suggestions")),
                JsonUtil.text(node, "detected_language")
        );
    }

    private Map<String, Object> context(ExtractionRequest request) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("transcript", request.transcript());
        context.put("target_field", describe(request.targetField()));
        List<Map<String, Object>> remaining = new ArrayList<>();
        for (FieldDescriptor field : request.remainingFields()) {
            remaining.add(describe(field));
        }
        context.put("remaining_fields", remaining);
        context.put("form_context", request.formContext());
        List<QaHistoryEntry> history = request.qaHistory();
        context.put("qa_history", history.subList(Math.max(0, history.size() - MAX_QA_CONTEXT), history.size()));
        return context;
    }

    private static Map<String, Object> describe(FieldDescriptor field) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", field.getName());
        out.put("label", field.displayLabel());
        out.put("type", field.normalizedType());
        if (field.hasOptions()) {
            out.put("options", field.getOptions());
        }
        if (field.getValidationPattern() != null) {
            out.put("validation_pattern", field.getValidationPattern());
        }
        return out;
    }

    private static double confidence(JsonNode node) {
        double value = node.path("confidence").asDouble(0.5d);
        return Math.max(0.0d, Math.min(1.0d, value));
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode item : array) {
                if (!item.isNull() && !item.asText().isBlank()) {
                    out.add(item.asText());
                }
            }
        }
        return out;
    }
}

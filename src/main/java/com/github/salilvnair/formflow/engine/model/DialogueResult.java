package com.github.salilvnair.formflow.engine.model;

import java.util.List;
import java.util.Map;

public record DialogueResult(
        String sessionId,
        String response,
        Map<String, String> extractedValues,
        Map<String, Double> confidenceScores,
        boolean needsConfirmation,
        int remainingFieldsCount,
        boolean complete,
        List<String> nextQuestions,
        List<String> suggestions,
        List<String> issues,
        String activeField,
        DialogueState state,
        String detectedLanguage
) {}

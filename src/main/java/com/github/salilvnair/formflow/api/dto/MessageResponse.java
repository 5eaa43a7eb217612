package com.github.salilvnair.formflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageResponse {

    private String sessionId;
    private String response;
    private Map<String, String> extractedValues;
    private Map<String, Double> confidenceScores;
    private boolean needsConfirmation;
    private int remainingFieldsCount;
    @JsonProperty("is_complete")
    private boolean complete;
    private List<String> nextQuestions;
    private List<String> suggestions;
    private List<String> issues;
    private String activeField;
    private String state;
    private String detectedLanguage;

    public static MessageResponse from(DialogueResult result) {
        MessageResponse res = new MessageResponse();
        res.setSessionId(result.sessionId());
        res.setResponse(result.response());
        res.setExtractedValues(result.extractedValues());
        res.setConfidenceScores(result.confidenceScores());
        res.setNeedsConfirmation(result.needsConfirmation());
        res.setRemainingFieldsCount(result.remainingFieldsCount());
        res.setComplete(result.complete());
        res.setNextQuestions(result.nextQuestions());
        res.setSuggestions(result.suggestions());
        res.setIssues(result.issues());
        res.setActiveField(result.activeField());
        res.setState(result.state() == null ? null : result.state().name());
        res.setDetectedLanguage(result.detectedLanguage());
        return res;
    }
}

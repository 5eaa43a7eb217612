package com.github.salilvnair.formflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageRequest {
    private String sessionId;
    private String message;
    /** confirm, select_suggestion or reject */
    private String action;
    private String value;
    private Double asrConfidence;
}

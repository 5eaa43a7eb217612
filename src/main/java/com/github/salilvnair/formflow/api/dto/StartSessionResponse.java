package com.github.salilvnair.formflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.salilvnair.formflow.engine.model.SessionStart;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StartSessionResponse {

    private String sessionId;
    private String greeting;
    private List<String> nextQuestions;
    private int remainingFieldsCount;

    public static StartSessionResponse from(SessionStart start) {
        StartSessionResponse res = new StartSessionResponse();
        res.setSessionId(start.sessionId());
        res.setGreeting(start.greeting());
        res.setNextQuestions(start.nextQuestions());
        res.setRemainingFieldsCount(start.remainingFieldsCount());
        return res;
    }
}

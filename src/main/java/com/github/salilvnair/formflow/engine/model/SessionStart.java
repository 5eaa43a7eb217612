package com.github.salilvnair.formflow.engine.model;

import java.util.List;

public record SessionStart(
        String sessionId,
        String greeting,
        List<String> nextQuestions,
        int remainingFieldsCount
) {}

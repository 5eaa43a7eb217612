package com.github.salilvnair.formflow.audit;

import com.github.salilvnair.formflow.util.JsonUtil;

import java.util.Map;

public interface AuditService {
    void audit(String stage, String sessionId, String payloadJson);

    default void audit(DialogueAuditStage stage, String sessionId, String payloadJson) {
        audit(stage.value(), sessionId, payloadJson);
    }

    default void audit(String stage, String sessionId, Map<String, ?> payload) {
        audit(stage, sessionId, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }

    default void audit(DialogueAuditStage stage, String sessionId, Map<String, ?> payload) {
        audit(stage.value(), sessionId, payload);
    }
}

package com.github.salilvnair.formflow.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class FormFlowException extends RuntimeException {

    private final FormFlowErrorCode code;
    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public FormFlowException(FormFlowErrorCode code) {
        super(code.defaultMessage());
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FormFlowException(FormFlowErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FormFlowException(FormFlowErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FormFlowException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public int httpStatus() {
        return code.httpStatus();
    }

    public static FormFlowException sessionNotFound(String sessionId) {
        return new FormFlowException(FormFlowErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId)
                .withMetaData(Map.of("sessionId", String.valueOf(sessionId)));
    }

    public static FormFlowException busy(String sessionId) {
        return new FormFlowException(FormFlowErrorCode.SESSION_BUSY,
                "Session " + sessionId + " is already processing a message")
                .withMetaData(Map.of("sessionId", String.valueOf(sessionId)));
    }

    public static FormFlowException malformed(String message) {
        return new FormFlowException(FormFlowErrorCode.MALFORMED_REQUEST, message);
    }
}

package com.github.salilvnair.formflow.engine.exception;

public enum FormFlowErrorCode {

    // =========================
    // Session errors
    // =========================
    SESSION_NOT_FOUND(
            "Session not found",
            false,
            404
    ),

    SESSION_BUSY(
            "Session is processing another message",
            true,
            409
    ),

    // =========================
    // Request errors
    // =========================
    MALFORMED_REQUEST(
            "Malformed request",
            false,
            400
    ),

    // =========================
    // Extraction provider errors (recovered by the heuristic extractor)
    // =========================
    EXTRACTION_PROVIDER_UNAVAILABLE(
            "Extraction provider is unavailable",
            true,
            503
    ),

    EXTRACTION_TIMEOUT(
            "Extraction provider timed out",
            true,
            504
    ),

    EXTRACTION_INVALID_RESPONSE(
            "Extraction provider returned an invalid response",
            true,
            502
    ),

    // =========================
    // Engine / pipeline errors
    // =========================
    PIPELINE_NO_FINAL_RESULT(
            "Pipeline completed without producing final result",
            false,
            500
    ),

    DUPLICATE_ENGINE_STEP(
            "Duplicate EngineStep bean detected",
            false,
            500
    ),

    MISSING_TERMINAL_STEP(
            "Missing required TerminalStep",
            false,
            500
    ),

    MISSING_DEPENDENT_STEP(
            "EngineStep dependency is missing",
            false,
            500
    ),

    MISSING_DAG_CYCLE(
            "EngineStep DAG cycle or unsatisfied constraints",
            false,
            500
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal engine error",
            false,
            500
    );

    private final String defaultMessage;
    private final boolean recoverable;
    private final int httpStatus;

    FormFlowErrorCode(String defaultMessage, boolean recoverable, int httpStatus) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
        this.httpStatus = httpStatus;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }

    public int httpStatus() {
        return httpStatus;
    }
}

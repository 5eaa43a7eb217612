package com.github.salilvnair.formflow.audit;

public enum DialogueAuditStage {
    SESSION_STARTED,
    USER_INPUT,
    STEP_ERROR,
    COMMAND_DETECTED,
    EXTRACTION_PROVIDER_FAILED,
    EXTRACTION_FALLBACK,
    VALUE_COMMITTED,
    VALUE_PENDING_CONFIRMATION,
    VALUE_NEEDS_CLARIFICATION,
    PENDING_REJECTED,
    FIELD_SKIPPED,
    COMMIT_UNDONE,
    FORM_COMPLETE,
    SESSION_DELETED,
    SESSION_REAPED;

    public String value() {
        return name();
    }
}

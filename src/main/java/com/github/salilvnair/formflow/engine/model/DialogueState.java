package com.github.salilvnair.formflow.engine.model;

public enum DialogueState {
    AWAITING_INPUT,
    PROCESSING,
    AUTO_ADVANCED,
    AWAITING_CONFIRMATION,
    AWAITING_CLARIFICATION,
    COMPLETE,
    TERMINATED;

    public boolean acceptsInput() {
        return this != PROCESSING && this != TERMINATED;
    }
}

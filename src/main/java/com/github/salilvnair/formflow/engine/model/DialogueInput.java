package com.github.salilvnair.formflow.engine.model;

/**
 * One client message: a finalized transcript, an explicit action, or both.
 */
public record DialogueInput(
        String message,
        TurnAction action,
        String value,
        Double asrConfidence
) {
    public static DialogueInput text(String message) {
        return new DialogueInput(message, null, null, null);
    }

    public boolean hasMessage() {
        return message != null && !message.isBlank();
    }
}

package com.github.salilvnair.formflow.engine.model;

import java.util.Locale;

/**
 * Explicit client actions that resolve a pending confirmation or clarification.
 */
public enum TurnAction {
    CONFIRM,
    SELECT_SUGGESTION,
    REJECT;

    public static TurnAction from(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (TurnAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        if ("SELECT".equals(normalized) || "SUGGESTION".equals(normalized)) {
            return SELECT_SUGGESTION;
        }
        return null;
    }
}

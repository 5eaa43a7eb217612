package com.github.salilvnair.formflow.engine.model;

public record QaHistoryEntry(String question, String answer) {
}

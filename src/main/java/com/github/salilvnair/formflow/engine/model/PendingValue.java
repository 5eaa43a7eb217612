package com.github.salilvnair.formflow.engine.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PendingValue {
    private String field;             // field the value belongs to
    private String value;             // what was heard
    private double confidence;
    private Disposition disposition;  // CONFIRM or CLARIFY
    private List<String> suggestions;
    private String transcript;        // original utterance
}

package com.github.salilvnair.formflow.engine.session;

import com.github.salilvnair.formflow.engine.model.DialogueInput;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working state of one message as it moves through the engine steps.
 */
@Getter
@Setter
public class DialogueTurn {

    private final FormSession session;
    private final DialogueInput input;
    private final DialogueState previousState;
    private final FieldDescriptor targetField;

    private ExtractionResult extraction;
    private boolean handled;
    private boolean askNext;
    private boolean needsConfirmation;
    private DialogueState outcomeState;
    private String detectedLanguage;
    private DialogueResult finalResult;

    private final StringBuilder response = new StringBuilder();
    private final List<String> suggestions = new ArrayList<>();
    private final List<String> issues = new ArrayList<>();
    private final List<String> committedFields = new ArrayList<>();
    private final Map<String, Long> stepTimingsMs = new LinkedHashMap<>();

    public DialogueTurn(FormSession session, DialogueInput input, DialogueState previousState) {
        this.session = session;
        this.input = input;
        this.previousState = previousState;
        this.targetField = session.activeField();
    }

    public String getSessionId() {
        return session.getId();
    }

    public String transcript() {
        return input.message() == null ? "" : input.message().trim();
    }

    public DialogueTurn say(String sentence) {
        if (sentence == null || sentence.isBlank()) {
            return this;
        }
        if (response.length() > 0) {
            response.append(' ');
        }
        response.append(sentence.trim());
        return this;
    }

    /** Marks the input as fully handled, so later steps only build the response. */
    public void markHandled() {
        this.handled = true;
    }
}

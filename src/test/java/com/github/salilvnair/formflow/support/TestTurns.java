package com.github.salilvnair.formflow.support;

import com.github.salilvnair.formflow.engine.model.DialogueInput;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import com.github.salilvnair.formflow.engine.session.InMemorySessionStore;

import java.util.List;
import java.util.Map;

public final class TestTurns {

    private TestTurns() {
    }

    public static DialogueTurn newTurn(String message) {
        FormSession session = new InMemorySessionStore().create(TestForms.contactForm(), TestConstants.FORM_URL, null);
        return new DialogueTurn(session, DialogueInput.text(message), DialogueState.AWAITING_INPUT);
    }

    public static DialogueResult result(String sessionId, String response) {
        return new DialogueResult(sessionId, response, Map.of(), Map.of(), false, 3, false,
                List.of(), List.of(), List.of(), null, DialogueState.AWAITING_INPUT, null);
    }
}

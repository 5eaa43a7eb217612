package com.github.salilvnair.formflow.engine.handler;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.AuditValueMasker;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.engine.clarification.ClarificationResolver;
import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.model.Disposition;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.PendingValue;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SingleTurnHandler {

    private final ClarificationResolver clarificationResolver;
    private final FieldCommitter fieldCommitter;
    private final AuditService audit;

    public void handle(DialogueTurn turn, ExtractionResult.Single single) {
        FormSession session = turn.getSession();
        FieldDescriptor field = turn.getTargetField();
        if (single.detectedLanguage() != null) {
            turn.setDetectedLanguage(single.detectedLanguage());
        }
        turn.getIssues().addAll(single.issues());

        String value = single.value() == null ? "" : single.value().trim();
        double confidence = value.isEmpty() ? 0.0d : single.confidence();
        Disposition disposition = clarificationResolver.classify(confidence);

        switch (disposition) {
            case AUTO_ACCEPT -> {
                fieldCommitter.commit(turn, field, value, confidence, "extraction");
                turn.say("Got it.");
                turn.setAskNext(true);
            }
            case CONFIRM -> {
                List<String> suggestions = clarificationResolver.rankSuggestions(field, value, single.suggestions());
                session.setPending(new PendingValue(field.getName(), value, confidence, Disposition.CONFIRM, suggestions, turn.transcript()));
                turn.getSuggestions().addAll(suggestions);
                turn.setNeedsConfirmation(true);
                turn.setOutcomeState(DialogueState.AWAITING_CONFIRMATION);
                String prompt = clarificationResolver.confirmationPrompt(field, value, confidence);
                turn.say(prompt);
                session.setLastPrompt(prompt);
                audit.audit(DialogueAuditStage.VALUE_PENDING_CONFIRMATION, session.getId(), payload(field, value, confidence, suggestions));
            }
            case CLARIFY -> {
                int attempt = session.incrementClarificationAttempts(field.getName());
                List<String> suggestions = clarificationResolver.rankSuggestions(field, value, single.suggestions());
                session.setPending(value.isEmpty()
                        ? null
                        : new PendingValue(field.getName(), value, confidence, Disposition.CLARIFY, suggestions, turn.transcript()));
                turn.getSuggestions().addAll(suggestions);
                turn.setNeedsConfirmation(true);
                turn.setOutcomeState(DialogueState.AWAITING_CLARIFICATION);
                String question = clarificationResolver.clarificationQuestion(field, turn.transcript(), attempt, suggestions);
                turn.say(question);
                session.setLastPrompt(question);
                Map<String, Object> payload = payload(field, value, confidence, suggestions);
                payload.put("attempt", attempt);
                audit.audit(DialogueAuditStage.VALUE_NEEDS_CLARIFICATION, session.getId(), payload);
            }
        }
    }

    private static Map<String, Object> payload(FieldDescriptor field, String value, double confidence, List<String> suggestions) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field.getName());
        payload.put("value", AuditValueMasker.mask(field, value));
        payload.put("confidence", confidence);
        payload.put("suggestionCount", suggestions.size());
        return payload;
    }
}

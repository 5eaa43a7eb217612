package com.github.salilvnair.formflow.engine.handler;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.AuditValueMasker;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.PendingValue;
import com.github.salilvnair.formflow.engine.scheduler.QuestionScheduler;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import com.github.salilvnair.formflow.engine.session.SessionStore;
import com.github.salilvnair.formflow.service.AsyncAutofillPersistenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single path for committing a value during a turn: store commit, QA history, audit, and the
 * asynchronous autofill write.
 */
@Component
@RequiredArgsConstructor
public class FieldCommitter {

    private final SessionStore sessionStore;
    private final QuestionScheduler questionScheduler;
    private final AsyncAutofillPersistenceService autofillPersistence;
    private final AuditService audit;

    public void commit(DialogueTurn turn, FieldDescriptor field, String value, double confidence, String source) {
        FormSession session = turn.getSession();
        sessionStore.commit(session.getId(), field.getName(), value, confidence);
        session.recordAnswer(questionScheduler.questionFor(field), AuditValueMasker.mask(field, value));
        PendingValue pending = session.getPending();
        if (pending != null && field.getName().equals(pending.getField())) {
            session.setPending(null);
        }
        turn.getCommittedFields().add(field.getName());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field.getName());
        payload.put("value", AuditValueMasker.mask(field, value));
        payload.put("confidence", confidence);
        payload.put("source", source);
        payload.put("remainingFieldsCount", session.remainingFieldsCount());
        audit.audit(DialogueAuditStage.VALUE_COMMITTED, session.getId(), payload);

        if (session.getUserId() != null && !FieldTypeConstants.PASSWORD.equals(field.normalizedType())) {
            autofillPersistence.recordAsync(session.getUserId(), field.getName(), field.normalizedType(), value, confidence);
        }
    }
}

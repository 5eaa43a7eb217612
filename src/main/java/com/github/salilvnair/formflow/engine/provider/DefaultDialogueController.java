package com.github.salilvnair.formflow.engine.provider;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.engine.core.DialogueController;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.factory.EnginePipelineFactory;
import com.github.salilvnair.formflow.engine.model.DialogueInput;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.SessionSnapshot;
import com.github.salilvnair.formflow.engine.model.SessionStart;
import com.github.salilvnair.formflow.engine.scheduler.QuestionScheduler;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import com.github.salilvnair.formflow.engine.session.SessionLease;
import com.github.salilvnair.formflow.engine.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultDialogueController implements DialogueController {

    private final SessionStore sessionStore;
    private final EnginePipelineFactory pipelineFactory;
    private final QuestionScheduler questionScheduler;
    private final AuditService audit;

    @Override
    public SessionStart startSession(List<FieldDescriptor> formSchema, String formUrl, String userId) {
        if (formSchema == null || formSchema.isEmpty()) {
            throw FormFlowException.malformed("form_schema must contain at least one field");
        }
        FormSession created = sessionStore.create(formSchema, formUrl, userId);
        try (SessionLease lease = sessionStore.acquire(created.getId())) {
            FormSession session = lease.session();
            String greeting = questionScheduler.greeting(session);
            List<String> nextQuestions = questionScheduler.nextQuestions(session);
            FieldDescriptor first = session.activeField();
            session.setLastPrompt(first == null ? greeting : questionScheduler.questionFor(first));
            session.setState(DialogueState.AWAITING_INPUT);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("formUrl", formUrl);
            payload.put("fieldCount", session.getFieldList().size());
            payload.put("userScoped", session.getUserId() != null);
            audit.audit(DialogueAuditStage.SESSION_STARTED, session.getId(), payload);
            log.info("Started session {} for {} with {} fields", session.getId(), formUrl, session.getFieldList().size());
            return new SessionStart(session.getId(), greeting, nextQuestions, session.remainingFieldsCount());
        }
    }

    @Override
    public DialogueResult handleMessage(String sessionId, DialogueInput input) {
        if (input == null || (!input.hasMessage() && input.action() == null)) {
            throw FormFlowException.malformed("message must not be blank");
        }
        try (SessionLease lease = sessionStore.acquire(sessionId)) {
            FormSession session = lease.session();
            DialogueState previous = session.getState();
            session.setState(DialogueState.PROCESSING);
            try {
                session.nextTurn();
                session.touch(Instant.now());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("turn", session.getTurnCount());
                payload.put("action", input.action() == null ? null : input.action().name());
                payload.put("activeField", session.activeField() == null ? null : session.activeField().getName());
                payload.put("asrConfidence", input.asrConfidence());
                audit.audit(DialogueAuditStage.USER_INPUT, sessionId, payload);

                DialogueTurn turn = new DialogueTurn(session, input, previous);
                return pipelineFactory.create().execute(turn);
            } finally {
                if (session.getState() == DialogueState.PROCESSING) {
                    session.setState(previous);
                }
            }
        }
    }

    @Override
    public SessionSnapshot endSession(String sessionId) {
        SessionSnapshot snapshot = sessionStore.delete(sessionId);
        audit.audit(DialogueAuditStage.SESSION_DELETED, sessionId, Map.of("fieldsCollected", snapshot.fieldsCollected()));
        log.info("Ended session {} with {} fields collected", sessionId, snapshot.fieldsCollected());
        return snapshot;
    }
}

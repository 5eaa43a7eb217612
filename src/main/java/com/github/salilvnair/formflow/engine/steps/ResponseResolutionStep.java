package com.github.salilvnair.formflow.engine.steps;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.pipeline.EngineStep;
import com.github.salilvnair.formflow.engine.pipeline.StepResult;
import com.github.salilvnair.formflow.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formflow.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.formflow.engine.scheduler.QuestionScheduler;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settles the dialogue state after a turn, asks the next question when the turn advanced, and
 * builds the result.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@TerminalStep
@MustRunAfter(ExtractionDispatchStep.class)
public class ResponseResolutionStep implements EngineStep {

    static final String COMPLETE_PROMPT = "That's everything - the form is complete.";

    private final QuestionScheduler questionScheduler;
    private final AuditService audit;

    @Override
    public StepResult execute(DialogueTurn turn) {
        FormSession session = turn.getSession();
        boolean complete = questionScheduler.settle(session);

        DialogueState state;
        List<String> nextQuestions;
        if (complete) {
            state = DialogueState.COMPLETE;
            nextQuestions = List.of();
            session.setPending(null);
            if (turn.getPreviousState() != DialogueState.COMPLETE) {
                turn.say(COMPLETE_PROMPT);
                session.setLastPrompt(COMPLETE_PROMPT);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("fieldsCollected", session.getExtractedValues().size());
                payload.put("skipped", List.copyOf(session.getSkippedFields()));
                payload.put("turns", session.getTurnCount());
                audit.audit(DialogueAuditStage.FORM_COMPLETE, session.getId(), payload);
            }
        } else {
            state = turn.getOutcomeState() != null ? turn.getOutcomeState() : DialogueState.AWAITING_INPUT;
            nextQuestions = questionScheduler.nextQuestions(session);
            if (turn.isAskNext() || turn.getResponse().length() == 0) {
                askActiveField(turn, session);
            }
        }
        if (turn.getResponse().length() == 0) {
            turn.say("Okay.");
        }
        session.setState(state);

        if (log.isDebugEnabled()) {
            DialogueState outcome = !turn.getCommittedFields().isEmpty() && turn.isAskNext() && !complete
                    ? DialogueState.AUTO_ADVANCED
                    : state;
            log.debug("Session {} turn {} outcome={} state={} committed={} timings={}",
                    session.getId(), session.getTurnCount(), outcome, state, turn.getCommittedFields(), turn.getStepTimingsMs());
        }

        FieldDescriptor active = complete ? null : session.activeField();
        DialogueResult result = new DialogueResult(
                session.getId(),
                turn.getResponse().toString(),
                new LinkedHashMap<>(session.getExtractedValues()),
                new LinkedHashMap<>(session.getConfidenceScores()),
                turn.isNeedsConfirmation(),
                session.remainingFieldsCount(),
                complete,
                nextQuestions,
                List.copyOf(turn.getSuggestions()),
                List.copyOf(turn.getIssues()),
                active == null ? null : active.getName(),
                state,
                turn.getDetectedLanguage()
        );
        turn.setFinalResult(result);
        return new StepResult.Continue();
    }

    private void askActiveField(DialogueTurn turn, FormSession session) {
        FieldDescriptor active = session.activeField();
        if (active == null) {
            return;
        }
        boolean comingBack = session.getReofferedFields().contains(active.getName())
                && (turn.getTargetField() == null || !active.getName().equals(turn.getTargetField().getName()));
        if (comingBack) {
            turn.say("Let's come back to the " + active.displayLabel().toLowerCase(Locale.ROOT) + " you skipped.");
        }
        String question = questionScheduler.questionFor(active);
        turn.say(question);
        session.setLastPrompt(question);
    }
}

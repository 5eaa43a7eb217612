package com.github.salilvnair.formflow.engine.handler;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.scheduler.QuestionScheduler;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import com.github.salilvnair.formflow.engine.session.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CommandTurnHandler {

    private final SessionStore sessionStore;
    private final QuestionScheduler questionScheduler;
    private final AuditService audit;

    public void handle(DialogueTurn turn, ExtractionResult.Command command) {
        FormSession session = turn.getSession();
        audit.audit(DialogueAuditStage.COMMAND_DETECTED, session.getId(), Map.of("action", command.action().name()));
        switch (command.action()) {
            case SKIP -> skip(turn, session);
            case REPEAT -> repeat(turn, session);
            case BACK -> back(turn, session);
            case STOP -> stop(turn);
        }
    }

    private void skip(DialogueTurn turn, FormSession session) {
        FieldDescriptor active = session.activeField();
        if (active == null) {
            turn.say("There's nothing left to skip.");
            return;
        }
        session.setPending(null);
        questionScheduler.skip(session);
        audit.audit(DialogueAuditStage.FIELD_SKIPPED, session.getId(), Map.of("field", active.getName()));
        turn.say("Okay, skipping " + active.displayLabel().toLowerCase(Locale.ROOT) + ".");
        turn.setAskNext(true);
    }

    /** Re-emits the last prompt verbatim and keeps any pending value. */
    private void repeat(DialogueTurn turn, FormSession session) {
        String prompt = session.getLastPrompt();
        if (prompt == null && session.activeField() != null) {
            prompt = questionScheduler.questionFor(session.activeField());
        }
        turn.say(prompt == null ? "The form is complete." : prompt);
        keepPreviousState(turn);
    }

    private void back(DialogueTurn turn, FormSession session) {
        String last = session.getCommitHistory().peek();
        if (last == null) {
            turn.say("There's nothing to go back to.");
            turn.setAskNext(true);
            return;
        }
        session.setPending(null);
        sessionStore.undoCommit(session.getId(), last);
        FieldDescriptor field = session.field(last);
        audit.audit(DialogueAuditStage.COMMIT_UNDONE, session.getId(), Map.of("field", last));
        turn.say("Okay, let's go back to " + field.displayLabel().toLowerCase(Locale.ROOT) + ".");
        turn.setAskNext(true);
    }

    private void stop(DialogueTurn turn) {
        turn.say("Okay, I've paused. Say anything when you're ready to continue.");
        keepPreviousState(turn);
    }

    private static void keepPreviousState(DialogueTurn turn) {
        DialogueState previous = turn.getPreviousState();
        if (previous == DialogueState.AWAITING_CONFIRMATION || previous == DialogueState.AWAITING_CLARIFICATION) {
            turn.setOutcomeState(previous);
            turn.setNeedsConfirmation(true);
            if (turn.getSession().getPending() != null) {
                turn.getSuggestions().addAll(turn.getSession().getPending().getSuggestions());
            }
        }
    }
}

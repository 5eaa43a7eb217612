package com.github.salilvnair.formflow.engine.steps;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.handler.FieldCommitter;
import com.github.salilvnair.formflow.engine.model.DialogueInput;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.PendingValue;
import com.github.salilvnair.formflow.engine.model.TurnAction;
import com.github.salilvnair.formflow.engine.pipeline.EngineStep;
import com.github.salilvnair.formflow.engine.pipeline.StepResult;
import com.github.salilvnair.formflow.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a value waiting for confirmation or clarification, either from an explicit client
 * action or from a yes/no/suggestion utterance.
 */
@RequiredArgsConstructor
@Component
@MustRunBefore(ExtractionStep.class)
public class PendingResolutionStep implements EngineStep {

    private static final Pattern AFFIRM = Pattern.compile(
            "^(\\s)*(yes|yep|yeah|yup|ok|okay|sure|correct|right|that's right|that is right|exactly|confirm|confirmed|sounds good)(\\s)*(please)?[.!]*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NEGATE = Pattern.compile(
            "^(\\s)*(no|nope|nah|wrong|incorrect|not right|that's wrong|that is wrong|that's not right|no that's wrong)(\\s)*[.!]*$",
            Pattern.CASE_INSENSITIVE);
    private static final List<String> ORDINALS = List.of("first", "second", "third", "fourth", "fifth");
    private static final Pattern ORDINAL_CHOICE = Pattern.compile(
            "^(?:the\\s+)?(first|second|third|fourth|fifth)(?:\\s+one)?$", Pattern.CASE_INSENSITIVE);

    private final FieldCommitter fieldCommitter;
    private final AuditService audit;

    @Override
    public StepResult execute(DialogueTurn turn) {
        DialogueInput input = turn.getInput();
        FormSession session = turn.getSession();
        if (input.action() != null) {
            resolveAction(turn, input.action(), input.value());
            turn.markHandled();
            return new StepResult.Continue();
        }
        PendingValue pending = session.getPending();
        if (pending == null || !input.hasMessage()) {
            return new StepResult.Continue();
        }
        String text = turn.transcript();
        if (AFFIRM.matcher(text).matches()) {
            confirm(turn, pending);
            turn.markHandled();
        } else if (NEGATE.matcher(text).matches()) {
            reject(turn, pending);
            turn.markHandled();
        } else {
            String chosen = echoedSuggestion(text, pending.getSuggestions());
            if (chosen != null) {
                commitChoice(turn, session.field(pending.getField()), chosen);
                turn.markHandled();
            }
        }
        return new StepResult.Continue();
    }

    private void resolveAction(DialogueTurn turn, TurnAction action, String value) {
        FormSession session = turn.getSession();
        PendingValue pending = session.getPending();
        switch (action) {
            case CONFIRM -> {
                if (pending == null) {
                    turn.say("There's nothing waiting for confirmation.");
                    turn.setAskNext(true);
                } else {
                    confirm(turn, pending);
                }
            }
            case SELECT_SUGGESTION -> {
                if (value == null || value.isBlank()) {
                    throw FormFlowException.malformed("select_suggestion requires a value");
                }
                FieldDescriptor field = pending != null ? session.field(pending.getField()) : session.activeField();
                if (field == null) {
                    turn.say("The form is already complete.");
                    return;
                }
                commitChoice(turn, field, value.trim());
            }
            case REJECT -> {
                if (pending == null) {
                    turn.setAskNext(true);
                } else {
                    reject(turn, pending);
                }
            }
        }
    }

    private void confirm(DialogueTurn turn, PendingValue pending) {
        FieldDescriptor field = turn.getSession().field(pending.getField());
        fieldCommitter.commit(turn, field, pending.getValue(), 1.0d, "confirmed");
        turn.say("Great, thanks.");
        turn.setAskNext(true);
    }

    private void commitChoice(DialogueTurn turn, FieldDescriptor field, String value) {
        fieldCommitter.commit(turn, field, value, 1.0d, "selected");
        turn.say("Got it.");
        turn.setAskNext(true);
    }

    private void reject(DialogueTurn turn, PendingValue pending) {
        FormSession session = turn.getSession();
        session.setPending(null);
        audit.audit(DialogueAuditStage.PENDING_REJECTED, session.getId(), Map.of("field", pending.getField()));
        FieldDescriptor field = session.field(pending.getField());
        turn.say("Sorry about that. Let's try " + field.displayLabel().toLowerCase(Locale.ROOT) + " again.");
        turn.setAskNext(true);
    }

    static String echoedSuggestion(String text, List<String> suggestions) {
        if (suggestions == null || suggestions.isEmpty()) {
            return null;
        }
        Matcher ordinal = ORDINAL_CHOICE.matcher(text.trim());
        if (ordinal.matches()) {
            int index = ORDINALS.indexOf(ordinal.group(1).toLowerCase(Locale.ROOT));
            return index < suggestions.size() ? suggestions.get(index) : null;
        }
        String key = comparable(text);
        for (String suggestion : suggestions) {
            if (comparable(suggestion).equals(key)) {
                return suggestion;
            }
        }
        return null;
    }

    private static String comparable(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}@.]", "").replaceAll("\\.$", "");
    }
}

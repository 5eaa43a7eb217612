package com.github.salilvnair.formflow.engine.handler;

import com.github.salilvnair.formflow.engine.clarification.ClarificationResolver;
import com.github.salilvnair.formflow.engine.model.Disposition;
import com.github.salilvnair.formflow.engine.model.ExtractedEntity;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Commits every entity at or above the auto-accept threshold. A weaker value for the field being
 * asked goes through the single-field confirm/clarify path; weaker values for other fields are
 * reported as issues and left for later.
 */
@Component
@RequiredArgsConstructor
public class BatchTurnHandler {

    private final ClarificationResolver clarificationResolver;
    private final FieldCommitter fieldCommitter;
    private final SingleTurnHandler singleTurnHandler;

    public void handle(DialogueTurn turn, ExtractionResult.Batch batch) {
        FormSession session = turn.getSession();
        FieldDescriptor target = turn.getTargetField();
        List<String> committedLabels = new ArrayList<>();
        ExtractedEntity weakTarget = null;

        for (ExtractedEntity entity : batch.entities()) {
            FieldDescriptor field = session.field(entity.field());
            if (field == null || session.isCommitted(field.getName())) {
                continue;
            }
            if (clarificationResolver.classify(entity.confidence()) == Disposition.AUTO_ACCEPT) {
                fieldCommitter.commit(turn, field, entity.value(), entity.confidence(), "batch");
                committedLabels.add(field.displayLabel().toLowerCase(Locale.ROOT));
                for (String issue : entity.issues()) {
                    turn.getIssues().add(field.displayLabel() + ": " + issue);
                }
            } else if (target != null && target.getName().equals(field.getName())) {
                weakTarget = entity;
            } else {
                turn.getIssues().add("Not sure about " + field.displayLabel() + ": heard '" + entity.value() + "'");
                for (String issue : entity.issues()) {
                    turn.getIssues().add(field.displayLabel() + ": " + issue);
                }
            }
        }

        if (!committedLabels.isEmpty()) {
            turn.say("Got your " + joinLabels(committedLabels) + ".");
        } else if (weakTarget == null) {
            turn.say("I couldn't catch those clearly.");
        }
        if (weakTarget != null) {
            singleTurnHandler.handle(turn, new ExtractionResult.Single(
                    weakTarget.field(), weakTarget.value(), weakTarget.confidence(), weakTarget.issues(), List.of(), null));
        } else {
            turn.setAskNext(true);
        }
    }

    static String joinLabels(List<String> labels) {
        if (labels.size() == 1) {
            return labels.get(0);
        }
        return String.join(", ", labels.subList(0, labels.size() - 1)) + " and " + labels.get(labels.size() - 1);
    }
}

package com.github.salilvnair.formflow.engine.steps;

import com.github.salilvnair.formflow.audit.AuditValueMasker;
import com.github.salilvnair.formflow.engine.extraction.ExtractionPipeline;
import com.github.salilvnair.formflow.engine.extraction.ExtractionRequest;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.pipeline.EngineStep;
import com.github.salilvnair.formflow.engine.pipeline.StepResult;
import com.github.salilvnair.formflow.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import com.github.salilvnair.formflow.engine.session.FormSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RequiredArgsConstructor
@Component
@MustRunAfter(PendingResolutionStep.class)
public class ExtractionStep implements EngineStep {

    private final ExtractionPipeline extractionPipeline;

    @Override
    public StepResult execute(DialogueTurn turn) {
        if (turn.isHandled()) {
            return new StepResult.Continue();
        }
        FormSession session = turn.getSession();
        FieldDescriptor target = turn.getTargetField();
        if (target == null) {
            // nothing left to ask, only commands still apply
            Optional<ExtractionResult.Command> command = extractionPipeline.detectCommand(turn.transcript());
            if (command.isPresent()) {
                turn.setExtraction(command.get());
            } else {
                turn.say("The form is already complete. Say 'go back' if you want to change your last answer.");
                turn.markHandled();
            }
            return new StepResult.Continue();
        }
        ExtractionRequest request = new ExtractionRequest(
                turn.transcript(),
                target,
                session.remainingDescriptors(),
                maskedValues(session),
                session.getQaHistory(),
                turn.getInput().asrConfidence()
        );
        turn.setExtraction(extractionPipeline.extract(session.getId(), request));
        return new StepResult.Continue();
    }

    private static Map<String, String> maskedValues(FormSession session) {
        Map<String, String> values = new LinkedHashMap<>();
        session.getExtractedValues().forEach((name, value) -> values.put(name, AuditValueMasker.mask(session.field(name), value)));
        return values;
    }
}

package com.github.salilvnair.formflow.engine.steps;

import com.github.salilvnair.formflow.engine.handler.BatchTurnHandler;
import com.github.salilvnair.formflow.engine.handler.CommandTurnHandler;
import com.github.salilvnair.formflow.engine.handler.SingleTurnHandler;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.pipeline.EngineStep;
import com.github.salilvnair.formflow.engine.pipeline.StepResult;
import com.github.salilvnair.formflow.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
@MustRunAfter(ExtractionStep.class)
public class ExtractionDispatchStep implements EngineStep {

    private final CommandTurnHandler commandTurnHandler;
    private final BatchTurnHandler batchTurnHandler;
    private final SingleTurnHandler singleTurnHandler;

    @Override
    public StepResult execute(DialogueTurn turn) {
        ExtractionResult extraction = turn.getExtraction();
        if (turn.isHandled() || extraction == null) {
            return new StepResult.Continue();
        }
        if (extraction.kind() != ExtractionResult.Kind.COMMAND) {
            // a fresh answer replaces whatever was waiting for confirmation
            turn.getSession().setPending(null);
        }
        switch (extraction.kind()) {
            case COMMAND -> commandTurnHandler.handle(turn, (ExtractionResult.Command) extraction);
            case BATCH -> batchTurnHandler.handle(turn, (ExtractionResult.Batch) extraction);
            case SINGLE -> singleTurnHandler.handle(turn, (ExtractionResult.Single) extraction);
        }
        return new StepResult.Continue();
    }
}

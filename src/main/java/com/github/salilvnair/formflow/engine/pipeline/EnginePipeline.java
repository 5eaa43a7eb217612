package com.github.salilvnair.formflow.engine.pipeline;

import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;

import java.util.List;

public final class EnginePipeline {

    private final List<EngineStep> steps;

    public EnginePipeline(List<EngineStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public DialogueResult execute(DialogueTurn turn) {
        for (EngineStep step : steps) {
            StepResult r = step.execute(turn);
            if (r instanceof StepResult.Stop stop) {
                return stop.result();
            }
        }
        // ResponseResolutionStep must have set finalResult
        if (turn.getFinalResult() == null) {
            throw new FormFlowException(FormFlowErrorCode.PIPELINE_NO_FINAL_RESULT);
        }
        return turn.getFinalResult();
    }

    public List<EngineStep> steps() {
        return steps;
    }
}

package com.github.salilvnair.formflow.engine.pipeline;

import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.session.DialogueTurn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.formflow.support.TestConstants.SAID_JOHN_SMITH;
import static com.github.salilvnair.formflow.support.TestTurns.newTurn;
import static com.github.salilvnair.formflow.support.TestTurns.result;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnginePipelineTest {

    @Test
    void executeReturnsStopResultImmediately() {
        DialogueTurn turn = newTurn(SAID_JOHN_SMITH);
        DialogueResult expected = result(turn.getSessionId(), "stopped");
        EnginePipeline pipeline = new EnginePipeline(List.of(
                t -> new StepResult.Stop(expected),
                t -> {
                    throw new AssertionError("Should not execute next step");
                }
        ));

        DialogueResult actual = pipeline.execute(turn);

        assertEquals(expected, actual);
    }

    @Test
    void executeReturnsFinalTurnResultWhenStepsContinue() {
        DialogueTurn turn = newTurn(SAID_JOHN_SMITH);
        DialogueResult expected = result(turn.getSessionId(), "done");
        turn.setFinalResult(expected);
        EnginePipeline pipeline = new EnginePipeline(List.of(
                ignored -> new StepResult.Continue(),
                ignored -> new StepResult.Continue()
        ));

        DialogueResult actual = pipeline.execute(turn);

        assertEquals(expected, actual);
    }

    @Test
    void executeThrowsWhenNoFinalResultWasProduced() {
        EnginePipeline pipeline = new EnginePipeline(List.of(ignored -> new StepResult.Continue()));

        FormFlowException ex = assertThrows(FormFlowException.class, () -> pipeline.execute(newTurn(SAID_JOHN_SMITH)));

        assertEquals(FormFlowErrorCode.PIPELINE_NO_FINAL_RESULT, ex.getCode());
    }
}

package com.github.salilvnair.formflow.engine.pipeline;

import com.github.salilvnair.formflow.engine.model.DialogueResult;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(DialogueResult result) implements StepResult {}
}

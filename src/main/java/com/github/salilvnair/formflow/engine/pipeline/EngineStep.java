package com.github.salilvnair.formflow.engine.pipeline;

import com.github.salilvnair.formflow.engine.session.DialogueTurn;

public interface EngineStep {
    StepResult execute(DialogueTurn turn);
}

package com.github.salilvnair.formflow.engine.model;

public enum CommandAction {
    SKIP,
    REPEAT,
    BACK,
    STOP
}

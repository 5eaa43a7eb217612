package com.github.salilvnair.formflow.engine.model;

/**
 * Confidence band an extracted value falls into.
 */
public enum Disposition {
    CLARIFY,
    CONFIRM,
    AUTO_ACCEPT
}

package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.model.ExtractionResult;

/**
 * Turns a transcript into field values. Implementations may block on external I/O; the pipeline
 * bounds them with a timeout.
 */
public interface ExtractionProvider {

    ExtractionResult extract(ExtractionRequest request);

    String name();

    default boolean isAvailable() {
        return true;
    }
}

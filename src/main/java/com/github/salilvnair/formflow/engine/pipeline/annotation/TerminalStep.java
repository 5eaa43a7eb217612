package com.github.salilvnair.formflow.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the step that always runs last and produces the turn result. Exactly one is allowed.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TerminalStep {
}

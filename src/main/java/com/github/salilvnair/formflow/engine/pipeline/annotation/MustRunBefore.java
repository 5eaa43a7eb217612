package com.github.salilvnair.formflow.engine.pipeline.annotation;

import com.github.salilvnair.formflow.engine.pipeline.EngineStep;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MustRunBefore {
    Class<? extends EngineStep>[] value();
}

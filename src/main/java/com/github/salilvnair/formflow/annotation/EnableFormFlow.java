package com.github.salilvnair.formflow.annotation;

import com.github.salilvnair.formflow.config.FormFlowAsyncConfiguration;
import com.github.salilvnair.formflow.config.FormFlowAutoConfiguration;
import com.github.salilvnair.formflow.config.FormFlowCacheConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Turns on the FormFlow dialogue engine in a host Spring Boot application: REST endpoints,
 * engine beans, the extraction and autofill thread pools, the idle-session reaper and the
 * Caffeine backed autofill cache.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import({FormFlowAutoConfiguration.class, FormFlowAsyncConfiguration.class, FormFlowCacheConfiguration.class})
public @interface EnableFormFlow {
}

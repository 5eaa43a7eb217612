package com.github.salilvnair.formflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
@EnableScheduling
public class FormFlowAsyncConfiguration {

    public static final String EXTRACTION_EXECUTOR = "formFlowExtractionExecutor";
    public static final String AUTOFILL_EXECUTOR = "formFlowAutofillExecutor";

    @Bean(name = EXTRACTION_EXECUTOR)
    public ThreadPoolTaskExecutor formFlowExtractionExecutor(FormFlowProperties properties) {
        int poolSize = Math.max(1, properties.getExtraction().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize * 4);
        executor.setThreadNamePrefix("ff-extract-");
        // a saturated pool rejects the submit so the caller falls back instead of running the call itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = AUTOFILL_EXECUTOR)
    public ThreadPoolTaskExecutor formFlowAutofillExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("ff-autofill-");
        executor.initialize();
        return executor;
    }
}

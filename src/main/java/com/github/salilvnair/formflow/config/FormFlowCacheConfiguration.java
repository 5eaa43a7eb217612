package com.github.salilvnair.formflow.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class FormFlowCacheConfiguration {

    public static final String AUTOFILL_CACHE = "ff_autofill_cache";

    @Bean
    public CacheManager formFlowCacheManager(FormFlowProperties properties) {
        CaffeineCacheManager manager = new CaffeineCacheManager(AUTOFILL_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofSeconds(properties.getAutofill().getCacheTtlSeconds())));
        return manager;
    }
}

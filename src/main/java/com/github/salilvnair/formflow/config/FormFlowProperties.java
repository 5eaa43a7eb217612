package com.github.salilvnair.formflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "formflow")
@Getter
@Setter
public class FormFlowProperties {

    private String version = "1.0.0";
    private Session session = new Session();
    private Extraction extraction = new Extraction();
    private Clarification clarification = new Clarification();
    private Autofill autofill = new Autofill();
    private Questions questions = new Questions();

    @Getter
    @Setter
    public static class Session {
        private long ttlMinutes = 30L;
        private long reaperIntervalMs = 60_000L;
    }

    @Getter
    @Setter
    public static class Extraction {
        private long timeoutMs = 10_000L;
        private int poolSize = 8;
    }

    @Getter
    @Setter
    public static class Clarification {
        private double clarifyBelow = 0.60d;
        private double autoAcceptAt = 0.85d;
        private int maxSuggestions = 3;
    }

    @Getter
    @Setter
    public static class Autofill {
        private int topK = 5;
        private long cacheTtlSeconds = 60L;
    }

    @Getter
    @Setter
    public static class Questions {
        private int maxBatchSize = 3;
    }
}

package com.github.salilvnair.formflow.llm.core;

/**
 * Text generation backend supplied by the host application. FormFlow only needs structured JSON
 * back; the other methods let a host reuse an existing client.
 */
public interface LlmClient {
    String generateJson(String hint, String jsonSchema, String contextJson);

    default String generateText(String hint, String contextJson) {
        return generateJson(hint, "{\"type\":\"string\"}", contextJson);
    }

    default String providerName() {
        return getClass().getSimpleName();
    }
}

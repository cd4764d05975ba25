package com.deepansh.lineage.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the local generation server (Ollama).
 * Populated from application.yml under "lineage.llm".
 */
@ConfigurationProperties(prefix = "lineage.llm")
@Data
public class LlmProperties {
    private String baseUrl = "http://localhost:11434";
    private String model = "mistral";
    private String embeddingModel = "all-minilm";
    private double temperature = 0.3;
    private double topP = 0.9;
    private int connectTimeoutSeconds = 5;
    /** Per-call bound for generation requests; a timed out call yields empty text */
    private int timeoutSeconds = 30;
}

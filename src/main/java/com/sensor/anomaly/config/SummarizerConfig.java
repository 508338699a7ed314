package com.sensor.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "summarizer")
public class SummarizerConfig {

    private boolean enabled = false;

    // Azure OpenAI resource endpoint, e.g. https://my-resource.openai.azure.com
    private String endpoint;
    private String apiKey;
    private String deployment;
    private String apiVersion = "2024-02-01";

    private double temperature = 0.2;
    private int maxTokens = 200;

    private int connectTimeoutMs = 2000;
    private int readTimeoutMs = 8000;

    private int maxAttempts = 2;
    private long initialBackoffMs = 200;
    private long maxBackoffMs = 1000;
}

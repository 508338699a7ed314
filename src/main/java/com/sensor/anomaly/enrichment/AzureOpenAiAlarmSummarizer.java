package com.sensor.anomaly.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.config.SummarizerConfig;
import com.sensor.anomaly.exception.DependencyUnavailableException;
import com.sensor.anomaly.model.ContextEntry;
import com.sensor.anomaly.support.BoundedRetry;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summarizes alarm context through an Azure OpenAI chat-completions deployment.
 *
 * <p>The {@link RestClient} is expected to carry the resource endpoint as base URL, the
 * {@code api-key} header and bounded connect/read timeouts. Timeouts, 5xx and 429 responses
 * are retried with jitter; anything else, or exhaustion, yields empty.
 */
public class AzureOpenAiAlarmSummarizer implements AlarmSummarizer {

    private static final Logger log = LoggerFactory.getLogger(AzureOpenAiAlarmSummarizer.class);

    static final String SYSTEM_PROMPT =
            "You are a monitoring assistant. Convert the following alarm JSON into a clear, "
                    + "concise summary using plain text only. Write in simple sentences without any "
                    + "markdown formatting, bullet points, bold text, or special characters.";

    private final RestClient restClient;
    private final SummarizerConfig config;
    private final ObjectMapper objectMapper;
    private final MetricsConfig metricsConfig;
    private final BoundedRetry retry;

    public AzureOpenAiAlarmSummarizer(RestClient restClient, SummarizerConfig config,
                                      ObjectMapper objectMapper, MetricsConfig metricsConfig) {
        this.restClient = restClient;
        this.config = config;
        this.objectMapper = objectMapper;
        this.metricsConfig = metricsConfig;
        this.retry = new BoundedRetry("summarizer", config.getMaxAttempts(),
                config.getInitialBackoffMs(), config.getMaxBackoffMs(),
                AzureOpenAiAlarmSummarizer::isTransient);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    @Observed(name = "summarizer.summarize", contextualName = "summarize-alarm")
    public Optional<String> summarize(String variable, String alarmLabel, ContextEntry context) {
        if (context == null) {
            return Optional.empty();
        }

        Map<String, Object> body;
        try {
            body = requestBody(variable, alarmLabel, context);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize alarm context for {} {}: {}", variable, alarmLabel, e.getMessage());
            metricsConfig.recordSummarizer("error");
            return Optional.empty();
        }

        try {
            JsonNode response = retry.call("chat-completion", () -> restClient.post()
                    .uri("/openai/deployments/{deployment}/chat/completions?api-version={version}",
                            config.getDeployment(), config.getApiVersion())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class));

            String text = response == null ? ""
                    : response.path("choices").path(0).path("message").path("content").asText("").strip();
            if (text.isEmpty()) {
                metricsConfig.recordSummarizer("empty");
                return Optional.empty();
            }
            metricsConfig.recordSummarizer("success");
            return Optional.of(text);
        } catch (DependencyUnavailableException e) {
            metricsConfig.recordSummarizer("unavailable");
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("Summarizer request rejected for {} {}: {}", variable, alarmLabel, e.getMessage());
            metricsConfig.recordSummarizer("error");
            return Optional.empty();
        }
    }

    Map<String, Object> requestBody(String variable, String alarmLabel, ContextEntry context)
            throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("variable", variable);
        payload.put("alarm_type", alarmLabel);
        payload.put("context", context);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", "Alarm JSON:\n" + objectMapper.writeValueAsString(payload))));
        body.put("temperature", config.getTemperature());
        body.put("max_tokens", config.getMaxTokens());
        return body;
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof ResourceAccessException || e instanceof HttpServerErrorException) {
            return true;
        }
        return e instanceof HttpClientErrorException clientError
                && clientError.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }
}

package com.sensor.anomaly.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensor.anomaly.engine.reconstruction.ModelArtifactLoader;
import com.sensor.anomaly.engine.reconstruction.ReconstructionModel;
import com.sensor.anomaly.engine.threshold.ThresholdSet;
import com.sensor.anomaly.enrichment.AlarmContextCatalog;
import com.sensor.anomaly.enrichment.AlarmSummarizer;
import com.sensor.anomaly.enrichment.AzureOpenAiAlarmSummarizer;
import com.sensor.anomaly.enrichment.DisabledAlarmSummarizer;
import com.sensor.anomaly.exception.DetectorConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads the startup artifacts every detector depends on. Each bean either loads completely
 * or fails context startup; no detector is ever built on partial state.
 */
@Configuration
public class DetectionBeansConfig {

    private static final Logger log = LoggerFactory.getLogger(DetectionBeansConfig.class);

    @Bean
    public ThresholdSet thresholdSet(DetectionConfig config, ResourceLoader resourceLoader,
                                     ObjectMapper objectMapper) {
        String location = config.getThresholdsPath();
        try (InputStream in = open(resourceLoader, location)) {
            ThresholdSet thresholds = ThresholdSet.read(in, objectMapper, location);
            log.info("Loaded thresholds for {} variables from {}", thresholds.size(), location);
            return thresholds;
        } catch (IOException e) {
            throw new DetectorConfigurationException(location, "unreadable threshold file", e);
        }
    }

    @Bean
    public AlarmContextCatalog alarmContextCatalog(DetectionConfig config, ResourceLoader resourceLoader,
                                                   ObjectMapper objectMapper) {
        String location = config.getContextPath();
        try (InputStream in = open(resourceLoader, location)) {
            AlarmContextCatalog catalog = AlarmContextCatalog.read(in, objectMapper, location);
            log.info("Loaded {} alarm context entries from {}", catalog.size(), location);
            return catalog;
        } catch (IOException e) {
            throw new DetectorConfigurationException(location, "unreadable alarm context corpus", e);
        }
    }

    @Bean
    public ReconstructionModel reconstructionModel(DetectionConfig config, ResourceLoader resourceLoader,
                                                   ObjectMapper objectMapper) {
        return new ModelArtifactLoader(resourceLoader, objectMapper).load(config.getModelPath());
    }

    @Bean
    public AlarmSummarizer alarmSummarizer(SummarizerConfig config, ObjectMapper objectMapper,
                                           MetricsConfig metricsConfig) {
        if (!config.isEnabled()) {
            log.info("Alarm summarizer is DISABLED, structured context will be used as-is.");
            return new DisabledAlarmSummarizer();
        }
        requireSetting("summarizer.endpoint", config.getEndpoint());
        requireSetting("summarizer.api-key", config.getApiKey());
        requireSetting("summarizer.deployment", config.getDeployment());

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(config.getConnectTimeoutMs());
        requestFactory.setReadTimeout(config.getReadTimeoutMs());

        RestClient restClient = RestClient.builder()
                .baseUrl(config.getEndpoint())
                .requestFactory(requestFactory)
                .defaultHeader("api-key", config.getApiKey())
                .build();

        log.info("Alarm summarizer initialized. Deployment: {}", config.getDeployment());
        return new AzureOpenAiAlarmSummarizer(restClient, config, objectMapper, metricsConfig);
    }

    @Bean(name = "statisticalExecutor", destroyMethod = "shutdown")
    public ExecutorService statisticalExecutor(DetectionConfig config) {
        int threads = Math.max(1, config.getStatistical().getParallelism());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "statistical-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, threadFactory);
    }

    private static InputStream open(ResourceLoader resourceLoader, String location) throws IOException {
        if (location == null || location.isBlank()) {
            throw new DetectorConfigurationException("detection", "resource location is not configured");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DetectorConfigurationException(location, "file not found");
        }
        return resource.getInputStream();
    }

    private static void requireSetting(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new DetectorConfigurationException(name, "required when summarizer.enabled=true");
        }
    }
}

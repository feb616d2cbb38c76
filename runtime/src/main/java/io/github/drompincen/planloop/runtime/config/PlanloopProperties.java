package io.github.drompincen.planloop.runtime.config;

import io.github.drompincen.planloop.protocol.api.ModelConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * All runtime settings, bound once from the {@code planloop.*} namespace.
 */
@ConfigurationProperties(prefix = "planloop")
public class PlanloopProperties {

    private final Llm llm = new Llm();
    private final Retry retry = new Retry();
    private final Generation feedback = new Generation(0.3, 2000);
    private final Planning planning = new Planning();
    private final Generation inbox = new Generation(0.3, 500);
    private final Daily daily = new Daily();
    private final Worker worker = new Worker();

    public Llm getLlm() { return llm; }
    public Retry getRetry() { return retry; }
    public Generation getFeedback() { return feedback; }
    public Planning getPlanning() { return planning; }
    public Generation getInbox() { return inbox; }
    public Daily getDaily() { return daily; }
    public Worker getWorker() { return worker; }

    public static class Llm {
        /** openai, anthropic or fake */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model;
        private Duration timeout = Duration.ofSeconds(60);

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public static class Generation {
        private double temperature;
        private int maxTokens;

        public Generation() {}

        public Generation(double temperature, int maxTokens) {
            this.temperature = temperature;
            this.maxTokens = maxTokens;
        }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public ModelConfig toModelConfig(String systemPrompt) {
            return new ModelConfig(temperature, maxTokens, systemPrompt);
        }
    }

    public static class Planning extends Generation {
        private boolean autoGenerate = true;

        public Planning() {
            super(0.5, 1500);
        }

        public boolean isAutoGenerate() { return autoGenerate; }
        public void setAutoGenerate(boolean autoGenerate) { this.autoGenerate = autoGenerate; }
    }

    public static class Daily {
        private ZoneId zone = ZoneId.of("UTC");

        public ZoneId getZone() { return zone; }
        public void setZone(ZoneId zone) { this.zone = zone; }
    }

    public static class Worker {
        private int coreSize = 4;
        private int maxSize = 8;
        private int queueCapacity = 500;
        private long sweepIntervalMs = 60000;
        private Duration pendingGrace = Duration.ofMinutes(2);

        public int getCoreSize() { return coreSize; }
        public void setCoreSize(int coreSize) { this.coreSize = coreSize; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }

        public Duration getPendingGrace() { return pendingGrace; }
        public void setPendingGrace(Duration pendingGrace) { this.pendingGrace = pendingGrace; }
    }
}

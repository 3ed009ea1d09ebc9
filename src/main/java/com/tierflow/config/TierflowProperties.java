package com.tierflow.config;

import com.tierflow.core.escalation.ValueThreshold;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deployment configuration for the orchestration engine, bound from {@code tierflow.*}.
 */
@Component
@ConfigurationProperties(prefix = "tierflow")
public class TierflowProperties {

    private Scheduler scheduler = new Scheduler();
    private Escalation escalation = new Escalation();
    private Registry registry = new Registry();
    private Checkpoint checkpoint = new Checkpoint();
    private Metrics metrics = new Metrics();
    private Alerting alerting = new Alerting();

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Escalation getEscalation() { return escalation; }
    public void setEscalation(Escalation escalation) { this.escalation = escalation; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }
    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }
    public Alerting getAlerting() { return alerting; }
    public void setAlerting(Alerting alerting) { this.alerting = alerting; }

    public static class Scheduler {
        private Duration backoffBase = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
        private Duration backoffMax = Duration.ofSeconds(30);
        private int defaultMaxRetries = 2;
        private Duration defaultNodeTimeout = Duration.ofMinutes(5);
        private boolean recoverOnStartup = true;
        /** Finished tasks whose final view stays in memory; older ones are read back from checkpoints. */
        private int finishedViewLimit = 1000;

        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }
        public Duration getBackoffMax() { return backoffMax; }
        public void setBackoffMax(Duration backoffMax) { this.backoffMax = backoffMax; }
        public int getDefaultMaxRetries() { return defaultMaxRetries; }
        public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }
        public Duration getDefaultNodeTimeout() { return defaultNodeTimeout; }
        public void setDefaultNodeTimeout(Duration defaultNodeTimeout) { this.defaultNodeTimeout = defaultNodeTimeout; }
        public boolean isRecoverOnStartup() { return recoverOnStartup; }
        public void setRecoverOnStartup(boolean recoverOnStartup) { this.recoverOnStartup = recoverOnStartup; }
        public int getFinishedViewLimit() { return finishedViewLimit; }
        public void setFinishedViewLimit(int finishedViewLimit) { this.finishedViewLimit = finishedViewLimit; }
    }

    public static class Escalation {
        private int maxEscalations = 2;
        private List<ValueThreshold> valueThresholds = new ArrayList<>();

        public int getMaxEscalations() { return maxEscalations; }
        public void setMaxEscalations(int maxEscalations) { this.maxEscalations = maxEscalations; }
        public List<ValueThreshold> getValueThresholds() { return valueThresholds; }
        public void setValueThresholds(List<ValueThreshold> valueThresholds) { this.valueThresholds = valueThresholds; }
    }

    public static class Registry {
        private int failureThreshold = 3;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        /** Primary capability tag -> substitute capability tag. */
        private Map<String, String> substitutes = new LinkedHashMap<>();

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
        public Map<String, String> getSubstitutes() { return substitutes; }
        public void setSubstitutes(Map<String, String> substitutes) { this.substitutes = substitutes; }
    }

    public static class Checkpoint {
        /** Sequences kept per task; 0 keeps every checkpoint. */
        private int retention = 0;
        private Jdbc jdbc = new Jdbc();

        public int getRetention() { return retention; }
        public void setRetention(int retention) { this.retention = retention; }
        public Jdbc getJdbc() { return jdbc; }
        public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }
    }

    public static class Jdbc {
        private String url = "";
        private String username = "";
        private String password = "";
        private int maxPoolSize = 5;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    }

    public static class Metrics {
        private int bucketsPerWindow = 60;
        private Duration rolloverInterval = Duration.ofMinutes(1);

        public int getBucketsPerWindow() { return bucketsPerWindow; }
        public void setBucketsPerWindow(int bucketsPerWindow) { this.bucketsPerWindow = bucketsPerWindow; }
        public Duration getRolloverInterval() { return rolloverInterval; }
        public void setRolloverInterval(Duration rolloverInterval) { this.rolloverInterval = rolloverInterval; }
    }

    public static class Alerting {
        private double cpuPercent = 80.0;
        private double memoryPercent = 85.0;
        private double httpErrorRate = 0.05;
        private double agentSuccessRate = 0.8;
        private int historyLimit = 500;

        public double getCpuPercent() { return cpuPercent; }
        public void setCpuPercent(double cpuPercent) { this.cpuPercent = cpuPercent; }
        public double getMemoryPercent() { return memoryPercent; }
        public void setMemoryPercent(double memoryPercent) { this.memoryPercent = memoryPercent; }
        public double getHttpErrorRate() { return httpErrorRate; }
        public void setHttpErrorRate(double httpErrorRate) { this.httpErrorRate = httpErrorRate; }
        public double getAgentSuccessRate() { return agentSuccessRate; }
        public void setAgentSuccessRate(double agentSuccessRate) { this.agentSuccessRate = agentSuccessRate; }
        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
    }
}

package com.caseflow.engine.config;

import com.caseflow.core.model.ActivityOptions;
import com.caseflow.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Settings under the {@code caseflow} prefix.
 */
@ConfigurationProperties(prefix = "caseflow")
public class CaseflowProperties {

    private final Engine engine = new Engine();
    private final Persistence persistence = new Persistence();
    private final Activities activities = new Activities();
    private final Recovery recovery = new Recovery();

    public Engine getEngine() {
        return engine;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public Activities getActivities() {
        return activities;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public static class Engine {
        /** Upper bound between two iterations of an idle instance. */
        private Duration pollInterval = Duration.ofHours(1);
        private int workerThreads = 8;
        private int activityThreads = 16;
        private boolean seedPresets = true;

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getActivityThreads() {
            return activityThreads;
        }

        public void setActivityThreads(int activityThreads) {
            this.activityThreads = activityThreads;
        }

        public boolean isSeedPresets() {
            return seedPresets;
        }

        public void setSeedPresets(boolean seedPresets) {
            this.seedPresets = seedPresets;
        }
    }

    public static class Persistence {
        /** memory or jdbc */
        private String type = "memory";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Activities {
        /** local or http */
        private String mode = "local";
        private String baseUrl = "http://localhost:3000";
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration startToCloseTimeout = ActivityOptions.DEFAULT_START_TO_CLOSE;
        private final Retry retry = new Retry();

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public Duration getStartToCloseTimeout() {
            return startToCloseTimeout;
        }

        public void setStartToCloseTimeout(Duration startToCloseTimeout) {
            this.startToCloseTimeout = startToCloseTimeout;
        }

        public Retry getRetry() {
            return retry;
        }

        public ActivityOptions toActivityOptions() {
            return new ActivityOptions(startToCloseTimeout, retry.toRetryPolicy());
        }
    }

    public static class Retry {
        private int maximumAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(10);
        private Duration maximumInterval = Duration.ofMinutes(1);
        private double backoffCoefficient = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = new HashSet<>();

        public int getMaximumAttempts() {
            return maximumAttempts;
        }

        public void setMaximumAttempts(int maximumAttempts) {
            this.maximumAttempts = maximumAttempts;
        }

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
        }

        public Duration getMaximumInterval() {
            return maximumInterval;
        }

        public void setMaximumInterval(Duration maximumInterval) {
            this.maximumInterval = maximumInterval;
        }

        public double getBackoffCoefficient() {
            return backoffCoefficient;
        }

        public void setBackoffCoefficient(double backoffCoefficient) {
            this.backoffCoefficient = backoffCoefficient;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public Set<String> getNonRetryableErrors() {
            return nonRetryableErrors;
        }

        public void setNonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
        }

        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.builder()
                .maximumAttempts(maximumAttempts)
                .initialInterval(initialInterval)
                .maximumInterval(maximumInterval)
                .backoffCoefficient(backoffCoefficient)
                .jitterFactor(jitterFactor)
                .nonRetryableErrors(nonRetryableErrors)
                .build();
        }
    }

    public static class Recovery {
        /** How often live instances are checkpointed. */
        private Duration snapshotInterval = Duration.ofMinutes(5);

        public Duration getSnapshotInterval() {
            return snapshotInterval;
        }

        public void setSnapshotInterval(Duration snapshotInterval) {
            this.snapshotInterval = snapshotInterval;
        }
    }
}

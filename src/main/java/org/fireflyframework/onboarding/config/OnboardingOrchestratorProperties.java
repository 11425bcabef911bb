/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.onboarding.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the onboarding orchestrator.
 *
 * <p>
 * Example configuration:
 * <pre>
 * firefly.onboarding.worker-id=onboarding-1
 * firefly.onboarding.lease-duration=PT2M
 * firefly.onboarding.step.call-timeout=PT10S
 * firefly.onboarding.step.deadline=PT2M
 * firefly.onboarding.retry.max-attempts=3
 * firefly.onboarding.retry.initial-backoff=PT0.2S
 * firefly.onboarding.retry.max-backoff=PT5S
 * firefly.onboarding.poller.interval=PT30S
 * firefly.onboarding.poller.stale-threshold=PT5M
 * firefly.onboarding.persistence.enabled=true
 * firefly.onboarding.persistence.redis.host=localhost
 * firefly.onboarding.persistence.redis.key-prefix=firefly:onboarding:
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.onboarding")
public class OnboardingOrchestratorProperties {

    /**
     * Identity this instance uses when claiming orchestrations. Generated when blank.
     */
    private String workerId;

    /**
     * How long a claim lasts without a commit. Must comfortably exceed the step deadline.
     */
    private Duration leaseDuration = Duration.ofMinutes(2);

    @NestedConfigurationProperty
    private StepProperties step = new StepProperties();

    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @NestedConfigurationProperty
    private PollerProperties poller = new PollerProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private ObservabilityProperties observability = new ObservabilityProperties();

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    public StepProperties getStep() {
        return step;
    }

    public void setStep(StepProperties step) {
        this.step = step;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public PollerProperties getPoller() {
        return poller;
    }

    public void setPoller(PollerProperties poller) {
        this.poller = poller;
    }

    public PersistenceProperties getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceProperties persistence) {
        this.persistence = persistence;
    }

    public ObservabilityProperties getObservability() {
        return observability;
    }

    public void setObservability(ObservabilityProperties observability) {
        this.observability = observability;
    }

    /**
     * Timeouts applied to every collaborator call.
     */
    public static class StepProperties {
        /**
         * Timeout of a single call attempt.
         */
        private Duration callTimeout = Duration.ofSeconds(10);

        /**
         * Upper bound for one step including all retries and backoff.
         */
        private Duration deadline = Duration.ofMinutes(2);

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public Duration getDeadline() {
            return deadline;
        }

        public void setDeadline(Duration deadline) {
            this.deadline = deadline;
        }
    }

    /**
     * Retry policy shared by forward and compensating calls.
     */
    public static class RetryProperties {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(5);
        private double multiplier = 2.0d;
        private double jitterFactor = 0.5d;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    /**
     * Stale orchestration poller.
     */
    public static class PollerProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);

        /**
         * A non-terminal orchestration not updated for this long is re-dispatched.
         */
        private Duration staleThreshold = Duration.ofMinutes(5);
        private int batchSize = 100;
        private int maxConcurrency = 8;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getStaleThreshold() {
            return staleThreshold;
        }

        public void setStaleThreshold(Duration staleThreshold) {
            this.staleThreshold = staleThreshold;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }
    }

    /**
     * Persistence configuration.
     */
    public static class PersistenceProperties {
        /**
         * Whether Redis persistence is enabled. In-memory storage is used otherwise.
         */
        private boolean enabled = false;

        @NestedConfigurationProperty
        private RedisProperties redis = new RedisProperties();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public RedisProperties getRedis() {
            return redis;
        }

        public void setRedis(RedisProperties redis) {
            this.redis = redis;
        }
    }

    /**
     * Redis connection and key layout.
     */
    public static class RedisProperties {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
        private String keyPrefix = "firefly:onboarding:";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    /**
     * Observability configuration.
     */
    public static class ObservabilityProperties {
        private boolean metricsEnabled = true;
        private boolean eventLoggingEnabled = true;

        public boolean isMetricsEnabled() {
            return metricsEnabled;
        }

        public void setMetricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
        }

        public boolean isEventLoggingEnabled() {
            return eventLoggingEnabled;
        }

        public void setEventLoggingEnabled(boolean eventLoggingEnabled) {
            this.eventLoggingEnabled = eventLoggingEnabled;
        }
    }
}

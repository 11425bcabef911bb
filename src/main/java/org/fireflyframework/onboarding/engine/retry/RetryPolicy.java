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

package org.fireflyframework.onboarding.engine.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff with jitter.
 * <p>
 * Attempt {@code n} (1-based) that fails retryably is followed by a wait of
 * {@code min(maxBackoff, initialBackoff * multiplier^(n-1))}, spread by {@code +/- jitterFactor}
 * and never above {@code maxBackoff}. Failures the predicate rejects are not retried.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;
    private final double jitterFactor;
    private final Predicate<Throwable> retryable;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff,
                       double multiplier, double jitterFactor, Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.multiplier = multiplier;
        this.jitterFactor = Math.max(0.0d, Math.min(jitterFactor, 1.0d));
        this.retryable = Objects.requireNonNull(retryable, "retryable");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(5), 2.0d, 0.5d, RetryPredicates.DEFAULT);
    }

    /**
     * A policy that makes exactly one attempt.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0d, 0.0d, RetryPredicates.NEVER);
    }

    public RetryPolicy withRetryable(Predicate<Throwable> predicate) {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, multiplier, jitterFactor, predicate);
    }

    /**
     * Whether a failed attempt should be followed by another one.
     *
     * @param error the failure of the attempt
     * @param attempt number of attempts made so far (1-based)
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        return attempt < maxAttempts && retryable.test(error);
    }

    /**
     * Backoff before the attempt after {@code attempt}.
     */
    public Duration delayAfter(int attempt) {
        long base = baseDelayMillis(attempt);
        long jittered = computeDelay(base, jitterFactor);
        return Duration.ofMillis(Math.min(jittered, maxBackoff.toMillis()));
    }

    long baseDelayMillis(int attempt) {
        double raw = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(raw, (double) maxBackoff.toMillis());
    }

    static long computeDelay(long backoffMs, double jitterFactor) {
        if (backoffMs <= 0) return 0L;
        if (jitterFactor <= 0.0d) return backoffMs;
        double min = backoffMs * (1.0d - jitterFactor);
        double max = backoffMs * (1.0d + jitterFactor);
        long v = Math.round(ThreadLocalRandom.current().nextDouble(min, max));
        return Math.max(0L, v);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", initialBackoff=" + initialBackoff
                + ", maxBackoff=" + maxBackoff + ", multiplier=" + multiplier + ", jitterFactor=" + jitterFactor + '}';
    }
}

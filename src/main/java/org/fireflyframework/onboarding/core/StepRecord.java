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

package org.fireflyframework.onboarding.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only audit row for one step attempt.
 * <p>
 * {@code error} is present if and only if {@code status} is {@link StepRecordStatus#FAILED}.
 */
public record StepRecord(String orchestrationId,
                         StepKind step,
                         StepDirection direction,
                         StepRecordStatus status,
                         Map<String, Object> input,
                         Map<String, Object> output,
                         String error,
                         int attempts,
                         Instant startedAt,
                         Instant completedAt) {

    public StepRecord {
        Objects.requireNonNull(orchestrationId, "orchestrationId");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        if ((status == StepRecordStatus.FAILED) != (error != null)) {
            throw new IllegalArgumentException("error must be present exactly when status is FAILED");
        }
        input = copy(input);
        output = copy(output);
    }

    public static StepRecord started(String orchestrationId, StepKind step, StepDirection direction,
                                     Map<String, Object> input, Instant now) {
        return new StepRecord(orchestrationId, step, direction, StepRecordStatus.STARTED,
                input, null, null, 0, now, null);
    }

    public static StepRecord completed(String orchestrationId, StepKind step, Map<String, Object> input,
                                       Map<String, Object> output, int attempts, Instant startedAt, Instant now) {
        return new StepRecord(orchestrationId, step, StepDirection.FORWARD, StepRecordStatus.COMPLETED,
                input, output, null, attempts, startedAt, now);
    }

    public static StepRecord compensated(String orchestrationId, StepKind step, Map<String, Object> input,
                                         int attempts, Instant startedAt, Instant now) {
        return new StepRecord(orchestrationId, step, StepDirection.COMPENSATION, StepRecordStatus.COMPENSATED,
                input, null, null, attempts, startedAt, now);
    }

    public static StepRecord failed(String orchestrationId, StepKind step, StepDirection direction,
                                    Map<String, Object> input, String error, int attempts,
                                    Instant startedAt, Instant now) {
        return new StepRecord(orchestrationId, step, direction, StepRecordStatus.FAILED,
                input, null, error, attempts, startedAt, now);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

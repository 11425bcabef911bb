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

package org.fireflyframework.onboarding.engine.step;

import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepKind;
import org.fireflyframework.onboarding.util.JsonUtils;

import java.util.Map;

/**
 * Terminal result of one step execution after the retry budget. Failures are data, not exceptions.
 */
public record StepOutcome(boolean success,
                          StepKind step,
                          StepDirection direction,
                          Map<String, Object> output,
                          Throwable error,
                          int attempts,
                          long latencyMs) {

    public static StepOutcome success(StepKind step, StepDirection direction, Map<String, Object> output,
                                      int attempts, long latencyMs) {
        return new StepOutcome(true, step, direction, output, null, attempts, latencyMs);
    }

    public static StepOutcome failure(StepKind step, StepDirection direction, Throwable error,
                                      int attempts, long latencyMs) {
        return new StepOutcome(false, step, direction, null, error, attempts, latencyMs);
    }

    public String errorDescription() {
        return error != null ? JsonUtils.describe(error) : null;
    }
}

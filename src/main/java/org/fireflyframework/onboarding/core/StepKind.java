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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The forward steps of the onboarding saga, in execution order.
 */
public enum StepKind {

    AUTH("auth"),
    PROVISIONING("provisioning"),
    DR("dr");

    private final String key;

    StepKind(String key) {
        this.key = key;
    }

    /**
     * Stable identifier used in step records, context keys and log events.
     */
    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static StepKind fromKey(String key) {
        for (StepKind kind : values()) {
            if (kind.key.equals(key) || kind.name().equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown step kind: " + key);
    }
}

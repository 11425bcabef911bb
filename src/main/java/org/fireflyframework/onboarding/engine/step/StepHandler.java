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

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * One forward step of the onboarding saga together with its inverse.
 * <p>
 * Implementations wrap exactly one collaborator call per method and must not retry on their own;
 * retries, timeouts and outcome reporting belong to {@link StepExecutor}. Both methods read what they
 * need from the committed record: the request payload and the outputs of earlier steps.
 */
public interface StepHandler {

    StepKind kind();

    /**
     * Performs the step. The emitted map is merged into the record context under {@link StepKind#key()}
     * and is what {@link #performCompensation} later reads back.
     */
    Mono<Map<String, Object>> performForward(OrchestrationRecord record);

    /**
     * Undoes the step using the output recorded by {@link #performForward}. Must complete empty
     * when there is nothing to undo.
     */
    Mono<Void> performCompensation(OrchestrationRecord record);

    /**
     * What is sent to the collaborator on the forward call, as recorded in the step log.
     */
    Map<String, Object> describeForwardInput(OrchestrationRecord record);

    default Map<String, Object> describeCompensationInput(OrchestrationRecord record) {
        Map<String, Object> output = record.contextEntry(kind());
        return output != null ? output : Map.of();
    }
}

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

package org.fireflyframework.onboarding.engine;

import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepKind;

/**
 * What the engine does from one state, and where it goes next.
 *
 * @param type      kind of action
 * @param step      step the action concerns, {@code null} for {@link Type#BEGIN_COMPENSATION}
 * @param direction forward or compensation
 * @param onSuccess state committed when the action succeeds
 * @param onFailure state committed when an executed forward step fails; {@code null} for actions that
 *                  cannot fail and for compensation, which stays put on failure
 */
public record SagaAction(Type type,
                         StepKind step,
                         StepDirection direction,
                         OrchestrationState onSuccess,
                         OrchestrationState onFailure) {

    public enum Type {
        /** Record that a forward step is about to run. No collaborator call. */
        BEGIN_STEP,
        /** Run a forward step through the step executor. */
        EXECUTE_FORWARD,
        /** Enter the compensation path after a forward failure. No collaborator call. */
        BEGIN_COMPENSATION,
        /** Run the inverse of a completed step. */
        EXECUTE_COMPENSATION
    }

    public static SagaAction begin(StepKind step, OrchestrationState next) {
        return new SagaAction(Type.BEGIN_STEP, step, StepDirection.FORWARD, next, null);
    }

    public static SagaAction execute(StepKind step, OrchestrationState onSuccess, OrchestrationState onFailure) {
        return new SagaAction(Type.EXECUTE_FORWARD, step, StepDirection.FORWARD, onSuccess, onFailure);
    }

    public static SagaAction beginCompensation(OrchestrationState next) {
        return new SagaAction(Type.BEGIN_COMPENSATION, null, StepDirection.COMPENSATION, next, null);
    }

    public static SagaAction compensate(StepKind step, OrchestrationState onSuccess) {
        return new SagaAction(Type.EXECUTE_COMPENSATION, step, StepDirection.COMPENSATION, onSuccess, null);
    }

    public boolean invokesCollaborator() {
        return type == Type.EXECUTE_FORWARD || type == Type.EXECUTE_COMPENSATION;
    }
}

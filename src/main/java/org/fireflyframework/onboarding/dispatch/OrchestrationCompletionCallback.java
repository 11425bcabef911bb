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

package org.fireflyframework.onboarding.dispatch;

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;

/**
 * Caller-supplied notification for orchestrations that reach a terminal state.
 * <p>
 * Invoked once per orchestration, by the worker whose dispatch committed the terminal transition.
 * A crash between that commit and the invocation loses the notification; callers that cannot tolerate
 * this should reconcile from {@link OnboardingDispatcher#find}. Exceptions thrown here are logged and
 * do not affect the orchestration.
 */
public interface OrchestrationCompletionCallback {

    /**
     * All steps succeeded.
     *
     * @param record the completed record; {@link OrchestrationRecord#context()} holds every step's output
     */
    void onCompleted(OrchestrationRecord record);

    /**
     * A step failed and every completed step was compensated.
     *
     * @param record     the rolled back record
     * @param failedStep the forward step whose failure triggered the rollback
     * @param error      description of that failure
     */
    void onRolledBack(OrchestrationRecord record, StepKind failedStep, String error);
}

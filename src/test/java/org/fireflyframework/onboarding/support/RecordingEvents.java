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

package org.fireflyframework.onboarding.support;

import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepKind;
import org.fireflyframework.onboarding.observability.OrchestrationEvents;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records events as short strings.
 */
public class RecordingEvents implements OrchestrationEvents {

    public final List<String> calls = new CopyOnWriteArrayList<>();

    @Override public void onCreated(String id, String key) { calls.add("created:" + key); }
    @Override public void onDuplicateSuppressed(String id, String key, OrchestrationState state) { calls.add("duplicate:" + key + ":" + state); }
    @Override public void onTransition(String id, OrchestrationState from, OrchestrationState to) { calls.add("transition:" + from + "->" + to); }
    @Override public void onStepRetry(String id, StepKind step, StepDirection direction, int attempt, Throwable error) { calls.add("retry:" + step.key() + ":" + direction + ":" + attempt); }
    @Override public void onStepSucceeded(String id, StepKind step, StepDirection direction, int attempts, long latencyMs) { calls.add("success:" + step.key() + ":" + direction + ":attempts=" + attempts); }
    @Override public void onStepFailed(String id, StepKind step, StepDirection direction, Throwable error, int attempts, long latencyMs) { calls.add("failed:" + step.key() + ":" + direction + ":attempts=" + attempts); }
    @Override public void onCompensationStuck(String id, StepKind step, String error) { calls.add("stuck:" + step.key()); }
    @Override public void onClaimLost(String id) { calls.add("claim_lost:" + id); }
    @Override public void onFinished(String id, OrchestrationState state, long durationMs) { calls.add("finished:" + state); }
    @Override public void onPollCompleted(int found, int dispatched, int failed) { calls.add("poll:" + found + ":" + dispatched + ":" + failed); }

    public long count(String prefix) {
        return calls.stream().filter(c -> c.startsWith(prefix)).count();
    }
}

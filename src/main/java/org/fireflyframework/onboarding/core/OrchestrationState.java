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

/**
 * States of an onboarding orchestration.
 * <p>
 * Forward path: {@code PENDING -> AUTH_IN_PROGRESS -> AUTH_COMPLETE -> PROV_IN_PROGRESS -> PROV_COMPLETE
 * -> DR_IN_PROGRESS -> COMPLETED}. A failure moves an {@code _IN_PROGRESS} state to its {@code _FAILED}
 * sibling, from which compensation unwinds the completed steps in reverse order until
 * {@code ROLLED_BACK}.
 */
public enum OrchestrationState {

    PENDING(null, Phase.PENDING),
    AUTH_IN_PROGRESS(StepKind.AUTH, Phase.IN_PROGRESS),
    AUTH_COMPLETE(StepKind.AUTH, Phase.COMPLETE),
    AUTH_FAILED(StepKind.AUTH, Phase.FAILED),
    PROV_IN_PROGRESS(StepKind.PROVISIONING, Phase.IN_PROGRESS),
    PROV_COMPLETE(StepKind.PROVISIONING, Phase.COMPLETE),
    PROV_FAILED(StepKind.PROVISIONING, Phase.FAILED),
    DR_IN_PROGRESS(StepKind.DR, Phase.IN_PROGRESS),
    COMPLETED(null, Phase.TERMINAL),
    DR_FAILED(StepKind.DR, Phase.FAILED),
    AUTH_COMPENSATING(StepKind.AUTH, Phase.COMPENSATING),
    PROV_COMPENSATING(StepKind.PROVISIONING, Phase.COMPENSATING),
    ROLLED_BACK(null, Phase.TERMINAL);

    /**
     * Coarse grouping of states, used by the poller, the health indicator and metrics tags.
     */
    public enum Phase {
        PENDING,
        IN_PROGRESS,
        COMPLETE,
        FAILED,
        COMPENSATING,
        TERMINAL
    }

    private final StepKind step;
    private final Phase phase;

    OrchestrationState(StepKind step, Phase phase) {
        this.step = step;
        this.phase = phase;
    }

    /**
     * The step this state concerns, or {@code null} for PENDING and the terminal states.
     */
    public StepKind step() {
        return step;
    }

    public Phase phase() {
        return phase;
    }

    public boolean isTerminal() {
        return phase == Phase.TERMINAL;
    }

    public boolean isCompensating() {
        return phase == Phase.COMPENSATING;
    }
}

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
import org.fireflyframework.onboarding.core.StepKind;
import org.fireflyframework.onboarding.exception.UnknownOrchestrationStateException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.fireflyframework.onboarding.core.OrchestrationState.*;

/**
 * Lookup table from persisted state to the next action. The engine derives everything it does from
 * this table and the committed record, so a resumed orchestration continues exactly where the last
 * commit left it.
 */
public final class TransitionTable {

    private static final TransitionTable STANDARD = new TransitionTable(standardActions());

    private final Map<OrchestrationState, SagaAction> actions;

    TransitionTable(Map<OrchestrationState, SagaAction> actions) {
        this.actions = Collections.unmodifiableMap(new EnumMap<>(actions));
    }

    /**
     * The three-step onboarding saga: auth, provisioning, dr; compensated in reverse order.
     */
    public static TransitionTable standard() {
        return STANDARD;
    }

    /**
     * @return the action for {@code state}, empty for terminal states
     * @throws UnknownOrchestrationStateException if a non-terminal state has no entry
     */
    public Optional<SagaAction> actionFor(OrchestrationState state) {
        if (state.isTerminal()) {
            return Optional.empty();
        }
        SagaAction action = actions.get(state);
        if (action == null) {
            throw new UnknownOrchestrationStateException(state);
        }
        return Optional.of(action);
    }

    public Map<OrchestrationState, SagaAction> asMap() {
        return actions;
    }

    private static Map<OrchestrationState, SagaAction> standardActions() {
        Map<OrchestrationState, SagaAction> table = new EnumMap<>(OrchestrationState.class);

        table.put(PENDING, SagaAction.begin(StepKind.AUTH, AUTH_IN_PROGRESS));
        table.put(AUTH_IN_PROGRESS, SagaAction.execute(StepKind.AUTH, AUTH_COMPLETE, AUTH_FAILED));
        table.put(AUTH_COMPLETE, SagaAction.begin(StepKind.PROVISIONING, PROV_IN_PROGRESS));
        table.put(PROV_IN_PROGRESS, SagaAction.execute(StepKind.PROVISIONING, PROV_COMPLETE, PROV_FAILED));
        table.put(PROV_COMPLETE, SagaAction.begin(StepKind.DR, DR_IN_PROGRESS));
        table.put(DR_IN_PROGRESS, SagaAction.execute(StepKind.DR, COMPLETED, DR_FAILED));

        // nothing completed before auth, so there is nothing to undo
        table.put(AUTH_FAILED, SagaAction.beginCompensation(ROLLED_BACK));
        table.put(PROV_FAILED, SagaAction.beginCompensation(AUTH_COMPENSATING));
        table.put(DR_FAILED, SagaAction.beginCompensation(PROV_COMPENSATING));

        table.put(PROV_COMPENSATING, SagaAction.compensate(StepKind.PROVISIONING, AUTH_COMPENSATING));
        table.put(AUTH_COMPENSATING, SagaAction.compensate(StepKind.AUTH, ROLLED_BACK));
        return table;
    }
}

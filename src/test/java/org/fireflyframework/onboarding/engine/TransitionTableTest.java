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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.fireflyframework.onboarding.core.OrchestrationState.*;

class TransitionTableTest {

    private final TransitionTable table = TransitionTable.standard();

    @Test
    void everyNonTerminalStateHasAnAction() {
        for (OrchestrationState state : OrchestrationState.values()) {
            if (state.isTerminal()) {
                assertThat(table.actionFor(state)).isEmpty();
            } else {
                assertThat(table.actionFor(state)).as("action for %s", state).isPresent();
            }
        }
    }

    @Test
    void forwardPathVisitsStepsInOrder() {
        assertThat(successPath(PENDING)).containsExactly(
                AUTH_IN_PROGRESS, AUTH_COMPLETE, PROV_IN_PROGRESS, PROV_COMPLETE, DR_IN_PROGRESS, COMPLETED);
    }

    @Test
    void compensationRunsInReverseOrderOfCompletedSteps() {
        assertThat(successPath(DR_FAILED)).containsExactly(PROV_COMPENSATING, AUTH_COMPENSATING, ROLLED_BACK);
        assertThat(successPath(PROV_FAILED)).containsExactly(AUTH_COMPENSATING, ROLLED_BACK);
        assertThat(successPath(AUTH_FAILED)).containsExactly(ROLLED_BACK);
    }

    @Test
    void forwardFailuresLeadToTheStepFailedState() {
        assertThat(table.actionFor(AUTH_IN_PROGRESS).orElseThrow().onFailure()).isEqualTo(AUTH_FAILED);
        assertThat(table.actionFor(PROV_IN_PROGRESS).orElseThrow().onFailure()).isEqualTo(PROV_FAILED);
        assertThat(table.actionFor(DR_IN_PROGRESS).orElseThrow().onFailure()).isEqualTo(DR_FAILED);
    }

    @Test
    void onlyExecuteActionsInvokeCollaborators() {
        SagaAction begin = table.actionFor(PENDING).orElseThrow();
        SagaAction execute = table.actionFor(PROV_IN_PROGRESS).orElseThrow();
        SagaAction compensate = table.actionFor(PROV_COMPENSATING).orElseThrow();

        assertThat(begin.invokesCollaborator()).isFalse();
        assertThat(execute.invokesCollaborator()).isTrue();
        assertThat(execute.step()).isEqualTo(StepKind.PROVISIONING);
        assertThat(compensate.invokesCollaborator()).isTrue();
        assertThat(compensate.step()).isEqualTo(StepKind.PROVISIONING);
    }

    @Test
    void missingEntryIsReportedAsUnknownState() {
        Map<OrchestrationState, SagaAction> partial = new EnumMap<>(OrchestrationState.class);
        partial.put(PENDING, SagaAction.begin(StepKind.AUTH, AUTH_IN_PROGRESS));
        TransitionTable incomplete = new TransitionTable(partial);

        assertThatThrownBy(() -> incomplete.actionFor(DR_IN_PROGRESS))
                .isInstanceOf(UnknownOrchestrationStateException.class)
                .hasMessageContaining("DR_IN_PROGRESS");
    }

    private List<OrchestrationState> successPath(OrchestrationState from) {
        List<OrchestrationState> path = new ArrayList<>();
        OrchestrationState state = from;
        while (!state.isTerminal()) {
            state = table.actionFor(state).orElseThrow().onSuccess();
            path.add(state);
        }
        return path;
    }
}

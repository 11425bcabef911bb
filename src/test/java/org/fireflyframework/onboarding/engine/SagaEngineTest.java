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

import org.fireflyframework.onboarding.client.PermanentCollaboratorException;
import org.fireflyframework.onboarding.client.ResourceNotFoundException;
import org.fireflyframework.onboarding.client.TransientCollaboratorException;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepKind;
import org.fireflyframework.onboarding.core.StepRecord;
import org.fireflyframework.onboarding.core.StepRecordStatus;
import org.fireflyframework.onboarding.persistence.OrchestrationStoreException;
import org.fireflyframework.onboarding.persistence.Transition;
import org.fireflyframework.onboarding.persistence.impl.InMemoryOrchestrationStore;
import org.fireflyframework.onboarding.support.FakeCollaborators;
import org.fireflyframework.onboarding.support.OrchestratorHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.onboarding.support.FakeCollaborators.CONFIGURE_REPLICATION;
import static org.fireflyframework.onboarding.support.FakeCollaborators.CREATE_TENANT;
import static org.fireflyframework.onboarding.support.FakeCollaborators.DELETE_TENANT;
import static org.fireflyframework.onboarding.support.FakeCollaborators.DEPROVISION;
import static org.fireflyframework.onboarding.support.FakeCollaborators.PROVISION;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class SagaEngineTest {

    private OrchestratorHarness harness;
    private FakeCollaborators collaborators;

    @BeforeEach
    void setUp() {
        harness = new OrchestratorHarness();
        collaborators = harness.collaborators;
        harness.createPending("o-1", FakeCollaborators.request("acme"));
    }

    @Test
    void happyPathRunsEveryStepOnceAndCompletes() {
        DispatchResult result = harness.engine.dispatch("o-1").block();

        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.REACHED_TERMINAL);
        OrchestrationRecord record = harness.record("o-1");
        assertThat(record.state()).isEqualTo(OrchestrationState.COMPLETED);
        assertThat(record.completedAt()).isNotNull();
        assertThat(record.error()).isNull();
        assertThat(record.context()).containsOnlyKeys("auth", "provisioning", "dr");
        assertThat(record.contextEntry(StepKind.PROVISIONING)).containsEntry("resourceId", "res-acme");

        assertThat(collaborators.calls).containsExactly(CREATE_TENANT, PROVISION, CONFIGURE_REPLICATION);
        assertThat(summary(harness.steps("o-1"))).containsExactly(
                "auth:FORWARD:STARTED", "auth:FORWARD:COMPLETED",
                "provisioning:FORWARD:STARTED", "provisioning:FORWARD:COMPLETED",
                "dr:FORWARD:STARTED", "dr:FORWARD:COMPLETED");
    }

    @Test
    void stepRowsAreStrictlyOrderedByStartTime() {
        harness.engine.dispatch("o-1").block();

        List<StepRecord> steps = harness.steps("o-1");
        for (int i = 1; i < steps.size(); i++) {
            assertThat(steps.get(i).startedAt()).isAfter(steps.get(i - 1).startedAt());
        }
    }

    @Test
    void drFailureCompensatesProvisioningThenAuth() {
        collaborators.failAlways(CONFIGURE_REPLICATION, new PermanentCollaboratorException("dr", "invalid rpo"));

        DispatchResult result = harness.engine.dispatch("o-1").block();

        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.REACHED_TERMINAL);
        OrchestrationRecord record = harness.record("o-1");
        assertThat(record.state()).isEqualTo(OrchestrationState.ROLLED_BACK);
        assertThat(record.failedStep()).isEqualTo(StepKind.DR);
        assertThat(record.error()).contains("invalid rpo");
        assertThat(record.completedAt()).isNotNull();

        // permanent errors are not retried
        assertThat(collaborators.invocations(CONFIGURE_REPLICATION)).isEqualTo(1);
        assertThat(collaborators.calls).containsExactly(
                CREATE_TENANT, PROVISION, CONFIGURE_REPLICATION, DEPROVISION, DELETE_TENANT);

        List<String> rows = summary(harness.steps("o-1"));
        assertThat(rows).endsWith(
                "dr:FORWARD:FAILED",
                "provisioning:COMPENSATION:COMPENSATED",
                "auth:COMPENSATION:COMPENSATED");
        int failedAt = rows.indexOf("dr:FORWARD:FAILED");
        assertThat(rows.subList(failedAt + 1, rows.size())).noneMatch(row -> row.contains(":FORWARD:"));
    }

    @Test
    void authFailureRollsBackWithoutCompensation() {
        collaborators.failAlways(CREATE_TENANT, new PermanentCollaboratorException("idp", "realm quota exceeded"));

        harness.engine.dispatch("o-1").block();

        OrchestrationRecord record = harness.record("o-1");
        assertThat(record.state()).isEqualTo(OrchestrationState.ROLLED_BACK);
        assertThat(record.failedStep()).isEqualTo(StepKind.AUTH);
        assertThat(harness.steps("o-1")).noneMatch(row -> row.direction() == StepDirection.COMPENSATION);
        assertThat(collaborators.calls).containsExactly(CREATE_TENANT);
    }

    @Test
    void provisioningFailureCompensatesOnlyAuth() {
        collaborators.failAlways(PROVISION, new PermanentCollaboratorException("provisioning", "unknown plan"));

        harness.engine.dispatch("o-1").block();

        assertThat(harness.record("o-1").state()).isEqualTo(OrchestrationState.ROLLED_BACK);
        assertThat(collaborators.calls).containsExactly(CREATE_TENANT, PROVISION, DELETE_TENANT);
        assertThat(summary(harness.steps("o-1"))).endsWith(
                "provisioning:FORWARD:FAILED", "auth:COMPENSATION:COMPENSATED");
    }

    @Test
    void transientFailuresAreRetriedWithinTheBudget() {
        collaborators.failNext(PROVISION,
                new TransientCollaboratorException("provisioning", "503"),
                new TransientCollaboratorException("provisioning", "503"));

        harness.engine.dispatch("o-1").block();

        assertThat(harness.record("o-1").state()).isEqualTo(OrchestrationState.COMPLETED);
        assertThat(collaborators.invocations(PROVISION)).isEqualTo(3);
        List<StepRecord> provisioning = harness.steps("o-1").stream()
                .filter(row -> row.step() == StepKind.PROVISIONING && row.status() != StepRecordStatus.STARTED)
                .collect(Collectors.toList());
        assertThat(provisioning).hasSize(1);
        assertThat(provisioning.get(0).status()).isEqualTo(StepRecordStatus.COMPLETED);
        assertThat(provisioning.get(0).attempts()).isEqualTo(3);
        assertThat(harness.events.count("retry:provisioning")).isEqualTo(2);
    }

    @Test
    void exhaustedRetryBudgetFailsTheStep() {
        collaborators.failAlways(PROVISION, new TransientCollaboratorException("provisioning", "503"));

        harness.engine.dispatch("o-1").block();

        OrchestrationRecord record = harness.record("o-1");
        assertThat(record.state()).isEqualTo(OrchestrationState.ROLLED_BACK);
        assertThat(record.failedStep()).isEqualTo(StepKind.PROVISIONING);
        assertThat(collaborators.invocations(PROVISION)).isEqualTo(3);
        StepRecord failed = harness.steps("o-1").stream()
                .filter(row -> row.status() == StepRecordStatus.FAILED)
                .findFirst().orElseThrow();
        assertThat(failed.attempts()).isEqualTo(3);
        assertThat(failed.error()).contains("503");
    }

    @Test
    void redispatchingATerminalRecordChangesNothing() {
        harness.engine.dispatch("o-1").block();
        OrchestrationRecord before = harness.record("o-1");
        int rowsBefore = harness.steps("o-1").size();
        int callsBefore = collaborators.calls.size();

        DispatchResult again = harness.engine.dispatch("o-1").block();

        assertThat(again.outcome()).isEqualTo(DispatchResult.Outcome.ALREADY_TERMINAL);
        assertThat(harness.record("o-1")).isEqualTo(before);
        assertThat(harness.steps("o-1")).hasSize(rowsBefore);
        assertThat(collaborators.calls).hasSize(callsBefore);
    }

    @Test
    void failingCompensationLeavesRecordCompensatingUntilRetried() {
        collaborators.failAlways(CONFIGURE_REPLICATION, new PermanentCollaboratorException("dr", "region unsupported"));
        collaborators.failAlways(DEPROVISION, new TransientCollaboratorException("provisioning", "timeout"));

        DispatchResult result = harness.engine.dispatch("o-1").block();

        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.HALTED);
        OrchestrationRecord stuck = harness.record("o-1");
        assertThat(stuck.state()).isEqualTo(OrchestrationState.PROV_COMPENSATING);
        assertThat(stuck.error()).contains("region unsupported");
        StepRecord last = lastRow("o-1");
        assertThat(last.step()).isEqualTo(StepKind.PROVISIONING);
        assertThat(last.direction()).isEqualTo(StepDirection.COMPENSATION);
        assertThat(last.status()).isEqualTo(StepRecordStatus.FAILED);
        assertThat(last.attempts()).isEqualTo(3);
        assertThat(last.input()).containsEntry("resourceId", "res-acme");
        assertThat(harness.events.calls).contains("stuck:provisioning");
        assertThat(collaborators.invocations(DELETE_TENANT)).isZero();

        collaborators.clearFailures(DEPROVISION);
        DispatchResult resumed = harness.engine.dispatch("o-1").block();

        assertThat(resumed.outcome()).isEqualTo(DispatchResult.Outcome.REACHED_TERMINAL);
        assertThat(harness.record("o-1").state()).isEqualTo(OrchestrationState.ROLLED_BACK);
        assertThat(collaborators.invocations(DELETE_TENANT)).isEqualTo(1);
    }

    @Test
    void compensationOfAnAlreadyDeletedResourceCountsAsDone() {
        collaborators.failAlways(PROVISION, new PermanentCollaboratorException("provisioning", "no capacity"));
        collaborators.failAlways(DELETE_TENANT, new ResourceNotFoundException("idp", "tenant acme not found"));

        DispatchResult result = harness.engine.dispatch("o-1").block();

        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.REACHED_TERMINAL);
        assertThat(harness.record("o-1").state()).isEqualTo(OrchestrationState.ROLLED_BACK);
        assertThat(lastRow("o-1").status()).isEqualTo(StepRecordStatus.COMPENSATED);
    }

    @Test
    void resumesFromTheLastCommittedStateAfterAWorkerDies() {
        // Given a worker that completed auth and began provisioning, then vanished holding the lease
        OrchestrationRecord pending = harness.record("o-1");
        harness.store.claim("o-1", "dead-worker", Duration.ofSeconds(30)).block();
        OrchestrationRecord inAuth = commitAs("dead-worker", pending,
                pending.withState(OrchestrationState.AUTH_IN_PROGRESS, harness.clock.instant()));
        Map<String, Object> tenant = Map.of("tenantId", "acme", "externalTenantId", "ext-acme", "realm", "realm-acme");
        OrchestrationRecord authDone = commitAs("dead-worker", inAuth, inAuth.withContextEntry(StepKind.AUTH, tenant)
                .withState(OrchestrationState.AUTH_COMPLETE, harness.clock.instant()));
        commitAs("dead-worker", authDone, authDone.withState(OrchestrationState.PROV_IN_PROGRESS, harness.clock.instant()));

        // When the lease has expired and another worker dispatches
        harness.clock.advance(Duration.ofMinutes(1));
        DispatchResult result = harness.engine("worker-b").dispatch("o-1").block();

        // Then auth is not repeated and the saga finishes
        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.REACHED_TERMINAL);
        assertThat(harness.record("o-1").state()).isEqualTo(OrchestrationState.COMPLETED);
        assertThat(collaborators.invocations(CREATE_TENANT)).isZero();
        assertThat(collaborators.calls).containsExactly(PROVISION, CONFIGURE_REPLICATION);
    }

    @Test
    void failedCommitAbortsTheDispatchAndLeavesTheLastCommittedState() {
        OrchestratorHarness flaky = new OrchestratorHarness(clock -> spy(new InMemoryOrchestrationStore(clock)));
        flaky.createPending("o-1", FakeCollaborators.request("acme"));
        doReturn(Mono.error(new OrchestrationStoreException("connection reset")))
                .doCallRealMethod()
                .when(flaky.store)
                .commit(argThat((Transition t) -> t.next().state() == OrchestrationState.AUTH_COMPLETE));

        StepVerifier.create(flaky.engine.dispatch("o-1"))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(OrchestrationStoreException.class)
                        .hasMessageContaining("connection reset"))
                .verify(Duration.ofSeconds(5));

        // the tenant was created but nothing of that outcome was persisted
        assertThat(flaky.collaborators.invocations(CREATE_TENANT)).isEqualTo(1);
        OrchestrationRecord record = flaky.record("o-1");
        assertThat(record.state()).isEqualTo(OrchestrationState.AUTH_IN_PROGRESS);
        assertThat(record.context()).isEmpty();
        assertThat(summary(flaky.steps("o-1"))).containsExactly("auth:FORWARD:STARTED");
        assertThat(flaky.events.calls).doesNotContain("transition:AUTH_IN_PROGRESS->AUTH_COMPLETE");

        // the lease was released, so another worker resumes at once and re-invokes auth
        DispatchResult resumed = flaky.engine("worker-b").dispatch("o-1").block();

        assertThat(resumed.outcome()).isEqualTo(DispatchResult.Outcome.REACHED_TERMINAL);
        assertThat(flaky.record("o-1").state()).isEqualTo(OrchestrationState.COMPLETED);
        assertThat(flaky.collaborators.invocations(CREATE_TENANT)).isEqualTo(2);
        assertThat(summary(flaky.steps("o-1"))).containsExactly(
                "auth:FORWARD:STARTED", "auth:FORWARD:COMPLETED",
                "provisioning:FORWARD:STARTED", "provisioning:FORWARD:COMPLETED",
                "dr:FORWARD:STARTED", "dr:FORWARD:COMPLETED");
    }

    @Test
    void beginningCompensationCommitsNoStepRow() {
        collaborators.failAlways(CONFIGURE_REPLICATION, new PermanentCollaboratorException("dr", "invalid rpo"));

        harness.engine.dispatch("o-1").block();

        assertThat(harness.events.calls).contains("transition:DR_FAILED->PROV_COMPENSATING");
        assertThat(summary(harness.steps("o-1"))).containsExactly(
                "auth:FORWARD:STARTED", "auth:FORWARD:COMPLETED",
                "provisioning:FORWARD:STARTED", "provisioning:FORWARD:COMPLETED",
                "dr:FORWARD:STARTED", "dr:FORWARD:FAILED",
                "provisioning:COMPENSATION:COMPENSATED",
                "auth:COMPENSATION:COMPENSATED");
    }

    @Test
    void dispatchWhileAnotherWorkerHoldsTheLeaseDoesNothing() {
        harness.store.claim("o-1", "worker-z", Duration.ofMinutes(5)).block();

        DispatchResult result = harness.engine.dispatch("o-1").block();

        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.CLAIM_LOST);
        assertThat(harness.record("o-1").state()).isEqualTo(OrchestrationState.PENDING);
        assertThat(collaborators.calls).isEmpty();
        assertThat(harness.events.calls).contains("claim_lost:o-1");
    }

    @Test
    void unknownOrchestrationIsReportedAsNotFound() {
        DispatchResult result = harness.engine.dispatch("missing").block();

        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.NOT_FOUND);
        assertThat(result.record()).isNull();
    }

    @Test
    void leaseIsReleasedWhenDispatchEnds() {
        collaborators.failAlways(CONFIGURE_REPLICATION, new TransientCollaboratorException("dr", "503"));
        collaborators.failAlways(DEPROVISION, new TransientCollaboratorException("provisioning", "503"));
        harness.engine.dispatch("o-1").block();

        // A halted record can be picked up at once by another worker
        collaborators.clearFailures(DEPROVISION);
        DispatchResult result = harness.engine("worker-b").dispatch("o-1").block();

        assertThat(result.outcome()).isEqualTo(DispatchResult.Outcome.REACHED_TERMINAL);
    }

    @Test
    void transitionsAndFinishAreReported() {
        harness.engine.dispatch("o-1").block();

        assertThat(harness.events.calls).containsSubsequence(
                "transition:PENDING->AUTH_IN_PROGRESS",
                "transition:AUTH_IN_PROGRESS->AUTH_COMPLETE",
                "transition:DR_IN_PROGRESS->COMPLETED",
                "finished:COMPLETED");
        assertThat(harness.events.count("finished:")).isEqualTo(1);
    }

    private OrchestrationRecord commitAs(String owner, OrchestrationRecord current, OrchestrationRecord next) {
        return harness.store.commit(new Transition(current.id(), current.version(), owner, next, null,
                Duration.ofSeconds(30))).block();
    }

    private StepRecord lastRow(String id) {
        List<StepRecord> steps = harness.steps(id);
        return steps.get(steps.size() - 1);
    }

    private static List<String> summary(List<StepRecord> steps) {
        return steps.stream()
                .map(row -> row.step().key() + ":" + row.direction() + ":" + row.status())
                .collect(Collectors.toList());
    }
}

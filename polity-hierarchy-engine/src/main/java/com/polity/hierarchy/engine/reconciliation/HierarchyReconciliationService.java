/*
 * Copyright (C) 2025 The Polity Hierarchy Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.polity.hierarchy.engine.reconciliation;

import static com.polity.hierarchy.common.domain.job.ReconciliationStatus.CORRECTED;
import static com.polity.hierarchy.common.domain.job.ReconciliationStatus.FAILURE_INTEGRITY;
import static com.polity.hierarchy.common.domain.job.ReconciliationStatus.FAILURE_UNKNOWN;
import static com.polity.hierarchy.common.domain.job.ReconciliationStatus.RUNNING;
import static com.polity.hierarchy.common.domain.job.ReconciliationStatus.SUCCESS;
import static com.polity.hierarchy.common.domain.job.ReconciliationStatus.UNKNOWN;

import com.google.common.base.Stopwatch;
import com.polity.hierarchy.common.domain.job.ReconciliationJob;
import com.polity.hierarchy.common.domain.job.ReconciliationStatus;
import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.common.exception.ScopeNotFoundException;
import com.polity.hierarchy.engine.lock.ScopeLockManager;
import com.polity.hierarchy.engine.reconciliation.MembershipLedger.MembershipTally;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import com.polity.hierarchy.engine.repository.HierarchyScopeRepository;
import com.polity.hierarchy.engine.repository.ReconciliationJobRepository;
import com.polity.hierarchy.engine.scope.ScopeService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.CustomLog;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Recomputes the counters, paths and depths of a scope from the membership records and its ranges, and overwrites any
 * value that drifted. The snapshot is read in one repeatable read transaction and each correction is written with a
 * compare and set on the snapshot value, so rows changed by concurrent writers are skipped until the next run rather
 * than overwritten with stale data.
 */
@CustomLog
@Named
public class HierarchyReconciliationService {

    static final String METRIC = "polity.hierarchy.reconciliation";

    final AtomicReference<ReconciliationStatus> status;

    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final HierarchyScopeRepository hierarchyScopeRepository;
    private final MembershipLedger membershipLedger;
    private final MeterRegistry meterRegistry;
    private final ReconciliationJobRepository reconciliationJobRepository;
    private final ReconciliationProperties reconciliationProperties;
    private final ScopeLockManager scopeLockManager;
    private final ScopeService scopeService;
    private final TransactionTemplate snapshotTemplate;
    private final TransactionTemplate writeTemplate;

    @SuppressWarnings("java:S107")
    public HierarchyReconciliationService(
            HierarchyNodeRepository hierarchyNodeRepository,
            HierarchyScopeRepository hierarchyScopeRepository,
            MembershipLedger membershipLedger,
            MeterRegistry meterRegistry,
            PlatformTransactionManager transactionManager,
            ReconciliationJobRepository reconciliationJobRepository,
            ReconciliationProperties reconciliationProperties,
            ScopeLockManager scopeLockManager,
            ScopeService scopeService) {
        this.hierarchyNodeRepository = hierarchyNodeRepository;
        this.hierarchyScopeRepository = hierarchyScopeRepository;
        this.membershipLedger = membershipLedger;
        this.meterRegistry = meterRegistry;
        this.reconciliationJobRepository = reconciliationJobRepository;
        this.reconciliationProperties = reconciliationProperties;
        this.scopeLockManager = scopeLockManager;
        this.scopeService = scopeService;
        this.status = meterRegistry.gauge(METRIC, new AtomicReference<>(UNKNOWN), s -> s.get().ordinal());

        this.snapshotTemplate = new TransactionTemplate(transactionManager);
        this.snapshotTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        this.snapshotTemplate.setReadOnly(true);
        this.writeTemplate = new TransactionTemplate(transactionManager);
    }

    @Scheduled(cron = "${polity.hierarchy.reconciliation.cron:0 0 2 * * *}")
    public void reconcileAll() {
        if (!reconciliationProperties.isEnabled()) {
            return;
        }

        var stopwatch = Stopwatch.createStarted();
        int count = 0;

        for (var scope : hierarchyScopeRepository.findAll()) {
            if (scope.isQuarantined()) {
                log.warn("Skipping quarantined scope {}: {}", scope.toKey(), scope.getStatusReason());
                continue;
            }

            try {
                reconcile(scope.getId());
                ++count;
            } catch (Exception e) {
                log.warn("Unable to reconcile scope {}: {}", scope.toKey(), e.getMessage());
            }
        }

        log.info("Reconciled {} scopes in {}", count, stopwatch);
    }

    /**
     * Reconciles one scope and records the run as a job. An integrity violation quarantines the scope without writing
     * any correction.
     */
    public synchronized ReconciliationReport reconcile(long scopeId) {
        var scope = hierarchyScopeRepository.findById(scopeId).orElseThrow(() -> new ScopeNotFoundException(scopeId));
        var stopwatch = Stopwatch.createStarted();
        var job = startJob(scopeId);

        try {
            var snapshot = snapshotTemplate.execute(t -> new Snapshot(
                    hierarchyNodeRepository.findByScopeIdOrderByLeftBound(scopeId), membershipLedger.tally(scopeId)));
            var plan = ReconciliationPlanner.plan(snapshot.nodes(), snapshot.tally());
            job.setNodesExamined(plan.nodesExamined());

            if (plan.hasViolations()) {
                return quarantine(scope, plan, job, stopwatch);
            }

            var outcome = writeTemplate.execute(t -> applyCorrections(scopeId, plan));
            long applied = outcome.applied();
            long skipped = outcome.skipped();
            job.setCorrections(applied);
            job.setSkipped(skipped);
            job.setStatus(applied > 0 ? CORRECTED : SUCCESS);

            if (applied > 0) {
                log.info(
                        "Reconciled scope {} in {} correcting {} of {} nodes and skipping {} changed values",
                        scope.toKey(),
                        stopwatch,
                        applied,
                        plan.nodesExamined(),
                        skipped);
            } else {
                log.info(
                        "Reconciled {} nodes of scope {} without drift in {}",
                        plan.nodesExamined(),
                        scope.toKey(),
                        stopwatch);
            }

            return report(scopeId, job, plan, outcome, stopwatch);
        } catch (Exception e) {
            job.setError(e.getMessage());
            job.setStatus(FAILURE_UNKNOWN);
            log.warn(
                    "Reconciliation of scope {} completed unsuccessfully in {}: {}",
                    scope.toKey(),
                    stopwatch,
                    e.getMessage());
            throw e;
        } finally {
            job.setTimestampEnd(Instant.now());
            reconciliationJobRepository.save(job);
            status.set(job.getStatus());
        }
    }

    private ReconciliationJob startJob(long scopeId) {
        var job = ReconciliationJob.builder()
                .error(StringUtils.EMPTY)
                .scopeId(scopeId)
                .status(RUNNING)
                .timestampStart(Instant.now())
                .build();
        status.set(job.getStatus());
        return reconciliationJobRepository.save(job);
    }

    private ReconciliationReport quarantine(
            HierarchyScope scope, ReconciliationPlan plan, ReconciliationJob job, Stopwatch stopwatch) {
        var violations = plan.violations();
        var error = String.format(FAILURE_INTEGRITY.getMessage(), scope.getId(), violations.get(0));

        log.error(
                "Integrity violation in scope {} with {} overlapping or malformed ranges, writing no corrections: {}",
                scope.toKey(),
                violations.size(),
                violations);
        Counter.builder(METRIC + ".integrity")
                .description("The number of reconciliation runs that found an integrity violation")
                .register(meterRegistry)
                .increment();

        scopeService.quarantine(scope.getId(), error);
        job.setError(error);
        job.setStatus(FAILURE_INTEGRITY);
        return report(scope.getId(), job, plan, Outcome.NONE, stopwatch);
    }

    private Outcome applyCorrections(long scopeId, ReconciliationPlan plan) {
        // Shared lock keeps structural moves out while paths are rewritten
        scopeLockManager.lockShared(scopeId);
        var now = Instant.now();
        var counters = new ArrayList<CounterCorrection>();
        var paths = new ArrayList<PathCorrection>();
        long skipped = 0L;

        for (var correction : plan.counterCorrections()) {
            int updated = hierarchyNodeRepository.updateCounters(
                    correction.nodeId(),
                    correction.observedTotal(),
                    correction.observedActive(),
                    correction.expectedTotal(),
                    correction.expectedActive(),
                    now);

            if (updated == 0) {
                ++skipped;
                log.debug("Skipped counter correction of node {} changed since the snapshot", correction.nodeId());
                continue;
            }

            log.warn(
                    "Corrected counters of node {} by total {} and active {} to {} and {}",
                    correction.nodeId(),
                    correction.totalDelta(),
                    correction.activeDelta(),
                    correction.expectedTotal(),
                    correction.expectedActive());
            counters.add(correction);
            drift("counter");
        }

        for (var correction : plan.pathCorrections()) {
            int updated = hierarchyNodeRepository.updatePath(
                    correction.nodeId(),
                    correction.observedPath(),
                    correction.observedDepth(),
                    correction.expectedPath(),
                    correction.expectedDepth(),
                    now);

            if (updated == 0) {
                ++skipped;
                log.debug("Skipped path correction of node {} changed since the snapshot", correction.nodeId());
                continue;
            }

            log.warn(
                    "Corrected path of node {} from {} at depth {} to {} at depth {}",
                    correction.nodeId(),
                    correction.observedPath(),
                    correction.observedDepth(),
                    correction.expectedPath(),
                    correction.expectedDepth());
            paths.add(correction);
            drift("path");
        }

        return new Outcome(counters, paths, skipped);
    }

    private void drift(String type) {
        Counter.builder(METRIC + ".drift")
                .description("The number of drifted values corrected by reconciliation")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    private ReconciliationReport report(
            long scopeId, ReconciliationJob job, ReconciliationPlan plan, Outcome outcome, Stopwatch stopwatch) {
        return ReconciliationReport.builder()
                .counterCorrections(outcome.counterCorrections())
                .elapsed(stopwatch.elapsed())
                .nodesExamined(plan.nodesExamined())
                .pathCorrections(outcome.pathCorrections())
                .scopeId(scopeId)
                .skipped(outcome.skipped())
                .status(job.getStatus())
                .violations(plan.violations())
                .build();
    }

    private record Snapshot(List<HierarchyNode> nodes, Map<Long, MembershipTally> tally) {}

    // Corrections actually written, without those skipped by the compare and set
    private record Outcome(
            List<CounterCorrection> counterCorrections, List<PathCorrection> pathCorrections, long skipped) {

        private static final Outcome NONE = new Outcome(List.of(), List.of(), 0L);

        long applied() {
            return counterCorrections.size() + pathCorrections.size();
        }
    }
}

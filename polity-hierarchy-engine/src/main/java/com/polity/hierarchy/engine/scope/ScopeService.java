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

package com.polity.hierarchy.engine.scope;

import static com.polity.hierarchy.common.exception.ValidationFailure.INVALID_RULES;
import static com.polity.hierarchy.common.exception.ValidationFailure.SCOPE_EXISTS;

import com.polity.hierarchy.common.domain.rule.UnitLevelRule;
import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.common.domain.scope.ScopeStatus;
import com.polity.hierarchy.common.exception.IntegrityViolationException;
import com.polity.hierarchy.common.exception.ScopeNotFoundException;
import com.polity.hierarchy.common.exception.ValidationException;
import com.polity.hierarchy.engine.config.HierarchyProperties;
import com.polity.hierarchy.engine.config.HierarchyProperties.LevelRuleProperties;
import com.polity.hierarchy.engine.index.RangeIndexMaintainer;
import com.polity.hierarchy.engine.lock.ScopeLockManager;
import com.polity.hierarchy.engine.lock.ScopeMutation;
import com.polity.hierarchy.engine.repository.HierarchyScopeRepository;
import com.polity.hierarchy.engine.repository.UnitLevelRuleRepository;
import jakarta.inject.Named;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lifecycle of a scope: provisioning with its level rules, quarantine after an integrity violation and release once
 * the ranges have been repaired.
 */
@CustomLog
@Named
@RequiredArgsConstructor
public class ScopeService {

    private final HierarchyProperties hierarchyProperties;
    private final HierarchyScopeRepository hierarchyScopeRepository;
    private final RangeIndexMaintainer rangeIndexMaintainer;
    private final ScopeLockManager scopeLockManager;
    private final UnitLevelRuleRepository unitLevelRuleRepository;

    @Transactional
    public HierarchyScope provisionScope(ScopeRequest request) {
        hierarchyScopeRepository
                .findByTenantAndDomainCode(request.tenant(), request.domainCode())
                .ifPresent(s -> {
                    throw new ValidationException(SCOPE_EXISTS, SCOPE_EXISTS.format(s.toKey()));
                });

        var rules = StringUtils.isNotBlank(request.template())
                ? hierarchyProperties.getTemplate(request.template())
                : request.rules();
        checkRules(rules);

        var now = Instant.now();
        var scope = hierarchyScopeRepository.save(HierarchyScope.builder()
                .createdTimestamp(now)
                .domainCode(request.domainCode())
                .modifiedTimestamp(now)
                .tenant(request.tenant())
                .build());

        for (var rule : rules) {
            unitLevelRuleRepository.save(UnitLevelRule.builder()
                    .maxCount(rule.getMaxCount())
                    .minCount(rule.getMinCount())
                    .scopeId(scope.getId())
                    .unitLevel(rule.getLevel())
                    .unitType(rule.getType())
                    .validParentType(StringUtils.trimToNull(rule.getParentType()))
                    .build());
        }

        log.info("Provisioned scope {} as {} with {} level rules", scope.getId(), scope.toKey(), rules.size());
        return scope;
    }

    @Transactional(readOnly = true)
    public HierarchyScope getScope(long scopeId) {
        return hierarchyScopeRepository.findById(scopeId).orElseThrow(() -> new ScopeNotFoundException(scopeId));
    }

    @Transactional(readOnly = true)
    public List<UnitLevelRule> getRules(long scopeId) {
        getScope(scopeId);
        return unitLevelRuleRepository.findByScopeIdOrderByUnitLevel(scopeId);
    }

    /**
     * Refuses further structural writes to a scope. Reads and counter updates continue.
     */
    @ScopeMutation("quarantine")
    @Transactional
    public HierarchyScope quarantine(long scopeId, String reason) {
        var scope = scopeLockManager.lock(scopeId, LockModeType.PESSIMISTIC_WRITE);
        scope.setStatus(ScopeStatus.QUARANTINED);
        scope.setStatusReason(StringUtils.abbreviate(reason, 1000));
        scope.setModifiedTimestamp(Instant.now());
        log.error("Quarantined scope {} ({}): {}", scopeId, scope.toKey(), reason);
        return scope;
    }

    /**
     * Returns a quarantined scope to service once its ranges verify as consistent.
     */
    @ScopeMutation("releaseQuarantine")
    @Transactional
    public HierarchyScope releaseQuarantine(long scopeId) {
        var scope = scopeLockManager.lock(scopeId, LockModeType.PESSIMISTIC_WRITE);
        if (!scope.isQuarantined()) {
            return scope;
        }

        var report = verifyIntegrity(scopeId);
        if (!report.isConsistent()) {
            throw new IntegrityViolationException(
                    scopeId,
                    String.format(
                            "Scope %d still has %d integrity violations: %s",
                            scopeId,
                            report.violations().size(),
                            report.violations().get(0)));
        }

        scope.setStatus(ScopeStatus.ACTIVE);
        scope.setStatusReason(null);
        scope.setModifiedTimestamp(Instant.now());
        log.info("Released scope {} from quarantine after verifying {} nodes", scopeId, report.nodesExamined());
        return scope;
    }

    @Transactional(readOnly = true)
    public IntegrityReport verifyIntegrity(long scopeId) {
        getScope(scopeId);
        var walk = rangeIndexMaintainer.walk(scopeId);
        return new IntegrityReport(scopeId, walk.placements().size(), walk.violations());
    }

    /**
     * Suspends or resumes counter propagation. Deltas arriving while suspended are dropped and the counters are
     * rebuilt by reconciliation.
     */
    @ScopeMutation("setPropagationSuspended")
    @Transactional
    public HierarchyScope setPropagationSuspended(long scopeId, boolean suspended) {
        var scope = scopeLockManager.lock(scopeId, LockModeType.PESSIMISTIC_WRITE);
        scope.setPropagationSuspended(suspended);
        scope.setModifiedTimestamp(Instant.now());
        log.info("{} counter propagation in scope {}", suspended ? "Suspended" : "Resumed", scopeId);
        return scope;
    }

    private void checkRules(List<LevelRuleProperties> rules) {
        if (rules == null || rules.isEmpty()) {
            throw invalidRules("at least one rule is required");
        }

        var byType = new HashMap<String, LevelRuleProperties>();
        long roots = 0;

        for (var rule : rules) {
            if (byType.put(rule.getType(), rule) != null) {
                throw invalidRules("duplicate type " + rule.getType());
            }
            if (StringUtils.isBlank(rule.getParentType())) {
                roots++;
            }
            if (rule.getMaxCount() != null && rule.getMaxCount() < rule.getMinCount()) {
                throw invalidRules("minimum exceeds maximum for " + rule.getType());
            }
        }

        if (roots != 1) {
            throw invalidRules("expected one root type but found " + roots);
        }

        for (var rule : rules) {
            if (StringUtils.isBlank(rule.getParentType())) {
                continue;
            }

            var parent = byType.get(rule.getParentType());
            if (parent == null || parent.getLevel() >= rule.getLevel()) {
                throw invalidRules(rule.getParentType() + " is not a type of a lower level than " + rule.getType());
            }
        }
    }

    private static ValidationException invalidRules(String detail) {
        return new ValidationException(INVALID_RULES, INVALID_RULES.format(detail));
    }
}

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

package com.polity.hierarchy.engine.validation;

import static com.polity.hierarchy.common.exception.ValidationFailure.CAPACITY_EXCEEDED;
import static com.polity.hierarchy.common.exception.ValidationFailure.DUPLICATE_CODE;
import static com.polity.hierarchy.common.exception.ValidationFailure.PARENT_INACTIVE;
import static com.polity.hierarchy.common.exception.ValidationFailure.SCOPE_MISMATCH;
import static com.polity.hierarchy.common.exception.ValidationFailure.SCOPE_NOT_FOUND;
import static com.polity.hierarchy.common.exception.ValidationFailure.TEMPORAL_VIOLATION;
import static com.polity.hierarchy.common.exception.ValidationFailure.TYPE_NOT_PERMITTED;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.rule.UnitLevelRule;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import com.polity.hierarchy.engine.repository.HierarchyScopeRepository;
import com.polity.hierarchy.engine.repository.UnitLevelRuleRepository;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

/**
 * Placement rules evaluated before any range is touched. Rules are reloaded on every call so a change to a scope's
 * configuration applies to the next mutation.
 */
@Named
@RequiredArgsConstructor
public class HierarchyValidator {

    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final HierarchyScopeRepository hierarchyScopeRepository;
    private final UnitLevelRuleRepository unitLevelRuleRepository;

    @Transactional(readOnly = true)
    public ScopeRuleSet getRules(long scopeId) {
        return ScopeRuleSet.of(scopeId, unitLevelRuleRepository.findByScopeIdOrderByUnitLevel(scopeId));
    }

    /**
     * Checks whether a unit type may be placed under a parent type, with a null parent type standing for the root.
     */
    @Transactional(readOnly = true)
    public ValidationResult validatePlacement(long scopeId, String parentType, String childType) {
        if (!hierarchyScopeRepository.existsById(scopeId)) {
            return ValidationResult.reject(SCOPE_NOT_FOUND, scopeId);
        }
        return checkType(getRules(scopeId), parentType, childType);
    }

    /**
     * Validates a new child of an existing parent. The validity window has already been defaulted.
     */
    public ValidationResult validateChild(
            ScopeRuleSet rules, HierarchyNode parent, String unitType, String code, Instant from, Instant to) {
        return checkActive(parent)
                .and(() -> checkType(rules, parent.getUnitType(), unitType))
                .and(() -> checkTemporal(parent, from, to))
                .and(() -> checkCode(parent, code))
                .and(() -> checkCapacity(rules, parent, unitType));
    }

    /**
     * Validates moving a node under a new parent within the same scope.
     */
    public ValidationResult validateMove(ScopeRuleSet rules, HierarchyNode node, HierarchyNode newParent) {
        return checkScope(node, newParent)
                .and(() -> checkActive(newParent))
                .and(() -> checkType(rules, newParent.getUnitType(), node.getUnitType()))
                .and(() -> checkTemporal(newParent, node.getValidFrom(), node.getValidTo()))
                .and(() -> checkCode(newParent, node.getCode()))
                .and(() -> checkMovedCapacity(rules, node, newParent));
    }

    public ValidationResult validateRoot(ScopeRuleSet rules, String unitType, Instant from, Instant to) {
        return checkType(rules, null, unitType).and(() -> checkWindow(from, to, null, null));
    }

    /**
     * Reports active parents that have fewer active children of a type than its rule's minimum. Minimums cannot be
     * enforced while a tree is being built, so they are reported rather than rejected.
     */
    @Transactional(readOnly = true)
    public List<Shortfall> findShortfalls(long scopeId) {
        var rules = getRules(scopeId);
        var nodes = hierarchyNodeRepository.findByScopeIdOrderByLeftBound(scopeId);
        Map<Long, Map<String, Long>> children = new HashMap<>();

        for (var node : nodes) {
            if (node.isActive() && node.getParentId() != null) {
                children.computeIfAbsent(node.getParentId(), k -> new HashMap<>())
                        .merge(node.getUnitType(), 1L, Long::sum);
            }
        }

        var shortfalls = new ArrayList<Shortfall>();
        for (var node : nodes) {
            if (!node.isActive()) {
                continue;
            }

            var counts = children.getOrDefault(node.getId(), Map.of());
            for (var rule : rules.getChildRules(node.getUnitType())) {
                long actual = counts.getOrDefault(rule.getUnitType(), 0L);
                if (actual < rule.getMinCount()) {
                    var minimum = rule.getMinCount();
                    shortfalls.add(new Shortfall(node.getId(), node.getCode(), rule.getUnitType(), actual, minimum));
                }
            }
        }

        return shortfalls;
    }

    private ValidationResult checkActive(HierarchyNode parent) {
        return parent.isActive() ? ValidationResult.accept() : ValidationResult.reject(PARENT_INACTIVE, parent.getId());
    }

    private ValidationResult checkScope(HierarchyNode node, HierarchyNode parent) {
        if (node.getScopeId() != parent.getScopeId()) {
            return ValidationResult.reject(SCOPE_MISMATCH, node.getScopeId(), parent.getScopeId());
        }
        return ValidationResult.accept();
    }

    private ValidationResult checkType(ScopeRuleSet rules, String parentType, String childType) {
        if (!rules.permits(parentType, childType)) {
            return ValidationResult.reject(TYPE_NOT_PERMITTED, childType, parentType, rules.getScopeId());
        }
        return ValidationResult.accept();
    }

    private ValidationResult checkTemporal(HierarchyNode parent, Instant from, Instant to) {
        return checkWindow(from, to, parent.getValidFrom(), parent.getValidTo());
    }

    // A null end is open ended
    private ValidationResult checkWindow(Instant from, Instant to, Instant parentFrom, Instant parentTo) {
        boolean valid = from != null
                && (to == null || to.isAfter(from))
                && (parentFrom == null || !from.isBefore(parentFrom))
                && (parentTo == null || (to != null && !to.isAfter(parentTo)));

        if (!valid) {
            return ValidationResult.reject(TEMPORAL_VIOLATION, from, to, parentFrom, parentTo);
        }
        return ValidationResult.accept();
    }

    private ValidationResult checkCode(HierarchyNode parent, String code) {
        if (hierarchyNodeRepository.existsByParentIdAndCode(parent.getId(), code)) {
            return ValidationResult.reject(DUPLICATE_CODE, code, parent.getId());
        }
        return ValidationResult.accept();
    }

    // Inactive nodes do not occupy a slot under their parent
    private ValidationResult checkMovedCapacity(ScopeRuleSet rules, HierarchyNode node, HierarchyNode newParent) {
        return node.isActive() ? checkCapacity(rules, newParent, node.getUnitType()) : ValidationResult.accept();
    }

    private ValidationResult checkCapacity(ScopeRuleSet rules, HierarchyNode parent, String unitType) {
        var maxCount = rules.getRule(unitType).map(UnitLevelRule::getMaxCount).orElse(null);
        if (maxCount == null) {
            return ValidationResult.accept();
        }

        long count = hierarchyNodeRepository.countByParentIdAndUnitTypeAndActiveTrue(parent.getId(), unitType);
        if (count >= maxCount) {
            return ValidationResult.reject(CAPACITY_EXCEEDED, parent.getId(), count, unitType, maxCount);
        }
        return ValidationResult.accept();
    }
}

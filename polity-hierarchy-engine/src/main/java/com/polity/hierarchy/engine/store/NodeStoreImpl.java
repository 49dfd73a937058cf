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

package com.polity.hierarchy.engine.store;

import static com.polity.hierarchy.common.exception.ValidationFailure.CYCLE_DETECTED;
import static com.polity.hierarchy.common.exception.ValidationFailure.INVALID_POSITION;
import static com.polity.hierarchy.common.exception.ValidationFailure.PARENT_NOT_FOUND;
import static com.polity.hierarchy.common.exception.ValidationFailure.ROOT_EXISTS;
import static com.polity.hierarchy.common.exception.ValidationFailure.ROOT_IMMOVABLE;
import static com.polity.hierarchy.common.exception.ValidationFailure.SCOPE_MISMATCH;
import static com.polity.hierarchy.common.exception.ValidationFailure.SCOPE_NOT_FOUND;
import static com.polity.hierarchy.common.exception.ValidationFailure.TEMPORAL_VIOLATION;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.node.NodeRange;
import com.polity.hierarchy.common.domain.rule.UnitLevelRule;
import com.polity.hierarchy.common.exception.NodeNotFoundException;
import com.polity.hierarchy.common.exception.ValidationException;
import com.polity.hierarchy.engine.aggregate.StatisticsAggregator;
import com.polity.hierarchy.engine.index.RangeIndexMaintainer;
import com.polity.hierarchy.engine.lock.ScopeLockManager;
import com.polity.hierarchy.engine.lock.ScopeMutation;
import com.polity.hierarchy.engine.path.PathMaterializer;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import com.polity.hierarchy.engine.validation.HierarchyValidator;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.Objects;
import java.util.TreeMap;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

@CustomLog
@Named
@RequiredArgsConstructor
public class NodeStoreImpl implements NodeStore {

    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final HierarchyValidator hierarchyValidator;
    private final PathMaterializer pathMaterializer;
    private final RangeIndexMaintainer rangeIndexMaintainer;
    private final ScopeLockManager scopeLockManager;
    private final StatisticsAggregator statisticsAggregator;

    @Override
    @ScopeMutation("createNode")
    @Transactional(timeoutString = "#{@hierarchyProperties.getStructuralTimeout().toSeconds()}")
    public HierarchyNode createNode(NodeRequest request) {
        long scopeId = resolveScope(request);
        var scope = scopeLockManager.lockExclusive(scopeId);
        var rules = hierarchyValidator.getRules(scopeId);
        var now = Instant.now();
        HierarchyNode parent = null;
        NodeRange range;
        int level = rules.getRule(request.unitType()).map(UnitLevelRule::getUnitLevel).orElse(0);
        Instant validFrom;
        Instant validTo;

        if (request.parentId() == null) {
            hierarchyNodeRepository.findByScopeIdAndParentIdIsNull(scopeId).ifPresent(root -> {
                throw new ValidationException(ROOT_EXISTS, scopeId, root.getId());
            });
            validFrom = Objects.requireNonNullElse(request.validFrom(), now);
            validTo = request.validTo();
            hierarchyValidator
                    .validateRoot(rules, request.unitType(), validFrom, validTo)
                    .orElseThrow();
            range = RangeIndexMaintainer.ROOT_RANGE;
        } else {
            parent = hierarchyNodeRepository
                    .findById(request.parentId())
                    .orElseThrow(() -> new ValidationException(PARENT_NOT_FOUND, request.parentId()));
            validFrom = request.validFrom() != null ? request.validFrom() : latest(now, parent.getValidFrom());
            validTo = request.validTo() != null ? request.validTo() : parent.getValidTo();
            hierarchyValidator
                    .validateChild(rules, parent, request.unitType(), request.code(), validFrom, validTo)
                    .orElseThrow();
            range = rangeIndexMaintainer.allocate(scopeId, insertionPoint(parent, request.beforeSiblingId()));
        }

        var node = HierarchyNode.builder()
                .active(true)
                .attributes(request.attributes() != null ? new TreeMap<>(request.attributes()) : new TreeMap<>())
                .code(request.code())
                .createdTimestamp(now)
                .depth(parent != null ? parent.getDepth() + 1 : 0)
                .leftBound(range.left())
                .modifiedTimestamp(now)
                .name(request.name())
                .parentId(request.parentId())
                .path(parent != null ? parent.getPath() : "/") // The id is only known after the insert
                .rightBound(range.right())
                .scopeId(scopeId)
                .unitLevel(level)
                .unitType(request.unitType())
                .validFrom(validFrom)
                .validTo(validTo)
                .build();
        node = hierarchyNodeRepository.save(node);
        pathMaterializer.assign(node, parent);

        log.info(
                "Created {} {} as node {} at {} in scope {}",
                node.getUnitType(),
                node.getCode(),
                node.getId(),
                range,
                scope.toKey());
        return node;
    }

    @Override
    @ScopeMutation("deactivateNode")
    @Transactional(timeoutString = "#{@hierarchyProperties.getStructuralTimeout().toSeconds()}")
    public HierarchyNode deactivateNode(long nodeId, Instant at) {
        long scopeId = resolveNodeScope(nodeId);
        scopeLockManager.lockExclusive(scopeId);
        var node = load(nodeId);

        if (!node.isActive()) {
            log.debug("Node {} is already inactive", nodeId);
            return node;
        }

        var now = Instant.now();
        var end = at != null ? at : now;
        if (end.isBefore(node.getValidFrom())) {
            var reason = String.format(
                    "Node %d cannot be closed at %s before it opens at %s", nodeId, end, node.getValidFrom());
            throw new ValidationException(TEMPORAL_VIOLATION, reason);
        }

        int closed = hierarchyNodeRepository.closeWindows(
                scopeId, node.getLeftBound(), node.getRightBound(), end, now);
        int deactivated =
                hierarchyNodeRepository.deactivateSubtree(scopeId, node.getLeftBound(), node.getRightBound(), now);
        log.info(
                "Deactivated node {} and {} descendants at {}, closing {} windows",
                nodeId,
                deactivated - 1,
                end,
                closed);
        return load(nodeId);
    }

    @Override
    @ScopeMutation("reparentNode")
    @Transactional(timeoutString = "#{@hierarchyProperties.getStructuralTimeout().toSeconds()}")
    public HierarchyNode reparentNode(long nodeId, long newParentId) {
        long scopeId = resolveNodeScope(nodeId);
        long parentScopeId = hierarchyNodeRepository
                .findScopeIdById(newParentId)
                .orElseThrow(() -> new ValidationException(PARENT_NOT_FOUND, newParentId));
        if (scopeId != parentScopeId) {
            throw new ValidationException(SCOPE_MISMATCH, scopeId, parentScopeId);
        }

        var scope = scopeLockManager.lockExclusive(scopeId);
        var node = load(nodeId);
        var newParent = load(newParentId);

        if (node.isRoot()) {
            throw new ValidationException(ROOT_IMMOVABLE, nodeId, scopeId);
        }
        if (node.getRange().contains(newParent.getRange())) {
            throw new ValidationException(CYCLE_DETECTED, nodeId, newParentId);
        }
        if (newParentId == node.getParentId()) {
            log.debug("Node {} is already a child of {}", nodeId, newParentId);
            return node;
        }

        hierarchyValidator
                .validateMove(hierarchyValidator.getRules(scopeId), node, newParent)
                .orElseThrow();

        long total = node.getTotalCount();
        long active = node.getActiveCount();
        long oldParentId = node.getParentId();
        var oldRange = node.getRange();

        // Counts leave the old chain before the move and join the new one after it
        statisticsAggregator.applyToChain(scope, load(oldParentId), -total, -active);
        var range = rangeIndexMaintainer.move(load(nodeId), load(newParentId));
        int paths = pathMaterializer.rematerialize(nodeId, newParentId);
        statisticsAggregator.applyToChain(scope, load(newParentId), total, active);

        log.info(
                "Moved node {} from parent {} {} to parent {} {}, rewriting {} paths",
                nodeId,
                oldParentId,
                oldRange,
                newParentId,
                range,
                paths);
        return load(nodeId);
    }

    private long resolveScope(NodeRequest request) {
        if (request.parentId() == null) {
            if (request.scopeId() == null) {
                throw new ValidationException(SCOPE_NOT_FOUND, "A root node requires a scope");
            }
            return request.scopeId();
        }

        long scopeId = hierarchyNodeRepository
                .findScopeIdById(request.parentId())
                .orElseThrow(() -> new ValidationException(PARENT_NOT_FOUND, request.parentId()));
        if (request.scopeId() != null && request.scopeId() != scopeId) {
            throw new ValidationException(SCOPE_MISMATCH, request.scopeId(), scopeId);
        }
        return scopeId;
    }

    private long resolveNodeScope(long nodeId) {
        return hierarchyNodeRepository.findScopeIdById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    private long insertionPoint(HierarchyNode parent, Long beforeSiblingId) {
        if (beforeSiblingId == null) {
            return parent.getRightBound();
        }

        return hierarchyNodeRepository
                .findById(beforeSiblingId)
                .filter(sibling -> parent.getId().equals(sibling.getParentId()))
                .map(HierarchyNode::getLeftBound)
                .orElseThrow(() -> new ValidationException(INVALID_POSITION, beforeSiblingId, parent.getId()));
    }

    private HierarchyNode load(long nodeId) {
        return hierarchyNodeRepository.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    private static Instant latest(Instant first, Instant second) {
        return second != null && second.isAfter(first) ? second : first;
    }
}

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

package com.polity.hierarchy.engine.aggregate;

import static com.polity.hierarchy.common.exception.ValidationFailure.COUNTER_UNDERFLOW;

import com.polity.hierarchy.common.domain.membership.MembershipTransfer;
import com.polity.hierarchy.common.domain.membership.MembershipTransition;
import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.common.exception.NodeNotFoundException;
import com.polity.hierarchy.common.exception.ValidationException;
import com.polity.hierarchy.engine.lock.ScopeLockManager;
import com.polity.hierarchy.engine.lock.ScopeMutation;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies membership deltas to the cumulative counters of a node and all of its ancestors with a single range
 * predicate update. The ancestor chain of a node is exactly the set of rows whose range contains the node's range.
 */
@CustomLog
@Named
@RequiredArgsConstructor
public class StatisticsAggregator {

    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final ScopeLockManager scopeLockManager;

    /**
     * @return false if the delta was skipped because propagation is suspended for the node's scope
     */
    @ScopeMutation("applyMembershipDelta")
    @Transactional(timeoutString = "#{@hierarchyProperties.getCounterTimeout().toSeconds()}")
    public boolean applyMembershipDelta(long nodeId, long totalDelta, long activeDelta) {
        return apply(nodeId, totalDelta, activeDelta);
    }

    @ScopeMutation("onTransition")
    @Transactional(timeoutString = "#{@hierarchyProperties.getCounterTimeout().toSeconds()}")
    public boolean onTransition(MembershipTransition transition) {
        if (transition.isNoop()) {
            log.debug("Ignoring transition {} with no counter effect", transition);
            return true;
        }
        return apply(transition.nodeId(), transition.totalDelta(), transition.activeDelta());
    }

    /**
     * Moves one member between nodes, possibly in different scopes. Ancestors shared by both chains net to zero.
     *
     * @return false if the transfer was skipped in either scope because propagation is suspended
     */
    @ScopeMutation("transfer")
    @Transactional(timeoutString = "#{@hierarchyProperties.getCounterTimeout().toSeconds()}")
    public boolean transfer(MembershipTransfer transfer) {
        long fromScope = resolveScope(transfer.fromNodeId());
        long toScope = resolveScope(transfer.toNodeId());
        var scopes = scopeLockManager.lockShared(List.of(fromScope, toScope)).stream()
                .collect(Collectors.toMap(HierarchyScope::getId, Function.identity()));
        var source = load(transfer.fromNodeId());
        var destination = load(transfer.toNodeId());
        long total = transfer.totalDelta();
        long active = transfer.activeDelta();

        if (source.getId().equals(destination.getId()) || (total == 0 && active == 0)) {
            return true;
        }

        boolean decremented = applyToChain(scopes.get(fromScope), source, -total, -active);
        boolean incremented = applyToChain(scopes.get(toScope), destination, total, active);
        log.debug("Transferred member {} from node {} to {}", transfer.memberId(), source.getId(), destination.getId());
        return decremented && incremented;
    }

    /**
     * Applies a delta along the ancestor chain of a node, the node included. The caller must hold a lock on the scope
     * and pass a node loaded after any preceding range update.
     *
     * @return false if propagation is suspended for the scope
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean applyToChain(HierarchyScope scope, HierarchyNode node, long totalDelta, long activeDelta) {
        if (scope.isPropagationSuspended()) {
            log.debug("Skipping delta on node {} while propagation is suspended", node.getId());
            return false;
        }

        if (totalDelta == 0 && activeDelta == 0) {
            return true;
        }

        boolean decrement = totalDelta < 0 || activeDelta < 0;
        long chain = decrement
                ? hierarchyNodeRepository.countChain(node.getScopeId(), node.getLeftBound(), node.getRightBound())
                : 0L;
        int updated = hierarchyNodeRepository.applyDelta(
                node.getScopeId(),
                node.getLeftBound(),
                node.getRightBound(),
                totalDelta,
                activeDelta,
                Instant.now());

        // Concurrent decrements re-check the guard in the update against the committed row
        if (decrement && updated != chain) {
            throw new ValidationException(COUNTER_UNDERFLOW, totalDelta, activeDelta, node.getId());
        }
        log.debug(
                "Applied delta (total {}, active {}) to {} nodes on the chain of node {}",
                totalDelta,
                activeDelta,
                updated,
                node.getId());
        return true;
    }

    private boolean apply(long nodeId, long totalDelta, long activeDelta) {
        long scopeId = resolveScope(nodeId);
        var scope = scopeLockManager.lockShared(scopeId);
        return applyToChain(scope, load(nodeId), totalDelta, activeDelta);
    }

    private long resolveScope(long nodeId) {
        return hierarchyNodeRepository.findScopeIdById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    private HierarchyNode load(long nodeId) {
        return hierarchyNodeRepository.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }
}

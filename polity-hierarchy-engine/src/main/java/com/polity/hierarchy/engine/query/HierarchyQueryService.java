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

package com.polity.hierarchy.engine.query;

import com.google.common.base.Preconditions;
import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.exception.NodeNotFoundException;
import com.polity.hierarchy.common.exception.ScopeNotFoundException;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import com.polity.hierarchy.engine.repository.HierarchyScopeRepository;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read only queries. None of them take a scope lock.
 */
@Named
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class HierarchyQueryService {

    static final int MAX_LEADERBOARD_SIZE = 1000;

    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final HierarchyScopeRepository hierarchyScopeRepository;

    public HierarchyNode getNode(long nodeId) {
        return hierarchyNodeRepository.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    /**
     * @return the strict ancestors of the node derived from its range, root first
     */
    public List<HierarchyNode> getAncestors(long nodeId) {
        getNode(nodeId);
        return hierarchyNodeRepository.findAncestors(nodeId);
    }

    /**
     * @return the strict ancestors of the node found by following parent pointers, root first
     */
    public List<HierarchyNode> getAncestorsByParentChain(long nodeId) {
        var node = getNode(nodeId);
        var ancestors = new ArrayList<HierarchyNode>();
        var visited = new HashSet<Long>();
        visited.add(node.getId());

        for (var parentId = node.getParentId(); parentId != null; ) {
            if (!visited.add(parentId)) {
                throw new IllegalStateException("Parent chain of node " + nodeId + " loops at " + parentId);
            }
            var parent = getNode(parentId);
            ancestors.add(parent);
            parentId = parent.getParentId();
        }

        Collections.reverse(ancestors);
        return ancestors;
    }

    /**
     * @param maxDepth the maximum depth relative to the node, or null for the whole subtree
     * @return the strict descendants in pre-order
     */
    public List<HierarchyNode> getDescendants(long nodeId, Integer maxDepth) {
        getNode(nodeId);
        if (maxDepth == null) {
            return hierarchyNodeRepository.findDescendants(nodeId);
        }
        Preconditions.checkArgument(maxDepth >= 0, "maxDepth must not be negative");
        return hierarchyNodeRepository.findDescendants(nodeId, maxDepth);
    }

    public SubtreeCount getSubtreeCount(long nodeId) {
        var node = getNode(nodeId);
        return new SubtreeCount(node.getId(), node.getTotalCount(), node.getActiveCount(), node.getSubtreeSize() - 1);
    }

    /**
     * Ranks the active nodes of a level by active count, then total count, then id.
     */
    public List<HierarchyNode> leaderboard(long scopeId, int level, int limit) {
        Preconditions.checkArgument(limit > 0 && limit <= MAX_LEADERBOARD_SIZE, "limit must be between 1 and 1000");
        if (!hierarchyScopeRepository.existsById(scopeId)) {
            throw new ScopeNotFoundException(scopeId);
        }
        return hierarchyNodeRepository.findLeaderboard(scopeId, level, limit);
    }
}

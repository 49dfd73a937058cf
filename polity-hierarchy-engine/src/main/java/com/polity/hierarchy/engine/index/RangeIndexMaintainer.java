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

package com.polity.hierarchy.engine.index;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.node.NodeRange;
import com.polity.hierarchy.common.exception.NodeNotFoundException;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import jakarta.inject.Named;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates and relocates nested intervals. Every method must run in a transaction holding the exclusive scope lock;
 * the shifting statements clear the persistence context, so callers must reload any node they read beforehand.
 */
@CustomLog
@Named
@RequiredArgsConstructor
public class RangeIndexMaintainer {

    public static final NodeRange ROOT_RANGE = new NodeRange(1L, 2L);

    private final HierarchyNodeRepository hierarchyNodeRepository;

    /**
     * Opens a gap of two at the insertion point. Every bound at or after the position moves right, which widens the
     * ranges of the parent and all of its ancestors.
     *
     * @param scopeId  the scope of the tree
     * @param position the parent's right bound to append, or a sibling's left bound to insert before it
     * @return the range of the new node
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public NodeRange allocate(long scopeId, long position) {
        int lefts = hierarchyNodeRepository.shiftLeftBounds(scopeId, position, 2L);
        int rights = hierarchyNodeRepository.shiftRightBounds(scopeId, position, 2L);
        log.debug("Shifted {} left and {} right bounds at {} in scope {}", lefts, rights, position, scopeId);
        return new NodeRange(position, position + 1);
    }

    /**
     * Moves a subtree under a new parent. The subtree is parked at negated bounds while the gap it leaves is closed and
     * a new gap is opened at the destination's right bound, then it is translated into that gap.
     *
     * @return the new range of the moved node
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public NodeRange move(HierarchyNode node, HierarchyNode newParent) {
        long scopeId = node.getScopeId();
        long left = node.getLeftBound();
        long right = node.getRightBound();
        long width = node.getRange().width();
        int depthDelta = newParent.getDepth() + 1 - node.getDepth();

        int detached = hierarchyNodeRepository.detachSubtree(scopeId, left, right);
        hierarchyNodeRepository.shiftLeftBounds(scopeId, right + 1, -width);
        hierarchyNodeRepository.shiftRightBounds(scopeId, right + 1, -width);

        long position = hierarchyNodeRepository
                .findRightBound(newParent.getId())
                .orElseThrow(() -> new NodeNotFoundException(newParent.getId()));
        hierarchyNodeRepository.shiftLeftBounds(scopeId, position, width);
        hierarchyNodeRepository.shiftRightBounds(scopeId, position, width);
        int attached = hierarchyNodeRepository.attachSubtree(scopeId, position - left, depthDelta);

        if (attached != detached) {
            throw new IllegalStateException(String.format(
                    "Moved %d nodes of scope %d but detached %d", attached, scopeId, detached));
        }

        var range = new NodeRange(position, position + width - 1);
        log.debug("Moved {} nodes of scope {} from [{}, {}] to {}", attached, scopeId, left, right, range);
        return range;
    }

    @Transactional(readOnly = true)
    public RangeWalk walk(long scopeId) {
        return RangeWalker.walk(hierarchyNodeRepository.findByScopeIdOrderByLeftBound(scopeId));
    }
}

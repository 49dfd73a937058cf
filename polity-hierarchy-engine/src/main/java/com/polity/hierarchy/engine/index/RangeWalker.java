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
import com.polity.hierarchy.common.domain.node.NodePath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import lombok.experimental.UtilityClass;

/**
 * Stack walk over nodes in left bound order. The stack always holds the chain of open ranges enclosing the current
 * node, so its contents are the node's range-derived ancestors.
 */
@UtilityClass
public class RangeWalker {

    public static RangeWalk walk(List<HierarchyNode> nodes) {
        var sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingLong(HierarchyNode::getLeftBound));

        var placements = new HashMap<Long, RangeWalk.Placement>();
        var violations = new ArrayList<String>();
        var bounds = new HashSet<Long>();
        var stack = new ArrayDeque<HierarchyNode>();
        int roots = 0;

        for (var node : sorted) {
            var range = node.getRange();

            if (!range.isWellFormed()) {
                violations.add(String.format("Node %d has malformed range %s", node.getId(), range));
            }

            boolean leftUnique = bounds.add(node.getLeftBound());
            boolean rightUnique = bounds.add(node.getRightBound());
            if (!leftUnique || !rightUnique) {
                violations.add(String.format("Node %d reuses a bound of range %s", node.getId(), range));
            }

            while (!stack.isEmpty() && stack.peek().getRightBound() < node.getLeftBound()) {
                stack.pop();
            }

            var enclosing = stack.peek();
            if (enclosing != null && enclosing.getRange().partiallyOverlaps(range)) {
                violations.add(String.format(
                        "Node %d range %s partially overlaps node %d range %s",
                        node.getId(), range, enclosing.getId(), enclosing.getRange()));
            }

            var parentId = enclosing != null ? enclosing.getId() : null;
            if (parentId == null && ++roots > 1) {
                violations.add(String.format("Node %d is a second root", node.getId()));
            }

            if (!Objects.equals(parentId, node.getParentId())) {
                violations.add(String.format(
                        "Node %d has parent %d but its range is enclosed by %d",
                        node.getId(), node.getParentId(), parentId));
            }

            var chain = new ArrayList<Long>(stack.size() + 1);
            stack.descendingIterator().forEachRemaining(n -> chain.add(n.getId()));
            chain.add(node.getId());
            placements.put(node.getId(), new RangeWalk.Placement(parentId, NodePath.of(chain), stack.size()));
            stack.push(node);
        }

        return new RangeWalk(placements, violations);
    }
}

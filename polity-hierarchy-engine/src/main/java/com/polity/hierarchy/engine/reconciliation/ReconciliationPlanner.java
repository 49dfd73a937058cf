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

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.engine.index.RangeWalker;
import com.polity.hierarchy.engine.reconciliation.MembershipLedger.MembershipTally;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;

/**
 * Computes the expected counters, paths and depths of a scope from a snapshot without touching the database.
 */
@UtilityClass
class ReconciliationPlanner {

    static ReconciliationPlan plan(List<HierarchyNode> nodes, Map<Long, MembershipTally> tally) {
        var walk = RangeWalker.walk(nodes);
        if (!walk.isConsistent()) {
            return new ReconciliationPlan(nodes.size(), List.of(), List.of(), walk.violations());
        }

        var sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingLong(HierarchyNode::getLeftBound));
        int size = sorted.size();
        var lefts = new long[size];
        var totals = new long[size + 1];
        var actives = new long[size + 1];

        // Prefix sums over left bound order, so a subtree is a contiguous slice of the arrays
        for (int i = 0; i < size; i++) {
            var node = sorted.get(i);
            var direct = tally.getOrDefault(node.getId(), MembershipTally.ZERO);
            lefts[i] = node.getLeftBound();
            totals[i + 1] = totals[i] + direct.total();
            actives[i + 1] = actives[i] + direct.active();
        }

        var counterCorrections = new ArrayList<CounterCorrection>();
        var pathCorrections = new ArrayList<PathCorrection>();

        for (int i = 0; i < size; i++) {
            var node = sorted.get(i);
            int end = lastWithin(lefts, node.getRightBound());
            long expectedTotal = totals[end + 1] - totals[i];
            long expectedActive = actives[end + 1] - actives[i];

            if (expectedTotal != node.getTotalCount() || expectedActive != node.getActiveCount()) {
                counterCorrections.add(new CounterCorrection(
                        node.getId(), node.getTotalCount(), node.getActiveCount(), expectedTotal, expectedActive));
            }

            var placement = walk.getPlacement(node.getId());
            if (!placement.path().equals(node.getPath()) || placement.depth() != node.getDepth()) {
                pathCorrections.add(new PathCorrection(
                        node.getId(), node.getPath(), node.getDepth(), placement.path(), placement.depth()));
            }
        }

        return new ReconciliationPlan(size, counterCorrections, pathCorrections, List.of());
    }

    private static int lastWithin(long[] lefts, long right) {
        int index = Arrays.binarySearch(lefts, right);
        // Bounds are unique, so the right bound is never another node's left bound
        return index >= 0 ? index : -index - 2;
    }
}

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

import java.util.List;
import java.util.Map;

/**
 * The ancestry derived purely from the ranges of a scope's nodes, keyed by node id, along with any range that
 * breaks the nesting of intervals.
 */
public record RangeWalk(Map<Long, Placement> placements, List<String> violations) {

    public boolean isConsistent() {
        return violations.isEmpty();
    }

    public Placement getPlacement(long nodeId) {
        return placements.get(nodeId);
    }

    public record Placement(Long parentId, String path, int depth) {}
}

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

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import java.time.Instant;

/**
 * Structural mutations of a hierarchy. Nodes are never physically deleted.
 */
public interface NodeStore {

    HierarchyNode createNode(NodeRequest request);

    /**
     * Closes the validity window of a node and of every descendant whose window extends past {@code at}, and marks the
     * still-active ones inactive. Deactivating an inactive node has no effect.
     *
     * @param at the end of the window, or null for now
     */
    HierarchyNode deactivateNode(long nodeId, Instant at);

    /**
     * Moves a node and its subtree under a new parent. The subtree's counters move with it, going forward only.
     */
    HierarchyNode reparentNode(long nodeId, long newParentId);
}

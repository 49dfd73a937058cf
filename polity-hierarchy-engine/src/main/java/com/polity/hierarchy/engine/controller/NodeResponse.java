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

package com.polity.hierarchy.engine.controller;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record NodeResponse(
        long id,
        long scopeId,
        Long parentId,
        String unitType,
        int level,
        String code,
        String name,
        long leftBound,
        long rightBound,
        int depth,
        String path,
        long totalCount,
        long activeCount,
        boolean active,
        Instant validFrom,
        Instant validTo,
        Map<String, String> attributes) {

    static NodeResponse of(HierarchyNode node) {
        return new NodeResponse(
                node.getId(),
                node.getScopeId(),
                node.getParentId(),
                node.getUnitType(),
                node.getUnitLevel(),
                node.getCode(),
                node.getName(),
                node.getLeftBound(),
                node.getRightBound(),
                node.getDepth(),
                node.getPath(),
                node.getTotalCount(),
                node.getActiveCount(),
                node.isActive(),
                node.getValidFrom(),
                node.getValidTo(),
                node.getAttributes());
    }

    static List<NodeResponse> of(List<HierarchyNode> nodes) {
        return nodes.stream().map(NodeResponse::of).toList();
    }
}

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

package com.polity.hierarchy.engine.path;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.node.NodePath;
import com.polity.hierarchy.common.exception.NodeNotFoundException;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.HashMap;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the denormalized {@code path} of each node in step with the ranges. Paths are written through managed
 * entities and flushed with the surrounding transaction.
 */
@CustomLog
@Named
@RequiredArgsConstructor
public class PathMaterializer {

    private final HierarchyNodeRepository hierarchyNodeRepository;

    /**
     * Sets the path of a newly inserted node, which requires its generated id.
     */
    public String assign(HierarchyNode node, HierarchyNode parent) {
        var parentPath = parent != null ? parent.getPath() : null;
        var path = NodePath.append(parentPath, node.getId());
        node.setPath(path);
        return path;
    }

    /**
     * Repoints a moved node at its new parent and recomputes the path of every node in its subtree. Must be called
     * after the ranges have been moved.
     *
     * @return the number of nodes whose path was rewritten
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int rematerialize(long nodeId, long newParentId) {
        var node = load(nodeId);
        var parent = load(newParentId);
        var subtree = hierarchyNodeRepository.findByScopeIdAndLeftBoundBetweenOrderByLeftBound(
                node.getScopeId(), node.getLeftBound(), node.getRightBound());
        var paths = new HashMap<Long, String>();
        var now = Instant.now();

        paths.put(parent.getId(), parent.getPath());
        node.setParentId(parent.getId());

        for (var descendant : subtree) {
            var current = descendant.getId().equals(nodeId) ? node : descendant;
            var path = NodePath.append(paths.get(current.getParentId()), current.getId());
            paths.put(current.getId(), path);
            current.setPath(path);
            current.setModifiedTimestamp(now);
        }

        log.debug("Rewrote {} paths under {}", subtree.size(), parent.getPath());
        return subtree.size();
    }

    private HierarchyNode load(long id) {
        return hierarchyNodeRepository.findById(id).orElseThrow(() -> new NodeNotFoundException(id));
    }
}

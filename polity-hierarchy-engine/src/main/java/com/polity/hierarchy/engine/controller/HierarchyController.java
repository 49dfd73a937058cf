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

import com.polity.hierarchy.engine.aggregate.StatisticsAggregator;
import com.polity.hierarchy.engine.query.HierarchyQueryService;
import com.polity.hierarchy.engine.query.SubtreeCount;
import com.polity.hierarchy.engine.store.NodeRequest;
import com.polity.hierarchy.engine.store.NodeStore;
import jakarta.validation.Valid;
import java.util.List;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@CustomLog
@RequestMapping("/api/v1/nodes")
@RequiredArgsConstructor
@RestController
public class HierarchyController {

    private final HierarchyQueryService hierarchyQueryService;
    private final NodeStore nodeStore;
    private final StatisticsAggregator statisticsAggregator;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    NodeResponse createNode(@RequestBody @Valid NodeRequest request) {
        return NodeResponse.of(nodeStore.createNode(request));
    }

    @GetMapping("/{id}")
    NodeResponse getNode(@PathVariable long id) {
        return NodeResponse.of(hierarchyQueryService.getNode(id));
    }

    @GetMapping("/{id}/ancestors")
    List<NodeResponse> getAncestors(
            @PathVariable long id, @RequestParam(defaultValue = "false") boolean parentChain) {
        var ancestors = parentChain
                ? hierarchyQueryService.getAncestorsByParentChain(id)
                : hierarchyQueryService.getAncestors(id);
        return NodeResponse.of(ancestors);
    }

    @GetMapping("/{id}/descendants")
    List<NodeResponse> getDescendants(@PathVariable long id, @RequestParam(required = false) Integer maxDepth) {
        return NodeResponse.of(hierarchyQueryService.getDescendants(id, maxDepth));
    }

    @GetMapping("/{id}/counts")
    SubtreeCount getSubtreeCount(@PathVariable long id) {
        return hierarchyQueryService.getSubtreeCount(id);
    }

    @PostMapping("/{id}/deactivate")
    NodeResponse deactivateNode(@PathVariable long id, @RequestBody(required = false) NodeRequests.Deactivate body) {
        var at = body != null ? body.at() : null;
        return NodeResponse.of(nodeStore.deactivateNode(id, at));
    }

    @PostMapping("/{id}/reparent")
    NodeResponse reparentNode(@PathVariable long id, @RequestBody @Valid NodeRequests.Reparent body) {
        return NodeResponse.of(nodeStore.reparentNode(id, body.parentId()));
    }

    @PostMapping("/{id}/deltas")
    NodeRequests.DeltaResult applyMembershipDelta(@PathVariable long id, @RequestBody NodeRequests.Delta body) {
        boolean applied = statisticsAggregator.applyMembershipDelta(id, body.totalDelta(), body.activeDelta());
        return new NodeRequests.DeltaResult(id, applied);
    }

    @PostMapping("/transfers")
    NodeRequests.TransferResult transfer(@RequestBody @Valid NodeRequests.Transfer body) {
        return new NodeRequests.TransferResult(statisticsAggregator.transfer(body.toTransfer()));
    }
}

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

package com.polity.hierarchy.engine.bulk;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.common.exception.NodeNotFoundException;
import com.polity.hierarchy.engine.lock.ScopeMutation;
import com.polity.hierarchy.engine.reconciliation.HierarchyReconciliationService;
import com.polity.hierarchy.engine.reconciliation.ReconciliationReport;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import com.polity.hierarchy.engine.scope.ScopeService;
import com.polity.hierarchy.engine.store.NodeStore;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads a large tree without paying for counter propagation on every membership. Propagation is suspended for the
 * scope while the import runs and the counters are rebuilt by a reconciliation when it completes.
 */
@CustomLog
@Named
@RequiredArgsConstructor
public class BulkImportService {

    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final HierarchyReconciliationService hierarchyReconciliationService;
    private final NodeStore nodeStore;
    private final ScopeService scopeService;

    public HierarchyScope beginImport(long scopeId) {
        log.info("Beginning bulk import into scope {}", scopeId);
        return scopeService.setPropagationSuspended(scopeId, true);
    }

    /**
     * Creates the nodes of a batch in order, all or nothing.
     */
    @ScopeMutation("importNodes")
    @Transactional(timeoutString = "#{@hierarchyProperties.getStructuralTimeout().toSeconds()}")
    public List<HierarchyNode> importNodes(long scopeId, List<ImportEntry> entries) {
        var created = new HashMap<String, Long>();
        var ids = new ArrayList<Long>(entries.size());

        for (var entry : entries) {
            var request = entry.node().toBuilder().scopeId(scopeId);

            if (entry.parentReference() != null) {
                var parentId = created.get(entry.parentReference());
                if (parentId == null) {
                    throw new IllegalArgumentException("Unknown parent reference " + entry.parentReference()
                            + " of " + entry.reference());
                }
                request.parentId(parentId);
            }

            var node = nodeStore.createNode(request.build());
            created.put(entry.reference(), node.getId());
            ids.add(node.getId());
        }

        log.info("Imported {} nodes into scope {}", ids.size(), scopeId);
        // Later inserts shift the bounds of earlier ones
        return ids.stream()
                .map(id -> hierarchyNodeRepository.findById(id).orElseThrow(() -> new NodeNotFoundException(id)))
                .toList();
    }

    public ReconciliationReport completeImport(long scopeId) {
        scopeService.setPropagationSuspended(scopeId, false);
        var report = hierarchyReconciliationService.reconcile(scopeId);
        log.info("Completed bulk import into scope {} with reconciliation status {}", scopeId, report.status());
        return report;
    }
}

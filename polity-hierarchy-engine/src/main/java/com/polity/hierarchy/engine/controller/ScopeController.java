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

import com.polity.hierarchy.common.domain.rule.UnitLevelRule;
import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.engine.bulk.BulkImportService;
import com.polity.hierarchy.engine.bulk.ImportEntry;
import com.polity.hierarchy.engine.query.HierarchyQueryService;
import com.polity.hierarchy.engine.reconciliation.HierarchyReconciliationService;
import com.polity.hierarchy.engine.reconciliation.ReconciliationReport;
import com.polity.hierarchy.engine.scope.IntegrityReport;
import com.polity.hierarchy.engine.scope.ScopeRequest;
import com.polity.hierarchy.engine.scope.ScopeService;
import com.polity.hierarchy.engine.validation.HierarchyValidator;
import com.polity.hierarchy.engine.validation.Shortfall;
import com.polity.hierarchy.engine.validation.ValidationResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
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
@RequestMapping("/api/v1/scopes")
@RequiredArgsConstructor
@RestController
public class ScopeController {

    private final BulkImportService bulkImportService;
    private final HierarchyQueryService hierarchyQueryService;
    private final HierarchyReconciliationService hierarchyReconciliationService;
    private final HierarchyValidator hierarchyValidator;
    private final ScopeService scopeService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    HierarchyScope provisionScope(@RequestBody @Valid ScopeRequest request) {
        return scopeService.provisionScope(request);
    }

    @GetMapping("/{id}")
    HierarchyScope getScope(@PathVariable long id) {
        return scopeService.getScope(id);
    }

    @GetMapping("/{id}/rules")
    List<UnitLevelRule> getRules(@PathVariable long id) {
        return scopeService.getRules(id);
    }

    @GetMapping("/{id}/placements")
    ValidationResult validatePlacement(
            @PathVariable long id, @RequestParam(required = false) String parentType, @RequestParam String childType) {
        return hierarchyValidator.validatePlacement(id, parentType, childType);
    }

    @GetMapping("/{id}/shortfalls")
    List<Shortfall> findShortfalls(@PathVariable long id) {
        scopeService.getScope(id);
        return hierarchyValidator.findShortfalls(id);
    }

    @GetMapping("/{id}/leaderboard")
    List<NodeResponse> leaderboard(
            @PathVariable long id, @RequestParam int level, @RequestParam(defaultValue = "25") int limit) {
        return NodeResponse.of(hierarchyQueryService.leaderboard(id, level, limit));
    }

    @PostMapping("/{id}/reconciliation")
    ReconciliationReport reconcile(@PathVariable long id) {
        return hierarchyReconciliationService.reconcile(id);
    }

    @GetMapping("/{id}/integrity")
    IntegrityReport verifyIntegrity(@PathVariable long id) {
        return scopeService.verifyIntegrity(id);
    }

    @PostMapping("/{id}/quarantine/release")
    HierarchyScope releaseQuarantine(@PathVariable long id) {
        return scopeService.releaseQuarantine(id);
    }

    @PostMapping("/{id}/imports")
    HierarchyScope beginImport(@PathVariable long id) {
        return bulkImportService.beginImport(id);
    }

    @PostMapping("/{id}/imports/nodes")
    List<NodeResponse> importNodes(@PathVariable long id, @RequestBody @NotEmpty List<@Valid ImportEntry> entries) {
        return NodeResponse.of(bulkImportService.importNodes(id, entries));
    }

    @PostMapping("/{id}/imports/complete")
    ReconciliationReport completeImport(@PathVariable long id) {
        return bulkImportService.completeImport(id);
    }
}

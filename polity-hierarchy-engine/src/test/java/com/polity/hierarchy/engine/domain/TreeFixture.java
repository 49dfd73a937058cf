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

package com.polity.hierarchy.engine.domain;

import com.polity.hierarchy.common.domain.membership.MembershipState;
import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.engine.config.HierarchyProperties.LevelRuleProperties;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import com.polity.hierarchy.engine.scope.ScopeRequest;
import com.polity.hierarchy.engine.scope.ScopeService;
import com.polity.hierarchy.engine.store.NodeRequest;
import com.polity.hierarchy.engine.store.NodeStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.stereotype.Component;

/**
 * Builds trees through the real node store so their ranges, paths and depths are consistent.
 */
@Component
@RequiredArgsConstructor(onConstructor = @__(@Autowired))
public class TreeFixture {

    public static final String CENTRAL = "CENTRAL";
    public static final String PROVINCE = "PROVINCE";
    public static final String DISTRICT = "DISTRICT";
    public static final String MUNICIPALITY = "MUNICIPALITY";
    public static final String WARD = "WARD";
    public static final int MAX_PROVINCES = 3;

    private final DomainBuilder domainBuilder;
    private final HierarchyNodeRepository hierarchyNodeRepository;
    private final JdbcOperations jdbcOperations;
    private final NodeStore nodeStore;
    private final ScopeService scopeService;

    public HierarchyScope scope() {
        var rules = List.of(
                rule(CENTRAL, 0, null, null, 0),
                rule(PROVINCE, 1, CENTRAL, MAX_PROVINCES, 0),
                rule(DISTRICT, 2, PROVINCE, null, 0),
                rule(MUNICIPALITY, 3, DISTRICT, null, 0),
                rule(WARD, 4, MUNICIPALITY, null, 1));
        var request = new ScopeRequest("tenant-" + domainBuilder.number(), "NP", null, rules);
        return scopeService.provisionScope(request);
    }

    public HierarchyNode root(HierarchyScope scope) {
        return nodeStore.createNode(NodeRequest.builder()
                .code("HQ")
                .name("Central Committee")
                .scopeId(scope.getId())
                .unitType(CENTRAL)
                .build());
    }

    public HierarchyNode child(HierarchyNode parent, String unitType, String code) {
        return nodeStore.createNode(NodeRequest.builder()
                .code(code)
                .name(code)
                .parentId(parent.getId())
                .unitType(unitType)
                .build());
    }

    /**
     * Builds HQ, ProvinceA, District1, Palika1 and its wards Ward5 and Ward6.
     */
    public Tree tree() {
        var scope = scope();
        var hq = root(scope);
        var province = child(hq, PROVINCE, "ProvinceA");
        var district = child(province, DISTRICT, "District1");
        var palika = child(district, MUNICIPALITY, "Palika1");
        var ward5 = child(palika, WARD, "Ward5");
        var ward6 = child(palika, WARD, "Ward6");
        return new Tree(
                scope,
                reload(hq),
                reload(province),
                reload(district),
                reload(palika),
                reload(ward5),
                reload(ward6));
    }

    public HierarchyNode reload(HierarchyNode node) {
        return hierarchyNodeRepository.findById(node.getId()).orElseThrow();
    }

    public void membership(HierarchyNode node, MembershipState state) {
        jdbcOperations.update(
                "insert into membership (member_id, node_id, state) values (?, ?, ?)",
                "member-" + domainBuilder.number(),
                node.getId(),
                state.name());
    }

    private static LevelRuleProperties rule(String type, int level, String parentType, Integer max, int min) {
        var rule = new LevelRuleProperties();
        rule.setLevel(level);
        rule.setMaxCount(max);
        rule.setMinCount(min);
        rule.setParentType(parentType);
        rule.setType(type);
        return rule;
    }

    public record Tree(
            HierarchyScope scope,
            HierarchyNode hq,
            HierarchyNode province,
            HierarchyNode district,
            HierarchyNode palika,
            HierarchyNode ward5,
            HierarchyNode ward6) {}
}

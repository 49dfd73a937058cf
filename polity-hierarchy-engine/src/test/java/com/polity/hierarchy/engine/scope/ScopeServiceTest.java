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

package com.polity.hierarchy.engine.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

import com.polity.hierarchy.common.domain.rule.UnitLevelRule;
import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.common.domain.scope.ScopeStatus;
import com.polity.hierarchy.common.exception.ScopeNotFoundException;
import com.polity.hierarchy.common.exception.ValidationException;
import com.polity.hierarchy.common.exception.ValidationFailure;
import com.polity.hierarchy.engine.HierarchyIntegrationTest;
import com.polity.hierarchy.engine.config.HierarchyProperties.LevelRuleProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcOperations;

@RequiredArgsConstructor
class ScopeServiceTest extends HierarchyIntegrationTest {

    private final JdbcOperations jdbcOperations;
    private final ScopeService scopeService;

    @Test
    void provisionFromTemplate() {
        // when
        var scope = scopeService.provisionScope(new ScopeRequest("nc", "NP", "party", null));

        // then
        assertThat(scope)
                .returns("nc/NP", HierarchyScope::toKey)
                .returns(ScopeStatus.ACTIVE, HierarchyScope::getStatus)
                .returns(false, HierarchyScope::isPropagationSuspended);
        assertThat(scopeService.getRules(scope.getId()))
                .extracting(UnitLevelRule::getUnitType)
                .containsExactly("CENTRAL", "PROVINCE", "DISTRICT", "MUNICIPALITY", "WARD");
        assertThat(scopeService.getRules(scope.getId()))
                .filteredOn(r -> r.getUnitType().equals("PROVINCE"))
                .singleElement()
                .returns(7, UnitLevelRule::getMaxCount)
                .returns("CENTRAL", UnitLevelRule::getValidParentType);
    }

    @Test
    void provisionExplicitRules() {
        var rules = List.of(rule("COUNTRY", 0, null), rule("STATE", 1, "COUNTRY"));

        var scope = scopeService.provisionScope(new ScopeRequest("gov", "IN", null, rules));

        assertThat(scopeService.getRules(scope.getId()))
                .extracting(UnitLevelRule::getUnitType, UnitLevelRule::getValidParentType)
                .containsExactly(tuple("COUNTRY", null), tuple("STATE", "COUNTRY"));
    }

    @Test
    void duplicateScope() {
        scopeService.provisionScope(new ScopeRequest("nc", "NP", "party", null));

        assertThatThrownBy(() -> scopeService.provisionScope(new ScopeRequest("nc", "NP", "geography", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Scope nc/NP already exists")
                .extracting(e -> ((ValidationException) e).getFailure())
                .isEqualTo(ValidationFailure.SCOPE_EXISTS);
        assertThat(scopeService.provisionScope(new ScopeRequest("nc", "IN", "party", null)))
                .isNotNull();
    }

    @Test
    void unknownTemplate() {
        assertThatThrownBy(() -> scopeService.provisionScope(new ScopeRequest("nc", "NP", "missing", null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidRules() {
        assertInvalid(List.of());
        assertInvalid(List.of(rule("A", 0, null), rule("B", 0, null)));
        assertInvalid(List.of(rule("A", 0, null), rule("A", 1, "A")));
        assertInvalid(List.of(rule("A", 0, null), rule("B", 1, "C")));
        assertInvalid(List.of(rule("A", 1, null), rule("B", 1, "A")));

        var bounded = rule("B", 1, "A");
        bounded.setMinCount(3);
        bounded.setMaxCount(2);
        assertInvalid(List.of(rule("A", 0, null), bounded));

        assertThat(jdbcOperations.queryForObject("select count(*) from hierarchy_scope", Long.class))
                .isZero();
    }

    @Test
    void propagationSuspension() {
        var scope = scopeService.provisionScope(new ScopeRequest("nc", "NP", "party", null));

        assertThat(scopeService.setPropagationSuspended(scope.getId(), true).isPropagationSuspended())
                .isTrue();
        assertThat(scopeService.getScope(scope.getId()).isPropagationSuspended())
                .isTrue();
        assertThat(scopeService.setPropagationSuspended(scope.getId(), false).isPropagationSuspended())
                .isFalse();
    }

    @Test
    void quarantineAndRelease() {
        var tree = treeFixture.tree();
        var scopeId = tree.scope().getId();

        var quarantined = scopeService.quarantine(scopeId, "manual");
        assertThat(quarantined)
                .returns(ScopeStatus.QUARANTINED, HierarchyScope::getStatus)
                .returns("manual", HierarchyScope::getStatusReason);

        var report = scopeService.verifyIntegrity(scopeId);
        assertThat(report.isConsistent()).isTrue();
        assertThat(report.nodesExamined()).isEqualTo(6);

        assertThat(scopeService.releaseQuarantine(scopeId))
                .returns(ScopeStatus.ACTIVE, HierarchyScope::getStatus)
                .returns(null, HierarchyScope::getStatusReason);
        assertThat(scopeService.releaseQuarantine(scopeId).getStatus()).isEqualTo(ScopeStatus.ACTIVE);
    }

    @Test
    void scopeNotFound() {
        assertThatThrownBy(() -> scopeService.getScope(-1L)).isInstanceOf(ScopeNotFoundException.class);
        assertThatThrownBy(() -> scopeService.getRules(-1L)).isInstanceOf(ScopeNotFoundException.class);
        assertThatThrownBy(() -> scopeService.verifyIntegrity(-1L)).isInstanceOf(ScopeNotFoundException.class);
        assertThatThrownBy(() -> scopeService.quarantine(-1L, "x")).isInstanceOf(ScopeNotFoundException.class);
    }

    private void assertInvalid(List<LevelRuleProperties> rules) {
        assertThatThrownBy(() -> scopeService.provisionScope(new ScopeRequest("t", "NP", null, rules)))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Level rules are invalid")
                .extracting(e -> ((ValidationException) e).getFailure())
                .isEqualTo(ValidationFailure.INVALID_RULES);
    }

    private static LevelRuleProperties rule(String type, int level, String parentType) {
        var rule = new LevelRuleProperties();
        rule.setLevel(level);
        rule.setParentType(parentType);
        rule.setType(type);
        return rule;
    }
}

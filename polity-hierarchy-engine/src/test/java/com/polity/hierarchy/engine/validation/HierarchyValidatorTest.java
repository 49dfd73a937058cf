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

package com.polity.hierarchy.engine.validation;

import static com.polity.hierarchy.common.exception.ValidationFailure.CAPACITY_EXCEEDED;
import static com.polity.hierarchy.common.exception.ValidationFailure.DUPLICATE_CODE;
import static com.polity.hierarchy.common.exception.ValidationFailure.PARENT_INACTIVE;
import static com.polity.hierarchy.common.exception.ValidationFailure.SCOPE_MISMATCH;
import static com.polity.hierarchy.common.exception.ValidationFailure.SCOPE_NOT_FOUND;
import static com.polity.hierarchy.common.exception.ValidationFailure.TEMPORAL_VIOLATION;
import static com.polity.hierarchy.common.exception.ValidationFailure.TYPE_NOT_PERMITTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import com.polity.hierarchy.common.domain.rule.UnitLevelRule;
import com.polity.hierarchy.common.exception.ValidationException;
import com.polity.hierarchy.engine.repository.HierarchyNodeRepository;
import com.polity.hierarchy.engine.repository.HierarchyScopeRepository;
import com.polity.hierarchy.engine.repository.UnitLevelRuleRepository;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HierarchyValidatorTest {

    private static final long SCOPE_ID = 1L;
    private static final Instant NOW = Instant.now();

    @Mock
    private HierarchyNodeRepository hierarchyNodeRepository;

    @Mock
    private HierarchyScopeRepository hierarchyScopeRepository;

    @Mock
    private UnitLevelRuleRepository unitLevelRuleRepository;

    private HierarchyValidator hierarchyValidator;
    private ScopeRuleSet rules;

    @BeforeEach
    void setup() {
        hierarchyValidator =
                new HierarchyValidator(hierarchyNodeRepository, hierarchyScopeRepository, unitLevelRuleRepository);
        rules = ScopeRuleSet.of(
                SCOPE_ID,
                List.of(
                        rule("CENTRAL", 0, null, null, 0),
                        rule("PROVINCE", 1, "CENTRAL", 7, 0),
                        rule("DISTRICT", 2, "PROVINCE", null, 0),
                        rule("MUNICIPALITY", 3, "DISTRICT", null, 0),
                        rule("WARD", 4, "MUNICIPALITY", null, 1)));
    }

    @Test
    void acceptChild() {
        var parent = node(10L, "MUNICIPALITY", true);
        var result = hierarchyValidator.validateChild(rules, parent, "WARD", "Ward1", NOW, null);
        assertThat(result.accepted()).isTrue();
        assertThat(result.failure()).isNull();
    }

    @Test
    void wardUnderRoot() {
        var hq = node(1L, "CENTRAL", true);

        var result = hierarchyValidator.validateChild(rules, hq, "WARD", "Ward1", NOW, null);

        assertThat(result.accepted()).isFalse();
        assertThat(result.failure()).isEqualTo(TYPE_NOT_PERMITTED);
        assertThat(result.reason()).contains("WARD", "CENTRAL");
        assertThatThrownBy(result::orElseThrow)
                .isInstanceOf(ValidationException.class)
                .hasMessage(result.reason());
        verify(hierarchyNodeRepository, never()).existsByParentIdAndCode(anyLong(), anyString());
    }

    @Test
    void unknownType() {
        var result = hierarchyValidator.validateChild(rules, node(1L, "CENTRAL", true), "CITY", "C", NOW, null);
        assertThat(result.failure()).isEqualTo(TYPE_NOT_PERMITTED);
    }

    @Test
    void inactiveParentCheckedFirst() {
        var result = hierarchyValidator.validateChild(rules, node(1L, "CENTRAL", false), "WARD", "Ward1", NOW, null);
        assertThat(result.failure()).isEqualTo(PARENT_INACTIVE);
    }

    @Test
    void temporal() {
        var parent = node(10L, "MUNICIPALITY", true);
        parent.setValidTo(NOW.plus(1, ChronoUnit.DAYS));

        assertThat(hierarchyValidator
                        .validateChild(rules, parent, "WARD", "W", NOW.minusSeconds(1), null)
                        .failure())
                .isEqualTo(TEMPORAL_VIOLATION);
        assertThat(hierarchyValidator
                        .validateChild(rules, parent, "WARD", "W", NOW, null)
                        .failure())
                .isEqualTo(TEMPORAL_VIOLATION);
        assertThat(hierarchyValidator
                        .validateChild(rules, parent, "WARD", "W", NOW, NOW.plus(2, ChronoUnit.DAYS))
                        .failure())
                .isEqualTo(TEMPORAL_VIOLATION);
        assertThat(hierarchyValidator
                        .validateChild(rules, parent, "WARD", "W", NOW.plusSeconds(5), NOW.plusSeconds(5))
                        .failure())
                .isEqualTo(TEMPORAL_VIOLATION);
        assertThat(hierarchyValidator
                        .validateChild(rules, parent, "WARD", "W", NOW, NOW.plusSeconds(5))
                        .accepted())
                .isTrue();
    }

    @Test
    void duplicateCode() {
        when(hierarchyNodeRepository.existsByParentIdAndCode(10L, "Ward1")).thenReturn(true);
        var result = hierarchyValidator.validateChild(rules, node(10L, "MUNICIPALITY", true), "WARD", "Ward1", NOW, null);
        assertThat(result.failure()).isEqualTo(DUPLICATE_CODE);
    }

    @Test
    void capacity() {
        var hq = node(1L, "CENTRAL", true);
        when(hierarchyNodeRepository.countByParentIdAndUnitTypeAndActiveTrue(1L, "PROVINCE"))
                .thenReturn(6L, 7L);

        assertThat(hierarchyValidator
                        .validateChild(rules, hq, "PROVINCE", "P7", NOW, null)
                        .accepted())
                .isTrue();
        assertThat(hierarchyValidator
                        .validateChild(rules, hq, "PROVINCE", "P8", NOW, null)
                        .failure())
                .isEqualTo(CAPACITY_EXCEEDED);
    }

    @Test
    void moveAcrossScopes() {
        var district = node(3L, "DISTRICT", true);
        var palika = node(4L, "MUNICIPALITY", true);
        palika.setScopeId(2L);

        var result = hierarchyValidator.validateMove(rules, palika, district);

        assertThat(result.failure()).isEqualTo(SCOPE_MISMATCH);
    }

    @Test
    void moveInactiveNodeIgnoresCapacity() {
        var hq = node(1L, "CENTRAL", true);
        var province = node(2L, "PROVINCE", false);

        var result = hierarchyValidator.validateMove(rules, province, hq);

        assertThat(result.accepted()).isTrue();
        verify(hierarchyNodeRepository, never()).countByParentIdAndUnitTypeAndActiveTrue(anyLong(), anyString());
    }

    @Test
    void root() {
        assertThat(hierarchyValidator.validateRoot(rules, "CENTRAL", NOW, null).accepted())
                .isTrue();
        assertThat(hierarchyValidator.validateRoot(rules, "PROVINCE", NOW, null).failure())
                .isEqualTo(TYPE_NOT_PERMITTED);
        assertThat(hierarchyValidator.validateRoot(rules, "CENTRAL", NOW, NOW).failure())
                .isEqualTo(TEMPORAL_VIOLATION);
    }

    @Test
    void placement() {
        when(hierarchyScopeRepository.existsById(SCOPE_ID)).thenReturn(true);
        when(unitLevelRuleRepository.findByScopeIdOrderByUnitLevel(SCOPE_ID)).thenReturn(rules());

        assertThat(hierarchyValidator
                        .validatePlacement(SCOPE_ID, "PROVINCE", "DISTRICT")
                        .accepted())
                .isTrue();
        assertThat(hierarchyValidator
                        .validatePlacement(SCOPE_ID, null, "CENTRAL")
                        .accepted())
                .isTrue();
        assertThat(hierarchyValidator
                        .validatePlacement(SCOPE_ID, "PROVINCE", "WARD")
                        .failure())
                .isEqualTo(TYPE_NOT_PERMITTED);
    }

    @Test
    void placementScopeNotFound() {
        assertThat(hierarchyValidator.validatePlacement(2L, "PROVINCE", "DISTRICT").failure())
                .isEqualTo(SCOPE_NOT_FOUND);
    }

    @Test
    void shortfalls() {
        // given
        var palika1 = node(4L, "MUNICIPALITY", true);
        palika1.setParentId(3L);
        var palika2 = node(6L, "MUNICIPALITY", true);
        palika2.setParentId(3L);
        var ward = node(5L, "WARD", true);
        ward.setParentId(4L);
        var closedWard = node(7L, "WARD", false);
        closedWard.setParentId(6L);
        var closedPalika = node(8L, "MUNICIPALITY", false);
        closedPalika.setParentId(3L);
        when(unitLevelRuleRepository.findByScopeIdOrderByUnitLevel(SCOPE_ID)).thenReturn(rules());
        when(hierarchyNodeRepository.findByScopeIdOrderByLeftBound(SCOPE_ID))
                .thenReturn(List.of(palika1, ward, palika2, closedWard, closedPalika));

        // when
        var shortfalls = hierarchyValidator.findShortfalls(SCOPE_ID);

        // then
        assertThat(shortfalls).containsExactly(new Shortfall(6L, "C6", "WARD", 0L, 1));
    }

    private List<UnitLevelRule> rules() {
        return List.of(
                rule("CENTRAL", 0, null, null, 0),
                rule("PROVINCE", 1, "CENTRAL", 7, 0),
                rule("DISTRICT", 2, "PROVINCE", null, 0),
                rule("MUNICIPALITY", 3, "DISTRICT", null, 0),
                rule("WARD", 4, "MUNICIPALITY", null, 1));
    }

    private static HierarchyNode node(long id, String unitType, boolean active) {
        return HierarchyNode.builder()
                .active(active)
                .code("C" + id)
                .id(id)
                .scopeId(SCOPE_ID)
                .unitType(unitType)
                .validFrom(NOW)
                .build();
    }

    private static UnitLevelRule rule(String type, int level, String parentType, Integer max, int min) {
        return UnitLevelRule.builder()
                .maxCount(max)
                .minCount(min)
                .scopeId(SCOPE_ID)
                .unitLevel(level)
                .unitType(type)
                .validParentType(parentType)
                .build();
    }
}

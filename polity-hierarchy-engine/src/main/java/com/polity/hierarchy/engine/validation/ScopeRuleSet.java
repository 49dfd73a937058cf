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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.polity.hierarchy.common.domain.rule.UnitLevelRule;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;

/**
 * The immutable level rules of one scope, indexed by unit type.
 */
public class ScopeRuleSet {

    @Getter
    private final long scopeId;

    private final ImmutableMap<String, UnitLevelRule> rules;

    private ScopeRuleSet(long scopeId, Collection<UnitLevelRule> rules) {
        this.scopeId = scopeId;
        this.rules = rules.stream().collect(ImmutableMap.toImmutableMap(UnitLevelRule::getUnitType, r -> r));
    }

    public static ScopeRuleSet of(long scopeId, Collection<UnitLevelRule> rules) {
        return new ScopeRuleSet(scopeId, rules);
    }

    public Optional<UnitLevelRule> getRule(String unitType) {
        return Optional.ofNullable(rules.get(unitType));
    }

    /**
     * @param parentType the unit type of the parent, null for a root
     */
    public boolean permits(String parentType, String childType) {
        return getRule(childType)
                .filter(r -> Objects.equals(r.getValidParentType(), parentType))
                .isPresent();
    }

    public List<UnitLevelRule> getChildRules(String parentType) {
        return rules.values().stream()
                .filter(r -> Objects.equals(r.getValidParentType(), parentType))
                .collect(ImmutableList.toImmutableList());
    }
}

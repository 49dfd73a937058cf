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

import com.polity.hierarchy.engine.config.HierarchyProperties.LevelRuleProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * A scope to provision with either an explicit list of level rules or the name of a configured template.
 */
public record ScopeRequest(
        @NotBlank @Size(max = 64) String tenant,
        @NotBlank @Size(max = 64) String domainCode,
        String template,
        List<@Valid LevelRuleProperties> rules) {}

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

package com.polity.hierarchy.engine.store;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;

/**
 * A node to create. {@code scopeId} is required for a root and otherwise checked against the parent's scope. A null
 * {@code beforeSiblingId} appends the node after the parent's last child.
 */
@Builder(toBuilder = true)
public record NodeRequest(
        Long scopeId,
        Long parentId,
        @NotBlank @Size(max = 64) String unitType,
        @NotBlank @Size(max = 64) String code,
        @NotBlank @Size(max = 256) String name,
        Instant validFrom,
        Instant validTo,
        Map<String, String> attributes,
        Long beforeSiblingId) {}

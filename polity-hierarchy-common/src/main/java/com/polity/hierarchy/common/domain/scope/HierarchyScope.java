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

package com.polity.hierarchy.common.domain.scope;

import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One independent hierarchy tree, identified by its tenant and country or organisational domain. The row doubles as
 * the lock that serializes structural writes to the tree.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Data
@Entity
@NoArgsConstructor
public class HierarchyScope {

    private Instant createdTimestamp;

    private String domainCode;

    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Id
    private Long id;

    private Instant modifiedTimestamp;

    private boolean propagationSuspended;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    private ScopeStatus status = ScopeStatus.ACTIVE;

    private String statusReason;

    private String tenant;

    public boolean isQuarantined() {
        return status == ScopeStatus.QUARANTINED;
    }

    public String toKey() {
        return tenant + "/" + domainCode;
    }
}

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

package com.polity.hierarchy.common.domain.node;

import com.polity.hierarchy.common.converter.AttributesConverter;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An administrative or organisational unit. The {@code [leftBound, rightBound]} interval is the canonical encoding of
 * ancestry: an ancestor's interval strictly contains the intervals of all of its descendants. {@code path} and
 * {@code depth} are derived from it, and the counters are cumulative over the node's subtree.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Data
@Entity
@NoArgsConstructor
public class HierarchyNode {

    private boolean active;

    private long activeCount;

    @Convert(converter = AttributesConverter.class)
    private Map<String, String> attributes;

    private String code;

    private Instant createdTimestamp;

    private int depth;

    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Id
    private Long id;

    private long leftBound;

    private Instant modifiedTimestamp;

    private String name;

    private Long parentId;

    private String path;

    private long rightBound;

    private long scopeId;

    private long totalCount;

    private int unitLevel;

    private String unitType;

    private Instant validFrom;

    private Instant validTo;

    public NodeRange getRange() {
        return new NodeRange(leftBound, rightBound);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * @return the number of nodes in this node's subtree, itself included
     */
    public long getSubtreeSize() {
        return (rightBound - leftBound + 1) / 2;
    }
}

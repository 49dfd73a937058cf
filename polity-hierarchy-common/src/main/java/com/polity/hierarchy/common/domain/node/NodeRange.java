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

/**
 * A nested interval. Two ranges of the same scope are valid only if one contains the other or they are disjoint.
 */
public record NodeRange(long left, long right) {

    public boolean contains(NodeRange other) {
        return left <= other.left && right >= other.right;
    }

    public boolean strictlyContains(NodeRange other) {
        return left < other.left && right > other.right;
    }

    public boolean isDisjoint(NodeRange other) {
        return right < other.left || other.right < left;
    }

    public boolean isWellFormed() {
        return left < right;
    }

    /**
     * @return true if the ranges intersect without one nesting inside the other
     */
    public boolean partiallyOverlaps(NodeRange other) {
        return !isDisjoint(other) && !contains(other) && !other.contains(this);
    }

    public long width() {
        return right - left + 1;
    }

    @Override
    public String toString() {
        return "[" + left + ", " + right + "]";
    }
}

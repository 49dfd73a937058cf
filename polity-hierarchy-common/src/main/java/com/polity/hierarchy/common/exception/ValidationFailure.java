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

package com.polity.hierarchy.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The placement or counter rule that rejected a request. The message is a format string filled in by the rule that
 * failed so callers receive an actionable reason.
 */
@Getter
@RequiredArgsConstructor
public enum ValidationFailure {
    CAPACITY_EXCEEDED("Parent %s already has %d active children of type %s, the maximum is %d"),
    COUNTER_UNDERFLOW("Delta (total %d, active %d) on node %d would make a counter on its ancestor chain negative"),
    CYCLE_DETECTED("Node %d cannot be moved under %d since the destination lies within its own subtree"),
    DUPLICATE_CODE("Code %s is already used by a sibling under parent %s"),
    INVALID_POSITION("Node %d is not a child of %d and cannot be used as an insertion point"),
    INVALID_RULES("Level rules are invalid: %s"),
    PARENT_INACTIVE("Parent %d is inactive"),
    PARENT_NOT_FOUND("Parent %d does not exist"),
    ROOT_EXISTS("Scope %d already has root node %d"),
    ROOT_IMMOVABLE("Node %d is the root of scope %d and cannot be reparented"),
    SCOPE_EXISTS("Scope %s already exists"),
    SCOPE_MISMATCH("Scope %d of the node does not match scope %d of its parent"),
    SCOPE_NOT_FOUND("Scope %d does not exist"),
    TEMPORAL_VIOLATION("Validity window [%s, %s] is not within the parent window [%s, %s]"),
    TYPE_NOT_PERMITTED("Unit type %s is not permitted under %s in scope %d");

    private final String message;

    public String format(Object... arguments) {
        return String.format(message, arguments);
    }
}

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

package com.polity.hierarchy.common.domain.membership;

/**
 * Lifecycle states owned by the external membership system. Every state except {@link #ARCHIVED} counts towards a
 * node's total; only {@link #ACTIVE} counts towards its active total.
 */
public enum MembershipState {
    PENDING,
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    ARCHIVED;

    public static boolean isCounted(MembershipState state) {
        return state != null && state != ARCHIVED;
    }

    public static boolean isActive(MembershipState state) {
        return state == ACTIVE;
    }
}

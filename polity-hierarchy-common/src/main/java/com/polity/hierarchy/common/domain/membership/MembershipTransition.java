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
 * A membership state change emitted by the membership system. A null {@code oldState} is a new membership and a null
 * {@code newState} a removed one.
 */
public record MembershipTransition(String memberId, long nodeId, MembershipState oldState, MembershipState newState) {

    public long totalDelta() {
        return signum(MembershipState.isCounted(oldState), MembershipState.isCounted(newState));
    }

    public long activeDelta() {
        return signum(MembershipState.isActive(oldState), MembershipState.isActive(newState));
    }

    public boolean isNoop() {
        return totalDelta() == 0 && activeDelta() == 0;
    }

    private static long signum(boolean before, boolean after) {
        if (before == after) {
            return 0L;
        }
        return after ? 1L : -1L;
    }
}

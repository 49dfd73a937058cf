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

package com.polity.hierarchy.engine.reconciliation;

import java.util.Map;

/**
 * Read access to the membership system's records, used as the source of truth when recomputing counters.
 */
public interface MembershipLedger {

    /**
     * @return the counted and active memberships assigned directly to each node of the scope, keyed by node id. Nodes
     * without memberships may be omitted.
     */
    Map<Long, MembershipTally> tally(long scopeId);

    record MembershipTally(long total, long active) {

        public static final MembershipTally ZERO = new MembershipTally(0L, 0L);

        public MembershipTally plus(MembershipTally other) {
            return new MembershipTally(total + other.total, active + other.active);
        }
    }
}

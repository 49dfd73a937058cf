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

import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcOperations;

/**
 * Tallies memberships with a configurable aggregate query against the membership system's tables. Due to the number of
 * rows involved, it's considerably more performant to not use JPA.
 */
@RequiredArgsConstructor
public class JdbcMembershipLedger implements MembershipLedger {

    private final JdbcOperations jdbcOperations;
    private final ReconciliationProperties reconciliationProperties;

    @Override
    public Map<Long, MembershipTally> tally(long scopeId) {
        var tally = new HashMap<Long, MembershipTally>();
        jdbcOperations.query(
                reconciliationProperties.getMembershipQuery(),
                rs -> {
                    long nodeId = rs.getLong(1);
                    long total = rs.getLong(2);
                    long active = rs.getLong(3);
                    tally.merge(nodeId, new MembershipTally(total, active), MembershipTally::plus);
                },
                scopeId);
        return tally;
    }
}

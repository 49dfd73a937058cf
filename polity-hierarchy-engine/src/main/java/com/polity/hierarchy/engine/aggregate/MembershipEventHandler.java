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

package com.polity.hierarchy.engine.aggregate;

import com.polity.hierarchy.common.domain.membership.MembershipTransfer;
import com.polity.hierarchy.common.domain.membership.MembershipTransition;
import jakarta.inject.Named;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;

/**
 * Consumes membership lifecycle events published by the membership system. Listeners run synchronously on the
 * publishing thread so the counter update joins the transaction that changed the membership, and a rejected delta
 * rolls that change back.
 */
@CustomLog
@Named
@RequiredArgsConstructor
public class MembershipEventHandler {

    private final StatisticsAggregator statisticsAggregator;

    @EventListener
    public void onTransition(MembershipTransition transition) {
        log.trace("Received {}", transition);
        statisticsAggregator.onTransition(transition);
    }

    @EventListener
    public void onTransfer(MembershipTransfer transfer) {
        log.trace("Received {}", transfer);
        statisticsAggregator.transfer(transfer);
    }
}

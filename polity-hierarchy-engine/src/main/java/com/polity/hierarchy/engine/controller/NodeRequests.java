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

package com.polity.hierarchy.engine.controller;

import com.polity.hierarchy.common.domain.membership.MembershipState;
import com.polity.hierarchy.common.domain.membership.MembershipTransfer;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Request bodies of the node endpoints.
 */
final class NodeRequests {

    private NodeRequests() {}

    record Deactivate(Instant at) {}

    record Reparent(@NotNull Long parentId) {}

    record Delta(long totalDelta, long activeDelta) {}

    record DeltaResult(long nodeId, boolean applied) {}

    record Transfer(
            @NotBlank String memberId, @NotNull Long fromNodeId, @NotNull Long toNodeId, @NotNull MembershipState state) {

        MembershipTransfer toTransfer() {
            return new MembershipTransfer(memberId, fromNodeId, toNodeId, state);
        }
    }

    record TransferResult(boolean applied) {}
}

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

import com.polity.hierarchy.common.domain.job.ReconciliationStatus;
import java.time.Duration;
import java.util.List;
import lombok.Builder;

@Builder
public record ReconciliationReport(
        long scopeId,
        ReconciliationStatus status,
        int nodesExamined,
        List<CounterCorrection> counterCorrections,
        List<PathCorrection> pathCorrections,
        long skipped,
        List<String> violations,
        Duration elapsed) {

    /**
     * @return the number of corrections written, excluding those skipped because the value changed concurrently
     */
    public long getApplied() {
        return (long) counterCorrections.size() + pathCorrections.size();
    }
}

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

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component("reconciliationProperties")
@Data
@Validated
@ConfigurationProperties("polity.hierarchy.reconciliation")
public class ReconciliationProperties {

    @NotBlank
    private String cron = "0 0 2 * * *"; // Every day at 2am

    private boolean enabled = true;

    // Must return node_id, total and active columns, one row per directly assigned node, for the scope id parameter
    @NotBlank
    private String membershipQuery =
            """
            select m.node_id, count(*) as total, count(case when m.state = 'ACTIVE' then 1 end) as active
            from membership m
            join hierarchy_node n on n.id = m.node_id
            where n.scope_id = ? and m.state <> 'ARCHIVED'
            group by m.node_id""";
}

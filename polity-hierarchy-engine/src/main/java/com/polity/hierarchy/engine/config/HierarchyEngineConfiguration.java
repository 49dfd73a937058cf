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

package com.polity.hierarchy.engine.config;

import com.polity.hierarchy.engine.lock.ScopeMutationAspect;
import com.polity.hierarchy.engine.reconciliation.JdbcMembershipLedger;
import com.polity.hierarchy.engine.reconciliation.MembershipLedger;
import com.polity.hierarchy.engine.reconciliation.ReconciliationProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EntityScan("com.polity.hierarchy.common.domain")
@EnableJpaRepositories("com.polity.hierarchy.engine.repository")
public class HierarchyEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    MembershipLedger membershipLedger(
            JdbcOperations jdbcOperations, ReconciliationProperties reconciliationProperties) {
        return new JdbcMembershipLedger(jdbcOperations, reconciliationProperties);
    }

    @Bean
    ScopeMutationAspect scopeMutationAspect(MeterRegistry meterRegistry) {
        return new ScopeMutationAspect(meterRegistry);
    }

    @Configuration
    @ConditionalOnProperty(
            prefix = "spring.task.scheduling",
            name = "enabled",
            havingValue = "true",
            matchIfMissing = true)
    @EnableScheduling
    protected static class SchedulingConfiguration {}
}

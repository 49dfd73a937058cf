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

package com.polity.hierarchy.engine.repository;

import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import java.util.Optional;
import org.springframework.data.repository.CrudRepository;

public interface HierarchyScopeRepository extends CrudRepository<HierarchyScope, Long> {

    Optional<HierarchyScope> findByTenantAndDomainCode(String tenant, String domainCode);
}

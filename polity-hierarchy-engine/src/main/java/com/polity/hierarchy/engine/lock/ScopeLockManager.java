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

package com.polity.hierarchy.engine.lock;

import com.polity.hierarchy.common.domain.scope.HierarchyScope;
import com.polity.hierarchy.common.exception.IntegrityViolationException;
import com.polity.hierarchy.common.exception.ScopeNotFoundException;
import com.polity.hierarchy.engine.config.HierarchyProperties;
import jakarta.inject.Named;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.CustomLog;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Serializes writers through the scope row. Structural mutations take it exclusively since they may shift any bound in
 * the tree, while counter mutations take it shared since range predicate increments commute. Locks are released when
 * the surrounding transaction ends.
 */
@CustomLog
@Named
@RequiredArgsConstructor
public class ScopeLockManager {

    static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    private final EntityManager entityManager;
    private final HierarchyProperties hierarchyProperties;

    /**
     * Locks a scope for a structural mutation, refusing quarantined scopes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public HierarchyScope lockExclusive(long scopeId) {
        var scope = lock(scopeId, LockModeType.PESSIMISTIC_WRITE);
        if (scope.isQuarantined()) {
            throw new IntegrityViolationException(
                    scopeId, "Scope " + scopeId + " is quarantined: " + scope.getStatusReason());
        }
        return scope;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public HierarchyScope lockShared(long scopeId) {
        return lock(scopeId, LockModeType.PESSIMISTIC_READ);
    }

    /**
     * Takes shared locks on several scopes in ascending id order so concurrent callers cannot deadlock each other.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<HierarchyScope> lockShared(Collection<Long> scopeIds) {
        return scopeIds.stream().distinct().sorted().map(this::lockShared).toList();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public HierarchyScope lock(long scopeId, LockModeType lockMode) {
        var hints = Map.<String, Object>of(
                LOCK_TIMEOUT_HINT, hierarchyProperties.getLockTimeout().toMillis());
        var scope = entityManager.find(HierarchyScope.class, scopeId, lockMode, hints);
        if (scope == null) {
            throw new ScopeNotFoundException(scopeId);
        }
        log.trace("Acquired {} lock on scope {}", lockMode, scopeId);
        return scope;
    }
}

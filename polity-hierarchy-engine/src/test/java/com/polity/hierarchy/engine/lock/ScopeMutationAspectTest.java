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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.polity.hierarchy.common.exception.ConcurrencyConflictException;
import com.polity.hierarchy.common.exception.ValidationException;
import com.polity.hierarchy.common.exception.ValidationFailure;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.persistence.LockTimeoutException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

@ExtendWith(MockitoExtension.class)
class ScopeMutationAspectTest {

    @Mock
    private ProceedingJoinPoint joinPoint;

    @Mock
    private ScopeMutation scopeMutation;

    private SimpleMeterRegistry meterRegistry;
    private ScopeMutationAspect scopeMutationAspect;

    @BeforeEach
    void setup() {
        meterRegistry = new SimpleMeterRegistry();
        scopeMutationAspect = new ScopeMutationAspect(meterRegistry);
        when(scopeMutation.value()).thenReturn("createNode");
    }

    @Test
    void success() throws Throwable {
        when(joinPoint.proceed()).thenReturn("node");

        assertThat(scopeMutationAspect.mutate(joinPoint, scopeMutation)).isEqualTo("node");
        assertThat(count("success")).isOne();
    }

    @ParameterizedTest
    @ValueSource(strings = {"lock", "pessimistic", "query", "transaction", "jpa"})
    void conflict(String type) throws Throwable {
        var cause = switch (type) {
            case "lock" -> new CannotAcquireLockException("lock");
            case "pessimistic" -> new PessimisticLockingFailureException("pessimistic");
            case "query" -> new QueryTimeoutException("query");
            case "transaction" -> new TransactionTimedOutException("transaction");
            default -> new LockTimeoutException("jpa");
        };
        when(joinPoint.proceed()).thenThrow(cause);

        assertThatThrownBy(() -> scopeMutationAspect.mutate(joinPoint, scopeMutation))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasCause(cause)
                .hasMessageContaining("createNode");
        assertThat(count("conflict")).isOne();
    }

    @Test
    void failure() throws Throwable {
        var cause = new ValidationException(ValidationFailure.PARENT_INACTIVE, 1L);
        when(joinPoint.proceed()).thenThrow(cause);

        assertThatThrownBy(() -> scopeMutationAspect.mutate(joinPoint, scopeMutation))
                .isSameAs(cause);
        assertThat(count("failure")).isOne();
        assertThat(count("conflict")).isZero();
    }

    private long count(String outcome) {
        var timer = meterRegistry
                .find(ScopeMutationAspect.METRIC)
                .tag("operation", "createNode")
                .tag("outcome", outcome)
                .timer();
        return timer != null ? timer.count() : 0L;
    }
}

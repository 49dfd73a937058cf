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

import com.polity.hierarchy.common.exception.ConcurrencyConflictException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import lombok.CustomLog;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.annotation.Order;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Runs outside the transaction advice so that failures raised while acquiring the scope lock, executing a statement or
 * committing all surface as a single conflict type. The transaction has been rolled back by the time it is translated.
 */
@Aspect
@CustomLog
@Order(1)
public class ScopeMutationAspect {

    static final String METRIC = "polity.hierarchy.mutation";

    private final MeterRegistry meterRegistry;

    public ScopeMutationAspect(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Around("execution(@com.polity.hierarchy.engine.lock.ScopeMutation * *(..)) && @annotation(scopeMutation)")
    public Object mutate(ProceedingJoinPoint joinPoint, ScopeMutation scopeMutation) throws Throwable {
        var sample = Timer.start(meterRegistry);
        var outcome = "success";

        try {
            return joinPoint.proceed();
        } catch (ConcurrencyFailureException
                | QueryTimeoutException
                | TransactionTimedOutException
                | LockTimeoutException
                | PessimisticLockException e) {
            outcome = "conflict";
            var operation = scopeMutation.value();
            log.warn("Unable to {} due to concurrent access: {}", operation, e.getMessage());
            throw new ConcurrencyConflictException("Concurrent modification prevented " + operation, e);
        } catch (Throwable t) {
            outcome = "failure";
            throw t;
        } finally {
            sample.stop(Timer.builder(METRIC)
                    .description("The time it takes to mutate a hierarchy scope")
                    .tag("operation", scopeMutation.value())
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }
}

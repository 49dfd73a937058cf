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

package com.polity.hierarchy.engine.validation;

import com.polity.hierarchy.common.exception.ValidationException;
import com.polity.hierarchy.common.exception.ValidationFailure;
import java.util.function.Supplier;

public record ValidationResult(boolean accepted, ValidationFailure failure, String reason) {

    private static final ValidationResult ACCEPTED = new ValidationResult(true, null, null);

    public static ValidationResult accept() {
        return ACCEPTED;
    }

    public static ValidationResult reject(ValidationFailure failure, Object... arguments) {
        return new ValidationResult(false, failure, failure.format(arguments));
    }

    public ValidationResult and(Supplier<ValidationResult> next) {
        return accepted ? next.get() : this;
    }

    public void orElseThrow() {
        if (!accepted) {
            throw new ValidationException(failure, reason);
        }
    }
}

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

package com.polity.hierarchy.common.exception;

import java.io.Serial;
import lombok.Getter;

@Getter
public class ValidationException extends HierarchyException {

    @Serial
    private static final long serialVersionUID = -2850134455329180467L;

    private final ValidationFailure failure;

    public ValidationException(ValidationFailure failure, Object... arguments) {
        super(failure.format(arguments));
        this.failure = failure;
    }

    public ValidationException(ValidationFailure failure, String reason) {
        super(reason);
        this.failure = failure;
    }
}

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

public abstract class HierarchyException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4163318710398546062L;

    protected HierarchyException(String message) {
        super(message);
    }

    protected HierarchyException(Throwable throwable) {
        super(throwable);
    }

    protected HierarchyException(String message, Throwable throwable) {
        super(message, throwable);
    }
}

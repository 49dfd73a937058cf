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

package com.polity.hierarchy.engine.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public record ApiError(Status status) {

    public static ApiError of(String message, String detail, String code) {
        return new ApiError(new Status(List.of(new Message(code, detail, message))));
    }

    public static ApiError of(List<Message> messages) {
        return new ApiError(new Status(messages));
    }

    public record Status(List<Message> messages) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Message(String code, String detail, String message) {}
}

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.polity.hierarchy.engine.HierarchyIntegrationTest;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
abstract class ControllerTest extends HierarchyIntegrationTest {

    private static final String BASE_PATH = "/api/v1/";

    protected RestClient restClient;

    @LocalServerPort
    private int port;

    @BeforeEach
    final void setupClient() {
        restClient = RestClient.builder()
                .baseUrl("http://localhost:%d%s".formatted(port, BASE_PATH))
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Asserts the request fails with the status and a single error message carrying the code and detail fragment.
     */
    protected final void validateError(ThrowingCallable callable, HttpStatus status, String code, String detail) {
        assertThatThrownBy(callable)
                .isInstanceOf(HttpStatusCodeException.class)
                .asInstanceOf(InstanceOfAssertFactories.type(HttpStatusCodeException.class))
                .satisfies(e -> assertThat(e.getStatusCode()).isEqualTo(status))
                .extracting(e -> e.getResponseBodyAs(ApiError.class).status().messages())
                .asInstanceOf(InstanceOfAssertFactories.list(ApiError.Message.class))
                .singleElement()
                .satisfies(m -> {
                    assertThat(m.code()).isEqualTo(code);
                    assertThat(m.message()).isEqualTo(status.getReasonPhrase());
                    assertThat(m.detail()).contains(detail);
                });
    }
}

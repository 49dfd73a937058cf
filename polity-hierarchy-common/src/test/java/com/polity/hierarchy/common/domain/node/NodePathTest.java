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

package com.polity.hierarchy.common.domain.node;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class NodePathTest {

    @Test
    void of() {
        assertThat(NodePath.of(List.of(1L, 5L, 9L))).isEqualTo("/1/5/9/");
        assertThat(NodePath.of(List.of())).isEqualTo("/");
    }

    @Test
    void append() {
        assertThat(NodePath.append("/1/5/", 55L)).isEqualTo("/1/5/55/");
        assertThat(NodePath.append(null, 1L)).isEqualTo("/1/");
    }

    @Test
    void prefixDoesNotMatchSiblingWithSharedDigits() {
        var path = NodePath.append("/1/", 5L);
        var other = NodePath.append("/1/", 55L);
        assertThat(other).doesNotStartWith(path);
    }
}

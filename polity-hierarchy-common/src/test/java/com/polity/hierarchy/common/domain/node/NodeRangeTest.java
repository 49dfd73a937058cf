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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NodeRangeTest {

    @Test
    void nested() {
        var parent = new NodeRange(1, 10);
        var child = new NodeRange(2, 5);

        assertThat(parent.contains(child)).isTrue();
        assertThat(parent.strictlyContains(child)).isTrue();
        assertThat(parent.contains(parent)).isTrue();
        assertThat(parent.strictlyContains(parent)).isFalse();
        assertThat(child.contains(parent)).isFalse();
        assertThat(parent.partiallyOverlaps(child)).isFalse();
        assertThat(parent.width()).isEqualTo(10);
    }

    @ParameterizedTest
    @CsvSource({
        "1, 4, 5, 8, false, true",
        "1, 6, 5, 8, true, false",
        "5, 8, 1, 6, true, false",
        "1, 8, 2, 3, false, false",
        "2, 3, 1, 8, false, false"
    })
    void overlap(long left1, long right1, long left2, long right2, boolean partial, boolean disjoint) {
        var first = new NodeRange(left1, right1);
        var second = new NodeRange(left2, right2);

        assertThat(first.partiallyOverlaps(second)).isEqualTo(partial);
        assertThat(first.isDisjoint(second)).isEqualTo(disjoint);
    }

    @Test
    void wellFormed() {
        assertThat(new NodeRange(1, 2).isWellFormed()).isTrue();
        assertThat(new NodeRange(3, 3).isWellFormed()).isFalse();
        assertThat(new NodeRange(4, 3).isWellFormed()).isFalse();
        assertThat(new NodeRange(1, 2)).hasToString("[1, 2]");
    }
}

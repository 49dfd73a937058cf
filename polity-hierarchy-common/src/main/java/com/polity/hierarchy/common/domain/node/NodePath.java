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

import java.util.List;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/**
 * Serialized ancestor chain. Every id is enclosed in separators, {@code /1/5/9/}, so a prefix match on a node's path
 * selects exactly its subtree.
 */
@UtilityClass
public class NodePath {

    public static final String SEPARATOR = "/";

    public static String of(List<Long> ids) {
        if (ids.isEmpty()) {
            return SEPARATOR;
        }
        return ids.stream().map(String::valueOf).collect(Collectors.joining(SEPARATOR, SEPARATOR, SEPARATOR));
    }

    public static String append(String parentPath, long id) {
        var base = StringUtils.isEmpty(parentPath) ? SEPARATOR : parentPath;
        return base + id + SEPARATOR;
    }
}

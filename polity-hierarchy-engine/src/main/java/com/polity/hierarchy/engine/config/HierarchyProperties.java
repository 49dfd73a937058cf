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

package com.polity.hierarchy.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component("hierarchyProperties")
@Data
@Validated
@ConfigurationProperties("polity.hierarchy")
public class HierarchyProperties {

    @DurationMin(seconds = 1)
    @NotNull
    private Duration counterTimeout = Duration.ofSeconds(10L);

    @DurationMin(millis = 0)
    @NotNull
    private Duration lockTimeout = Duration.ofSeconds(5L);

    @DurationMin(seconds = 1)
    @NotNull
    private Duration structuralTimeout = Duration.ofSeconds(30L);

    // Named sets of level rules that a scope can be provisioned from
    @NotNull
    private Map<String, List<@Valid LevelRuleProperties>> templates = new LinkedHashMap<>();

    public List<LevelRuleProperties> getTemplate(String name) {
        var template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Unknown level rule template " + name);
        }
        return template;
    }

    @Data
    public static class LevelRuleProperties {

        @Min(0)
        private Integer maxCount;

        @Min(0)
        private int minCount = 0;

        @NotBlank
        private String type;

        @Min(0)
        private int level;

        private String parentType;
    }
}

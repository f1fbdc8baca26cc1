package me.golemcore.discovery.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit of work created by an agent's strategy and owned by that agent until it
 * completes or the agent stops.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryTask {

    private String id;
    private String type;
    private Instant createdAt;

    @Builder.Default
    private int priority = 5;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    /**
     * Depth of self-spawned work, {@code null} for top-level tasks.
     */
    private Integer recursionDepth;

    @Builder.Default
    private List<String> explorationPath = new ArrayList<>();
}

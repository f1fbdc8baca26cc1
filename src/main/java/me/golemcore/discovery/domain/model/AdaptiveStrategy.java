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

/**
 * Strategy hints an agent's task generation reads on every cycle. Written by
 * the agent itself and by orchestrator coordination routines.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AdaptiveStrategy {

    @Builder.Default
    private String approach = "balanced";

    @Builder.Default
    private String scope = "normal";

    @Builder.Default
    private String collaboration = "medium";

    @Builder.Default
    private String riskTolerance = "medium";

    @Builder.Default
    private String searchDepth = "normal";

    public static AdaptiveStrategy defaults() {
        return AdaptiveStrategy.builder().build();
    }

    public AdaptiveStrategy copy() {
        return toBuilder().build();
    }
}

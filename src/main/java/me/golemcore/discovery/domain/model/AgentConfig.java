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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-agent scheduling and collaboration settings. Persisted as part of the
 * agent snapshot; fields missing from a stored snapshot keep their defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfig {

    @Builder.Default
    private long autonomousInterval = 30_000L;

    @Builder.Default
    private List<Long> adaptiveIntervalRange = new ArrayList<>(List.of(10_000L, 120_000L));

    @Builder.Default
    private int maxConcurrentTasks = 3;

    @Builder.Default
    private double collaborationThreshold = 0.6;

    @Builder.Default
    private boolean selfHealingEnabled = true;

    @Builder.Default
    private boolean persistentState = true;

    @Builder.Default
    private int maxRecoveryAttempts = 3;

    @JsonIgnore
    public long intervalFloor() {
        return adaptiveIntervalRange.get(0);
    }

    @JsonIgnore
    public long intervalCeiling() {
        return adaptiveIntervalRange.get(1);
    }

    public AgentConfig copy() {
        return toBuilder()
                .adaptiveIntervalRange(new ArrayList<>(adaptiveIntervalRange))
                .build();
    }
}

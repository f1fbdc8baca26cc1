package me.golemcore.discovery.domain.agent;

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

import java.time.Duration;

/**
 * Fixed periods of an agent's background timers.
 *
 * @param diagnosticsPeriod
 *            how often self-diagnostics run
 * @param performancePeriod
 *            length of the window discovery rates are measured over
 */
public record AgentTimings(Duration diagnosticsPeriod, Duration performancePeriod) {

    public static final AgentTimings DEFAULT = new AgentTimings(Duration.ofSeconds(30), Duration.ofMinutes(1));
}

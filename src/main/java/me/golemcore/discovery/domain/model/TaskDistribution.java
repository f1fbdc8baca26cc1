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

/**
 * Aggregate view of what running agents are working on.
 *
 * @param overlap
 *            share of active task types that more than one agent is running
 * @param coverage
 *            share of the fleet's known task types that are active at all
 * @param efficiency
 *            mean success rate of the running agents
 */
public record TaskDistribution(double overlap, double coverage, double efficiency) {
}

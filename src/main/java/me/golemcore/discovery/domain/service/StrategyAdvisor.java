package me.golemcore.discovery.domain.service;

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

import me.golemcore.discovery.domain.agent.DiscoveryAgent;
import me.golemcore.discovery.domain.model.AgentStatusView;
import me.golemcore.discovery.domain.model.DiscoveryTask;
import me.golemcore.discovery.domain.model.PerformanceMetrics;
import me.golemcore.discovery.domain.model.StrategyAdaptation;
import me.golemcore.discovery.domain.model.TaskDistribution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fleet-level heuristics used by the orchestrator's coordination timers.
 */
@Component
public class StrategyAdvisor {

    private static final double MIN_COVERAGE = 0.8;
    private static final double MAX_OVERLAP = 0.3;
    private static final double LOW_SUCCESS_RATE = 0.5;
    private static final double LOW_DISCOVERY_RATE = 0.1;

    /**
     * Measure how the running agents' in-flight work is spread.
     *
     * <ul>
     * <li>overlap - share of in-flight tasks whose type is already being worked
     * on by another task</li>
     * <li>coverage - share of the task types the fleet could have in flight at
     * once (its known types, capped by its combined task capacity) that are in
     * flight</li>
     * <li>efficiency - mean success rate</li>
     * </ul>
     */
    public TaskDistribution analyzeTaskDistribution(Collection<AgentStatusView> running, Set<String> knownTaskTypes,
            int taskCapacity) {
        List<String> active = running.stream()
                .flatMap(view -> view.activeTaskTypes().stream())
                .toList();
        Set<String> distinct = new HashSet<>(active);

        double overlap = active.isEmpty() ? 0.0 : (double) (active.size() - distinct.size()) / active.size();
        int reachable = Math.min(knownTaskTypes.size(), taskCapacity);
        double coverage = reachable <= 0 ? 1.0 : (double) distinct.size() / reachable;
        double efficiency = running.stream()
                .mapToDouble(view -> view.metrics().getSuccessRate())
                .average()
                .orElse(1.0);
        return new TaskDistribution(overlap, Math.min(coverage, 1.0), efficiency);
    }

    public List<StrategyAdaptation> calculateOptimalStrategy(TaskDistribution distribution) {
        return List.of(
                StrategyAdaptation.of(StrategyAdaptation.Type.SEARCH_DEPTH,
                        distribution.coverage() < MIN_COVERAGE ? "deep" : "normal"),
                StrategyAdaptation.of(StrategyAdaptation.Type.COLLABORATION_LEVEL,
                        distribution.overlap() > MAX_OVERLAP ? "high" : "medium"));
    }

    public List<StrategyAdaptation> calculateAdaptations(PerformanceMetrics performance) {
        List<StrategyAdaptation> adaptations = new ArrayList<>();
        if (performance.successRate() < LOW_SUCCESS_RATE) {
            adaptations.add(StrategyAdaptation.of(StrategyAdaptation.Type.STRATEGY, "conservative"));
        }
        if (performance.discoveryRate() < LOW_DISCOVERY_RATE) {
            adaptations.add(StrategyAdaptation.of(StrategyAdaptation.Type.SEARCH_SCOPE, "expanded"));
        }
        return adaptations;
    }

    /**
     * Tasks to hand an agent that just went idle. No fleet-level task source
     * exists yet, so nothing is assigned.
     */
    public List<DiscoveryTask> calculateOptimalTasks(DiscoveryAgent agent) {
        return List.of();
    }
}

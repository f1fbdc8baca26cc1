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

import me.golemcore.discovery.domain.agent.AgentTimings;
import me.golemcore.discovery.domain.agent.DiscoveryAgent;
import me.golemcore.discovery.domain.loop.EventLoop;
import me.golemcore.discovery.domain.model.AgentConfig;
import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.strategy.AgentStrategyFactory;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds agents configured from {@code discovery.agents.*}.
 */
@Component
@RequiredArgsConstructor
public class AgentFactory {

    private final AgentStrategyFactory strategyFactory;
    private final EventLoop eventLoop;
    private final Clock clock;
    private final DiscoveryProperties properties;

    /**
     * @param id
     *            fixed agent id, or {@code null} to generate one
     */
    public DiscoveryAgent create(AgentKind kind, String id) {
        DiscoveryProperties.AgentsProperties agents = properties.getAgents();
        return new DiscoveryAgent(id, strategyFactory.create(kind), defaultConfig(), eventLoop, clock,
                new AgentTimings(agents.getDiagnosticsPeriod(), agents.getPerformancePeriod()));
    }

    AgentConfig defaultConfig() {
        DiscoveryProperties.AgentsProperties agents = properties.getAgents();
        return AgentConfig.builder()
                .autonomousInterval(agents.getAutonomousInterval())
                .adaptiveIntervalRange(new ArrayList<>(List.of(agents.getMinInterval(), agents.getMaxInterval())))
                .maxConcurrentTasks(agents.getMaxConcurrentTasks())
                .collaborationThreshold(agents.getCollaborationThreshold())
                .selfHealingEnabled(agents.isSelfHealingEnabled())
                .persistentState(agents.isPersistentState())
                .maxRecoveryAttempts(agents.getMaxRecoveryAttempts())
                .build();
    }
}

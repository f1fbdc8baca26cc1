package me.golemcore.discovery.infrastructure.config;

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

import me.golemcore.discovery.domain.model.AgentKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the discovery fleet, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code discovery.*} prefix:
 * <ul>
 * <li>{@link AgentsProperties} - defaults applied to every agent</li>
 * <li>{@link OrchestratorProperties} - coordination timers and deep-analysis
 * trigger</li>
 * <li>{@link HealingProperties} - retry policy for unhealthy agents</li>
 * <li>{@link StorageProperties} - snapshot persistence</li>
 * <li>{@link FleetMember} - agents registered at startup</li>
 * <li>{@link SimulationProperties} - bundled simulated discovery source</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "discovery")
@Data
public class DiscoveryProperties {

    private AgentsProperties agents = new AgentsProperties();
    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private HealingProperties healing = new HealingProperties();
    private StorageProperties storage = new StorageProperties();
    private List<FleetMember> fleet = new ArrayList<>();
    private SimulationProperties simulation = new SimulationProperties();

    @Data
    public static class AgentsProperties {
        private long autonomousInterval = 30_000L;
        private long minInterval = 10_000L;
        private long maxInterval = 120_000L;
        private int maxConcurrentTasks = 3;
        private double collaborationThreshold = 0.6;
        private boolean selfHealingEnabled = true;
        private boolean persistentState = true;
        private int maxRecoveryAttempts = 3;
        private Duration diagnosticsPeriod = Duration.ofSeconds(30);
        private Duration performancePeriod = Duration.ofMinutes(1);
    }

    @Data
    public static class OrchestratorProperties {
        private boolean autoStart = true;
        private Duration redistributionPeriod = Duration.ofSeconds(60);
        private Duration adaptationPeriod = Duration.ofSeconds(300);
        private Duration healthCheckPeriod = Duration.ofSeconds(30);
        private AgentKind deepAnalysisKind = AgentKind.ASSET_SEEKER;
        private List<String> deepAnalysisIndicators = new ArrayList<>(List.of(
                "assetMovementPattern", "obscureDomainOwnership", "blockchainCrossLinks", "hiddenAssetClusters"));
        private double deepAnalysisThreshold = 0.7;
    }

    @Data
    public static class HealingProperties {
        private int maxRetries = 3;
        private double backoffMultiplier = 2.0;
        private long baseDelayMs = 1000L;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String stateDirectory = "state";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/discovery";
    }

    @Data
    public static class FleetMember {
        private AgentKind kind;
        private String id;
    }

    @Data
    public static class SimulationProperties {
        private Long seed;
        private double findingProbability = 0.6;
        private double failureProbability = 0.05;
        private Duration minLatency = Duration.ofSeconds(1);
        private Duration maxLatency = Duration.ofSeconds(6);
    }
}

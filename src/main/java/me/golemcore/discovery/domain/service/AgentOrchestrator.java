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

import me.golemcore.discovery.domain.agent.AgentEventListener;
import me.golemcore.discovery.domain.agent.DiscoveryAgent;
import me.golemcore.discovery.domain.loop.EventLoop;
import me.golemcore.discovery.domain.loop.ScheduledHandle;
import me.golemcore.discovery.domain.model.AgentSnapshot;
import me.golemcore.discovery.domain.model.AgentStatus;
import me.golemcore.discovery.domain.model.AgentStatusView;
import me.golemcore.discovery.domain.model.CollaborationRequest;
import me.golemcore.discovery.domain.model.DeepAnalysis;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.domain.model.FleetEvent;
import me.golemcore.discovery.domain.model.FleetEventType;
import me.golemcore.discovery.domain.model.HealthStatus;
import me.golemcore.discovery.domain.model.OrchestratorMetrics;
import me.golemcore.discovery.domain.model.OrchestratorStatus;
import me.golemcore.discovery.domain.model.StrategyAdaptation;
import me.golemcore.discovery.domain.model.TaskDistribution;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.infrastructure.event.SpringEventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Coordinates the discovery fleet.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>registers agents and relays their events as {@link FleetEvent}s</li>
 * <li>fans every discovery out to all other agents and triggers deep-whisper
 * scans</li>
 * <li>routes collaboration requests between agents</li>
 * <li>runs the redistribution, adaptation and health-poll timers</li>
 * <li>heals failing agents through the {@link HealingSupervisor}</li>
 * <li>saves and restores the flat state snapshot</li>
 * </ul>
 *
 * <p>
 * Every method must be called from the {@link EventLoop}; callers on other
 * threads hop onto it with {@link EventLoop#submit}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AgentOrchestrator {

    private final EventLoop eventLoop;
    private final Clock clock;
    private final DiscoveryProperties properties;
    private final OrchestratorStateStore stateStore;
    private final SpringEventBus eventBus;
    private final DeepAnalysisTrigger deepAnalysisTrigger;
    private final StrategyAdvisor strategyAdvisor;
    private final HealingSupervisor healingSupervisor;

    private final Map<String, DiscoveryAgent> agents = new LinkedHashMap<>();
    private final OrchestratorMetrics metrics = OrchestratorMetrics.builder().build();
    private Map<String, AgentSnapshot> persistedState = new LinkedHashMap<>();

    private AgentStatus status = AgentStatus.IDLE;
    private Instant startTime;
    private ScheduledHandle redistributionTimer;
    private ScheduledHandle adaptationTimer;
    private ScheduledHandle healthTimer;

    public AgentOrchestrator(EventLoop eventLoop, Clock clock, DiscoveryProperties properties,
            OrchestratorStateStore stateStore, SpringEventBus eventBus, DeepAnalysisTrigger deepAnalysisTrigger,
            StrategyAdvisor strategyAdvisor) {
        this.eventLoop = eventLoop;
        this.clock = clock;
        this.properties = properties;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.deepAnalysisTrigger = deepAnalysisTrigger;
        this.strategyAdvisor = strategyAdvisor;
        this.healingSupervisor = new HealingSupervisor(eventLoop, clock, properties.getHealing(), agents::get,
                new HealingOutcomePublisher());
    }

    // ==================== Registration ====================

    /**
     * Register an agent, restoring its persisted state when present.
     *
     * @throws IllegalArgumentException
     *             if an agent with the same id is already registered
     */
    public void registerAgent(DiscoveryAgent agent) {
        String agentId = agent.getId();
        if (agents.containsKey(agentId)) {
            throw new IllegalArgumentException("Agent already registered: " + agentId);
        }

        AgentSnapshot snapshot = persistedState.get(agentId);
        if (snapshot != null && agent.getConfig().isPersistentState()) {
            agent.restoreState(snapshot);
        }

        agent.setListener(new AgentEventRelay(agentId));
        agents.put(agentId, agent);
        log.info("[Orchestrator] Registered agent {} ({})", agentId, agent.getType());
        publish(FleetEventType.BOT_REGISTERED, agentId, Map.of("type", agent.getType()));
    }

    // ==================== Lifecycle ====================

    /**
     * Start every registered agent and the coordination timers. An agent that
     * fails to start is handed to healing; the others keep running.
     *
     * @throws IllegalStateException
     *             if operations are already running
     */
    public void startAutonomousOperations() {
        if (status == AgentStatus.RUNNING) {
            throw new IllegalStateException("Autonomous operations already running");
        }

        status = AgentStatus.STARTING;
        startTime = clock.instant();
        log.info("[Orchestrator] Starting autonomous operations with {} agents", agents.size());

        for (DiscoveryAgent agent : List.copyOf(agents.values())) {
            try {
                agent.startAutonomous();
            } catch (RuntimeException e) {
                log.error("[Orchestrator] Failed to start agent {}: {}", agent.getId(), e.getMessage());
                healingSupervisor.scheduleHealing(agent.getId(), e);
            }
        }

        startCoordinationRoutines();
        status = AgentStatus.RUNNING;
        publish(FleetEventType.OPERATIONS_STARTED, null, Map.of("agents", agents.size()));
    }

    /**
     * Stop every agent, cancel coordination timers and pending healing, then
     * save the snapshot. Agent failures are logged and never propagated.
     */
    public void stopAutonomousOperations() {
        if (status == AgentStatus.IDLE) {
            log.debug("[Orchestrator] Autonomous operations not running");
            return;
        }

        status = AgentStatus.STOPPING;
        log.info("[Orchestrator] Stopping autonomous operations");

        for (DiscoveryAgent agent : List.copyOf(agents.values())) {
            try {
                agent.stopGracefully();
            } catch (RuntimeException e) {
                log.error("[Orchestrator] Failed to stop agent {}: {}", agent.getId(), e.getMessage());
            }
        }

        clearCoordinationRoutines();
        healingSupervisor.cancelAll();
        savePersistentState();

        status = AgentStatus.IDLE;
        publish(FleetEventType.OPERATIONS_STOPPED, null, Map.of("agents", agents.size()));
    }

    private void startCoordinationRoutines() {
        DiscoveryProperties.OrchestratorProperties settings = properties.getOrchestrator();
        redistributionTimer = scheduleRepeating(this::redistributeTasks, settings.getRedistributionPeriod());
        adaptationTimer = scheduleRepeating(this::adaptAgentStrategies, settings.getAdaptationPeriod());
        healthTimer = scheduleRepeating(this::performHealthChecks, settings.getHealthCheckPeriod());
    }

    private ScheduledHandle scheduleRepeating(Runnable routine, Duration period) {
        return eventLoop.scheduleAtFixedRate(routine, period, period);
    }

    private void clearCoordinationRoutines() {
        for (ScheduledHandle timer : new ScheduledHandle[] { redistributionTimer, adaptationTimer, healthTimer }) {
            if (timer != null) {
                timer.cancel();
            }
        }
        redistributionTimer = null;
        adaptationTimer = null;
        healthTimer = null;
    }

    // ==================== Agent events ====================

    void handleDiscovery(String agentId, Discovery discovery) {
        metrics.setTotalDiscoveries(metrics.getTotalDiscoveries() + 1);

        for (DiscoveryAgent peer : List.copyOf(agents.values())) {
            if (peer.getId().equals(agentId)) {
                continue;
            }
            try {
                peer.processCollaborativeDiscovery(discovery, agentId);
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] {} failed to process discovery from {}: {}", peer.getId(), agentId,
                        e.getMessage());
                publish(FleetEventType.ERROR, peer.getId(), Map.of("error", String.valueOf(e.getMessage())));
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("discoveryId", discovery.id());
        payload.put("type", discovery.type());
        payload.put("confidence", discovery.confidence());
        payload.put("agentType", discovery.agentType());

        // deep-whisper results are never re-analyzed
        if (!DiscoveryAgent.DEEP_WHISPER_TYPE.equals(discovery.type()) && deepAnalysisTrigger.shouldAnalyze(discovery)) {
            try {
                triggerDeepWhisperScan(discovery);
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] Deep-whisper scan of {} failed: {}", discovery.id(), e.getMessage());
            }
        }

        publish(FleetEventType.DISCOVERY, agentId, payload);
    }

    void handleCollaborationRequest(String requestingAgentId, CollaborationRequest request) {
        publish(FleetEventType.COLLABORATION_REQUEST, requestingAgentId,
                Map.of("target", String.valueOf(request.targetAgentId()), "type", String.valueOf(request.type())));

        DiscoveryAgent target = request.targetAgentId() != null ? agents.get(request.targetAgentId()) : null;
        if (target == null) {
            log.warn("[Orchestrator] Dropping collaboration request from {} to unknown agent {}", requestingAgentId,
                    request.targetAgentId());
            return;
        }

        boolean accepted = target.handleCollaborationRequest(requestingAgentId, request);
        metrics.setCollaborations(metrics.getCollaborations() + 1);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requester", requestingAgentId);
        payload.put("target", target.getId());
        payload.put("type", request.type());
        payload.put("accepted", accepted);
        publish(FleetEventType.COLLABORATION, requestingAgentId, payload);
    }

    void handleStatusChange(String agentId, AgentStatus agentStatus) {
        log.info("[Orchestrator] Agent {} status changed to {}", agentId, agentStatus);
        if (agentStatus == AgentStatus.IDLE) {
            assignAdaptiveTasks(agentId);
        }
        publish(FleetEventType.STATUS_CHANGE, agentId, Map.of("status", agentStatus.name()));
    }

    void handleAgentError(String agentId, Throwable error) {
        log.error("[Orchestrator] Agent {} error: {}", agentId, error.getMessage());
        publish(FleetEventType.BOT_ERROR, agentId, Map.of("error", String.valueOf(error.getMessage())));
        healingSupervisor.scheduleHealing(agentId, error);
    }

    private void assignAdaptiveTasks(String agentId) {
        DiscoveryAgent agent = agents.get(agentId);
        if (agent == null) {
            return;
        }
        agent.assignTasks(strategyAdvisor.calculateOptimalTasks(agent));
    }

    // ==================== Deep whisper ====================

    /**
     * Run a deep analysis of a discovery on an available agent, preferring the
     * configured deep-analysis kind.
     *
     * @return the analysis, or empty when no agent is available or the
     *         analyzer produced nothing
     * @throws RuntimeException
     *             the analyzer's failure, after an ERROR event for it
     */
    public Optional<DeepAnalysis> triggerDeepWhisperScan(Discovery discovery) {
        metrics.setDeepWhisperScans(metrics.getDeepWhisperScans() + 1);

        Optional<DiscoveryAgent> analyzer = selectDeepAnalyzer();
        if (analyzer.isEmpty()) {
            log.warn("[Orchestrator] No agent available for deep-whisper scan of {}", discovery.id());
            return Optional.empty();
        }

        DiscoveryAgent agent = analyzer.get();
        log.info("[Orchestrator] Deep-whisper scan of {} on {}", discovery.type(), agent.getId());
        DeepAnalysis analysis;
        try {
            analysis = agent.performDeepAnalysis(discovery);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Deep analysis on {} failed: {}", agent.getId(), e.getMessage());
            publish(FleetEventType.ERROR, agent.getId(), Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
        if (analysis == null) {
            log.warn("[Orchestrator] {} returned no deep analysis for {}", agent.getId(), discovery.id());
            return Optional.empty();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("discoveryId", discovery.id());
        payload.put("correlations", analysis.hiddenCorrelations().size());
        payload.put("clusters", analysis.assetClusters().size());
        payload.put("confidence", analysis.confidence());
        publish(FleetEventType.DEEP_WHISPER_SCAN, agent.getId(), payload);
        return Optional.of(analysis);
    }

    private Optional<DiscoveryAgent> selectDeepAnalyzer() {
        List<DiscoveryAgent> available = agents.values().stream()
                .filter(DiscoveryAgent::isAvailable)
                .toList();
        return available.stream()
                .filter(agent -> agent.getKind() == properties.getOrchestrator().getDeepAnalysisKind())
                .findFirst()
                .or(() -> available.stream().findFirst());
    }

    // ==================== Coordination ====================

    void redistributeTasks() {
        List<DiscoveryAgent> running = agents.values().stream()
                .filter(DiscoveryAgent::isActive)
                .toList();
        if (running.size() < 2) {
            return;
        }

        Set<String> knownTaskTypes = new LinkedHashSet<>();
        List<AgentStatusView> views = new ArrayList<>();
        int taskCapacity = 0;
        for (DiscoveryAgent agent : running) {
            knownTaskTypes.addAll(agent.getTaskTypes());
            views.add(agent.getStatus());
            taskCapacity += agent.getConfig().getMaxConcurrentTasks();
        }

        TaskDistribution distribution = strategyAdvisor.analyzeTaskDistribution(views, knownTaskTypes, taskCapacity);
        List<StrategyAdaptation> adaptations = strategyAdvisor.calculateOptimalStrategy(distribution);
        running.forEach(agent -> agent.adaptStrategy(adaptations));
        log.debug("[Orchestrator] Task redistribution completed: {}", distribution);
    }

    void adaptAgentStrategies() {
        for (DiscoveryAgent agent : agents.values()) {
            List<StrategyAdaptation> adaptations = strategyAdvisor.calculateAdaptations(
                    agent.getPerformanceMetrics());
            if (!adaptations.isEmpty()) {
                agent.adaptStrategy(adaptations);
                log.info("[Orchestrator] Adapted strategy for {}: {}", agent.getId(), adaptations);
            }
        }
    }

    void performHealthChecks() {
        for (DiscoveryAgent agent : List.copyOf(agents.values())) {
            try {
                HealthStatus health = agent.performHealthCheck();
                if (!health.healthy()) {
                    log.warn("[Orchestrator] Agent {} health check failed: {}", agent.getId(), health.issues());
                    healingSupervisor.scheduleHealing(agent.getId(),
                            new IllegalStateException("Health check failed: " + health.issues()));
                }
            } catch (RuntimeException e) {
                log.error("[Orchestrator] Health check error for {}: {}", agent.getId(), e.getMessage());
                publish(FleetEventType.ERROR, agent.getId(), Map.of("error", String.valueOf(e.getMessage())));
                healingSupervisor.scheduleHealing(agent.getId(), e);
            }
        }
    }

    // ==================== Persistence ====================

    public boolean savePersistentState() {
        Map<String, AgentSnapshot> snapshots = new LinkedHashMap<>(persistedState);
        for (DiscoveryAgent agent : agents.values()) {
            if (agent.getConfig().isPersistentState()) {
                snapshots.put(agent.getId(), agent.getState());
            }
        }
        boolean saved = stateStore.save(snapshots);
        if (saved) {
            persistedState = snapshots;
        }
        return saved;
    }

    /**
     * Load the snapshot and restore already registered agents from it. Agents
     * registered later are restored on registration.
     */
    public void loadPersistentState() {
        persistedState = stateStore.load();
        for (DiscoveryAgent agent : agents.values()) {
            AgentSnapshot snapshot = persistedState.get(agent.getId());
            if (snapshot != null && agent.getConfig().isPersistentState()) {
                agent.restoreState(snapshot);
            }
        }
    }

    // ==================== Views ====================

    public OrchestratorStatus getStatus() {
        Map<String, AgentStatusView> agentStatuses = new LinkedHashMap<>();
        agents.forEach((agentId, agent) -> agentStatuses.put(agentId, agent.getStatus()));
        return OrchestratorStatus.builder()
                .orchestratorStatus(status)
                .startTime(startTime)
                .uptimeMs(startTime != null ? Duration.between(startTime, clock.instant()).toMillis() : 0)
                .metrics(metrics.toBuilder().activeScans(countActiveAgents()).build())
                .agents(agentStatuses)
                .healing(healingSupervisor.getHealingAgentIds())
                .build();
    }

    public Optional<DiscoveryAgent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<DiscoveryAgent> getAgents() {
        return List.copyOf(agents.values());
    }

    public boolean isRunning() {
        return status == AgentStatus.RUNNING;
    }

    HealingSupervisor getHealingSupervisor() {
        return healingSupervisor;
    }

    private long countActiveAgents() {
        return agents.values().stream().filter(DiscoveryAgent::isActive).count();
    }

    private void publish(FleetEventType type, String agentId, Map<String, Object> payload) {
        eventBus.publish(FleetEvent.builder()
                .type(type)
                .agentId(agentId)
                .timestamp(clock.instant())
                .payload(payload)
                .build());
    }

    private final class AgentEventRelay implements AgentEventListener {

        private final String agentId;

        private AgentEventRelay(String agentId) {
            this.agentId = agentId;
        }

        @Override
        public void onDiscovery(String sourceId, Discovery discovery) {
            handleDiscovery(agentId, discovery);
        }

        @Override
        public void onCollaborationRequest(String sourceId, CollaborationRequest request) {
            handleCollaborationRequest(agentId, request);
        }

        @Override
        public void onStatusChange(String sourceId, AgentStatus agentStatus) {
            handleStatusChange(agentId, agentStatus);
        }

        @Override
        public void onError(String sourceId, Throwable error) {
            publish(FleetEventType.ERROR, agentId, Map.of("error", String.valueOf(error.getMessage())));
            handleAgentError(agentId, error);
        }

        @Override
        public void onCycleCompleted(String sourceId) {
            publish(FleetEventType.CYCLE_COMPLETED, agentId, Map.of());
        }
    }

    private final class HealingOutcomePublisher implements HealingSupervisor.Listener {

        @Override
        public void onHealed(String agentId, int attempts) {
            publish(FleetEventType.BOT_HEALED, agentId, Map.of("attempts", attempts));
        }

        @Override
        public void onHealingFailed(String agentId, int attempts, String lastError) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("attempts", attempts);
            payload.put("lastError", lastError);
            publish(FleetEventType.BOT_HEALING_FAILED, agentId, payload);
        }
    }
}

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

import me.golemcore.discovery.domain.loop.EventLoop;
import me.golemcore.discovery.domain.loop.ScheduledHandle;
import me.golemcore.discovery.domain.model.AdaptiveStrategy;
import me.golemcore.discovery.domain.model.AgentConfig;
import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.model.AgentMetrics;
import me.golemcore.discovery.domain.model.AgentSnapshot;
import me.golemcore.discovery.domain.model.AgentStatus;
import me.golemcore.discovery.domain.model.AgentStatusView;
import me.golemcore.discovery.domain.model.CollaborationRecord;
import me.golemcore.discovery.domain.model.CollaborationRequest;
import me.golemcore.discovery.domain.model.DeepAnalysis;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.domain.model.DiscoveryTask;
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.domain.model.HealthStatus;
import me.golemcore.discovery.domain.model.PerformanceMetrics;
import me.golemcore.discovery.domain.model.StrategyAdaptation;
import me.golemcore.discovery.domain.model.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Autonomous discovery agent: owns its work loop, a bounded set of in-flight
 * tasks, a discovery dedup cache and self-tuned scheduling parameters.
 *
 * <p>
 * Lifecycle: {@code IDLE -> STARTING -> RUNNING -> STOPPING -> IDLE}. An
 * exception escaping a running cycle moves the agent to {@code ERROR} and
 * leaves its timers untouched; recovery is driven by {@link #heal()}.
 *
 * <p>
 * Each tick of the autonomous timer performs one cycle:
 * <ol>
 * <li>admit new tasks from the strategy while below the concurrency
 * ceiling</li>
 * <li>adapt the tick interval to the current discovery rate</li>
 * <li>emit collaboration requests the strategy identifies</li>
 * </ol>
 * Task completions arrive asynchronously and are re-posted onto the event
 * loop, where they update metrics and feed the dedup cache.
 *
 * <p>
 * Not thread-safe: every method must be called from the {@link EventLoop}.
 *
 * @since 1.0
 * @see AgentStrategy
 */
@Slf4j
public class DiscoveryAgent {

    public static final String DEEP_WHISPER_TYPE = "deep-whisper";
    static final int MAX_CACHE_SIZE = 1000;
    static final Duration STALE_ACTIVITY_THRESHOLD = Duration.ofMinutes(2);
    private static final int ERROR_ALERT_THRESHOLD = 10;
    private static final double LOW_SUCCESS_RATE = 0.5;
    private static final double HIGH_DISCOVERY_RATE = 0.5;
    private static final double LOW_DISCOVERY_RATE = 0.1;
    private static final double SPEED_UP_FACTOR = 0.8;
    private static final double SLOW_DOWN_FACTOR = 1.2;

    private final String id;
    private final AgentStrategy strategy;
    private final EventLoop eventLoop;
    private final Clock clock;
    private final AgentTimings timings;

    private final Map<String, DiscoveryTask> currentTasks = new LinkedHashMap<>();
    private final Map<String, List<CollaborationRecord>> collaborationHistory = new LinkedHashMap<>();
    private Map<String, Discovery> discoveryCache = new LinkedHashMap<>();

    private AgentStatus status = AgentStatus.IDLE;
    private AgentConfig config;
    private AgentMetrics metrics;
    private AdaptiveStrategy adaptiveStrategy = AdaptiveStrategy.defaults();
    private HealthStatus healthStatus = HealthStatus.ok();
    private Instant startTime;
    private Instant lastActivity;
    private int recoveryAttempts;
    private boolean resumable;

    private ScheduledHandle autonomousTimer;
    private ScheduledHandle performanceTimer;
    private ScheduledHandle diagnosticsTimer;
    private AgentEventListener listener = AgentEventListener.NOOP;

    public DiscoveryAgent(String id, AgentStrategy strategy, AgentConfig config, EventLoop eventLoop, Clock clock,
            AgentTimings timings) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timings = timings != null ? timings : AgentTimings.DEFAULT;
        this.id = id != null && !id.isBlank() ? id : generateId(strategy.kind());
        this.config = validate(config != null ? config.copy() : AgentConfig.builder().build());
        this.metrics = AgentMetrics.builder().lastPerformanceUpdate(clock.instant()).build();
    }

    public String getId() {
        return id;
    }

    public AgentKind getKind() {
        return strategy.kind();
    }

    public String getType() {
        return strategy.kind().getTypeTag();
    }

    public void setListener(AgentEventListener listener) {
        this.listener = listener != null ? listener : AgentEventListener.NOOP;
    }

    // ==================== Lifecycle ====================

    /**
     * Initialize the strategy and arm the autonomous, performance and
     * diagnostics timers.
     *
     * @throws IllegalStateException
     *             if the agent is already running
     * @throws AgentLifecycleException
     *             if the strategy fails to initialize
     */
    public void startAutonomous() {
        if (status == AgentStatus.RUNNING) {
            throw new IllegalStateException("Agent " + id + " is already running");
        }

        // a restart from ERROR still holds the previous run's timers
        cancelTimers();
        status = AgentStatus.STARTING;
        startTime = clock.instant();
        log.info("[Agent] Starting {} ({})", id, getType());

        try {
            strategy.initialize();
        } catch (Exception e) {
            status = AgentStatus.ERROR;
            log.error("[Agent] {} failed to initialize: {}", id, e.getMessage());
            listener.onError(id, e);
            throw new AgentLifecycleException("Agent " + id + " failed to initialize", e);
        }

        status = AgentStatus.RUNNING;
        resumable = true;
        lastActivity = startTime;
        startAutonomousLoop();
        startBackgroundRoutines();
        listener.onStatusChange(id, AgentStatus.RUNNING);
        log.info("[Agent] {} running with interval {}ms", id, config.getAutonomousInterval());
    }

    /**
     * Stop the agent. In-flight tasks are abandoned: their references are
     * dropped immediately and any late completion is ignored.
     */
    public void stopGracefully() {
        if (status == AgentStatus.IDLE) {
            log.debug("[Agent] {} already idle", id);
            return;
        }

        status = AgentStatus.STOPPING;
        log.info("[Agent] Stopping {}", id);

        cancelTimers();

        int abandoned = currentTasks.size();
        currentTasks.clear();
        if (abandoned > 0) {
            log.info("[Agent] {} abandoned {} in-flight tasks", id, abandoned);
        }

        try {
            strategy.cleanup();
        } catch (RuntimeException e) {
            log.warn("[Agent] {} cleanup failed: {}", id, e.getMessage());
        }

        status = AgentStatus.IDLE;
        resumable = false;
        listener.onStatusChange(id, AgentStatus.IDLE);
        log.info("[Agent] {} stopped", id);
    }

    private void startAutonomousLoop() {
        Duration interval = Duration.ofMillis(config.getAutonomousInterval());
        autonomousTimer = eventLoop.scheduleAtFixedRate(this::onAutonomousTick, interval, interval);
    }

    private void startBackgroundRoutines() {
        if (performanceTimer == null || performanceTimer.isCancelled()) {
            performanceTimer = eventLoop.scheduleAtFixedRate(this::updatePerformanceWindow,
                    timings.performancePeriod(), timings.performancePeriod());
        }
        if (diagnosticsTimer == null || diagnosticsTimer.isCancelled()) {
            diagnosticsTimer = eventLoop.scheduleAtFixedRate(this::performSelfDiagnostics,
                    timings.diagnosticsPeriod(), timings.diagnosticsPeriod());
        }
    }

    private void cancelTimers() {
        if (autonomousTimer != null) {
            autonomousTimer.cancel();
            autonomousTimer = null;
        }
        if (performanceTimer != null) {
            performanceTimer.cancel();
            performanceTimer = null;
        }
        if (diagnosticsTimer != null) {
            diagnosticsTimer.cancel();
            diagnosticsTimer = null;
        }
    }

    private void onAutonomousTick() {
        if (status == AgentStatus.RUNNING) {
            performAutonomousCycle();
        }
    }

    // ==================== Autonomous cycle ====================

    void performAutonomousCycle() {
        try {
            initiateNewTasks();
            analyzeAndAdapt();
            checkCollaborationOpportunities();
            lastActivity = clock.instant();
            listener.onCycleCompleted(id);
        } catch (RuntimeException e) {
            metrics.setErrors(metrics.getErrors() + 1);
            updateSuccessRate();
            status = AgentStatus.ERROR;
            log.error("[Agent] Cycle failed for {}: {}", id, e.getMessage(), e);
            listener.onError(id, e);

            if (status == AgentStatus.ERROR && config.isSelfHealingEnabled()
                    && recoveryAttempts < config.getMaxRecoveryAttempts()) {
                attemptSelfHealing();
            }
        }
    }

    private void initiateNewTasks() {
        if (currentTasks.size() >= config.getMaxConcurrentTasks()) {
            log.debug("[Agent] {} at capacity ({} tasks)", id, currentTasks.size());
            return;
        }
        List<DiscoveryTask> generated = strategy.generateTasks(config.copy(), adaptiveStrategy.copy());
        admitTasks(generated);
    }

    private int admitTasks(List<DiscoveryTask> tasks) {
        if (tasks == null) {
            return 0;
        }
        int admitted = 0;
        for (DiscoveryTask task : tasks) {
            if (currentTasks.size() >= config.getMaxConcurrentTasks()) {
                break;
            }
            if (task == null || task.getId() == null || currentTasks.containsKey(task.getId())) {
                continue;
            }
            currentTasks.put(task.getId(), task);
            dispatch(task);
            admitted++;
        }
        return admitted;
    }

    private void dispatch(DiscoveryTask task) {
        log.debug("[Agent] {} executing task {} ({})", id, task.getId(), task.getType());
        CompletableFuture<TaskResult> execution;
        try {
            execution = strategy.executeTask(task);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            execution = CompletableFuture.failedFuture(
                    new IllegalStateException("Strategy returned no result for task " + task.getType()));
        }
        String taskId = task.getId();
        execution.whenComplete((result, error) -> eventLoop.execute(() -> completeTask(taskId, result, error)));
    }

    void completeTask(String taskId, TaskResult result, Throwable error) {
        DiscoveryTask task = currentTasks.remove(taskId);
        if (task == null) {
            log.debug("[Agent] {} ignoring completion of abandoned task {}", id, taskId);
            return;
        }

        if (error != null || result == null || !result.success()) {
            metrics.setErrors(metrics.getErrors() + 1);
            String reason = error != null ? error.getMessage() : result != null ? result.error() : "no result";
            log.warn("[Agent] {} task {} failed: {}", id, task.getType(), reason);
        } else {
            metrics.setTasksCompleted(metrics.getTasksCompleted() + 1);
            if (result.finding() != null) {
                handleDiscovery(result.finding());
            }
            if (!result.followUpTasks().isEmpty() && status == AgentStatus.RUNNING) {
                admitTasks(result.followUpTasks());
            }
        }

        updateSuccessRate();
    }

    /**
     * Cache and announce a finding unless an identical one was already seen.
     *
     * @return {@code true} if the finding was new
     */
    boolean handleDiscovery(Finding finding) {
        String key = DiscoveryKeys.keyOf(finding);
        if (discoveryCache.containsKey(key)) {
            log.debug("[Agent] {} dropped duplicate discovery {}", id, key);
            return false;
        }

        double confidence = clamp(strategy.calculateConfidence(finding));
        Discovery discovery = Discovery.builder()
                .id(key)
                .type(finding.type())
                .payload(finding.data())
                .confidence(confidence)
                .agentId(id)
                .agentType(getType())
                .timestamp(clock.instant())
                .build();

        discoveryCache.put(key, discovery);
        metrics.setDiscoveries(metrics.getDiscoveries() + 1);
        log.info("[Agent] Discovery by {}: {} (confidence {})", id, finding.type(), confidence);
        listener.onDiscovery(id, discovery);
        return true;
    }

    private void analyzeAndAdapt() {
        PerformanceMetrics performance = getPerformanceMetrics();
        metrics.setDiscoveryRate(performance.discoveryRate());

        long current = config.getAutonomousInterval();
        long next = current;
        if (performance.discoveryRate() > HIGH_DISCOVERY_RATE) {
            next = Math.round(current * SPEED_UP_FACTOR);
        } else if (performance.discoveryRate() < LOW_DISCOVERY_RATE) {
            next = Math.round(current * SLOW_DOWN_FACTOR);
        }
        next = Math.max(config.intervalFloor(), Math.min(next, config.intervalCeiling()));

        if (next != current) {
            config.setAutonomousInterval(next);
            log.debug("[Agent] {} interval {}ms -> {}ms (discovery rate {})", id, current, next,
                    performance.discoveryRate());
            if (autonomousTimer != null) {
                autonomousTimer.cancel();
                startAutonomousLoop();
            }
        }
    }

    private void checkCollaborationOpportunities() {
        List<CollaborationRequest> opportunities = strategy.identifyCollaborationOpportunities(getStatus());
        if (opportunities == null) {
            return;
        }
        for (CollaborationRequest request : opportunities) {
            listener.onCollaborationRequest(id, request);
        }
    }

    private void updatePerformanceWindow() {
        metrics.setLastPerformanceUpdate(clock.instant());
    }

    private void updateSuccessRate() {
        long total = metrics.getTasksCompleted() + metrics.getErrors();
        metrics.setSuccessRate(total > 0 ? (double) metrics.getTasksCompleted() / total : 1.0);
    }

    // ==================== Health ====================

    /**
     * Run self-diagnostics and store the result as the health snapshot.
     */
    public HealthStatus performHealthCheck() {
        return performSelfDiagnostics();
    }

    private HealthStatus performSelfDiagnostics() {
        List<String> issues = new ArrayList<>();
        Instant now = clock.instant();

        if (lastActivity != null && Duration.between(lastActivity, now).compareTo(STALE_ACTIVITY_THRESHOLD) > 0) {
            issues.add("Agent appears unresponsive - no completed cycle in 2 minutes");
        }
        if (metrics.getErrors() > ERROR_ALERT_THRESHOLD && metrics.getSuccessRate() < LOW_SUCCESS_RATE) {
            issues.add("High error rate detected");
        }
        if (discoveryCache.size() > MAX_CACHE_SIZE) {
            issues.add("Discovery cache growing large - may need cleanup");
        }

        healthStatus = HealthStatus.of(issues);
        if (!healthStatus.healthy()) {
            log.debug("[Agent] {} diagnostics: {}", id, issues);
        }
        return healthStatus;
    }

    /**
     * Return the agent to a clean baseline: trims an oversized cache, resets
     * error counters, re-arms a missing autonomous timer and marks the agent
     * healthy. Safe to call repeatedly.
     *
     * @throws AgentLifecycleException
     *             if the agent is in error without ever having reached the
     *             running state
     */
    public void heal() {
        recoveryAttempts++;
        log.info("[Agent] Healing {} (attempt {})", id, recoveryAttempts);

        strategy.onHeal();

        if (discoveryCache.size() > MAX_CACHE_SIZE) {
            int oldSize = discoveryCache.size();
            discoveryCache.clear();
            log.info("[Agent] {} cleared discovery cache (was {} items)", id, oldSize);
        }

        metrics.setErrors(0);
        metrics.setSuccessRate(1.0);

        if (status == AgentStatus.ERROR) {
            if (!resumable) {
                throw new AgentLifecycleException("Agent " + id + " never reached the running state");
            }
            status = AgentStatus.RUNNING;
            listener.onStatusChange(id, AgentStatus.RUNNING);
        }

        if (status == AgentStatus.RUNNING) {
            if (autonomousTimer == null || autonomousTimer.isCancelled()) {
                startAutonomousLoop();
            }
            startBackgroundRoutines();
        }

        healthStatus = HealthStatus.ok();
        log.info("[Agent] Healing completed for {}", id);
    }

    private void attemptSelfHealing() {
        try {
            heal();
        } catch (RuntimeException e) {
            log.warn("[Agent] Self-healing failed for {}: {}", id, e.getMessage());
        }
    }

    // ==================== Collaboration ====================

    /**
     * Consider a discovery shared by a peer.
     *
     * @return {@code true} if it was relevant enough to record a collaboration
     */
    public boolean processCollaborativeDiscovery(Discovery discovery, String sourceAgentId) {
        double relevance = strategy.calculateRelevance(discovery.finding());
        if (relevance <= config.getCollaborationThreshold()) {
            return false;
        }
        strategy.adaptToDiscovery(discovery, sourceAgentId, adaptiveStrategy);
        recordCollaboration(sourceAgentId, CollaborationRecord.DISCOVERY_SHARED, relevance);
        return true;
    }

    /**
     * Accept a peer's request when it is relevant and this agent has room.
     *
     * @return {@code true} if the request was accepted
     */
    public boolean handleCollaborationRequest(String requestingAgentId, CollaborationRequest request) {
        double relevance = strategy.calculateRelevance(request.finding());
        if (relevance > config.getCollaborationThreshold() && isAvailable()) {
            recordCollaboration(requestingAgentId, CollaborationRecord.COLLABORATION_ACCEPTED, 1.0);
            return true;
        }
        return false;
    }

    private void recordCollaboration(String peerId, String type, double relevance) {
        collaborationHistory.computeIfAbsent(peerId, key -> new ArrayList<>())
                .add(new CollaborationRecord(type, relevance, clock.instant()));
        metrics.setCollaborations(metrics.getCollaborations() + 1);
    }

    /**
     * Run the strategy's extended analysis. Hidden correlations, when found,
     * are taken in as a regular {@code deep-whisper} discovery.
     */
    public DeepAnalysis performDeepAnalysis(Discovery discovery) {
        log.info("[Agent] {} performing deep analysis of {}", id, discovery.type());
        DeepAnalysis analysis = strategy.conductDeepAnalysis(discovery);
        if (analysis != null && analysis.hasCorrelations()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("originalDiscoveryId", discovery.id());
            data.put("originalType", discovery.type());
            data.put("hiddenCorrelations", analysis.hiddenCorrelations());
            data.put("assetClusters", analysis.assetClusters());
            data.put("confidence", analysis.confidence());
            data.put("aiInsights", analysis.insights());
            handleDiscovery(new Finding(DEEP_WHISPER_TYPE, data));
            log.info("[Agent] Deep analysis by {} revealed {} hidden correlations", id,
                    analysis.hiddenCorrelations().size());
        }
        return analysis;
    }

    // ==================== Strategy ====================

    public void adaptStrategy(List<StrategyAdaptation> adaptations) {
        for (StrategyAdaptation adaptation : adaptations) {
            switch (adaptation.type()) {
            case STRATEGY -> adaptiveStrategy.setApproach(adaptation.value());
            case SEARCH_SCOPE -> adaptiveStrategy.setScope(adaptation.value());
            case COLLABORATION_LEVEL -> adaptiveStrategy.setCollaboration(adaptation.value());
            case SEARCH_DEPTH -> adaptiveStrategy.setSearchDepth(adaptation.value());
            default -> log.warn("[Agent] Unknown adaptation type: {}", adaptation.type());
            }
        }
        log.debug("[Agent] Strategy adapted for {}: {}", id, adaptations);
    }

    /**
     * Admit externally assigned tasks, up to the remaining capacity.
     *
     * @return number of tasks admitted
     */
    public int assignTasks(List<DiscoveryTask> tasks) {
        if (status != AgentStatus.RUNNING) {
            log.debug("[Agent] {} not running, ignoring {} assigned tasks", id, tasks.size());
            return 0;
        }
        return admitTasks(tasks);
    }

    // ==================== Views ====================

    public AgentStatus getLifecycleStatus() {
        return status;
    }

    public boolean isAvailable() {
        return status == AgentStatus.RUNNING
                && currentTasks.size() < config.getMaxConcurrentTasks()
                && healthStatus.healthy();
    }

    public boolean isActive() {
        return status == AgentStatus.RUNNING;
    }

    public AgentStatusView getStatus() {
        return AgentStatusView.builder()
                .id(id)
                .type(getType())
                .status(status)
                .uptimeMs(startTime != null ? Duration.between(startTime, clock.instant()).toMillis() : 0)
                .activeTasks(currentTasks.size())
                .activeTaskTypes(currentTasks.values().stream().map(DiscoveryTask::getType).toList())
                .metrics(metrics.copy())
                .health(healthStatus)
                .strategy(adaptiveStrategy.copy())
                .build();
    }

    public PerformanceMetrics getPerformanceMetrics() {
        Instant windowStart = metrics.getLastPerformanceUpdate() != null
                ? metrics.getLastPerformanceUpdate()
                : clock.instant();
        double minutes = Duration.between(windowStart, clock.instant()).toMillis() / 60_000.0;
        double window = Math.max(minutes, 1.0);
        return new PerformanceMetrics(
                metrics.getTasksCompleted(),
                metrics.getDiscoveries(),
                metrics.getErrors(),
                metrics.getSuccessRate(),
                metrics.getDiscoveries() / window,
                metrics.getTasksCompleted() / window);
    }

    public AgentConfig getConfig() {
        return config.copy();
    }

    public AgentMetrics getMetrics() {
        return metrics.copy();
    }

    public AdaptiveStrategy getAdaptiveStrategy() {
        return adaptiveStrategy.copy();
    }

    public HealthStatus getHealthStatus() {
        return healthStatus;
    }

    public int getInFlightTaskCount() {
        return currentTasks.size();
    }

    public int getDiscoveryCacheSize() {
        return discoveryCache.size();
    }

    public List<String> getTaskTypes() {
        return strategy.taskTypes();
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public Map<String, List<CollaborationRecord>> getCollaborationHistory() {
        Map<String, List<CollaborationRecord>> copy = new LinkedHashMap<>();
        collaborationHistory.forEach((peer, records) -> copy.put(peer, List.copyOf(records)));
        return Collections.unmodifiableMap(copy);
    }

    // ==================== Persistence ====================

    public AgentSnapshot getState() {
        return AgentSnapshot.builder()
                .type(getType())
                .id(id)
                .config(config.copy())
                .metrics(metrics.copy())
                .adaptiveStrategy(adaptiveStrategy.copy())
                .discoveryCache(new LinkedHashMap<>(discoveryCache))
                .lastActivity(lastActivity)
                .build();
    }

    /**
     * Restore a previously exported snapshot. Missing sections keep their
     * current values; a missing strategy falls back to the defaults.
     */
    public void restoreState(AgentSnapshot snapshot) {
        if (snapshot.getConfig() != null) {
            config = validate(snapshot.getConfig().copy());
        }
        if (snapshot.getMetrics() != null) {
            metrics = snapshot.getMetrics().copy();
            if (metrics.getLastPerformanceUpdate() == null) {
                metrics.setLastPerformanceUpdate(clock.instant());
            }
        }
        adaptiveStrategy = snapshot.getAdaptiveStrategy() != null
                ? snapshot.getAdaptiveStrategy().copy()
                : AdaptiveStrategy.defaults();
        if (snapshot.getDiscoveryCache() != null) {
            discoveryCache = new LinkedHashMap<>(snapshot.getDiscoveryCache());
        }
        lastActivity = snapshot.getLastActivity();
        log.info("[Agent] State restored for {} ({} cached discoveries)", id, discoveryCache.size());
    }

    // ==================== Helpers ====================

    private static AgentConfig validate(AgentConfig candidate) {
        List<Long> range = candidate.getAdaptiveIntervalRange();
        if (range == null || range.size() != 2 || range.get(0) == null || range.get(1) == null) {
            throw new IllegalArgumentException("adaptiveIntervalRange must hold exactly two bounds");
        }
        if (range.get(0) <= 0 || range.get(0) > range.get(1)) {
            throw new IllegalArgumentException("Invalid adaptiveIntervalRange: " + range);
        }
        if (candidate.getMaxConcurrentTasks() < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be positive");
        }
        if (candidate.getAutonomousInterval() <= 0) {
            throw new IllegalArgumentException("autonomousInterval must be positive");
        }
        return candidate;
    }

    private static String generateId(AgentKind kind) {
        return kind.getTypeTag() + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}

package me.golemcore.discovery.domain.service;

import me.golemcore.discovery.domain.agent.AgentTimings;
import me.golemcore.discovery.domain.agent.DiscoveryAgent;
import me.golemcore.discovery.domain.model.AgentConfig;
import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.model.AgentMetrics;
import me.golemcore.discovery.domain.model.AgentSnapshot;
import me.golemcore.discovery.domain.model.AgentStatus;
import me.golemcore.discovery.domain.model.CollaborationRequest;
import me.golemcore.discovery.domain.model.DeepAnalysis;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.domain.model.FleetEvent;
import me.golemcore.discovery.domain.model.FleetEventType;
import me.golemcore.discovery.domain.model.HiddenCorrelation;
import me.golemcore.discovery.domain.model.OrchestratorStatus;
import me.golemcore.discovery.domain.model.TaskResult;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.infrastructure.event.SpringEventBus;
import me.golemcore.discovery.testsupport.ManualEventLoop;
import me.golemcore.discovery.testsupport.MutableClock;
import me.golemcore.discovery.testsupport.StubStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.invocation.Invocation;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AgentOrchestratorTest {

    private static final String HUNTER_ID = "DomainHunter-hunt0001";
    private static final String SEEKER_ID = "AssetSeeker-seek0001";
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    private static final Finding EXPIRED = new Finding("expired-domains",
            Map.of("domains", List.of("alpha.com"), "totalFound", 1));
    private static final DeepAnalysis CORRELATED = new DeepAnalysis(
            List.of(new HiddenCorrelation("asset-movement", "cyclical-transfer", 0.85, "loop")),
            List.of(), 0.85, "insight");

    private MutableClock clock;
    private ManualEventLoop loop;
    private DiscoveryProperties properties;
    private OrchestratorStateStore stateStore;
    private SpringEventBus eventBus;
    private DeepAnalysisTrigger trigger;
    private StubStrategy hunterStrategy;
    private StubStrategy seekerStrategy;
    private DiscoveryAgent hunter;
    private DiscoveryAgent seeker;
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        loop = new ManualEventLoop(clock);
        properties = new DiscoveryProperties();
        stateStore = mock(OrchestratorStateStore.class);
        eventBus = mock(SpringEventBus.class);
        trigger = mock(DeepAnalysisTrigger.class);

        hunterStrategy = new StubStrategy(AgentKind.DOMAIN_HUNTER);
        seekerStrategy = new StubStrategy(AgentKind.ASSET_SEEKER);
        hunter = newAgent(HUNTER_ID, hunterStrategy, AgentConfig.builder().build());
        seeker = newAgent(SEEKER_ID, seekerStrategy, AgentConfig.builder().build());

        orchestrator = new AgentOrchestrator(loop, clock, properties, stateStore, eventBus, trigger,
                new StrategyAdvisor());
    }

    private DiscoveryAgent newAgent(String id, StubStrategy strategy, AgentConfig config) {
        return new DiscoveryAgent(id, strategy, config, loop, clock, AgentTimings.DEFAULT);
    }

    private void registerBoth() {
        orchestrator.registerAgent(hunter);
        orchestrator.registerAgent(seeker);
    }

    private List<FleetEvent> events(FleetEventType type) {
        return mockingDetails(eventBus).getInvocations().stream()
                .map(Invocation::getArguments)
                .map(arguments -> arguments[0])
                .filter(FleetEvent.class::isInstance)
                .map(FleetEvent.class::cast)
                .filter(event -> event.type() == type)
                .toList();
    }

    private void discoverFromHunter() {
        hunterStrategy.setExecutor(task -> CompletableFuture.completedFuture(TaskResult.found(EXPIRED)));
        hunter.assignTasks(List.of(hunterStrategy.newTask()));
        loop.runPending();
    }

    // ==================== Registration ====================

    @Test
    void shouldRegisterAgentAndAnnounceIt() {
        orchestrator.registerAgent(hunter);

        assertEquals(Optional.of(hunter), orchestrator.getAgent(HUNTER_ID));
        FleetEvent registered = events(FleetEventType.BOT_REGISTERED).get(0);
        assertEquals(HUNTER_ID, registered.agentId());
        assertEquals("DomainHunter", registered.payload().get("type"));
        assertEquals(START, registered.timestamp());
    }

    @Test
    void shouldRejectDuplicateAgentId() {
        orchestrator.registerAgent(hunter);
        DiscoveryAgent duplicate = newAgent(HUNTER_ID, new StubStrategy(AgentKind.DOMAIN_HUNTER),
                AgentConfig.builder().build());

        assertThrows(IllegalArgumentException.class, () -> orchestrator.registerAgent(duplicate));
        assertEquals(1, orchestrator.getAgents().size());
    }

    @Test
    void shouldRestorePersistedStateOnRegistration() {
        AgentSnapshot snapshot = AgentSnapshot.builder()
                .id(HUNTER_ID)
                .type("DomainHunter")
                .metrics(AgentMetrics.builder().discoveries(7).tasksCompleted(9).build())
                .build();
        when(stateStore.load()).thenReturn(Map.of(HUNTER_ID, snapshot));
        orchestrator.loadPersistentState();

        orchestrator.registerAgent(hunter);

        assertEquals(7, hunter.getMetrics().getDiscoveries());
    }

    @Test
    void shouldNotRestoreAgentThatOptedOutOfPersistence() {
        when(stateStore.load()).thenReturn(Map.of(HUNTER_ID, AgentSnapshot.builder()
                .metrics(AgentMetrics.builder().discoveries(7).build())
                .build()));
        orchestrator.loadPersistentState();
        DiscoveryAgent ephemeral = newAgent(HUNTER_ID, hunterStrategy,
                AgentConfig.builder().persistentState(false).build());

        orchestrator.registerAgent(ephemeral);

        assertEquals(0, ephemeral.getMetrics().getDiscoveries());
    }

    // ==================== Lifecycle ====================

    @Test
    void shouldStartEveryAgentAndCoordinationTimers() {
        registerBoth();

        orchestrator.startAutonomousOperations();

        assertTrue(orchestrator.isRunning());
        assertTrue(hunter.isActive());
        assertTrue(seeker.isActive());
        assertEquals(2, events(FleetEventType.STATUS_CHANGE).size());
        assertEquals(2, events(FleetEventType.OPERATIONS_STARTED).get(0).payload().get("agents"));
        assertEquals(2 * 3 + 3, loop.activeTimers());
    }

    @Test
    void shouldRejectSecondStart() {
        registerBoth();
        orchestrator.startAutonomousOperations();

        assertThrows(IllegalStateException.class, orchestrator::startAutonomousOperations);
    }

    @Test
    void shouldHandOverAgentThatFailsToStartToHealing() {
        hunterStrategy.setInitializeFailure(new IOException("registry offline"));
        registerBoth();

        orchestrator.startAutonomousOperations();

        assertTrue(orchestrator.isRunning());
        assertEquals(AgentStatus.ERROR, hunter.getLifecycleStatus());
        assertTrue(seeker.isActive());
        assertTrue(orchestrator.getHealingSupervisor().isHealing(HUNTER_ID));
        assertEquals(HUNTER_ID, events(FleetEventType.BOT_ERROR).get(0).agentId());
        assertEquals(List.of(HUNTER_ID), orchestrator.getStatus().healing());
    }

    @Test
    void shouldReportHealingFailureWhenAgentNeverRecovers() {
        hunterStrategy.setInitializeFailure(new IOException("registry offline"));
        registerBoth();
        orchestrator.startAutonomousOperations();

        loop.advance(Duration.ofSeconds(10));

        List<FleetEvent> failed = events(FleetEventType.BOT_HEALING_FAILED);
        assertEquals(1, failed.size());
        assertEquals(HUNTER_ID, failed.get(0).agentId());
        assertEquals(3, failed.get(0).payload().get("attempts"));
        assertFalse(orchestrator.getHealingSupervisor().isHealing(HUNTER_ID));
    }

    @Test
    void shouldStopAgentsCancelTimersAndSave() {
        when(stateStore.save(any())).thenReturn(true);
        registerBoth();
        orchestrator.startAutonomousOperations();

        orchestrator.stopAutonomousOperations();

        assertFalse(orchestrator.isRunning());
        assertEquals(AgentStatus.IDLE, hunter.getLifecycleStatus());
        assertEquals(AgentStatus.IDLE, seeker.getLifecycleStatus());
        assertEquals(0, loop.activeTimers());
        verify(stateStore).save(any());
        assertEquals(1, events(FleetEventType.OPERATIONS_STOPPED).size());
    }

    @Test
    void shouldIgnoreStopWhenNotRunning() {
        registerBoth();

        orchestrator.stopAutonomousOperations();

        verify(stateStore, never()).save(any());
        assertTrue(events(FleetEventType.OPERATIONS_STOPPED).isEmpty());
    }

    @Test
    void shouldCancelPendingHealingOnStop() {
        hunterStrategy.setInitializeFailure(new IOException("registry offline"));
        registerBoth();
        orchestrator.startAutonomousOperations();

        orchestrator.stopAutonomousOperations();
        loop.advance(Duration.ofMinutes(1));

        assertTrue(events(FleetEventType.BOT_HEALING_FAILED).isEmpty());
        assertTrue(orchestrator.getStatus().healing().isEmpty());
    }

    // ==================== Discoveries ====================

    @Test
    void shouldFanDiscoveryOutToPeers() {
        registerBoth();
        orchestrator.startAutonomousOperations();

        discoverFromHunter();

        assertEquals(1, seeker.getMetrics().getCollaborations());
        assertEquals(0, hunter.getMetrics().getCollaborations());
        assertEquals(1, orchestrator.getStatus().metrics().getTotalDiscoveries());
        FleetEvent discovery = events(FleetEventType.DISCOVERY).get(0);
        assertEquals(HUNTER_ID, discovery.agentId());
        assertEquals("expired-domains", discovery.payload().get("type"));
        assertEquals("DomainHunter", discovery.payload().get("agentType"));
        assertEquals(0.8, discovery.payload().get("confidence"));
    }

    @Test
    void shouldDeliverDiscoveryToEveryOtherAgentExactlyOnce() {
        StubStrategy explorerStrategy = new StubStrategy(AgentKind.RECURSIVE_EXPLORER);
        DiscoveryAgent peerSeeker = spy(seeker);
        DiscoveryAgent peerExplorer = spy(newAgent("RecursiveExplorer-expl0001", explorerStrategy,
                AgentConfig.builder().build()));
        orchestrator.registerAgent(hunter);
        orchestrator.registerAgent(peerSeeker);
        orchestrator.registerAgent(peerExplorer);
        orchestrator.startAutonomousOperations();

        discoverFromHunter();

        Discovery shared = hunter.getState().getDiscoveryCache().values().iterator().next();
        verify(peerSeeker, times(1)).processCollaborativeDiscovery(shared, HUNTER_ID);
        verify(peerExplorer, times(1)).processCollaborativeDiscovery(shared, HUNTER_ID);
        assertEquals(List.of(shared), seekerStrategy.getAdaptedTo());
        assertEquals(List.of(shared), explorerStrategy.getAdaptedTo());
        assertTrue(hunterStrategy.getAdaptedTo().isEmpty());
        assertEquals(0, hunter.getMetrics().getCollaborations());
    }

    @Test
    void shouldRunDeepWhisperScanOnPreferredKind() {
        when(trigger.shouldAnalyze(any())).thenReturn(true);
        seekerStrategy.setDeepAnalysis(CORRELATED);
        registerBoth();
        orchestrator.startAutonomousOperations();

        discoverFromHunter();

        List<FleetEvent> scans = events(FleetEventType.DEEP_WHISPER_SCAN);
        assertEquals(1, scans.size());
        assertEquals(SEEKER_ID, scans.get(0).agentId());
        assertEquals(1, scans.get(0).payload().get("correlations"));
        assertEquals(1, seeker.getDiscoveryCacheSize());
        assertEquals(1, orchestrator.getStatus().metrics().getDeepWhisperScans());
        assertEquals(2, orchestrator.getStatus().metrics().getTotalDiscoveries());
    }

    @Test
    void shouldKeepSourceAgentWorkingWhenAnalyzerFails() {
        when(trigger.shouldAnalyze(any())).thenReturn(true);
        seekerStrategy.setDeepAnalysisFailure(new IllegalStateException("analyzer crashed"));
        registerBoth();
        orchestrator.startAutonomousOperations();
        hunterStrategy.setExecutor(task -> CompletableFuture.failedFuture(new IllegalStateException("timeout")));
        hunter.assignTasks(List.of(hunterStrategy.newTask()));
        loop.runPending();

        discoverFromHunter();

        AgentMetrics metrics = hunter.getMetrics();
        assertEquals(1, metrics.getTasksCompleted());
        assertEquals(1, metrics.getErrors());
        assertEquals(0.5, metrics.getSuccessRate());
        assertEquals(1, events(FleetEventType.DISCOVERY).size());
        FleetEvent error = events(FleetEventType.ERROR).get(0);
        assertEquals(SEEKER_ID, error.agentId());
        assertEquals("analyzer crashed", error.payload().get("error"));
        assertTrue(events(FleetEventType.DEEP_WHISPER_SCAN).isEmpty());
    }

    @Test
    void shouldTreatMissingDeepAnalysisAsEmptyScan() {
        when(trigger.shouldAnalyze(any())).thenReturn(true);
        seekerStrategy.setDeepAnalysis(null);
        registerBoth();
        orchestrator.startAutonomousOperations();

        discoverFromHunter();

        assertEquals(1, events(FleetEventType.DISCOVERY).size());
        assertTrue(events(FleetEventType.DEEP_WHISPER_SCAN).isEmpty());
        assertEquals(1.0, hunter.getMetrics().getSuccessRate());
    }

    @Test
    void shouldSkipDeepWhisperScanWhenTriggerDeclines() {
        seekerStrategy.setDeepAnalysis(CORRELATED);
        registerBoth();
        orchestrator.startAutonomousOperations();

        discoverFromHunter();

        assertTrue(events(FleetEventType.DEEP_WHISPER_SCAN).isEmpty());
        assertEquals(0, seeker.getDiscoveryCacheSize());
    }

    @Test
    void shouldFindNoAnalyzerWhileFleetIsIdle() {
        registerBoth();

        Optional<DeepAnalysis> analysis = orchestrator.triggerDeepWhisperScan(
                Discovery.builder().id("d-1").type("dormant-assets").build());

        assertTrue(analysis.isEmpty());
        assertEquals(1, orchestrator.getStatus().metrics().getDeepWhisperScans());
    }

    // ==================== Collaboration ====================

    @Test
    void shouldRouteCollaborationRequestToTarget() {
        registerBoth();
        orchestrator.startAutonomousOperations();
        CollaborationRequest request = CollaborationRequest.builder()
                .targetAgentId(SEEKER_ID)
                .type("asset-correlation")
                .payload(Map.of("domains", List.of("alpha.com")))
                .build();

        orchestrator.handleCollaborationRequest(HUNTER_ID, request);

        assertEquals(1, events(FleetEventType.COLLABORATION_REQUEST).size());
        FleetEvent collaboration = events(FleetEventType.COLLABORATION).get(0);
        assertEquals(SEEKER_ID, collaboration.payload().get("target"));
        assertEquals(true, collaboration.payload().get("accepted"));
        assertTrue(seeker.getCollaborationHistory().containsKey(HUNTER_ID));
        assertEquals(1, orchestrator.getStatus().metrics().getCollaborations());
    }

    @Test
    void shouldDropCollaborationRequestForUnknownTarget() {
        registerBoth();
        CollaborationRequest request = CollaborationRequest.builder().targetAgentId("Nobody-1").type("x").build();

        orchestrator.handleCollaborationRequest(HUNTER_ID, request);

        assertEquals(1, events(FleetEventType.COLLABORATION_REQUEST).size());
        assertTrue(events(FleetEventType.COLLABORATION).isEmpty());
        assertEquals(0, orchestrator.getStatus().metrics().getCollaborations());
    }

    @Test
    void shouldRelayStrategyCollaborationRequestsFromCycle() {
        hunterStrategy.setCollaborationRequests(List.of(CollaborationRequest.builder()
                .targetAgentId(SEEKER_ID)
                .type("asset-correlation")
                .build()));
        registerBoth();
        orchestrator.startAutonomousOperations();

        loop.advance(Duration.ofSeconds(30));

        assertEquals(HUNTER_ID, events(FleetEventType.COLLABORATION).get(0).agentId());
        assertEquals(2, events(FleetEventType.CYCLE_COMPLETED).size());
    }

    // ==================== Errors & health ====================

    @Test
    void shouldHealAgentAfterReportedCycleError() {
        hunterStrategy.setGenerateFailure(new IllegalStateException("generator down"));
        registerBoth();
        orchestrator.startAutonomousOperations();

        loop.advance(Duration.ofSeconds(30));

        assertEquals("generator down", events(FleetEventType.BOT_ERROR).get(0).payload().get("error"));
        assertEquals(HUNTER_ID, events(FleetEventType.ERROR).get(0).agentId());
        FleetEvent healed = events(FleetEventType.BOT_HEALED).get(0);
        assertEquals(HUNTER_ID, healed.agentId());
        assertEquals(1, healed.payload().get("attempts"));
        assertEquals(AgentStatus.RUNNING, hunter.getLifecycleStatus());
        assertEquals(1, hunterStrategy.getHealCalls());
    }

    @Test
    void shouldHealUnresponsiveAgentsOnHealthCheck() {
        registerBoth();
        orchestrator.startAutonomousOperations();
        clock.advance(Duration.ofMinutes(3));

        orchestrator.performHealthChecks();

        assertEquals(2, events(FleetEventType.BOT_HEALED).size());
        assertTrue(hunter.getHealthStatus().healthy());
        assertTrue(seeker.getHealthStatus().healthy());
    }

    @Test
    void shouldPublishErrorWhenHealthCheckThrows() {
        DiscoveryAgent broken = mock(DiscoveryAgent.class);
        when(broken.getId()).thenReturn("Broken-1");
        when(broken.getType()).thenReturn("DomainHunter");
        when(broken.performHealthCheck()).thenThrow(new IllegalStateException("diagnostics crashed"));
        orchestrator.registerAgent(broken);

        orchestrator.performHealthChecks();

        FleetEvent error = events(FleetEventType.ERROR).get(0);
        assertEquals("Broken-1", error.agentId());
        assertEquals("diagnostics crashed", error.payload().get("error"));
        verify(broken).heal();
    }

    // ==================== Coordination ====================

    @Test
    void shouldRaiseCollaborationWhenAgentsOverlap() {
        hunterStrategy.setTasksPerCycle(2);
        seekerStrategy.setTasksPerCycle(2);
        registerBoth();
        orchestrator.startAutonomousOperations();
        loop.advance(Duration.ofSeconds(30));

        orchestrator.redistributeTasks();

        assertEquals("high", hunter.getAdaptiveStrategy().getCollaboration());
        assertEquals("high", seeker.getAdaptiveStrategy().getCollaboration());
        assertEquals("normal", hunter.getAdaptiveStrategy().getSearchDepth());
    }

    @Test
    void shouldSkipRedistributionWithSingleRunningAgent() {
        orchestrator.registerAgent(hunter);
        orchestrator.startAutonomousOperations();

        orchestrator.redistributeTasks();

        assertEquals("medium", hunter.getAdaptiveStrategy().getCollaboration());
    }

    @Test
    void shouldExpandScopeOfUnproductiveAgents() {
        registerBoth();
        orchestrator.startAutonomousOperations();

        orchestrator.adaptAgentStrategies();

        assertEquals("expanded", hunter.getAdaptiveStrategy().getScope());
        assertEquals("balanced", hunter.getAdaptiveStrategy().getApproach());
    }

    // ==================== Persistence & status ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldKeepSnapshotsOfUnregisteredAgentsWhenSaving() {
        when(stateStore.load()).thenReturn(Map.of("Retired-1", AgentSnapshot.builder().id("Retired-1").build()));
        when(stateStore.save(any())).thenReturn(true);
        orchestrator.loadPersistentState();
        registerBoth();

        assertTrue(orchestrator.savePersistentState());

        ArgumentCaptor<Map<String, AgentSnapshot>> captor = ArgumentCaptor.forClass(Map.class);
        verify(stateStore).save(captor.capture());
        assertEquals(3, captor.getValue().size());
        assertEquals("AssetSeeker", captor.getValue().get(SEEKER_ID).getType());
    }

    @Test
    void shouldDescribeFleet() {
        registerBoth();
        orchestrator.startAutonomousOperations();
        clock.advance(Duration.ofSeconds(5));

        OrchestratorStatus status = orchestrator.getStatus();

        assertEquals(AgentStatus.RUNNING, status.orchestratorStatus());
        assertEquals(START, status.startTime());
        assertEquals(5000, status.uptimeMs());
        assertEquals(2, status.metrics().getActiveScans());
        assertEquals(List.of(HUNTER_ID, SEEKER_ID), List.copyOf(status.agents().keySet()));
    }
}

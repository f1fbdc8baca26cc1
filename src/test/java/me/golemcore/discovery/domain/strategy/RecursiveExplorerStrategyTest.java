package me.golemcore.discovery.domain.strategy;

import me.golemcore.discovery.domain.model.AdaptiveStrategy;
import me.golemcore.discovery.domain.model.AgentConfig;
import me.golemcore.discovery.domain.model.DeepAnalysis;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.domain.model.DiscoveryTask;
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.domain.model.TaskResult;
import me.golemcore.discovery.port.outbound.DiscoverySourcePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RecursiveExplorerStrategyTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private static final Finding PROMISING = new Finding("boundary-expansion", Map.of(
            "unexploredBranches", List.of("north", "east"),
            "potentialValue", 2500));

    private DiscoverySourcePort discoverySource;
    private RecursiveExplorerStrategy strategy;

    @BeforeEach
    void setUp() {
        discoverySource = mock(DiscoverySourcePort.class);
        strategy = new RecursiveExplorerStrategy(discoverySource, new FixedRandom(0.65), CLOCK);
    }

    @Test
    void shouldSelectTasksMoreEagerlyThanOtherKinds() {
        List<DiscoveryTask> tasks = strategy.generateTasks(AgentConfig.builder().build(), AdaptiveStrategy.defaults());

        assertEquals(3, tasks.size());
        assertEquals("deep-recursive-scan", tasks.get(0).getType());
        assertEquals(10, tasks.get(0).getPriority());
        assertTrue(tasks.stream().allMatch(task -> Integer.valueOf(0).equals(task.getRecursionDepth())));
    }

    @Test
    void shouldSpawnDeeperFollowUpForPromisingFinding() {
        when(discoverySource.probe(any(), any())).thenReturn(CompletableFuture.completedFuture(Optional.of(PROMISING)));
        DiscoveryTask task = strategy.createTask("boundary-expansion", AdaptiveStrategy.defaults());

        TaskResult result = strategy.executeTask(task).join();

        assertEquals(PROMISING, result.finding());
        assertEquals(1, result.followUpTasks().size());
        DiscoveryTask followUp = result.followUpTasks().get(0);
        assertEquals("recursive-" + task.getId() + "-" + CLOCK.millis(), followUp.getId());
        assertEquals("boundary-expansion", followUp.getType());
        assertEquals(1, followUp.getRecursionDepth());
        assertEquals("boundary-expansion", followUp.getParameters().get("parentDiscoveryType"));
        assertEquals(true, followUp.getParameters().get("recursiveContext"));
        assertEquals(List.of("boundary-expansion"), followUp.getExplorationPath());
        assertTrue(task.getExplorationPath().isEmpty());
    }

    @Test
    void shouldStopRecursingAtMaximumDepth() {
        when(discoverySource.probe(any(), any())).thenReturn(CompletableFuture.completedFuture(Optional.of(PROMISING)));
        DiscoveryTask task = strategy.createTask("boundary-expansion", AdaptiveStrategy.defaults());
        task.setRecursionDepth(RecursiveExplorerStrategy.MAX_RECURSION_DEPTH);

        TaskResult result = strategy.executeTask(task).join();

        assertTrue(result.followUpTasks().isEmpty());
    }

    @Test
    void shouldRequireTwoFactorsToRecurse() {
        assertFalse(strategy.shouldRecurse(new Finding("serendipity-discoveries",
                Map.of("unexploredBranches", List.of("west")))));
        assertTrue(strategy.shouldRecurse(new Finding("serendipity-discoveries",
                Map.of("unexploredBranches", List.of("west"), "noveltyFactor", 0.9))));
    }

    @Test
    void shouldScoreDeepSerendipitousFindings() {
        Finding deep = new Finding("recursive-depth-results", Map.of("depth", 6, "serendipityScore", 0.9));

        assertEquals(1.0, strategy.calculateConfidence(deep), 1e-9);
        assertEquals(0.7, strategy.calculateConfidence(new Finding("plain", Map.of())), 1e-9);
    }

    @Test
    void shouldRateOpenLeadsAsRelevant() {
        Finding finding = new Finding("boundary-expansion", Map.of("connections", List.of("a")));

        assertEquals(1.0, strategy.calculateRelevance(finding), 1e-9);
        assertEquals(0.5, strategy.calculateRelevance(new Finding("expired-domains", Map.of())), 1e-9);
    }

    @Test
    void shouldDeepenSearchWhenPeerReportsUnexploredBranches() {
        AdaptiveStrategy adaptive = AdaptiveStrategy.defaults();
        Discovery shared = Discovery.builder().id("s-1").type("boundary-expansion")
                .payload(Map.of("unexploredBranches", List.of("north"))).build();

        strategy.adaptToDiscovery(shared, "peer", adaptive);

        assertEquals("deep", adaptive.getSearchDepth());
    }

    @Test
    void shouldCorrelateSerendipitousDiscoveries() {
        Discovery discovery = Discovery.builder().id("s-2").type("serendipity-discoveries").payload(Map.of()).build();

        DeepAnalysis analysis = strategy.conductDeepAnalysis(discovery);

        assertEquals(1, analysis.hiddenCorrelations().size());
        assertEquals(0.88, analysis.confidence(), 1e-9);
    }

    @Test
    void shouldFallBackToGenericAnalysisWithoutRecursiveSignals() {
        Discovery discovery = Discovery.builder().id("s-3").type("noise").payload(Map.of()).build();

        assertFalse(strategy.conductDeepAnalysis(discovery).hasCorrelations());
    }
}

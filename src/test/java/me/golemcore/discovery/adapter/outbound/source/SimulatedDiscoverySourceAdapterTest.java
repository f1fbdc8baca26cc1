package me.golemcore.discovery.adapter.outbound.source;

import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.model.DiscoveryTask;
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedDiscoverySourceAdapterTest {

    private static DiscoveryProperties.SimulationProperties settings(double finding, double failure) {
        DiscoveryProperties.SimulationProperties settings = new DiscoveryProperties.SimulationProperties();
        settings.setFindingProbability(finding);
        settings.setFailureProbability(failure);
        settings.setMinLatency(Duration.ZERO);
        settings.setMaxLatency(Duration.ZERO);
        return settings;
    }

    private static DiscoveryTask task(String type) {
        return DiscoveryTask.builder().id(type + "-1").type(type).build();
    }

    @Test
    void shouldFailProbeWhenSourceIsDown() {
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(settings(0.0, 1.0),
                new Random(7));

        assertThrows(IllegalStateException.class,
                () -> adapter.simulate(AgentKind.DOMAIN_HUNTER, task("expired-domain-scan")));
    }

    @Test
    void shouldFindNothingWhenFindingsAreDisabled() {
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(settings(0.0, 0.0),
                new Random(7));

        assertTrue(adapter.simulate(AgentKind.DOMAIN_HUNTER, task("expired-domain-scan")).isEmpty());
    }

    @Test
    void shouldReportExpiredDomains() {
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(settings(1.0, 0.0),
                new Random(7));

        Finding finding = adapter.simulate(AgentKind.DOMAIN_HUNTER, task("expired-domain-scan")).orElseThrow();

        assertEquals("expired-domains", finding.type());
        List<?> domains = (List<?>) finding.get("domains");
        assertTrue(domains.size() >= 5);
        assertEquals(domains.size(), finding.get("totalFound"));
    }

    @Test
    void shouldAttachDeepAnalysisIndicatorsToAssetFindings() {
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(settings(1.0, 0.0),
                new Random(7));

        Finding finding = adapter.simulate(AgentKind.ASSET_SEEKER, task("dormant-asset-scan")).orElseThrow();

        assertEquals("dormant-assets", finding.type());
        Map<?, ?> indicator = (Map<?, ?>) finding.get("hiddenAssetClusters");
        double confidence = ((Number) indicator.get("confidence")).doubleValue();
        assertTrue(confidence >= 0.0 && confidence <= 1.0);
    }

    @Test
    void shouldCarryRecursionDepthIntoRecursiveFindings() {
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(settings(1.0, 0.0),
                new Random(7));
        DiscoveryTask task = DiscoveryTask.builder().id("b-1").type("boundary-expansion").recursionDepth(3).build();

        Finding finding = adapter.simulate(AgentKind.RECURSIVE_EXPLORER, task).orElseThrow();

        assertEquals("boundary-expansion", finding.type());
        assertEquals(3, finding.get("depth"));
    }

    @Test
    void shouldRenameSerendipityDives() {
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(settings(1.0, 0.0),
                new Random(7));

        Finding finding = adapter.simulate(AgentKind.RECURSIVE_EXPLORER, task("serendipity-dive")).orElseThrow();

        assertEquals("serendipity-discoveries", finding.type());
        assertTrue(finding.has("serendipityScore"));
    }

    @Test
    void shouldReplaySameOutcomesForSameSeed() {
        SimulatedDiscoverySourceAdapter first = new SimulatedDiscoverySourceAdapter(settings(0.6, 0.05),
                new Random(42));
        SimulatedDiscoverySourceAdapter second = new SimulatedDiscoverySourceAdapter(settings(0.6, 0.05),
                new Random(42));

        for (int i = 0; i < 20; i++) {
            DiscoveryTask task = task("blockchain-sweep");
            assertEquals(outcome(first, task), outcome(second, task));
        }
    }

    @Test
    void shouldKeepLatencyWithinBounds() {
        DiscoveryProperties.SimulationProperties settings = settings(1.0, 0.0);
        settings.setMinLatency(Duration.ofMillis(100));
        settings.setMaxLatency(Duration.ofMillis(200));
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(settings, new Random(7));

        for (int i = 0; i < 50; i++) {
            long latency = adapter.nextLatencyMillis();
            assertTrue(latency >= 100 && latency <= 200, "latency " + latency);
        }
    }

    @Test
    void shouldCompleteProbeAsynchronously() throws Exception {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setSimulation(settings(1.0, 0.0));
        properties.getSimulation().setSeed(11L);
        SimulatedDiscoverySourceAdapter adapter = new SimulatedDiscoverySourceAdapter(properties);

        Optional<Finding> finding = adapter.probe(AgentKind.DOMAIN_HUNTER, task("auction-monitoring"))
                .get(5, TimeUnit.SECONDS);

        assertEquals("auction-opportunities", finding.orElseThrow().type());
    }

    private static String outcome(SimulatedDiscoverySourceAdapter adapter, DiscoveryTask task) {
        try {
            return adapter.simulate(AgentKind.ASSET_SEEKER, task).map(Finding::toString).orElse("empty");
        } catch (IllegalStateException e) {
            return "failed";
        }
    }
}

package me.golemcore.discovery.domain.service;

import me.golemcore.discovery.domain.agent.DiscoveryAgent;
import me.golemcore.discovery.domain.model.AgentConfig;
import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.strategy.AgentStrategyFactory;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.port.outbound.DiscoverySourcePort;
import me.golemcore.discovery.testsupport.ManualEventLoop;
import me.golemcore.discovery.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AgentFactoryTest {

    private DiscoveryProperties properties;
    private AgentFactory factory;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        properties = new DiscoveryProperties();
        factory = new AgentFactory(new AgentStrategyFactory(mock(DiscoverySourcePort.class), clock),
                new ManualEventLoop(clock), clock, properties);
    }

    @Test
    void shouldApplyConfiguredAgentDefaults() {
        DiscoveryProperties.AgentsProperties agents = properties.getAgents();
        agents.setAutonomousInterval(45_000L);
        agents.setMinInterval(15_000L);
        agents.setMaxInterval(90_000L);
        agents.setMaxConcurrentTasks(5);
        agents.setSelfHealingEnabled(false);

        AgentConfig config = factory.create(AgentKind.DOMAIN_HUNTER, "hunter-1").getConfig();

        assertEquals(45_000L, config.getAutonomousInterval());
        assertEquals(List.of(15_000L, 90_000L), config.getAdaptiveIntervalRange());
        assertEquals(5, config.getMaxConcurrentTasks());
        assertFalse(config.isSelfHealingEnabled());
    }

    @Test
    void shouldKeepFixedIdOrGenerateOne() {
        DiscoveryAgent fixed = factory.create(AgentKind.RECURSIVE_EXPLORER, "explorer-1");
        DiscoveryAgent generated = factory.create(AgentKind.RECURSIVE_EXPLORER, null);

        assertEquals("explorer-1", fixed.getId());
        assertTrue(generated.getId().startsWith("RecursiveExplorer-"));
        assertEquals(AgentKind.RECURSIVE_EXPLORER, generated.getKind());
    }

    @Test
    void shouldRejectInvertedIntervalBounds() {
        properties.getAgents().setMinInterval(200_000L);

        assertThrows(IllegalArgumentException.class, () -> factory.create(AgentKind.ASSET_SEEKER, null));
    }
}

package me.golemcore.discovery.domain.service;

import me.golemcore.discovery.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.discovery.domain.model.AdaptiveStrategy;
import me.golemcore.discovery.domain.model.AgentConfig;
import me.golemcore.discovery.domain.model.AgentMetrics;
import me.golemcore.discovery.domain.model.AgentSnapshot;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.infrastructure.config.AutoConfiguration;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class OrchestratorStateStoreTest {

    private static final String AGENT_ID = "DomainHunter-store001";
    private static final Instant ACTIVITY = Instant.parse("2026-01-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private DiscoveryProperties properties;
    private OrchestratorStateStore store;

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new OrchestratorStateStore(storage, AutoConfiguration.objectMapper(), properties);
    }

    @Test
    void shouldLoadEmptyStateWhenNothingSaved() {
        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldPersistSnapshotsAcrossInstances() {
        Discovery cached = Discovery.builder()
                .id("abc123")
                .type("expired-domains")
                .payload(Map.of("domains", List.of("alpha.com")))
                .confidence(0.8)
                .agentId(AGENT_ID)
                .agentType("DomainHunter")
                .timestamp(ACTIVITY)
                .build();
        Map<String, Discovery> cache = new LinkedHashMap<>();
        cache.put(cached.id(), cached);
        AgentSnapshot snapshot = AgentSnapshot.builder()
                .type("DomainHunter")
                .id(AGENT_ID)
                .config(AgentConfig.builder().autonomousInterval(24_000L).build())
                .metrics(AgentMetrics.builder().discoveries(3).tasksCompleted(5).lastPerformanceUpdate(ACTIVITY).build())
                .adaptiveStrategy(AdaptiveStrategy.builder().searchDepth("deep").build())
                .discoveryCache(cache)
                .lastActivity(ACTIVITY)
                .build();

        assertTrue(store.save(Map.of(AGENT_ID, snapshot)));
        Map<String, AgentSnapshot> loaded = store.load();

        AgentSnapshot restored = loaded.get(AGENT_ID);
        assertEquals(24_000L, restored.getConfig().getAutonomousInterval());
        assertEquals(List.of(10_000L, 120_000L), restored.getConfig().getAdaptiveIntervalRange());
        assertEquals(3, restored.getMetrics().getDiscoveries());
        assertEquals("deep", restored.getAdaptiveStrategy().getSearchDepth());
        assertEquals(ACTIVITY, restored.getLastActivity());
        assertEquals(cached, restored.getDiscoveryCache().get("abc123"));
    }

    @Test
    void shouldWriteReadableJsonWithIsoTimestamps() throws Exception {
        store.save(Map.of(AGENT_ID, AgentSnapshot.builder().id(AGENT_ID).lastActivity(ACTIVITY).build()));

        String json = Files.readString(tempDir.resolve("state").resolve(OrchestratorStateStore.STATE_FILE));

        assertTrue(json.contains("\"lastActivity\" : \"2026-01-01T12:00:00Z\""), json);
    }

    @Test
    void shouldKeepBackupOfPreviousSnapshot() {
        store.save(Map.of("first", AgentSnapshot.builder().id("first").build()));
        store.save(Map.of("second", AgentSnapshot.builder().id("second").build()));

        Path backup = tempDir.resolve("state").resolve(OrchestratorStateStore.STATE_FILE + ".bak");
        assertTrue(Files.exists(backup));
        assertEquals(List.of("second"), List.copyOf(store.load().keySet()));
    }

    @Test
    void shouldFallBackToEmptyStateOnCorruptFile() throws Exception {
        Files.writeString(tempDir.resolve("state").resolve(OrchestratorStateStore.STATE_FILE), "{not json");

        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldReportFailedSave() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        OrchestratorStateStore failingStore = new OrchestratorStateStore(failing, AutoConfiguration.objectMapper(),
                properties);

        assertFalse(failingStore.save(Map.of()));
    }

    @Test
    void shouldSkipReadingWhenNoSnapshotExists() {
        StoragePort storage = mock(StoragePort.class);
        when(storage.exists("state", OrchestratorStateStore.STATE_FILE))
                .thenReturn(CompletableFuture.completedFuture(false));
        OrchestratorStateStore emptyStore = new OrchestratorStateStore(storage, AutoConfiguration.objectMapper(),
                properties);

        assertTrue(emptyStore.load().isEmpty());
        verify(storage, never()).getText(anyString(), anyString());
    }
}

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

import me.golemcore.discovery.domain.model.AgentSnapshot;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the flat orchestrator snapshot: one JSON document mapping
 * agent id to {@link AgentSnapshot}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestratorStateStore {

    static final String STATE_FILE = "orchestrator-state.json";
    private static final TypeReference<LinkedHashMap<String, AgentSnapshot>> SNAPSHOT_MAP_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;

    /**
     * Load the snapshot. A missing, unreadable or corrupt file yields an empty
     * map.
     */
    public Map<String, AgentSnapshot> load() {
        String directory = properties.getStorage().getStateDirectory();
        try {
            if (!storagePort.exists(directory, STATE_FILE).join()) {
                log.debug("[Storage] No orchestrator state found");
                return new LinkedHashMap<>();
            }
            String json = storagePort.getText(directory, STATE_FILE).join();
            if (json == null || json.isBlank()) {
                log.debug("[Storage] No orchestrator state found");
                return new LinkedHashMap<>();
            }
            Map<String, AgentSnapshot> snapshots = objectMapper.readValue(json, SNAPSHOT_MAP_TYPE_REF);
            log.info("[Storage] Loaded state for {} agents", snapshots.size());
            return snapshots;
        } catch (IOException | RuntimeException e) { // NOSONAR - fall back to an empty snapshot
            log.warn("[Storage] Failed to load orchestrator state: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * Write the snapshot atomically, keeping the previous version as backup.
     *
     * @return {@code true} if the snapshot was written
     */
    public boolean save(Map<String, AgentSnapshot> snapshots) {
        String directory = properties.getStorage().getStateDirectory();
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshots);
            storagePort.putTextAtomic(directory, STATE_FILE, json, true).join();
            log.info("[Storage] Saved state for {} agents", snapshots.size());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("[Storage] Failed to save orchestrator state", e);
            return false;
        }
    }
}

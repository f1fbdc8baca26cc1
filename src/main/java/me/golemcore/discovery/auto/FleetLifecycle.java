package me.golemcore.discovery.auto;

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
import me.golemcore.discovery.domain.service.AgentFactory;
import me.golemcore.discovery.domain.service.AgentOrchestrator;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Brings the configured fleet up on startup and down on shutdown.
 *
 * <p>
 * On startup the persisted snapshot is loaded, every agent listed under
 * {@code discovery.fleet} is registered, and operations start when
 * {@code discovery.orchestrator.auto-start} is enabled. All orchestrator calls
 * run on the {@link EventLoop}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FleetLifecycle {

    private static final long CONTROL_TIMEOUT_SECONDS = 30;

    private final AgentOrchestrator orchestrator;
    private final AgentFactory agentFactory;
    private final EventLoop eventLoop;
    private final DiscoveryProperties properties;

    @PostConstruct
    public void start() {
        runOnLoop(() -> {
            orchestrator.loadPersistentState();
            for (DiscoveryProperties.FleetMember member : properties.getFleet()) {
                if (member.getKind() == null) {
                    throw new IllegalArgumentException("discovery.fleet entry without a kind: " + member.getId());
                }
                orchestrator.registerAgent(agentFactory.create(member.getKind(), member.getId()));
            }
            if (properties.getOrchestrator().isAutoStart() && !orchestrator.getAgents().isEmpty()) {
                orchestrator.startAutonomousOperations();
            }
            return null;
        });
        log.info("[Fleet] {} agents registered", properties.getFleet().size());
    }

    @PreDestroy
    public void stop() {
        try {
            runOnLoop(() -> {
                orchestrator.stopAutonomousOperations();
                return null;
            });
        } catch (RuntimeException e) {
            log.error("[Fleet] Failed to stop operations cleanly: {}", e.getMessage());
        }
    }

    private void runOnLoop(Callable<Void> action) {
        try {
            eventLoop.submit(action).get(CONTROL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the event loop", e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Event loop did not respond in " + CONTROL_TIMEOUT_SECONDS + "s", e);
        }
    }
}

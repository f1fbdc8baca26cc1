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

import me.golemcore.discovery.domain.agent.DiscoveryAgent;
import me.golemcore.discovery.domain.loop.EventLoop;
import me.golemcore.discovery.domain.loop.ScheduledHandle;
import me.golemcore.discovery.domain.model.HealingProcess;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Drives the bounded, backed-off healing protocol for agents.
 *
 * <p>
 * At most one {@link HealingProcess} exists per agent. The first attempt runs
 * immediately; a failed attempt {@code n} is retried after
 * {@code baseDelay * backoffMultiplier^n} until {@code maxRetries} attempts
 * have been made, after which the process is dropped and reported as failed.
 * An attempt fails when the agent is unknown or its {@code heal()} throws.
 *
 * <p>
 * Must be used from the {@link EventLoop}.
 */
@Slf4j
public class HealingSupervisor {

    /**
     * Outcome callbacks.
     */
    public interface Listener {

        void onHealed(String agentId, int attempts);

        void onHealingFailed(String agentId, int attempts, String lastError);
    }

    private final EventLoop eventLoop;
    private final Clock clock;
    private final DiscoveryProperties.HealingProperties settings;
    private final Function<String, DiscoveryAgent> agentLookup;
    private final Listener listener;

    private final Map<String, HealingProcess> processes = new LinkedHashMap<>();
    private final Map<String, ScheduledHandle> pendingRetries = new LinkedHashMap<>();

    public HealingSupervisor(EventLoop eventLoop, Clock clock, DiscoveryProperties.HealingProperties settings,
            Function<String, DiscoveryAgent> agentLookup, Listener listener) {
        this.eventLoop = eventLoop;
        this.clock = clock;
        this.settings = settings;
        this.agentLookup = agentLookup;
        this.listener = listener;
    }

    /**
     * Open a healing process for an agent and run the first attempt.
     *
     * @return {@code false} if the agent is already being healed
     */
    public boolean scheduleHealing(String agentId, Throwable cause) {
        if (processes.containsKey(agentId)) {
            log.debug("[Healing] {} already under healing", agentId);
            return false;
        }

        HealingProcess process = HealingProcess.builder()
                .agentId(agentId)
                .attempts(0)
                .lastError(cause != null ? cause.getMessage() : null)
                .nextAttemptAt(clock.instant())
                .build();
        processes.put(agentId, process);
        log.info("[Healing] Scheduled healing for {}: {}", agentId, process.getLastError());

        performHealing(agentId);
        return true;
    }

    void performHealing(String agentId) {
        HealingProcess process = processes.get(agentId);
        if (process == null) {
            return;
        }
        pendingRetries.remove(agentId);

        process.setState(HealingProcess.HealingState.ATTEMPTING);
        process.setAttempts(process.getAttempts() + 1);

        DiscoveryAgent agent = agentLookup.apply(agentId);
        if (agent == null) {
            process.setLastError("Agent " + agentId + " is not registered");
            log.warn("[Healing] Attempt {} for {}: agent not registered", process.getAttempts(), agentId);
        } else {
            try {
                agent.heal();
                process.setState(HealingProcess.HealingState.HEALED);
                processes.remove(agentId);
                log.info("[Healing] {} healed after {} attempts", agentId, process.getAttempts());
                listener.onHealed(agentId, process.getAttempts());
                return;
            } catch (RuntimeException e) {
                process.setLastError(e.getMessage());
                log.warn("[Healing] Attempt {} failed for {}: {}", process.getAttempts(), agentId, e.getMessage());
            }
        }

        if (process.getAttempts() < settings.getMaxRetries()) {
            Duration delay = backoffDelay(process.getAttempts());
            process.setState(HealingProcess.HealingState.SCHEDULED);
            process.setNextAttemptAt(clock.instant().plus(delay));
            pendingRetries.put(agentId, eventLoop.schedule(() -> performHealing(agentId), delay));
            log.debug("[Healing] Next attempt for {} in {}ms", agentId, delay.toMillis());
        } else {
            process.setState(HealingProcess.HealingState.FAILED);
            processes.remove(agentId);
            log.error("[Healing] {} healing failed after {} attempts", agentId, process.getAttempts());
            listener.onHealingFailed(agentId, process.getAttempts(), process.getLastError());
        }
    }

    Duration backoffDelay(int attempts) {
        double millis = settings.getBaseDelayMs() * Math.pow(settings.getBackoffMultiplier(), attempts);
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Drop every open process and its pending retry.
     */
    public void cancelAll() {
        pendingRetries.values().forEach(ScheduledHandle::cancel);
        pendingRetries.clear();
        if (!processes.isEmpty()) {
            log.info("[Healing] Cancelled healing for {}", processes.keySet());
        }
        processes.clear();
    }

    public boolean isHealing(String agentId) {
        return processes.containsKey(agentId);
    }

    public Optional<HealingProcess> getProcess(String agentId) {
        return Optional.ofNullable(processes.get(agentId));
    }

    public List<String> getHealingAgentIds() {
        return List.copyOf(processes.keySet());
    }
}

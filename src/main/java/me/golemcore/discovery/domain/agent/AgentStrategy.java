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

import me.golemcore.discovery.domain.model.AdaptiveStrategy;
import me.golemcore.discovery.domain.model.AgentConfig;
import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.model.AgentStatusView;
import me.golemcore.discovery.domain.model.CollaborationRequest;
import me.golemcore.discovery.domain.model.DeepAnalysis;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.domain.model.DiscoveryTask;
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.domain.model.TaskResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Capability contract an agent kind implements. The agent only calls these
 * methods and never assumes how work is actually done; real registry, WHOIS or
 * chain lookups live behind implementations of this interface.
 *
 * <p>
 * All methods are invoked on the event loop. {@link #executeTask} may complete
 * its future on any thread.
 */
public interface AgentStrategy {

    AgentKind kind();

    /**
     * Acquire resources before the first cycle. A thrown exception keeps the
     * agent out of the running state.
     */
    default void initialize() throws Exception {
    }

    default void cleanup() {
    }

    /**
     * Every task type this strategy can produce.
     */
    List<String> taskTypes();

    List<DiscoveryTask> generateTasks(AgentConfig config, AdaptiveStrategy strategy);

    CompletableFuture<TaskResult> executeTask(DiscoveryTask task);

    double calculateConfidence(Finding finding);

    double calculateRelevance(Finding finding);

    default List<CollaborationRequest> identifyCollaborationOpportunities(AgentStatusView self) {
        return List.of();
    }

    /**
     * React to a relevant discovery shared by a peer.
     */
    default void adaptToDiscovery(Discovery discovery, String sourceAgentId, AdaptiveStrategy strategy) {
    }

    DeepAnalysis conductDeepAnalysis(Discovery discovery);

    /**
     * Strategy-specific recovery performed while the agent heals. Throwing
     * marks the healing attempt as failed.
     */
    default void onHeal() {
    }
}

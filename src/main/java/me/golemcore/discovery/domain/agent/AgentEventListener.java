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

import me.golemcore.discovery.domain.model.AgentStatus;
import me.golemcore.discovery.domain.model.CollaborationRequest;
import me.golemcore.discovery.domain.model.Discovery;

/**
 * Typed observer for agent-level events. Callbacks are delivered on the event
 * loop, in order, one at a time.
 */
public interface AgentEventListener {

    AgentEventListener NOOP = new AgentEventListener() {
    };

    default void onDiscovery(String agentId, Discovery discovery) {
    }

    default void onCollaborationRequest(String agentId, CollaborationRequest request) {
    }

    default void onStatusChange(String agentId, AgentStatus status) {
    }

    default void onError(String agentId, Throwable error) {
    }

    default void onCycleCompleted(String agentId) {
    }
}

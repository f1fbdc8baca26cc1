package me.golemcore.discovery.port.outbound;

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

import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.model.DiscoveryTask;
import me.golemcore.discovery.domain.model.Finding;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the external sources a discovery task probes (registrars, auction
 * platforms, blockchains, ...). Implementations may complete the returned
 * future on any thread.
 */
public interface DiscoverySourcePort {

    /**
     * Probe the sources behind a task.
     *
     * @param kind
     *            kind of the agent that owns the task
     * @param task
     *            task to run
     * @return the finding, or empty when the probe turned up nothing; completes
     *         exceptionally when the source failed
     */
    CompletableFuture<Optional<Finding>> probe(AgentKind kind, DiscoveryTask task);
}

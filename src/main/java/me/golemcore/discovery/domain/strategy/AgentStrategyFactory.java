package me.golemcore.discovery.domain.strategy;

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

import me.golemcore.discovery.domain.agent.AgentStrategy;
import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.port.outbound.DiscoverySourcePort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;

/**
 * Creates the bundled strategy for an {@link AgentKind}. Every call returns a
 * fresh instance, one per agent.
 */
@Component
@RequiredArgsConstructor
public class AgentStrategyFactory {

    private final DiscoverySourcePort discoverySource;
    private final Clock clock;

    public AgentStrategy create(AgentKind kind) {
        Random random = new Random();
        return switch (kind) {
        case DOMAIN_HUNTER -> new DomainHunterStrategy(discoverySource, random, clock);
        case ASSET_SEEKER -> new AssetSeekerStrategy(discoverySource, random, clock);
        case RECURSIVE_EXPLORER -> new RecursiveExplorerStrategy(discoverySource, random, clock);
        };
    }
}

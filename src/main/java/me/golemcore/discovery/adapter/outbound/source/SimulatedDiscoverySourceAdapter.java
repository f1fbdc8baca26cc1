package me.golemcore.discovery.adapter.outbound.source;

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
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.port.outbound.DiscoverySourcePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

/**
 * Simulated discovery source. Each probe completes after a random latency on
 * a background thread and either finds something, finds nothing or fails, with
 * the configured probabilities. A fixed {@code discovery.simulation.seed} makes
 * the sequence of outcomes reproducible.
 */
@Component
@Slf4j
public class SimulatedDiscoverySourceAdapter implements DiscoverySourcePort {

    private static final List<String> TLDS = List.of("com", "net", "org", "io", "ai");
    private static final List<String> BLOCKCHAINS = List.of("ethereum", "bitcoin", "polygon", "solana");

    private final DiscoveryProperties.SimulationProperties settings;
    private final Random random;

    @Autowired
    public SimulatedDiscoverySourceAdapter(DiscoveryProperties properties) {
        this(properties.getSimulation(), properties.getSimulation().getSeed() != null
                ? new Random(properties.getSimulation().getSeed())
                : new Random());
    }

    SimulatedDiscoverySourceAdapter(DiscoveryProperties.SimulationProperties settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    @Override
    public CompletableFuture<Optional<Finding>> probe(AgentKind kind, DiscoveryTask task) {
        long latency = nextLatencyMillis();
        Executor delayed = CompletableFuture.delayedExecutor(latency, TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(() -> simulate(kind, task), delayed);
    }

    Optional<Finding> simulate(AgentKind kind, DiscoveryTask task) {
        double roll = random.nextDouble();
        if (roll < settings.getFailureProbability()) {
            throw new IllegalStateException("Source unavailable for " + task.getType());
        }
        if (roll >= settings.getFailureProbability() + settings.getFindingProbability()) {
            log.debug("[Simulation] {} found nothing for {}", kind.getTypeTag(), task.getType());
            return Optional.empty();
        }
        return Optional.of(findingFor(task));
    }

    long nextLatencyMillis() {
        long min = settings.getMinLatency().toMillis();
        long max = Math.max(min, settings.getMaxLatency().toMillis());
        return min + (max > min ? (long) (random.nextDouble() * (max - min)) : 0L);
    }

    private Finding findingFor(DiscoveryTask task) {
        Map<String, Object> data = new LinkedHashMap<>();
        String type;
        switch (task.getType()) {
        case "expired-domain-scan" -> {
            type = "expired-domains";
            List<String> domains = domains("expired", 5 + random.nextInt(20));
            data.put("domains", domains);
            data.put("totalFound", domains.size());
        }
        case "auction-monitoring" -> {
            type = "auction-opportunities";
            data.put("auctions", domains("auction", 1 + random.nextInt(6)));
            data.put("platform", task.getParameters().getOrDefault("platforms", "sedo"));
        }
        case "premium-domain-search", "keyword-domain-hunt", "competitor-analysis", "trend-based-discovery" -> {
            type = "premium-domain-opportunities";
            data.put("domains", domains(task.getType(), 1 + random.nextInt(8)));
            data.put("source", task.getType());
        }
        case "blockchain-sweep", "cross-chain-analysis" -> {
            type = task.getType().equals("blockchain-sweep") ? "blockchain-sweep-results" : "cross-chain-analysis";
            data.put("blockchain", pick(BLOCKCHAINS));
            data.put("assets", wallets(1 + random.nextInt(5)));
            data.put("blockchainCrossLinks", indicator("bridge-hop"));
        }
        case "asset-correlation-analysis", "movement-pattern-detection", "ownership-mapping" -> {
            type = "asset-correlations";
            data.put("strongCorrelations", random.nextInt(8));
            data.put("hiddenPatterns", random.nextBoolean() ? List.of("layered-transfer") : List.of());
            data.put("assetMovementPattern", indicator("cyclical-transfer"));
            data.put("obscureDomainOwnership", indicator("proxy-registrant"));
        }
        case "dormant-asset-scan", "nft-treasure-hunt", "defi-position-discovery" -> {
            type = "dormant-assets";
            data.put("assets", wallets(1 + random.nextInt(10)));
            data.put("recoverableAssets", random.nextInt(12));
            data.put("hiddenAssetClusters", indicator("dormant-cluster"));
        }
        case "deep-recursive-scan", "boundary-expansion", "connection-amplification",
                "parallel-path-exploration" -> {
            type = task.getType();
            data.put("depth", task.getRecursionDepth() != null ? task.getRecursionDepth() : 0);
            data.put("unexploredBranches", random.nextBoolean() ? List.of("branch-" + random.nextInt(100)) : List.of());
            data.put("connections", IntStream.range(0, random.nextInt(10)).mapToObj(i -> "node-" + i).toList());
            data.put("potentialValue", random.nextInt(2000));
        }
        default -> {
            type = task.getType().equals("serendipity-dive") ? "serendipity-discoveries" : task.getType();
            data.put("noveltyFactor", round(random.nextDouble()));
            data.put("serendipityScore", round(random.nextDouble()));
        }
        }
        return new Finding(type, data);
    }

    private Map<String, Object> indicator(String pattern) {
        Map<String, Object> indicator = new LinkedHashMap<>();
        indicator.put("pattern", pattern);
        indicator.put("confidence", round(random.nextDouble()));
        return indicator;
    }

    private List<String> domains(String prefix, int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> prefix + "-" + random.nextInt(10_000) + "." + pick(TLDS))
                .toList();
    }

    private List<String> wallets(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "0x" + Long.toHexString(random.nextLong()))
                .toList();
    }

    private <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}

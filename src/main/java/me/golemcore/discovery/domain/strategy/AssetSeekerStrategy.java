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

import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.model.AssetCluster;
import me.golemcore.discovery.domain.model.DeepAnalysis;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.domain.model.HiddenCorrelation;
import me.golemcore.discovery.port.outbound.DiscoverySourcePort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Sweeps blockchains for dormant, correlated and cross-chain assets. Preferred
 * agent kind for deep analysis.
 */
public class AssetSeekerStrategy extends AbstractDiscoveryStrategy {

    private static final List<String> BLOCKCHAINS = List.of("ethereum", "bitcoin", "polygon", "solana",
            "cardano");
    private static final int MIN_ASSET_VALUE = 100;
    private static final String ML_INSIGHTS = "Correlated movements and layered ownership point to assets "
            + "managed as one network across chains and jurisdictions.";
    private static final Map<String, Integer> PRIORITIES = priorities();

    public AssetSeekerStrategy(DiscoverySourcePort discoverySource, Random random, Clock clock) {
        super(discoverySource, random, clock);
    }

    @Override
    public AgentKind kind() {
        return AgentKind.ASSET_SEEKER;
    }

    @Override
    protected Map<String, Integer> taskPriorities() {
        return PRIORITIES;
    }

    @Override
    protected Map<String, Object> taskParameters(String taskType) {
        return switch (taskType) {
        case "blockchain-sweep" -> Map.of("blockchain", pick(BLOCKCHAINS), "blockCount", 50 + random.nextInt(100));
        case "asset-correlation-analysis" -> Map.of("assetIds", assetIds(10), "analysisDepth", "deep");
        case "movement-pattern-detection" -> Map.of("timeframe", pick(List.of("24h", "7d", "30d")),
                "minTransactionValue", 1000);
        case "ownership-mapping" -> Map.of("assetIds", assetIds(15), "traceDepth", 5);
        case "dormant-asset-scan" -> Map.of("dormancyDays", 365 + random.nextInt(730),
                "minValue", MIN_ASSET_VALUE);
        case "cross-chain-analysis" -> Map.of("timeframe", "7d",
                "bridgeProtocols", List.of("polygon", "arbitrum", "optimism"));
        case "nft-treasure-hunt" -> Map.of("collections", List.of("cryptopunks", "boredapes", "azuki"),
                "rarityThreshold", 0.05);
        case "defi-position-discovery" -> Map.of("protocols", List.of("uniswap", "compound", "aave"),
                "minApy", 5.0);
        default -> Map.of();
        };
    }

    @Override
    public double calculateConfidence(Finding finding) {
        double confidence = 0.6;
        if ("dormant-assets".equals(finding.type()) && numberOf(finding.get("recoverableAssets")) > 5) {
            confidence += 0.3;
        }
        if ("asset-correlations".equals(finding.type()) && numberOf(finding.get("strongCorrelations")) > 3) {
            confidence += 0.2;
        }
        if (sizeOf(finding.get("hiddenPatterns")) > 0) {
            confidence += 0.1;
        }
        return Math.min(confidence, 1.0);
    }

    @Override
    public double calculateRelevance(Finding finding) {
        double relevance = 0.4;
        if (finding.typeContains("asset") || finding.typeContains("correlation")) {
            relevance += 0.4;
        }
        if (finding.has("blockchain") || finding.typeContains("movement")) {
            relevance += 0.3;
        }
        if (finding.has("domains") && "premium-domain-opportunities".equals(finding.type())) {
            relevance += 0.2;
        }
        return Math.min(relevance, 1.0);
    }

    @Override
    public DeepAnalysis conductDeepAnalysis(Discovery discovery) {
        Finding finding = discovery.finding();
        List<HiddenCorrelation> correlations = new ArrayList<>();
        List<AssetCluster> clusters = new ArrayList<>();

        if (finding.has("assets") || "blockchain-sweep-results".equals(finding.type())) {
            correlations.add(new HiddenCorrelation("asset-movement-correlation", "coordinated-liquidation", 0.87,
                    "Synchronized movement across assets suggests coordinated management"));
            correlations.add(new HiddenCorrelation("ownership-shell-network", "layered-ownership", 0.82,
                    "Assets trace back to an interconnected shell company network"));
        }
        if (finding.has("blockchain") || "cross-chain-analysis".equals(finding.type())) {
            correlations.add(new HiddenCorrelation("cross-chain-correlation", "bridge-arbitrage-network", 0.93,
                    "Cross-chain arbitrage network with automated profit extraction"));
        }
        if ("dormant-assets".equals(finding.type())) {
            clusters.add(new AssetCluster("dormant-treasure-" + clock.millis(),
                    List.of("forgotten-eth-wallet", "abandoned-nft-collection", "expired-domain-cluster"),
                    "~$125K", "2019-08-22", "low"));
        }
        if (correlations.isEmpty()) {
            return super.conductDeepAnalysis(discovery);
        }
        return new DeepAnalysis(correlations, clusters, meanConfidence(correlations), ML_INSIGHTS);
    }

    private static List<String> assetIds(int count) {
        return IntStream.range(0, count).mapToObj(i -> "asset-" + i).toList();
    }

    private static Map<String, Integer> priorities() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        priorities.put("blockchain-sweep", 9);
        priorities.put("asset-correlation-analysis", 8);
        priorities.put("movement-pattern-detection", 7);
        priorities.put("ownership-mapping", 8);
        priorities.put("dormant-asset-scan", 9);
        priorities.put("cross-chain-analysis", 7);
        priorities.put("nft-treasure-hunt", 6);
        priorities.put("defi-position-discovery", 7);
        return priorities;
    }
}

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

import me.golemcore.discovery.domain.model.AdaptiveStrategy;
import me.golemcore.discovery.domain.model.AgentKind;
import me.golemcore.discovery.domain.model.AssetCluster;
import me.golemcore.discovery.domain.model.DeepAnalysis;
import me.golemcore.discovery.domain.model.Discovery;
import me.golemcore.discovery.domain.model.DiscoveryTask;
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.domain.model.HiddenCorrelation;
import me.golemcore.discovery.domain.model.TaskResult;
import me.golemcore.discovery.port.outbound.DiscoverySourcePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Explores recursively: a finding with enough open leads spawns a follow-up
 * task one level deeper, up to {@link #MAX_RECURSION_DEPTH}.
 */
@Slf4j
public class RecursiveExplorerStrategy extends AbstractDiscoveryStrategy {

    static final int MAX_RECURSION_DEPTH = 5;
    private static final int MIN_RECURSION_FACTORS = 2;
    private static final List<String> WALK_STRATEGIES = List.of("breadth-first", "depth-first", "random-walk",
            "spiral-search");
    private static final String RECURSIVE_INSIGHTS = "Persistent multi-level exploration surfaced structural "
            + "patterns that only emerge several hops away from the starting point.";
    private static final Map<String, Integer> PRIORITIES = priorities();

    public RecursiveExplorerStrategy(DiscoverySourcePort discoverySource, Random random, Clock clock) {
        super(discoverySource, random, clock);
    }

    @Override
    public AgentKind kind() {
        return AgentKind.RECURSIVE_EXPLORER;
    }

    @Override
    protected Map<String, Integer> taskPriorities() {
        return PRIORITIES;
    }

    @Override
    protected double taskSelectionProbability() {
        return 0.7;
    }

    @Override
    protected Map<String, Object> taskParameters(String taskType) {
        return switch (taskType) {
        case "deep-recursive-scan" -> Map.of("startingNodes", 5, "maxDepth", MAX_RECURSION_DEPTH,
                "walk", pick(WALK_STRATEGIES));
        case "boundary-expansion" -> Map.of("expansionFactor", 1.5 + random.nextDouble() * 2);
        case "unexplored-territory-mapping" -> Map.of("mappingDepth", 3 + random.nextInt(5), "resolution", "high");
        case "connection-amplification" -> Map.of("amplificationFactor", 2 + random.nextDouble() * 4,
                "maxConnections", 50);
        case "serendipity-dive" -> Map.of("diveDepth", 3 + random.nextInt(5), "serendipityFactor", 0.6);
        case "parallel-path-exploration" -> Map.of("pathCount", 5, "maxDepth", 6);
        case "deadend-resurrection" -> Map.of("resurrectionStrategy",
                pick(List.of("alternative-approach", "brute-force", "lateral-thinking")));
        case "spiral-discovery" -> Map.of("maxRadius", 8, "resolution", 12);
        default -> Map.of();
        };
    }

    @Override
    protected DiscoveryTask createTask(String taskType, AdaptiveStrategy strategy) {
        DiscoveryTask task = super.createTask(taskType, strategy);
        task.setRecursionDepth(0);
        return task;
    }

    @Override
    protected TaskResult toResult(DiscoveryTask task, Finding finding) {
        TaskResult result = TaskResult.found(finding);
        int depth = task.getRecursionDepth() != null ? task.getRecursionDepth() : 0;
        if (depth >= MAX_RECURSION_DEPTH || !shouldRecurse(finding)) {
            return result;
        }

        Map<String, Object> parameters = new LinkedHashMap<>(task.getParameters());
        parameters.put("parentDiscoveryType", finding.type());
        parameters.put("recursiveContext", true);
        List<String> path = new ArrayList<>(task.getExplorationPath());
        path.add(finding.type());

        DiscoveryTask followUp = task.toBuilder()
                .id("recursive-" + task.getId() + "-" + clock.millis())
                .createdAt(clock.instant())
                .recursionDepth(depth + 1)
                .parameters(parameters)
                .explorationPath(path)
                .build();
        log.debug("[RecursiveExplorer] Recursing into {} (depth {})", followUp.getType(), depth + 1);
        return result.withFollowUps(List.of(followUp));
    }

    boolean shouldRecurse(Finding finding) {
        long factors = Stream.of(
                sizeOf(finding.get("unexploredBranches")) > 0,
                sizeOf(finding.get("connections")) > 5,
                numberOf(finding.get("potentialValue")) > 1000,
                numberOf(finding.get("noveltyFactor")) > 0.7,
                "boundary-expansion".equals(finding.type()))
                .filter(Boolean::booleanValue)
                .count();
        return factors >= MIN_RECURSION_FACTORS;
    }

    @Override
    public double calculateConfidence(Finding finding) {
        double confidence = 0.7;
        if (numberOf(finding.get("depth")) > 5) {
            confidence += 0.2;
        }
        if (finding.typeContains("recursive") || finding.typeContains("boundary")) {
            confidence += 0.1;
        }
        if (numberOf(finding.get("serendipityScore")) > 0.8) {
            confidence += 0.1;
        }
        return Math.min(confidence, 1.0);
    }

    @Override
    public double calculateRelevance(Finding finding) {
        double relevance = 0.5;
        if (finding.has("unexploredBranches") || finding.has("connections")) {
            relevance += 0.3;
        }
        if (sizeOf(finding.get("correlations")) > 3) {
            relevance += 0.2;
        }
        if (finding.typeContains("boundary") || finding.typeContains("expansion")) {
            relevance += 0.2;
        }
        return Math.min(relevance, 1.0);
    }

    @Override
    public void adaptToDiscovery(Discovery discovery, String sourceAgentId, AdaptiveStrategy strategy) {
        if (discovery.finding().has("unexploredBranches")) {
            strategy.setSearchDepth("deep");
        }
    }

    @Override
    public DeepAnalysis conductDeepAnalysis(Discovery discovery) {
        Finding finding = discovery.finding();
        List<HiddenCorrelation> correlations = new ArrayList<>();
        List<AssetCluster> clusters = new ArrayList<>();

        if (finding.typeContains("recursive") || finding.typeContains("exploration")) {
            correlations.add(new HiddenCorrelation("recursive-exploration-pattern", "fibonacci-spiral-discovery",
                    0.91, "Discovery follows an organic network expansion pattern"));
            correlations.add(new HiddenCorrelation("boundary-breakthrough", "exponential-expansion", 0.86,
                    "Exploration moved past the previous search boundaries"));
        }
        if (finding.has("amplifications") || "connection-amplification".equals(finding.type())) {
            correlations.add(new HiddenCorrelation("network-amplification", "cascade-multiplication", 0.94,
                    "Each discovered connection reveals several additional pathways"));
        }
        if ("serendipity-discoveries".equals(finding.type())) {
            correlations.add(new HiddenCorrelation("serendipitous-correlation", "non-local-link", 0.88,
                    "Unrelated discoveries share non-obvious correlations"));
        }
        if ("deep-recursive-scan".equals(finding.type()) || "boundary-expansion".equals(finding.type())) {
            clusters.add(new AssetCluster("recursive-treasure-" + clock.millis(),
                    List.of("deep-exploration-wallet", "boundary-expansion-nft-collection",
                            "recursive-domain-cluster", "hidden-defi-position"),
                    "~$280K", "2020-11-30", "medium"));
        }
        if (correlations.isEmpty()) {
            return super.conductDeepAnalysis(discovery);
        }
        return new DeepAnalysis(correlations, clusters, meanConfidence(correlations), RECURSIVE_INSIGHTS);
    }

    private static Map<String, Integer> priorities() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        priorities.put("deep-recursive-scan", 10);
        priorities.put("boundary-expansion", 9);
        priorities.put("unexplored-territory-mapping", 7);
        priorities.put("connection-amplification", 8);
        priorities.put("serendipity-dive", 8);
        priorities.put("parallel-path-exploration", 7);
        priorities.put("deadend-resurrection", 6);
        priorities.put("spiral-discovery", 6);
        return priorities;
    }
}

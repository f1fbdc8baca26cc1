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
import me.golemcore.discovery.domain.model.AdaptiveStrategy;
import me.golemcore.discovery.domain.model.AgentConfig;
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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for the bundled strategies.
 *
 * <p>
 * Subclasses declare a task catalog (type to priority) and the parameters of
 * each task type. Every cycle each catalog entry is picked independently with
 * {@link #taskSelectionProbability()}, and the picks are capped at the agent's
 * concurrency ceiling. Execution is delegated to the
 * {@link DiscoverySourcePort}; {@link #toResult(DiscoveryTask, Finding)} lets a
 * subclass attach follow-up work to a finding.
 */
@Slf4j
public abstract class AbstractDiscoveryStrategy implements AgentStrategy {

    static final String DEFAULT_INSIGHTS = "Pattern recognition identified non-obvious asset relationships "
            + "that manual analysis would likely miss.";

    protected final DiscoverySourcePort discoverySource;
    protected final Random random;
    protected final Clock clock;

    protected AbstractDiscoveryStrategy(DiscoverySourcePort discoverySource, Random random, Clock clock) {
        this.discoverySource = discoverySource;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Task catalog in generation order, mapped to priorities.
     */
    protected abstract Map<String, Integer> taskPriorities();

    protected abstract Map<String, Object> taskParameters(String taskType);

    protected double taskSelectionProbability() {
        return 0.5;
    }

    @Override
    public List<String> taskTypes() {
        return List.copyOf(taskPriorities().keySet());
    }

    @Override
    public List<DiscoveryTask> generateTasks(AgentConfig config, AdaptiveStrategy strategy) {
        List<DiscoveryTask> tasks = new ArrayList<>();
        for (String taskType : taskPriorities().keySet()) {
            if (tasks.size() >= config.getMaxConcurrentTasks()) {
                break;
            }
            if (random.nextDouble() < taskSelectionProbability()) {
                tasks.add(createTask(taskType, strategy));
            }
        }
        return tasks;
    }

    protected DiscoveryTask createTask(String taskType, AdaptiveStrategy strategy) {
        Map<String, Object> parameters = new LinkedHashMap<>(taskParameters(taskType));
        parameters.put("scope", strategy.getScope());
        parameters.put("searchDepth", strategy.getSearchDepth());
        return DiscoveryTask.builder()
                .id(taskType + "-" + clock.millis() + "-" + shortId())
                .type(taskType)
                .createdAt(clock.instant())
                .priority(taskPriorities().getOrDefault(taskType, 5))
                .parameters(parameters)
                .build();
    }

    @Override
    public CompletableFuture<TaskResult> executeTask(DiscoveryTask task) {
        if (!taskPriorities().containsKey(task.getType())) {
            return CompletableFuture.completedFuture(TaskResult.failed("Unknown task type: " + task.getType()));
        }
        log.debug("[{}] Executing {} ({})", kind().getTypeTag(), task.getType(), task.getId());
        return discoverySource.probe(kind(), task)
                .thenApply(finding -> finding
                        .map(found -> toResult(task, found))
                        .orElseGet(TaskResult::empty));
    }

    protected TaskResult toResult(DiscoveryTask task, Finding finding) {
        return TaskResult.found(finding);
    }

    /**
     * Correlations for assets, domains and blockchain links found in the
     * payload, plus one hidden asset cluster.
     */
    @Override
    public DeepAnalysis conductDeepAnalysis(Discovery discovery) {
        Finding finding = discovery.finding();
        List<HiddenCorrelation> correlations = new ArrayList<>();

        if (finding.has("assets")) {
            correlations.add(new HiddenCorrelation("asset-movement", "cyclical-transfer", 0.85,
                    "Recurring transfer pattern suggesting automated management"));
        }
        if (finding.has("domains")) {
            correlations.add(new HiddenCorrelation("ownership-pattern", "shell-company-network", 0.72,
                    "Multiple domains registered through layered shell companies"));
        }
        if (finding.has("blockchain")) {
            correlations.add(new HiddenCorrelation("blockchain-link", "cross-chain-bridge", 0.91,
                    "Assets linked across multiple blockchain networks"));
        }

        List<AssetCluster> clusters = List.of(new AssetCluster("cluster-" + clock.millis(),
                List.of("hidden-wallet-1", "dormant-domain-1", "forgotten-nft-1"),
                "~$50K", "2021-03-15", "medium"));

        return new DeepAnalysis(correlations, clusters, meanConfidence(correlations), DEFAULT_INSIGHTS);
    }

    protected static double meanConfidence(List<HiddenCorrelation> correlations) {
        return correlations.stream().mapToDouble(HiddenCorrelation::confidence).average().orElse(0.0);
    }

    protected static int sizeOf(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        return 0;
    }

    protected static double numberOf(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }

    protected <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 9).replace("-", "");
    }
}

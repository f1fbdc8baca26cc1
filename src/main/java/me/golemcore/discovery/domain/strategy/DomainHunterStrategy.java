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
import me.golemcore.discovery.domain.model.Finding;
import me.golemcore.discovery.port.outbound.DiscoverySourcePort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Hunts expired, auctioned and undervalued domains.
 */
public class DomainHunterStrategy extends AbstractDiscoveryStrategy {

    private static final List<String> TLDS = List.of(".com", ".net", ".org", ".io", ".ai", ".co");
    private static final Map<String, Integer> PRIORITIES = priorities();

    public DomainHunterStrategy(DiscoverySourcePort discoverySource, Random random, Clock clock) {
        super(discoverySource, random, clock);
    }

    @Override
    public AgentKind kind() {
        return AgentKind.DOMAIN_HUNTER;
    }

    @Override
    protected Map<String, Integer> taskPriorities() {
        return PRIORITIES;
    }

    @Override
    protected Map<String, Object> taskParameters(String taskType) {
        return switch (taskType) {
        case "expired-domain-scan" -> Map.of("tlds", TLDS.subList(0, 3), "maxAgeDays", 365);
        case "auction-monitoring" -> Map.of("platforms", List.of("sedo", "godaddy", "flippa"), "maxBid", 1000);
        case "premium-domain-search" -> Map.of("tld", pick(TLDS), "maxPrice", 5000);
        case "keyword-domain-hunt" -> Map.of("industry", pick(List.of("tech", "finance", "health", "education")),
                "maxLength", 12);
        case "competitor-analysis" -> Map.of("industry", pick(List.of("saas", "ecommerce", "fintech")),
                "depth", "deep");
        case "trend-based-discovery" -> Map.of("timeframe", "7d",
                "sources", List.of("google-trends", "social-media", "news"));
        default -> Map.of();
        };
    }

    @Override
    public double calculateConfidence(Finding finding) {
        double confidence = 0.5;
        if ("expired-domains".equals(finding.type()) && sizeOf(finding.get("domains")) > 5) {
            confidence += 0.3;
        }
        if ("auction-opportunities".equals(finding.type())) {
            confidence += 0.2;
        }
        if (numberOf(finding.get("totalFound")) > 10) {
            confidence += 0.1;
        }
        return Math.min(confidence, 1.0);
    }

    @Override
    public double calculateRelevance(Finding finding) {
        double relevance = 0.3;
        if (finding.typeContains("domain")) {
            relevance += 0.4;
        }
        if (finding.has("domains") || "asset-correlation".equals(finding.type())) {
            relevance += 0.3;
        }
        return Math.min(relevance, 1.0);
    }

    private static Map<String, Integer> priorities() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        priorities.put("expired-domain-scan", 8);
        priorities.put("auction-monitoring", 9);
        priorities.put("premium-domain-search", 6);
        priorities.put("keyword-domain-hunt", 7);
        priorities.put("competitor-analysis", 5);
        priorities.put("trend-based-discovery", 8);
        return priorities;
    }
}

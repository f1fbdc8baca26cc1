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

import me.golemcore.discovery.domain.model.Discovery;

import java.util.List;
import java.util.Map;

/**
 * Fires when any configured indicator field of the payload holds a map whose
 * {@code confidence} exceeds the threshold.
 */
public class IndicatorDeepAnalysisTrigger implements DeepAnalysisTrigger {

    private final List<String> indicatorFields;
    private final double threshold;

    public IndicatorDeepAnalysisTrigger(List<String> indicatorFields, double threshold) {
        this.indicatorFields = List.copyOf(indicatorFields);
        this.threshold = threshold;
    }

    @Override
    public boolean shouldAnalyze(Discovery discovery) {
        Map<String, Object> payload = discovery.payload();
        for (String field : indicatorFields) {
            if (payload.get(field) instanceof Map<?, ?> indicator
                    && indicator.get("confidence") instanceof Number confidence
                    && confidence.doubleValue() > threshold) {
                return true;
            }
        }
        return false;
    }
}

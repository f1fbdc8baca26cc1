package me.golemcore.discovery.infrastructure.event;

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

import me.golemcore.discovery.domain.model.FleetEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes every published {@link FleetEvent} to the log.
 */
@Component
@Slf4j
public class FleetEventLogger {

    @EventListener
    public void onFleetEvent(FleetEvent event) {
        switch (event.type()) {
        case BOT_ERROR, BOT_HEALING_FAILED, ERROR ->
            log.warn("[Fleet] {} from {}: {}", event.type(), event.agentId(), event.payload());
        case CYCLE_COMPLETED, STATUS_CHANGE ->
            log.debug("[Fleet] {} from {}: {}", event.type(), event.agentId(), event.payload());
        default -> log.info("[Fleet] {} from {}: {}", event.type(), event.agentId(), event.payload());
        }
    }
}

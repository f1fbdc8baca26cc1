package me.golemcore.discovery.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of discovery agents. Each kind selects one strategy implementation and
 * carries the wire-level type tag used in snapshots and events.
 */
public enum AgentKind {
    DOMAIN_HUNTER("DomainHunter"), ASSET_SEEKER("AssetSeeker"), RECURSIVE_EXPLORER("RecursiveExplorer");

    private final String typeTag;

    AgentKind(String typeTag) {
        this.typeTag = typeTag;
    }

    @JsonValue
    public String getTypeTag() {
        return typeTag;
    }

    @JsonCreator
    public static AgentKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Agent kind must not be blank");
        }
        for (AgentKind kind : values()) {
            if (kind.name().equalsIgnoreCase(raw) || kind.typeTag.equalsIgnoreCase(raw)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown agent kind: " + raw);
    }
}

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed payload produced by a strategy. Opaque to the agent apart from its
 * type tag; the agent hashes it into a dedup key.
 */
public record Finding(String type, Map<String, Object> data) {

    public Finding {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public Object get(String key) {
        return data.get(key);
    }

    public boolean has(String key) {
        return data.get(key) != null;
    }

    public boolean typeContains(String fragment) {
        return type != null && type.contains(fragment);
    }
}

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.sopflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * How a procedure is started, with an opaque engine-specific configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class Trigger {

    private final String type;
    private final Map<String, Object> config;

    public Trigger(String type, Map<String, Object> config) {
        this.type = type;
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public Trigger(TriggerType type, Map<String, Object> config) {
        this(Objects.requireNonNull(type, "Trigger type cannot be null").getValue(), config);
    }

    public String getType() {
        return type;
    }

    /**
     * @return the resolved trigger type, or null when the authored type is unknown
     */
    public TriggerType getTriggerType() {
        return TriggerType.fromValue(type).orElse(null);
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Trigger that = (Trigger) o;
        return Objects.equals(type, that.type) &&
               Objects.equals(config, that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, config);
    }

    @Override
    public String toString() {
        return "Trigger{" +
               "type='" + type + '\'' +
               ", config=" + config +
               '}';
    }
}

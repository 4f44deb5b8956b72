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

package dev.mars.sopflow.compiler;

import dev.mars.sopflow.core.Condition;
import dev.mars.sopflow.core.Step;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Round-trip metadata stored on every step node under the reserved parameter key:
 * <pre>
 * { id, order, title, description, type, config: { actionType, parameters }, conditionTargets }
 * </pre>
 * {@code conditionTargets} holds each condition's target step ID in condition order, with
 * {@code null} for conditions without one, since the true-branch edges alone cannot say
 * which condition they belong to.
 * Reading is lenient because the map may come back from JSON edited by hand or by the engine.
 *
 * @param id          step ID
 * @param order       step order at compile time
 * @param title       step title
 * @param description step description
 * @param type        step type as authored
 * @param actionType  action type, may be null
 * @param parameters  step parameters as authored
 * @param conditionTargets target step ID per condition, or null when not recorded
 */
public record StepMetadata(String id, int order, String title, String description, String type,
                           String actionType, Map<String, Object> parameters, List<String> conditionTargets) {

    public static StepMetadata of(Step step) {
        List<String> targets = new ArrayList<>();
        for (Condition condition : step.getConditions()) {
            targets.add(condition.getNextStep());
        }
        return new StepMetadata(step.getId(), step.getOrder(), step.getTitle(), step.getDescription(),
                step.getType(), step.getActionType(), step.getParameters(), targets);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("actionType", actionType);
        config.put("parameters", parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", id);
        metadata.put("order", order);
        metadata.put("title", title);
        metadata.put("description", description);
        metadata.put("type", type);
        metadata.put("config", config);
        if (conditionTargets != null && !conditionTargets.isEmpty()) {
            metadata.put("conditionTargets", new ArrayList<>(conditionTargets));
        }
        return metadata;
    }

    /**
     * Reads metadata from a node's parameter value.
     *
     * @return the metadata, or empty when the value is not a map or has no step ID
     */
    public static Optional<StepMetadata> read(Object value) {
        if (!(value instanceof Map<?, ?> metadata)) {
            return Optional.empty();
        }
        String id = asString(metadata.get("id"));
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }

        String actionType = null;
        Map<String, Object> parameters = Map.of();
        if (metadata.get("config") instanceof Map<?, ?> config) {
            actionType = asString(config.get("actionType"));
            parameters = asStringKeyedMap(config.get("parameters"));
        }

        List<String> conditionTargets = null;
        if (metadata.get("conditionTargets") instanceof List<?> targets) {
            conditionTargets = new ArrayList<>();
            for (Object target : targets) {
                conditionTargets.add(asString(target));
            }
        }

        int order = metadata.get("order") instanceof Number number ? number.intValue() : 0;
        return Optional.of(new StepMetadata(id, order, asString(metadata.get("title")),
                asString(metadata.get("description")), asString(metadata.get("type")), actionType, parameters,
                conditionTargets));
    }

    static Map<String, Object> asStringKeyedMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, entry) -> result.put(String.valueOf(key), entry));
        }
        return result;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}

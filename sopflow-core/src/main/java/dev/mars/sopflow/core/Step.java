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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a procedure document.
 * <p>
 * The {@code type} is kept as authored; {@link #getStepType()} resolves it to
 * the closed {@link StepType} set and returns {@code null} for unknown values,
 * which the validator reports. {@code actionType} only matters for action steps
 * and {@code conditions} only for decision steps. {@code parameters} is an
 * ordered, opaque bag passed through to the engine unchanged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class Step {

    private final String id;
    private final int order;
    private final String title;
    private final String description;
    private final String type;
    private final String actionType;
    private final Map<String, Object> parameters;
    private final List<String> nextSteps;
    private final List<Condition> conditions;

    public Step(String id, int order, String title, String description, String type, String actionType,
                Map<String, Object> parameters, List<String> nextSteps, List<Condition> conditions) {
        this.id = id;
        this.order = order;
        this.title = title;
        this.description = description;
        this.type = type;
        this.actionType = actionType;
        // LinkedHashMap keeps authoring order and tolerates null values from JSON
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        this.nextSteps = nextSteps != null
                ? Collections.unmodifiableList(new ArrayList<>(nextSteps)) : List.of();
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public String getId() {
        return id;
    }

    public int getOrder() {
        return order;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the step type as authored, possibly null or unknown
     */
    public String getType() {
        return type;
    }

    /**
     * @return the resolved step type, or null when {@link #getType()} is missing or unknown
     */
    public StepType getStepType() {
        return StepType.fromValue(type).orElse(null);
    }

    public String getActionType() {
        return actionType;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public List<String> getNextSteps() {
        return nextSteps;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public Step withOrder(int newOrder) {
        if (newOrder == order) {
            return this;
        }
        return toBuilder().order(newOrder).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .order(order)
                .title(title)
                .description(description)
                .type(type)
                .actionType(actionType)
                .parameters(parameters)
                .nextSteps(nextSteps)
                .conditions(conditions);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Step that = (Step) o;
        return order == that.order &&
               Objects.equals(id, that.id) &&
               Objects.equals(title, that.title) &&
               Objects.equals(description, that.description) &&
               Objects.equals(type, that.type) &&
               Objects.equals(actionType, that.actionType) &&
               Objects.equals(parameters, that.parameters) &&
               Objects.equals(nextSteps, that.nextSteps) &&
               Objects.equals(conditions, that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, order, title, description, type, actionType, parameters, nextSteps, conditions);
    }

    @Override
    public String toString() {
        return "Step{" +
               "id='" + id + '\'' +
               ", order=" + order +
               ", title='" + title + '\'' +
               ", type='" + type + '\'' +
               ", actionType='" + actionType + '\'' +
               ", nextSteps=" + nextSteps +
               ", conditions=" + conditions.size() +
               '}';
    }

    public static class Builder {
        private String id;
        private int order;
        private String title;
        private String description;
        private String type;
        private String actionType;
        private Map<String, Object> parameters;
        private List<String> nextSteps;
        private List<Condition> conditions;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder type(StepType type) {
            this.type = type != null ? type.getValue() : null;
            return this;
        }

        public Builder actionType(String actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder nextSteps(List<String> nextSteps) {
            this.nextSteps = nextSteps;
            return this;
        }

        public Builder conditions(List<Condition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Step build() {
            return new Step(id, order, title, description, type, actionType, parameters, nextSteps, conditions);
        }
    }
}

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
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A standard operating procedure: ordered steps, branching decisions,
 * sub-processes, waits and the triggers that start it.
 *
 * <p>Documents are immutable values. They are built by hand through
 * {@link #builder()}, read from markup or YAML, or recovered from a workflow
 * graph by the reverse compiler. Nothing about a document is checked on
 * construction; structural rules are enforced by the procedure validator so
 * that every violation can be reported at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class ProcedureDocument {

    private final String title;
    private final String description;
    private final String version;
    private final List<Step> steps;
    private final List<Trigger> triggers;

    public ProcedureDocument(String title, String description, String version,
                             List<Step> steps, List<Trigger> triggers) {
        this.title = title;
        this.description = description;
        this.version = version;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.triggers = triggers != null ? List.copyOf(triggers) : List.of();
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    /**
     * @return steps in declaration order
     */
    public List<Step> getSteps() {
        return steps;
    }

    /**
     * @return steps sorted by ascending {@code order}; ties keep declaration order
     */
    public List<Step> getStepsInOrder() {
        List<Step> sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingInt(Step::getOrder));
        return sorted;
    }

    public List<Trigger> getTriggers() {
        return triggers;
    }

    public boolean hasTriggers() {
        return !triggers.isEmpty();
    }

    public Optional<Step> findStep(String stepId) {
        if (stepId == null) {
            return Optional.empty();
        }
        return steps.stream().filter(step -> stepId.equals(step.getId())).findFirst();
    }

    public Builder toBuilder() {
        return new Builder()
                .title(title)
                .description(description)
                .version(version)
                .steps(steps)
                .triggers(triggers);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcedureDocument that = (ProcedureDocument) o;
        return Objects.equals(title, that.title) &&
               Objects.equals(description, that.description) &&
               Objects.equals(version, that.version) &&
               Objects.equals(steps, that.steps) &&
               Objects.equals(triggers, that.triggers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, version, steps, triggers);
    }

    @Override
    public String toString() {
        return "ProcedureDocument{" +
               "title='" + title + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + steps.size() +
               ", triggers=" + triggers +
               '}';
    }

    public static class Builder {
        private String title;
        private String description;
        private String version;
        private final List<Step> steps = new ArrayList<>();
        private final List<Trigger> triggers = new ArrayList<>();

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder steps(List<Step> steps) {
            this.steps.clear();
            if (steps != null) {
                this.steps.addAll(steps);
            }
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.triggers.add(Objects.requireNonNull(trigger, "Trigger cannot be null"));
            return this;
        }

        public Builder triggers(List<Trigger> triggers) {
            this.triggers.clear();
            if (triggers != null) {
                this.triggers.addAll(triggers);
            }
            return this;
        }

        public ProcedureDocument build() {
            return new ProcedureDocument(title, description, version, steps, triggers);
        }
    }
}

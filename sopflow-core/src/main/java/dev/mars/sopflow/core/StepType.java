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

import java.util.Optional;

/**
 * Kinds of step a procedure document may contain.
 * <p>
 * Documents carry the step type as authored text so that the validator can
 * report unknown values; compilers resolve it to this closed set and dispatch
 * with exhaustive {@code switch} expressions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public enum StepType {

    /**
     * A unit of work mapped to an engine node through the action type table.
     */
    ACTION("action"),

    /**
     * A branching point evaluated against the step's conditions.
     */
    DECISION("decision"),

    /**
     * Invocation of another workflow.
     */
    SUBPROCESS("subprocess"),

    /**
     * A pause before the procedure continues.
     */
    WAIT("wait");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    /**
     * @return the textual form used in documents and markup
     */
    public String getValue() {
        return value;
    }

    /**
     * Resolves a textual step type, ignoring case and surrounding whitespace.
     *
     * @param value the authored type, may be null
     * @return the matching step type, or empty when the value is not a known type
     */
    public static Optional<StepType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (StepType type : values()) {
            if (type.value.equalsIgnoreCase(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}

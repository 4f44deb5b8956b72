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
 * Comparison operators a decision condition can use.
 * <p>
 * Each operator has a word form (used in documents) and a symbol form (used in
 * markup condition lines). Both forms are accepted when resolving.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public enum ConditionOperator {

    EQUALS("equals", "=="),
    CONTAINS("contains", "contains"),
    GREATER("greater", ">"),
    LESS("less", "<");

    private final String value;
    private final String symbol;

    ConditionOperator(String value, String symbol) {
        this.value = value;
        this.symbol = symbol;
    }

    public String getValue() {
        return value;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Resolves an operator from either its word or its symbol form.
     *
     * @param text the operator text, may be null
     * @return the operator, or empty when the text is not recognised
     */
    public static Optional<ConditionOperator> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim();
        for (ConditionOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(normalized) || operator.symbol.equals(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}

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

import java.util.Objects;

/**
 * A branch condition on a decision step.
 * <p>
 * When {@code field} read from the execution state compares true against
 * {@code value} with {@code operator}, execution continues at {@code nextStep}.
 * The value is opaque to the compiler; it is normally a string, number or boolean.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class Condition {

    private final String field;
    private final ConditionOperator operator;
    private final Object value;
    private final String nextStep;

    public Condition(String field, ConditionOperator operator, Object value, String nextStep) {
        this.field = field;
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        this.value = value;
        this.nextStep = nextStep;
    }

    public String getField() {
        return field;
    }

    public ConditionOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    public String getNextStep() {
        return nextStep;
    }

    public Condition withNextStep(String nextStep) {
        return new Condition(field, operator, value, nextStep);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition that = (Condition) o;
        return Objects.equals(field, that.field) &&
               operator == that.operator &&
               Objects.equals(value, that.value) &&
               Objects.equals(nextStep, that.nextStep);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value, nextStep);
    }

    @Override
    public String toString() {
        return "Condition{" +
               "field='" + field + '\'' +
               ", operator=" + operator +
               ", value=" + value +
               ", nextStep='" + nextStep + '\'' +
               '}';
    }
}

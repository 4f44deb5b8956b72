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

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnumLookupTest {

    @Test
    void testStepTypeFromValue() {
        assertEquals(Optional.of(StepType.DECISION), StepType.fromValue("decision"));
        assertEquals(Optional.of(StepType.SUBPROCESS), StepType.fromValue(" SubProcess "));
        assertTrue(StepType.fromValue("loop").isEmpty());
        assertTrue(StepType.fromValue(null).isEmpty());
    }

    @Test
    void testTriggerTypeFromValue() {
        assertEquals(Optional.of(TriggerType.WEBHOOK), TriggerType.fromValue("webhook"));
        assertEquals(Optional.of(TriggerType.EVENT), TriggerType.fromValue("EVENT"));
        assertTrue(TriggerType.fromValue("email").isEmpty());
        assertTrue(TriggerType.fromValue("").isEmpty());
    }

    @Test
    void testConditionOperatorFromWordOrSymbol() {
        assertEquals(Optional.of(ConditionOperator.EQUALS), ConditionOperator.fromText("=="));
        assertEquals(Optional.of(ConditionOperator.EQUALS), ConditionOperator.fromText("equals"));
        assertEquals(Optional.of(ConditionOperator.GREATER), ConditionOperator.fromText(">"));
        assertEquals(Optional.of(ConditionOperator.LESS), ConditionOperator.fromText("Less"));
        assertEquals(Optional.of(ConditionOperator.CONTAINS), ConditionOperator.fromText("contains"));
        assertTrue(ConditionOperator.fromText(">=").isEmpty());
        assertTrue(ConditionOperator.fromText(null).isEmpty());
    }

    @Test
    void testToStringUsesAuthoredValue() {
        assertEquals("action", StepType.ACTION.toString());
        assertEquals("schedule", TriggerType.SCHEDULE.toString());
        assertEquals("==", ConditionOperator.EQUALS.getSymbol());
    }
}

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
import dev.mars.sopflow.core.ConditionOperator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionParametersTest {

    @Test
    void testWriteUsesOperatorTypeOfValue() {
        Map<String, Object> parameters = ConditionParameters.write(List.of(
                new Condition("status", ConditionOperator.CONTAINS, "open", "a"),
                new Condition("active", ConditionOperator.EQUALS, true, "b"),
                new Condition("count", ConditionOperator.LESS, 3, "c")));

        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) parameters.get("conditions");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> comparisons = (List<Map<String, Object>>) body.get("conditions");

        assertEquals(Map.of("type", "string", "operation", "contains"), comparisons.get(0).get("operator"));
        assertEquals(Map.of("type", "boolean", "operation", "equals"), comparisons.get(1).get("operator"));
        assertEquals(Map.of("type", "number", "operation", "lt"), comparisons.get(2).get("operator"));
        assertEquals("condition_2", comparisons.get(2).get("id"));
        assertEquals(Map.of("caseSensitive", true, "leftValue", "", "typeValidation", "strict"), body.get("options"));
    }

    @Test
    void testReadDropsTargets() {
        List<Condition> written = List.of(new Condition("amount", ConditionOperator.GREATER, 10, "next"));

        List<Condition> read = ConditionParameters.read(ConditionParameters.write(written));

        assertEquals(List.of(new Condition("amount", ConditionOperator.GREATER, 10, null)), read);
    }

    @Test
    void testReadLegacyShape() {
        Map<String, Object> parameters = Map.of("conditions", Map.of("string", List.of(
                Map.of("value1", "={{ $json[\"name\"] }}", "operation", "contains", "value2", "Ltd"))));

        assertEquals(List.of(new Condition("name", ConditionOperator.CONTAINS, "Ltd", null)),
                ConditionParameters.read(parameters));
    }

    @Test
    void testUnknownOperationFallsBackToEquals() {
        Map<String, Object> comparison = Map.of("leftValue", "={{ $json.tier }}", "rightValue", "gold",
                "operator", Map.of("type", "string", "operation", "startsWith"));
        Map<String, Object> parameters = Map.of("conditions", Map.of("conditions", List.of(comparison)));

        assertEquals(List.of(new Condition("tier", ConditionOperator.EQUALS, "gold", null)),
                ConditionParameters.read(parameters));
    }

    @Test
    void testFieldExpressions() {
        assertEquals("amount", ConditionParameters.fieldOf("={{ $json[\"amount\"] }}"));
        assertEquals("order.total", ConditionParameters.fieldOf("{{$json.order.total}}"));
        assertEquals("plain text", ConditionParameters.fieldOf("plain text"));
        assertEquals("", ConditionParameters.fieldOf(null));
        assertEquals("={{ $json[\"x\"] }}", ConditionParameters.fieldExpression("x"));
    }

    @Test
    void testMissingConditionsReadAsEmpty() {
        assertTrue(ConditionParameters.read(Map.of()).isEmpty());
        assertTrue(ConditionParameters.read(Map.of("conditions", "not a map")).isEmpty());
    }
}

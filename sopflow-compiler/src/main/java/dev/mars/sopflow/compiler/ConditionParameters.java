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
import dev.mars.sopflow.mapping.NodeTypeMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between decision conditions and the conditional node's comparison parameters.
 *
 * <p>Written in the current shape, one comparison per condition, combined with {@code or}:</p>
 * <pre>
 * conditions: {
 *   options: { caseSensitive, leftValue, typeValidation },
 *   conditions: [ { id, leftValue: "={{ $json["field"] }}", rightValue, operator: { type, operation } } ],
 *   combinator: "or"
 * }
 * </pre>
 * <p>Read from either that shape or the legacy
 * {@code conditions: { string|number|boolean: [ { value1, operation, value2 } ] }} shape.
 * Conditions read back carry no target; the caller assigns it from the true-branch edges.</p>
 */
final class ConditionParameters {

    private static final Logger logger = Logger.getLogger(ConditionParameters.class.getName());

    static final String CONDITIONS = "conditions";

    private static final Pattern FIELD_EXPRESSION =
            Pattern.compile("^=?\\{\\{\\s*\\$json(?:\\[\"?([^\"\\]]*)\"?]|\\.([\\w.]+))\\s*}}$");

    private ConditionParameters() {
    }

    static Map<String, Object> write(List<Condition> conditions) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("caseSensitive", true);
        options.put("leftValue", "");
        options.put("typeValidation", "strict");

        List<Map<String, Object>> comparisons = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);

            Map<String, Object> operator = new LinkedHashMap<>();
            operator.put("type", valueType(condition.getValue()));
            operator.put("operation", NodeTypeMap.operationFor(condition.getOperator()));

            Map<String, Object> comparison = new LinkedHashMap<>();
            comparison.put("id", "condition_" + i);
            comparison.put("leftValue", fieldExpression(condition.getField()));
            comparison.put("rightValue", condition.getValue());
            comparison.put("operator", operator);
            comparisons.add(comparison);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("options", options);
        body.put(CONDITIONS, comparisons);
        body.put("combinator", "or");

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(CONDITIONS, body);
        return parameters;
    }

    static List<Condition> read(Map<String, Object> parameters) {
        List<Condition> conditions = new ArrayList<>();
        if (!(parameters.get(CONDITIONS) instanceof Map<?, ?> body)) {
            return conditions;
        }

        if (body.get(CONDITIONS) instanceof List<?> comparisons) {
            for (Object entry : comparisons) {
                if (entry instanceof Map<?, ?> comparison) {
                    String operation = comparison.get("operator") instanceof Map<?, ?> operator
                            ? asString(operator.get("operation")) : null;
                    conditions.add(new Condition(fieldOf(comparison.get("leftValue")), operatorOf(operation),
                            comparison.get("rightValue"), null));
                }
            }
            return conditions;
        }

        // legacy shape, grouped by value type
        for (Object group : body.values()) {
            if (group instanceof List<?> comparisons) {
                for (Object entry : comparisons) {
                    if (entry instanceof Map<?, ?> comparison) {
                        conditions.add(new Condition(fieldOf(comparison.get("value1")),
                                operatorOf(asString(comparison.get("operation"))), comparison.get("value2"), null));
                    }
                }
            }
        }
        return conditions;
    }

    static String fieldExpression(String field) {
        return "={{ $json[\"" + (field != null ? field : "") + "\"] }}";
    }

    static String fieldOf(Object leftValue) {
        String expression = asString(leftValue);
        if (expression == null) {
            return "";
        }
        Matcher matcher = FIELD_EXPRESSION.matcher(expression.trim());
        if (!matcher.matches()) {
            return expression;
        }
        return matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
    }

    private static ConditionOperator operatorOf(String operation) {
        return NodeTypeMap.operatorFor(operation).orElseGet(() -> {
            logger.warning("Unsupported comparison operation '" + operation + "', using equals");
            return ConditionOperator.EQUALS;
        });
    }

    private static String valueType(Object value) {
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "string";
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}

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

package dev.mars.sopflow.markup;

import dev.mars.sopflow.core.Condition;
import dev.mars.sopflow.core.ConditionOperator;
import dev.mars.sopflow.core.ProcedureDocument;
import dev.mars.sopflow.core.Step;
import dev.mars.sopflow.core.Trigger;
import dev.mars.sopflow.core.exceptions.ProcedureParseException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * YAML-based implementation of ProcedureDocumentParser.
 * Reads procedure documents stored as YAML using SnakeYAML's safe constructor.
 *
 * <pre>
 * title: Invoice Approval
 * version: 1.0.0
 * triggers:
 *   - type: webhook
 *     config: { path: invoices }
 * steps:
 *   - id: check
 *     title: Check amount
 *     type: decision
 *     conditions:
 *       - { field: amount, operator: greater, value: 1000, nextStep: manager }
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 */
public class YamlProcedureParser implements ProcedureDocumentParser {

    private static final Logger logger = Logger.getLogger(YamlProcedureParser.class.getName());

    private final Yaml yaml;

    public YamlProcedureParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public ProcedureDocument parse(Path yamlFile) throws ProcedureParseException {
        String content;
        try {
            content = Files.readString(yamlFile);
        } catch (IOException e) {
            throw new ProcedureParseException("Failed to read YAML file: " + yamlFile, e);
        }
        try {
            return parseFromString(content);
        } catch (ProcedureParseException e) {
            throw e.withDocumentName(yamlFile.getFileName().toString());
        }
    }

    @Override
    public ProcedureDocument parseFromString(String yamlContent) throws ProcedureParseException {
        Object data;
        try {
            data = yaml.load(yamlContent);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            int line = mark != null ? mark.getLine() + 1 : -1;
            throw new ProcedureParseException(null, line, null, "YAML parsing failed: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new ProcedureParseException("YAML parsing failed", e);
        }

        if (data == null) {
            throw new ProcedureParseException("Empty or invalid YAML content");
        }
        if (!(data instanceof Map)) {
            throw new ProcedureParseException("Procedure YAML must be a mapping at the root");
        }

        @SuppressWarnings("unchecked")
        ProcedureDocument document = parseDocument((Map<String, Object>) data);
        logger.info("Parsed YAML procedure '" + document.getTitle() + "' with " + document.getSteps().size() + " steps");
        return document;
    }

    private ProcedureDocument parseDocument(Map<String, Object> data) throws ProcedureParseException {
        ProcedureDocument.Builder builder = ProcedureDocument.builder()
                .title(getStringValue(data, "title"))
                .description(getStringValue(data, "description"))
                .version(getStringValue(data, "version"));

        List<?> triggers = getListValue(data, "triggers");
        if (triggers != null) {
            for (int i = 0; i < triggers.size(); i++) {
                Map<String, Object> trigger = asMap(triggers.get(i));
                if (trigger == null) {
                    throw new ProcedureParseException("triggers[" + i + "]", "Trigger must be a mapping");
                }
                builder.trigger(new Trigger(getStringValue(trigger, "type"), getMapValue(trigger, "config")));
            }
        }

        List<?> steps = getListValue(data, "steps");
        if (steps != null) {
            for (int i = 0; i < steps.size(); i++) {
                builder.step(parseStep(asMap(steps.get(i)), i));
            }
        }

        return builder.build();
    }

    private Step parseStep(Map<String, Object> stepData, int index) throws ProcedureParseException {
        String path = "steps[" + index + "]";
        if (stepData == null) {
            throw new ProcedureParseException(path, "Step must be a mapping");
        }

        List<Condition> conditions = new ArrayList<>();
        List<?> conditionList = getListValue(stepData, "conditions");
        if (conditionList != null) {
            for (int c = 0; c < conditionList.size(); c++) {
                conditions.add(parseCondition(asMap(conditionList.get(c)), path + ".conditions[" + c + "]"));
            }
        }

        return Step.builder()
                .id(getStringValue(stepData, "id"))
                .order(getIntValue(stepData, "order", index + 1, path + ".order"))
                .title(getStringValue(stepData, "title"))
                .description(getStringValue(stepData, "description"))
                .type(getStringValue(stepData, "type"))
                .actionType(getStringValue(stepData, "actionType"))
                .parameters(getMapValue(stepData, "parameters"))
                .nextSteps(getStringList(stepData, "nextSteps"))
                .conditions(conditions)
                .build();
    }

    private Condition parseCondition(Map<String, Object> conditionData, String path) throws ProcedureParseException {
        if (conditionData == null) {
            throw new ProcedureParseException(path, "Condition must be a mapping");
        }
        String operatorText = getStringValue(conditionData, "operator");
        ConditionOperator operator = ConditionOperator.fromText(operatorText)
                .orElseThrow(() -> new ProcedureParseException(path + ".operator",
                        "Unknown condition operator: " + operatorText));
        return new Condition(getStringValue(conditionData, "field"), operator, conditionData.get("value"),
                getStringValue(conditionData, "nextStep"));
    }

    private String getStringValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue, String path)
            throws ProcedureParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ProcedureParseException(path, "Expected an integer but found '" + value + "'");
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private List<?> getListValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof List ? (List<?>) value : null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private List<String> getStringList(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof List<?> list)) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}

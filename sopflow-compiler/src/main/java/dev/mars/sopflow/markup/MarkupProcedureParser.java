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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the line-oriented procedure markup.
 *
 * <pre>
 * # SOP: Invoice Approval
 * ## Version: 1.2.0
 * ## Description
 * Routes invoices to the right approver.
 * ## Trigger
 * - Type: webhook
 * - Config: {"path": "invoices"}
 * ## Steps
 * ### 1. Check amount
 * - Id: check
 * - Type: decision
 * - Condition: amount &gt; 1000
 *   - If true: manager
 * - Next: clerk
 * </pre>
 *
 * <p>Sections are read with a small state machine. A heading closes the step being
 * read and fills in defaults: type {@code action}, id {@code step_<order>}, title
 * {@code Step <order>} and an empty description. A step heading without a number takes
 * the next position. Parameter values, condition values and trigger config are decoded
 * as JSON when possible and kept as text otherwise. A condition field that contains
 * whitespace is written as a JSON string.</p>
 *
 * <p>Description lines are kept with their line breaks. A description line starting with
 * {@code #} or {@code \} is escaped with a leading {@code \}. Type, action and trigger
 * values are kept as written; their kinds are resolved case-insensitively later.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class MarkupProcedureParser implements ProcedureDocumentParser {

    private static final Logger logger = Logger.getLogger(MarkupProcedureParser.class.getName());

    private static final Pattern STEP_HEADING = Pattern.compile("^###\\s+(?:(\\d+)\\.\\s*)?(.*)$");
    private static final Pattern CONDITION = Pattern.compile(
            "^(\"(?:[^\"\\\\]|\\\\.)*\"|\\S+)\\s+(==|contains|>|<|equals|greater|less)\\s+(.+)$",
            Pattern.CASE_INSENSITIVE);

    private enum Section {
        NONE, DESCRIPTION, TRIGGER, STEPS
    }

    @Override
    public ProcedureDocument parse(Path file) throws ProcedureParseException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ProcedureParseException("Failed to read procedure markup: " + file, e);
        }
        try {
            return parseFromString(content);
        } catch (ProcedureParseException e) {
            throw e.withDocumentName(file.getFileName().toString());
        }
    }

    @Override
    public ProcedureDocument parseFromString(String markup) throws ProcedureParseException {
        if (markup == null || markup.isBlank()) {
            throw new ProcedureParseException("Procedure markup is empty");
        }

        ParseState state = new ParseState();
        String[] lines = markup.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            parseLine(lines[i], i + 1, state);
        }
        state.closeStep();
        state.closeTrigger();

        ProcedureDocument document = ProcedureDocument.builder()
                .title(state.title)
                .description(state.description())
                .version(state.version)
                .steps(state.steps)
                .triggers(state.triggers)
                .build();
        logger.info("Parsed procedure markup '" + document.getTitle() + "' with " + document.getSteps().size() + " steps");
        return document;
    }

    private void parseLine(String rawLine, int lineNumber, ParseState state) throws ProcedureParseException {
        String line = rawLine.trim();
        if (state.section == Section.DESCRIPTION && !line.startsWith("#")) {
            state.descriptionLines.add(rawLine.startsWith("\\") ? rawLine.substring(1) : rawLine);
            return;
        }
        if (line.isEmpty()) {
            return;
        }

        if (line.startsWith("### ")) {
            state.closeStep();
            if (state.section != Section.STEPS) {
                logger.fine("Line " + lineNumber + ": step heading outside the steps section ignored");
                return;
            }
            state.openStep(line);
            return;
        }
        if (line.startsWith("## ")) {
            state.closeStep();
            openSection(line.substring(3).trim(), state);
            return;
        }
        if (line.startsWith("# ")) {
            state.title = line.substring(2).replaceFirst("^(?i)SOP:\\s*", "").trim();
            return;
        }
        if (line.startsWith("#")) {
            return;
        }

        switch (state.section) {
            case TRIGGER -> {
                if (line.startsWith("- ")) {
                    parseTriggerProperty(line.substring(2), state);
                }
            }
            case STEPS -> {
                if (line.startsWith("- ") && state.step != null) {
                    boolean nested = Character.isWhitespace(rawLine.charAt(0));
                    parseStepProperty(line.substring(2), nested, lineNumber, state.step);
                }
            }
            case NONE -> logger.fine("Line " + lineNumber + " is outside any section and was ignored");
        }
    }

    private void openSection(String heading, ParseState state) {
        String name = heading.toLowerCase(Locale.ROOT);
        if (name.startsWith("version")) {
            int colon = heading.indexOf(':');
            String version = colon >= 0 ? heading.substring(colon + 1).trim() : "";
            state.version = version.isEmpty() ? null : version;
            // version is a one-line section
            state.section = Section.NONE;
            return;
        }
        switch (name) {
            case "description" -> {
                state.section = Section.DESCRIPTION;
                state.descriptionLines = new ArrayList<>();
            }
            case "trigger", "triggers" -> state.section = Section.TRIGGER;
            case "steps" -> state.section = Section.STEPS;
            default -> {
                logger.fine("Unknown section '" + heading + "' ignored");
                state.section = Section.NONE;
            }
        }
    }

    private void parseTriggerProperty(String content, ParseState state) {
        String key = keyOf(content);
        String value = valueOf(content);

        if (key.equals("type")) {
            state.closeTrigger();
            state.trigger = new TriggerDraft();
            state.trigger.type = value;
            return;
        }
        if (state.trigger == null) {
            state.trigger = new TriggerDraft();
        }
        if (key.equals("config")) {
            Object config = MarkupValues.decode(value);
            if (config instanceof Map<?, ?> map) {
                map.forEach((k, v) -> state.trigger.config.put(String.valueOf(k), v));
            } else {
                state.trigger.config.put("raw", value);
            }
        } else {
            state.trigger.config.put(key, value);
        }
    }

    private void parseStepProperty(String content, boolean nested, int lineNumber, StepDraft step)
            throws ProcedureParseException {
        String rawKey = content.indexOf(':') >= 0 ? content.substring(0, content.indexOf(':')).trim() : content.trim();
        String key = rawKey.toLowerCase(Locale.ROOT);
        String value = valueOf(content);

        if (key.equals("if true")) {
            if (step.conditions.isEmpty()) {
                throw new ProcedureParseException(lineNumber, "steps." + step.label() + ".conditions",
                        "'If true' without a preceding condition");
            }
            int last = step.conditions.size() - 1;
            step.conditions.set(last, step.conditions.get(last).withNextStep(value.isEmpty() ? null : value));
            return;
        }
        if (nested && step.readingParameters) {
            step.parameters.put(rawKey, MarkupValues.decode(value));
            return;
        }

        step.readingParameters = false;
        switch (key) {
            case "id" -> step.id = value;
            case "type" -> step.type = value;
            case "action" -> step.actionType = value.isEmpty() ? null : value;
            case "description" -> step.description = value;
            case "next" -> {
                for (String target : value.split(",")) {
                    if (!target.isBlank()) {
                        step.nextSteps.add(target.trim());
                    }
                }
            }
            case "condition" -> step.conditions.add(parseCondition(value, lineNumber, step));
            case "parameters" -> {
                step.readingParameters = true;
                if (!value.isEmpty() && MarkupValues.decode(value) instanceof Map<?, ?> inline) {
                    inline.forEach((k, v) -> step.parameters.put(String.valueOf(k), v));
                }
            }
            default -> logger.fine("Line " + lineNumber + ": unknown step property '" + rawKey + "' ignored");
        }
    }

    private Condition parseCondition(String text, int lineNumber, StepDraft step) throws ProcedureParseException {
        Matcher matcher = CONDITION.matcher(text);
        if (!matcher.matches()) {
            throw new ProcedureParseException(lineNumber, "steps." + step.label() + ".conditions",
                    "Malformed condition '" + text + "', expected '<field> <operator> <value>'");
        }
        ConditionOperator operator = ConditionOperator.fromText(matcher.group(2))
                .orElseThrow(() -> new ProcedureParseException(lineNumber, "steps." + step.label() + ".conditions",
                        "Unknown condition operator: " + matcher.group(2)));
        String field = matcher.group(1);
        if (field.startsWith("\"")) {
            field = String.valueOf(MarkupValues.decode(field));
        }
        return new Condition(field, operator, MarkupValues.decode(matcher.group(3).trim()), null);
    }

    private static String keyOf(String content) {
        int colon = content.indexOf(':');
        return (colon >= 0 ? content.substring(0, colon) : content).trim().toLowerCase(Locale.ROOT);
    }

    private static String valueOf(String content) {
        int colon = content.indexOf(':');
        return colon >= 0 ? content.substring(colon + 1).trim() : "";
    }

    private static final class ParseState {
        private Section section = Section.NONE;
        private String title;
        private String version;
        private List<String> descriptionLines;
        private final List<Step> steps = new ArrayList<>();
        private final List<Trigger> triggers = new ArrayList<>();
        private StepDraft step;
        private TriggerDraft trigger;

        String description() {
            return descriptionLines != null ? String.join("\n", descriptionLines).strip() : null;
        }

        void openStep(String heading) {
            Matcher matcher = STEP_HEADING.matcher(heading);
            int order = steps.size() + 1;
            String stepTitle = heading.substring(3).trim();
            if (matcher.matches()) {
                if (matcher.group(1) != null) {
                    order = Integer.parseInt(matcher.group(1));
                }
                stepTitle = matcher.group(2).trim();
            }
            step = new StepDraft(order, stepTitle);
        }

        void closeStep() {
            if (step != null) {
                steps.add(step.build());
                step = null;
            }
        }

        void closeTrigger() {
            if (trigger == null) {
                return;
            }
            if (trigger.type == null || trigger.type.isEmpty()) {
                logger.warning("Trigger without a type ignored");
            } else {
                triggers.add(new Trigger(trigger.type, trigger.config));
            }
            trigger = null;
        }
    }

    private static final class TriggerDraft {
        private String type;
        private final Map<String, Object> config = new LinkedHashMap<>();
    }

    private static final class StepDraft {
        private final int order;
        private final String title;
        private String id;
        private String type;
        private String actionType;
        private String description;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final List<String> nextSteps = new ArrayList<>();
        private final List<Condition> conditions = new ArrayList<>();
        private boolean readingParameters;

        StepDraft(int order, String title) {
            this.order = order;
            this.title = title;
        }

        String label() {
            return id != null && !id.isEmpty() ? id : "#" + order;
        }

        Step build() {
            return Step.builder()
                    .id(id != null && !id.isEmpty() ? id : "step_" + order)
                    .order(order)
                    .title(title != null && !title.isEmpty() ? title : "Step " + order)
                    .description(description != null ? description : "")
                    .type(type != null && !type.isEmpty() ? type : "action")
                    .actionType(actionType)
                    .parameters(parameters)
                    .nextSteps(nextSteps)
                    .conditions(conditions)
                    .build();
        }
    }
}

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
import dev.mars.sopflow.core.ProcedureDocument;
import dev.mars.sopflow.core.Step;
import dev.mars.sopflow.core.Trigger;

import java.util.Map;
import java.util.Objects;

/**
 * Writes a procedure document as markup readable by {@link MarkupProcedureParser}.
 * Sections and step fields are written in a fixed order; optional fields are omitted
 * when unset.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class MarkupProcedureSerializer {

    public String serialize(ProcedureDocument document) {
        Objects.requireNonNull(document, "Procedure document cannot be null");
        StringBuilder out = new StringBuilder();

        if (document.getTitle() != null) {
            out.append("# ").append(document.getTitle()).append("\n\n");
        }

        if (document.getVersion() != null) {
            out.append("## Version: ").append(document.getVersion()).append("\n\n");
        }

        if (document.getDescription() != null) {
            out.append("## Description\n");
            if (!document.getDescription().isBlank()) {
                for (String line : document.getDescription().split("\\R", -1)) {
                    out.append(escapeDescriptionLine(line)).append('\n');
                }
            }
            out.append('\n');
        }

        if (document.hasTriggers()) {
            out.append(document.getTriggers().size() > 1 ? "## Triggers\n" : "## Trigger\n");
            for (Trigger trigger : document.getTriggers()) {
                out.append("- Type: ").append(trigger.getType()).append('\n');
                if (!trigger.getConfig().isEmpty()) {
                    out.append("- Config: ").append(MarkupValues.encode(trigger.getConfig())).append('\n');
                }
            }
            out.append('\n');
        }

        out.append("## Steps\n\n");
        for (Step step : document.getSteps()) {
            writeStep(step, out);
        }

        return out.toString();
    }

    private void writeStep(Step step, StringBuilder out) {
        out.append("### ").append(step.getOrder()).append(". ")
                .append(step.getTitle() != null ? step.getTitle() : "").append('\n');
        out.append("- Id: ").append(step.getId()).append('\n');
        out.append("- Type: ").append(step.getType()).append('\n');

        if (step.getActionType() != null) {
            out.append("- Action: ").append(step.getActionType()).append('\n');
        }
        if (step.getDescription() != null && !step.getDescription().isEmpty()) {
            out.append("- Description: ").append(step.getDescription()).append('\n');
        }

        if (!step.getParameters().isEmpty()) {
            out.append("- Parameters:\n");
            for (Map.Entry<String, Object> parameter : step.getParameters().entrySet()) {
                out.append("  - ").append(parameter.getKey()).append(": ")
                        .append(MarkupValues.encode(parameter.getValue())).append('\n');
            }
        }

        for (Condition condition : step.getConditions()) {
            out.append("- Condition: ").append(conditionField(condition.getField())).append(' ')
                    .append(condition.getOperator().getSymbol()).append(' ')
                    .append(MarkupValues.encode(condition.getValue())).append('\n');
            if (condition.getNextStep() != null) {
                out.append("  - If true: ").append(condition.getNextStep()).append('\n');
            }
        }

        if (!step.getNextSteps().isEmpty()) {
            out.append("- Next: ").append(String.join(", ", step.getNextSteps())).append('\n');
        }

        out.append('\n');
    }

    private static String escapeDescriptionLine(String line) {
        if (line.startsWith("\\") || line.stripLeading().startsWith("#")) {
            return "\\" + line;
        }
        return line;
    }

    private static String conditionField(String field) {
        if (field == null) {
            return "null";
        }
        if (field.isEmpty() || field.startsWith("\"") || field.chars().anyMatch(Character::isWhitespace)) {
            return MarkupValues.encode(field);
        }
        return field;
    }
}

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

package dev.mars.sopflow.validation;

import dev.mars.sopflow.core.Condition;
import dev.mars.sopflow.core.ProcedureDocument;
import dev.mars.sopflow.core.Step;
import dev.mars.sopflow.core.StepType;
import dev.mars.sopflow.core.Trigger;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Structural validator for procedure documents.
 *
 * <p>Every rule is checked independently, so one pass reports all problems:</p>
 * <ul>
 *   <li>title and at least one step are required</li>
 *   <li>description and version are recommended (warnings)</li>
 *   <li>each step needs an id, a title and a known type; ids must be unique</li>
 *   <li>decision steps should carry conditions (warning)</li>
 *   <li>every {@code nextSteps} entry and condition target must name an existing step</li>
 *   <li>trigger types must be known</li>
 * </ul>
 *
 * <p>Validation never throws; a {@code null} document yields a single error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class ProcedureValidator {

    private static final Logger logger = Logger.getLogger(ProcedureValidator.class.getName());

    public ValidationResult validate(ProcedureDocument document) {
        ValidationResult result = new ValidationResult();

        if (document == null) {
            result.addError("document", "Procedure document cannot be null");
            return result;
        }

        validateHeader(document, result);
        validateSteps(document.getSteps(), result);
        validateTriggers(document.getTriggers(), result);

        logger.fine("Validated procedure '" + document.getTitle() + "': " + result);
        return result;
    }

    private void validateHeader(ProcedureDocument document, ValidationResult result) {
        if (isBlank(document.getTitle())) {
            result.addError("title", "Title is required");
        }
        if (isBlank(document.getDescription())) {
            result.addWarning("description", "Description is recommended");
        }
        if (isBlank(document.getVersion())) {
            result.addWarning("version", "Version is recommended");
        }
        if (document.getSteps().isEmpty()) {
            result.addError("steps", "At least one step is required");
        }
    }

    private void validateSteps(List<Step> steps, ValidationResult result) {
        Set<String> stepIds = new HashSet<>();
        // referenced id -> field path of its first reference
        Map<String, String> references = new LinkedHashMap<>();

        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            String path = "steps[" + i + "]";

            if (isBlank(step.getId())) {
                result.addError(path + ".id", step.getId(), "Step ID is required");
            } else if (!stepIds.add(step.getId())) {
                result.addError(path + ".id", step.getId(), "Duplicate step ID: " + step.getId());
            }

            if (isBlank(step.getTitle())) {
                result.addError(path + ".title", step.getId(), "Step title is required");
            }

            if (isBlank(step.getType())) {
                result.addError(path + ".type", step.getId(), "Step type is required");
            } else if (step.getStepType() == null) {
                result.addError(path + ".type", step.getId(), "Invalid step type: " + step.getType());
            }

            if (step.getStepType() == StepType.DECISION && step.getConditions().isEmpty()) {
                result.addWarning(path + ".conditions", step.getId(), "Decision step should have conditions");
            }

            for (String next : step.getNextSteps()) {
                references.putIfAbsent(next, path + ".nextSteps");
            }
            List<Condition> conditions = step.getConditions();
            for (int c = 0; c < conditions.size(); c++) {
                String target = conditions.get(c).getNextStep();
                if (target != null) {
                    references.putIfAbsent(target, path + ".conditions[" + c + "].nextStep");
                }
            }
        }

        references.forEach((referencedId, fieldPath) -> {
            if (!stepIds.contains(referencedId)) {
                result.addError(fieldPath, "Referenced step not found: " + referencedId);
            }
        });
    }

    private void validateTriggers(List<Trigger> triggers, ValidationResult result) {
        for (int i = 0; i < triggers.size(); i++) {
            Trigger trigger = triggers.get(i);
            if (trigger.getTriggerType() == null) {
                result.addError("triggers[" + i + "].type", "Invalid trigger type: " + trigger.getType());
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

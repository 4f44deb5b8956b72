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

package dev.mars.sopflow.mapping;

import dev.mars.sopflow.core.ConditionOperator;
import dev.mars.sopflow.core.StepType;
import dev.mars.sopflow.core.TriggerType;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Bidirectional lookups between procedure vocabulary and engine node types.
 *
 * <p>Forward lookups never fail: a blank action type resolves to {@link ActionNodeType#CODE}
 * and an unknown one to the engine's no-op node. Reverse lookups fall back to a generic
 * action step and a manual trigger.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public final class NodeTypeMap {

    private static final Logger logger = Logger.getLogger(NodeTypeMap.class.getName());

    public static final NodeTypeRef IF = new NodeTypeRef("n8n-nodes-base.if", 2);
    public static final NodeTypeRef EXECUTE_WORKFLOW = new NodeTypeRef("n8n-nodes-base.executeWorkflow", 1);
    public static final NodeTypeRef WAIT = new NodeTypeRef("n8n-nodes-base.wait", 1);
    public static final NodeTypeRef NO_OP = new NodeTypeRef("n8n-nodes-base.noOp", 1);

    private NodeTypeMap() {
    }

    /**
     * Engine node for an action step.
     *
     * @param actionType the step's action type, may be null or blank
     */
    public static NodeTypeRef forAction(String actionType) {
        if (actionType == null || actionType.isBlank()) {
            return ActionNodeType.CODE.getNodeType();
        }
        Optional<ActionNodeType> known = ActionNodeType.fromActionType(actionType);
        if (known.isEmpty()) {
            logger.warning("Unknown action type '" + actionType + "', using " + NO_OP.type());
            return NO_OP;
        }
        return known.get().getNodeType();
    }

    /**
     * Engine node for a step of the given kind. Action steps are resolved through {@link #forAction(String)}.
     */
    public static NodeTypeRef forStep(StepType stepType, String actionType) {
        return switch (stepType) {
            case ACTION -> forAction(actionType);
            case DECISION -> IF;
            case SUBPROCESS -> EXECUTE_WORKFLOW;
            case WAIT -> WAIT;
        };
    }

    public static Optional<String> actionFor(String nodeType) {
        return ActionNodeType.fromNodeType(nodeType).map(ActionNodeType::getActionType);
    }

    public static StepType stepTypeFor(String nodeType) {
        if (IF.type().equals(nodeType)) {
            return StepType.DECISION;
        }
        if (EXECUTE_WORKFLOW.type().equals(nodeType)) {
            return StepType.SUBPROCESS;
        }
        if (WAIT.type().equals(nodeType)) {
            return StepType.WAIT;
        }
        return StepType.ACTION;
    }

    public static boolean isTriggerNode(String nodeType) {
        if (nodeType == null) {
            return false;
        }
        for (TriggerNodeType trigger : TriggerNodeType.values()) {
            if (nodeType.contains(trigger.getNodeType().type())) {
                return true;
            }
        }
        return nodeType.contains(TriggerNodeType.LEGACY_CRON_TRIGGER) || nodeType.endsWith("Trigger");
    }

    public static TriggerType triggerTypeFor(String nodeType) {
        if (nodeType == null) {
            return TriggerType.MANUAL;
        }
        if (nodeType.contains("n8nTrigger")) {
            return TriggerType.EVENT;
        }
        String lower = nodeType.toLowerCase();
        if (lower.contains("schedule") || lower.contains("cron")) {
            return TriggerType.SCHEDULE;
        }
        if (lower.contains("webhook")) {
            return TriggerType.WEBHOOK;
        }
        return TriggerType.MANUAL;
    }

    /**
     * Generic description for a node that carries no notes.
     */
    public static String describe(String nodeType) {
        Optional<ActionNodeType> action = ActionNodeType.fromNodeType(nodeType);
        if (action.isPresent()) {
            return action.get().getDescription();
        }
        if (IF.type().equals(nodeType)) {
            return "Evaluates a condition";
        }
        if (WAIT.type().equals(nodeType)) {
            return "Waits for a specified duration";
        }
        if (EXECUTE_WORKFLOW.type().equals(nodeType)) {
            return "Executes another workflow";
        }
        return "Executes " + nodeType;
    }

    /**
     * Operation name used by the conditional node's comparison list.
     */
    public static String operationFor(ConditionOperator operator) {
        return switch (operator) {
            case EQUALS -> "equals";
            case CONTAINS -> "contains";
            case GREATER -> "gt";
            case LESS -> "lt";
        };
    }

    /**
     * Resolves an operation name from either the current comparison list or the legacy
     * {@code value1/operation/value2} shape. Unknown names resolve to empty.
     */
    public static Optional<ConditionOperator> operatorFor(String operation) {
        if (operation == null) {
            return Optional.empty();
        }
        return switch (operation.trim()) {
            case "equals", "equal", "==" -> Optional.of(ConditionOperator.EQUALS);
            case "contains" -> Optional.of(ConditionOperator.CONTAINS);
            case "gt", "larger", "greater" -> Optional.of(ConditionOperator.GREATER);
            case "lt", "smaller", "less" -> Optional.of(ConditionOperator.LESS);
            default -> Optional.empty();
        };
    }
}

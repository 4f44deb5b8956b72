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

import dev.mars.sopflow.config.SopflowConfiguration;
import dev.mars.sopflow.core.Condition;
import dev.mars.sopflow.core.ProcedureDocument;
import dev.mars.sopflow.core.Step;
import dev.mars.sopflow.core.Trigger;
import dev.mars.sopflow.core.exceptions.CompilationException;
import dev.mars.sopflow.graph.Edge;
import dev.mars.sopflow.graph.GraphNode;
import dev.mars.sopflow.graph.NodeConnections;
import dev.mars.sopflow.graph.Position;
import dev.mars.sopflow.graph.WorkflowGraph;
import dev.mars.sopflow.mapping.NodeTypeMap;
import dev.mars.sopflow.mapping.NodeTypeRef;
import dev.mars.sopflow.mapping.TriggerNodeType;
import dev.mars.sopflow.validation.ProcedureValidator;
import dev.mars.sopflow.validation.ValidationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Compiles a procedure document into a workflow graph.
 *
 * <p>The document is validated first and rejected with a {@link CompilationException}
 * when it has errors. The first trigger becomes the entry node; each step becomes one
 * node, laid out left to right in step order, with the step's full definition stored
 * under the reserved metadata key so that {@link WorkflowGraphDecompiler} can restore it.</p>
 *
 * <p>Instances hold no per-call state and may be shared between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class WorkflowGraphCompiler {

    private static final Logger logger = Logger.getLogger(WorkflowGraphCompiler.class.getName());

    private final SopflowConfiguration configuration;
    private final ProcedureValidator validator;

    public WorkflowGraphCompiler() {
        this(SopflowConfiguration.defaults(), new ProcedureValidator());
    }

    public WorkflowGraphCompiler(SopflowConfiguration configuration, ProcedureValidator validator) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
    }

    public WorkflowGraph compile(ProcedureDocument document) throws CompilationException {
        Objects.requireNonNull(document, "Procedure document cannot be null");
        logger.info("Compiling procedure '" + document.getTitle() + "' with " + document.getSteps().size() + " steps");

        ValidationResult validation = validator.validate(document);
        if (!validation.isValid()) {
            throw new CompilationException(document.getTitle(), "Invalid procedure document",
                    validation.getErrorMessages());
        }
        validation.getWarnings().forEach(warning -> logger.fine("Procedure warning: " + warning));

        CompilationContext context = new CompilationContext(configuration);
        List<GraphNode> nodes = new ArrayList<>();
        Map<String, NodeConnections> connections = new LinkedHashMap<>();
        List<Step> orderedSteps = document.getStepsInOrder();

        GraphNode triggerNode = null;
        if (document.hasTriggers()) {
            List<Trigger> triggers = document.getTriggers();
            if (triggers.size() > 1) {
                logger.warning("Procedure '" + document.getTitle() + "' declares " + triggers.size() +
                               " triggers; only the first is compiled");
            }
            triggerNode = createTriggerNode(triggers.get(0), context);
            nodes.add(triggerNode);
        }

        Map<String, GraphNode> nodesByStepId = new LinkedHashMap<>();
        for (Step step : orderedSteps) {
            GraphNode node = createStepNode(step, context);
            nodesByStepId.put(step.getId(), node);
            nodes.add(node);
            logger.fine("Step '" + step.getId() + "' -> node '" + node.getName() + "' (" + node.getType() +
                        ") at " + node.getPosition());
        }

        if (triggerNode != null && !orderedSteps.isEmpty()) {
            GraphNode first = nodesByStepId.get(orderedSteps.get(0).getId());
            connections.put(triggerNode.getName(), NodeConnections.singlePort(List.of(Edge.to(first.getName()))));
        }
        for (Step step : orderedSteps) {
            NodeConnections outputs = createConnections(step, nodesByStepId);
            if (outputs != null) {
                connections.put(nodesByStepId.get(step.getId()).getName(), outputs);
            }
        }

        WorkflowGraph graph = new WorkflowGraph(document.getTitle(), nodes, connections,
                defaultSettings(), staticData(document));
        logger.info("Compiled procedure '" + document.getTitle() + "' into " + nodes.size() + " nodes");
        return graph;
    }

    private GraphNode createTriggerNode(Trigger trigger, CompilationContext context) {
        TriggerNodeType nodeType = TriggerNodeType.forTrigger(trigger.getTriggerType());
        Position position = context.placeTrigger();
        return new GraphNode(context.nextNodeId(), context.uniqueName(nodeType.getNodeName(), "Trigger"),
                nodeType.getNodeType().type(), nodeType.getNodeType().typeVersion(), position,
                trigger.getConfig(), null);
    }

    private GraphNode createStepNode(Step step, CompilationContext context) {
        Position position = context.placeStep(step.getId());
        NodeTypeRef nodeType = NodeTypeMap.forStep(step.getStepType(), step.getActionType());

        Map<String, Object> parameters = switch (step.getStepType()) {
            case ACTION -> new LinkedHashMap<>(step.getParameters());
            case DECISION -> {
                context.registerBranchTargets(position, branchTargets(step));
                yield ConditionParameters.write(step.getConditions());
            }
            case SUBPROCESS -> subprocessParameters(step.getParameters());
            case WAIT -> waitParameters(step.getParameters());
        };
        parameters.put(configuration.getMetadataKey(), StepMetadata.of(step).toMap());

        String notes = step.getDescription() != null && !step.getDescription().isBlank() ? step.getDescription() : null;
        return new GraphNode(context.nextNodeId(), context.uniqueName(step.getTitle(), "Step " + step.getOrder()),
                nodeType.type(), nodeType.typeVersion(), position, parameters, notes);
    }

    private Map<String, Object> subprocessParameters(Map<String, Object> stepParameters) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("workflowId", "");
        parameters.putAll(stepParameters);
        if (parameters.get("workflowId") == null) {
            parameters.put("workflowId", "");
        }
        return parameters;
    }

    private Map<String, Object> waitParameters(Map<String, Object> stepParameters) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("unit", "seconds");
        Object duration = stepParameters.get("duration");
        parameters.put("amount", duration != null ? duration : 1);
        parameters.putAll(stepParameters);
        if (parameters.get("unit") == null) {
            parameters.put("unit", "seconds");
        }
        return parameters;
    }

    private Set<String> branchTargets(Step decision) {
        Set<String> targets = new LinkedHashSet<>();
        for (Condition condition : decision.getConditions()) {
            if (condition.getNextStep() != null) {
                targets.add(condition.getNextStep());
            }
        }
        targets.addAll(decision.getNextSteps());
        return targets;
    }

    private NodeConnections createConnections(Step step, Map<String, GraphNode> nodesByStepId) {
        return switch (step.getStepType()) {
            case DECISION -> {
                Set<String> conditionTargets = new LinkedHashSet<>();
                List<Edge> truePort = new ArrayList<>();
                for (Condition condition : step.getConditions()) {
                    GraphNode target = nodesByStepId.get(condition.getNextStep());
                    if (target != null) {
                        truePort.add(Edge.to(target.getName()));
                        conditionTargets.add(condition.getNextStep());
                    }
                }
                List<Edge> falsePort = new ArrayList<>();
                for (String nextStep : step.getNextSteps()) {
                    GraphNode target = nodesByStepId.get(nextStep);
                    if (target != null && !conditionTargets.contains(nextStep)) {
                        falsePort.add(Edge.to(target.getName()));
                    }
                }
                yield new NodeConnections(List.of(truePort, falsePort));
            }
            case ACTION, SUBPROCESS, WAIT -> {
                List<Edge> edges = new ArrayList<>();
                for (String nextStep : step.getNextSteps()) {
                    GraphNode target = nodesByStepId.get(nextStep);
                    if (target != null) {
                        edges.add(Edge.to(target.getName()));
                    }
                }
                yield edges.isEmpty() ? null : NodeConnections.singlePort(edges);
            }
        };
    }

    private Map<String, Object> defaultSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("executionOrder", "v1");
        settings.put("saveDataSuccessExecution", "all");
        settings.put("saveDataErrorExecution", "all");
        return settings;
    }

    private Map<String, Object> staticData(ProcedureDocument document) {
        if (document.getDescription() == null || document.getDescription().isBlank()) {
            return null;
        }
        Map<String, Object> staticData = new LinkedHashMap<>();
        staticData.put("description", document.getDescription());
        return staticData;
    }
}

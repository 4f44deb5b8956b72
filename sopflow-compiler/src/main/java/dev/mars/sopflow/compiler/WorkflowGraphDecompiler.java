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
import dev.mars.sopflow.core.StepType;
import dev.mars.sopflow.core.Trigger;
import dev.mars.sopflow.core.exceptions.CompilationException;
import dev.mars.sopflow.graph.Edge;
import dev.mars.sopflow.graph.GraphNode;
import dev.mars.sopflow.graph.NodeConnections;
import dev.mars.sopflow.graph.WorkflowGraph;
import dev.mars.sopflow.mapping.NodeTypeMap;
import dev.mars.sopflow.validation.ValidationResult;
import dev.mars.sopflow.validation.WorkflowGraphValidator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Recovers a procedure document from a workflow graph.
 *
 * <p>Steps compiled by {@link WorkflowGraphCompiler} are restored from their metadata.
 * Other nodes are described from their engine type. Edges become {@code nextSteps},
 * true-branch edges of conditional nodes become condition targets, and step order is
 * rebuilt from the edges by topological sort.</p>
 *
 * <p>Branching is only representable on conditional nodes. When any other node fans
 * out from one of its outputs, only the first edge of that output is kept and a warning
 * is logged. Two nodes claiming the same step ID in their metadata keep the first claim;
 * the later node is recovered from the node itself under its node ID.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class WorkflowGraphDecompiler {

    private static final Logger logger = Logger.getLogger(WorkflowGraphDecompiler.class.getName());

    private final SopflowConfiguration configuration;
    private final WorkflowGraphValidator graphValidator;

    public WorkflowGraphDecompiler() {
        this(SopflowConfiguration.defaults(), new WorkflowGraphValidator());
    }

    public WorkflowGraphDecompiler(SopflowConfiguration configuration, WorkflowGraphValidator graphValidator) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.graphValidator = Objects.requireNonNull(graphValidator, "Graph validator cannot be null");
    }

    public ProcedureDocument decompile(WorkflowGraph graph) throws CompilationException {
        Objects.requireNonNull(graph, "Workflow graph cannot be null");
        logger.info("Decompiling workflow '" + graph.getName() + "' with " + graph.getNodes().size() + " nodes");

        ValidationResult validation = graphValidator.validate(graph);
        validation.getErrors().forEach(issue -> logger.warning("Workflow '" + graph.getName() + "': " + issue));
        validation.getWarnings().forEach(issue -> logger.warning("Workflow '" + graph.getName() + "': " + issue));

        List<Trigger> triggers = new ArrayList<>();
        Map<String, GraphNode> stepNodes = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes()) {
            if (NodeTypeMap.isTriggerNode(node.getType())) {
                triggers.add(new Trigger(NodeTypeMap.triggerTypeFor(node.getType()), node.getParameters()));
            } else if (node.getName() != null) {
                stepNodes.putIfAbsent(node.getName(), node);
            }
        }
        if (triggers.size() > 1) {
            logger.warning("Workflow '" + graph.getName() + "' has " + triggers.size() + " trigger nodes");
        }

        if (stepNodes.isEmpty()) {
            throw new CompilationException(graph.getName(), "Workflow contains no step nodes", List.of());
        }

        Map<String, Optional<StepMetadata>> metadata = new LinkedHashMap<>();
        Map<String, String> stepIdsByNodeName = new LinkedHashMap<>();
        Set<String> usedIds = new LinkedHashSet<>();
        stepNodes.forEach((name, node) -> {
            Optional<StepMetadata> recovered = StepMetadata.read(node.getParameters().get(configuration.getMetadataKey()));
            if (recovered.isPresent() && usedIds.contains(recovered.get().id())) {
                logger.warning("Node '" + name + "' repeats step ID '" + recovered.get().id() +
                               "'; recovering it from the node instead of its metadata");
                recovered = Optional.empty();
            }
            String stepId = recovered.isPresent() ? recovered.get().id() : uniqueId(nodeIdOf(node), usedIds);
            usedIds.add(stepId);
            metadata.put(name, recovered);
            stepIdsByNodeName.put(name, stepId);
        });

        List<Step> steps = new ArrayList<>();
        for (GraphNode node : stepNodes.values()) {
            NodeConnections outputs = graph.connectionsFrom(node.getName());
            List<String> nextSteps = nextSteps(node, outputs, stepIdsByNodeName);
            steps.add(recoverStep(node, metadata.get(node.getName()), stepIdsByNodeName.get(node.getName()),
                    nextSteps, outputs, stepIdsByNodeName));
        }

        List<Step> ordered;
        try {
            ordered = new StepDependencyGraph(steps).topologicalSort();
        } catch (CompilationException e) {
            throw new CompilationException(graph.getName(), "Workflow contains a cycle", e.getProblems());
        }

        ProcedureDocument document = ProcedureDocument.builder()
                .title(graph.getName())
                .description(describe(graph, stepNodes.values().iterator().next()))
                .version(configuration.getDefaultDocumentVersion())
                .steps(ordered)
                .triggers(triggers)
                .build();
        logger.info("Decompiled workflow '" + graph.getName() + "' into " + ordered.size() + " steps");
        return document;
    }

    private List<String> nextSteps(GraphNode node, NodeConnections outputs, Map<String, String> stepIdsByNodeName) {
        List<Edge> edges;
        if (NodeTypeMap.IF.type().equals(node.getType())) {
            edges = outputs.allEdges();
        } else {
            edges = new ArrayList<>();
            for (int port = 0; port < outputs.portCount(); port++) {
                List<Edge> portEdges = outputs.port(port);
                if (portEdges.isEmpty()) {
                    continue;
                }
                if (portEdges.size() > 1) {
                    logger.warning("Node '" + node.getName() + "' branches to " + portEdges.size() +
                                   " nodes from output " + port + " outside a conditional node; keeping only '" +
                                   portEdges.get(0).getNode() + "'");
                }
                edges.add(portEdges.get(0));
            }
        }

        Set<String> targets = new LinkedHashSet<>();
        for (Edge edge : edges) {
            String stepId = stepIdsByNodeName.get(edge.getNode());
            if (stepId == null) {
                logger.warning("Node '" + node.getName() + "' connects to unknown step node '" + edge.getNode() + "'");
            } else {
                targets.add(stepId);
            }
        }
        return new ArrayList<>(targets);
    }

    private Step recoverStep(GraphNode node, Optional<StepMetadata> metadata, String stepId, List<String> nextSteps,
                             NodeConnections outputs, Map<String, String> stepIdsByNodeName) {
        Step.Builder builder = Step.builder().nextSteps(nextSteps);

        if (metadata.isPresent()) {
            StepMetadata recovered = metadata.get();
            builder.id(recovered.id())
                    .order(recovered.order())
                    .title(recovered.title())
                    .description(recovered.description())
                    .type(recovered.type())
                    .actionType(recovered.actionType())
                    .parameters(recovered.parameters());
        } else {
            Map<String, Object> parameters = new LinkedHashMap<>(node.getParameters());
            parameters.remove(configuration.getMetadataKey());
            builder.id(stepId)
                    .title(node.getName())
                    .description(node.getNotes() != null && !node.getNotes().isBlank()
                            ? node.getNotes() : NodeTypeMap.describe(node.getType()))
                    .type(NodeTypeMap.stepTypeFor(node.getType()))
                    .actionType(NodeTypeMap.actionFor(node.getType()).orElse(null))
                    .parameters(parameters);
        }

        if (NodeTypeMap.stepTypeFor(node.getType()) == StepType.DECISION) {
            builder.conditions(recoverConditions(node, metadata, outputs, stepIdsByNodeName));
        }
        return builder.build();
    }

    private List<Condition> recoverConditions(GraphNode node, Optional<StepMetadata> metadata,
                                              NodeConnections outputs, Map<String, String> stepIdsByNodeName) {
        List<Condition> extracted = ConditionParameters.read(node.getParameters());
        List<String> recordedTargets = metadata.map(StepMetadata::conditionTargets).orElse(null);
        if (recordedTargets != null && recordedTargets.size() != extracted.size()) {
            logger.warning("Node '" + node.getName() + "' records " + recordedTargets.size() + " condition targets for " +
                           extracted.size() + " conditions; assigning targets from its edges");
            recordedTargets = null;
        }
        if (recordedTargets != null) {
            Set<String> knownIds = new LinkedHashSet<>(stepIdsByNodeName.values());
            List<Condition> conditions = new ArrayList<>();
            for (int i = 0; i < extracted.size(); i++) {
                String target = recordedTargets.get(i);
                if (target != null && !knownIds.contains(target)) {
                    logger.warning("Condition " + (i + 1) + " of node '" + node.getName() +
                                   "' targets unknown step '" + target + "'");
                    target = null;
                }
                conditions.add(extracted.get(i).withNextStep(target));
            }
            return conditions;
        }

        List<Edge> trueBranch = outputs.port(0);
        List<Condition> conditions = new ArrayList<>();
        for (int i = 0; i < extracted.size(); i++) {
            String target = i < trueBranch.size() ? stepIdsByNodeName.get(trueBranch.get(i).getNode()) : null;
            if (target == null) {
                logger.warning("Condition " + (i + 1) + " of node '" + node.getName() + "' has no target step");
            }
            conditions.add(extracted.get(i).withNextStep(target));
        }
        return conditions;
    }

    private String describe(WorkflowGraph graph, GraphNode firstStepNode) {
        if (graph.getStaticData() != null && graph.getStaticData().get("description") != null) {
            return graph.getStaticData().get("description").toString();
        }
        if (firstStepNode.getNotes() != null && !firstStepNode.getNotes().isBlank()) {
            return firstStepNode.getNotes();
        }
        return "Workflow: " + graph.getName();
    }

    private static String uniqueId(String candidate, Set<String> usedIds) {
        String id = candidate;
        for (int suffix = 2; usedIds.contains(id); suffix++) {
            id = candidate + "_" + suffix;
        }
        if (!id.equals(candidate)) {
            logger.warning("Step ID '" + candidate + "' is already taken; using '" + id + "'");
        }
        return id;
    }

    private static String nodeIdOf(GraphNode node) {
        return node.getId() != null && !node.getId().isBlank() ? node.getId() : node.getName();
    }
}

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

import dev.mars.sopflow.graph.Edge;
import dev.mars.sopflow.graph.GraphNode;
import dev.mars.sopflow.graph.NodeConnections;
import dev.mars.sopflow.graph.WorkflowGraph;
import dev.mars.sopflow.mapping.NodeTypeMap;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Structural checks applied to a workflow graph before it is accepted or decompiled.
 * Never throws; a missing trigger node is only a warning.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class WorkflowGraphValidator {

    private static final Logger logger = Logger.getLogger(WorkflowGraphValidator.class.getName());

    public ValidationResult validate(WorkflowGraph graph) {
        ValidationResult result = new ValidationResult();

        if (graph == null) {
            result.addError("graph", "Workflow graph cannot be null");
            return result;
        }

        if (graph.getName() == null || graph.getName().isBlank()) {
            result.addError("name", "Workflow name is required");
        }

        List<GraphNode> nodes = graph.getNodes();
        if (nodes.isEmpty()) {
            result.addError("nodes", "Workflow must contain at least one node");
        }

        Set<String> nodeNames = validateNodes(nodes, result);
        validateConnections(graph.getConnections(), nodeNames, result);

        boolean hasTrigger = nodes.stream().anyMatch(node -> NodeTypeMap.isTriggerNode(node.getType()));
        if (!nodes.isEmpty() && !hasTrigger) {
            result.addWarning("nodes", "Workflow has no trigger node");
        }

        logger.fine("Validated workflow graph '" + graph.getName() + "': " + result);
        return result;
    }

    private Set<String> validateNodes(List<GraphNode> nodes, ValidationResult result) {
        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < nodes.size(); i++) {
            GraphNode node = nodes.get(i);
            String path = "nodes[" + i + "]";

            if (isBlank(node.getId())) {
                result.addError(path + ".id", "Node ID is required");
            } else if (!ids.add(node.getId())) {
                result.addError(path + ".id", "Duplicate node ID: " + node.getId());
            }

            if (isBlank(node.getName())) {
                result.addError(path + ".name", "Node name is required");
            } else if (!names.add(node.getName())) {
                result.addError(path + ".name", "Duplicate node name: " + node.getName());
            }

            if (isBlank(node.getType())) {
                result.addError(path + ".type", "Node type is required");
            }
        }
        return names;
    }

    private void validateConnections(Map<String, NodeConnections> connections, Set<String> nodeNames,
                                     ValidationResult result) {
        connections.forEach((source, outputs) -> {
            String path = "connections." + source;
            if (!nodeNames.contains(source)) {
                result.addError(path, "Connection source not found: " + source);
            }
            if (outputs == null) {
                return;
            }
            for (Edge edge : outputs.allEdges()) {
                if (!nodeNames.contains(edge.getNode())) {
                    result.addError(path, "Connection target not found: " + edge.getNode());
                }
            }
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

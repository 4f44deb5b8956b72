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
import dev.mars.sopflow.graph.Position;
import dev.mars.sopflow.graph.WorkflowGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowGraphValidatorTest {

    private WorkflowGraphValidator validator;

    @BeforeEach
    void setUp() {
        validator = new WorkflowGraphValidator();
    }

    private GraphNode node(String id, String name, String type) {
        return new GraphNode(id, name, type, 1, new Position(0, 0), Map.of(), null);
    }

    @Test
    void testValidGraph() {
        WorkflowGraph graph = new WorkflowGraph("Valid", List.of(
                node("1", "Start", "n8n-nodes-base.manualTrigger"),
                node("2", "Work", "n8n-nodes-base.code")),
                Map.of("Start", NodeConnections.singlePort(List.of(Edge.to("Work")))));

        ValidationResult result = validator.validate(graph);

        assertTrue(result.isValid(), result.getErrors().toString());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testStructuralErrors() {
        WorkflowGraph graph = new WorkflowGraph(" ", List.of(
                node("1", "Start", "n8n-nodes-base.manualTrigger"),
                node("1", "Start", ""),
                node(null, null, "n8n-nodes-base.code")),
                Map.of("Nowhere", NodeConnections.singlePort(List.of(Edge.to("Ghost")))));

        List<String> errors = validator.validate(graph).getErrorMessages();

        assertTrue(errors.contains("Workflow name is required"));
        assertTrue(errors.contains("Duplicate node ID: 1"));
        assertTrue(errors.contains("Duplicate node name: Start"));
        assertTrue(errors.contains("Node type is required"));
        assertTrue(errors.contains("Node ID is required"));
        assertTrue(errors.contains("Node name is required"));
        assertTrue(errors.contains("Connection source not found: Nowhere"));
        assertTrue(errors.contains("Connection target not found: Ghost"));
        assertEquals(8, errors.size());
    }

    @Test
    void testEmptyGraph() {
        ValidationResult result = validator.validate(new WorkflowGraph("Empty", List.of(), Map.of()));

        assertEquals(List.of("Workflow must contain at least one node"), result.getErrorMessages());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testMissingTriggerIsWarning() {
        WorkflowGraph graph = new WorkflowGraph("No trigger", List.of(node("1", "Work", "n8n-nodes-base.code")), null);

        ValidationResult result = validator.validate(graph);

        assertTrue(result.isValid());
        assertEquals("Workflow has no trigger node", result.getWarnings().get(0).getMessage());
    }
}

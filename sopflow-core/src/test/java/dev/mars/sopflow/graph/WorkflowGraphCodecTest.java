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

package dev.mars.sopflow.graph;

import dev.mars.sopflow.core.exceptions.GraphCodecException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowGraphCodecTest {

    private WorkflowGraphCodec codec;

    @BeforeEach
    void setUp() {
        codec = new WorkflowGraphCodec();
    }

    @Test
    void testReadEngineExport() throws GraphCodecException {
        String json = """
                {
                  "id": "wf-123",
                  "name": "Invoice Approval",
                  "active": false,
                  "nodes": [
                    {
                      "id": "a1",
                      "name": "Manual Trigger",
                      "type": "n8n-nodes-base.manualTrigger",
                      "typeVersion": 1,
                      "position": [250, 300],
                      "parameters": {}
                    },
                    {
                      "id": "a2",
                      "name": "Check Amount",
                      "type": "n8n-nodes-base.if",
                      "typeVersion": 2,
                      "position": [550, 300],
                      "parameters": {"conditions": {"combinator": "or"}},
                      "notes": "Checks the invoice amount",
                      "credentials": {"any": "thing"}
                    }
                  ],
                  "connections": {
                    "Manual Trigger": {
                      "main": [[{"node": "Check Amount", "type": "main", "index": 0}]]
                    }
                  },
                  "pinData": {},
                  "staticData": {"description": "Approves invoices"}
                }
                """;

        WorkflowGraph graph = codec.fromJson(json);

        assertEquals("Invoice Approval", graph.getName());
        assertEquals(2, graph.getNodes().size());
        GraphNode check = graph.findNodeByName("Check Amount").orElseThrow();
        assertEquals("n8n-nodes-base.if", check.getType());
        assertEquals(2, check.getTypeVersion().intValue());
        assertEquals(new Position(550, 300), check.getPosition());
        assertEquals("Checks the invoice amount", check.getNotes());
        assertEquals(List.of(Edge.to("Check Amount")), graph.connectionsFrom("Manual Trigger").port(0));
        assertEquals("Approves invoices", graph.getStaticData().get("description"));
        assertNull(graph.getSettings());
    }

    @Test
    void testWriteOmitsNullOptionalFields() throws GraphCodecException {
        GraphNode node = new GraphNode("node_1", "Start", "n8n-nodes-base.manualTrigger", 1,
                new Position(250, 300), Map.of(), null);
        WorkflowGraph graph = new WorkflowGraph("Simple", List.of(node), Map.of());

        String json = codec.toJson(graph);

        assertTrue(json.contains("\"position\":[250,300]"), json);
        assertFalse(json.contains("notes"), json);
        assertFalse(json.contains("settings"), json);
        assertFalse(json.contains("staticData"), json);
    }

    @Test
    void testWriteThenReadPreservesGraph() throws GraphCodecException {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("url", "https://example.com");
        parameters.put("retries", 3);
        GraphNode trigger = new GraphNode("node_1", "Manual Trigger", "n8n-nodes-base.manualTrigger", 1,
                new Position(250, 300), Map.of(), null);
        GraphNode request = new GraphNode("node_2", "Fetch", "n8n-nodes-base.httpRequest", 4,
                new Position(550, 300), parameters, "Makes an HTTP request");
        Map<String, NodeConnections> connections = new LinkedHashMap<>();
        connections.put("Manual Trigger", NodeConnections.singlePort(List.of(Edge.to("Fetch"))));
        WorkflowGraph graph = new WorkflowGraph("Fetcher", List.of(trigger, request), connections,
                Map.of("executionOrder", "v1"), Map.of("description", "Fetches"));

        WorkflowGraph read = codec.fromJson(codec.toPrettyJson(graph));

        assertEquals(graph, read);
    }

    @Test
    void testFractionalTypeVersionIsKept() throws GraphCodecException {
        String json = """
                {"name": "Versions", "nodes": [
                  {"id": "1", "name": "Fetch", "type": "n8n-nodes-base.httpRequest", "typeVersion": 4.2,
                   "position": [0, 0]},
                  {"id": "2", "name": "Check", "type": "n8n-nodes-base.if", "typeVersion": 2,
                   "position": [300, 0]}
                ]}
                """;

        WorkflowGraph graph = codec.fromJson(json);

        assertEquals(4.2, graph.findNodeByName("Fetch").orElseThrow().getTypeVersion().doubleValue());
        String written = codec.toJson(graph);
        assertTrue(written.contains("\"typeVersion\":4.2"), written);
        assertTrue(written.contains("\"typeVersion\":2,"), written);
        assertEquals(graph, codec.fromJson(written));
    }

    @Test
    void testMissingTypeVersionDefaultsToOne() throws GraphCodecException {
        WorkflowGraph graph = codec.fromJson("{\"name\": \"x\", \"nodes\": [{\"id\": \"1\", \"name\": \"n\", \"type\": \"t\"}]}");

        assertEquals(1, graph.getNodes().get(0).getTypeVersion().intValue());
    }

    @Test
    void testMalformedJsonThrows() {
        GraphCodecException exception = assertThrows(GraphCodecException.class,
                () -> codec.fromJson("{\"name\": \"broken\", \"nodes\": ["));

        assertTrue(exception.getMessage().startsWith("Invalid workflow graph JSON"));
        assertNotNull(exception.getCause());
    }

    @Test
    void testBlankJsonThrows() {
        assertThrows(GraphCodecException.class, () -> codec.fromJson("  "));
    }

    @Test
    void testInvalidPositionThrows() {
        String json = """
                {"name": "x", "nodes": [{"id": "1", "name": "n", "type": "t", "position": [1, 2, 3]}]}
                """;

        assertThrows(GraphCodecException.class, () -> codec.fromJson(json));
    }
}

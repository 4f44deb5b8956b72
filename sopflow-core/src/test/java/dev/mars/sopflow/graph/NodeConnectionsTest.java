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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeConnectionsTest {

    @Test
    void testPortsAndEdges() {
        NodeConnections connections = new NodeConnections(List.of(
                List.of(Edge.to("Yes"), Edge.to("Also yes")),
                List.of(Edge.to("No"))));

        assertEquals(2, connections.portCount());
        assertEquals(2, connections.port(0).size());
        assertEquals("No", connections.port(1).get(0).getNode());
        assertTrue(connections.port(5).isEmpty());
        assertEquals(List.of("Yes", "Also yes", "No"),
                connections.allEdges().stream().map(Edge::getNode).toList());
    }

    @Test
    void testNullPortsBecomeEmpty() {
        NodeConnections connections = new NodeConnections(Arrays.asList(null, List.of(Edge.to("B"))));

        assertEquals(2, connections.portCount());
        assertTrue(connections.port(0).isEmpty());
        assertTrue(new NodeConnections(null).allEdges().isEmpty());
    }

    @Test
    void testEdgeDefaultsToMainType() {
        Edge edge = new Edge("Target", null, 0);

        assertEquals(Edge.MAIN, edge.getType());
        assertEquals(Edge.to("Target"), edge);
    }

    @Test
    void testMissingConnectionsAreEmpty() {
        WorkflowGraph graph = new WorkflowGraph("g", List.of(), null);

        assertEquals(0, graph.connectionsFrom("Nobody").portCount());
        assertTrue(graph.getConnections().isEmpty());
    }
}

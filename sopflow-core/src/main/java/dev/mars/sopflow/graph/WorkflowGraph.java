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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The node-and-edge representation exchanged with the external workflow engine.
 *
 * <p>Matches the engine's JSON shape:</p>
 * <pre>
 * { name, nodes: [...], connections: { nodeName: { main: [[{node, type, index}]] } },
 *   settings?, staticData? }
 * </pre>
 *
 * <p>Connections are keyed by source node name and keep insertion order so that
 * serialization is deterministic. Engine fields this model does not know
 * (active flags, pinned data, tags) are dropped on read.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowGraph {

    private final String name;
    private final List<GraphNode> nodes;
    private final Map<String, NodeConnections> connections;
    private final Map<String, Object> settings;
    private final Map<String, Object> staticData;

    @JsonCreator
    public WorkflowGraph(@JsonProperty("name") String name,
                         @JsonProperty("nodes") List<GraphNode> nodes,
                         @JsonProperty("connections") Map<String, NodeConnections> connections,
                         @JsonProperty("settings") Map<String, Object> settings,
                         @JsonProperty("staticData") Map<String, Object> staticData) {
        this.name = name;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.connections = connections != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(connections)) : Map.of();
        this.settings = settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : null;
        this.staticData = staticData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(staticData)) : null;
    }

    public WorkflowGraph(String name, List<GraphNode> nodes, Map<String, NodeConnections> connections) {
        this(name, nodes, connections, null, null);
    }

    public String getName() {
        return name;
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public Map<String, NodeConnections> getConnections() {
        return connections;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public Map<String, Object> getStaticData() {
        return staticData;
    }

    public Optional<GraphNode> findNodeByName(String nodeName) {
        return nodes.stream().filter(node -> Objects.equals(node.getName(), nodeName)).findFirst();
    }

    /**
     * @return the outgoing connections of the named node, or empty connections when it has none
     */
    public NodeConnections connectionsFrom(String nodeName) {
        NodeConnections nodeConnections = connections.get(nodeName);
        return nodeConnections != null ? nodeConnections : new NodeConnections(List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowGraph that = (WorkflowGraph) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(nodes, that.nodes) &&
               Objects.equals(connections, that.connections) &&
               Objects.equals(settings, that.settings) &&
               Objects.equals(staticData, that.staticData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nodes, connections, settings, staticData);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" +
               "name='" + name + '\'' +
               ", nodes=" + nodes.size() +
               ", connections=" + connections.keySet() +
               '}';
    }
}

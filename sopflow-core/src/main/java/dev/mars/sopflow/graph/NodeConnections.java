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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The outgoing connections of one node: a list of output ports, each holding the
 * edges leaving that port. Port 0 of a conditional node is its "true" branch and
 * port 1 its "false" branch.
 * <p>
 * Only the engine's {@code main} connection type is modelled; other connection
 * types are ignored on read.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeConnections {

    private final List<List<Edge>> main;

    @JsonCreator
    public NodeConnections(@JsonProperty("main") List<List<Edge>> main) {
        List<List<Edge>> ports = new ArrayList<>();
        if (main != null) {
            for (List<Edge> port : main) {
                ports.add(port != null ? List.copyOf(port) : List.of());
            }
        }
        this.main = List.copyOf(ports);
    }

    /**
     * Creates connections with a single output port.
     */
    public static NodeConnections singlePort(List<Edge> edges) {
        return new NodeConnections(List.of(edges));
    }

    @JsonProperty("main")
    public List<List<Edge>> getMain() {
        return main;
    }

    public int portCount() {
        return main.size();
    }

    /**
     * @return the edges of the given port, or an empty list when the port does not exist
     */
    public List<Edge> port(int index) {
        return index >= 0 && index < main.size() ? main.get(index) : List.of();
    }

    /**
     * @return every edge across all ports, in port then declaration order
     */
    public List<Edge> allEdges() {
        List<Edge> edges = new ArrayList<>();
        main.forEach(edges::addAll);
        return edges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeConnections that = (NodeConnections) o;
        return Objects.equals(main, that.main);
    }

    @Override
    public int hashCode() {
        return Objects.hash(main);
    }

    @Override
    public String toString() {
        return "NodeConnections{main=" + main + '}';
    }
}

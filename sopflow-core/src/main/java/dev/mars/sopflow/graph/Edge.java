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

import java.util.Objects;

/**
 * A directed edge from an output port to the input {@code index} of the node named {@code node}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Edge {

    public static final String MAIN = "main";

    private final String node;
    private final String type;
    private final int index;

    @JsonCreator
    public Edge(@JsonProperty("node") String node,
                @JsonProperty("type") String type,
                @JsonProperty("index") int index) {
        this.node = Objects.requireNonNull(node, "Edge target node cannot be null");
        this.type = type != null ? type : MAIN;
        this.index = index;
    }

    /**
     * Creates an edge on the main connection type into input 0 of the target.
     */
    public static Edge to(String node) {
        return new Edge(node, MAIN, 0);
    }

    public String getNode() {
        return node;
    }

    public String getType() {
        return type;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge that = (Edge) o;
        return index == that.index &&
               Objects.equals(node, that.node) &&
               Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, type, index);
    }

    @Override
    public String toString() {
        return "Edge{" + "node='" + node + '\'' + ", type='" + type + '\'' + ", index=" + index + '}';
    }
}

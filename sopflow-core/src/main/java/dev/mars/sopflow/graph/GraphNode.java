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
import java.util.Map;
import java.util.Objects;

/**
 * One executable unit of a workflow graph.
 * <p>
 * {@code name} is unique within a graph and is the key used by connections.
 * {@code type} is the engine's node type identifier and is opaque to this model.
 * {@code parameters} is passed through as-is; the forward compiler stores its
 * round-trip metadata there under a reserved key.
 * {@code typeVersion} is kept as read, so fractional engine versions such as {@code 4.2}
 * survive a read and write; a missing or non-positive version becomes {@code 1}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphNode {

    private final String id;
    private final String name;
    private final String type;
    private final Number typeVersion;
    private final Position position;
    private final Map<String, Object> parameters;
    private final String notes;

    @JsonCreator
    public GraphNode(@JsonProperty("id") String id,
                     @JsonProperty("name") String name,
                     @JsonProperty("type") String type,
                     @JsonProperty("typeVersion") Number typeVersion,
                     @JsonProperty("position") Position position,
                     @JsonProperty("parameters") Map<String, Object> parameters,
                     @JsonProperty("notes") String notes) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.typeVersion = typeVersion != null && typeVersion.doubleValue() > 0
                ? typeVersion : Integer.valueOf(1);
        this.position = position != null ? position : new Position(0, 0);
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        this.notes = notes;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public Number getTypeVersion() {
        return typeVersion;
    }

    public Position getPosition() {
        return position;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String getNotes() {
        return notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(typeVersion, that.typeVersion) &&
               Objects.equals(name, that.name) &&
               Objects.equals(type, that.type) &&
               Objects.equals(position, that.position) &&
               Objects.equals(parameters, that.parameters) &&
               Objects.equals(notes, that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, typeVersion, position, parameters, notes);
    }

    @Override
    public String toString() {
        return "GraphNode{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", type='" + type + '\'' +
               ", typeVersion=" + typeVersion +
               ", position=" + position +
               '}';
    }
}

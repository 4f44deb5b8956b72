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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.sopflow.core.exceptions.GraphCodecException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads and writes {@link WorkflowGraph} in the workflow engine's JSON shape.
 * Unknown engine fields are ignored on read and null optional fields are omitted on write.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class WorkflowGraphCodec {

    private static final Logger logger = Logger.getLogger(WorkflowGraphCodec.class.getName());

    private final ObjectMapper objectMapper;

    public WorkflowGraphCodec() {
        this(new ObjectMapper());
    }

    public WorkflowGraphCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null")
                .copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public String toJson(WorkflowGraph graph) throws GraphCodecException {
        Objects.requireNonNull(graph, "Workflow graph cannot be null");
        try {
            return objectMapper.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new GraphCodecException("Failed to serialize workflow graph '" + graph.getName() + "'", e);
        }
    }

    public String toPrettyJson(WorkflowGraph graph) throws GraphCodecException {
        Objects.requireNonNull(graph, "Workflow graph cannot be null");
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new GraphCodecException("Failed to serialize workflow graph '" + graph.getName() + "'", e);
        }
    }

    public WorkflowGraph fromJson(String json) throws GraphCodecException {
        if (json == null || json.isBlank()) {
            throw new GraphCodecException("Workflow graph JSON cannot be empty");
        }
        try {
            WorkflowGraph graph = objectMapper.readValue(json, WorkflowGraph.class);
            logger.fine("Read workflow graph '" + graph.getName() + "' with " + graph.getNodes().size() + " nodes");
            return graph;
        } catch (JsonProcessingException e) {
            throw new GraphCodecException("Invalid workflow graph JSON: " + e.getOriginalMessage(), e);
        }
    }

    public WorkflowGraph read(Path path) throws GraphCodecException {
        Objects.requireNonNull(path, "Path cannot be null");
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new GraphCodecException("Failed to read workflow graph from " + path, e);
        }
    }
}

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
import dev.mars.sopflow.core.ProcedureDocument;
import dev.mars.sopflow.core.exceptions.CompilationException;
import dev.mars.sopflow.core.exceptions.ProcedureParseException;
import dev.mars.sopflow.graph.WorkflowGraph;
import dev.mars.sopflow.markup.MarkupProcedureParser;
import dev.mars.sopflow.markup.MarkupProcedureSerializer;
import dev.mars.sopflow.validation.ProcedureValidator;
import dev.mars.sopflow.validation.ValidationResult;
import dev.mars.sopflow.validation.WorkflowGraphValidator;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point for converting between procedure documents, their markup and workflow graphs.
 *
 * <p>Example:</p>
 * <pre>
 * ProcedureCompiler compiler = new ProcedureCompiler();
 * ProcedureDocument document = compiler.parseMarkup(markup);
 * WorkflowGraph graph = compiler.compile(document);
 * ProcedureDocument restored = compiler.decompile(graph);
 * </pre>
 *
 * <p>All operations are synchronous and side-effect free; one instance may serve
 * concurrent callers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public class ProcedureCompiler {

    private static final Logger logger = Logger.getLogger(ProcedureCompiler.class.getName());

    private final ProcedureValidator validator;
    private final WorkflowGraphValidator graphValidator;
    private final WorkflowGraphCompiler graphCompiler;
    private final WorkflowGraphDecompiler graphDecompiler;
    private final MarkupProcedureParser markupParser;
    private final MarkupProcedureSerializer markupSerializer;

    public ProcedureCompiler() {
        this(new SopflowConfiguration());
    }

    public ProcedureCompiler(SopflowConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.validator = new ProcedureValidator();
        this.graphValidator = new WorkflowGraphValidator();
        this.graphCompiler = new WorkflowGraphCompiler(configuration, validator);
        this.graphDecompiler = new WorkflowGraphDecompiler(configuration, graphValidator);
        this.markupParser = new MarkupProcedureParser();
        this.markupSerializer = new MarkupProcedureSerializer();
        logger.fine("Procedure compiler created with " + configuration);
    }

    public ValidationResult validate(ProcedureDocument document) {
        return validator.validate(document);
    }

    public ValidationResult validateGraph(WorkflowGraph graph) {
        return graphValidator.validate(graph);
    }

    public WorkflowGraph compile(ProcedureDocument document) throws CompilationException {
        return graphCompiler.compile(document);
    }

    public ProcedureDocument decompile(WorkflowGraph graph) throws CompilationException {
        return graphDecompiler.decompile(graph);
    }

    public ProcedureDocument parseMarkup(String markup) throws ProcedureParseException {
        return markupParser.parseFromString(markup);
    }

    public String serializeToMarkup(ProcedureDocument document) {
        return markupSerializer.serialize(document);
    }
}

package dev.mars.sopflow.core.exceptions;

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


import java.util.List;

/**
 * Thrown when a procedure document cannot be compiled to a workflow graph or a
 * workflow graph cannot be decompiled back to a document.
 * <p>
 * Raised only for: compiling a document that failed validation, decompiling a
 * graph whose step dependencies form a cycle, and decompiling a graph with no
 * step nodes. Other anomalies are degraded with a logged warning.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class CompilationException extends SopflowException {

    private final String procedureName;
    private final List<String> problems;

    public CompilationException(String message) {
        this(null, message, List.of());
    }

    public CompilationException(String procedureName, String message, List<String> problems) {
        super(message);
        this.procedureName = procedureName;
        this.problems = problems != null ? List.copyOf(problems) : List.of();
    }

    public String getProcedureName() {
        return procedureName;
    }

    /**
     * @return the individual problems behind this failure, e.g. validation errors or step IDs in a cycle
     */
    public List<String> getProblems() {
        return problems;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (procedureName != null) {
            sb.append("Procedure '").append(procedureName).append("': ");
        }

        sb.append(super.getMessage());

        if (!problems.isEmpty()) {
            sb.append(": ").append(String.join(", ", problems));
        }

        return sb.toString();
    }
}

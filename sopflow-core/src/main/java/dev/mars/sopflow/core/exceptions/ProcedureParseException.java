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


/**
 * Exception thrown when a procedure document cannot be read from markup or YAML.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ProcedureParseException extends SopflowException {

    private final String documentName;
    private final int lineNumber;
    private final String fieldPath;

    public ProcedureParseException(String message) {
        this(null, -1, null, message, null);
    }

    public ProcedureParseException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public ProcedureParseException(String fieldPath, String message) {
        this(null, -1, fieldPath, message, null);
    }

    public ProcedureParseException(int lineNumber, String fieldPath, String message) {
        this(null, lineNumber, fieldPath, message, null);
    }

    public ProcedureParseException(String documentName, int lineNumber, String fieldPath, String message,
                                   Throwable cause) {
        super(message, cause);
        this.documentName = documentName;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    /**
     * Copy of this exception attributed to the named document, keeping line, field and cause.
     */
    public ProcedureParseException withDocumentName(String name) {
        ProcedureParseException named = new ProcedureParseException(name, lineNumber, fieldPath, super.getMessage(), getCause());
        named.setStackTrace(getStackTrace());
        return named;
    }

    public String getDocumentName() {
        return documentName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (documentName != null) {
            sb.append("Document '").append(documentName).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}

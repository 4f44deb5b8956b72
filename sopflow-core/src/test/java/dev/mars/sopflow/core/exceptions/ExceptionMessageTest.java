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

package dev.mars.sopflow.core.exceptions;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionMessageTest {

    @Test
    void testParseExceptionWithAllContext() {
        ProcedureParseException exception =
                new ProcedureParseException("onboarding.md", 12, "steps[2].condition", "Malformed condition", null);

        assertEquals("Document 'onboarding.md': Line 12: Field 'steps[2].condition': Malformed condition",
                exception.getMessage());
        assertEquals(12, exception.getLineNumber());
        assertEquals("steps[2].condition", exception.getFieldPath());
        assertEquals("onboarding.md", exception.getDocumentName());
    }

    @Test
    void testParseExceptionWithMessageOnly() {
        ProcedureParseException exception = new ProcedureParseException("Document is empty");

        assertEquals("Document is empty", exception.getMessage());
        assertEquals(-1, exception.getLineNumber());
        assertNull(exception.getFieldPath());
    }

    @Test
    void testParseExceptionWithLineAndField() {
        ProcedureParseException exception = new ProcedureParseException(4, "condition", "Unknown operator");

        assertEquals("Line 4: Field 'condition': Unknown operator", exception.getMessage());
    }

    @Test
    void testParseExceptionKeepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        ProcedureParseException exception = new ProcedureParseException("Invalid YAML", cause);

        assertSame(cause, exception.getCause());
        assertInstanceOf(SopflowException.class, exception);
    }

    @Test
    void testCompilationExceptionListsProblems() {
        CompilationException exception = new CompilationException("Onboarding", "Invalid procedure document",
                List.of("Duplicate step ID: s1", "Referenced step not found: ghost"));

        assertEquals("Procedure 'Onboarding': Invalid procedure document: " +
                     "Duplicate step ID: s1, Referenced step not found: ghost", exception.getMessage());
        assertEquals(2, exception.getProblems().size());
    }

    @Test
    void testCompilationExceptionWithoutProblems() {
        CompilationException exception = new CompilationException("Workflow contains no step nodes");

        assertEquals("Workflow contains no step nodes", exception.getMessage());
        assertTrue(exception.getProblems().isEmpty());
        assertNull(exception.getProcedureName());
    }
}

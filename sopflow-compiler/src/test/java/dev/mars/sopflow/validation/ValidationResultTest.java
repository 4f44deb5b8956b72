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

package dev.mars.sopflow.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    void testEmptyValidationResult() {
        ValidationResult result = new ValidationResult();

        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
        assertEquals(0, result.getErrorCount());
        assertTrue(result.getErrorMessages().isEmpty());
    }

    @Test
    void testErrorsMakeResultInvalid() {
        ValidationResult result = new ValidationResult();

        result.addError("title", "Title is required");
        result.addError("steps[0].id", "s1", "Duplicate step ID: s1");
        result.addWarning("version", "Version is recommended");

        assertFalse(result.isValid());
        assertTrue(result.hasWarnings());
        assertEquals(List.of("Title is required", "Duplicate step ID: s1"), result.getErrorMessages());
        assertEquals("s1", result.getErrors().get(1).getStepId());
        assertNull(result.getErrors().get(0).getStepId());
        assertEquals(ValidationResult.ValidationIssue.Severity.WARNING, result.getWarnings().get(0).getSeverity());
    }

    @Test
    void testWarningsKeepResultValid() {
        ValidationResult result = new ValidationResult();
        result.addWarning("steps[1].conditions", "d1", "Decision step should have conditions");

        assertTrue(result.isValid());
        assertEquals(1, result.getWarningCount());
    }

    @Test
    void testConstructorWithNullLists() {
        ValidationResult result = new ValidationResult(null, null);

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void testReturnedListsAreSnapshots() {
        ValidationResult result = new ValidationResult();
        List<ValidationResult.ValidationIssue> before = result.getErrors();

        result.addError("title", "Title is required");

        assertTrue(before.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> result.getErrors().clear());
    }

    @Test
    void testIssueToString() {
        ValidationResult.ValidationIssue issue = new ValidationResult.ValidationIssue(
                ValidationResult.ValidationIssue.Severity.ERROR, "steps[2].type", "s3", "Invalid step type: loop");

        assertEquals("ERROR [steps[2].type] (step s3): Invalid step type: loop", issue.toString());
    }

    @Test
    void testIssueRequiresMessage() {
        assertThrows(NullPointerException.class, () -> new ValidationResult.ValidationIssue(
                ValidationResult.ValidationIssue.Severity.ERROR, null, null, null));
    }
}

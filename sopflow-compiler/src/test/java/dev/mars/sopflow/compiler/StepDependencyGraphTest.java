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

import dev.mars.sopflow.core.Step;
import dev.mars.sopflow.core.exceptions.CompilationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StepDependencyGraphTest {

    private Step step(String id, String... nextSteps) {
        return Step.builder().id(id).title(id).type("action").nextSteps(List.of(nextSteps)).build();
    }

    private List<String> ids(List<Step> steps) {
        return steps.stream().map(Step::getId).toList();
    }

    @Test
    void testLinearChainIsSortedAndRenumbered() throws CompilationException {
        StepDependencyGraph graph = new StepDependencyGraph(List.of(step("c"), step("b", "c"), step("a", "b")));

        List<Step> sorted = graph.topologicalSort();

        assertEquals(List.of("a", "b", "c"), ids(sorted));
        assertEquals(List.of(1, 2, 3), sorted.stream().map(Step::getOrder).toList());
    }

    @Test
    void testReadyStepsKeepDeclarationAndEdgeOrder() throws CompilationException {
        StepDependencyGraph roots = new StepDependencyGraph(List.of(step("second"), step("first")));
        assertEquals(List.of("second", "first"), ids(roots.topologicalSort()));

        StepDependencyGraph branches = new StepDependencyGraph(List.of(
                step("start", "left", "right"), step("right", "end"), step("left", "end"), step("end")));
        assertEquals(List.of("start", "left", "right", "end"), ids(branches.topologicalSort()));
    }

    @Test
    void testDiamondPutsJoinLast() throws CompilationException {
        StepDependencyGraph graph = new StepDependencyGraph(List.of(
                step("join"), step("top", "left", "right"), step("left", "join"), step("right", "join")));

        List<String> order = ids(graph.topologicalSort());

        assertEquals("top", order.get(0));
        assertEquals("join", order.get(3));
    }

    @Test
    void testUnknownSuccessorsAreIgnored() throws CompilationException {
        StepDependencyGraph graph = new StepDependencyGraph(List.of(step("a", "ghost"), step("b")));

        assertEquals(List.of("a", "b"), ids(graph.topologicalSort()));
        assertFalse(graph.hasCycles());
    }

    @Test
    void testCycleReportsRemainingSteps() {
        StepDependencyGraph graph = new StepDependencyGraph(List.of(step("entry", "x"), step("x", "y"), step("y", "x")));

        CompilationException exception = assertThrows(CompilationException.class, graph::topologicalSort);

        assertEquals(List.of("x", "y"), exception.getProblems());
        assertTrue(graph.hasCycles());
    }

    @Test
    void testSelfLoopIsCycle() {
        StepDependencyGraph graph = new StepDependencyGraph(List.of(step("a", "a")));

        assertTrue(graph.hasCycles());
    }

    @Test
    void testSuccessors() {
        StepDependencyGraph graph = new StepDependencyGraph();
        graph.addStep(step("a", "b", "c"));

        assertEquals(Set.of("b", "c"), graph.getSuccessors("a"));
        assertTrue(graph.getSuccessors("missing").isEmpty());
        assertThrows(NullPointerException.class, () -> graph.addStep(null));
    }
}

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

import java.util.*;

/**
 * Successor graph over the steps of a procedure, used to recover a valid execution
 * order for steps read back from a workflow graph.
 * <p>
 * Edges come from each step's {@code nextSteps}; references to unknown steps are ignored.
 * Declaration order is preserved so that sorting is deterministic.
 */
public class StepDependencyGraph {

    private final Map<String, Step> steps;
    private final Map<String, Set<String>> successors;

    public StepDependencyGraph() {
        this.steps = new LinkedHashMap<>();
        this.successors = new LinkedHashMap<>();
    }

    public StepDependencyGraph(List<Step> steps) {
        this();
        steps.forEach(this::addStep);
    }

    /**
     * Adds a step to the graph.
     *
     * @param step the step to add
     */
    public void addStep(Step step) {
        Objects.requireNonNull(step, "Step cannot be null");

        steps.put(step.getId(), step);
        successors.put(step.getId(), new LinkedHashSet<>(step.getNextSteps()));
    }

    /**
     * Gets the successors of a specific step.
     *
     * @param stepId the step ID
     * @return IDs of the steps reached from it
     */
    public Set<String> getSuccessors(String stepId) {
        return successors.getOrDefault(stepId, Set.of());
    }

    /**
     * Orders the steps so that every step comes after all of its predecessors, and
     * renumbers them 1..n in that order. Among steps that become ready together,
     * the one declared first wins.
     *
     * @return re-ordered copies of the steps
     * @throws CompilationException if the steps form a cycle
     */
    public List<Step> topologicalSort() throws CompilationException {
        // Kahn's algorithm
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new ArrayDeque<>();
        List<Step> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(steps.get(current).withOrder(result.size() + 1));

            for (String successor : getSuccessors(current)) {
                if (!inDegree.containsKey(successor)) {
                    continue;
                }
                int remaining = inDegree.get(successor) - 1;
                inDegree.put(successor, remaining);
                if (remaining == 0) {
                    queue.offer(successor);
                }
            }
        }

        if (result.size() != steps.size()) {
            Set<String> sorted = new HashSet<>();
            result.forEach(step -> sorted.add(step.getId()));
            List<String> remaining = new ArrayList<>();
            for (String stepId : steps.keySet()) {
                if (!sorted.contains(stepId)) {
                    remaining.add(stepId);
                }
            }
            throw new CompilationException(null, "Cycle detected among steps", remaining);
        }

        return result;
    }

    public boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (CompilationException e) {
            return true;
        }
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();

        for (String stepId : steps.keySet()) {
            inDegree.put(stepId, 0);
        }

        for (Set<String> targets : successors.values()) {
            for (String target : targets) {
                if (steps.containsKey(target)) {
                    inDegree.put(target, inDegree.get(target) + 1);
                }
            }
        }

        return inDegree;
    }

    @Override
    public String toString() {
        return "StepDependencyGraph{" +
               "steps=" + steps.keySet() +
               ", successors=" + successors +
               '}';
    }
}

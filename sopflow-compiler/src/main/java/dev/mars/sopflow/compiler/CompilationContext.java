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
import dev.mars.sopflow.graph.Position;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Mutable state of a single compile call: node ID counter, canvas occupancy and used
 * node names. A fresh context is created per call and never shared.
 *
 * <p>Layout: the trigger sits at {@code (xStart, yStart)}. Steps are placed left to right
 * at the cursor column, except targets of an already placed decision, which share the
 * column right after that decision. Within a column nodes stack downwards by the branch
 * offset.</p>
 */
class CompilationContext {

    private static final Pattern NAME_DISALLOWED = Pattern.compile("[^a-zA-Z0-9\\s_-]");

    private final int xStart;
    private final int xSpacing;
    private final int yStart;
    private final int branchOffset;

    private int nodeCounter;
    private int cursorX;
    private final Map<Integer, Integer> nodesPerColumn = new HashMap<>();
    private final Map<String, Integer> branchColumns = new HashMap<>();
    private final Set<String> usedNames = new HashSet<>();

    CompilationContext(SopflowConfiguration configuration) {
        this.xStart = configuration.getXStart();
        this.xSpacing = configuration.getXSpacing();
        this.yStart = configuration.getYStart();
        this.branchOffset = configuration.getBranchOffset();
        this.cursorX = xStart;
    }

    String nextNodeId() {
        nodeCounter++;
        return "node_" + nodeCounter;
    }

    /**
     * Position for the trigger node; advances the cursor past it.
     */
    Position placeTrigger() {
        return place(cursorX);
    }

    /**
     * Position for a step node. Uses the branch column when the step is the target of a
     * decision placed earlier.
     */
    Position placeStep(String stepId) {
        Integer branchColumn = branchColumns.get(stepId);
        return place(branchColumn != null ? branchColumn : cursorX);
    }

    /**
     * Records the targets of a placed decision so they share the column after it.
     * The first decision to claim a target wins.
     */
    void registerBranchTargets(Position decision, Iterable<String> targetIds) {
        int column = decision.getX() + xSpacing;
        for (String targetId : targetIds) {
            branchColumns.putIfAbsent(targetId, column);
        }
    }

    /**
     * Node name derived from a step title: disallowed characters removed, blank names
     * replaced by {@code fallback}, and a numeric suffix added on collision.
     */
    String uniqueName(String title, String fallback) {
        String base = title != null ? NAME_DISALLOWED.matcher(title).replaceAll("").trim() : "";
        if (base.isEmpty()) {
            base = fallback;
        }
        String name = base;
        int suffix = 2;
        while (!usedNames.add(name)) {
            name = base + " " + suffix++;
        }
        return name;
    }

    private Position place(int x) {
        int stacked = nodesPerColumn.merge(x, 1, Integer::sum) - 1;
        cursorX = Math.max(cursorX, x + xSpacing);
        return new Position(x, yStart + stacked * branchOffset);
    }
}

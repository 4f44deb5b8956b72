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

package dev.mars.sopflow.mapping;

import dev.mars.sopflow.core.ConditionOperator;
import dev.mars.sopflow.core.StepType;
import dev.mars.sopflow.core.TriggerType;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NodeTypeMapTest {

    @Test
    void testKnownActionTypes() {
        assertEquals(new NodeTypeRef("n8n-nodes-base.httpRequest", 4), NodeTypeMap.forAction("http_request"));
        assertEquals(new NodeTypeRef("n8n-nodes-base.emailSend", 2), NodeTypeMap.forAction("send_email"));
        assertEquals(new NodeTypeRef("n8n-nodes-base.splitInBatches", 3), NodeTypeMap.forAction("split"));
        assertEquals(new NodeTypeRef("n8n-nodes-base.respondToWebhook", 1), NodeTypeMap.forAction("webhook_response"));
    }

    @Test
    void testBlankActionTypeDefaultsToCode() {
        assertEquals(ActionNodeType.CODE.getNodeType(), NodeTypeMap.forAction(null));
        assertEquals(ActionNodeType.CODE.getNodeType(), NodeTypeMap.forAction("  "));
    }

    @Test
    void testUnknownActionTypeFallsBackToNoOp() {
        assertEquals(NodeTypeMap.NO_OP, NodeTypeMap.forAction("send_fax"));
    }

    @Test
    void testEveryActionMapsBothWays() {
        for (ActionNodeType type : ActionNodeType.values()) {
            NodeTypeRef node = NodeTypeMap.forAction(type.getActionType());
            assertEquals(Optional.of(type.getActionType()), NodeTypeMap.actionFor(node.type()));
            assertEquals(StepType.ACTION, NodeTypeMap.stepTypeFor(node.type()));
        }
    }

    @Test
    void testStructuralNodeTypes() {
        assertEquals(NodeTypeMap.IF, NodeTypeMap.forStep(StepType.DECISION, null));
        assertEquals(NodeTypeMap.EXECUTE_WORKFLOW, NodeTypeMap.forStep(StepType.SUBPROCESS, "code"));
        assertEquals(NodeTypeMap.WAIT, NodeTypeMap.forStep(StepType.WAIT, null));

        assertEquals(StepType.DECISION, NodeTypeMap.stepTypeFor("n8n-nodes-base.if"));
        assertEquals(StepType.SUBPROCESS, NodeTypeMap.stepTypeFor("n8n-nodes-base.executeWorkflow"));
        assertEquals(StepType.WAIT, NodeTypeMap.stepTypeFor("n8n-nodes-base.wait"));
        assertEquals(StepType.ACTION, NodeTypeMap.stepTypeFor("n8n-nodes-base.googleSheets"));
        assertTrue(NodeTypeMap.actionFor("n8n-nodes-base.googleSheets").isEmpty());
    }

    @Test
    void testTriggerRecognition() {
        assertTrue(NodeTypeMap.isTriggerNode("n8n-nodes-base.manualTrigger"));
        assertTrue(NodeTypeMap.isTriggerNode("n8n-nodes-base.webhook"));
        assertTrue(NodeTypeMap.isTriggerNode("n8n-nodes-base.cronTrigger"));
        assertTrue(NodeTypeMap.isTriggerNode("n8n-nodes-base.githubTrigger"));
        assertFalse(NodeTypeMap.isTriggerNode("n8n-nodes-base.httpRequest"));
        assertFalse(NodeTypeMap.isTriggerNode(null));
    }

    @Test
    void testTriggerTypeReverseMapping() {
        assertEquals(TriggerType.SCHEDULE, NodeTypeMap.triggerTypeFor("n8n-nodes-base.scheduleTrigger"));
        assertEquals(TriggerType.SCHEDULE, NodeTypeMap.triggerTypeFor("n8n-nodes-base.cronTrigger"));
        assertEquals(TriggerType.WEBHOOK, NodeTypeMap.triggerTypeFor("n8n-nodes-base.webhook"));
        assertEquals(TriggerType.EVENT, NodeTypeMap.triggerTypeFor("n8n-nodes-base.n8nTrigger"));
        assertEquals(TriggerType.MANUAL, NodeTypeMap.triggerTypeFor("n8n-nodes-base.githubTrigger"));
    }

    @Test
    void testTriggerNodeTypes() {
        TriggerNodeType schedule = TriggerNodeType.forTrigger(TriggerType.SCHEDULE);

        assertEquals("n8n-nodes-base.scheduleTrigger", schedule.getNodeType().type());
        assertEquals("Schedule Trigger", schedule.getNodeName());
        assertEquals(2, TriggerNodeType.forTrigger(TriggerType.WEBHOOK).getNodeType().typeVersion());
        for (TriggerNodeType type : TriggerNodeType.values()) {
            assertEquals(type.getTriggerType(), NodeTypeMap.triggerTypeFor(type.getNodeType().type()));
        }
    }

    @Test
    void testDescriptions() {
        assertEquals("Makes an HTTP request", NodeTypeMap.describe("n8n-nodes-base.httpRequest"));
        assertEquals("Evaluates a condition", NodeTypeMap.describe("n8n-nodes-base.if"));
        assertEquals("Waits for a specified duration", NodeTypeMap.describe("n8n-nodes-base.wait"));
        assertEquals("Executes another workflow", NodeTypeMap.describe("n8n-nodes-base.executeWorkflow"));
        assertEquals("Executes n8n-nodes-base.googleSheets", NodeTypeMap.describe("n8n-nodes-base.googleSheets"));
    }

    @Test
    void testOperatorMapping() {
        assertEquals("equals", NodeTypeMap.operationFor(ConditionOperator.EQUALS));
        assertEquals("gt", NodeTypeMap.operationFor(ConditionOperator.GREATER));
        assertEquals("lt", NodeTypeMap.operationFor(ConditionOperator.LESS));

        for (ConditionOperator operator : ConditionOperator.values()) {
            assertEquals(Optional.of(operator), NodeTypeMap.operatorFor(NodeTypeMap.operationFor(operator)));
        }
        assertEquals(Optional.of(ConditionOperator.EQUALS), NodeTypeMap.operatorFor("equal"));
        assertEquals(Optional.of(ConditionOperator.GREATER), NodeTypeMap.operatorFor("larger"));
        assertEquals(Optional.of(ConditionOperator.LESS), NodeTypeMap.operatorFor("smaller"));
        assertTrue(NodeTypeMap.operatorFor("regex").isEmpty());
    }
}

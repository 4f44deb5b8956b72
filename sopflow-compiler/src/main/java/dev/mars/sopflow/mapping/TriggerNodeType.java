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

import dev.mars.sopflow.core.TriggerType;

/**
 * Engine node types used to start a workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public enum TriggerNodeType {

    /**
     * Started by hand from the engine UI or API.
     */
    MANUAL(TriggerType.MANUAL, "n8n-nodes-base.manualTrigger", 1),

    /**
     * Started on a cron or interval schedule.
     */
    SCHEDULE(TriggerType.SCHEDULE, "n8n-nodes-base.scheduleTrigger", 1),

    /**
     * Started by an inbound HTTP call.
     */
    WEBHOOK(TriggerType.WEBHOOK, "n8n-nodes-base.webhook", 2),

    /**
     * Started by an engine-internal event such as activation or update.
     */
    EVENT(TriggerType.EVENT, "n8n-nodes-base.n8nTrigger", 1);

    /**
     * Legacy cron node, recognised on read only.
     */
    public static final String LEGACY_CRON_TRIGGER = "n8n-nodes-base.cronTrigger";

    private final TriggerType triggerType;
    private final NodeTypeRef nodeType;

    TriggerNodeType(TriggerType triggerType, String nodeType, int typeVersion) {
        this.triggerType = triggerType;
        this.nodeType = new NodeTypeRef(nodeType, typeVersion);
    }

    public TriggerType getTriggerType() {
        return triggerType;
    }

    public NodeTypeRef getNodeType() {
        return nodeType;
    }

    /**
     * @return node name for the trigger, e.g. {@code Schedule Trigger}
     */
    public String getNodeName() {
        String value = triggerType.getValue();
        return Character.toUpperCase(value.charAt(0)) + value.substring(1) + " Trigger";
    }

    public static TriggerNodeType forTrigger(TriggerType triggerType) {
        return switch (triggerType) {
            case MANUAL -> MANUAL;
            case SCHEDULE -> SCHEDULE;
            case WEBHOOK -> WEBHOOK;
            case EVENT -> EVENT;
        };
    }
}

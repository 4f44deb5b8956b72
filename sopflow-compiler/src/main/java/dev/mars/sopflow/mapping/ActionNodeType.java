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

import java.util.Optional;

/**
 * Closed table of action kinds a procedure step may name through {@code actionType},
 * each paired with the engine node that implements it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-18
 */
public enum ActionNodeType {

    HTTP_REQUEST("http_request", "n8n-nodes-base.httpRequest", 4, "Makes an HTTP request"),
    SEND_EMAIL("send_email", "n8n-nodes-base.emailSend", 2, "Sends an email"),
    SLACK_MESSAGE("slack_message", "n8n-nodes-base.slack", 2, "Sends a Slack message"),
    SET_VARIABLE("set_variable", "n8n-nodes-base.set", 3, "Sets variables"),
    CODE("code", "n8n-nodes-base.code", 2, "Executes custom code"),
    FILTER("filter", "n8n-nodes-base.filter", 2, "Filters items"),
    MERGE("merge", "n8n-nodes-base.merge", 3, "Merges data from multiple inputs"),
    SPLIT("split", "n8n-nodes-base.splitInBatches", 3, "Splits items into batches"),
    FUNCTION("function", "n8n-nodes-base.function", 2, "Runs a function"),
    WEBHOOK_RESPONSE("webhook_response", "n8n-nodes-base.respondToWebhook", 1, "Responds to a webhook call");

    private final String actionType;
    private final NodeTypeRef nodeType;
    private final String description;

    ActionNodeType(String actionType, String nodeType, int typeVersion, String description) {
        this.actionType = actionType;
        this.nodeType = new NodeTypeRef(nodeType, typeVersion);
        this.description = description;
    }

    public String getActionType() {
        return actionType;
    }

    public NodeTypeRef getNodeType() {
        return nodeType;
    }

    /**
     * @return generic description used for nodes of this type that carry no notes
     */
    public String getDescription() {
        return description;
    }

    public static Optional<ActionNodeType> fromActionType(String actionType) {
        if (actionType == null) {
            return Optional.empty();
        }
        String normalized = actionType.trim();
        for (ActionNodeType type : values()) {
            if (type.actionType.equalsIgnoreCase(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<ActionNodeType> fromNodeType(String nodeType) {
        if (nodeType == null) {
            return Optional.empty();
        }
        for (ActionNodeType type : values()) {
            if (type.nodeType.type().equals(nodeType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return actionType;
    }
}

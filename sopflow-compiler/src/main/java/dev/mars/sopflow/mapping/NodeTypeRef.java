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

import java.util.Objects;

/**
 * An engine node type identifier together with the type version the compiler emits for it.
 *
 * @param type        engine node type, for example {@code n8n-nodes-base.httpRequest}
 * @param typeVersion engine type version
 */
public record NodeTypeRef(String type, int typeVersion) {

    public NodeTypeRef {
        Objects.requireNonNull(type, "Node type cannot be null");
    }
}

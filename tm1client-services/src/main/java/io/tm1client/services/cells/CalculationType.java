package io.tm1client.services.cells;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.util.Locale;

/// How the server derived a traced cell's value. Servers send either the ordinal or the name.
public enum CalculationType {
    SIMPLE,
    CONSOLIDATION,
    RULE;

    static CalculationType of(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return SIMPLE;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            int ordinal = primitive.getAsInt();
            if (ordinal < 0 || ordinal >= values().length) {
                throw new IllegalArgumentException("invalid calculation type: " + ordinal);
            }
            return values()[ordinal];
        }
        return valueOf(primitive.getAsString().trim().toUpperCase(Locale.ROOT));
    }
}

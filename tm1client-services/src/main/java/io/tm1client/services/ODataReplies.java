package io.tm1client.services;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.tm1client.rest.SHARED;

import java.util.ArrayList;
import java.util.List;

/// Reads the `value` array of an OData collection reply.
public final class ODataReplies {

    private ODataReplies() {
    }

    /// @return the `value` entries, empty when the reply is null or has none
    public static JsonArray entries(JsonObject reply) {
        if (reply == null || !reply.has("value") || !reply.get("value").isJsonArray()) {
            return new JsonArray();
        }
        return reply.getAsJsonArray("value");
    }

    public static <T> List<T> values(JsonObject reply, Class<T> type) {
        List<T> values = new ArrayList<>();
        for (JsonElement entry : entries(reply)) {
            values.add(SHARED.gson.fromJson(entry, type));
        }
        return values;
    }

    /// @return the `Name` of every entry
    public static List<String> names(JsonObject reply) {
        List<String> names = new ArrayList<>();
        for (JsonElement entry : entries(reply)) {
            JsonElement name = entry.getAsJsonObject().get("Name");
            if (name != null && !name.isJsonNull()) {
                names.add(name.getAsString());
            }
        }
        return names;
    }
}

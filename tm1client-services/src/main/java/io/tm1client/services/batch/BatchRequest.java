package io.tm1client.services.batch;

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
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/// One sub-request of a JSON `$batch` call.
///
/// @param id unique within the batch; responses are matched back by it
/// @param method the HTTP method
/// @param url the endpoint, relative to the service root; normalized before sending
/// @param headers sub-request headers, may be null
/// @param body the JSON body, may be null
/// @param dependsOn ids that must complete first, may be null
public record BatchRequest(
    @SerializedName("id") String id,
    @SerializedName("method") String method,
    @SerializedName("url") String url,
    @SerializedName("headers") Map<String, String> headers,
    @SerializedName("body") JsonElement body,
    @SerializedName("dependsOn") List<String> dependsOn
) {

    public static final Map<String, String> JSON_HEADERS = Map.of("Content-Type", "application/json");

    public static BatchRequest of(String id, String method, String url, JsonElement body) {
        return new BatchRequest(id, method, url, body == null ? null : JSON_HEADERS, body, null);
    }

    public BatchRequest withUrl(String newUrl) {
        return new BatchRequest(id, method, newUrl, headers, body, dependsOn);
    }
}

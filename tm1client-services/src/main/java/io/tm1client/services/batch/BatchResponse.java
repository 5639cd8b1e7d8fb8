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

import java.util.Map;

/// One sub-response of a JSON `$batch` call.
public record BatchResponse(
    @SerializedName("id") String id,
    @SerializedName("status") int status,
    @SerializedName("headers") Map<String, String> headers,
    @SerializedName("body") JsonElement body
) {

    public BatchResponse {
        headers = headers == null ? Map.of() : headers;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 400;
    }

    /// @return the body as text, empty when there is none
    public String bodyText() {
        if (body == null || body.isJsonNull()) {
            return "";
        }
        return body.isJsonPrimitive() ? body.getAsString() : body.toString();
    }
}

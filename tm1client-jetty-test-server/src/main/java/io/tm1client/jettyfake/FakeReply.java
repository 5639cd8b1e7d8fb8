package io.tm1client.jettyfake;

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

import java.util.LinkedHashMap;
import java.util.Map;

/// A scripted reply served by [FakeTm1Server].
///
/// @param status the HTTP status code
/// @param headers response headers, in insertion order
/// @param body the response body, may be empty
public record FakeReply(int status, Map<String, String> headers, String body) {

    public FakeReply {
        headers = new LinkedHashMap<>(headers);
        body = body == null ? "" : body;
    }

    public static FakeReply status(int status) {
        return new FakeReply(status, Map.of(), "");
    }

    public static FakeReply json(String body) {
        return json(200, body);
    }

    public static FakeReply json(int status, String body) {
        return new FakeReply(status, Map.of("Content-Type", "application/json"), body);
    }

    public static FakeReply text(String body) {
        return new FakeReply(200, Map.of("Content-Type", "text/plain"), body);
    }

    public FakeReply withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new FakeReply(status, copy, body);
    }
}

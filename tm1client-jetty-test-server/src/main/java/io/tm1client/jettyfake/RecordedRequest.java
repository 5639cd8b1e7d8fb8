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

import java.util.List;
import java.util.Locale;
import java.util.Map;

/// One request as seen by the fake server.
///
/// The path is percent-decoded and has the API root (for example `/api/v1`) removed when it
/// was present, so tests can assert on `/Chores('Nightly')` rather than on the full URL.
/// Header names are stored in lower case.
///
/// @param method the HTTP method, upper case
/// @param path the decoded path relative to the API root
/// @param query the decoded query string, or null when the request had none
/// @param headers request headers keyed by lower-case name
/// @param body the request body as UTF-8 text, empty when there was none
public record RecordedRequest(
    String method,
    String path,
    String query,
    Map<String, List<String>> headers,
    String body
) {

    /// @return `path` followed by `?query` when a query was sent
    public String target() {
        return query == null ? path : path + "?" + query;
    }

    /// @return the first value of the named header, or null
    public String header(String name) {
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    /// @return a compact `METHOD path` line, used for request traces
    public String traceLine() {
        return method + " " + path;
    }

    @Override
    public String toString() {
        return method + " " + target();
    }
}

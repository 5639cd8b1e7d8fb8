package io.tm1client.rest.odata;

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

/// Routes a request into a sandbox with the `!sandbox=` query parameter.
public final class SandboxRouting {

    public static final String SANDBOX_PARAMETER = "!sandbox";

    private SandboxRouting() {
    }

    /// Appends `!sandbox={encoded name}` to the endpoint. Any `!sandbox` parameter already present
    /// is replaced, other parameters are kept in order. A null or empty sandbox leaves the
    /// endpoint unchanged.
    public static String withSandbox(String endpoint, String sandbox) {
        if (sandbox == null || sandbox.isEmpty()) {
            return endpoint;
        }
        String routed = withoutSandbox(endpoint);
        String separator = routed.contains("?") ? "&" : "?";
        return routed + separator + SANDBOX_PARAMETER + "=" + ODataUrls.encode(sandbox);
    }

    static String withoutSandbox(String endpoint) {
        int q = endpoint.indexOf('?');
        if (q < 0) {
            return endpoint;
        }
        StringBuilder kept = new StringBuilder();
        for (String parameter : endpoint.substring(q + 1).split("&")) {
            if (parameter.isEmpty() || parameter.startsWith(SANDBOX_PARAMETER + "=")) {
                continue;
            }
            kept.append(kept.length() == 0 ? "" : "&").append(parameter);
        }
        String path = endpoint.substring(0, q);
        return kept.length() == 0 ? path : path + "?" + kept;
    }
}

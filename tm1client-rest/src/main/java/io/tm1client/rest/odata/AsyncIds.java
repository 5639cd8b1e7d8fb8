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

import java.util.Optional;

/// Addressing for the `/_async('<id>')` resource.
public final class AsyncIds {

    private AsyncIds() {
    }

    /// Extracts the ID from a `Location` header such as `/api/v1/_async('abc123')`.
    public static Optional<String> fromLocation(String location) {
        if (location == null) {
            return Optional.empty();
        }
        int start = location.lastIndexOf("('");
        if (start < 0) {
            return Optional.empty();
        }
        int end = location.indexOf("')", start + 2);
        if (end < 0) {
            return Optional.empty();
        }
        String id = location.substring(start + 2, end);
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }

    public static String endpoint(String asyncId) {
        return ODataUrls.format("/_async('{}')", asyncId);
    }
}

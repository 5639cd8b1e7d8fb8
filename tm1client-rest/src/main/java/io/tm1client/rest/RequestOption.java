package io.tm1client.rest;

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

import java.time.Duration;
import java.util.Map;

/// Per-request adjustment, applied in order after default headers and credentials.
@FunctionalInterface
public interface RequestOption {

    void apply(PreparedRequest request);

    static RequestOption header(String name, String value) {
        return request -> request.header(name, value);
    }

    static RequestOption query(String name, String value) {
        return request -> request.addQueryParameter(name, value);
    }

    static RequestOption queryValues(Map<String, String> values) {
        return request -> values.forEach(request::addQueryParameter);
    }

    static RequestOption async() {
        return PreparedRequest::async;
    }

    static RequestOption synchronous() {
        return PreparedRequest::synchronous;
    }

    static RequestOption cancellation(CancellationHandle handle) {
        return request -> request.cancellation(handle);
    }

    /// Overrides the configured timeout for this request, including async polling.
    static RequestOption timeout(Duration timeout) {
        return request -> request.timeout(timeout);
    }
}

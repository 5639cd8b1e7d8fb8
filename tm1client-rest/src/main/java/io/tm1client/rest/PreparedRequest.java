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

import okhttp3.HttpUrl;
import okhttp3.Request;

import java.time.Duration;

/// A request under construction, as seen by [RequestOption]s.
///
/// Default headers and credentials are already applied when options run, so an option that
/// sets a header overrides both.
public final class PreparedRequest {

    private final Request.Builder builder;
    private final HttpUrl.Builder url;
    private boolean async;
    private boolean synchronous;
    private CancellationHandle cancellation;
    private Duration timeout;

    PreparedRequest(Request.Builder builder, HttpUrl url) {
        this.builder = builder;
        this.url = url.newBuilder();
    }

    public PreparedRequest header(String name, String value) {
        builder.header(name, value);
        return this;
    }

    public PreparedRequest removeHeader(String name) {
        builder.removeHeader(name);
        return this;
    }

    public PreparedRequest addQueryParameter(String name, String value) {
        url.addQueryParameter(name, value);
        return this;
    }

    public PreparedRequest setQueryParameter(String name, String value) {
        url.setQueryParameter(name, value);
        return this;
    }

    /// Sends this request through the async protocol even when async mode is off.
    public PreparedRequest async() {
        this.async = true;
        return this;
    }

    /// Sends this request synchronously even when async mode is on.
    public PreparedRequest synchronous() {
        this.synchronous = true;
        return this;
    }

    public PreparedRequest cancellation(CancellationHandle cancellation) {
        this.cancellation = cancellation;
        return this;
    }

    public PreparedRequest timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    boolean isAsync(boolean asyncMode) {
        return !synchronous && (async || asyncMode);
    }

    CancellationHandle cancellation() {
        return cancellation;
    }

    /// @return the per-request timeout, or `fallback` when none was set
    Duration timeoutOr(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    Request build() {
        return builder.url(url.build()).build();
    }
}

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

import io.tm1client.rest.auth.AuthProvider;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/// The mutable target of [RestOption]s. Read once by [RestService] during construction.
public final class RestSettings {

    private AuthProvider authProvider;
    private Logger logger;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String version;
    private AsyncPollSchedule pollSchedule = AsyncPollSchedule.DEFAULT;

    RestSettings() {
    }

    public RestSettings authProvider(AuthProvider authProvider) {
        this.authProvider = authProvider;
        return this;
    }

    public RestSettings logger(Logger logger) {
        this.logger = logger;
        return this;
    }

    public RestSettings header(String name, String value) {
        this.headers.put(name, value);
        return this;
    }

    public RestSettings version(String version) {
        this.version = version;
        return this;
    }

    public RestSettings pollSchedule(AsyncPollSchedule pollSchedule) {
        this.pollSchedule = pollSchedule;
        return this;
    }

    AuthProvider authProvider() {
        return authProvider;
    }

    Logger logger() {
        return logger;
    }

    Map<String, String> headers() {
        return headers;
    }

    String version() {
        return version;
    }

    AsyncPollSchedule pollSchedule() {
        return pollSchedule;
    }
}

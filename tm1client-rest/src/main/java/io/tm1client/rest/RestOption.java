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

import java.util.Map;

/// Client-level adjustment applied once while a [RestService] is constructed.
@FunctionalInterface
public interface RestOption {

    void apply(RestSettings settings);

    /// Replaces the provider the configuration would select.
    static RestOption authProvider(AuthProvider provider) {
        return settings -> settings.authProvider(provider);
    }

    static RestOption logger(Logger logger) {
        return settings -> settings.logger(logger);
    }

    static RestOption header(String name, String value) {
        return settings -> settings.header(name, value);
    }

    static RestOption headers(Map<String, String> headers) {
        return settings -> headers.forEach(settings::header);
    }

    /// Pins the server version instead of reading it on first use.
    static RestOption version(String version) {
        return settings -> settings.version(version);
    }

    static RestOption pollSchedule(AsyncPollSchedule schedule) {
        return settings -> settings.pollSchedule(schedule);
    }
}

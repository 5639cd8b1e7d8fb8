package io.tm1client.services;

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

import io.tm1client.jettyfake.FakeTm1Server;
import io.tm1client.rest.RestOption;
import io.tm1client.rest.RestService;
import io.tm1client.rest.config.Tm1Config;

/// Transports pointed at the shared fake server, with the session kept open so that closing
/// them adds nothing to the request trace.
public final class FakeServerConnections {

    public static final String V11 = "11.8.02500.3";
    public static final String V12 = "12.0.1";

    private FakeServerConnections() {
    }

    public static Tm1Config.Builder config(FakeTm1Server server) {
        return Tm1Config.builder().baseUrl(server.getApiUrl()).user("admin").password("apple").keepAlive(true);
    }

    /// @param version the pinned server version, so no version request shows up in traces
    public static RestService rest(FakeTm1Server server, String version) {
        return new RestService(config(server).build(), RestOption.version(version));
    }
}

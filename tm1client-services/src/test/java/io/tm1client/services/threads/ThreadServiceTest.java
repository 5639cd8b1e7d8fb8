package io.tm1client.services.threads;

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

import io.tm1client.jettyfake.FakeReply;
import io.tm1client.jettyfake.FakeTm1Server;
import io.tm1client.jettyfake.FakeTm1ServerExtension;
import io.tm1client.rest.errors.Tm1VersionUnsupportedException;
import io.tm1client.services.Tm1Service;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static io.tm1client.services.FakeServerConnections.V11;
import static io.tm1client.services.FakeServerConnections.V12;
import static io.tm1client.services.FakeServerConnections.rest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(FakeTm1ServerExtension.class)
public class ThreadServiceTest {

    @Test
    public void testThreadsAreGoneInVersion12() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        try (Tm1Service tm1 = new Tm1Service(rest(server, V12))) {
            assertThatThrownBy(() -> tm1.threads().getAll()).isInstanceOf(Tm1VersionUnsupportedException.class);
            assertThatThrownBy(() -> tm1.threads().cancel(7)).isInstanceOf(Tm1VersionUnsupportedException.class);
        }
        assertThat(server.trace()).isEmpty();
    }

    @Test
    public void testActiveFilter() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/Threads", FakeReply.json("{\"value\":[{\"ID\":12,\"State\":\"Run\"}]}"));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertEquals(1, tm1.threads().getActive().size());
        }
        assertEquals("$filter=" + ThreadService.ACTIVE_FILTER, server.requests().get(0).query());
    }

    @Test
    public void testCancelAllRunningSkipsIdleSystemAndOwnThreads() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/Threads", FakeReply.json("{\"value\":["
            + "{\"ID\":1,\"Type\":\"User\",\"Name\":\"jane\",\"State\":\"Idle\",\"Function\":\"\"},"
            + "{\"ID\":2,\"Type\":\"System\",\"Name\":\"Sys\",\"State\":\"Run\",\"Function\":\"\"},"
            + "{\"ID\":3,\"Type\":\"User\",\"Name\":\"Pseudo\",\"State\":\"Run\",\"Function\":\"\"},"
            + "{\"ID\":4,\"Type\":\"User\",\"Name\":\"admin\",\"State\":\"Run\",\"Function\":\"GET /api/v1/Threads\"},"
            + "{\"ID\":5,\"Type\":\"User\",\"Name\":\"jane\",\"State\":\"Run\",\"Function\":\"POST /api/v1/ExecuteMDX\"}]}"));
        server.on("POST", "/Threads('5')/tm1.CancelOperation", FakeReply.status(204));

        List<?> cancelled;
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            cancelled = tm1.threads().cancelAllRunning();
        }

        assertEquals(1, cancelled.size());
        assertEquals(List.of("GET /Threads", "POST /Threads('5')/tm1.CancelOperation"), server.trace());
    }
}

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

import io.tm1client.jettyfake.FakeReply;
import io.tm1client.jettyfake.FakeTm1Server;
import io.tm1client.jettyfake.FakeTm1ServerExtension;
import io.tm1client.services.security.ActiveUser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static io.tm1client.services.FakeServerConnections.config;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(FakeTm1ServerExtension.class)
public class Tm1ServiceTest {

    @Test
    public void testConnectSendsNothingUntilUsed() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/Configuration/ProductVersion/$value", FakeReply.text("12.0.1"));
        server.on("GET", "/ActiveUser", FakeReply.json("{\"Name\":\"admin\",\"Type\":\"Admin\"}"));

        try (Tm1Service tm1 = Tm1Service.connect(config(server).build())) {
            assertThat(server.trace()).isEmpty();
            assertEquals("12.0.1", tm1.version());
            assertEquals("12.0.1", tm1.version());
            ActiveUser user = tm1.whoAmI();
            assertEquals("admin", user.name());
            assertTrue(user.hasAdminPrivilege());
        }

        assertEquals(List.of("GET /Configuration/ProductVersion/$value", "GET /ActiveUser"), server.trace());
    }

    @Test
    public void testMetadataAsksForXml() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/$metadata", FakeReply.text("<edmx:Edmx Version=\"4.0\"/>"));

        try (Tm1Service tm1 = Tm1Service.connect(config(server).build())) {
            assertEquals("<edmx:Edmx Version=\"4.0\"/>", tm1.metadata());
        }

        assertEquals("application/xml", server.requests("GET", "/$metadata").get(0).header("Accept"));
    }
}
